package io.troupe.core.compose;

import io.troupe.core.agent.AgentSpec;
import io.troupe.core.routing.TierStrategy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Helpers for inspecting composed agents before they run. */
public final class AgentPlanning {

    /** Default estimate per agent by strategy, in USD. */
    public static final Map<TierStrategy, Double> DEFAULT_STRATEGY_COSTS =
            Collections.unmodifiableMap(
                    new EnumMap<>(
                            Map.of(
                                    TierStrategy.CHEAP_ONLY, 0.05,
                                    TierStrategy.CAPABLE_FIRST, 0.15,
                                    TierStrategy.PROGRESSIVE, 0.25)));

    private AgentPlanning() {}

    /**
     * Groups agents by tier strategy, keeping input order within each group. Strategies with no
     * agent are absent.
     */
    public static Map<TierStrategy, List<AgentSpec>> groupByTierStrategy(List<AgentSpec> specs) {
        Map<TierStrategy, List<AgentSpec>> grouped = new EnumMap<>(TierStrategy.class);
        for (AgentSpec spec : specs) {
            grouped.computeIfAbsent(spec.getTierStrategy(), k -> new ArrayList<>()).add(spec);
        }
        return grouped;
    }

    public static CostEstimate estimateCosts(List<AgentSpec> specs) {
        return estimateCosts(specs, DEFAULT_STRATEGY_COSTS);
    }

    /**
     * Estimates the cost of running the agents.
     *
     * @param specs agents, not null
     * @param costPerStrategy cost per agent by strategy; missing strategies fall back to {@link
     *     #DEFAULT_STRATEGY_COSTS}
     * @return estimate, never null
     */
    public static CostEstimate estimateCosts(
            List<AgentSpec> specs, Map<TierStrategy, Double> costPerStrategy) {
        Map<TierStrategy, Double> byStrategy = new EnumMap<>(TierStrategy.class);
        double total = 0.0;
        for (AgentSpec spec : specs) {
            TierStrategy strategy = spec.getTierStrategy();
            double cost =
                    costPerStrategy.getOrDefault(strategy, DEFAULT_STRATEGY_COSTS.get(strategy));
            byStrategy.merge(strategy, cost, Double::sum);
            total += cost;
        }
        return new CostEstimate(total, byStrategy, specs.size());
    }

    /**
     * Lists dependencies that no agent in the set provides.
     *
     * @param specs agents, not null
     * @return one warning per missing dependency, empty when all are met
     */
    public static List<String> validateDependencies(List<AgentSpec> specs) {
        Set<String> roles = new HashSet<>();
        for (AgentSpec spec : specs) {
            roles.add(spec.getRole());
        }
        List<String> warnings = new ArrayList<>();
        for (AgentSpec spec : specs) {
            for (String dependency : spec.getDependsOn()) {
                if (!roles.contains(dependency)) {
                    warnings.add(
                            "Agent '"
                                    + spec.getRole()
                                    + "' depends on '"
                                    + dependency
                                    + "', which is not in the plan");
                }
            }
        }
        return warnings;
    }
}
