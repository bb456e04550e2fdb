package io.troupe.core.compose;

import io.troupe.core.agent.AgentSpec;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Agents composed for one response, in rule order, with the rules that produced nothing.
 *
 * @param specs composed agents, never null
 * @param stats rule counts of this composition, not null
 * @param skipped skipped rules with reasons, never null
 */
public record CompositionResult(
        List<AgentSpec> specs, CompositionStats stats, List<SkippedRule> skipped) {

    public CompositionResult {
        specs = specs != null ? List.copyOf(specs) : List.of();
        Objects.requireNonNull(stats, "stats must not be null");
        skipped = skipped != null ? List.copyOf(skipped) : List.of();
    }

    public boolean isEmpty() {
        return specs.isEmpty();
    }

    public Optional<AgentSpec> specFor(String role) {
        return specs.stream().filter(s -> s.getRole().equals(role)).findFirst();
    }
}
