package io.troupe.core.execution;

import io.troupe.core.agent.AgentSpec;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Agents to run, the strategy to run them with, and the context they start from.
 *
 * <p>Read-only for presentation consumers. Spec order is significant for the sequential and
 * refinement strategies and is preserved in the outcome for every strategy.
 *
 * @implNote Immutable. Create instances via {@link #builder()}.
 */
public final class ExecutionPlan {

    private final String planId;
    private final List<AgentSpec> specs;
    private final StrategyType strategy;
    private final Map<String, Object> initialContext;

    private ExecutionPlan(Builder builder) {
        this.planId =
                builder.planId != null
                        ? builder.planId
                        : "plan-" + UUID.randomUUID().toString().substring(0, 12);
        this.specs = List.copyOf(builder.specs);
        this.strategy = Objects.requireNonNull(builder.strategy, "Strategy required");
        this.initialContext =
                Collections.unmodifiableMap(new LinkedHashMap<>(builder.initialContext));
    }

    public String getPlanId() {
        return planId;
    }

    public List<AgentSpec> getSpecs() {
        return specs;
    }

    public StrategyType getStrategy() {
        return strategy;
    }

    public Map<String, Object> getInitialContext() {
        return initialContext;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String planId;
        private List<AgentSpec> specs = List.of();
        private StrategyType strategy = StrategyType.PARALLEL;
        private Map<String, Object> initialContext = Map.of();

        private Builder() {}

        public Builder planId(String planId) {
            this.planId = planId;
            return this;
        }

        public Builder specs(List<AgentSpec> specs) {
            this.specs = specs != null ? specs : List.of();
            return this;
        }

        public Builder strategy(StrategyType strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder initialContext(Map<String, Object> initialContext) {
            this.initialContext = initialContext != null ? initialContext : Map.of();
            return this;
        }

        public ExecutionPlan build() {
            return new ExecutionPlan(this);
        }
    }
}
