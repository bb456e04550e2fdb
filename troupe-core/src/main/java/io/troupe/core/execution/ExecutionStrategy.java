package io.troupe.core.execution;

import java.util.Optional;

/**
 * Concurrency pattern for running a plan's agents.
 *
 * <p>Strategies never embed analysis logic: every agent runs through the {@link AgentExecutor},
 * which delegates routing to the tier router and work to the agent runtime.
 *
 * @see ParallelStrategy
 * @see SequentialStrategy
 * @see RefinementStrategy
 */
public interface ExecutionStrategy {

    StrategyType type();

    /**
     * Checks that a plan fits this strategy.
     *
     * @param plan plan to check, not null
     * @return problem description, or empty when the plan is acceptable
     */
    default Optional<String> validate(ExecutionPlan plan) {
        return Optional.empty();
    }

    /**
     * Runs the plan until every agent has settled.
     *
     * @param plan validated plan, not null
     * @param context execution resources, not null
     * @return one result per spec, never null
     */
    StrategyResult execute(ExecutionPlan plan, StrategyContext context);
}
