package io.troupe.core.execution;

/**
 * Point-in-time progress of one execution, as polled by presentation consumers.
 *
 * @param executionId execution id
 * @param stage current stage name, e.g. {@code "executing"}
 * @param agentsTotal agents in the plan
 * @param agentsSettled agents with a final result
 * @param percentComplete 0-100
 * @param runningCost cost of every attempt logged so far, in USD
 */
public record ProgressSnapshot(
        String executionId,
        String stage,
        int agentsTotal,
        int agentsSettled,
        double percentComplete,
        double runningCost) {}
