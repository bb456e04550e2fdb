package io.troupe.core.execution;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Settled results of an execution plan, one per spec in plan order.
 *
 * @param planId plan id, not null
 * @param strategy strategy used, not null
 * @param status completion state, not null
 * @param results agent results in plan order, never null
 * @param rounds refinement rounds used; 1 for the other strategies, 0 for an empty plan
 * @param startedAt start time, not null
 * @param completedAt completion time, not null
 */
public record ExecutionOutcome(
        String planId,
        StrategyType strategy,
        PlanStatus status,
        List<AgentResult> results,
        int rounds,
        Instant startedAt,
        Instant completedAt) {

    public ExecutionOutcome {
        Objects.requireNonNull(planId, "planId must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        Objects.requireNonNull(status, "status must not be null");
        results = results != null ? List.copyOf(results) : List.of();
    }

    public Optional<AgentResult> resultFor(String role) {
        return results.stream().filter(r -> r.role().equals(role)).findFirst();
    }

    public long successCount() {
        return results.stream().filter(AgentResult::isSuccess).count();
    }

    public double totalCost() {
        return results.stream().mapToDouble(AgentResult::totalCost).sum();
    }

    /** Every attempt of every agent, grouped by agent in plan order. */
    public List<TierAttempt> allAttempts() {
        return results.stream().flatMap(r -> r.attempts().stream()).toList();
    }

    public Duration elapsed() {
        return Duration.between(startedAt, completedAt);
    }
}
