package io.troupe.core.execution;

import io.troupe.core.agent.AgentSpec;
import io.troupe.core.routing.CircuitTransition;

/**
 * Listener for execution lifecycle events.
 *
 * <p>All methods have default no-op implementations, so listeners override only the events
 * they care about.
 *
 * <h2>Callback order per agent</h2>
 *
 * <pre>
 * onAgentStart(spec)
 * onAttempt(spec, attempt)           one per tier attempt, short-circuits included
 * onCircuitTransition(transition)    whenever an attempt changed a breaker's state
 * onAgentComplete(spec, result)
 * </pre>
 *
 * Skipped agents only receive {@code onAgentComplete}. A refinement producer completes once per
 * round. {@code onProgress} follows agent completions when a {@link ProgressTracker} is
 * attached.
 *
 * @implNote Implementations must be thread-safe: the parallel strategy calls them from several
 *     worker threads at once.
 */
public interface ExecutionListener {

    ExecutionListener NOOP = new ExecutionListener() {};

    default void onPlanStart(ExecutionPlan plan) {}

    default void onAgentStart(AgentSpec spec) {}

    default void onAttempt(AgentSpec spec, TierAttempt attempt) {}

    default void onCircuitTransition(CircuitTransition transition) {}

    default void onAgentComplete(AgentSpec spec, AgentResult result) {}

    default void onPlanComplete(ExecutionOutcome outcome) {}

    default void onProgress(ProgressSnapshot snapshot) {}
}
