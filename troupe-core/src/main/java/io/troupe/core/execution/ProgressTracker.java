package io.troupe.core.execution;

import io.troupe.core.agent.AgentSpec;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Listener that keeps the progress of one execution for polling.
 *
 * <p>Stages are set by the engine ({@code composing}, {@code executing}, {@code aggregating},
 * {@code completed}); agent counts and running cost are derived from execution events.
 *
 * @implNote Thread-safe.
 */
public final class ProgressTracker implements ExecutionListener {

    public static final String STAGE_QUEUED = "queued";
    public static final String STAGE_COMPOSING = "composing";
    public static final String STAGE_EXECUTING = "executing";
    public static final String STAGE_AGGREGATING = "aggregating";
    public static final String STAGE_COMPLETED = "completed";
    public static final String STAGE_FAILED = "failed";

    private final String executionId;
    private final ExecutionListener progressSink;
    private final AtomicInteger total = new AtomicInteger();
    private final AtomicInteger settled = new AtomicInteger();
    private final DoubleAdder cost = new DoubleAdder();
    private volatile String stage = STAGE_QUEUED;

    public ProgressTracker(String executionId) {
        this(executionId, NOOP);
    }

    /**
     * Creates a tracker that forwards a snapshot to {@code progressSink} after every settled
     * agent and stage change.
     *
     * @param executionId execution id, not null
     * @param progressSink receiver of {@link #onProgress} events, not null
     */
    public ProgressTracker(String executionId, ExecutionListener progressSink) {
        this.executionId = Objects.requireNonNull(executionId, "executionId must not be null");
        this.progressSink = Objects.requireNonNull(progressSink, "progressSink must not be null");
    }

    public String getExecutionId() {
        return executionId;
    }

    public void stage(String stage) {
        this.stage = stage;
        publish();
    }

    @Override
    public void onPlanStart(ExecutionPlan plan) {
        total.set(plan.getSpecs().size());
        stage = STAGE_EXECUTING;
        publish();
    }

    @Override
    public void onAttempt(AgentSpec spec, TierAttempt attempt) {
        cost.add(attempt.cost());
    }

    @Override
    public void onAgentComplete(AgentSpec spec, AgentResult result) {
        settled.incrementAndGet();
        publish();
    }

    /**
     * Returns the current progress.
     *
     * <p>Execution accounts for 90% of the bar; aggregation and persistence take the rest.
     *
     * @return snapshot, never null
     */
    public ProgressSnapshot snapshot() {
        int agents = total.get();
        int done = Math.min(settled.get(), agents);
        String current = stage;
        double percent;
        if (STAGE_COMPLETED.equals(current) || STAGE_FAILED.equals(current)) {
            percent = 100.0;
        } else if (STAGE_AGGREGATING.equals(current)) {
            percent = 95.0;
        } else if (agents == 0) {
            percent = 0.0;
        } else {
            percent = 90.0 * done / agents;
        }
        return new ProgressSnapshot(executionId, current, agents, done, percent, cost.sum());
    }

    private void publish() {
        if (progressSink != NOOP) {
            progressSink.onProgress(snapshot());
        }
    }
}
