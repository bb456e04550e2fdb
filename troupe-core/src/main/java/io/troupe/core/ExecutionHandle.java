package io.troupe.core;

import io.troupe.core.execution.CancellationToken;
import io.troupe.core.execution.ProgressSnapshot;
import io.troupe.core.execution.ProgressTracker;
import io.troupe.core.run.RunRecord;
import java.util.concurrent.CompletableFuture;

/**
 * Handle of an execution submitted with {@link TroupeEngine#submit}.
 *
 * <p>Cancelling is cooperative: agents finish their current tier attempt, unstarted agents are
 * skipped, and the future still completes with a record whose plan is partial.
 */
public final class ExecutionHandle {

    private final String executionId;
    private final CompletableFuture<RunRecord> result;
    private final CancellationToken cancellation;
    private final ProgressTracker tracker;

    ExecutionHandle(
            String executionId,
            CompletableFuture<RunRecord> result,
            CancellationToken cancellation,
            ProgressTracker tracker) {
        this.executionId = executionId;
        this.result = result;
        this.cancellation = cancellation;
        this.tracker = tracker;
    }

    /** Returns the execution id, which is also the run id of the resulting record. */
    public String getExecutionId() {
        return executionId;
    }

    public CompletableFuture<RunRecord> getResult() {
        return result;
    }

    /**
     * Requests cancellation.
     *
     * @return {@code true} if this call requested it, {@code false} if already requested
     */
    public boolean cancel() {
        return cancellation.cancel();
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    public boolean isDone() {
        return result.isDone();
    }

    public ProgressSnapshot progress() {
        return tracker.snapshot();
    }
}
