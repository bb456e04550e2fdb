package io.troupe.core.execution;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for one execution plan.
 *
 * <p>Cancelling never interrupts a call in flight. Agents finish their current tier attempt,
 * no further attempts start, and agents that had not started are recorded as skipped.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /** Token that is never cancelled. Cancelling it has no effect beyond this token. */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    /**
     * Requests cancellation.
     *
     * @return {@code true} if this call flipped the flag
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
