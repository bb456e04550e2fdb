package io.troupe.core.execution;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Growing record of one agent's attempts. Entries are appended, never rewritten.
 *
 * @implNote Thread-safe, so progress listeners may read it while the agent runs.
 */
public final class AttemptLog {

    private final List<TierAttempt> entries = new CopyOnWriteArrayList<>();

    public void append(TierAttempt attempt) {
        entries.add(Objects.requireNonNull(attempt, "attempt must not be null"));
    }

    public void appendAll(List<TierAttempt> attempts) {
        attempts.forEach(this::append);
    }

    /**
     * Returns an immutable copy of the log.
     *
     * @return entries in append order, never null
     */
    public List<TierAttempt> entries() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public double totalCost() {
        return entries.stream().mapToDouble(TierAttempt::cost).sum();
    }

    public Duration totalDuration() {
        return entries.stream().map(TierAttempt::duration).reduce(Duration.ZERO, Duration::plus);
    }
}
