package io.troupe.core.result;

/**
 * Classification of everything that can go wrong below the engine facade.
 *
 * <p>Each kind belongs to one {@link Severity}. Recoverable kinds drive same-tier provider
 * fallback and tier escalation; fatal kinds end an agent's execution immediately; outcome kinds
 * describe a settled state rather than a failed call.
 *
 * @see io.troupe.core.routing.TierRouter#shouldFallback(ErrorKind, io.troupe.core.routing.Tier)
 */
public enum ErrorKind {
    TIMEOUT(Severity.RECOVERABLE),
    CONNECTION(Severity.RECOVERABLE),
    RATE_LIMITED(Severity.RECOVERABLE),
    UNAVAILABLE(Severity.RECOVERABLE),
    CIRCUIT_OPEN(Severity.RECOVERABLE),

    INVALID_INPUT(Severity.FATAL),
    INVALID_CONFIG(Severity.FATAL),
    INTERNAL(Severity.FATAL),

    CRITERIA_NOT_MET(Severity.OUTCOME),
    DEPENDENCY_UNMET(Severity.OUTCOME),
    CANCELLED(Severity.OUTCOME),
    INVALID_PLAN(Severity.OUTCOME),
    AGGREGATION_DATA(Severity.OUTCOME);

    /** Coarse grouping used by routing decisions. */
    public enum Severity {
        RECOVERABLE,
        FATAL,
        OUTCOME
    }

    private final Severity severity;

    ErrorKind(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }

    /**
     * Returns whether retrying elsewhere (another provider or a higher tier) may succeed.
     *
     * @return {@code true} for timeouts, connection, rate-limit, availability and open-circuit
     *     errors
     */
    public boolean isRecoverable() {
        return severity == Severity.RECOVERABLE;
    }

    /**
     * Returns whether the error must stop the agent without any fallback.
     *
     * @return {@code true} for invalid input, invalid configuration and internal errors
     */
    public boolean isFatal() {
        return severity == Severity.FATAL;
    }
}
