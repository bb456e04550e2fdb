package io.troupe.core.execution;

/** Outcome of one tier attempt. */
public enum AttemptOutcome {
    /** The runtime answered; the output may still miss the success criteria. */
    SUCCESS,
    /** Timeout, connection, rate-limit, availability error, or a short-circuited attempt. */
    RECOVERABLE_ERROR,
    /** Invalid input or configuration, or an unexpected runtime exception. */
    FATAL_ERROR
}
