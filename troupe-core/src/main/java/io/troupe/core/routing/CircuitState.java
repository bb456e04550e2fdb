package io.troupe.core.routing;

/** Circuit breaker state per (provider, tier) pair. */
public enum CircuitState {
    /** Calls pass through; consecutive recoverable failures are counted. */
    CLOSED,
    /** Calls are short-circuited until the cooldown elapses. */
    OPEN,
    /** A single probe call is in flight or allowed; its outcome decides the next state. */
    HALF_OPEN
}
