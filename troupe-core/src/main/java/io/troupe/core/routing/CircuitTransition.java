package io.troupe.core.routing;

import java.time.Duration;
import java.time.Instant;

/**
 * State change of one circuit breaker.
 *
 * @param key breaker identity
 * @param from previous state
 * @param to new state
 * @param at time of the change
 * @param cooldown cooldown in force after the change
 */
public record CircuitTransition(
        TierKey key, CircuitState from, CircuitState to, Instant at, Duration cooldown) {

    @Override
    public String toString() {
        return key + " " + from + " -> " + to + " (cooldown " + cooldown.toMillis() + "ms)";
    }
}
