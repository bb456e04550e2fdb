package io.troupe.core.routing;

import java.time.Duration;
import java.util.Objects;

/**
 * Thresholds shared by every breaker of a {@link CircuitBreakerTable}.
 *
 * @param failureThreshold consecutive recoverable failures that open a closed circuit, at least
 *     1
 * @param window failures older than this no longer count towards the threshold
 * @param cooldown initial open period before a probe is admitted
 * @param maxCooldown upper bound for the doubled cooldown after failed probes
 */
public record CircuitBreakerConfig(
        int failureThreshold, Duration window, Duration cooldown, Duration maxCooldown) {

    public CircuitBreakerConfig {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(cooldown, "cooldown must not be null");
        Objects.requireNonNull(maxCooldown, "maxCooldown must not be null");
        if (maxCooldown.compareTo(cooldown) < 0) {
            throw new IllegalArgumentException("maxCooldown must not be shorter than cooldown");
        }
    }

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(
                5, Duration.ofSeconds(60), Duration.ofSeconds(30), Duration.ofMinutes(10));
    }
}
