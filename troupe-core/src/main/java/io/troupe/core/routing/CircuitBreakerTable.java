package io.troupe.core.routing;

import java.time.Clock;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Circuit breakers for every (provider, tier) pair seen so far.
 *
 * <p>This table is the only mutable state shared by concurrently executing agents. It is owned
 * by a {@link TierRouter} and injected through its constructor; tests build a fresh table per
 * case.
 *
 * @implNote Thread-safe. Breakers are created lazily in a {@link ConcurrentHashMap}; each one
 *     guards its own state with a per-key lock.
 */
public final class CircuitBreakerTable {

    private final Map<TierKey, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerConfig config;
    private final Clock clock;

    public CircuitBreakerTable(CircuitBreakerConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public CircuitBreakerTable(CircuitBreakerConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * Returns the breaker for a pair, creating a closed one on first use.
     *
     * @param key provider and tier, not null
     * @return breaker, never null
     */
    public CircuitBreaker breakerFor(TierKey key) {
        Objects.requireNonNull(key, "key must not be null");
        return breakers.computeIfAbsent(key, k -> new CircuitBreaker(k, config, clock));
    }

    public CircuitState state(TierKey key) {
        CircuitBreaker breaker = breakers.get(key);
        return breaker != null ? breaker.getState() : CircuitState.CLOSED;
    }

    public boolean wouldAdmit(TierKey key) {
        CircuitBreaker breaker = breakers.get(key);
        return breaker == null || breaker.wouldAdmit();
    }

    /**
     * Returns the current state of every known pair, for dashboards and logs.
     *
     * @return sorted snapshot, never null
     */
    public Map<String, CircuitState> snapshot() {
        Map<String, CircuitState> states = new TreeMap<>();
        breakers.forEach((key, breaker) -> states.put(key.toString(), breaker.getState()));
        return Collections.unmodifiableMap(states);
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }
}
