package io.troupe.core.routing;

import io.troupe.core.agent.AgentSpec;
import io.troupe.core.result.ErrorKind;
import java.util.Objects;

/**
 * Decides which (provider, tier) pair each attempt uses and whether a failure may fall back.
 *
 * <p>The router is stateless apart from the injected {@link CircuitBreakerTable}; per-agent
 * progress lives in the {@link RoutingSession} returned by {@link #open(AgentSpec)}.
 *
 * @implNote Thread-safe. One router serves all concurrently executing agents.
 */
public class TierRouter {

    private final ProviderCatalog catalog;
    private final CircuitBreakerTable breakers;

    public TierRouter(ProviderCatalog catalog, CircuitBreakerTable breakers) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.breakers = Objects.requireNonNull(breakers, "breakers must not be null");
    }

    /**
     * Returns whether a failure at the given tier may be retried elsewhere.
     *
     * @param kind failure classification, not null
     * @param currentTier tier of the failed attempt, not null
     * @return {@code false} at premium or for fatal errors, {@code true} otherwise
     */
    public boolean shouldFallback(ErrorKind kind, Tier currentTier) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(currentTier, "currentTier must not be null");
        return !currentTier.isHighest() && !kind.isFatal();
    }

    /**
     * Starts routing one agent execution.
     *
     * @param spec agent to route, not null
     * @return fresh session positioned at the strategy's start tier, never null
     */
    public RoutingSession open(AgentSpec spec) {
        return new RoutingSession(spec, this);
    }

    public ProviderCatalog getCatalog() {
        return catalog;
    }

    public CircuitBreakerTable getCircuitBreakers() {
        return breakers;
    }
}
