package io.troupe.core.routing;

import java.util.Objects;

/**
 * Identity of one circuit breaker: a provider at a tier.
 *
 * @param provider provider name, not null
 * @param tier tier, not null
 */
public record TierKey(String provider, Tier tier) {

    public TierKey {
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(tier, "tier must not be null");
    }

    @Override
    public String toString() {
        return provider + "/" + tier.id();
    }
}
