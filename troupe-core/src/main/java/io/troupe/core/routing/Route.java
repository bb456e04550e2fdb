package io.troupe.core.routing;

/**
 * Provider and tier chosen for the next attempt.
 *
 * @param provider provider name
 * @param tier tier
 */
public record Route(String provider, Tier tier) {

    public TierKey key() {
        return new TierKey(provider, tier);
    }
}
