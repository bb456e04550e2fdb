package io.troupe.core.routing;

import java.util.Arrays;
import java.util.Locale;

/**
 * How an agent moves over the tier ladder.
 *
 * <ul>
 *   <li>{@link #CHEAP_ONLY}: cheap tier only, falling back across cheap providers
 *   <li>{@link #CAPABLE_FIRST}: capable tier with provider fallback, one premium attempt once
 *       every capable provider failed recoverably
 *   <li>{@link #PROGRESSIVE}: one attempt per tier from cheap upward, escalating on a
 *       recoverable error or unmet success criteria
 * </ul>
 *
 * @see RoutingSession
 */
public enum TierStrategy {
    CHEAP_ONLY(Tier.CHEAP),
    CAPABLE_FIRST(Tier.CAPABLE),
    PROGRESSIVE(Tier.CHEAP);

    private final Tier startTier;

    TierStrategy(Tier startTier) {
        this.startTier = startTier;
    }

    public Tier startTier() {
        return startTier;
    }

    /** Declarative identifier, e.g. {@code "capable_first"}. */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TierStrategy fromId(String id) {
        String normalized = id.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(s -> s.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown tier strategy: " + id));
    }
}
