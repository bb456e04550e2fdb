package io.troupe.core.routing;

import java.util.Locale;
import java.util.Optional;

/**
 * Cost/capability level at which an agent's work runs. Declaration order is escalation order.
 */
public enum Tier {
    CHEAP,
    CAPABLE,
    PREMIUM;

    /**
     * Returns the tier one step up the ladder.
     *
     * @return next tier, or empty at {@link #PREMIUM}
     */
    public Optional<Tier> next() {
        return this == PREMIUM ? Optional.empty() : Optional.of(values()[ordinal() + 1]);
    }

    public boolean isHighest() {
        return this == PREMIUM;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Tier fromId(String id) {
        return valueOf(id.trim().toUpperCase(Locale.ROOT));
    }
}
