package io.troupe.core.routing;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered providers and default per-attempt cost for each tier.
 *
 * <p>Provider order is preference order for same-tier fallback. The default cost applies when
 * the runtime does not report a cost for an attempt.
 *
 * @implNote Immutable. Every tier must have at least one provider.
 */
public final class ProviderCatalog {

    private final Map<Tier, List<String>> providers;
    private final Map<Tier, Double> costs;

    private ProviderCatalog(Builder builder) {
        this.providers = new EnumMap<>(Tier.class);
        this.costs = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            List<String> names = builder.providers.get(tier);
            if (names == null || names.isEmpty()) {
                throw new IllegalArgumentException("No providers configured for tier " + tier.id());
            }
            this.providers.put(tier, List.copyOf(names));
            this.costs.put(tier, builder.costs.getOrDefault(tier, 0.0));
        }
    }

    /** One provider named {@code name} on every tier, with the default tier costs. */
    public static ProviderCatalog single(String name) {
        Builder builder = builder();
        for (Tier tier : Tier.values()) {
            builder.providers(tier, List.of(name));
        }
        return builder.build();
    }

    public List<String> providers(Tier tier) {
        return providers.get(tier);
    }

    public double defaultCost(Tier tier) {
        return costs.get(tier);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<Tier, List<String>> providers = new EnumMap<>(Tier.class);
        private final Map<Tier, Double> costs = new EnumMap<>(Tier.class);

        private Builder() {
            costs.put(Tier.CHEAP, 0.005);
            costs.put(Tier.CAPABLE, 0.05);
            costs.put(Tier.PREMIUM, 0.25);
        }

        public Builder providers(Tier tier, List<String> names) {
            providers.put(Objects.requireNonNull(tier, "tier must not be null"), names);
            return this;
        }

        public Builder cost(Tier tier, double cost) {
            if (cost < 0.0) {
                throw new IllegalArgumentException("cost must not be negative");
            }
            costs.put(Objects.requireNonNull(tier, "tier must not be null"), cost);
            return this;
        }

        public ProviderCatalog build() {
            return new ProviderCatalog(this);
        }
    }
}
