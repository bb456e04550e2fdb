package io.troupe.core;

import io.troupe.core.routing.CircuitBreakerConfig;
import io.troupe.core.routing.ProviderCatalog;
import io.troupe.core.routing.Tier;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Engine settings: worker bounds, timeouts, circuit breaker thresholds, readiness margins and
 * the provider catalog.
 *
 * <p>Every setting has a default, so {@code new TroupeConfig()} is a working configuration.
 * {@link #fromProperties(Properties)} reads {@code troupe.*} keys; unknown keys are ignored.
 */
public class TroupeConfig {

    public static final String PREFIX = "troupe.";

    private int maxWorkers = 4;
    private Duration attemptTimeout = Duration.ofSeconds(30);
    private int maxRefinementRounds = 3;
    private int circuitFailureThreshold = 5;
    private Duration circuitWindow = Duration.ofSeconds(60);
    private Duration circuitCooldown = Duration.ofSeconds(30);
    private Duration circuitMaxCooldown = Duration.ofMinutes(10);
    private Duration cooldownWait = Duration.ZERO;
    private double trendEpsilon = 1.0;
    private double smallMargin = 0.05;
    private double wideMargin = 0.15;
    private int retainedRuns = 256;
    private final Map<Tier, List<String>> providers = new EnumMap<>(Tier.class);
    private final Map<Tier, Double> tierCosts = new EnumMap<>(Tier.class);

    public TroupeConfig() {
        for (Tier tier : Tier.values()) {
            providers.put(tier, List.of("default"));
        }
        tierCosts.put(Tier.CHEAP, 0.005);
        tierCosts.put(Tier.CAPABLE, 0.05);
        tierCosts.put(Tier.PREMIUM, 0.25);
    }

    /**
     * Loads a config from properties, keeping defaults for absent keys.
     *
     * @param properties source properties, not null
     * @return new config, never null
     * @throws IllegalArgumentException if a present value cannot be parsed
     */
    public static TroupeConfig fromProperties(Properties properties) {
        TroupeConfig config = new TroupeConfig();
        String value;
        if ((value = read(properties, "workers.max")) != null) {
            config.setMaxWorkers(parseInt("workers.max", value));
        }
        if ((value = read(properties, "attempt.timeout-ms")) != null) {
            config.setAttemptTimeout(parseMillis("attempt.timeout-ms", value));
        }
        if ((value = read(properties, "refinement.max-rounds")) != null) {
            config.setMaxRefinementRounds(parseInt("refinement.max-rounds", value));
        }
        if ((value = read(properties, "circuit.failure-threshold")) != null) {
            config.setCircuitFailureThreshold(parseInt("circuit.failure-threshold", value));
        }
        if ((value = read(properties, "circuit.window-ms")) != null) {
            config.setCircuitWindow(parseMillis("circuit.window-ms", value));
        }
        if ((value = read(properties, "circuit.cooldown-ms")) != null) {
            config.setCircuitCooldown(parseMillis("circuit.cooldown-ms", value));
        }
        if ((value = read(properties, "circuit.max-cooldown-ms")) != null) {
            config.setCircuitMaxCooldown(parseMillis("circuit.max-cooldown-ms", value));
        }
        if ((value = read(properties, "circuit.cooldown-wait-ms")) != null) {
            config.setCooldownWait(parseMillis("circuit.cooldown-wait-ms", value));
        }
        if ((value = read(properties, "trend.epsilon")) != null) {
            config.setTrendEpsilon(parseDouble("trend.epsilon", value));
        }
        if ((value = read(properties, "readiness.small-margin")) != null) {
            config.setSmallMargin(parseDouble("readiness.small-margin", value));
        }
        if ((value = read(properties, "readiness.wide-margin")) != null) {
            config.setWideMargin(parseDouble("readiness.wide-margin", value));
        }
        if ((value = read(properties, "progress.retained-runs")) != null) {
            config.setRetainedRuns(parseInt("progress.retained-runs", value));
        }
        for (Tier tier : Tier.values()) {
            if ((value = read(properties, "providers." + tier.id())) != null) {
                config.setProviders(tier, splitList(value));
            }
            if ((value = read(properties, "cost." + tier.id())) != null) {
                config.setTierCost(tier, parseDouble("cost." + tier.id(), value));
            }
        }
        return config;
    }

    private static String read(Properties properties, String key) {
        String value = properties.getProperty(PREFIX + key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not an integer: " + value, e);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not a number: " + value, e);
        }
    }

    private static Duration parseMillis(String key, String value) {
        long millis;
        try {
            millis = Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not a duration: " + value, e);
        }
        if (millis < 0) {
            throw new IllegalArgumentException(PREFIX + key + " must not be negative");
        }
        return Duration.ofMillis(millis);
    }

    private static List<String> splitList(String value) {
        List<String> names = new ArrayList<>();
        for (String part : value.split(",")) {
            String name = part.trim();
            if (!name.isEmpty()) {
                names.add(name.toLowerCase(Locale.ROOT));
            }
        }
        return names;
    }

    /** Builds the breaker thresholds these settings describe. */
    public CircuitBreakerConfig toCircuitBreakerConfig() {
        return new CircuitBreakerConfig(
                circuitFailureThreshold, circuitWindow, circuitCooldown, circuitMaxCooldown);
    }

    /** Builds the provider catalog these settings describe. */
    public ProviderCatalog toProviderCatalog() {
        ProviderCatalog.Builder builder = ProviderCatalog.builder();
        for (Tier tier : Tier.values()) {
            builder.providers(tier, providers.get(tier)).cost(tier, tierCosts.get(tier));
        }
        return builder.build();
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public void setMaxWorkers(int maxWorkers) {
        this.maxWorkers = maxWorkers;
    }

    public Duration getAttemptTimeout() {
        return attemptTimeout;
    }

    public void setAttemptTimeout(Duration attemptTimeout) {
        this.attemptTimeout = attemptTimeout;
    }

    public int getMaxRefinementRounds() {
        return maxRefinementRounds;
    }

    public void setMaxRefinementRounds(int maxRefinementRounds) {
        this.maxRefinementRounds = maxRefinementRounds;
    }

    public int getCircuitFailureThreshold() {
        return circuitFailureThreshold;
    }

    public void setCircuitFailureThreshold(int circuitFailureThreshold) {
        this.circuitFailureThreshold = circuitFailureThreshold;
    }

    public Duration getCircuitWindow() {
        return circuitWindow;
    }

    public void setCircuitWindow(Duration circuitWindow) {
        this.circuitWindow = circuitWindow;
    }

    public Duration getCircuitCooldown() {
        return circuitCooldown;
    }

    public void setCircuitCooldown(Duration circuitCooldown) {
        this.circuitCooldown = circuitCooldown;
    }

    public Duration getCircuitMaxCooldown() {
        return circuitMaxCooldown;
    }

    public void setCircuitMaxCooldown(Duration circuitMaxCooldown) {
        this.circuitMaxCooldown = circuitMaxCooldown;
    }

    public Duration getCooldownWait() {
        return cooldownWait;
    }

    public void setCooldownWait(Duration cooldownWait) {
        this.cooldownWait = cooldownWait;
    }

    public double getTrendEpsilon() {
        return trendEpsilon;
    }

    public void setTrendEpsilon(double trendEpsilon) {
        this.trendEpsilon = trendEpsilon;
    }

    public double getSmallMargin() {
        return smallMargin;
    }

    public void setSmallMargin(double smallMargin) {
        this.smallMargin = smallMargin;
    }

    public double getWideMargin() {
        return wideMargin;
    }

    public void setWideMargin(double wideMargin) {
        this.wideMargin = wideMargin;
    }

    /** Number of finished runs whose final progress stays available for polling. */
    public int getRetainedRuns() {
        return retainedRuns;
    }

    public void setRetainedRuns(int retainedRuns) {
        this.retainedRuns = retainedRuns;
    }

    public List<String> getProviders(Tier tier) {
        return providers.get(tier);
    }

    public void setProviders(Tier tier, List<String> names) {
        providers.put(tier, List.copyOf(names));
    }

    public double getTierCost(Tier tier) {
        return tierCosts.get(tier);
    }

    public void setTierCost(Tier tier, double cost) {
        tierCosts.put(tier, cost);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final TroupeConfig config = new TroupeConfig();

        public Builder maxWorkers(int maxWorkers) {
            config.maxWorkers = maxWorkers;
            return this;
        }

        public Builder attemptTimeout(Duration attemptTimeout) {
            config.attemptTimeout = attemptTimeout;
            return this;
        }

        public Builder maxRefinementRounds(int maxRefinementRounds) {
            config.maxRefinementRounds = maxRefinementRounds;
            return this;
        }

        public Builder circuitFailureThreshold(int threshold) {
            config.circuitFailureThreshold = threshold;
            return this;
        }

        public Builder circuitWindow(Duration window) {
            config.circuitWindow = window;
            return this;
        }

        public Builder circuitCooldown(Duration cooldown) {
            config.circuitCooldown = cooldown;
            return this;
        }

        public Builder circuitMaxCooldown(Duration maxCooldown) {
            config.circuitMaxCooldown = maxCooldown;
            return this;
        }

        public Builder cooldownWait(Duration cooldownWait) {
            config.cooldownWait = cooldownWait;
            return this;
        }

        public Builder trendEpsilon(double trendEpsilon) {
            config.trendEpsilon = trendEpsilon;
            return this;
        }

        public Builder margins(double small, double wide) {
            config.smallMargin = small;
            config.wideMargin = wide;
            return this;
        }

        public Builder retainedRuns(int retainedRuns) {
            config.retainedRuns = retainedRuns;
            return this;
        }

        public Builder providers(Tier tier, List<String> names) {
            config.setProviders(tier, names);
            return this;
        }

        public Builder tierCost(Tier tier, double cost) {
            config.setTierCost(tier, cost);
            return this;
        }

        public TroupeConfig build() {
            return config;
        }
    }
}
