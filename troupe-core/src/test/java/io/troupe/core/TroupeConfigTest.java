package io.troupe.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.troupe.core.routing.CircuitBreakerConfig;
import io.troupe.core.routing.ProviderCatalog;
import io.troupe.core.routing.Tier;
import java.time.Duration;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TroupeConfigTest {

    @Nested
    class Defaults {

        @Test
        void shouldProvideWorkingDefaults() {
            TroupeConfig config = new TroupeConfig();

            assertThat(config.getMaxWorkers()).isEqualTo(4);
            assertThat(config.getAttemptTimeout()).isEqualTo(Duration.ofSeconds(30));
            assertThat(config.getMaxRefinementRounds()).isEqualTo(3);
            assertThat(config.toCircuitBreakerConfig()).isEqualTo(CircuitBreakerConfig.defaults());
            assertThat(config.getProviders(Tier.PREMIUM)).containsExactly("default");
            assertThat(config.getTierCost(Tier.CAPABLE)).isEqualTo(0.05);
            assertThat(config.getRetainedRuns()).isEqualTo(256);
        }
    }

    @Nested
    class FromProperties {

        @Test
        void shouldReadPrefixedKeys() {
            // Given
            Properties properties = new Properties();
            properties.setProperty("troupe.workers.max", "8");
            properties.setProperty("troupe.attempt.timeout-ms", "250");
            properties.setProperty("troupe.circuit.failure-threshold", "3");
            properties.setProperty("troupe.circuit.cooldown-ms", "1000");
            properties.setProperty("troupe.readiness.wide-margin", "0.2");
            properties.setProperty("troupe.providers.capable", " Alpha , beta,, ");
            properties.setProperty("troupe.cost.premium", "1.5");
            properties.setProperty("troupe.progress.retained-runs", "16");

            // When
            TroupeConfig config = TroupeConfig.fromProperties(properties);

            // Then
            assertThat(config.getMaxWorkers()).isEqualTo(8);
            assertThat(config.getAttemptTimeout()).isEqualTo(Duration.ofMillis(250));
            assertThat(config.getCircuitFailureThreshold()).isEqualTo(3);
            assertThat(config.getCircuitCooldown()).isEqualTo(Duration.ofSeconds(1));
            assertThat(config.getWideMargin()).isEqualTo(0.2);
            assertThat(config.getProviders(Tier.CAPABLE)).containsExactly("alpha", "beta");
            assertThat(config.getTierCost(Tier.PREMIUM)).isEqualTo(1.5);
            assertThat(config.getRetainedRuns()).isEqualTo(16);
        }

        @Test
        void shouldKeepDefaultsForBlankAndUnknownKeys() {
            // Given
            Properties properties = new Properties();
            properties.setProperty("troupe.workers.max", "  ");
            properties.setProperty("troupe.unknown", "42");
            properties.setProperty("workers.max", "9");

            // When
            TroupeConfig config = TroupeConfig.fromProperties(properties);

            // Then
            assertThat(config.getMaxWorkers()).isEqualTo(4);
        }

        @Test
        void shouldRejectMalformedValues() {
            Properties properties = new Properties();
            properties.setProperty("troupe.workers.max", "many");

            assertThatThrownBy(() -> TroupeConfig.fromProperties(properties))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("troupe.workers.max");
        }

        @Test
        void shouldRejectNegativeDurations() {
            Properties properties = new Properties();
            properties.setProperty("troupe.circuit.window-ms", "-5");

            assertThatThrownBy(() -> TroupeConfig.fromProperties(properties))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("must not be negative");
        }
    }

    @Nested
    class Conversions {

        @Test
        void shouldBuildProviderCatalog() {
            TroupeConfig config =
                    TroupeConfig.builder()
                            .providers(Tier.CHEAP, List.of("local", "mirror"))
                            .tierCost(Tier.CHEAP, 0.001)
                            .build();

            ProviderCatalog catalog = config.toProviderCatalog();

            assertThat(catalog.providers(Tier.CHEAP)).containsExactly("local", "mirror");
            assertThat(catalog.defaultCost(Tier.CHEAP)).isEqualTo(0.001);
        }

        @Test
        void shouldLoadClasspathProperties() {
            TroupeConfig config = TroupeFactory.loadConfig();

            assertThat(config.getMaxWorkers()).isEqualTo(2);
            assertThat(config.getAttemptTimeout()).isEqualTo(Duration.ofMillis(1500));
            assertThat(config.getProviders(Tier.CHEAP)).containsExactly("local", "mirror");
        }
    }
}
