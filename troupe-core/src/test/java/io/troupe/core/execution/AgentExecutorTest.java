package io.troupe.core.execution;

import static io.troupe.core.agent.stub.StubAgentRuntime.delay;
import static io.troupe.core.agent.stub.StubAgentRuntime.fail;
import static io.troupe.core.agent.stub.StubAgentRuntime.succeed;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import io.troupe.core.MutableClock;
import io.troupe.core.agent.AgentSpec;
import io.troupe.core.agent.stub.StubAgentRuntime;
import io.troupe.core.criteria.Criterion;
import io.troupe.core.criteria.SuccessCriteria;
import io.troupe.core.result.ErrorKind;
import io.troupe.core.routing.CircuitBreakerConfig;
import io.troupe.core.routing.CircuitBreakerTable;
import io.troupe.core.routing.CircuitState;
import io.troupe.core.routing.CircuitTransition;
import io.troupe.core.routing.ProviderCatalog;
import io.troupe.core.routing.Tier;
import io.troupe.core.routing.TierKey;
import io.troupe.core.routing.TierRouter;
import io.troupe.core.routing.TierStrategy;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AgentExecutorTest {

    private static final Map<String, Object> REPORT = Map.of("coverage_percent", 91.0);

    @Mock private ExecutionListener listener;

    private MutableClock clock;
    private CircuitBreakerTable breakers;
    private StubAgentRuntime runtime;
    private ExecutorService attemptPool;
    private AgentExecutor executor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
        breakers = new CircuitBreakerTable(CircuitBreakerConfig.defaults(), clock);
        runtime = new StubAgentRuntime();
        attemptPool = Executors.newCachedThreadPool();
        executor = executorWithTimeout(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        attemptPool.shutdownNow();
    }

    @Nested
    class ProgressiveTest {

        @Test
        void shouldEscalateThroughEveryTierUntilPremiumSucceeds() {
            // Given
            runtime.script("coverage", fail(ErrorKind.TIMEOUT), fail(ErrorKind.TIMEOUT));
            runtime.respond("coverage", REPORT);

            // When
            AgentResult result = run(spec("coverage", TierStrategy.PROGRESSIVE));

            // Then
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.attemptCount()).isEqualTo(3);
            assertThat(result.tiers()).containsExactly(Tier.CHEAP, Tier.CAPABLE, Tier.PREMIUM);
            assertThat(result.finalTier()).isEqualTo(Tier.PREMIUM);
            assertThat(result.output()).isEqualTo(REPORT);
            assertThat(result.attempts().get(0).errorKind()).isEqualTo(ErrorKind.TIMEOUT);
            assertThat(result.attempts().get(2).isSuccess()).isTrue();
        }

        @Test
        void shouldTreatHungCallAsTimeout() {
            // Given
            executor = executorWithTimeout(Duration.ofMillis(50));
            Map<String, Object> late = Map.of("coverage_percent", 10.0);
            runtime.onTier("coverage", Tier.CHEAP, delay(Duration.ofSeconds(2), late));
            runtime.onTier("coverage", Tier.CAPABLE, delay(Duration.ofSeconds(2), late));
            runtime.onTier("coverage", Tier.PREMIUM, succeed(REPORT));

            // When
            AgentResult result = run(spec("coverage", TierStrategy.PROGRESSIVE));

            // Then
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.tiers()).containsExactly(Tier.CHEAP, Tier.CAPABLE, Tier.PREMIUM);
            assertThat(result.attempts())
                    .extracting(TierAttempt::errorKind)
                    .containsExactly(ErrorKind.TIMEOUT, ErrorKind.TIMEOUT, null);
            assertThat(result.attempts().get(0).message()).contains("timed out after 50ms");
        }

        @Test
        void shouldChargeOnlyAttemptsThatReturnedOutput() {
            // Given
            runtime.script("coverage", fail(ErrorKind.CONNECTION));
            runtime.respond("coverage", REPORT);

            // When
            AgentResult result = run(spec("coverage", TierStrategy.PROGRESSIVE));

            // Then
            assertThat(result.attempts().get(0).cost()).isZero();
            assertThat(result.totalCost()).isCloseTo(0.05, within(1e-9));
        }

        @Test
        void shouldPreferCostReportedByRuntime() {
            // Given
            runtime.respond("coverage", succeed(REPORT, 0.0123));

            // When
            AgentResult result = run(spec("coverage", TierStrategy.PROGRESSIVE));

            // Then
            assertThat(result.totalCost()).isCloseTo(0.0123, within(1e-9));
        }

        @Test
        void shouldEscalateWhenCriteriaAreNotMet() {
            // Given
            runtime.onTier("coverage", Tier.CHEAP, succeed(Map.of("coverage_percent", 54.3)));
            runtime.onTier("coverage", Tier.CAPABLE, succeed(Map.of("coverage_percent", 85.0)));
            AgentSpec spec =
                    AgentSpec.builder()
                            .role("coverage")
                            .successCriteria(
                                    SuccessCriteria.of(Criterion.of("coverage_percent", ">=", 80)))
                            .build();

            // When
            AgentResult result = run(spec);

            // Then
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.tiers()).containsExactly(Tier.CHEAP, Tier.CAPABLE);
            TierAttempt rejected = result.attempts().get(0);
            assertThat(rejected.errorKind()).isEqualTo(ErrorKind.CRITERIA_NOT_MET);
            assertThat(rejected.outcome()).isEqualTo(AttemptOutcome.SUCCESS);
            assertThat(rejected.cost()).isCloseTo(0.005, within(1e-9));
            assertThat(breakers.state(new TierKey("local", Tier.CHEAP)))
                    .isEqualTo(CircuitState.CLOSED);
        }

        @Test
        void shouldStopOnFatalError() {
            // Given
            runtime.respond("coverage", fail(ErrorKind.INVALID_INPUT));

            // When
            AgentResult result = run(spec("coverage", TierStrategy.PROGRESSIVE));

            // Then
            assertThat(result.status()).isEqualTo(AgentStatus.FAILED);
            assertThat(result.errorKind()).isEqualTo(ErrorKind.INVALID_INPUT);
            assertThat(result.attemptCount()).isEqualTo(1);
            assertThat(result.attempts().get(0).outcome())
                    .isEqualTo(AttemptOutcome.FATAL_ERROR);
        }

        @Test
        void shouldFailWithLastErrorWhenEveryTierFails() {
            // Given
            runtime.respond("coverage", fail(ErrorKind.UNAVAILABLE));

            // When
            AgentResult result = run(spec("coverage", TierStrategy.PROGRESSIVE));

            // Then
            assertThat(result.status()).isEqualTo(AgentStatus.FAILED);
            assertThat(result.errorKind()).isEqualTo(ErrorKind.UNAVAILABLE);
            assertThat(result.finalTier()).isEqualTo(Tier.PREMIUM);
            assertThat(result.attemptCount()).isEqualTo(3);
        }
    }

    @Nested
    class CircuitBreakerTest {

        @Test
        void shouldShortCircuitSixthAttemptWithoutCallingRuntime() {
            // Given
            runtime.respond("security", fail(ErrorKind.CONNECTION));
            AgentSpec spec = spec("security", TierStrategy.CHEAP_ONLY);
            for (int i = 0; i < 5; i++) {
                assertThat(run(spec).errorKind()).isEqualTo(ErrorKind.CONNECTION);
            }

            // When
            AgentResult sixth = run(spec);

            // Then
            assertThat(runtime.invocationCount("security")).isEqualTo(5);
            assertThat(sixth.errorKind()).isEqualTo(ErrorKind.CIRCUIT_OPEN);
            assertThat(sixth.attemptCount()).isEqualTo(1);
            TierAttempt attempt = sixth.attempts().get(0);
            assertThat(attempt.outcome()).isEqualTo(AttemptOutcome.RECOVERABLE_ERROR);
            assertThat(attempt.cost()).isZero();
            assertThat(breakers.state(new TierKey("local", Tier.CHEAP)))
                    .isEqualTo(CircuitState.OPEN);
            verify(listener).onCircuitTransition(any(CircuitTransition.class));
        }

        @Test
        void shouldProbeAgainAfterCooldown() {
            // Given
            runtime.script(
                    "security",
                    fail(ErrorKind.CONNECTION),
                    fail(ErrorKind.CONNECTION),
                    fail(ErrorKind.CONNECTION),
                    fail(ErrorKind.CONNECTION),
                    fail(ErrorKind.CONNECTION));
            runtime.respond("security", Map.of("critical_issues", 0));
            AgentSpec spec = spec("security", TierStrategy.CHEAP_ONLY);
            for (int i = 0; i < 5; i++) {
                run(spec);
            }

            // When
            clock.advance(Duration.ofSeconds(30));
            AgentResult probe = run(spec);

            // Then
            assertThat(probe.isSuccess()).isTrue();
            assertThat(breakers.state(new TierKey("local", Tier.CHEAP)))
                    .isEqualTo(CircuitState.CLOSED);
        }

        @Test
        void shouldCloseCircuitWhenProbeCarriesNullConfigValues() {
            // Given
            TierKey key = new TierKey("local", Tier.CHEAP);
            for (int i = 0; i < 5; i++) {
                breakers.breakerFor(key).recordFailure();
            }
            clock.advance(Duration.ofSeconds(30));
            Map<String, Object> config = new HashMap<>();
            config.put("exclude", null);
            Map<String, Object> payload = new HashMap<>(REPORT);
            payload.put("report_path", null);
            runtime.respond("coverage", payload);
            AgentSpec spec =
                    AgentSpec.builder()
                            .role("coverage")
                            .tierStrategy(TierStrategy.CHEAP_ONLY)
                            .config(config)
                            .build();

            // When
            AgentResult result = run(spec);

            // Then
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.output()).containsEntry("report_path", null);
            assertThat(runtime.invocations().get(0).config()).containsEntry("exclude", null);
            assertThat(breakers.state(key)).isEqualTo(CircuitState.CLOSED);
        }

        @Test
        void shouldEscalatePastOpenCircuitForProgressiveStrategy() {
            // Given
            runtime.onTier("quality", Tier.CHEAP, fail(ErrorKind.RATE_LIMITED));
            runtime.respond("quality", Map.of("quality_score", 8.0));
            for (int i = 0; i < 5; i++) {
                run(spec("quality", TierStrategy.CHEAP_ONLY));
            }

            // When
            AgentResult result = run(spec("quality", TierStrategy.PROGRESSIVE));

            // Then
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.tiers()).containsExactly(Tier.CHEAP, Tier.CAPABLE);
            assertThat(result.attempts().get(0).errorKind()).isEqualTo(ErrorKind.CIRCUIT_OPEN);
        }
    }

    @Nested
    class ListenerAndCancellationTest {

        @Test
        void shouldNotifyListenerOfEveryAttempt() {
            // Given
            runtime.script("coverage", fail(ErrorKind.TIMEOUT));
            runtime.respond("coverage", REPORT);
            AgentSpec spec = spec("coverage", TierStrategy.PROGRESSIVE);

            // When
            AgentResult result = run(spec);

            // Then
            verify(listener).onAgentStart(spec);
            verify(listener, times(2)).onAttempt(eq(spec), any(TierAttempt.class));
            verify(listener).onAgentComplete(spec, result);
        }

        @Test
        void shouldStopBetweenAttemptsWhenCancelled() {
            // Given
            runtime.respond("coverage", fail(ErrorKind.TIMEOUT));
            CancellationToken token = CancellationToken.none();
            token.cancel();

            // When
            AgentResult result =
                    executor.execute(
                            spec("coverage", TierStrategy.PROGRESSIVE), Map.of(), listener, token);

            // Then
            assertThat(result.errorKind()).isEqualTo(ErrorKind.CANCELLED);
            assertThat(result.attemptCount()).isEqualTo(1);
        }

        @Test
        void shouldSucceedWithDegradedOutputWhenRuntimeHasNoAnswer() {
            // When
            AgentResult result = run(spec("writer", TierStrategy.CHEAP_ONLY));

            // Then
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.output()).containsEntry("stub", true);
            assertThat(result.warnings())
                    .hasSize(1)
                    .allSatisfy(warning -> assertThat(warning).contains("writer"));
        }

        @Test
        void shouldPassContextToRuntime() {
            // Given
            runtime.respond("writer", Map.of("draft", "v1"));

            // When
            executor.execute(
                    spec("writer", TierStrategy.CHEAP_ONLY),
                    Map.of("template_id", "docs"),
                    listener,
                    CancellationToken.none());

            // Then
            assertThat(runtime.invocations())
                    .singleElement()
                    .satisfies(
                            invocation -> {
                                assertThat(invocation.context())
                                        .containsEntry("template_id", "docs");
                                assertThat(invocation.provider()).isEqualTo("local");
                            });
        }
    }

    // -- Helpers --

    private AgentExecutor executorWithTimeout(Duration timeout) {
        return new AgentExecutor(
                new TierRouter(ProviderCatalog.single("local"), breakers),
                runtime,
                attemptPool,
                timeout,
                Duration.ZERO,
                clock);
    }

    private AgentResult run(AgentSpec spec) {
        return executor.execute(spec, Map.of(), listener, CancellationToken.none());
    }

    private static AgentSpec spec(String role, TierStrategy strategy) {
        return AgentSpec.builder().role(role).tierStrategy(strategy).build();
    }
}
