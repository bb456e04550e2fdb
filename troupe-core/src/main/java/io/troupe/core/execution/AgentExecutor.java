package io.troupe.core.execution;

import io.troupe.core.agent.AgentInvocation;
import io.troupe.core.agent.AgentRuntime;
import io.troupe.core.agent.AgentSpec;
import io.troupe.core.agent.RoleOutput;
import io.troupe.core.criteria.CriteriaVerdict;
import io.troupe.core.result.ErrorKind;
import io.troupe.core.routing.CircuitBreaker;
import io.troupe.core.routing.CircuitTransition;
import io.troupe.core.routing.ErrorClassifier;
import io.troupe.core.routing.Route;
import io.troupe.core.routing.RoutingSession;
import io.troupe.core.routing.Tier;
import io.troupe.core.routing.TierRouter;
import java.io.Serial;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Runs one agent spec to completion over the tier ladder.
 *
 * <p>For each route handed out by the agent's {@link RoutingSession}, the executor asks the
 * route's circuit breaker for admission, invokes the {@link AgentRuntime} with a per-attempt
 * timeout, classifies the outcome, feeds it back to the breaker and the session, and appends a
 * {@link TierAttempt} to the attempt log.
 *
 * <h2>Contracts</h2>
 *
 * <ul>
 *   <li><b>Postcondition</b>: returns exactly one {@link AgentResult}; never throws for runtime
 *       failures
 *   <li>A short-circuited attempt is logged as a recoverable {@code CIRCUIT_OPEN} attempt with
 *       zero cost, and the runtime is not invoked
 *   <li>A timed-out call is cancelled and classified as a recoverable {@code TIMEOUT}
 *   <li>Cancellation is checked between attempts; the attempt in flight is never interrupted
 * </ul>
 *
 * @implNote Thread-safe. Per-agent state lives in local variables and the routing session; the
 *     only shared mutable state is the router's circuit breaker table.
 */
public class AgentExecutor {

    private static final Logger logger = Logger.getLogger(AgentExecutor.class.getName());

    private final TierRouter router;
    private final AgentRuntime runtime;
    private final ExecutorService attemptExecutor;
    private final Duration attemptTimeout;
    private final Duration cooldownWait;
    private final Clock clock;
    private final ErrorClassifier classifier = new ErrorClassifier();

    /**
     * Creates an executor.
     *
     * @param router tier router owning the circuit breakers, not null
     * @param runtime agent runtime, not null
     * @param attemptExecutor pool that runs the bounded runtime calls, not null; not shut down by
     *     this executor
     * @param attemptTimeout maximum duration of one runtime call, positive
     * @param cooldownWait longest remaining cooldown worth waiting out for a half-open probe;
     *     zero never waits
     * @param clock clock for attempt timestamps, not null
     */
    public AgentExecutor(
            TierRouter router,
            AgentRuntime runtime,
            ExecutorService attemptExecutor,
            Duration attemptTimeout,
            Duration cooldownWait,
            Clock clock) {
        this.router = Objects.requireNonNull(router, "router must not be null");
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
        this.attemptExecutor =
                Objects.requireNonNull(attemptExecutor, "attemptExecutor must not be null");
        this.attemptTimeout = Objects.requireNonNull(attemptTimeout, "attemptTimeout required");
        this.cooldownWait = cooldownWait != null ? cooldownWait : Duration.ZERO;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (attemptTimeout.isZero() || attemptTimeout.isNegative()) {
            throw new IllegalArgumentException("attemptTimeout must be positive");
        }
    }

    /**
     * Executes an agent, enforcing its success criteria.
     *
     * @see #execute(AgentSpec, Map, ExecutionListener, CancellationToken, boolean)
     */
    public AgentResult execute(
            AgentSpec spec,
            Map<String, Object> context,
            ExecutionListener listener,
            CancellationToken cancellation) {
        return execute(spec, context, listener, cancellation, true);
    }

    /**
     * Executes an agent.
     *
     * @param spec agent to run, not null
     * @param context context visible to the runtime, not null
     * @param listener event listener, not null
     * @param cancellation plan cancellation signal, not null
     * @param enforceCriteria whether the spec's success criteria decide success; the refinement
     *     loop passes {@code false} because it judges the criteria on the reviewer's output
     * @return the agent's result, never null
     */
    public AgentResult execute(
            AgentSpec spec,
            Map<String, Object> context,
            ExecutionListener listener,
            CancellationToken cancellation,
            boolean enforceCriteria) {
        listener.onAgentStart(spec);

        RoutingSession session = router.open(spec);
        AttemptLog log = new AttemptLog();
        List<String> warnings = new ArrayList<>();

        Map<String, Object> lastOutput = Map.of();
        ErrorKind lastKind = null;
        String lastMessage = null;
        Tier lastTier = null;

        while (true) {
            if (!log.isEmpty() && cancellation.isCancelled()) {
                lastKind = ErrorKind.CANCELLED;
                lastMessage = "plan cancelled after " + log.size() + " attempt(s)";
                break;
            }
            Optional<Route> next = session.next();
            if (next.isEmpty()) {
                break;
            }
            Route route = next.get();
            lastTier = route.tier();

            CircuitBreaker breaker = router.getCircuitBreakers().breakerFor(route.key());
            CircuitBreaker.Permit permit = acquire(breaker, listener);
            if (!permit.isAdmitted()) {
                TierAttempt attempt = TierAttempt.shortCircuited(route, clock.instant());
                record(spec, log, attempt, listener);
                lastKind = ErrorKind.CIRCUIT_OPEN;
                lastMessage = attempt.message();
                session.onFailure(ErrorKind.CIRCUIT_OPEN);
                continue;
            }

            Instant startedAt = clock.instant();
            long startNanos = System.nanoTime();
            try {
                RoleOutput output = invoke(invocationFor(spec, route, context));
                Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
                double cost =
                        output.cost().orElse(router.getCatalog().defaultCost(route.tier()));
                emit(breaker.recordReachable(), listener);
                warnings.addAll(output.warnings());
                lastOutput = output.payload();

                CriteriaVerdict verdict =
                        enforceCriteria ? judge(spec, output) : CriteriaVerdict.pass();
                if (verdict.passed()) {
                    record(
                            spec,
                            log,
                            TierAttempt.success(route, startedAt, duration, cost),
                            listener);
                    session.onSuccess();
                    AgentResult result =
                            AgentResult.succeeded(
                                    spec, lastOutput, route.tier(), log.entries(), warnings);
                    logger.info(
                            "Agent "
                                    + spec.getRole()
                                    + " succeeded on "
                                    + route.key()
                                    + " after "
                                    + log.size()
                                    + " attempt(s)");
                    listener.onAgentComplete(spec, result);
                    return result;
                }

                lastKind = ErrorKind.CRITERIA_NOT_MET;
                lastMessage = verdict.summary();
                record(
                        spec,
                        log,
                        TierAttempt.criteriaNotMet(route, startedAt, duration, cost, lastMessage),
                        listener);
                session.onFailure(ErrorKind.CRITERIA_NOT_MET);
            } catch (AttemptFailure failure) {
                Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
                lastKind = failure.kind;
                lastMessage = failure.getMessage();
                if (!failure.providerContacted) {
                    breaker.release();
                } else if (lastKind.isRecoverable()) {
                    emit(breaker.recordFailure(), listener);
                } else {
                    emit(breaker.recordReachable(), listener);
                }
                record(
                        spec,
                        log,
                        TierAttempt.failure(route, startedAt, duration, lastKind, 0.0, lastMessage),
                        listener);
                logger.warning(
                        "Attempt of "
                                + spec.getRole()
                                + " on "
                                + route.key()
                                + " failed ("
                                + lastKind
                                + "): "
                                + lastMessage);
                session.onFailure(lastKind);
            }
        }

        if (lastKind == null) {
            lastKind = ErrorKind.INVALID_CONFIG;
            lastMessage = "no route available for " + spec.getTierStrategy().id();
        }
        AgentResult result =
                AgentResult.failed(
                        spec, lastKind, lastMessage, lastOutput, lastTier, log.entries(), warnings);
        logger.warning(
                "Agent "
                        + spec.getRole()
                        + " failed after "
                        + log.size()
                        + " attempt(s): "
                        + lastKind
                        + " - "
                        + lastMessage);
        listener.onAgentComplete(spec, result);
        return result;
    }

    private CircuitBreaker.Permit acquire(CircuitBreaker breaker, ExecutionListener listener) {
        CircuitBreaker.Permit permit = breaker.tryAcquire();
        if (!permit.isAdmitted() && !cooldownWait.isZero()) {
            Duration remaining = breaker.remainingCooldown();
            if (!remaining.isZero() && remaining.compareTo(cooldownWait) <= 0) {
                try {
                    Thread.sleep(remaining.toMillis() + 1);
                    permit = breaker.tryAcquire();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warning(
                            "Interrupted while waiting for " + breaker.getKey() + " cooldown");
                }
            }
        }
        permit.transitionIfAny().ifPresent(listener::onCircuitTransition);
        return permit;
    }

    private static AgentInvocation invocationFor(
            AgentSpec spec, Route route, Map<String, Object> context) throws AttemptFailure {
        try {
            return new AgentInvocation(
                    spec.getAgentId(),
                    spec.getRole(),
                    route.tier(),
                    route.provider(),
                    spec.getConfig(),
                    spec.getTools(),
                    context);
        } catch (RuntimeException e) {
            throw new AttemptFailure(
                    ErrorKind.INVALID_CONFIG, "invalid invocation: " + e.getMessage(), false);
        }
    }

    private static CriteriaVerdict judge(AgentSpec spec, RoleOutput output)
            throws AttemptFailure {
        try {
            return spec.getSuccessCriteria().evaluate(output.payload());
        } catch (RuntimeException e) {
            throw new AttemptFailure(
                    ErrorKind.INTERNAL, "criteria evaluation failed: " + e.getMessage());
        }
    }

    private RoleOutput invoke(AgentInvocation invocation) throws AttemptFailure {
        Future<RoleOutput> future;
        try {
            future = attemptExecutor.submit(() -> runtime.run(invocation));
        } catch (RejectedExecutionException e) {
            throw new AttemptFailure(
                    ErrorKind.INTERNAL, "attempt rejected: " + e.getMessage(), false);
        }
        try {
            RoleOutput output = future.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (output == null) {
                throw new AttemptFailure(ErrorKind.INTERNAL, "runtime returned no output");
            }
            return output;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AttemptFailure(
                    ErrorKind.TIMEOUT,
                    "attempt timed out after " + attemptTimeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new AttemptFailure(
                    classifier.classify(cause), String.valueOf(cause.getMessage()));
        } catch (CancellationException e) {
            throw new AttemptFailure(ErrorKind.INTERNAL, "attempt cancelled by its executor");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AttemptFailure(ErrorKind.INTERNAL, "attempt interrupted");
        }
    }

    private static void record(
            AgentSpec spec, AttemptLog log, TierAttempt attempt, ExecutionListener listener) {
        log.append(attempt);
        listener.onAttempt(spec, attempt);
    }

    private static void emit(Optional<CircuitTransition> transition, ExecutionListener listener) {
        transition.ifPresent(listener::onCircuitTransition);
    }

    /** Classified failure of one attempt; never leaves this class. */
    private static final class AttemptFailure extends Exception {
        @Serial private static final long serialVersionUID = -3866212003771851146L;

        private final ErrorKind kind;
        private final boolean providerContacted;

        AttemptFailure(ErrorKind kind, String message) {
            this(kind, message, true);
        }

        AttemptFailure(ErrorKind kind, String message, boolean providerContacted) {
            super(message, null, false, false);
            this.kind = kind;
            this.providerContacted = providerContacted;
        }
    }
}
