package io.troupe.core.routing;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Failure-tracking state machine for one (provider, tier) pair.
 *
 * <h2>Transitions</h2>
 *
 * <ul>
 *   <li>{@code CLOSED -> OPEN}: {@code failureThreshold} consecutive recoverable failures, all
 *       within the sliding window
 *   <li>{@code OPEN -> HALF_OPEN}: first admission request after the cooldown elapsed; that
 *       caller becomes the single probe
 *   <li>{@code HALF_OPEN -> CLOSED}: the probe reached the provider; cooldown resets to base
 *   <li>{@code HALF_OPEN -> OPEN}: the probe failed recoverably; cooldown doubles up to the
 *       maximum
 * </ul>
 *
 * <p>"Reached the provider" covers successful calls as well as fatal errors and unmet success
 * criteria: the provider answered, so it is available.
 *
 * @implNote Thread-safe. Each breaker owns a {@link ReentrantLock}; concurrent agents updating
 *     the same pair serialize on it without blocking unrelated pairs.
 */
public final class CircuitBreaker {

    private static final Logger logger = Logger.getLogger(CircuitBreaker.class.getName());

    /** Admission decision for one attempt. */
    public enum Admission {
        /** Circuit closed, attempt proceeds normally. */
        ALLOWED,
        /** Caller is the single half-open probe. */
        PROBE,
        /** Attempt must be short-circuited. */
        REJECTED
    }

    /**
     * Admission decision plus the transition it caused, if any.
     *
     * @param admission decision, not null
     * @param transition state change caused by the request, or null
     */
    public record Permit(Admission admission, CircuitTransition transition) {

        public boolean isAdmitted() {
            return admission != Admission.REJECTED;
        }

        public Optional<CircuitTransition> transitionIfAny() {
            return Optional.ofNullable(transition);
        }
    }

    private final TierKey key;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final Deque<Instant> failures = new ArrayDeque<>();
    private CircuitState state = CircuitState.CLOSED;
    private Duration cooldown;
    private Instant openedAt;
    private boolean probeInFlight;

    CircuitBreaker(TierKey key, CircuitBreakerConfig config, Clock clock) {
        this.key = key;
        this.config = config;
        this.clock = clock;
        this.cooldown = config.cooldown();
    }

    public TierKey getKey() {
        return key;
    }

    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public Duration getCooldown() {
        lock.lock();
        try {
            return cooldown;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Requests admission for an attempt. May move an open circuit to half-open.
     *
     * @return decision and resulting transition, never null
     */
    public Permit tryAcquire() {
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    return new Permit(Admission.ALLOWED, null);
                case OPEN:
                    if (cooldownElapsed()) {
                        probeInFlight = true;
                        CircuitTransition transition = transitionTo(CircuitState.HALF_OPEN);
                        return new Permit(Admission.PROBE, transition);
                    }
                    return new Permit(Admission.REJECTED, null);
                case HALF_OPEN:
                    if (probeInFlight) {
                        return new Permit(Admission.REJECTED, null);
                    }
                    probeInFlight = true;
                    return new Permit(Admission.PROBE, null);
                default:
                    throw new IllegalStateException("Unhandled circuit state: " + state);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns whether {@link #tryAcquire()} would currently admit a call, without changing state.
     *
     * @return {@code true} if an attempt would not be short-circuited
     */
    public boolean wouldAdmit() {
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    return true;
                case OPEN:
                    return cooldownElapsed();
                case HALF_OPEN:
                    return !probeInFlight;
                default:
                    return false;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns how long until an open circuit admits its probe.
     *
     * @return remaining cooldown, {@link Duration#ZERO} unless open
     */
    public Duration remainingCooldown() {
        lock.lock();
        try {
            if (state != CircuitState.OPEN) {
                return Duration.ZERO;
            }
            Duration elapsed = Duration.between(openedAt, clock.instant());
            Duration remaining = cooldown.minus(elapsed);
            return remaining.isNegative() ? Duration.ZERO : remaining;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records that the provider answered (success, fatal error, or unmet criteria).
     *
     * @return transition caused, if any
     */
    public Optional<CircuitTransition> recordReachable() {
        lock.lock();
        try {
            failures.clear();
            if (state == CircuitState.HALF_OPEN) {
                probeInFlight = false;
                cooldown = config.cooldown();
                return Optional.of(transitionTo(CircuitState.CLOSED));
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns an admission that never reached the provider. A held half-open probe is freed so
     * the next call can probe; the state and failure window are left untouched.
     */
    public void release() {
        lock.lock();
        try {
            if (state == CircuitState.HALF_OPEN) {
                probeInFlight = false;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a recoverable failure of an admitted attempt.
     *
     * @return transition caused, if any
     */
    public Optional<CircuitTransition> recordFailure() {
        lock.lock();
        try {
            Instant now = clock.instant();
            switch (state) {
                case HALF_OPEN:
                    probeInFlight = false;
                    cooldown = doubled(cooldown);
                    openedAt = now;
                    return Optional.of(transitionTo(CircuitState.OPEN));
                case CLOSED:
                    failures.addLast(now);
                    Instant horizon = now.minus(config.window());
                    while (!failures.isEmpty() && failures.peekFirst().isBefore(horizon)) {
                        failures.pollFirst();
                    }
                    if (failures.size() >= config.failureThreshold()) {
                        failures.clear();
                        openedAt = now;
                        return Optional.of(transitionTo(CircuitState.OPEN));
                    }
                    return Optional.empty();
                default:
                    return Optional.empty();
            }
        } finally {
            lock.unlock();
        }
    }

    private boolean cooldownElapsed() {
        return !clock.instant().isBefore(openedAt.plus(cooldown));
    }

    private Duration doubled(Duration current) {
        Duration next = current.multipliedBy(2);
        return next.compareTo(config.maxCooldown()) > 0 ? config.maxCooldown() : next;
    }

    private CircuitTransition transitionTo(CircuitState next) {
        CircuitTransition transition =
                new CircuitTransition(key, state, next, clock.instant(), cooldown);
        state = next;
        logger.info("Circuit " + transition);
        return transition;
    }
}
