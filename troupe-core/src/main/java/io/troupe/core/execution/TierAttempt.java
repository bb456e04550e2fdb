package io.troupe.core.execution;

import io.troupe.core.result.ErrorKind;
import io.troupe.core.routing.Route;
import io.troupe.core.routing.Tier;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Append-only log entry for one attempt. The attempt log is the sole source of truth for cost
 * accounting.
 *
 * @param provider provider used, not null
 * @param tier tier used, not null
 * @param startedAt start of the attempt, not null
 * @param duration wall-clock duration, zero for short-circuited attempts
 * @param outcome outcome, not null
 * @param errorKind classification of the failure, or null for a clean success
 * @param cost cost in USD, zero for short-circuited attempts
 * @param message failure detail, or null
 */
public record TierAttempt(
        String provider,
        Tier tier,
        Instant startedAt,
        Duration duration,
        AttemptOutcome outcome,
        ErrorKind errorKind,
        double cost,
        String message) {

    public TierAttempt {
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(tier, "tier must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        duration = duration != null ? duration : Duration.ZERO;
        if (cost < 0.0) {
            throw new IllegalArgumentException("cost must not be negative");
        }
    }

    public static TierAttempt success(
            Route route, Instant startedAt, Duration duration, double cost) {
        return new TierAttempt(
                route.provider(),
                route.tier(),
                startedAt,
                duration,
                AttemptOutcome.SUCCESS,
                null,
                cost,
                null);
    }

    /** Runtime answered but the output missed the success criteria. */
    public static TierAttempt criteriaNotMet(
            Route route, Instant startedAt, Duration duration, double cost, String detail) {
        return new TierAttempt(
                route.provider(),
                route.tier(),
                startedAt,
                duration,
                AttemptOutcome.SUCCESS,
                ErrorKind.CRITERIA_NOT_MET,
                cost,
                detail);
    }

    public static TierAttempt failure(
            Route route,
            Instant startedAt,
            Duration duration,
            ErrorKind kind,
            double cost,
            String message) {
        AttemptOutcome outcome =
                kind.isRecoverable()
                        ? AttemptOutcome.RECOVERABLE_ERROR
                        : AttemptOutcome.FATAL_ERROR;
        return new TierAttempt(
                route.provider(), route.tier(), startedAt, duration, outcome, kind, cost, message);
    }

    /** Attempt rejected by an open circuit without invoking the runtime. */
    public static TierAttempt shortCircuited(Route route, Instant at) {
        return new TierAttempt(
                route.provider(),
                route.tier(),
                at,
                Duration.ZERO,
                AttemptOutcome.RECOVERABLE_ERROR,
                ErrorKind.CIRCUIT_OPEN,
                0.0,
                "circuit open for " + route.key());
    }

    public boolean isSuccess() {
        return outcome == AttemptOutcome.SUCCESS && errorKind == null;
    }
}
