package io.troupe.core.routing;

import io.troupe.core.agent.AgentSpec;
import io.troupe.core.result.ErrorKind;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Per-execution cursor over the tier ladder for one agent.
 *
 * <p>The executor alternates {@link #next()} with one outcome signal per attempt ({@link
 * #onSuccess()} or {@link #onFailure(ErrorKind)}) until {@code next()} returns empty.
 *
 * <h2>Strategies</h2>
 *
 * <ul>
 *   <li><b>cheap_only</b>: cheap providers in order; recoverable errors move to the next cheap
 *       provider; the tier never changes
 *   <li><b>capable_first</b>: capable providers in order; once every capable provider failed
 *       recoverably, a single premium attempt follows
 *   <li><b>progressive</b>: one attempt per tier from cheap upward; a recoverable error or unmet
 *       criteria escalates exactly one step; premium is final
 * </ul>
 *
 * <p>Within a tier the first untried provider whose circuit admits a call is preferred; if none
 * admits, the first untried provider is returned and the attempt will be short-circuited. A
 * (provider, tier) pair is never routed twice in one execution, and the tier never moves down.
 *
 * @implNote Not thread-safe. A session belongs to the single thread executing its agent.
 */
public final class RoutingSession {

    private static final Logger logger = Logger.getLogger(RoutingSession.class.getName());

    private final AgentSpec spec;
    private final TierStrategy strategy;
    private final TierRouter router;
    private final Set<TierKey> tried = new HashSet<>();
    private final List<Tier> tierHistory = new ArrayList<>();

    private Tier tier;
    private boolean finished;

    RoutingSession(AgentSpec spec, TierRouter router) {
        this.spec = spec;
        this.strategy = spec.getTierStrategy();
        this.router = router;
        this.tier = strategy.startTier();
    }

    /**
     * Returns the route for the next attempt.
     *
     * @return next route, or empty when the execution is over
     */
    public Optional<Route> next() {
        if (finished) {
            return Optional.empty();
        }
        Optional<String> provider = pickProvider(tier);
        if (provider.isEmpty()) {
            finished = true;
            return Optional.empty();
        }
        Route route = new Route(provider.get(), tier);
        tried.add(route.key());
        tierHistory.add(tier);
        return Optional.of(route);
    }

    /** The last attempt met the success criteria. */
    public void onSuccess() {
        finished = true;
    }

    /**
     * The last attempt failed or produced output that missed the success criteria.
     *
     * @param kind classification of the failure, not null
     */
    public void onFailure(ErrorKind kind) {
        if (finished) {
            return;
        }
        if (kind.isFatal()) {
            finished = true;
            return;
        }
        switch (strategy) {
            case CHEAP_ONLY:
                if (!kind.isRecoverable()) {
                    finished = true;
                }
                break;
            case CAPABLE_FIRST:
                if (tier.isHighest() || !kind.isRecoverable()) {
                    finished = true;
                } else if (!hasUntried(tier)) {
                    escalate(kind);
                }
                break;
            case PROGRESSIVE:
                if (router.shouldFallback(kind, tier)) {
                    escalate(kind);
                } else {
                    finished = true;
                }
                break;
            default:
                throw new IllegalStateException("Unhandled strategy: " + strategy);
        }
    }

    public Tier currentTier() {
        return tier;
    }

    public boolean isFinished() {
        return finished;
    }

    /** Tiers routed so far, one entry per attempt. */
    public List<Tier> tierHistory() {
        return List.copyOf(tierHistory);
    }

    private void escalate(ErrorKind cause) {
        Optional<Tier> next = tier.next();
        if (next.isEmpty()) {
            finished = true;
            return;
        }
        logger.info(
                "Escalating "
                        + spec.getRole()
                        + " from "
                        + tier.id()
                        + " to "
                        + next.get().id()
                        + " after "
                        + cause);
        tier = next.get();
    }

    private boolean hasUntried(Tier candidate) {
        return router.getCatalog().providers(candidate).stream()
                .anyMatch(p -> !tried.contains(new TierKey(p, candidate)));
    }

    private Optional<String> pickProvider(Tier candidate) {
        List<String> untried =
                router.getCatalog().providers(candidate).stream()
                        .filter(p -> !tried.contains(new TierKey(p, candidate)))
                        .toList();
        if (untried.isEmpty()) {
            return Optional.empty();
        }
        CircuitBreakerTable breakers = router.getCircuitBreakers();
        return untried.stream()
                .filter(p -> breakers.wouldAdmit(new TierKey(p, candidate)))
                .findFirst()
                .or(() -> Optional.of(untried.get(0)));
    }
}
