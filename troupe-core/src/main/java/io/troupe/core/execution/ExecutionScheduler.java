package io.troupe.core.execution;

import io.troupe.core.agent.AgentSpec;
import io.troupe.core.result.ErrorKind;
import io.troupe.core.result.Result;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for running an {@link ExecutionPlan} under one of the registered strategies.
 *
 * <h2>Contracts</h2>
 *
 * <ul>
 *   <li><b>Postcondition</b>: an {@code Ok} outcome holds exactly one {@link AgentResult} per
 *       spec, in plan order
 *   <li>Invalid plans (duplicate roles, wrong shape for the strategy) yield {@code
 *       Err(INVALID_PLAN)} before any agent runs
 *   <li>No exception escapes: a strategy crash yields {@code Err(INTERNAL)}
 *   <li>A cancelled plan completes with status {@link PlanStatus#PARTIAL}
 * </ul>
 *
 * @implNote Thread-safe. Several plans may execute at once; they share the worker pool and the
 *     router's circuit breakers, and each plan bounds its own in-flight agents.
 */
public class ExecutionScheduler {

    private static final Logger logger = Logger.getLogger(ExecutionScheduler.class.getName());

    private final AgentExecutor agentExecutor;
    private final ExecutorService workers;
    private final int maxWorkers;
    private final int maxRefinementRounds;
    private final Clock clock;
    private final Map<StrategyType, ExecutionStrategy> strategies =
            new EnumMap<>(StrategyType.class);

    public ExecutionScheduler(
            AgentExecutor agentExecutor,
            ExecutorService workers,
            int maxWorkers,
            int maxRefinementRounds,
            Clock clock) {
        this.agentExecutor =
                Objects.requireNonNull(agentExecutor, "agentExecutor must not be null");
        this.workers = Objects.requireNonNull(workers, "workers must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1");
        }
        if (maxRefinementRounds < 1) {
            throw new IllegalArgumentException("maxRefinementRounds must be at least 1");
        }
        this.maxWorkers = maxWorkers;
        this.maxRefinementRounds = maxRefinementRounds;
        register(new ParallelStrategy());
        register(new SequentialStrategy());
        register(new RefinementStrategy());
    }

    /**
     * Registers or replaces the strategy for its type.
     *
     * @param strategy strategy, not null
     */
    public final void register(ExecutionStrategy strategy) {
        Objects.requireNonNull(strategy, "strategy must not be null");
        strategies.put(strategy.type(), strategy);
    }

    public Result<ExecutionOutcome> execute(ExecutionPlan plan) {
        return execute(plan, ExecutionListener.NOOP, CancellationToken.none());
    }

    /**
     * Runs a plan until every agent has settled.
     *
     * @param plan plan to run, not null
     * @param listener event listener, not null; its failures are logged and ignored
     * @param cancellation cooperative cancellation signal, not null
     * @return the outcome, or an {@code INVALID_PLAN}/{@code INTERNAL} error, never null
     */
    public Result<ExecutionOutcome> execute(
            ExecutionPlan plan, ExecutionListener listener, CancellationToken cancellation) {
        Objects.requireNonNull(plan, "plan must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");

        ExecutionStrategy strategy = strategies.get(plan.getStrategy());
        if (strategy == null) {
            return Result.err(
                    ErrorKind.INVALID_PLAN, "No strategy registered for " + plan.getStrategy());
        }
        Optional<String> problem = validate(plan, strategy);
        if (problem.isPresent()) {
            logger.warning("Rejected plan " + plan.getPlanId() + ": " + problem.get());
            return Result.err(ErrorKind.INVALID_PLAN, problem.get());
        }

        ExecutionListener safeListener = new CompositeExecutionListener(listener);
        StrategyContext context =
                new StrategyContext(
                        agentExecutor,
                        workers,
                        maxWorkers,
                        maxRefinementRounds,
                        safeListener,
                        cancellation);

        Instant startedAt = clock.instant();
        logger.info(
                "Executing plan "
                        + plan.getPlanId()
                        + " ("
                        + plan.getStrategy()
                        + ", "
                        + plan.getSpecs().size()
                        + " agent(s))");
        safeListener.onPlanStart(plan);

        StrategyResult strategyResult;
        try {
            strategyResult = strategy.execute(plan, context);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Strategy " + plan.getStrategy() + " crashed", e);
            return Result.err(ErrorKind.INTERNAL, "Strategy crashed: " + e.getMessage());
        }

        List<AgentResult> results = completeResults(plan, strategyResult.results());
        boolean partial =
                cancellation.isCancelled()
                        || results.stream().anyMatch(r -> r.errorKind() == ErrorKind.CANCELLED);
        ExecutionOutcome outcome =
                new ExecutionOutcome(
                        plan.getPlanId(),
                        plan.getStrategy(),
                        partial ? PlanStatus.PARTIAL : PlanStatus.COMPLETED,
                        results,
                        strategyResult.rounds(),
                        startedAt,
                        clock.instant());
        logger.info(
                "Plan "
                        + plan.getPlanId()
                        + " "
                        + outcome.status()
                        + ": "
                        + outcome.successCount()
                        + "/"
                        + results.size()
                        + " succeeded, cost $"
                        + String.format("%.4f", outcome.totalCost()));
        safeListener.onPlanComplete(outcome);
        return Result.ok(outcome);
    }

    private static Optional<String> validate(ExecutionPlan plan, ExecutionStrategy strategy) {
        Set<String> roles = new HashSet<>();
        Set<String> ids = new HashSet<>();
        for (AgentSpec spec : plan.getSpecs()) {
            if (!roles.add(spec.getRole())) {
                return Optional.of("duplicate role '" + spec.getRole() + "'");
            }
            if (!ids.add(spec.getAgentId())) {
                return Optional.of("duplicate agent id '" + spec.getAgentId() + "'");
            }
        }
        return strategy.validate(plan);
    }

    /** Guarantees one result per spec in plan order, synthesizing failures for gaps. */
    private static List<AgentResult> completeResults(
            ExecutionPlan plan, List<AgentResult> strategyResults) {
        Map<String, AgentResult> byAgentId = new HashMap<>();
        for (AgentResult result : strategyResults) {
            if (result != null) {
                byAgentId.putIfAbsent(result.agentId(), result);
            }
        }
        List<AgentResult> ordered = new ArrayList<>(plan.getSpecs().size());
        for (AgentSpec spec : plan.getSpecs()) {
            AgentResult result = byAgentId.get(spec.getAgentId());
            if (result == null) {
                logger.warning("No result recorded for " + spec.getRole() + "; marking failed");
                result =
                        AgentResult.failed(
                                spec,
                                ErrorKind.INTERNAL,
                                "no result recorded",
                                Map.of(),
                                null,
                                List.of(),
                                List.of());
            }
            ordered.add(result);
        }
        return ordered;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }
}
