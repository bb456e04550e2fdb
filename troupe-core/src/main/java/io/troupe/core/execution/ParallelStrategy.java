package io.troupe.core.execution;

import io.troupe.core.agent.AgentSpec;
import io.troupe.core.result.ErrorKind;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Runs independent agents concurrently in dependency waves.
 *
 * <p>Wave 1 holds every agent without declared dependencies. Each later wave holds the agents
 * whose dependencies all succeeded in earlier waves; they see those outputs as {@code
 * <role>_output} in their context. An agent depending on a role that is absent from the plan or
 * did not succeed is recorded as skipped with {@code DEPENDENCY_UNMET}, as are agents caught in
 * a dependency cycle.
 *
 * <p>At most {@code maxWorkers} agents are in flight at once; the dispatching thread blocks for a
 * free slot. One agent's failure never cancels its siblings, and every wave settles completely
 * before the next starts, so the strategy returns only once every agent has a result.
 */
public class ParallelStrategy implements ExecutionStrategy {

    private static final Logger logger = Logger.getLogger(ParallelStrategy.class.getName());

    @Override
    public StrategyType type() {
        return StrategyType.PARALLEL;
    }

    @Override
    public StrategyResult execute(ExecutionPlan plan, StrategyContext context) {
        List<AgentSpec> specs = plan.getSpecs();
        Set<String> planRoles = specs.stream().map(AgentSpec::getRole).collect(Collectors.toSet());
        Map<String, AgentResult> byAgentId = new HashMap<>();
        Map<String, AgentResult> byRole = new HashMap<>();
        Semaphore slots = new Semaphore(Math.max(1, context.maxWorkers()));

        List<AgentSpec> pending = new ArrayList<>(specs);
        int waveNumber = 0;
        while (!pending.isEmpty()) {
            List<AgentSpec> wave = new ArrayList<>();
            boolean progressed = false;

            Iterator<AgentSpec> iterator = pending.iterator();
            while (iterator.hasNext()) {
                AgentSpec spec = iterator.next();
                List<String> unmet =
                        spec.getDependsOn().stream()
                                .filter(
                                        dep ->
                                                !planRoles.contains(dep)
                                                        || (byRole.containsKey(dep)
                                                                && !byRole.get(dep).isSuccess()))
                                .toList();
                if (!unmet.isEmpty()) {
                    settle(
                            context.skip(
                                    spec,
                                    ErrorKind.DEPENDENCY_UNMET,
                                    "dependency unmet: " + unmet),
                            byAgentId,
                            byRole);
                    iterator.remove();
                    progressed = true;
                } else if (byRole.keySet().containsAll(spec.getDependsOn())) {
                    wave.add(spec);
                    iterator.remove();
                }
            }

            if (wave.isEmpty()) {
                if (!progressed) {
                    for (AgentSpec spec : pending) {
                        settle(
                                context.skip(
                                        spec,
                                        ErrorKind.DEPENDENCY_UNMET,
                                        "dependency cycle among " + pending.size() + " agent(s)"),
                                byAgentId,
                                byRole);
                    }
                    pending.clear();
                }
                continue;
            }

            waveNumber++;
            logger.info(
                    "Plan " + plan.getPlanId() + " wave " + waveNumber + ": " + wave.size()
                            + " agent(s)");
            for (AgentResult result : runWave(wave, plan, byRole, slots, context)) {
                settle(result, byAgentId, byRole);
            }
        }

        List<AgentResult> ordered = new ArrayList<>(specs.size());
        for (AgentSpec spec : specs) {
            ordered.add(byAgentId.get(spec.getAgentId()));
        }
        return new StrategyResult(ordered, specs.isEmpty() ? 0 : 1);
    }

    private List<AgentResult> runWave(
            List<AgentSpec> wave,
            ExecutionPlan plan,
            Map<String, AgentResult> byRole,
            Semaphore slots,
            StrategyContext context) {
        List<AgentResult> results = new ArrayList<>(wave.size());
        List<AgentSpec> dispatched = new ArrayList<>();
        List<Future<AgentResult>> futures = new ArrayList<>();

        for (AgentSpec spec : wave) {
            if (context.cancellation().isCancelled()) {
                results.add(context.skip(spec, ErrorKind.CANCELLED, "plan cancelled before start"));
                continue;
            }
            try {
                slots.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                context.cancellation().cancel();
                results.add(
                        context.skip(
                                spec,
                                ErrorKind.CANCELLED,
                                "interrupted waiting for a worker slot"));
                continue;
            }
            if (context.cancellation().isCancelled()) {
                slots.release();
                results.add(context.skip(spec, ErrorKind.CANCELLED, "plan cancelled before start"));
                continue;
            }

            Map<String, Object> agentContext = contextFor(spec, plan, byRole);
            try {
                futures.add(
                        context.workers()
                                .submit(
                                        () -> {
                                            try {
                                                return context.run(spec, agentContext, true);
                                            } finally {
                                                slots.release();
                                            }
                                        }));
                dispatched.add(spec);
            } catch (RejectedExecutionException e) {
                slots.release();
                results.add(internalFailure(spec, "worker pool rejected agent: " + e.getMessage()));
            }
        }

        for (int i = 0; i < futures.size(); i++) {
            AgentSpec spec = dispatched.get(i);
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                logger.warning("Agent " + spec.getRole() + " crashed: " + cause.getMessage());
                results.add(internalFailure(spec, "agent crashed: " + cause.getMessage()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                context.cancellation().cancel();
                results.add(internalFailure(spec, "interrupted while awaiting result"));
            }
        }
        return results;
    }

    private static Map<String, Object> contextFor(
            AgentSpec spec, ExecutionPlan plan, Map<String, AgentResult> byRole) {
        Map<String, Object> agentContext = new LinkedHashMap<>(plan.getInitialContext());
        for (String dependency : spec.getDependsOn()) {
            agentContext.put(dependency + "_output", byRole.get(dependency).output());
        }
        return agentContext;
    }

    private static AgentResult internalFailure(AgentSpec spec, String message) {
        return AgentResult.failed(
                spec, ErrorKind.INTERNAL, message, Map.of(), null, List.of(), List.of());
    }

    private static void settle(
            AgentResult result,
            Map<String, AgentResult> byAgentId,
            Map<String, AgentResult> byRole) {
        byAgentId.put(result.agentId(), result);
        byRole.put(result.role(), result);
    }
}
