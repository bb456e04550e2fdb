package io.troupe.core.execution;

import io.troupe.core.agent.AgentSpec;
import io.troupe.core.result.ErrorKind;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs agents strictly in plan order on the calling thread.
 *
 * <p>After each successful agent its output is merged into the running context as {@code
 * <role>_output}, so agent N+1 always sees agent N's final output. An agent whose declared
 * dependency is absent, has not run yet, or did not succeed is skipped with {@code
 * DEPENDENCY_UNMET} instead of being attempted.
 */
public class SequentialStrategy implements ExecutionStrategy {

    @Override
    public StrategyType type() {
        return StrategyType.SEQUENTIAL;
    }

    @Override
    public StrategyResult execute(ExecutionPlan plan, StrategyContext context) {
        Map<String, Object> runningContext = new LinkedHashMap<>(plan.getInitialContext());
        Map<String, AgentResult> byRole = new HashMap<>();
        List<AgentResult> results = new ArrayList<>();

        for (AgentSpec spec : plan.getSpecs()) {
            AgentResult result;
            if (context.cancellation().isCancelled()) {
                result = context.skip(spec, ErrorKind.CANCELLED, "plan cancelled before start");
            } else {
                List<String> unmet =
                        spec.getDependsOn().stream()
                                .filter(
                                        dep ->
                                                !byRole.containsKey(dep)
                                                        || !byRole.get(dep).isSuccess())
                                .toList();
                if (!unmet.isEmpty()) {
                    result =
                            context.skip(
                                    spec, ErrorKind.DEPENDENCY_UNMET, "dependency unmet: " + unmet);
                } else {
                    result = context.run(spec, runningContext, true);
                    if (result.isSuccess()) {
                        runningContext.put(spec.getRole() + "_output", result.output());
                    }
                }
            }
            byRole.put(spec.getRole(), result);
            results.add(result);
        }
        return new StrategyResult(results, results.isEmpty() ? 0 : 1);
    }
}
