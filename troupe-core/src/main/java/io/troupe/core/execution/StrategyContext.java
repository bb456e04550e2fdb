package io.troupe.core.execution;

import io.troupe.core.agent.AgentSpec;
import io.troupe.core.result.ErrorKind;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.logging.Logger;

/**
 * Resources a strategy needs for one plan execution.
 *
 * @param agentExecutor runs single agents over the tier ladder
 * @param workers pool for concurrently running agents; owned by the environment
 * @param maxWorkers maximum agents in flight at once for this plan
 * @param maxRefinementRounds round bound for the refinement loop
 * @param listener event listener, failure-isolated
 * @param cancellation plan cancellation signal
 */
public record StrategyContext(
        AgentExecutor agentExecutor,
        ExecutorService workers,
        int maxWorkers,
        int maxRefinementRounds,
        ExecutionListener listener,
        CancellationToken cancellation) {

    private static final Logger logger = Logger.getLogger(StrategyContext.class.getName());

    /**
     * Runs one agent. A crash is confined to that agent and reported as an {@code INTERNAL}
     * failure, so results already settled for other agents survive.
     *
     * @param spec agent to run, not null
     * @param agentContext context visible to the agent, not null
     * @param enforceCriteria whether the spec's success criteria decide success
     * @return the agent's result, never null
     */
    AgentResult run(AgentSpec spec, Map<String, Object> agentContext, boolean enforceCriteria) {
        try {
            return agentExecutor.execute(
                    spec, agentContext, listener, cancellation, enforceCriteria);
        } catch (RuntimeException e) {
            logger.warning("Agent " + spec.getRole() + " crashed: " + e);
            AgentResult result =
                    AgentResult.failed(
                            spec,
                            ErrorKind.INTERNAL,
                            "agent crashed: " + e.getMessage(),
                            Map.of(),
                            null,
                            List.of(),
                            List.of());
            listener.onAgentComplete(spec, result);
            return result;
        }
    }

    /** Records a synthesized skip for an agent that will not be attempted. */
    AgentResult skip(AgentSpec spec, ErrorKind kind, String message) {
        AgentResult result = AgentResult.skipped(spec, kind, message);
        listener.onAgentComplete(spec, result);
        return result;
    }
}
