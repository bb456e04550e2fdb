package io.troupe.core.execution;

import java.util.List;

/**
 * What a strategy hands back to the scheduler.
 *
 * @param results settled results, one per spec
 * @param rounds rounds used; only the refinement strategy runs more than one
 */
public record StrategyResult(List<AgentResult> results, int rounds) {

    public StrategyResult {
        results = List.copyOf(results);
    }
}
