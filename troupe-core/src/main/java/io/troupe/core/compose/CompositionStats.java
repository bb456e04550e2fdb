package io.troupe.core.compose;

/**
 * Rule counts of one or more compositions.
 *
 * <p>Always satisfies {@code rulesSkipped + agentsCreated == rulesEvaluated}.
 *
 * @param rulesEvaluated rules looked at
 * @param agentsCreated rules that produced an agent
 * @param rulesSkipped rules that produced none
 */
public record CompositionStats(int rulesEvaluated, int agentsCreated, int rulesSkipped) {

    public static final CompositionStats EMPTY = new CompositionStats(0, 0, 0);

    public CompositionStats {
        if (rulesEvaluated < 0 || agentsCreated < 0 || rulesSkipped < 0) {
            throw new IllegalArgumentException("Counts must not be negative");
        }
        if (agentsCreated + rulesSkipped != rulesEvaluated) {
            throw new IllegalArgumentException(
                    "agentsCreated + rulesSkipped must equal rulesEvaluated");
        }
    }

    public CompositionStats plus(CompositionStats other) {
        return new CompositionStats(
                rulesEvaluated + other.rulesEvaluated,
                agentsCreated + other.agentsCreated,
                rulesSkipped + other.rulesSkipped);
    }
}
