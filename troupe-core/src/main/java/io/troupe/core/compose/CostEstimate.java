package io.troupe.core.compose;

import io.troupe.core.routing.TierStrategy;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Up-front cost estimate for a set of agents.
 *
 * @param total estimated total in USD
 * @param byStrategy estimated cost per tier strategy, only strategies in use
 * @param agentCount number of agents estimated
 */
public record CostEstimate(double total, Map<TierStrategy, Double> byStrategy, int agentCount) {

    public CostEstimate {
        byStrategy =
                byStrategy == null || byStrategy.isEmpty()
                        ? Map.of()
                        : Collections.unmodifiableMap(new EnumMap<>(byStrategy));
    }
}
