package io.troupe.core.role;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Uses {@code performance_score} when reported, otherwise derives a score from bottleneck
 * counts: {@code 100 - 20*critical_bottlenecks - 5*bottlenecks}.
 */
public class PerformanceRoleHandler implements RoleHandler {

    public static final String ROLE = "performance";
    static final String SCORE = "performance_score";
    static final String CRITICAL_BOTTLENECKS = "critical_bottlenecks";
    static final String BOTTLENECKS = "bottlenecks";

    @Override
    public String role() {
        return ROLE;
    }

    @Override
    public String primaryMetric() {
        return SCORE;
    }

    @Override
    public double score(Map<String, Object> output) throws AggregationDataException {
        OptionalDouble direct = OutputMetrics.optional(output, SCORE);
        if (direct.isPresent()) {
            return direct.getAsDouble();
        }
        OptionalDouble critical = OutputMetrics.optional(output, CRITICAL_BOTTLENECKS);
        OptionalDouble regular = OutputMetrics.optional(output, BOTTLENECKS);
        if (critical.isEmpty() && regular.isEmpty()) {
            throw new AggregationDataException(
                    "output of " + ROLE + " has neither a score nor bottleneck counts");
        }
        return 100.0 - 20.0 * critical.orElse(0.0) - 5.0 * regular.orElse(0.0);
    }

    @Override
    public double metric(Map<String, Object> output, String metric)
            throws AggregationDataException {
        if (SCORE.equals(metric)) {
            return score(output);
        }
        return RoleHandler.super.metric(output, metric);
    }
}
