package io.troupe.core.role;

import java.util.List;
import java.util.Map;

/**
 * Role-specific interpretation of an agent's output.
 *
 * <p>One implementation exists per known role and is registered in a {@link RoleRegistry} at
 * startup. The composer refuses rules whose role has no handler, and the aggregator uses the
 * handler to map raw metrics to a 0-100 category score and to read quality gate values.
 *
 * <h2>Contracts</h2>
 *
 * <ul>
 *   <li><b>Monotonicity</b>: more or more severe findings never produce a higher score
 *   <li><b>Purity</b>: implementations are stateless and thread-safe
 *   <li>Scores may fall outside 0-100; the aggregator clamps them
 * </ul>
 */
public interface RoleHandler {

    /**
     * Returns the role name this handler serves.
     *
     * @return role name, never null
     */
    String role();

    /**
     * Returns the output key reported as the category's raw value.
     *
     * @return metric key, never null
     */
    String primaryMetric();

    /**
     * Maps the output to a score.
     *
     * @param output successful agent output, not null
     * @return unclamped score, nominally 0-100
     * @throws AggregationDataException if required fields are missing or malformed
     */
    double score(Map<String, Object> output) throws AggregationDataException;

    /**
     * Reads a raw metric, typically for a quality gate.
     *
     * @param output successful agent output, not null
     * @param metric metric key, not null
     * @return metric value
     * @throws AggregationDataException if the metric is missing or malformed
     */
    default double metric(Map<String, Object> output, String metric)
            throws AggregationDataException {
        return OutputMetrics.require(role(), output, metric);
    }

    /**
     * Returns issues worth surfacing from the output. The default reads an optional {@code
     * "issues"} list.
     *
     * @param output successful agent output, not null
     * @return issue descriptions, never null
     */
    default List<String> issues(Map<String, Object> output) {
        return OutputMetrics.strings(output, "issues");
    }

    /**
     * Suggests an action for a category that did not pass.
     *
     * @param category category name, not null
     * @param score category score
     * @return recommendation text, never null
     */
    default String recommendation(String category, double score) {
        return "Improve " + category + " (score " + String.format("%.1f", score) + ")";
    }
}
