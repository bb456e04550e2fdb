package io.troupe.core.role;

import java.util.Map;

/** Uses {@code coverage_percent} directly as the score. */
public class CoverageRoleHandler implements RoleHandler {

    public static final String ROLE = "coverage";
    static final String COVERAGE = "coverage_percent";

    @Override
    public String role() {
        return ROLE;
    }

    @Override
    public String primaryMetric() {
        return COVERAGE;
    }

    @Override
    public double score(Map<String, Object> output) throws AggregationDataException {
        return OutputMetrics.require(ROLE, output, COVERAGE);
    }

    @Override
    public String recommendation(String category, double score) {
        return "Add tests to raise coverage above the current " + String.format("%.1f%%", score);
    }
}
