package io.troupe.core.role;

import java.util.Map;

/** Uses documented-API {@code coverage_percent} as the score. */
public class DocumentationRoleHandler implements RoleHandler {

    public static final String ROLE = "documentation";
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
        return "Document public APIs that lack docstrings or javadoc";
    }
}
