package io.troupe.core.role;

import java.util.Map;

/** Scales a 0-10 {@code quality_score} to 0-100. */
public class QualityRoleHandler implements RoleHandler {

    public static final String ROLE = "quality";
    static final String QUALITY = "quality_score";

    @Override
    public String role() {
        return ROLE;
    }

    @Override
    public String primaryMetric() {
        return QUALITY;
    }

    @Override
    public double score(Map<String, Object> output) throws AggregationDataException {
        double quality = OutputMetrics.require(ROLE, output, QUALITY);
        if (quality < 0.0 || quality > 10.0) {
            throw new AggregationDataException(
                    "output of " + ROLE + " has quality_score outside 0-10: " + quality);
        }
        return quality * 10.0;
    }

    @Override
    public String recommendation(String category, double score) {
        return "Address lint and type-check findings to lift code quality";
    }
}
