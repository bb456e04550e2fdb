package io.troupe.core.role;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Scores security findings by severity.
 *
 * <p>{@code score = 100 - 25*critical - 15*high - 5*medium - 1*low}. At least one severity
 * count must be present; missing counts are read as zero.
 */
public class SecurityRoleHandler implements RoleHandler {

    public static final String ROLE = "security";

    static final String CRITICAL = "critical_issues";
    static final String HIGH = "high_issues";
    static final String MEDIUM = "medium_issues";
    static final String LOW = "low_issues";

    @Override
    public String role() {
        return ROLE;
    }

    @Override
    public String primaryMetric() {
        return CRITICAL;
    }

    @Override
    public double score(Map<String, Object> output) throws AggregationDataException {
        requireAnyCount(output);
        return 100.0
                - 25.0 * count(output, CRITICAL)
                - 15.0 * count(output, HIGH)
                - 5.0 * count(output, MEDIUM)
                - count(output, LOW);
    }

    @Override
    public double metric(Map<String, Object> output, String metric)
            throws AggregationDataException {
        if (CRITICAL.equals(metric) || HIGH.equals(metric)
                || MEDIUM.equals(metric) || LOW.equals(metric)) {
            requireAnyCount(output);
            return count(output, metric);
        }
        return RoleHandler.super.metric(output, metric);
    }

    @Override
    public List<String> issues(Map<String, Object> output) {
        List<String> issues = new ArrayList<>(RoleHandler.super.issues(output));
        long critical = Math.round(count(output, CRITICAL));
        long high = Math.round(count(output, HIGH));
        if (critical > 0) {
            issues.add(critical + " critical security issue(s)");
        }
        if (high > 0) {
            issues.add(high + " high severity security issue(s)");
        }
        return issues;
    }

    @Override
    public String recommendation(String category, double score) {
        return "Fix critical and high severity security findings before release";
    }

    private static void requireAnyCount(Map<String, Object> output)
            throws AggregationDataException {
        if (!output.containsKey(CRITICAL) && !output.containsKey(HIGH)
                && !output.containsKey(MEDIUM) && !output.containsKey(LOW)) {
            throw new AggregationDataException("output of " + ROLE + " has no severity counts");
        }
        for (String key : List.of(CRITICAL, HIGH, MEDIUM, LOW)) {
            Object raw = output.get(key);
            if (raw != null && !(raw instanceof Number)) {
                throw new AggregationDataException(
                        "output of " + ROLE + " has non-numeric '" + key + "': " + raw);
            }
        }
    }

    private static double count(Map<String, Object> output, String key) {
        OptionalDouble value = OutputMetrics.optional(output, key);
        return value.isPresent() ? Math.max(0.0, value.getAsDouble()) : 0.0;
    }
}
