package io.troupe.core.role;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Handler for roles without a dedicated scoring formula. Reads an optional {@code score}
 * field and treats a successful output without one as fully healthy.
 */
public class GenericRoleHandler implements RoleHandler {

    static final String SCORE = "score";

    private final String role;

    public GenericRoleHandler(String role) {
        this.role = Objects.requireNonNull(role, "role must not be null");
    }

    @Override
    public String role() {
        return role;
    }

    @Override
    public String primaryMetric() {
        return SCORE;
    }

    @Override
    public double score(Map<String, Object> output) throws AggregationDataException {
        Object raw = output.get(SCORE);
        if (raw == null) {
            return 100.0;
        }
        OptionalDouble value = OutputMetrics.optional(output, SCORE);
        if (value.isEmpty()) {
            throw new AggregationDataException(
                    "output of " + role + " has non-numeric 'score': " + raw);
        }
        return value.getAsDouble();
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
