package io.troupe.core.criteria;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Thresholds an agent's output must meet to count as a pass.
 *
 * <p>Criteria are evaluated against the role-specific payload returned by the agent runtime.
 * Every criterion must hold. A metric that is missing from the payload or is not numeric fails
 * its criterion; nothing is assumed on the output's behalf. Empty criteria always pass.
 *
 * @param criteria ordered criteria, never null
 */
public record SuccessCriteria(List<Criterion> criteria) {

    private static final SuccessCriteria NONE = new SuccessCriteria(List.of());

    public SuccessCriteria {
        criteria = criteria != null ? List.copyOf(criteria) : List.of();
    }

    public static SuccessCriteria none() {
        return NONE;
    }

    public static SuccessCriteria of(Criterion... criteria) {
        return new SuccessCriteria(List.of(criteria));
    }

    public boolean isEmpty() {
        return criteria.isEmpty();
    }

    /**
     * Checks every criterion against the given payload.
     *
     * @param output agent output payload, not null
     * @return verdict listing each failed criterion, never null
     */
    public CriteriaVerdict evaluate(Map<String, Object> output) {
        if (criteria.isEmpty()) {
            return CriteriaVerdict.pass();
        }

        List<String> failures = new ArrayList<>();
        for (Criterion criterion : criteria) {
            Object raw = output.get(criterion.metric());
            if (!(raw instanceof Number number)) {
                failures.add(
                        criterion
                                + " (metric "
                                + (raw == null ? "missing" : "not numeric: " + raw)
                                + ")");
                continue;
            }
            double actual = number.doubleValue();
            if (!criterion.comparator().test(actual, criterion.threshold())) {
                failures.add(criterion + " (actual " + actual + ")");
            }
        }
        return failures.isEmpty() ? CriteriaVerdict.pass() : CriteriaVerdict.fail(failures);
    }
}
