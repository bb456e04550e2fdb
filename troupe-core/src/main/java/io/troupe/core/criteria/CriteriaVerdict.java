package io.troupe.core.criteria;

import java.util.List;

/**
 * Result of checking an output against {@link SuccessCriteria}.
 *
 * @param passed whether every criterion held
 * @param failures one human-readable line per failed criterion, empty when passed
 */
public record CriteriaVerdict(boolean passed, List<String> failures) {

    private static final CriteriaVerdict PASS = new CriteriaVerdict(true, List.of());

    public CriteriaVerdict {
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public static CriteriaVerdict pass() {
        return PASS;
    }

    public static CriteriaVerdict fail(List<String> failures) {
        return new CriteriaVerdict(false, failures);
    }

    /** Joins the failure lines for log and error messages. */
    public String summary() {
        return passed ? "all criteria met" : String.join("; ", failures);
    }
}
