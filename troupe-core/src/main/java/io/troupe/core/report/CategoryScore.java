package io.troupe.core.report;

import java.util.List;
import java.util.Objects;

/**
 * Scored category of a report.
 *
 * @param name category name, not null
 * @param role role that fed the category, not null
 * @param rawValue the role's primary metric, or null when it could not be read
 * @param weight normalized weight; all weights of a report sum to 1
 * @param score clamped score, 0-100
 * @param passed whether {@code score >= passThreshold}
 * @param passThreshold minimum passing score
 * @param issues problems found for this category, never null
 */
public record CategoryScore(
        String name,
        String role,
        Double rawValue,
        double weight,
        double score,
        boolean passed,
        double passThreshold,
        List<String> issues) {

    public CategoryScore {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(role, "role must not be null");
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    /** Contribution of this category to the overall score. */
    public double weightedScore() {
        return weight * score;
    }
}
