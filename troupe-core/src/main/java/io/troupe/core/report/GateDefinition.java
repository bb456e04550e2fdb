package io.troupe.core.report;

import io.troupe.core.criteria.Comparator;
import java.util.Objects;

/**
 * Quality gate of a category: a raw metric of the category's agent compared to a threshold.
 *
 * @param metric output key read through the role handler, not null
 * @param threshold threshold value
 * @param comparator comparison, not null
 * @param critical whether a failure blocks release rather than warning
 */
public record GateDefinition(
        String metric, double threshold, Comparator comparator, boolean critical) {

    public GateDefinition {
        Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(comparator, "comparator must not be null");
    }

    public static GateDefinition critical(String metric, String op, double threshold) {
        return new GateDefinition(metric, threshold, Comparator.parse(op), true);
    }

    public static GateDefinition advisory(String metric, String op, double threshold) {
        return new GateDefinition(metric, threshold, Comparator.parse(op), false);
    }

    @Override
    public String toString() {
        return metric + " " + comparator.symbol() + " " + threshold;
    }
}
