package io.troupe.core.report;

import io.troupe.core.criteria.Comparator;
import java.util.Objects;

/**
 * Evaluated readiness gate.
 *
 * @param name category name, not null
 * @param metric metric compared, not null
 * @param actual raw value read from the agent output, or null when unavailable
 * @param threshold threshold value
 * @param comparator comparison, not null
 * @param passed whether the gate passed; always false when {@code actual} is null
 * @param critical whether a failure blocks release
 * @param margin normalized distance from the threshold, negative when failed
 * @param message human-readable outcome, not null
 */
public record QualityGate(
        String name,
        String metric,
        Double actual,
        double threshold,
        Comparator comparator,
        boolean passed,
        boolean critical,
        double margin,
        String message) {

    public QualityGate {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(comparator, "comparator must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }
}
