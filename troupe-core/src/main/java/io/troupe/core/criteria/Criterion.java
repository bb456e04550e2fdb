package io.troupe.core.criteria;

import java.util.Objects;

/**
 * One threshold an agent output must satisfy, e.g. {@code coverage_percent >= 80}.
 *
 * @param metric key looked up in the output payload, not null
 * @param comparator comparison applied as {@code actual <op> threshold}, not null
 * @param threshold threshold value
 */
public record Criterion(String metric, Comparator comparator, double threshold) {

    public Criterion {
        Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(comparator, "comparator must not be null");
    }

    public static Criterion of(String metric, String comparator, double threshold) {
        return new Criterion(metric, Comparator.parse(comparator), threshold);
    }

    @Override
    public String toString() {
        return metric + " " + comparator.symbol() + " " + threshold;
    }
}
