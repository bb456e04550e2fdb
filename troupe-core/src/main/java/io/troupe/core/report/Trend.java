package io.troupe.core.report;

/** Direction of the overall score relative to the previous report for the same template. */
public enum Trend {
    IMPROVING,
    DECLINING,
    STABLE,
    /** No previous score to compare against. */
    BASELINE;

    /**
     * Classifies the change from {@code previous} to {@code current}.
     *
     * @param current current overall score
     * @param previous previous overall score, or null when there is none
     * @param epsilon smallest change that counts as movement, at least 0
     * @return trend, never null
     */
    public static Trend classify(double current, Double previous, double epsilon) {
        if (previous == null) {
            return BASELINE;
        }
        double delta = current - previous;
        if (delta > epsilon) {
            return IMPROVING;
        }
        if (delta < -epsilon) {
            return DECLINING;
        }
        return STABLE;
    }
}
