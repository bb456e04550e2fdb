package io.troupe.core.criteria;

import java.util.Arrays;

/**
 * Threshold comparison used by success criteria and quality gates.
 *
 * <p>Each constant carries its conventional symbol so declarative templates can write {@code
 * ">="} instead of {@code GTE}.
 */
public enum Comparator {
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<="),
    EQ("==");

    private static final double EQ_TOLERANCE = 1e-9;

    private final String symbol;

    Comparator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Tests {@code actual <op> threshold}.
     *
     * @param actual measured value
     * @param threshold configured threshold
     * @return {@code true} if the comparison holds
     */
    public boolean test(double actual, double threshold) {
        switch (this) {
            case GT:
                return actual > threshold;
            case GTE:
                return actual >= threshold;
            case LT:
                return actual < threshold;
            case LTE:
                return actual <= threshold;
            case EQ:
                return Math.abs(actual - threshold) <= EQ_TOLERANCE;
            default:
                throw new IllegalStateException("Unhandled comparator: " + this);
        }
    }

    /**
     * Resolves a comparator from either its symbol ({@code ">="}) or its name ({@code "GTE"}).
     *
     * @param value symbol or constant name, not null
     * @return matching comparator, never null
     * @throws IllegalArgumentException if nothing matches
     */
    public static Comparator parse(String value) {
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(c -> c.symbol.equals(trimmed) || c.name().equalsIgnoreCase(trimmed))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown comparator: " + value));
    }
}
