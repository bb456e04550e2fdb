package io.troupe.core.role;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/** Typed reads from an agent output payload. */
public final class OutputMetrics {

    private OutputMetrics() {}

    /**
     * Reads a required numeric field.
     *
     * @param role role whose output is read, for error messages
     * @param output payload, not null
     * @param key field name, not null
     * @return the value as double
     * @throws AggregationDataException if the field is absent, not numeric, or not finite
     */
    public static double require(String role, Map<String, Object> output, String key)
            throws AggregationDataException {
        Object raw = output.get(key);
        if (raw == null) {
            throw new AggregationDataException(
                    "output of " + role + " is missing '" + key + "'");
        }
        if (!(raw instanceof Number number)) {
            throw new AggregationDataException(
                    "output of " + role + " has non-numeric '" + key + "': " + raw);
        }
        double value = number.doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new AggregationDataException(
                    "output of " + role + " has non-finite '" + key + "'");
        }
        return value;
    }

    /**
     * Reads an optional numeric field.
     *
     * @param output payload, not null
     * @param key field name, not null
     * @return the value, or empty when absent or not numeric
     */
    public static OptionalDouble optional(Map<String, Object> output, String key) {
        Object raw = output.get(key);
        if (raw instanceof Number number && Double.isFinite(number.doubleValue())) {
            return OptionalDouble.of(number.doubleValue());
        }
        return OptionalDouble.empty();
    }

    /**
     * Reads an optional list of strings; non-list values yield an empty list.
     *
     * @param output payload, not null
     * @param key field name, not null
     * @return the strings, never null
     */
    public static List<String> strings(Map<String, Object> output, String key) {
        Object raw = output.get(key);
        if (raw instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
