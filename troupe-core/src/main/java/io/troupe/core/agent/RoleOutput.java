package io.troupe.core.agent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Payload returned by the agent runtime for one successful call.
 *
 * <p>When the underlying tooling is missing, runtimes return a safe default payload flagged as
 * {@code degraded} with an explanatory warning instead of failing.
 *
 * @param payload role-specific raw metrics, never null
 * @param degraded whether the payload is a fallback default
 * @param warnings warnings reported by the runtime, never null
 * @param reportedCost cost in USD reported by the runtime, or null to use the tier default
 */
public record RoleOutput(
        Map<String, Object> payload, boolean degraded, List<String> warnings, Double reportedCost) {

    public RoleOutput {
        Objects.requireNonNull(payload, "payload must not be null");
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static RoleOutput of(Map<String, Object> payload) {
        return new RoleOutput(payload, false, List.of(), null);
    }

    public static RoleOutput of(Map<String, Object> payload, double cost) {
        return new RoleOutput(payload, false, List.of(), cost);
    }

    public static RoleOutput degraded(Map<String, Object> payload, String warning) {
        return new RoleOutput(payload, true, List.of(warning), null);
    }

    public OptionalDouble cost() {
        return reportedCost != null ? OptionalDouble.of(reportedCost) : OptionalDouble.empty();
    }
}
