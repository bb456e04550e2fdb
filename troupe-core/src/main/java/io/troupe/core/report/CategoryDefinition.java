package io.troupe.core.report;

import java.util.Objects;
import java.util.Optional;

/**
 * One scored category of a report.
 *
 * @param name category name, not null
 * @param role role whose result feeds the category, not null
 * @param weight relative weight, at least 0; weights are renormalized per report
 * @param passThreshold minimum score for the category to count as passing
 * @param gate readiness gate, empty to gate on {@code score >= passThreshold}
 */
public record CategoryDefinition(
        String name,
        String role,
        double weight,
        double passThreshold,
        Optional<GateDefinition> gate) {

    public static final double DEFAULT_PASS_THRESHOLD = 70.0;

    public CategoryDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(role, "role must not be null");
        gate = gate != null ? gate : Optional.empty();
        if (weight < 0 || Double.isNaN(weight)) {
            throw new IllegalArgumentException("weight must not be negative: " + name);
        }
    }

    /** Category named after its role, with the default pass threshold and no gate. */
    public static CategoryDefinition of(String role, double weight) {
        return new CategoryDefinition(
                role, role, weight, DEFAULT_PASS_THRESHOLD, Optional.empty());
    }

    public CategoryDefinition withPassThreshold(double threshold) {
        return new CategoryDefinition(name, role, weight, threshold, gate);
    }

    public CategoryDefinition withGate(GateDefinition definition) {
        return new CategoryDefinition(name, role, weight, passThreshold, Optional.of(definition));
    }
}
