package io.troupe.core.report;

import java.util.List;
import java.util.Objects;

/**
 * Release-readiness verdict.
 *
 * @param ready whether every gate passed
 * @param confidence trust in the verdict, not null
 * @param blockers failed critical gates and failed agents, never null
 * @param warnings failed non-critical gates, never null
 */
public record Readiness(
        boolean ready, Confidence confidence, List<String> blockers, List<String> warnings) {

    public Readiness {
        Objects.requireNonNull(confidence, "confidence must not be null");
        blockers = blockers != null ? List.copyOf(blockers) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
