package io.troupe.core.compose;

import java.util.Objects;

/**
 * A rule that produced no agent, with the reason.
 *
 * @param role rule role, not null
 * @param reason human-readable reason, not null
 */
public record SkippedRule(String role, String reason) {

    public static final String CONDITION_NOT_MET = "condition not met";

    public SkippedRule {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }
}
