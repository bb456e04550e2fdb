package io.troupe.core.execution;

import java.util.Locale;

/** Concurrency pattern used to run a set of agents. */
public enum StrategyType {
    PARALLEL,
    SEQUENTIAL,
    REFINEMENT;

    public static StrategyType fromId(String id) {
        return valueOf(id.trim().toUpperCase(Locale.ROOT));
    }
}
