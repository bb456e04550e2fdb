package io.troupe.core.execution;

/** Final state of one agent after a plan completes. */
public enum AgentStatus {
    SUCCEEDED,
    /** Attempted and failed: exhausted, fatal error, or criteria not met. */
    FAILED,
    /** Never attempted: dependency unmet or plan cancelled. */
    SKIPPED
}
