package io.troupe.core.execution;

/** Completion state of an execution plan. */
public enum PlanStatus {
    /** Every agent settled normally. */
    COMPLETED,
    /** Cancelled; unstarted agents were recorded as skipped. */
    PARTIAL
}
