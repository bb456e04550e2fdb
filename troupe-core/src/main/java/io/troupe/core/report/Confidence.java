package io.troupe.core.report;

/** How far a readiness verdict can be trusted. */
public enum Confidence {
    HIGH,
    MEDIUM,
    LOW
}
