package io.troupe.core.report;

import java.util.Locale;

/** Report variant: a plain health score, or a health score plus release-readiness gates. */
public enum ReportKind {
    HEALTH,
    READINESS;

    public static ReportKind fromId(String id) {
        return valueOf(id.trim().toUpperCase(Locale.ROOT));
    }
}
