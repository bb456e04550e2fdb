package io.troupe.core.role;

import java.io.Serial;

/**
 * Raised when an agent output lacks a field a role handler needs, or carries it in the wrong
 * shape. The aggregator scores the affected category as zero and records an issue.
 */
public class AggregationDataException extends Exception {
    @Serial private static final long serialVersionUID = 6027389173492219740L;

    public AggregationDataException(String message) {
        super(message);
    }
}
