package io.troupe.core.compose;

import java.io.Serial;

/**
 * Raised when a single composition rule cannot produce an agent.
 *
 * <p>The composer catches it per rule and records a {@link SkippedRule}; it never aborts the
 * whole composition.
 */
public class CompositionException extends Exception {

    @Serial private static final long serialVersionUID = 4127731093301817560L;

    private final String role;

    public CompositionException(String role, String message) {
        super(message);
        this.role = role;
    }

    public CompositionException(String role, String message, Throwable cause) {
        super(message, cause);
        this.role = role;
    }

    public String getRole() {
        return role;
    }
}
