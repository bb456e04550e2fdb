package io.troupe.core.result;

import java.util.Objects;

/**
 * Structured failure carried by {@link Result.Err}.
 *
 * @param kind classification of the failure, not null
 * @param message human-readable description, not null
 */
public record EngineError(ErrorKind kind, String message) {

    public EngineError {
        Objects.requireNonNull(kind, "kind must not be null");
        message = message != null ? message : kind.name();
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
