package io.troupe.core.agent;

import io.troupe.core.result.ErrorKind;
import java.io.Serial;

/** Timeout, connection, rate-limit or availability failure; drives fallback and escalation. */
public class RecoverableExecutionException extends AgentExecutionException {
    @Serial private static final long serialVersionUID = -6190271722379958310L;

    public RecoverableExecutionException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public RecoverableExecutionException(ErrorKind kind, String message, Throwable cause) {
        super(requireRecoverable(kind), message, cause);
    }

    private static ErrorKind requireRecoverable(ErrorKind kind) {
        if (kind == null || !kind.isRecoverable()) {
            throw new IllegalArgumentException("Not a recoverable error kind: " + kind);
        }
        return kind;
    }
}
