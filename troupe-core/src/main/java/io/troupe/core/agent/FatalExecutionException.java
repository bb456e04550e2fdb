package io.troupe.core.agent;

import io.troupe.core.result.ErrorKind;
import java.io.Serial;

/** Invalid input or configuration; the agent fails immediately without escalation. */
public class FatalExecutionException extends AgentExecutionException {
    @Serial private static final long serialVersionUID = 2939185016601786021L;

    public FatalExecutionException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public FatalExecutionException(ErrorKind kind, String message, Throwable cause) {
        super(requireFatal(kind), message, cause);
    }

    private static ErrorKind requireFatal(ErrorKind kind) {
        if (kind == null || !kind.isFatal()) {
            throw new IllegalArgumentException("Not a fatal error kind: " + kind);
        }
        return kind;
    }
}
