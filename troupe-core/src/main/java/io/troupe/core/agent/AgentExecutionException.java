package io.troupe.core.agent;

import io.troupe.core.result.ErrorKind;
import java.io.Serial;
import java.util.Objects;

/**
 * Classified failure raised by an {@link AgentRuntime}.
 *
 * @see RecoverableExecutionException
 * @see FatalExecutionException
 */
public abstract class AgentExecutionException extends Exception {
    @Serial private static final long serialVersionUID = 4417752840151932906L;

    private final ErrorKind kind;

    protected AgentExecutionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ErrorKind getKind() {
        return kind;
    }
}
