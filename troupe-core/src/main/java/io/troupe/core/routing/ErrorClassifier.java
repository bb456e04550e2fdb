package io.troupe.core.routing;

import io.troupe.core.agent.AgentExecutionException;
import io.troupe.core.result.ErrorKind;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps exceptions raised while running an attempt to an {@link ErrorKind}.
 *
 * <p>Classified runtime exceptions keep their declared kind. Timeouts and I/O problems are
 * recoverable. Argument errors are invalid input. Everything else is an internal, fatal error:
 * an unknown failure is never retried on a more expensive tier.
 */
public final class ErrorClassifier {

    /**
     * Classifies a failure, unwrapping executor wrappers first.
     *
     * @param failure the exception, not null
     * @return classification, never null
     */
    public ErrorKind classify(Throwable failure) {
        Throwable error = unwrap(failure);
        if (error instanceof AgentExecutionException classified) {
            return classified.getKind();
        }
        if (error instanceof TimeoutException
                || error instanceof SocketTimeoutException
                || error instanceof InterruptedIOException) {
            return ErrorKind.TIMEOUT;
        }
        if (error instanceof ConnectException
                || error instanceof UnknownHostException
                || error instanceof IOException) {
            return ErrorKind.CONNECTION;
        }
        if (error instanceof IllegalArgumentException) {
            return ErrorKind.INVALID_INPUT;
        }
        return ErrorKind.INTERNAL;
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
