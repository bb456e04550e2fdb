package io.troupe.core.result;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a scheduler or aggregator entry point: either a value or a structured error.
 *
 * <p>Component boundaries return a {@code Result} instead of letting exceptions escape. Only
 * template-loading problems are raised as exceptions, and they surface before an execution
 * starts.
 *
 * <pre>{@code
 * Result<Report> result = aggregator.aggregate(results, categories, previous, kind);
 * if (result instanceof Result.Err<Report> err) {
 *     logger.warning("Aggregation failed: " + err.error());
 * }
 * }</pre>
 *
 * @param <T> type of the success value
 */
public sealed interface Result<T> permits Result.Ok, Result.Err {

    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> err(ErrorKind kind, String message) {
        return new Err<>(new EngineError(kind, message));
    }

    static <T> Result<T> err(EngineError error) {
        return new Err<>(error);
    }

    /**
     * Returns whether this result carries a value.
     *
     * @return {@code true} for {@link Ok}
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * Returns the value if present.
     *
     * @return the value, or empty for an error
     */
    default Optional<T> toOptional() {
        if (this instanceof Ok<T> ok) {
            return Optional.of(ok.value());
        }
        return Optional.empty();
    }

    /**
     * Returns the error if present.
     *
     * @return the error, or empty for a value
     */
    default Optional<EngineError> toError() {
        if (this instanceof Err<T> err) {
            return Optional.of(err.error());
        }
        return Optional.empty();
    }

    /**
     * Transforms the value, passing errors through untouched.
     *
     * @param mapper function applied to the value, not null
     * @param <R> new value type
     * @return mapped result, never null
     */
    default <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper must not be null");
        if (this instanceof Ok<T> ok) {
            return new Ok<>(mapper.apply(ok.value()));
        }
        return new Err<>(((Err<T>) this).error());
    }

    /**
     * Returns the value or throws.
     *
     * @return the value, never null
     * @throws IllegalStateException if this is an error
     */
    default T orElseThrow() {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        throw new IllegalStateException("Result is an error: " + ((Err<T>) this).error());
    }

    /** Successful result. */
    record Ok<T>(T value) implements Result<T> {
        public Ok {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** Failed result. */
    record Err<T>(EngineError error) implements Result<T> {
        public Err {
            Objects.requireNonNull(error, "error must not be null");
        }
    }
}
