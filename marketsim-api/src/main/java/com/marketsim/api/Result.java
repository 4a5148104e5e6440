package com.marketsim.api;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a boundary operation: either a value, or an {@link ErrorCode}
 * with a message. Business failures travel as values, never as exceptions.
 *
 * @param <T> the success value type ({@link Void} for pure acknowledgements)
 */
public final class Result<T> {

    private final T value;
    private final ErrorCode error;
    private final String message;

    private Result(T value, ErrorCode error, String message) {
        this.value = value;
        this.error = error;
        this.message = message;
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(value, null, null);
    }

    public static Result<Void> ok() {
        return new Result<>(null, null, null);
    }

    public static <T> Result<T> error(ErrorCode code, String message) {
        return new Result<>(null, Objects.requireNonNull(code, "code"), message);
    }

    public boolean isOk() {
        return error == null;
    }

    /**
     * @throws IllegalStateException when this is an error result
     */
    public T value() {
        if (error != null) {
            throw new IllegalStateException("no value, result is " + error + ": " + message);
        }
        return value;
    }

    public ErrorCode error() {
        return error;
    }

    public String message() {
        return message;
    }

    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return new Result<>(null, error, message);
        }
        return new Result<>(mapper.apply(value), null, null);
    }

    @Override
    public String toString() {
        return isOk() ? "Ok(" + value + ")" : "Error(" + error + ": " + message + ")";
    }
}
