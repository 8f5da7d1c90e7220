package com.anonrelay.mailbox;

import java.util.function.Consumer;

/**
 * Result type for explicit error handling.
 * Sealed to ensure only success and failure exist.
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    /**
     * Successful result containing a value.
     */
    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }
    }

    /**
     * Failed result containing an error.
     */
    record Failure<T>(Throwable error) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrThrow() {
            if (error instanceof RuntimeException) {
                throw (RuntimeException) error;
            }
            if (error instanceof Error) {
                throw (Error) error;
            }
            throw new ReplyException("Reply failed", error);
        }
    }

    boolean isSuccess();

    /**
     * Returns the value, or rethrows the failure. Runtime exceptions and errors are
     * rethrown as they are; checked ones are wrapped in a {@link ReplyException}.
     */
    T getOrThrow();

    default void ifFailure(Consumer<Throwable> consumer) {
        if (this instanceof Failure) {
            consumer.accept(((Failure<T>) this).error());
        }
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Throwable error) {
        return new Failure<>(error);
    }
}
