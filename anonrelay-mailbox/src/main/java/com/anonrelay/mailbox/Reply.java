package com.anonrelay.mailbox;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Handle for exactly one reply to a request.
 *
 * <p>The same abstraction answers owner commands, peer actions and log durability.
 * Failures never escape as exceptions from {@link #await()}; they come back as a
 * {@link Result.Failure}.
 */
public interface Reply<T> {

    /**
     * Blocks until the reply is available and returns a Result.
     */
    Result<T> await();

    /**
     * Blocks until the reply is available or timeout expires.
     * Returns a failed Result carrying a TimeoutException on timeout.
     */
    Result<T> await(Duration timeout);

    /**
     * @return true once the reply has arrived, successfully or not
     */
    boolean isDone();

    static <T> Reply<T> from(CompletableFuture<T> future) {
        return new PendingReply<>(future);
    }

    /**
     * Create an already-completed successful Reply.
     */
    static <T> Reply<T> completed(T value) {
        return new PendingReply<>(CompletableFuture.completedFuture(value));
    }
}
