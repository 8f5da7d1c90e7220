package com.anonrelay.mailbox;

import java.util.concurrent.CompletableFuture;

/**
 * A message paired with the private channel its single reply travels on.
 *
 * <p>The producer keeps {@link #reply()}; the consumer answers exactly once through
 * {@link #complete(Object)} or {@link #fail(Throwable)}.
 *
 * @param <P> payload type
 * @param <R> reply type
 */
public record Request<P, R>(P payload, CompletableFuture<R> replyTo) {

    public static <P, R> Request<P, R> of(P payload) {
        return new Request<>(payload, new CompletableFuture<>());
    }

    public Reply<R> reply() {
        return Reply.from(replyTo);
    }

    public void complete(R value) {
        replyTo.complete(value);
    }

    public void fail(Throwable error) {
        replyTo.completeExceptionally(error);
    }
}
