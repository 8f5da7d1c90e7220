package com.anonrelay.mailbox;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Request/Reply pair and the Result it resolves to.
 */
class ReplyTest {

    @Test
    void awaitReturnsSuccess() {
        Request<String, Integer> request = Request.of("length");
        request.complete(6);

        Result<Integer> result = request.reply().await();

        assertTrue(result.isSuccess());
        assertEquals(6, result.getOrThrow());
    }

    @Test
    void completedReplyIsImmediatelyDone() {
        Reply<String> reply = Reply.completed("ok");

        assertTrue(reply.isDone());
        assertEquals("ok", reply.await(Duration.ZERO).getOrThrow());
    }

    @Test
    void awaitUnwrapsFailureCause() {
        Request<String, String> request = Request.of("parse");
        IllegalArgumentException cause = new IllegalArgumentException("bad input");
        request.fail(cause);

        Result<String> result = request.reply().await();

        assertFalse(result.isSuccess());
        assertInstanceOf(Result.Failure.class, result);
        assertSame(cause, ((Result.Failure<String>) result).error());
        assertSame(cause, assertThrows(IllegalArgumentException.class, result::getOrThrow));
    }

    @Test
    void checkedFailureIsWrappedOnGetOrThrow() {
        Request<String, Void> request = Request.of("boom");
        Exception cause = new Exception("checked");
        request.fail(cause);

        ReplyException e = assertThrows(ReplyException.class, () -> request.reply().await().getOrThrow());
        assertSame(cause, e.getCause());
    }

    @Test
    void awaitWithTimeoutYieldsTimeoutFailure() {
        Result<String> result = Reply.from(new CompletableFuture<String>()).await(Duration.ofMillis(20));

        AtomicReference<Throwable> seen = new AtomicReference<>();
        result.ifFailure(seen::set);
        assertInstanceOf(TimeoutException.class, seen.get());
        assertThrows(ReplyException.class, result::getOrThrow);
    }

    @Test
    void awaitWithTimeoutReturnsFailureThatArrivesInTime() {
        Request<String, String> request = Request.of("late");
        IllegalStateException cause = new IllegalStateException("rejected");
        request.fail(cause);

        Result<String> result = request.reply().await(Duration.ofSeconds(1));

        assertSame(cause, ((Result.Failure<String>) result).error());
    }

    @Test
    void isDoneTracksCompletion() {
        Request<String, String> request = Request.of("ping");
        assertFalse(request.reply().isDone());
        request.complete("pong");
        assertTrue(request.reply().isDone());
    }
}
