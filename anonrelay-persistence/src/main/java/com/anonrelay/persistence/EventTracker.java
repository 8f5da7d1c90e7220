package com.anonrelay.persistence;

import com.anonrelay.mailbox.Reply;

/**
 * Durability handle for one write request. Await it before any externally visible
 * step that depends on the events having reached the log.
 */
public final class EventTracker {

    private final Reply<Void> reply;

    EventTracker(Reply<Void> reply) {
        this.reply = reply;
    }

    /**
     * Blocks until the events are durable.
     *
     * @throws PersistenceException if the batch holding these events failed
     */
    public void awaitWritten() {
        reply.await().getOrThrow();
    }

    public boolean isDone() {
        return reply.isDone();
    }

    /**
     * @return true once the write is known to have failed
     */
    public boolean hasFailed() {
        return reply.isDone() && !reply.await().isSuccess();
    }

    static EventTracker completed() {
        return new EventTracker(Reply.completed(null));
    }
}
