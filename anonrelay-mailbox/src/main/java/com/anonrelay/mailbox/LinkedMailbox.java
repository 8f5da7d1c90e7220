package com.anonrelay.mailbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Default mailbox implementation using LinkedBlockingQueue.
 *
 * <p>A mailbox may be attached to a {@link Doorbell}. Every successful enqueue and the
 * close call ring it, which lets one consumer wait on several mailboxes at once.
 *
 * @param <T> The type of messages
 */
public class LinkedMailbox<T> implements Mailbox<T> {
    private static final Logger logger = LoggerFactory.getLogger(LinkedMailbox.class);

    private static final long PUT_RECHECK_MS = 50;

    private final LinkedBlockingQueue<T> queue;
    private final Doorbell doorbell;
    private volatile boolean closed;

    /**
     * Creates an unbounded mailbox with no doorbell.
     */
    public LinkedMailbox() {
        this(Integer.MAX_VALUE, null);
    }

    /**
     * Creates a bounded mailbox with the specified capacity and no doorbell.
     *
     * @param capacity the maximum number of messages
     */
    public LinkedMailbox(int capacity) {
        this(capacity, null);
    }

    /**
     * Creates a bounded mailbox that rings the given doorbell on every enqueue.
     *
     * @param capacity the maximum number of messages
     * @param doorbell the doorbell to ring, or null
     */
    public LinkedMailbox(int capacity, Doorbell doorbell) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Mailbox capacity must be positive");
        }
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.doorbell = doorbell;
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        ensureOpen();
        boolean added = queue.offer(message);
        if (added) {
            ring();
        }
        return added;
    }

    @Override
    public void put(T message) throws InterruptedException {
        Objects.requireNonNull(message, "Message cannot be null");
        // Timed offers so that a producer parked on a full mailbox notices close().
        while (true) {
            ensureOpen();
            if (queue.offer(message, PUT_RECHECK_MS, TimeUnit.MILLISECONDS)) {
                ring();
                return;
            }
        }
    }

    @Override
    public T poll() {
        return queue.poll();
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public void close() {
        if (!closed) {
            logger.debug("Mailbox closed with {} messages pending", queue.size());
        }
        closed = true;
        ring();
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    private void ensureOpen() {
        if (closed) {
            throw new MailboxClosedException("Mailbox is closed");
        }
    }

    private void ring() {
        if (doorbell != null) {
            doorbell.ring();
        }
    }
}
