package com.anonrelay.mailbox;

import java.util.concurrent.TimeUnit;

/**
 * Abstraction for an actor inbox.
 * A mailbox has many producers and exactly one consumer: the actor loop that owns it.
 * Once closed it rejects new messages, but messages already queued can still be drained.
 *
 * @param <T> The type of messages stored in the mailbox
 */
public interface Mailbox<T> {

    /**
     * Inserts the message if it is possible to do so immediately without exceeding capacity.
     *
     * @param message the message to add
     * @return true if the message was added, false if the mailbox is full
     * @throws MailboxClosedException if the mailbox has been closed
     */
    boolean offer(T message);

    /**
     * Inserts the message, suspending the caller while the mailbox is full.
     * This is the backpressure point between a slow consumer and its producers.
     *
     * @param message the message to add
     * @throws InterruptedException if interrupted while waiting for space
     * @throws MailboxClosedException if the mailbox is closed before or while waiting
     */
    void put(T message) throws InterruptedException;

    /**
     * Retrieves and removes the head of this mailbox, or returns null if empty.
     *
     * @return the head of this mailbox, or null if empty
     */
    T poll();

    /**
     * Retrieves and removes the head of this mailbox, waiting up to the
     * specified wait time if necessary for a message to become available.
     *
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return the head of this mailbox, or null if timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    T poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Returns the number of messages in this mailbox.
     *
     * @return the number of messages
     */
    int size();

    /**
     * Returns true if this mailbox contains no messages.
     *
     * @return true if empty
     */
    boolean isEmpty();

    /**
     * Closes the mailbox for producers. Idempotent.
     */
    void close();

    /**
     * @return true once {@link #close()} has been called
     */
    boolean isClosed();

    /**
     * Returns true when the mailbox is closed and nothing is left to consume.
     *
     * @return true if the consumer may retire
     */
    default boolean isDrained() {
        return isClosed() && isEmpty();
    }
}
