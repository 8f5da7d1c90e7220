package com.anonrelay.mailbox;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Wake-up signal shared by the mailboxes of one consumer.
 *
 * <p>Producers ring after enqueueing; the consumer polls all of its mailboxes and only
 * waits on the doorbell when every one of them was empty. A ring that lands between the
 * consumer's last poll and its wait leaves a permit behind, so no wake-up is lost.
 */
public final class Doorbell {

    private final Semaphore permits = new Semaphore(0);

    /**
     * Signals that at least one attached mailbox changed.
     */
    public void ring() {
        permits.release();
    }

    /**
     * Waits for a ring, up to the given timeout, then clears any accumulated rings.
     *
     * @param timeout maximum time to wait
     * @param unit unit of the timeout
     * @return true if a ring was observed, false on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        boolean rung = permits.tryAcquire(timeout, unit);
        permits.drainPermits();
        return rung;
    }
}
