package com.anonrelay.actor;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Claim on a peer action whose sender may stop waiting for it. Exactly one side wins:
 * the receiver takes the claim before acting, or the sender withdraws it after its wait
 * timed out. A withdrawn action is rejected unprocessed; once taken, the sender waits
 * for the outcome however long it takes.
 */
public final class Handshake {

    private static final int OPEN = 0;
    private static final int TAKEN = 1;
    private static final int WITHDRAWN = 2;

    private final AtomicInteger state = new AtomicInteger(OPEN);

    /**
     * @return true if the receiver may act, false if the sender already withdrew
     */
    public boolean take() {
        return state.compareAndSet(OPEN, TAKEN);
    }

    /**
     * @return true if the action will never be processed, false if the receiver took it
     */
    public boolean withdraw() {
        return state.compareAndSet(OPEN, WITHDRAWN);
    }

    public boolean isWithdrawn() {
        return state.get() == WITHDRAWN;
    }

    @Override
    public String toString() {
        switch (state.get()) {
            case TAKEN:
                return "Handshake{taken}";
            case WITHDRAWN:
                return "Handshake{withdrawn}";
            default:
                return "Handshake{open}";
        }
    }
}
