package com.anonrelay.actor;

/**
 * A request one user actor sends to another through the receiver's action mailbox.
 */
public sealed interface Action permits Action.StartAnonymousThread, Action.SendText, Action.TerminateThread,
        Action.Broadcast {

    /**
     * Installs the receiver's half of a new thread. The initiator has already built both
     * halves and keeps its own only if this succeeds.
     */
    record StartAnonymousThread(ConversationThread thread, Handshake handshake) implements Action {
    }

    /**
     * Relays text to the receiver on its endpoint {@code threadId}.
     */
    record SendText(String threadId, String text) implements Action {
    }

    /**
     * Removes the receiver's endpoint {@code threadId}. The initiator drops its own only
     * if this succeeds.
     */
    record TerminateThread(String threadId, Handshake handshake) implements Action {
    }

    record Broadcast(String text) implements Action {
    }
}
