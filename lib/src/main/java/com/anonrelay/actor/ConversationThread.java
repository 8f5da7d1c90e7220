package com.anonrelay.actor;

import com.anonrelay.mailbox.Reply;
import com.anonrelay.model.AnonymityMode;

/**
 * One endpoint of an anonymous conversation, owned by a single actor. The peer endpoint
 * lives in the peer actor and is only reachable through {@link #peer()}.
 */
public final class ConversationThread {

    private final String id;
    private final AnonymityMode anonMode;
    private final String otherId;
    private final UserHandle peer;

    public ConversationThread(String id, AnonymityMode anonMode, String otherId, UserHandle peer) {
        this.id = id;
        this.anonMode = anonMode;
        this.otherId = otherId;
        this.peer = peer;
    }

    /**
     * Builds the peer's endpoint of this thread: ids swapped, mode mirrored, pointing
     * back at {@code self}.
     */
    public ConversationThread mirror(UserHandle self) {
        return new ConversationThread(otherId, anonMode.mirror(), id, self);
    }

    public String id() {
        return id;
    }

    public AnonymityMode anonMode() {
        return anonMode;
    }

    public String otherId() {
        return otherId;
    }

    public UserHandle peer() {
        return peer;
    }

    public Reply<Void> sendText(String text) {
        return peer.sendAction(new Action.SendText(otherId, text));
    }

    public Reply<Void> terminate(Handshake handshake) {
        return peer.sendAction(new Action.TerminateThread(otherId, handshake));
    }

    /**
     * Formats text arriving on this endpoint. The prefix reveals or hides the sender
     * according to the endpoint's mode.
     */
    public String formatIncoming(String text) {
        switch (anonMode) {
            case Me:
                return ">>> Message from " + id + ":\n" + text;
            case Them:
                return ">>> Message from anonymous " + id + ":\n" + text;
            case Both:
                return ">>> Message from random chat " + id + ":\n" + text;
            default:
                throw new IllegalStateException("Unknown mode: " + anonMode);
        }
    }

    ActorSnapshot.ThreadView view() {
        return new ActorSnapshot.ThreadView(id, anonMode, otherId, peer.login());
    }

    @Override
    public String toString() {
        return "ConversationThread{" + id + " <-> @" + peer.login() + " " + otherId + ", " + anonMode + "}";
    }
}
