package com.anonrelay.actor;

import com.anonrelay.ActorException;
import com.anonrelay.mailbox.LinkedMailbox;
import com.anonrelay.mailbox.Reply;
import com.anonrelay.mailbox.Request;
import com.anonrelay.model.AnonymityMode;
import com.anonrelay.model.User;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConversationThreadTest {

    private final LinkedMailbox<Request<Action, Void>> bobActions = new LinkedMailbox<>(4);
    private final UserHandle alice = new UserHandle(new User("alice", "Alice", null), new LinkedMailbox<>(4));
    private final UserHandle bob = new UserHandle(new User("bob", "Bob", null), bobActions);

    @Test
    void mirrorSwapsIdsAndMode() {
        ConversationThread mine = new ConversationThread("@bob", AnonymityMode.Me, "#quiet_owl", bob);

        ConversationThread theirs = mine.mirror(alice);

        assertEquals("#quiet_owl", theirs.id());
        assertEquals("@bob", theirs.otherId());
        assertEquals(AnonymityMode.Them, theirs.anonMode());
        assertSame(alice, theirs.peer());
        assertEquals(AnonymityMode.Both, new ConversationThread("#a", AnonymityMode.Both, "#b", bob)
                .mirror(alice).anonMode());
    }

    @Test
    void formatsIncomingTextByMode() {
        assertEquals(">>> Message from @bob:\nhi",
                new ConversationThread("@bob", AnonymityMode.Me, "#x", bob).formatIncoming("hi"));
        assertEquals(">>> Message from anonymous #x:\nhi",
                new ConversationThread("#x", AnonymityMode.Them, "@alice", bob).formatIncoming("hi"));
        assertEquals(">>> Message from random chat #y:\nhi",
                new ConversationThread("#y", AnonymityMode.Both, "#z", bob).formatIncoming("hi"));
    }

    @Test
    void actionsTargetPeerEndpoint() {
        ConversationThread mine = new ConversationThread("@bob", AnonymityMode.Me, "#x", bob);

        Reply<Void> sent = mine.sendText("hello");
        Handshake handshake = new Handshake();
        mine.terminate(handshake);

        Request<Action, Void> first = bobActions.poll();
        assertEquals(new Action.SendText("#x", "hello"), first.payload());
        assertEquals(new Action.TerminateThread("#x", handshake), bobActions.poll().payload());
        assertFalse(sent.isDone());
        first.complete(null);
        assertTrue(sent.isDone());
    }

    @Test
    void sendingToRetiredPeerFails() {
        bobActions.close();
        ConversationThread mine = new ConversationThread("@bob", AnonymityMode.Me, "#x", bob);

        ActorException error = assertThrows(ActorException.class, () -> mine.sendText("hello"));
        assertEquals("bob", error.getActorId());
    }
}
