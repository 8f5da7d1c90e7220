package com.anonrelay.actor;

import com.anonrelay.ActorException;
import com.anonrelay.mailbox.Mailbox;
import com.anonrelay.mailbox.MailboxClosedException;
import com.anonrelay.mailbox.Reply;
import com.anonrelay.mailbox.Request;
import com.anonrelay.model.User;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The publicly shared face of one user actor: who it is, where its peer actions go and
 * whether the user has stopped the bot. Everything else about the actor is private to
 * its own thread.
 */
public final class UserHandle {

    private final User user;
    private final Mailbox<Request<Action, Void>> actions;
    private final AtomicBoolean stopped = new AtomicBoolean();

    public UserHandle(User user, Mailbox<Request<Action, Void>> actions) {
        this.user = user;
        this.actions = actions;
    }

    public User user() {
        return user;
    }

    public String login() {
        return user.login();
    }

    public boolean isStopped() {
        return stopped.get();
    }

    void setStopped(boolean value) {
        stopped.set(value);
    }

    /**
     * Enqueues an action for this actor, waiting while its action mailbox is full.
     *
     * @return the handle for the actor's reply
     * @throws ActorException if the actor is no longer running
     */
    public Reply<Void> sendAction(Action action) {
        Request<Action, Void> request = Request.of(action);
        try {
            actions.put(request);
        } catch (MailboxClosedException e) {
            throw new ActorException("actor of @" + login() + " is not running", e, login());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActorException("interrupted while sending an action to @" + login(), e, login());
        }
        return request.reply();
    }

    @Override
    public String toString() {
        return "UserHandle{@" + login() + (isStopped() ? ", stopped" : "") + "}";
    }
}
