package com.anonrelay.actor;

import com.anonrelay.command.Command;
import com.anonrelay.mailbox.Doorbell;
import com.anonrelay.mailbox.LinkedMailbox;
import com.anonrelay.mailbox.Mailbox;
import com.anonrelay.mailbox.Request;
import com.anonrelay.model.User;
import com.anonrelay.persistence.Event;
import com.anonrelay.persistence.JournalException;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Accumulates the state of one user actor before it starts.
 *
 * <p>During replay the dispatcher builder folds each logged event into the builder of
 * the login it names. A live first contact builds straight from an empty builder. Either
 * way the mailboxes and the {@link UserHandle} exist from the start, so peers can be
 * wired to each other before any actor runs.
 */
public final class UserActorBuilder {

    private final UserHandle handle;
    private final long chatId;
    private final HandleDirectory directory;
    private final Doorbell doorbell;
    private final Mailbox<Request<Command, Void>> commands;
    private final Mailbox<Request<Action, Void>> actions;

    final Map<String, ConversationThread> threads = new HashMap<>();
    final Map<Long, String> messageIndex = new HashMap<>();
    final Map<String, String> banlist = new HashMap<>();

    private UserActorBuilder(User user, long chatId, int mailboxCapacity, HandleDirectory directory) {
        this.chatId = chatId;
        this.directory = directory;
        this.doorbell = new Doorbell();
        this.commands = new LinkedMailbox<>(mailboxCapacity, doorbell);
        this.actions = new LinkedMailbox<>(mailboxCapacity, doorbell);
        this.handle = new UserHandle(user, actions);
    }

    /**
     * Creates a builder with fresh mailboxes. The handle is not published to the
     * directory yet.
     */
    public static UserActorBuilder create(User user, long chatId, int mailboxCapacity, HandleDirectory directory) {
        return new UserActorBuilder(user, chatId, mailboxCapacity, directory);
    }

    public UserHandle handle() {
        return handle;
    }

    public long chatId() {
        return chatId;
    }

    public Mailbox<Request<Command, Void>> commandMailbox() {
        return commands;
    }

    public void onThreadStarted(Event.ThreadStarted event) {
        UserHandle peer = directory.get(event.otherLogin())
                .orElseThrow(() -> new JournalException("user not found: @" + event.otherLogin()));
        threads.put(event.myThreadId(),
                new ConversationThread(event.myThreadId(), event.anonMode(), event.otherThreadId(), peer));
    }

    public void onThreadMessageReceived(Event.ThreadMessageReceived event) {
        messageIndex.put(event.messageId(), event.threadId());
    }

    public void terminateThread(String threadId) {
        if (threads.remove(threadId) == null) {
            throw new JournalException("thread is not found: " + threadId);
        }
    }

    public void onUserBanned(Event.UserBanned event) {
        terminateThread(event.bannedThreadId());
        banlist.put(event.bannedLogin(), event.bannedThreadId());
    }

    public void onUserUnbanned(Event.UserUnbanned event) {
        if (banlist.remove(event.unbannedLogin()) == null) {
            throw new JournalException("user is not banned: @" + event.unbannedLogin());
        }
    }

    public void onUserStopped() {
        handle.setStopped(true);
    }

    public void onUserStarted() {
        handle.setStopped(false);
    }

    /**
     * @return the highest message id indexed so far, or 0
     */
    public long maxMessageId() {
        return messageIndex.keySet().stream().mapToLong(Long::longValue).max().orElse(0L);
    }

    public ActorSnapshot snapshot() {
        return snapshotOf(handle, threads, messageIndex, banlist);
    }

    static ActorSnapshot snapshotOf(UserHandle handle, Map<String, ConversationThread> threads,
                                    Map<Long, String> messageIndex, Map<String, String> banlist) {
        Map<String, ActorSnapshot.ThreadView> views = threads.values().stream()
                .collect(Collectors.toMap(ConversationThread::id, ConversationThread::view));
        return new ActorSnapshot(handle.login(), handle.isStopped(), views, messageIndex, banlist);
    }

    /**
     * Creates the actor. The builder must not be used afterwards.
     */
    public UserActor build(ActorContext context) {
        return new UserActor(this, context, doorbell, commands, actions);
    }
}
