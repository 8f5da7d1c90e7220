package com.anonrelay.actor;

import com.anonrelay.ActorException;
import com.anonrelay.MailboxProcessor;
import com.anonrelay.RelayException;
import com.anonrelay.command.Command;
import com.anonrelay.mailbox.Doorbell;
import com.anonrelay.mailbox.Mailbox;
import com.anonrelay.mailbox.Reply;
import com.anonrelay.mailbox.Request;
import com.anonrelay.mailbox.Result;
import com.anonrelay.model.AnonymityMode;
import com.anonrelay.persistence.Event;
import com.anonrelay.persistence.EventService;
import com.anonrelay.persistence.JournalException;
import com.anonrelay.transport.Messages;
import com.anonrelay.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * The single owner of one user's conversational state: threads, the message index and
 * the ban list.
 *
 * <p>Owner commands arrive from the dispatcher, peer actions from other actors. Both are
 * served one at a time by the actor's own thread, so the state needs no locking. Every
 * request is answered exactly once on its reply channel. User-level failures
 * ({@link RelayException}, {@link TransportException}, {@link JournalException}) fail
 * only that request; an {@link ActorException} or an {@link Error} ends the actor.
 *
 * <p>An actor never waits on a reply from itself: thread creation towards its own login
 * is rejected before any action is sent, and broadcasts skip the sender.
 */
public class UserActor implements MailboxProcessor.Receiver<Request<Command, Void>, Request<Action, Void>> {
    private static final Logger logger = LoggerFactory.getLogger(UserActor.class);

    private static final int THREAD_ID_ATTEMPTS = 16;

    private final UserHandle self;
    private final String login;
    private final long chatId;
    private final ActorContext context;
    private final EventService events;
    private final Map<String, ConversationThread> threads;
    private final Map<Long, String> messageIndex;
    private final Map<String, String> banlist;
    private final Mailbox<Request<Command, Void>> commands;
    private final Mailbox<Request<Action, Void>> actions;
    private final MailboxProcessor<Request<Command, Void>, Request<Action, Void>> processor;

    UserActor(UserActorBuilder builder, ActorContext context, Doorbell doorbell,
              Mailbox<Request<Command, Void>> commands, Mailbox<Request<Action, Void>> actions) {
        this.self = builder.handle();
        this.login = self.login();
        this.chatId = builder.chatId();
        this.context = context;
        this.events = context.eventService();
        this.threads = builder.threads;
        this.messageIndex = builder.messageIndex;
        this.banlist = builder.banlist;
        this.commands = commands;
        this.actions = actions;
        this.processor = new MailboxProcessor<>(login, commands, actions, doorbell, this,
                context.threadPoolFactory().createActorThreadFactory(login));
    }

    public void start() {
        processor.start();
    }

    /**
     * Stops accepting new requests. Queued ones are still served before the actor retires.
     */
    public void closeMailboxes() {
        processor.closeMailboxes();
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return processor.awaitTermination(timeout);
    }

    public boolean isRunning() {
        return processor.isRunning();
    }

    public UserHandle handle() {
        return self;
    }

    public String login() {
        return login;
    }

    /**
     * Copies the actor state. Only consistent once the actor has retired.
     */
    public ActorSnapshot snapshot() {
        return UserActorBuilder.snapshotOf(self, threads, messageIndex, banlist);
    }

    @Override
    public void preStart() {
        logger.info("User actor @{} started with {} threads", login, threads.size());
    }

    @Override
    public void postStop(Throwable failure) {
        ActorException error = new ActorException("actor of @" + login + " is not running", failure, login);
        failPending(commands, error);
        failPending(actions, error);
        if (failure == null) {
            logger.debug("User actor @{} retired", login);
        }
    }

    private static <P> void failPending(Mailbox<Request<P, Void>> mailbox, ActorException error) {
        Request<P, Void> request;
        while ((request = mailbox.poll()) != null) {
            request.fail(error);
        }
    }

    @Override
    public void receiveCommand(Request<Command, Void> request) {
        serve(request, () -> handleCommand(request.payload()));
        pauseAfterCommand();
    }

    @Override
    public void receiveAction(Request<Action, Void> request) {
        serve(request, () -> handleAction(request.payload()));
    }

    private <P> void serve(Request<P, Void> request, Runnable handler) {
        try {
            handler.run();
            request.complete(null);
        } catch (RelayException | TransportException | JournalException e) {
            logger.debug("Request {} to @{} failed: {}", request.payload(), login, e.getMessage());
            request.fail(e);
        } catch (ActorException e) {
            request.fail(e);
            throw e;
        } catch (RuntimeException e) {
            logger.error("Unexpected failure of {} in actor @{}", request.payload(), login, e);
            request.fail(e);
        } catch (Error e) {
            request.fail(new ActorException("actor of @" + login + " failed", e, login));
            throw e;
        }
    }

    private void pauseAfterCommand() {
        Duration pause = context.config().getCommandPause();
        if (pause.isZero()) {
            return;
        }
        try {
            Thread.sleep(pause.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActorException("interrupted while pausing", e, login);
        }
    }

    // ========== Owner commands ==========

    private void handleCommand(Command command) {
        if (self.isStopped() && !(command instanceof Command.Start)) {
            throw new RelayException("you have stopped the bot. Use `/start` to restart it");
        }
        if (command instanceof Command.Start) {
            setStarted(true);
        } else if (command instanceof Command.Stop) {
            setStarted(false);
        } else if (command instanceof Command.Help) {
            sendToSelf(Messages.HELP);
        } else if (command instanceof Command.Users) {
            listUsers();
        } else if (command instanceof Command.Threads) {
            listThreads();
        } else if (command instanceof Command.Random random) {
            startRandomThread(random);
        } else if (command instanceof Command.Send send) {
            send(send);
        } else if (command instanceof Command.Reply reply) {
            reply(reply);
        } else if (command instanceof Command.Close close) {
            close(close.threadId());
        } else if (command instanceof Command.Ban ban) {
            ban(ban.threadId());
        } else if (command instanceof Command.Unban unban) {
            unban(unban.threadId());
        } else if (command instanceof Command.Banlist) {
            listBanned();
        } else if (command instanceof Command.Broadcast broadcast) {
            broadcast(broadcast.text());
        } else {
            throw new IllegalStateException("Unknown command: " + command);
        }
    }

    private void setStarted(boolean started) {
        self.setStopped(!started);
        Event event = started ? new Event.UserStarted(login) : new Event.UserStopped(login);
        events.write(event).awaitWritten();
        sendToSelf(started ? Messages.START : Messages.STOP);
    }

    private void listUsers() {
        List<String> names = context.directory().snapshot().stream()
                .filter(handle -> !handle.isStopped())
                .map(handle -> handle.user().displayName())
                .sorted()
                .collect(Collectors.toList());
        sendToSelf("Available users:\n* " + String.join("\n* ", names));
    }

    private void listThreads() {
        List<String> ids = threads.keySet().stream()
                .filter(id -> id.startsWith("#"))
                .sorted()
                .collect(Collectors.toList());
        if (ids.isEmpty()) {
            sendToSelf("There are no active threads.");
        } else {
            sendToSelf("Active threads:\n* " + String.join("\n* ", ids));
        }
    }

    private void startRandomThread(Command.Random command) {
        List<String> candidates = context.directory().snapshot().stream()
                .filter(handle -> !handle.login().equals(login) && !handle.isStopped())
                .map(UserHandle::login)
                .sorted()
                .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            throw new RelayException("there are currently no other users to chat with");
        }
        String otherLogin = candidates.get(context.random().nextInt(candidates.size()));
        String myThreadId = mintThreadId();
        String otherThreadId = context.threadIds().nextId();

        ConversationThread thread = openThread(myThreadId, otherThreadId, otherLogin, AnonymityMode.Both);
        messageIndex.put(command.messageId(), myThreadId);
        events.writeBatch(List.of(
                new Event.ThreadStarted(login, otherLogin, myThreadId, otherThreadId, AnonymityMode.Both),
                new Event.ThreadMessageReceived(login, command.messageId(), myThreadId))).awaitWritten();

        awaitPeer(thread.sendText(command.text()), otherLogin);

        long ackId = sendToSelf("Started a new anonymous thread " + myThreadId + ".");
        messageIndex.put(ackId, myThreadId);
        events.write(new Event.ThreadMessageReceived(login, ackId, myThreadId)).awaitWritten();
    }

    private void send(Command.Send command) {
        String threadId = command.threadId();
        List<Event> batch = new ArrayList<>(2);
        ConversationThread thread = threads.get(threadId);
        if (thread == null) {
            if (!threadId.startsWith("@")) {
                throw new RelayException("unknown thread: " + threadId);
            }
            String otherLogin = threadId.substring(1);
            if (otherLogin.equals(login)) {
                throw new RelayException("cannot send a message to self");
            }
            String otherThreadId = context.threadIds().nextId();
            thread = openThread(threadId, otherThreadId, otherLogin, AnonymityMode.Me);
            batch.add(new Event.ThreadStarted(login, otherLogin, threadId, otherThreadId, AnonymityMode.Me));
        }

        messageIndex.put(command.messageId(), threadId);
        batch.add(new Event.ThreadMessageReceived(login, command.messageId(), threadId));
        events.writeBatch(batch).awaitWritten();

        awaitPeer(thread.sendText(command.text()), thread.peer().login());
    }

    private void reply(Command.Reply command) {
        String threadId = messageIndex.get(command.replyToMessageId());
        if (threadId == null) {
            throw new RelayException("message you are replying to does not belong to a thread");
        }
        ConversationThread thread = threads.get(threadId);
        if (thread == null) {
            throw new RelayException("thread does not exist anymore");
        }

        messageIndex.put(command.messageId(), threadId);
        events.write(new Event.ThreadMessageReceived(login, command.messageId(), threadId)).awaitWritten();

        awaitPeer(thread.sendText(command.text()), thread.peer().login());
    }

    private void close(String threadId) {
        ConversationThread thread = existingThread(threadId);
        if (thread.anonMode() == AnonymityMode.Them) {
            throw new RelayException("cannot close a semi-anonymous thread; use `/ban` instead");
        }
        terminatePeer(thread);
        threads.remove(threadId);
        events.write(new Event.ThreadTerminated(login, thread.peer().login(), threadId, thread.otherId()))
                .awaitWritten();
    }

    private void ban(String threadId) {
        ConversationThread thread = existingThread(threadId);
        if (thread.anonMode() != AnonymityMode.Them) {
            throw new RelayException("cannot ban random or non-anonymous chat; use `/close` instead");
        }
        terminatePeer(thread);
        threads.remove(threadId);
        String bannedLogin = thread.peer().login();
        events.write(new Event.UserBanned(login, bannedLogin, threadId, thread.otherId())).awaitWritten();
        banlist.put(bannedLogin, threadId);
    }

    private void unban(String threadId) {
        String bannedLogin = banlist.entrySet().stream()
                .filter(entry -> entry.getValue().equals(threadId))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElseThrow(() -> new RelayException("no " + threadId + " in your ban list"));
        events.write(new Event.UserUnbanned(login, bannedLogin)).awaitWritten();
        banlist.remove(bannedLogin);
    }

    private void listBanned() {
        List<String> ids = banlist.values().stream().sorted().collect(Collectors.toList());
        if (ids.isEmpty()) {
            sendToSelf("You have not banned anybody.");
        } else {
            sendToSelf("Banned threads:\n* " + String.join("\n* ", ids));
        }
    }

    private void broadcast(String text) {
        if (!login.equals(context.config().getOperatorLogin())) {
            throw new RelayException("you are not admin");
        }
        List<UserHandle> targets = context.directory().snapshot().stream()
                .filter(handle -> handle != self)
                .sorted(Comparator.comparing(UserHandle::login))
                .collect(Collectors.toList());
        sendToSelf("Starting broadcast to " + targets.size() + " users...");
        for (UserHandle target : targets) {
            try {
                awaitPeer(target.sendAction(new Action.Broadcast(text)), target.login());
            } catch (RelayException | TransportException | JournalException e) {
                sendToSelf("Failed to send broadcast to user @" + target.login() + ": " + RelayException.describe(e));
            }
        }
        sendToSelf("Broadcast is finished.");
    }

    // ========== Peer actions ==========

    private void handleAction(Action action) {
        Handshake handshake = handshakeOf(action);
        if (handshake != null && !handshake.take()) {
            logger.debug("@{} skips {}: the sender stopped waiting", login, action);
            throw new RelayException("the request was withdrawn by the sender");
        }
        if (self.isStopped()) {
            throw new RelayException("user has stopped the bot");
        }
        if (action instanceof Action.StartAnonymousThread start) {
            acceptThread(start.thread());
        } else if (action instanceof Action.SendText sendText) {
            receiveText(sendText.threadId(), sendText.text());
        } else if (action instanceof Action.TerminateThread terminate) {
            String threadId = terminate.threadId();
            existingThread(threadId);
            sendToSelf("Thread " + threadId + " has been closed by the other side.");
            threads.remove(threadId);
        } else if (action instanceof Action.Broadcast broadcast) {
            sendToSelf(broadcast.text());
        } else {
            throw new IllegalStateException("Unknown action: " + action);
        }
    }

    private static Handshake handshakeOf(Action action) {
        if (action instanceof Action.StartAnonymousThread start) {
            return start.handshake();
        }
        if (action instanceof Action.TerminateThread terminate) {
            return terminate.handshake();
        }
        return null;
    }

    private void acceptThread(ConversationThread thread) {
        if (threads.containsKey(thread.id())) {
            throw new RelayException("thread id " + thread.id() + " is already used");
        }
        String peerLogin = thread.peer().login();
        if (banlist.containsKey(peerLogin) && thread.anonMode() == AnonymityMode.Them) {
            throw new RelayException("you are banned by this user");
        }
        events.write(new Event.ThreadStarted(login, peerLogin, thread.id(), thread.otherId(), thread.anonMode()))
                .awaitWritten();
        threads.put(thread.id(), thread);
    }

    private void receiveText(String threadId, String text) {
        ConversationThread thread = existingThread(threadId);
        long messageId = sendToSelf(thread.formatIncoming(text));
        events.write(new Event.ThreadMessageReceived(login, messageId, threadId)).awaitWritten();
        messageIndex.put(messageId, threadId);
    }

    // ========== Helpers ==========

    /**
     * Pairing: builds both halves, hands the peer its half and keeps ours only once the
     * peer has accepted it.
     */
    private ConversationThread openThread(String myThreadId, String otherThreadId, String otherLogin,
                                          AnonymityMode myMode) {
        if (otherLogin.equals(login)) {
            throw new RelayException("cannot send a message to self");
        }
        UserHandle peer = context.directory().get(otherLogin)
                .orElseThrow(() -> new RelayException("user has not started this bot"));
        ConversationThread mine = new ConversationThread(myThreadId, myMode, otherThreadId, peer);
        Handshake handshake = new Handshake();
        awaitPeer(peer.sendAction(new Action.StartAnonymousThread(mine.mirror(self), handshake)),
                handshake, otherLogin);
        threads.put(myThreadId, mine);
        logger.debug("@{} opened thread {} with @{} ({})", login, myThreadId, otherLogin, myMode);
        return mine;
    }

    private void terminatePeer(ConversationThread thread) {
        try {
            Handshake handshake = new Handshake();
            awaitPeer(thread.terminate(handshake), handshake, thread.peer().login());
        } catch (RelayException | TransportException | JournalException e) {
            throw new RelayException("failed to terminate peer thread", e);
        }
    }

    private ConversationThread existingThread(String threadId) {
        ConversationThread thread = threads.get(threadId);
        if (thread == null) {
            throw new RelayException("thread " + threadId + " does not exist");
        }
        return thread;
    }

    private String mintThreadId() {
        for (int i = 0; i < THREAD_ID_ATTEMPTS; i++) {
            String id = context.threadIds().nextId();
            if (!threads.containsKey(id)) {
                return id;
            }
        }
        throw new RelayException("could not pick a free thread id, try again");
    }

    private void awaitPeer(Reply<Void> reply, String peerLogin) {
        Duration timeout = context.config().getPeerReplyTimeout();
        checkPeerResult(timeout.isZero() ? reply.await() : reply.await(timeout), peerLogin);
    }

    /**
     * Waits for an action the peer must either complete or never start. After the timeout
     * the action is withdrawn; if the peer has already taken it, the wait goes on until
     * it finishes so both sides agree on the outcome.
     */
    private void awaitPeer(Reply<Void> reply, Handshake handshake, String peerLogin) {
        Duration timeout = context.config().getPeerReplyTimeout();
        if (timeout.isZero()) {
            checkPeerResult(reply.await(), peerLogin);
            return;
        }
        Result<Void> result = reply.await(timeout);
        if (isTimeout(result) && !handshake.withdraw()) {
            logger.debug("@{} is already serving the request of @{}, waiting for it", peerLogin, login);
            result = reply.await();
        }
        checkPeerResult(result, peerLogin);
    }

    private void checkPeerResult(Result<Void> result, String peerLogin) {
        if (isTimeout(result)) {
            throw new RelayException("@" + peerLogin + " did not respond in time");
        }
        if (result instanceof Result.Failure<Void> interrupted && interrupted.error() instanceof InterruptedException) {
            throw new ActorException("interrupted while waiting for @" + peerLogin, interrupted.error(), login);
        }
        result.getOrThrow();
    }

    private static boolean isTimeout(Result<Void> result) {
        return result instanceof Result.Failure<Void> failure && failure.error() instanceof TimeoutException;
    }

    private long sendToSelf(String text) {
        logger.debug("Sending message to @{}: {}", login, text);
        try {
            return context.transport().sendMessage(chatId, text);
        } catch (TransportException e) {
            throw new TransportException("failed to send message to user", e);
        }
    }
}
