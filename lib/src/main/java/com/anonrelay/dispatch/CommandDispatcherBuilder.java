package com.anonrelay.dispatch;

import com.anonrelay.actor.ActorContext;
import com.anonrelay.actor.ActorSnapshot;
import com.anonrelay.actor.HandleDirectory;
import com.anonrelay.actor.UserActorBuilder;
import com.anonrelay.config.RelayConfig;
import com.anonrelay.config.ThreadPoolFactory;
import com.anonrelay.model.RandomThreadIdGenerator;
import com.anonrelay.model.ThreadIdGenerator;
import com.anonrelay.persistence.Event;
import com.anonrelay.persistence.EventLogReader;
import com.anonrelay.persistence.EventService;
import com.anonrelay.persistence.JournalException;
import com.anonrelay.transport.ChatTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Rebuilds the actor population from the event log.
 *
 * <p>Replay is a left fold: every event goes to the builder of the login it names, and
 * events that touch two users ({@code ThreadTerminated}, {@code UserBanned} with a
 * mirror id) reach both. An event naming a login that was never connected, or a thread
 * that does not exist, aborts replay. No actor runs until {@link #build} starts them
 * all at once.
 */
public final class CommandDispatcherBuilder {
    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcherBuilder.class);

    private final RelayConfig config;
    private final HandleDirectory directory = new HandleDirectory();
    private final Map<String, UserActorBuilder> builders = new LinkedHashMap<>();
    private ThreadIdGenerator threadIds = new RandomThreadIdGenerator();
    private ThreadPoolFactory threadPoolFactory = new ThreadPoolFactory();
    private Random random = new Random();
    private long eventsRead;

    private CommandDispatcherBuilder(RelayConfig config) {
        this.config = config;
    }

    /**
     * A builder with no users, as for a brand-new log.
     */
    public static CommandDispatcherBuilder empty(RelayConfig config) {
        return new CommandDispatcherBuilder(config);
    }

    /**
     * Replays the log at {@code path}. A missing file replays as empty.
     *
     * @throws JournalException if the log is corrupt or inconsistent
     */
    public static CommandDispatcherBuilder fromEventLog(Path path, RelayConfig config) throws IOException {
        try (EventLogReader reader = EventLogReader.open(path)) {
            return fromEventLog(reader.events(), config);
        }
    }

    /**
     * Replays a sequence of events.
     *
     * @throws JournalException if an event cannot be decoded or does not fit the state
     *                          built so far
     */
    public static CommandDispatcherBuilder fromEventLog(Iterator<Event> events, RelayConfig config) {
        CommandDispatcherBuilder builder = new CommandDispatcherBuilder(config);
        ReplayFold fold = builder.new ReplayFold();
        while (events.hasNext()) {
            Event event = events.next();
            try {
                event.accept(fold);
            } catch (JournalException e) {
                throw new JournalException("failed to replay event " + (builder.eventsRead + 1) + " " + event, e);
            }
            builder.eventsRead++;
        }
        logger.info("Read {} events from event log", builder.eventsRead);
        return builder;
    }

    public CommandDispatcherBuilder withThreadIdGenerator(ThreadIdGenerator threadIds) {
        this.threadIds = threadIds;
        return this;
    }

    public CommandDispatcherBuilder withThreadPoolFactory(ThreadPoolFactory threadPoolFactory) {
        this.threadPoolFactory = threadPoolFactory;
        return this;
    }

    public CommandDispatcherBuilder withRandom(Random random) {
        this.random = random;
        return this;
    }

    public long eventsRead() {
        return eventsRead;
    }

    /**
     * @return the replayed state of every user, keyed by login
     */
    public Map<String, ActorSnapshot> snapshots() {
        Map<String, ActorSnapshot> snapshots = new LinkedHashMap<>();
        builders.forEach((login, builder) -> snapshots.put(login, builder.snapshot()));
        return snapshots;
    }

    /**
     * @return chat id of every replayed user, keyed by login
     */
    public Map<String, Long> chats() {
        Map<String, Long> chats = new LinkedHashMap<>();
        builders.forEach((login, builder) -> chats.put(login, builder.chatId()));
        return chats;
    }

    /**
     * @return the highest message id found in the log, or 0
     */
    public long maxMessageId() {
        return builders.values().stream().mapToLong(UserActorBuilder::maxMessageId).max().orElse(0L);
    }

    /**
     * Starts one actor per replayed user and returns the dispatcher that routes to them.
     */
    public CommandDispatcher build(EventService eventService, ChatTransport transport) {
        ActorContext context = new ActorContext(eventService, transport, directory, threadIds, config,
                threadPoolFactory, random);
        return new CommandDispatcher(context, builders);
    }

    private UserActorBuilder builderOf(String login) {
        UserActorBuilder builder = builders.get(login);
        if (builder == null) {
            throw new JournalException("user not found: @" + login);
        }
        return builder;
    }

    private final class ReplayFold implements Event.Visitor<Void> {

        @Override
        public Void visitUserConnected(Event.UserConnected event) {
            String login = event.user().login();
            if (builders.containsKey(login)) {
                logger.warn("User @{} connected twice in the event log, keeping the first", login);
                return null;
            }
            UserActorBuilder builder = UserActorBuilder.create(event.user(), event.chatId(),
                    config.getMailboxCapacity(), directory);
            builders.put(login, builder);
            directory.insertIfAbsent(builder.handle());
            return null;
        }

        @Override
        public Void visitThreadStarted(Event.ThreadStarted event) {
            builderOf(event.login()).onThreadStarted(event);
            return null;
        }

        @Override
        public Void visitThreadMessageReceived(Event.ThreadMessageReceived event) {
            builderOf(event.login()).onThreadMessageReceived(event);
            return null;
        }

        @Override
        public Void visitThreadTerminated(Event.ThreadTerminated event) {
            builderOf(event.login()).terminateThread(event.myThreadId());
            builderOf(event.otherLogin()).terminateThread(event.otherThreadId());
            return null;
        }

        @Override
        public Void visitUserBanned(Event.UserBanned event) {
            builderOf(event.login()).onUserBanned(event);
            if (event.bannedUserThreadId() != null) {
                builderOf(event.bannedLogin()).terminateThread(event.bannedUserThreadId());
            }
            return null;
        }

        @Override
        public Void visitUserUnbanned(Event.UserUnbanned event) {
            builderOf(event.login()).onUserUnbanned(event);
            return null;
        }

        @Override
        public Void visitUserStopped(Event.UserStopped event) {
            builderOf(event.login()).onUserStopped();
            return null;
        }

        @Override
        public Void visitUserStarted(Event.UserStarted event) {
            builderOf(event.login()).onUserStarted();
            return null;
        }
    }
}
