package com.anonrelay.dispatch;

import com.anonrelay.ActorException;
import com.anonrelay.actor.ActorContext;
import com.anonrelay.actor.HandleDirectory;
import com.anonrelay.actor.UserActor;
import com.anonrelay.actor.UserActorBuilder;
import com.anonrelay.command.Command;
import com.anonrelay.mailbox.Mailbox;
import com.anonrelay.mailbox.MailboxClosedException;
import com.anonrelay.mailbox.Request;
import com.anonrelay.mailbox.Result;
import com.anonrelay.model.User;
import com.anonrelay.persistence.Event;
import com.anonrelay.persistence.EventTracker;
import com.anonrelay.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes owner commands to user actors, creating an actor on a login's first contact.
 *
 * <p>The login to command-mailbox map is guarded by a single lock, so concurrent first
 * contacts of the same login create exactly one actor. Creation writes a
 * {@code UserConnected} event. Until that event is durable the actor receives no
 * commands and is not listed in the directory, so no event naming the login can reach
 * the log ahead of it. A failed write is retried on the login's next command.
 */
public class CommandDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);

    private final ActorContext context;
    private final Object lock = new Object();
    private final Map<String, Mailbox<Request<Command, Void>>> commandMailboxes = new HashMap<>();
    private final Map<String, UserActor> actors = new HashMap<>();
    private final Map<String, EventTracker> pendingConnects = new HashMap<>();
    private boolean shutdown;

    CommandDispatcher(ActorContext context, Map<String, UserActorBuilder> replayed) {
        this.context = context;
        List<UserActor> created = new ArrayList<>(replayed.size());
        synchronized (lock) {
            for (UserActorBuilder builder : replayed.values()) {
                UserActor actor = builder.build(context);
                commandMailboxes.put(actor.login(), builder.commandMailbox());
                actors.put(actor.login(), actor);
                created.add(actor);
            }
        }
        created.forEach(UserActor::start);
        logger.info("Started {} user actors from the event log", created.size());
    }

    /**
     * Delivers a command to the user's actor and waits for its outcome.
     *
     * @return success, or the user-level failure of the command
     * @throws ActorException if the actor is dead or its reply was lost
     */
    public Result<Void> dispatch(User user, long chatId, Command command) {
        Route route = route(user, chatId);
        if (route.connected() != null) {
            try {
                route.connected().awaitWritten();
            } catch (PersistenceException e) {
                return Result.failure(e);
            }
            markConnected(user.login(), route.connected());
        }

        Request<Command, Void> request = Request.of(command);
        try {
            route.commands().put(request);
        } catch (MailboxClosedException e) {
            throw new ActorException("failed to send request to @" + user.login() + " actor", e, user.login());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActorException("interrupted while dispatching to @" + user.login(), e, user.login());
        }

        Result<Void> result = request.reply().await();
        result.ifFailure(error -> {
            if (error instanceof ActorException) {
                throw (ActorException) error;
            }
            if (error instanceof InterruptedException) {
                throw new ActorException("interrupted while waiting for @" + user.login(), error, user.login());
            }
        });
        return result;
    }

    private Route route(User user, long chatId) {
        synchronized (lock) {
            if (shutdown) {
                throw new IllegalStateException("dispatcher is shut down");
            }
            Mailbox<Request<Command, Void>> existing = commandMailboxes.get(user.login());
            if (existing != null) {
                EventTracker pending = pendingConnects.get(user.login());
                if (pending != null && pending.hasFailed()) {
                    logger.info("Writing the connection of @{} again after a failed write", user.login());
                    pending = context.eventService().write(new Event.UserConnected(user, chatId));
                    pendingConnects.put(user.login(), pending);
                }
                return new Route(existing, pending);
            }
            EventTracker connected = context.eventService().write(new Event.UserConnected(user, chatId));
            UserActorBuilder builder = UserActorBuilder.create(user, chatId,
                    context.config().getMailboxCapacity(), context.directory());
            UserActor actor = builder.build(context);
            actor.start();
            commandMailboxes.put(user.login(), builder.commandMailbox());
            actors.put(user.login(), actor);
            pendingConnects.put(user.login(), connected);
            logger.info("Created actor for new user @{}", user.login());
            return new Route(builder.commandMailbox(), connected);
        }
    }

    private void markConnected(String login, EventTracker connected) {
        synchronized (lock) {
            if (pendingConnects.remove(login, connected)) {
                context.directory().insertIfAbsent(actors.get(login).handle());
                logger.debug("User @{} is connected", login);
            }
        }
    }

    public Optional<UserActor> actor(String login) {
        synchronized (lock) {
            return Optional.ofNullable(actors.get(login));
        }
    }

    public int actorCount() {
        synchronized (lock) {
            return actors.size();
        }
    }

    public HandleDirectory directory() {
        return context.directory();
    }

    /**
     * Closes every actor mailbox and waits for the actors to finish their queued
     * requests.
     *
     * @return true if every actor retired within the timeout
     */
    public boolean shutdown(Duration timeout) {
        List<UserActor> running;
        synchronized (lock) {
            shutdown = true;
            running = new ArrayList<>(actors.values());
        }
        running.forEach(UserActor::closeMailboxes);
        long deadline = System.nanoTime() + timeout.toNanos();
        boolean allRetired = true;
        try {
            for (UserActor actor : running) {
                Duration left = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
                if (!actor.awaitTermination(left)) {
                    logger.warn("Actor @{} did not retire within {}", actor.login(), timeout);
                    allRetired = false;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        logger.info("Dispatcher shut down, {} actors retired", running.size());
        return allRetired;
    }

    private record Route(Mailbox<Request<Command, Void>> commands, EventTracker connected) {
    }
}
