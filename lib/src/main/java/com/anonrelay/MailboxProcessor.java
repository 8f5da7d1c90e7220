package com.anonrelay;

import com.anonrelay.mailbox.Doorbell;
import com.anonrelay.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Runs one actor loop over a pair of mailboxes that share a {@link Doorbell}.
 *
 * <p>Each turn serves at most one message, alternating which mailbox is tried first, so
 * neither mailbox can starve the other. When both are empty the loop parks on the
 * doorbell. The loop retires once both mailboxes are closed and drained.
 *
 * <p>A {@link Receiver} that throws ends the loop: both mailboxes are closed and the
 * receiver is told why in {@link Receiver#postStop(Throwable)}.
 *
 * @param <C> owner command type
 * @param <A> peer action type
 */
public class MailboxProcessor<C, A> {
    private static final Logger logger = LoggerFactory.getLogger(MailboxProcessor.class);

    // Upper bound on a doorbell wait; close() also rings, so this only bounds missed wakeups.
    private static final long IDLE_WAIT_MS = 100;

    /**
     * Message handlers and lifecycle hooks of an actor.
     */
    public interface Receiver<C, A> {
        void receiveCommand(C command);

        void receiveAction(A action);

        default void preStart() {
        }

        /**
         * Called on the actor thread after the loop ends.
         *
         * @param failure the throwable that ended the loop, or null on normal retirement
         */
        default void postStop(Throwable failure) {
        }
    }

    private final String actorId;
    private final Mailbox<C> commands;
    private final Mailbox<A> actions;
    private final Doorbell doorbell;
    private final Receiver<C, A> receiver;
    private final ThreadFactory threadFactory;
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile boolean running;
    private volatile Thread thread;

    public MailboxProcessor(String actorId, Mailbox<C> commands, Mailbox<A> actions, Doorbell doorbell,
                            Receiver<C, A> receiver, ThreadFactory threadFactory) {
        this.actorId = actorId;
        this.commands = commands;
        this.actions = actions;
        this.doorbell = doorbell;
        this.receiver = receiver;
        this.threadFactory = threadFactory;
    }

    public synchronized void start() {
        if (running || thread != null) {
            logger.debug("Actor {} mailbox already running", actorId);
            return;
        }
        running = true;
        thread = threadFactory.newThread(this::processMailboxLoop);
        thread.start();
    }

    /**
     * Closes both mailboxes. Messages already queued are still processed before the loop
     * retires.
     */
    public void closeMailboxes() {
        commands.close();
        actions.close();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Waits for the loop to retire.
     *
     * @return true if it retired within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void processMailboxLoop() {
        Throwable failure = null;
        boolean commandsFirst = true;
        try {
            receiver.preStart();
            while (true) {
                boolean served = commandsFirst
                        ? serveCommand() || serveAction()
                        : serveAction() || serveCommand();
                commandsFirst = !commandsFirst;
                if (served) {
                    continue;
                }
                if (commands.isDrained() && actions.isDrained()) {
                    break;
                }
                doorbell.await(IDLE_WAIT_MS, TimeUnit.MILLISECONDS);
            }
            logger.debug("Actor {} has retired", actorId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = e;
            logger.warn("Actor {} interrupted", actorId);
        } catch (Throwable e) {
            failure = e;
            logger.error("Actor {} stopped after a fatal error", actorId, e);
        } finally {
            running = false;
            closeMailboxes();
            try {
                receiver.postStop(failure);
            } finally {
                terminated.countDown();
            }
        }
    }

    private boolean serveCommand() {
        C command = commands.poll();
        if (command == null) {
            return false;
        }
        receiver.receiveCommand(command);
        return true;
    }

    private boolean serveAction() {
        A action = actions.poll();
        if (action == null) {
            return false;
        }
        receiver.receiveAction(action);
        return true;
    }
}
