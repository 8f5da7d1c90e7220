package com.anonrelay.persistence;

import com.anonrelay.mailbox.LinkedMailbox;
import com.anonrelay.mailbox.Mailbox;
import com.anonrelay.mailbox.MailboxClosedException;
import com.anonrelay.mailbox.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Single writer in front of an {@link EventJournal}.
 *
 * <p>Any number of threads submit write requests. The writer thread blocks for one
 * request, then drains whatever else is already queued without blocking, stopping once
 * the coalesced batch holds {@code maxBatch} events or more. The whole batch is written
 * with one flushed append and the outcome is handed to every request in it. A failed
 * append is reported to all of them through one shared {@link PersistenceException} and
 * is not retried.
 *
 * <p>Events of one request are never split across batches and keep their relative order.
 */
public class EventService implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventService.class);

    public static final int DEFAULT_MAX_BATCH = 1000;
    private static final long POLL_TIMEOUT_MS = 100;

    private final EventJournal journal;
    private final int maxBatch;
    private final ThreadFactory threadFactory;
    private final Mailbox<Request<List<Event>, Void>> requests = new LinkedMailbox<>();
    private volatile Thread writer;

    public EventService(EventJournal journal) {
        this(journal, DEFAULT_MAX_BATCH, r -> {
            Thread thread = new Thread(r, "event-service");
            thread.setDaemon(true);
            return thread;
        });
    }

    public EventService(EventJournal journal, int maxBatch, ThreadFactory threadFactory) {
        if (maxBatch <= 0) {
            throw new IllegalArgumentException("maxBatch must be positive");
        }
        this.journal = Objects.requireNonNull(journal, "journal");
        this.maxBatch = maxBatch;
        this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
    }

    /**
     * Starts the writer thread. Requests submitted before this call are kept and written
     * once the writer runs.
     */
    public synchronized EventService start() {
        if (writer != null) {
            throw new IllegalStateException("Event service already started");
        }
        writer = threadFactory.newThread(this::run);
        writer.start();
        logger.info("Event service started (maxBatch={})", maxBatch);
        return this;
    }

    /**
     * Submits one event.
     */
    public EventTracker write(Event event) {
        return writeBatch(List.of(event));
    }

    /**
     * Submits events that must land in the log contiguously and in the given order.
     * An empty list completes immediately.
     *
     * @throws MailboxClosedException if the service has been closed
     */
    public EventTracker writeBatch(List<Event> events) {
        if (events.isEmpty()) {
            return EventTracker.completed();
        }
        Request<List<Event>, Void> request = Request.of(List.copyOf(events));
        requests.offer(request);
        return new EventTracker(request.reply());
    }

    private void run() {
        List<Request<List<Event>, Void>> pending = new ArrayList<>();
        List<Event> batch = new ArrayList<>();
        try {
            while (true) {
                Request<List<Event>, Void> first = requests.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (first == null) {
                    if (requests.isDrained()) {
                        break;
                    }
                    continue;
                }
                pending.add(first);
                batch.addAll(first.payload());
                while (batch.size() < maxBatch) {
                    Request<List<Event>, Void> next = requests.poll();
                    if (next == null) {
                        break;
                    }
                    pending.add(next);
                    batch.addAll(next.payload());
                }
                flush(batch, pending);
                pending.clear();
                batch.clear();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            PersistenceException error = new PersistenceException("Event service interrupted", e);
            for (Request<List<Event>, Void> request : pending) {
                request.fail(error);
            }
            failQueued(error);
        }
        logger.info("Event service stopped");
    }

    private void flush(List<Event> batch, List<Request<List<Event>, Void>> pending) {
        try {
            journal.append(batch);
            logger.debug("Wrote {} events to log", batch.size());
            for (Request<List<Event>, Void> request : pending) {
                request.complete(null);
            }
        } catch (IOException | RuntimeException e) {
            PersistenceException error = new PersistenceException("failed to write events", e);
            logger.error("Failed to write {} events", batch.size(), e);
            for (Request<List<Event>, Void> request : pending) {
                request.fail(error);
            }
        }
    }

    private void failQueued(PersistenceException error) {
        Request<List<Event>, Void> request;
        while ((request = requests.poll()) != null) {
            request.fail(error);
        }
    }

    /**
     * Stops accepting requests, waits for the writer to flush what is already queued,
     * then closes the journal.
     */
    @Override
    public void close() throws IOException {
        requests.close();
        Thread current = writer;
        if (current != null) {
            try {
                current.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for the event service to drain");
            }
        } else {
            failQueued(new PersistenceException("Event service closed before start", null));
        }
        journal.close();
    }

    /**
     * @return the number of requests waiting for the writer
     */
    public int queuedRequests() {
        return requests.size();
    }
}
