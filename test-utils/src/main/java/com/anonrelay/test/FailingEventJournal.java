package com.anonrelay.test;

import com.anonrelay.persistence.Event;
import com.anonrelay.persistence.EventJournal;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Journal whose every append fails with an {@link IOException}.
 */
public class FailingEventJournal implements EventJournal {

    private final String message;
    private final AtomicInteger attempts = new AtomicInteger();

    public FailingEventJournal() {
        this("simulated write failure");
    }

    public FailingEventJournal(String message) {
        this.message = message;
    }

    @Override
    public void append(List<Event> events) throws IOException {
        attempts.incrementAndGet();
        throw new IOException(message);
    }

    public int attempts() {
        return attempts.get();
    }

    @Override
    public void close() {
    }
}
