package com.anonrelay.persistence;

import java.io.IOException;
import java.util.List;

/**
 * Append-only sink for log records.
 */
public interface EventJournal extends AutoCloseable {

    /**
     * Appends the events in order and makes them durable before returning.
     *
     * @param events events to append, never empty
     * @throws IOException if writing or flushing fails
     */
    void append(List<Event> events) throws IOException;

    @Override
    void close() throws IOException;
}
