package com.anonrelay.persistence;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy, forward-only reader over a newline-delimited event log.
 *
 * <p>{@link #events()} may be called once. Iteration stops cleanly at end of input; a
 * line that does not decode raises {@link JournalException.CorruptedDataException}.
 */
public class EventLogReader implements AutoCloseable {

    private final BufferedReader reader;
    private boolean consumed;
    private long linesRead;

    public EventLogReader(BufferedReader reader) {
        this.reader = reader;
    }

    /**
     * Opens the log at the given path. A missing file reads as an empty log.
     */
    public static EventLogReader open(Path path) throws IOException {
        if (!Files.exists(path)) {
            return new EventLogReader(new BufferedReader(new StringReader("")));
        }
        return new EventLogReader(Files.newBufferedReader(path, StandardCharsets.UTF_8));
    }

    public Iterator<Event> events() {
        if (consumed) {
            throw new IllegalStateException("Event log can only be read once");
        }
        consumed = true;
        return new Iterator<>() {
            private Event next;
            private boolean finished;

            @Override
            public boolean hasNext() {
                if (next != null) {
                    return true;
                }
                if (finished) {
                    return false;
                }
                String line;
                try {
                    line = reader.readLine();
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to read event log", e);
                }
                if (line == null) {
                    finished = true;
                    return false;
                }
                linesRead++;
                next = EventCodec.decode(line, linesRead);
                return true;
            }

            @Override
            public Event next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Event event = next;
                next = null;
                return event;
            }
        };
    }

    /**
     * @return number of records consumed so far
     */
    public long getLinesRead() {
        return linesRead;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
