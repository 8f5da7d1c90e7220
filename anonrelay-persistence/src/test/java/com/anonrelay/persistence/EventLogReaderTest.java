package com.anonrelay.persistence;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventLogReaderTest {

    @TempDir
    Path tempDir;

    private static EventLogReader readerOf(String content) {
        return new EventLogReader(new BufferedReader(new StringReader(content)));
    }

    @Test
    void testMissingFileReadsAsEmptyLog() throws Exception {
        try (EventLogReader reader = EventLogReader.open(tempDir.resolve("absent.log"))) {
            assertFalse(reader.events().hasNext());
            assertEquals(0, reader.getLinesRead());
        }
    }

    @Test
    void testReadsEventsInOrder() throws Exception {
        Path log = tempDir.resolve("events.log");
        Files.writeString(log, EventCodec.encode(new Event.UserStopped("a")) + "\n"
                + EventCodec.encode(new Event.UserStarted("a")) + "\n", StandardCharsets.UTF_8);

        List<Event> events = new ArrayList<>();
        try (EventLogReader reader = EventLogReader.open(log)) {
            reader.events().forEachRemaining(events::add);
            assertEquals(2, reader.getLinesRead());
        }

        assertEquals(List.of(new Event.UserStopped("a"), new Event.UserStarted("a")), events);
    }

    @Test
    void testIsLazy() {
        EventLogReader reader = readerOf("{\"UserStopped\":{\"login\":\"a\"}}\ngarbage\n");
        Iterator<Event> events = reader.events();

        assertEquals(new Event.UserStopped("a"), events.next());
        assertEquals(1, reader.getLinesRead());
        JournalException.CorruptedDataException e =
                assertThrows(JournalException.CorruptedDataException.class, events::hasNext);
        assertEquals(2, e.getLineNumber());
    }

    @Test
    void testCanOnlyBeReadOnce() {
        EventLogReader reader = readerOf("");
        reader.events();
        assertThrows(IllegalStateException.class, reader::events);
    }
}
