package com.anonrelay.persistence;

import com.anonrelay.model.User;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.WritableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileEventJournalTest {

    @TempDir
    Path tempDir;

    @Test
    void testAppendsOneLinePerEvent() throws Exception {
        Path log = tempDir.resolve("nested/events.log");
        try (FileEventJournal journal = FileEventJournal.open(log, false)) {
            journal.append(List.of(new Event.UserConnected(new User("a", "Ann", "Lee"), 1L),
                    new Event.UserStopped("a")));
        }

        List<String> lines = Files.readAllLines(log, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).startsWith("{\"UserConnected\""));
        assertEquals("{\"UserStopped\":{\"login\":\"a\"}}", lines.get(1));
    }

    @Test
    void testReopenAppendsInsteadOfTruncating() throws Exception {
        Path log = tempDir.resolve("events.log");
        try (FileEventJournal journal = FileEventJournal.open(log, true)) {
            journal.append(List.of(new Event.UserStopped("a")));
        }
        try (FileEventJournal journal = FileEventJournal.open(log, true)) {
            journal.append(List.of(new Event.UserStarted("a")));
        }

        assertEquals(List.of(new Event.UserStopped("a"), new Event.UserStarted("a")), readEvents(log));
    }

    @Test
    void testFailedWriteLeavesNothingBehind() throws Exception {
        Path log = tempDir.resolve("events.log");
        FailingChannel channel = FailingChannel.open(log);
        channel.failNextWrite = true;

        try (FileEventJournal journal = new FileEventJournal(log, channel, false)) {
            journal.append(List.of(new Event.UserStarted("a")));

            IOException e = assertThrows(IOException.class,
                    () -> journal.append(List.of(new Event.UserStopped("alice"), new Event.UserStopped("carol"))));
            assertEquals("disk full", e.getMessage());
            assertTrue(channel.partialBytesWritten > 0);

            journal.append(List.of(new Event.UserStarted("bob")));
        }

        assertEquals(List.of(new Event.UserStarted("a"), new Event.UserStarted("bob")), readEvents(log));
    }

    @Test
    void testFailedForceDiscardsTheWrittenBatch() throws Exception {
        Path log = tempDir.resolve("events.log");
        FailingChannel channel = FailingChannel.open(log);
        channel.failNextForce = true;

        try (FileEventJournal journal = new FileEventJournal(log, channel, true)) {
            assertThrows(IOException.class, () -> journal.append(List.of(new Event.UserStopped("alice"))));
            journal.append(List.of(new Event.UserStarted("bob")));
        }

        assertEquals(List.of(new Event.UserStarted("bob")), readEvents(log));
    }

    @Test
    @Timeout(10)
    void testEventReportedAsFailedIsNotInTheLog() throws Exception {
        Path log = tempDir.resolve("events.log");
        FailingChannel channel = FailingChannel.open(log);
        channel.failNextWrite = true;

        try (EventService service = new EventService(new FileEventJournal(log, channel, false)).start()) {
            PersistenceException e = assertThrows(PersistenceException.class,
                    () -> service.write(new Event.UserStopped("alice")).awaitWritten());
            assertEquals("failed to write events", e.getMessage());
            assertEquals("disk full", e.getCause().getMessage());

            service.write(new Event.UserStarted("bob")).awaitWritten();
        }

        assertEquals(List.of(new Event.UserStarted("bob")), readEvents(log));
    }

    private static List<Event> readEvents(Path log) throws IOException {
        List<Event> events = new ArrayList<>();
        try (EventLogReader reader = EventLogReader.open(log)) {
            reader.events().forEachRemaining(events::add);
        }
        return events;
    }

    /**
     * Channel over a real file that can fail once: a write fails after putting half the
     * buffer on disk, a force fails after the data was written.
     */
    static class FailingChannel extends FileChannel {
        private final FileChannel delegate;
        volatile boolean failNextWrite;
        volatile boolean failNextForce;
        volatile int partialBytesWritten;

        private FailingChannel(FileChannel delegate) {
            this.delegate = delegate;
        }

        static FailingChannel open(Path path) throws IOException {
            return new FailingChannel(FileChannel.open(path,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND));
        }

        @Override
        public int write(ByteBuffer src) throws IOException {
            if (failNextWrite) {
                failNextWrite = false;
                ByteBuffer half = src.duplicate();
                half.limit(src.position() + Math.max(1, src.remaining() / 2));
                int written = delegate.write(half);
                src.position(src.position() + written);
                partialBytesWritten = written;
                throw new IOException("disk full");
            }
            return delegate.write(src);
        }

        @Override
        public void force(boolean metaData) throws IOException {
            if (failNextForce) {
                failNextForce = false;
                throw new IOException("device gone");
            }
            delegate.force(metaData);
        }

        @Override
        public int read(ByteBuffer dst) throws IOException {
            return delegate.read(dst);
        }

        @Override
        public long read(ByteBuffer[] dsts, int offset, int length) throws IOException {
            return delegate.read(dsts, offset, length);
        }

        @Override
        public long write(ByteBuffer[] srcs, int offset, int length) throws IOException {
            return delegate.write(srcs, offset, length);
        }

        @Override
        public long position() throws IOException {
            return delegate.position();
        }

        @Override
        public FileChannel position(long newPosition) throws IOException {
            delegate.position(newPosition);
            return this;
        }

        @Override
        public long size() throws IOException {
            return delegate.size();
        }

        @Override
        public FileChannel truncate(long size) throws IOException {
            delegate.truncate(size);
            return this;
        }

        @Override
        public long transferTo(long position, long count, WritableByteChannel target) throws IOException {
            return delegate.transferTo(position, count, target);
        }

        @Override
        public long transferFrom(ReadableByteChannel src, long position, long count) throws IOException {
            return delegate.transferFrom(src, position, count);
        }

        @Override
        public int read(ByteBuffer dst, long position) throws IOException {
            return delegate.read(dst, position);
        }

        @Override
        public int write(ByteBuffer src, long position) throws IOException {
            return delegate.write(src, position);
        }

        @Override
        public MappedByteBuffer map(MapMode mode, long position, long size) throws IOException {
            return delegate.map(mode, position, size);
        }

        @Override
        public FileLock lock(long position, long size, boolean shared) throws IOException {
            return delegate.lock(position, size, shared);
        }

        @Override
        public FileLock tryLock(long position, long size, boolean shared) throws IOException {
            return delegate.tryLock(position, size, shared);
        }

        @Override
        protected void implCloseChannel() throws IOException {
            delegate.close();
        }
    }
}
