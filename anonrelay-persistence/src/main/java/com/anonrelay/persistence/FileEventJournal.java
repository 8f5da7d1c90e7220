package com.anonrelay.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * File-backed event journal holding newline-delimited JSON. The file is opened in append
 * mode and never rewritten.
 *
 * <p>A batch is encoded in full before anything reaches the file. If writing or forcing
 * it fails, the file is truncated back to its size before the batch, so a batch reported
 * as failed never becomes part of the log.
 */
public class FileEventJournal implements EventJournal {
    private static final Logger logger = LoggerFactory.getLogger(FileEventJournal.class);

    private final Path path;
    private final FileChannel channel;
    private final boolean fsync;

    FileEventJournal(Path path, FileChannel channel, boolean fsync) {
        this.path = path;
        this.channel = channel;
        this.fsync = fsync;
    }

    /**
     * Opens (creating if needed) the log file for appending.
     *
     * @param path  the log file
     * @param fsync whether every append also forces the file contents to the device
     * @return the journal
     * @throws IOException if the file cannot be opened
     */
    public static FileEventJournal open(Path path, boolean fsync) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        FileChannel channel = FileChannel.open(path,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        logger.info("Opened event log {} for append (fsync={})", path, fsync);
        return new FileEventJournal(path, channel, fsync);
    }

    @Override
    public synchronized void append(List<Event> events) throws IOException {
        ByteBuffer batch = encode(events);
        long sizeBefore = channel.size();
        try {
            while (batch.hasRemaining()) {
                channel.write(batch);
            }
            if (fsync) {
                channel.force(false);
            }
        } catch (IOException e) {
            discardPartialBatch(sizeBefore, e);
            throw e;
        }
        logger.debug("Appended {} events", events.size());
    }

    private void discardPartialBatch(long sizeBefore, IOException failure) {
        try {
            channel.truncate(sizeBefore);
            logger.warn("Append of a batch failed, event log truncated back to {} bytes", sizeBefore);
        } catch (IOException e) {
            failure.addSuppressed(e);
            logger.error("Could not truncate event log {} after a failed append", path, e);
        }
    }

    private static ByteBuffer encode(List<Event> events) {
        StringBuilder lines = new StringBuilder();
        for (Event event : events) {
            lines.append(EventCodec.encode(event)).append('\n');
        }
        return ByteBuffer.wrap(lines.toString().getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public synchronized void close() throws IOException {
        channel.close();
    }

    public Path getPath() {
        return path;
    }
}
