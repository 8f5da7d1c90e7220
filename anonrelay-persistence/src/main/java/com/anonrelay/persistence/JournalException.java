package com.anonrelay.persistence;

/**
 * Base exception for event log errors.
 */
public class JournalException extends RuntimeException {

    public JournalException(String message) {
        super(message);
    }

    public JournalException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown when a log record cannot be decoded during replay.
     * A corrupt log is fatal: startup aborts before any actor is spawned.
     */
    public static class CorruptedDataException extends JournalException {
        private final long lineNumber;

        public CorruptedDataException(String message, long lineNumber) {
            super(String.format("%s (line: %d)", message, lineNumber));
            this.lineNumber = lineNumber;
        }

        public CorruptedDataException(String message, long lineNumber, Throwable cause) {
            super(String.format("%s (line: %d)", message, lineNumber), cause);
            this.lineNumber = lineNumber;
        }

        public long getLineNumber() {
            return lineNumber;
        }
    }
}
