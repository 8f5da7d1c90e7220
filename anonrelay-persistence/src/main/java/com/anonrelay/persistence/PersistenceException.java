package com.anonrelay.persistence;

/**
 * Failure of one physical write. A single instance is handed to every caller whose
 * events were coalesced into the failed batch.
 */
public class PersistenceException extends JournalException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
