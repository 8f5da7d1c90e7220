package com.anonrelay.mailbox;

/**
 * Thrown when a producer sends to a mailbox whose consumer has retired.
 */
public class MailboxClosedException extends IllegalStateException {

    public MailboxClosedException(String message) {
        super(message);
    }
}
