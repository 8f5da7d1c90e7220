package com.anonrelay.transport;

/**
 * A remote send failed. The failure is reported to the command that caused it; events
 * already written stay written.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
