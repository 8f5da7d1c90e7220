package com.anonrelay;

import java.util.ArrayList;
import java.util.List;

/**
 * A user-facing failure of one command: bad syntax, unknown thread, self-targeting,
 * a ban, the wrong thread mode, a stopped user. The message is shown to the user.
 */
public class RelayException extends RuntimeException {

    public RelayException(String message) {
        super(message);
    }

    public RelayException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Renders a failure for the user: the messages of the cause chain joined with
     * {@code ": "}, repeated messages skipped.
     */
    public static String describe(Throwable error) {
        List<String> parts = new ArrayList<>();
        for (Throwable current = error; current != null; current = current.getCause()) {
            String message = current.getMessage();
            if (message != null && !message.isBlank() && !parts.contains(message)) {
                parts.add(message);
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return parts.isEmpty() ? error.getClass().getSimpleName() : String.join(": ", parts);
    }
}
