package com.anonrelay.command;

import com.anonrelay.RelayException;

/**
 * Message text that is not a valid command.
 */
public class CommandParseException extends RelayException {

    public CommandParseException(String message) {
        super(message);
    }
}
