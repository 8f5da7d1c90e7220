package com.anonrelay.transport;

import com.anonrelay.ActorException;
import com.anonrelay.RelayException;
import com.anonrelay.command.Command;
import com.anonrelay.command.CommandParseException;
import com.anonrelay.command.CommandParser;
import com.anonrelay.dispatch.CommandDispatcher;
import com.anonrelay.mailbox.Result;
import com.anonrelay.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for messages arriving from the transport. Parses the text, dispatches the
 * command and answers a failed command with {@code Error: <message>.}.
 *
 * <p>{@link ActorException} is not a command failure and propagates to the caller.
 */
public class IncomingMessageHandler {
    private static final Logger logger = LoggerFactory.getLogger(IncomingMessageHandler.class);

    private final CommandDispatcher dispatcher;
    private final ChatTransport transport;

    public IncomingMessageHandler(CommandDispatcher dispatcher, ChatTransport transport) {
        this.dispatcher = dispatcher;
        this.transport = transport;
    }

    /**
     * @param user             sender
     * @param chatId           sender's chat session
     * @param text             message text, or null for a non-text message
     * @param messageId        transport id of the message
     * @param replyToMessageId id of the message this one replies to, or null
     * @return the outcome of the command
     */
    public Result<Void> handle(User user, long chatId, String text, long messageId, Long replyToMessageId) {
        logger.debug("Incoming message {} from @{}", messageId, user.login());
        Result<Void> result;
        try {
            Command command = CommandParser.parse(text, messageId, replyToMessageId);
            result = dispatcher.dispatch(user, chatId, command);
        } catch (CommandParseException e) {
            result = Result.failure(new RelayException("failed to parse command", e));
        }
        result.ifFailure(error -> reportFailure(user, chatId, error));
        return result;
    }

    private void reportFailure(User user, long chatId, Throwable error) {
        String message = "Error: " + RelayException.describe(error) + ".";
        logger.warn("Command from @{} failed: {}", user.login(), message);
        try {
            transport.sendMessage(chatId, message);
        } catch (TransportException e) {
            logger.warn("Could not report failure to @{}", user.login(), e);
        }
    }
}
