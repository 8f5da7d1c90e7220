package com.anonrelay.command;

/**
 * Turns message text into a {@link Command}.
 *
 * <p>The first whitespace-delimited token selects the command. A chat-style
 * {@code /cmd@botname} token is accepted as {@code /cmd}. Any message sent as a reply to
 * another message is a {@link Command.Reply}, whatever its first token.
 */
public final class CommandParser {

    private CommandParser() {
    }

    /**
     * @param text             message text, or null for a non-text message
     * @param messageId        transport id of the message
     * @param replyToMessageId id of the message this one replies to, or null
     * @throws CommandParseException if the text is not a valid command
     */
    public static Command parse(String text, long messageId, Long replyToMessageId) {
        if (text == null) {
            throw new CommandParseException("non-text messages are not supported");
        }
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            throw new CommandParseException("empty message");
        }
        if (replyToMessageId != null) {
            return new Command.Reply(replyToMessageId, messageId, trimmed);
        }

        String[] headAndRest = splitHead(trimmed);
        String head = commandName(headAndRest[0]);
        String rest = headAndRest[1];
        switch (head) {
            case "/start":
                return new Command.Start();
            case "/help":
                return new Command.Help();
            case "/users":
                return new Command.Users();
            case "/threads":
                return new Command.Threads();
            case "/banlist":
                return new Command.Banlist();
            case "/stop":
                return new Command.Stop();
            case "/random":
                return new Command.Random(messageId, requireText(rest));
            case "/broadcast":
                return new Command.Broadcast(requireText(rest));
            case "/send": {
                String[] threadAndText = splitHead(rest);
                String threadId = requireThreadId(threadAndText[0], "no receiver specified");
                return new Command.Send(threadId, messageId, requireText(threadAndText[1]));
            }
            case "/close":
                return new Command.Close(requireThreadId(splitHead(rest)[0], "no thread specified"));
            case "/ban":
                return new Command.Ban(requireThreadId(splitHead(rest)[0], "no thread specified"));
            case "/unban":
                return new Command.Unban(requireThreadId(splitHead(rest)[0], "no thread specified"));
            default:
                throw new CommandParseException("unknown command: " + headAndRest[0]);
        }
    }

    private static String[] splitHead(String text) {
        String stripped = text.stripLeading();
        int end = 0;
        while (end < stripped.length() && !Character.isWhitespace(stripped.charAt(end))) {
            end++;
        }
        return new String[]{stripped.substring(0, end), stripped.substring(end).stripLeading()};
    }

    private static String commandName(String token) {
        int at = token.indexOf('@');
        if (token.startsWith("/") && at > 0) {
            return token.substring(0, at);
        }
        return token;
    }

    private static String requireText(String text) {
        if (text.isEmpty()) {
            throw new CommandParseException("no message text specified");
        }
        return text;
    }

    private static String requireThreadId(String token, String missingMessage) {
        if (token.isEmpty()) {
            throw new CommandParseException(missingMessage);
        }
        if (token.length() < 2 || !(token.startsWith("@") || token.startsWith("#"))) {
            throw new CommandParseException("invalid thread id: " + token);
        }
        return token;
    }
}
