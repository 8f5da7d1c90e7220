package com.anonrelay.transport;

/**
 * Canned texts sent to users.
 */
public final class Messages {

    public static final String START = String.join("\n",
            "Hello! This is an anonymous chatting bot. Quick start guide:",
            "",
            "* Use command `/send @username Hello!` to send an anonymous message to a particular user;",
            "* Use command `/random Hello!` to start a chat with a random user;",
            "* Use command `/users` to list all available users.",
            "",
            "For more commands, use `/help`.");

    public static final String HELP = String.join("\n",
            "Available commands:",
            "* `/send [receiver] [message]` - send a message. Receiver can either be a @username or a #thread.",
            "* `/random [message]` - start an anonymous thread with a random user.",
            "* `/users` - list available users.",
            "* `/threads` - list active anonymous threads.",
            "* `/close [thread]` - close a thread you started or a random chat.",
            "* `/ban [thread]` - close an anonymous thread and forbid its author to write to you again.",
            "* `/unban [thread]` - lift a ban.",
            "* `/banlist` - list banned threads.",
            "* `/stop` - stop receiving messages.",
            "* `/help` - show this message.",
            "",
            "Hints:",
            "* You can reply to a message instead of using `/send` command.");

    public static final String STOP = String.join("\n",
            "You have stopped the bot. Nobody can write to you until you use `/start` again.");

    private Messages() {
    }
}
