package com.anonrelay.command;

/**
 * A parsed owner command. Commands that carry text also carry the transport id of the
 * message they arrived in, so the actor can index it under the thread it went to.
 */
public sealed interface Command permits Command.Start, Command.Help, Command.Users, Command.Threads,
        Command.Random, Command.Send, Command.Reply, Command.Close, Command.Ban, Command.Unban,
        Command.Banlist, Command.Stop, Command.Broadcast {

    record Start() implements Command {
    }

    record Help() implements Command {
    }

    record Users() implements Command {
    }

    record Threads() implements Command {
    }

    record Random(long messageId, String text) implements Command {
    }

    /**
     * @param threadId {@code @login} to open or continue a direct thread, or an existing {@code #id}
     */
    record Send(String threadId, long messageId, String text) implements Command {
    }

    /**
     * A transport-level reply to an earlier message; the thread is resolved from
     * {@code replyToMessageId}.
     */
    record Reply(long replyToMessageId, long messageId, String text) implements Command {
    }

    record Close(String threadId) implements Command {
    }

    record Ban(String threadId) implements Command {
    }

    record Unban(String threadId) implements Command {
    }

    record Banlist() implements Command {
    }

    record Stop() implements Command {
    }

    record Broadcast(String text) implements Command {
    }
}
