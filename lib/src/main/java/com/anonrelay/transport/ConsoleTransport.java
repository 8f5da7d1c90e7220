package com.anonrelay.transport;

import com.anonrelay.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Line-oriented transport for local runs. Each input line is
 * {@code <login> [reply:<messageId>] <text>}; every user gets a chat of their own and
 * outgoing messages are printed as {@code [#<messageId> to @<login>] <text>}. Chats known
 * only from the event log are printed by number.
 */
public class ConsoleTransport implements ChatTransport {
    private static final Logger logger = LoggerFactory.getLogger(ConsoleTransport.class);
    private static final String REPLY_PREFIX = "reply:";

    private final BufferedReader in;
    private final PrintStream out;
    private final AtomicLong messageIds = new AtomicLong();
    private final Map<String, Long> chatsByLogin = new HashMap<>();
    private final Map<Long, String> loginsByChat = new HashMap<>();

    public ConsoleTransport(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    /**
     * Binds a chat restored from the event log to its login.
     */
    public synchronized void registerChat(String login, long chatId) {
        chatsByLogin.put(login, chatId);
        loginsByChat.put(chatId, login);
    }

    /**
     * Continues message numbering after the highest id already present in the event log.
     */
    public void resumeAfter(long lastMessageId) {
        messageIds.accumulateAndGet(lastMessageId, Math::max);
    }

    @Override
    public long sendMessage(long chatId, String text) {
        String login;
        synchronized (this) {
            login = loginsByChat.get(chatId);
        }
        String recipient = login != null ? "@" + login : "chat " + chatId;
        long id = messageIds.incrementAndGet();
        synchronized (out) {
            out.println("[#" + id + " to " + recipient + "] " + text);
        }
        return id;
    }

    /**
     * Reads lines until end of input, handing each one to the handler.
     */
    public void run(IncomingMessageHandler handler) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            handleLine(line, handler);
        }
        logger.info("Console input closed");
    }

    void handleLine(String line, IncomingMessageHandler handler) {
        String[] parts = line.strip().split("\\s+", 2);
        String login = parts[0].startsWith("@") ? parts[0].substring(1) : parts[0];
        String text = parts.length > 1 ? parts[1] : "";
        Long replyTo = null;
        if (text.startsWith(REPLY_PREFIX)) {
            String[] replyAndText = text.split("\\s+", 2);
            try {
                replyTo = Long.parseLong(replyAndText[0].substring(REPLY_PREFIX.length()));
            } catch (NumberFormatException e) {
                out.println("Invalid reply target: " + replyAndText[0]);
                return;
            }
            text = replyAndText.length > 1 ? replyAndText[1] : "";
        }
        long chatId = chatOf(login);
        long messageId = messageIds.incrementAndGet();
        out.println("[#" + messageId + " from @" + login + "] " + text);
        handler.handle(new User(login, login, null), chatId, text, messageId, replyTo);
    }

    private synchronized long chatOf(String login) {
        Long known = chatsByLogin.get(login);
        if (known != null) {
            return known;
        }
        long chatId = 1;
        while (loginsByChat.containsKey(chatId)) {
            chatId++;
        }
        registerChat(login, chatId);
        return chatId;
    }
}
