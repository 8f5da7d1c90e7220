package com.anonrelay.transport;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Transport double that records every outgoing message and numbers them from 1000 on,
 * clear of the ids tests give to incoming messages.
 *
 * <p>A chat can be held: sends to it block until it is released, which keeps the
 * sending actor busy for as long as a test needs.
 */
public class RecordingTransport implements ChatTransport {

    public record Sent(long chatId, long messageId, String text) {
    }

    private final AtomicLong ids = new AtomicLong(1000);
    private final List<Sent> sent = new ArrayList<>();
    private final Set<Long> unreachable = new HashSet<>();
    private final Map<Long, CountDownLatch> held = new ConcurrentHashMap<>();
    private final Set<Long> blocked = ConcurrentHashMap.newKeySet();

    @Override
    public long sendMessage(long chatId, String text) {
        CountDownLatch gate = held.get(chatId);
        if (gate != null) {
            blocked.add(chatId);
            try {
                gate.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException("interrupted while sending to chat " + chatId, e);
            } finally {
                blocked.remove(chatId);
            }
        }
        return record(chatId, text);
    }

    private synchronized long record(long chatId, String text) {
        if (unreachable.contains(chatId)) {
            throw new TransportException("chat " + chatId + " is unreachable");
        }
        long id = ids.incrementAndGet();
        sent.add(new Sent(chatId, id, text));
        return id;
    }

    public synchronized void makeUnreachable(long chatId) {
        unreachable.add(chatId);
    }

    /**
     * Makes sends to the chat block until {@link #release(long)}.
     */
    public void hold(long chatId) {
        held.putIfAbsent(chatId, new CountDownLatch(1));
    }

    public void release(long chatId) {
        CountDownLatch gate = held.remove(chatId);
        if (gate != null) {
            gate.countDown();
        }
    }

    /**
     * @return true while some sender is blocked on the held chat
     */
    public boolean isBlocked(long chatId) {
        return blocked.contains(chatId);
    }

    public synchronized List<String> textsTo(long chatId) {
        return sent.stream().filter(s -> s.chatId() == chatId).map(Sent::text).collect(Collectors.toList());
    }

    public synchronized Sent lastTo(long chatId) {
        List<Sent> toChat = sent.stream().filter(s -> s.chatId() == chatId).collect(Collectors.toList());
        if (toChat.isEmpty()) {
            throw new AssertionError("nothing was sent to chat " + chatId);
        }
        return toChat.get(toChat.size() - 1);
    }

    public synchronized void clear() {
        sent.clear();
    }
}
