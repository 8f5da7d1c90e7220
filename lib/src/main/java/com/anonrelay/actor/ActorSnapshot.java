package com.anonrelay.actor;

import com.anonrelay.model.AnonymityMode;

import java.util.Map;

/**
 * Value copy of one actor's state, comparable with {@code equals}.
 */
public record ActorSnapshot(
        String login,
        boolean stopped,
        Map<String, ThreadView> threads,
        Map<Long, String> messageIndex,
        Map<String, String> banlist) {

    public ActorSnapshot {
        threads = Map.copyOf(threads);
        messageIndex = Map.copyOf(messageIndex);
        banlist = Map.copyOf(banlist);
    }

    public record ThreadView(String id, AnonymityMode anonMode, String otherId, String otherLogin) {
    }
}
