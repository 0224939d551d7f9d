package com.taskloom.core.session;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory index from external session identifier to its owner, for reverse lookup
 * by conversation and for enumerating what is live.
 */
@Component
public class StreamingSessionIndex {

    private final ConcurrentHashMap<String, StreamingSessionEntry> entries = new ConcurrentHashMap<>();

    public void register(StreamingSessionEntry entry) {
        entries.put(entry.sessionId(), entry);
    }

    public Optional<StreamingSessionEntry> remove(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(entries.remove(sessionId));
    }

    public Optional<StreamingSessionEntry> get(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(entries.get(sessionId));
    }

    /** The live session of a conversation, if any. */
    public Optional<StreamingSessionEntry> findByConversation(long conversationId) {
        return entries.values().stream()
                .filter(e -> e.conversationId() == conversationId)
                .findFirst();
    }

    public List<StreamingSessionEntry> all() {
        return List.copyOf(entries.values());
    }

    public boolean contains(String sessionId) {
        return sessionId != null && entries.containsKey(sessionId);
    }
}
