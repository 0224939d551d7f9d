package com.taskloom.core.store;

import com.taskloom.core.model.Conversation;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe in-memory {@link ConversationStore}.
 */
public class InMemoryConversationStore implements ConversationStore {

    private final ConcurrentHashMap<Long, Conversation> conversations = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final Clock clock;

    public InMemoryConversationStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Conversation createForTask(long taskId, String triggeredBy) {
        return save(new Conversation(ids.incrementAndGet(), taskId, null, null, triggeredBy, clock.instant()));
    }

    @Override
    public Conversation createForAgent(long agentId, String triggeredBy) {
        return save(new Conversation(ids.incrementAndGet(), null, agentId, null, triggeredBy, clock.instant()));
    }

    @Override
    public Optional<Conversation> findById(long conversationId) {
        return Optional.ofNullable(conversations.get(conversationId));
    }

    @Override
    public Conversation updateExternalSessionId(long conversationId, String externalSessionId) {
        Objects.requireNonNull(externalSessionId, "externalSessionId");
        Conversation updated = conversations.computeIfPresent(conversationId, (id, existing) -> {
            if (existing.externalSessionId() != null && !existing.externalSessionId().equals(externalSessionId)) {
                throw new IllegalStateException("Conversation " + id + " is already bound to session "
                        + existing.externalSessionId());
            }
            return existing.withExternalSessionId(externalSessionId);
        });
        if (updated == null) {
            throw new IllegalArgumentException("Conversation " + conversationId + " not found");
        }
        return updated;
    }

    @Override
    public void delete(long conversationId) {
        conversations.remove(conversationId);
    }

    private Conversation save(Conversation conversation) {
        conversations.put(conversation.id(), conversation);
        return conversation;
    }
}
