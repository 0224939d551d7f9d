package com.taskloom.core.store;

import com.taskloom.core.model.Conversation;

import java.util.Optional;

/**
 * Persistence of conversations.
 */
public interface ConversationStore {

    Conversation createForTask(long taskId, String triggeredBy);

    Conversation createForAgent(long agentId, String triggeredBy);

    Optional<Conversation> findById(long conversationId);

    /**
     * Records the external session identifier of a conversation.
     *
     * @throws IllegalStateException if a different identifier is already recorded
     */
    Conversation updateExternalSessionId(long conversationId, String externalSessionId);

    void delete(long conversationId);
}
