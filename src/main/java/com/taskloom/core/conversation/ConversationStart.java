package com.taskloom.core.conversation;

import java.util.concurrent.CompletableFuture;

/**
 * Result of starting a conversation, available as soon as the session identifier is known.
 *
 * @param conversationId    the conversation the session belongs to
 * @param externalSessionId identifier assigned by the generation service
 * @param completion        completes when the stream terminates; never completes exceptionally
 */
public record ConversationStart(
    long conversationId,
    String externalSessionId,
    CompletableFuture<StreamOutcome> completion
) {
}
