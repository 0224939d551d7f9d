package com.taskloom.core.conversation;

import java.util.concurrent.CompletableFuture;

/**
 * Thrown when no session identifier was observed within the start timeout.
 * <p>
 * The request keeps streaming; {@link #pendingCompletion()} completes when it terminates.
 * A session that appears late is registered and settled like any other.
 */
public class SessionStartTimeoutException extends ConversationException {

    private final transient CompletableFuture<StreamOutcome> pendingCompletion;

    public SessionStartTimeoutException(long conversationId, long timeoutSeconds,
                                        CompletableFuture<StreamOutcome> pendingCompletion) {
        super("Timed out after " + timeoutSeconds + "s waiting for session of conversation " + conversationId);
        this.pendingCompletion = pendingCompletion;
    }

    public CompletableFuture<StreamOutcome> pendingCompletion() {
        return pendingCompletion;
    }
}
