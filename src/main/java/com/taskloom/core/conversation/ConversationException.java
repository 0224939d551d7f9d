package com.taskloom.core.conversation;

/**
 * Base type for failures of the conversation lifecycle.
 */
public class ConversationException extends RuntimeException {

    public ConversationException(String message) {
        super(message);
    }

    public ConversationException(String message, Throwable cause) {
        super(message, cause);
    }
}
