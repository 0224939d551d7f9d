package com.taskloom.core.conversation;

/**
 * Thrown when the generation service fails mid-stream.
 */
public class StreamException extends ConversationException {

    public StreamException(String message) {
        super(message);
    }

    public StreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
