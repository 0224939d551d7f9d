package com.taskloom.core.conversation;

/**
 * Thrown when a message is sent to a conversation whose external session has not been established.
 */
public class NoSessionYetException extends ConversationException {

    public NoSessionYetException(long conversationId) {
        super("Conversation " + conversationId + " has no session yet");
    }
}
