package com.taskloom.core.conversation;

/**
 * Thrown when a task, agent or conversation referenced by a request does not exist.
 * Raised before any stream is opened.
 */
public class ConversationNotFoundException extends ConversationException {

    public ConversationNotFoundException(String message) {
        super(message);
    }

    public static ConversationNotFoundException task(long taskId) {
        return new ConversationNotFoundException("Task " + taskId + " not found");
    }

    public static ConversationNotFoundException agent(long agentId) {
        return new ConversationNotFoundException("Agent " + agentId + " not found");
    }

    public static ConversationNotFoundException conversation(long conversationId) {
        return new ConversationNotFoundException("Conversation " + conversationId + " not found");
    }
}
