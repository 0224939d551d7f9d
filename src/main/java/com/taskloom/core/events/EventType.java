package com.taskloom.core.events;

/**
 * Vocabulary of lifecycle events emitted while a conversation streams.
 */
public enum EventType {
    STREAMING_STARTED("streaming-started"),
    STREAMING_ENDED("streaming-ended"),
    CONVERSATION_CREATED("conversation-created"),
    CONVERSATION_ADDED("conversation-added"),
    CLAUDE_RESPONSE("claude-response"),
    SESSION_CREATED("session-created"),
    TOKEN_BUDGET("token-budget"),
    CLAUDE_STATUS("claude-status"),
    CLAUDE_COMPLETE("claude-complete"),
    CLAUDE_ERROR("claude-error"),
    AGENT_RUN_UPDATED("agent-run-updated");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
