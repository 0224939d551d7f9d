package com.taskloom.core.agent;

import com.taskloom.core.conversation.ConversationException;

/**
 * Thrown when an agent run could not be started.
 * <p>
 * When the run record had already been created, its id is available from {@link #runId()}.
 * That run is either marked failed or, after a start timeout, left running until its
 * stream ends.
 */
public class AgentRunStartException extends ConversationException {

    private final Long runId;

    public AgentRunStartException(String message, Long runId, Throwable cause) {
        super(message, cause);
        this.runId = runId;
    }

    public Long runId() {
        return runId;
    }
}
