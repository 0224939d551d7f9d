package com.taskloom.core.session;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Reverse-index entry naming the logical owner of a live session.
 *
 * @param sessionId      external session identifier
 * @param taskId         owning task (null for agent sessions)
 * @param agentId        owning agent (null for task sessions)
 * @param conversationId the conversation the session belongs to
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamingSessionEntry(
    String sessionId,
    Long taskId,
    Long agentId,
    long conversationId
) {

    public StreamingSessionEntry {
        if ((taskId == null) == (agentId == null)) {
            throw new IllegalArgumentException("Streaming entry must have exactly one of task or agent");
        }
    }
}
