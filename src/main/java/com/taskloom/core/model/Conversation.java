package com.taskloom.core.model;

import java.time.Instant;

/**
 * A persisted pairing of a task or a custom agent with one external generation session.
 * <p>
 * Exactly one of {@code taskId} and {@code agentId} is set. The external session
 * identifier stays null until the first streamed chunk carrying it arrives, and is
 * never changed afterwards.
 *
 * @param id                conversation identifier
 * @param taskId            owning task (null for agent conversations)
 * @param agentId           owning agent (null for task conversations)
 * @param externalSessionId identifier assigned by the generation service
 * @param triggeredBy       "user" or "cron"
 * @param createdAt         creation timestamp
 */
public record Conversation(
    long id,
    Long taskId,
    Long agentId,
    String externalSessionId,
    String triggeredBy,
    Instant createdAt
) {

    public Conversation {
        if ((taskId == null) == (agentId == null)) {
            throw new IllegalArgumentException("Conversation must belong to exactly one of task or agent");
        }
    }

    public boolean isTaskBound() {
        return taskId != null;
    }

    public Conversation withExternalSessionId(String sessionId) {
        return new Conversation(id, taskId, agentId, sessionId, triggeredBy, createdAt);
    }
}
