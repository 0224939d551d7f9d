package com.taskloom.core.conversation;

import com.taskloom.core.events.Broadcaster;

/**
 * Identity and delivery context of one session, handed to the completion handler.
 *
 * @param conversationId  the conversation
 * @param taskId          owning task (null for agent sessions)
 * @param agentId         owning agent (null for task sessions)
 * @param sessionId       external session identifier
 * @param userId          acting user (may be null)
 * @param broadcaster     per-conversation event delivery
 * @param taskBroadcaster task-wide fan-out (may be null)
 * @param newSession      true when the session was created by this exchange, false when resumed
 */
public record SessionContext(
    long conversationId,
    Long taskId,
    Long agentId,
    String sessionId,
    Long userId,
    Broadcaster broadcaster,
    Broadcaster taskBroadcaster,
    boolean newSession
) {

    public boolean isTaskBound() {
        return taskId != null;
    }

    SessionContext withSessionId(String id) {
        return new SessionContext(conversationId, taskId, agentId, id, userId, broadcaster, taskBroadcaster,
                newSession);
    }
}
