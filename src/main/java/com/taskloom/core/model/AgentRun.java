package com.taskloom.core.model;

import java.time.Instant;

/**
 * One execution of an agent role against a task.
 *
 * @param id             run identifier
 * @param taskId         the task the run works on
 * @param role           which agent role ran
 * @param status         running, completed or failed
 * @param conversationId linked conversation (null until the conversation is created)
 * @param createdAt      when the run record was created
 * @param completedAt    when the run left RUNNING (null while running)
 */
public record AgentRun(
    long id,
    long taskId,
    AgentRole role,
    AgentRunStatus status,
    Long conversationId,
    Instant createdAt,
    Instant completedAt
) {

    public boolean isRunning() {
        return status == AgentRunStatus.RUNNING;
    }

    public AgentRun withStatus(AgentRunStatus newStatus, Instant at) {
        return new AgentRun(id, taskId, role, newStatus, conversationId, createdAt,
                newStatus == AgentRunStatus.RUNNING ? null : at);
    }

    public AgentRun withConversation(long newConversationId) {
        return new AgentRun(id, taskId, role, status, newConversationId, createdAt, completedAt);
    }
}
