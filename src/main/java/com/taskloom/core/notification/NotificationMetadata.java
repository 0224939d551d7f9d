package com.taskloom.core.notification;

import com.taskloom.core.model.AgentRole;

/**
 * Context used to decide whether and how to notify.
 *
 * @param agentRole        role of the linked agent run (null for user-initiated conversations)
 * @param workflowComplete the task's workflow-complete flag
 * @param agentId          custom agent id, for agent deep links (may be null)
 * @param projectId        owning project, for deep links (may be null)
 */
public record NotificationMetadata(
    AgentRole agentRole,
    boolean workflowComplete,
    Long agentId,
    Long projectId
) {
}
