package com.taskloom.core.notification;

import java.util.concurrent.CompletableFuture;

/**
 * Notifies users about finished responses and keeps their badge count current.
 * <p>
 * All operations are asynchronous. Returned futures complete normally even when
 * delivery fails; failures are logged by the implementation.
 */
public interface NotificationService {

    /**
     * Notifies that a task conversation finished responding, subject to the role gating rules.
     *
     * @param userId         target user
     * @param taskTitle      task title for the message (may be null)
     * @param taskId         owning task (may be null)
     * @param conversationId the finished conversation
     * @param metadata       role and workflow state
     */
    CompletableFuture<Void> notifyComplete(long userId, String taskTitle, Long taskId,
                                           long conversationId, NotificationMetadata metadata);

    /** Notifies that a custom agent finished a run. */
    CompletableFuture<Void> notifyAgentComplete(long userId, String agentName, long agentId,
                                                Long projectId, long conversationId);

    /** Sends the user's in-progress task count as a silent badge update. */
    CompletableFuture<Void> updateBadge(long userId);
}
