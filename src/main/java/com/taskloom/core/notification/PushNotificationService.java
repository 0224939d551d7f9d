package com.taskloom.core.notification;

import com.taskloom.core.model.AgentRole;
import com.taskloom.core.model.TaskStatus;
import com.taskloom.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * {@link NotificationService} that builds banner and badge notifications and hands
 * them to a {@link PushGateway}.
 * <p>
 * Gating: user-initiated and planning conversations always notify; implementation
 * and review runs notify only once the task's workflow is complete, so the
 * implementation/review loop does not produce a banner per turn.
 */
public class PushNotificationService implements NotificationService {

    private static final Logger log = LoggerFactory.getLogger(PushNotificationService.class);

    static final String DEEP_LINK_SCHEME = "claudeui://";

    private final PushGateway gateway;
    private final TaskStore taskStore;
    private final Executor executor;
    private final boolean enabled;

    public PushNotificationService(PushGateway gateway, TaskStore taskStore, Executor executor, boolean enabled) {
        this.gateway = gateway;
        this.taskStore = taskStore;
        this.executor = executor;
        this.enabled = enabled;
    }

    @Override
    public CompletableFuture<Void> notifyComplete(long userId, String taskTitle, Long taskId,
                                                  long conversationId, NotificationMetadata metadata) {
        PushNotification notification = buildCompletion(taskTitle, taskId, conversationId, metadata);
        if (notification == null) {
            log.debug("Skipping notification for {} run of task {} (workflow not complete)",
                    metadata.agentRole().wireName(), taskId);
            return CompletableFuture.completedFuture(null);
        }
        return deliver("banner", userId, () -> gateway.sendBanner(userId, notification));
    }

    @Override
    public CompletableFuture<Void> notifyAgentComplete(long userId, String agentName, long agentId,
                                                       Long projectId, long conversationId) {
        Map<String, String> data = new LinkedHashMap<>();
        data.put("type", "agent_complete");
        data.put("agentId", String.valueOf(agentId));
        data.put("conversationId", String.valueOf(conversationId));
        if (projectId != null) {
            data.put("projectId", String.valueOf(projectId));
            data.put("deepLink", DEEP_LINK_SCHEME + "projects/" + projectId + "/agents/" + agentId
                    + "/chat/" + conversationId);
        }
        String message = agentName != null ? agentName + " has finished" : "Your agent has finished";
        var notification = new PushNotification("Agent Finished", message, data);
        return deliver("agent banner", userId, () -> gateway.sendBanner(userId, notification));
    }

    @Override
    public CompletableFuture<Void> updateBadge(long userId) {
        return deliver("badge", userId, () -> {
            int count = taskStore.countByUserAndStatus(userId, TaskStatus.IN_PROGRESS);
            gateway.sendBadge(userId, count);
        });
    }

    /**
     * Builds the completion banner, or returns null when the gating rules suppress it.
     */
    PushNotification buildCompletion(String taskTitle, Long taskId, long conversationId,
                                     NotificationMetadata metadata) {
        AgentRole role = metadata.agentRole();
        boolean workflowComplete = metadata.workflowComplete();
        if (role != null && role.isChainable() && !workflowComplete) {
            return null;
        }

        String title = workflowComplete ? "Task Workflow Complete" : "Claude Response Ready";
        String message;
        if (taskTitle != null) {
            message = workflowComplete ? "Task ready for review: " + taskTitle : "Response ready for: " + taskTitle;
        } else {
            message = workflowComplete ? "Task workflow complete, ready for review" : "Claude has finished responding";
        }

        Long projectId = metadata.projectId();
        String deepLink = null;
        if (projectId != null && taskId != null) {
            deepLink = DEEP_LINK_SCHEME + "projects/" + projectId + "/tasks/" + taskId + "/chat/" + conversationId;
        } else if (projectId != null && metadata.agentId() != null) {
            deepLink = DEEP_LINK_SCHEME + "projects/" + projectId + "/agents/" + metadata.agentId()
                    + "/chat/" + conversationId;
        }

        Map<String, String> data = new LinkedHashMap<>();
        data.put("type", workflowComplete ? "workflow_complete" : "claude_complete");
        putIfPresent(data, "taskId", taskId);
        putIfPresent(data, "agentId", metadata.agentId());
        data.put("conversationId", String.valueOf(conversationId));
        putIfPresent(data, "projectId", projectId);
        putIfPresent(data, "deepLink", deepLink);
        return new PushNotification(title, message, data);
    }

    private CompletableFuture<Void> deliver(String kind, long userId, Runnable send) {
        if (!enabled) {
            log.debug("Notifications disabled, skipping {} for user {}", kind, userId);
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(send, executor)
                .exceptionally(ex -> {
                    log.error("Failed to send {} to user {}: {}", kind, userId, ex.getMessage(), ex);
                    return null;
                });
    }

    private static void putIfPresent(Map<String, String> data, String key, Object value) {
        if (value != null) {
            data.put(key, String.valueOf(value));
        }
    }
}
