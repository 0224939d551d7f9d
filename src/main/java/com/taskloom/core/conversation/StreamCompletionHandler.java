package com.taskloom.core.conversation;

import com.taskloom.core.agent.AgentChainingController;
import com.taskloom.core.agent.RunContext;
import com.taskloom.core.events.EventType;
import com.taskloom.core.events.LifecycleEvent;
import com.taskloom.core.model.Agent;
import com.taskloom.core.model.AgentRun;
import com.taskloom.core.model.AgentRunStatus;
import com.taskloom.core.model.TaskInfo;
import com.taskloom.core.notification.NotificationMetadata;
import com.taskloom.core.notification.NotificationService;
import com.taskloom.core.store.AgentRunStore;
import com.taskloom.core.store.AgentStore;
import com.taskloom.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Shared end-of-session lifecycle: announces the end of streaming, settles the linked
 * agent run, triggers chaining and queues push notifications.
 * <p>
 * Invoked exactly once for each session that became active.
 */
public class StreamCompletionHandler {

    private static final Logger log = LoggerFactory.getLogger(StreamCompletionHandler.class);

    private final AgentRunStore runStore;
    private final TaskStore taskStore;
    private final AgentStore agentStore;
    private final AgentChainingController chaining;
    private final NotificationService notifications;

    public StreamCompletionHandler(AgentRunStore runStore, TaskStore taskStore, AgentStore agentStore,
                                   AgentChainingController chaining, NotificationService notifications) {
        this.runStore = runStore;
        this.taskStore = taskStore;
        this.agentStore = agentStore;
        this.chaining = chaining;
        this.notifications = notifications;
    }

    public void onStreamingComplete(SessionContext context, boolean isError) {
        context.broadcaster().broadcast(context.conversationId(), LifecycleEvent.of(EventType.STREAMING_ENDED,
                "taskId", context.taskId(),
                "agentId", context.agentId(),
                "conversationId", context.conversationId()));
        log.info("Streaming ended for conversation {} (error={})", context.conversationId(), isError);

        if (context.isTaskBound()) {
            completeTaskSession(context, isError);
        } else if (!isError) {
            notifyAgentComplete(context);
        }
    }

    private void completeTaskSession(SessionContext context, boolean isError) {
        long taskId = context.taskId();
        Optional<AgentRun> linked = runStore.findByConversationId(context.conversationId());

        if (linked.isPresent() && linked.get().isRunning()) {
            AgentRun run = linked.get();
            AgentRunStatus status = isError ? AgentRunStatus.FAILED : AgentRunStatus.COMPLETED;
            AgentRun updated = runStore.updateStatus(run.id(), status);
            log.info("Agent run {} ({}) {}", run.id(), run.role().wireName(), status.wireName());

            if (context.taskBroadcaster() != null) {
                context.taskBroadcaster().broadcast(taskId,
                        LifecycleEvent.of(EventType.AGENT_RUN_UPDATED, "taskId", taskId, "agentRun", updated));
            }
            if (!isError && run.role().isChainable()) {
                try {
                    chaining.onRunCompleted(taskId, run.role(),
                            new RunContext(context.userId(), context.broadcaster(), context.taskBroadcaster()));
                } catch (RuntimeException e) {
                    log.error("Chaining after run {} failed: {}", run.id(), e.getMessage(), e);
                }
            }
        }

        if (isError || context.userId() == null) {
            return;
        }
        Optional<TaskInfo> task = taskStore.findById(taskId);
        var metadata = new NotificationMetadata(
                linked.map(AgentRun::role).orElse(null),
                task.map(TaskInfo::workflowComplete).orElse(false),
                null,
                task.map(TaskInfo::projectId).orElse(null));
        notifications.notifyComplete(context.userId(), task.map(TaskInfo::title).orElse(null), taskId,
                        context.conversationId(), metadata)
                .exceptionally(ex -> {
                    log.error("Failed to send notification for conversation {}: {}",
                            context.conversationId(), ex.getMessage(), ex);
                    return null;
                });
    }

    private void notifyAgentComplete(SessionContext context) {
        Optional<Agent> agent = agentStore.findById(context.agentId());
        Long userId = context.userId() != null ? context.userId() : agent.map(Agent::userId).orElse(null);
        if (userId == null) {
            return;
        }
        notifications.notifyAgentComplete(userId, agent.map(Agent::name).orElse(null), context.agentId(),
                        agent.map(Agent::projectId).orElse(null), context.conversationId())
                .exceptionally(ex -> {
                    log.error("Failed to send agent notification for conversation {}: {}",
                            context.conversationId(), ex.getMessage(), ex);
                    return null;
                });
    }
}
