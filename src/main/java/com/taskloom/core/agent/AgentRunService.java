package com.taskloom.core.agent;

import com.taskloom.core.conversation.ConversationNotFoundException;
import com.taskloom.core.conversation.ConversationOptions;
import com.taskloom.core.conversation.ConversationOrchestrator;
import com.taskloom.core.conversation.ConversationStart;
import com.taskloom.core.conversation.SessionStartTimeoutException;
import com.taskloom.core.events.EventType;
import com.taskloom.core.events.LifecycleEvent;
import com.taskloom.core.model.AgentRole;
import com.taskloom.core.model.AgentRun;
import com.taskloom.core.model.AgentRunStatus;
import com.taskloom.core.model.Conversation;
import com.taskloom.core.model.TaskInfo;
import com.taskloom.core.model.TaskStatus;
import com.taskloom.core.notification.NotificationService;
import com.taskloom.core.store.AgentRunStore;
import com.taskloom.core.store.ConversationStore;
import com.taskloom.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Starts agent-role runs against tasks.
 * <p>
 * A run gets its own conversation, is linked to it before streaming begins, and is
 * settled by the completion handler when the stream ends. If the conversation cannot
 * be started the run is marked failed here, so a stuck "running" record never blocks
 * later runs of the task. After a start timeout the run stays running until its stream
 * ends, since a late session may still arrive.
 */
public class AgentRunService {

    private static final Logger log = LoggerFactory.getLogger(AgentRunService.class);

    static final String PERMISSION_MODE = "bypassPermissions";

    private final TaskStore taskStore;
    private final AgentRunStore runStore;
    private final ConversationStore conversationStore;
    private final ConversationOrchestrator orchestrator;
    private final NotificationService notifications;
    private final ContextPromptBuilder contextPromptBuilder;

    public AgentRunService(TaskStore taskStore, AgentRunStore runStore, ConversationStore conversationStore,
                           ConversationOrchestrator orchestrator, NotificationService notifications,
                           ContextPromptBuilder contextPromptBuilder) {
        this.taskStore = taskStore;
        this.runStore = runStore;
        this.conversationStore = conversationStore;
        this.orchestrator = orchestrator;
        this.notifications = notifications;
        this.contextPromptBuilder = contextPromptBuilder;
    }

    /**
     * Starts a run of {@code role} on a task.
     *
     * @return a future completing once the run's session is established; on failure it
     *         completes with an {@link AgentRunStartException}
     * @throws ConversationNotFoundException if the task does not exist
     */
    public CompletableFuture<AgentRunStart> startAgentRun(long taskId, AgentRole role, RunContext context) {
        TaskInfo task = taskStore.findById(taskId).orElseThrow(() -> ConversationNotFoundException.task(taskId));
        String message = AgentPrompts.forRole(role, taskId);

        AgentRun created = runStore.create(taskId, role, AgentRunStatus.RUNNING);
        Conversation conversation = conversationStore.createForTask(taskId, ConversationOptions.TRIGGER_USER);
        AgentRun run = runStore.linkConversation(created.id(), conversation.id());
        log.info("Agent run {} ({}) linked to conversation {} for task {}", run.id(), role.wireName(),
                conversation.id(), taskId);

        if (task.status() == TaskStatus.PENDING) {
            taskStore.updateStatus(taskId, TaskStatus.IN_PROGRESS);
            log.info("Task {} moved to {}", taskId, TaskStatus.IN_PROGRESS.wireName());
            if (context.userId() != null) {
                notifications.updateBadge(context.userId()).exceptionally(ex -> {
                    log.error("Failed to update badge for user {}: {}", context.userId(), ex.getMessage(), ex);
                    return null;
                });
            }
        }

        String contextPrompt = contextPromptBuilder.build(task.workingDirectory(), taskId);
        broadcastRun(context, run);

        ConversationOptions options = ConversationOptions.defaults()
                .withConversationId(conversation.id())
                .withBroadcasters(context.broadcaster(), context.taskBroadcaster())
                .withUserId(context.userId())
                .withPermissionMode(PERMISSION_MODE)
                .withCustomSystemPrompt(contextPrompt.isEmpty() ? null : contextPrompt);

        CompletableFuture<ConversationStart> started;
        try {
            started = orchestrator.startConversation(taskId, message, options);
        } catch (RuntimeException e) {
            throw startFailed(run, context, e);
        }
        return started.handle((start, ex) -> {
            if (ex != null) {
                Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                throw new CompletionException(startFailed(run, context, cause));
            }
            return new AgentRunStart(run, start);
        });
    }

    /** The running run of a task, if any. */
    public Optional<AgentRun> getRunningAgentForTask(long taskId) {
        return runStore.findRunningByTask(taskId);
    }

    /**
     * Marks every running run of a task completed. Recovery for stuck runs.
     *
     * @return number of runs completed
     */
    public int forceCompleteRunningAgents(long taskId) {
        int count = 0;
        for (AgentRun run : runStore.findByTask(taskId)) {
            if (run.isRunning()) {
                runStore.updateStatus(run.id(), AgentRunStatus.COMPLETED);
                log.info("Force-completed stuck agent run {}", run.id());
                count++;
            }
        }
        return count;
    }

    private AgentRunStartException startFailed(AgentRun run, RunContext context, Throwable cause) {
        log.error("Agent run {} ({}) failed to start: {}", run.id(), run.role().wireName(), cause.getMessage(), cause);
        Long runId = null;
        if (cause instanceof SessionStartTimeoutException timeout && timeout.pendingCompletion() != null) {
            // The stream is still open; a late session settles the run through the completion handler.
            timeout.pendingCompletion().thenRun(() -> failIfStillRunning(run, context));
            runId = run.id();
        } else if (failIfStillRunning(run, context)) {
            runId = run.id();
        }
        return new AgentRunStartException("Failed to start " + run.role().wireName() + " run for task "
                + run.taskId() + ": " + cause.getMessage(), runId, cause);
    }

    /**
     * Marks the run failed unless something already settled it.
     *
     * @return false if the run record could not be read or updated
     */
    private boolean failIfStillRunning(AgentRun run, RunContext context) {
        try {
            Optional<AgentRun> current = runStore.findById(run.id());
            if (current.isPresent() && current.get().isRunning()) {
                broadcastRun(context, runStore.updateStatus(run.id(), AgentRunStatus.FAILED));
                log.info("Agent run {} marked failed", run.id());
            }
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to mark agent run {} failed: {}", run.id(), e.getMessage(), e);
            return false;
        }
    }

    private static void broadcastRun(RunContext context, AgentRun run) {
        if (context.taskBroadcaster() != null) {
            context.taskBroadcaster().broadcast(run.taskId(),
                    LifecycleEvent.of(EventType.AGENT_RUN_UPDATED, "taskId", run.taskId(), "agentRun", run));
        }
    }
}
