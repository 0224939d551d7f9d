package com.taskloom.core.agent;

import com.taskloom.core.events.EventType;
import com.taskloom.core.events.LifecycleEvent;
import com.taskloom.core.metrics.TaskloomMetrics;
import com.taskloom.core.model.AgentRole;
import com.taskloom.core.model.AgentRun;
import com.taskloom.core.model.AgentRunStatus;
import com.taskloom.core.model.TaskInfo;
import com.taskloom.core.store.AgentRunStore;
import com.taskloom.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Alternates implementation and review runs on a task until its workflow is complete.
 * <p>
 * After a successful implementation or review run, the complementary role is started
 * following a short delay. The workflow-complete flag is checked both before and after
 * the delay, and no run is started while another run of the task is still running.
 * A failed start is recorded as a failed run so the chain never stalls silently.
 */
public class AgentChainingController {

    private static final Logger log = LoggerFactory.getLogger(AgentChainingController.class);

    private final AgentRunStore runStore;
    private final TaskStore taskStore;
    private final RoleRunStarter starter;
    private final ScheduledExecutorService scheduler;
    private final long delayMs;
    private final TaskloomMetrics metrics;

    public AgentChainingController(AgentRunStore runStore, TaskStore taskStore, RoleRunStarter starter,
                                   ScheduledExecutorService scheduler, long delayMs, TaskloomMetrics metrics) {
        this.runStore = runStore;
        this.taskStore = taskStore;
        this.starter = starter;
        this.scheduler = scheduler;
        this.delayMs = delayMs;
        this.metrics = metrics;
    }

    /**
     * Called after a run of {@code completedRole} finished successfully.
     */
    public void onRunCompleted(long taskId, AgentRole completedRole, RunContext context) {
        if (!completedRole.isChainable()) {
            metrics.recordChainingDecision("skipped");
            return;
        }
        if (isWorkflowComplete(taskId)) {
            log.info("Task {} workflow complete, stopping loop", taskId);
            metrics.recordChainingDecision("workflow_complete");
            return;
        }

        AgentRole nextRole = completedRole.complement();
        log.info("Chaining {} -> {} for task {} in {}ms", completedRole.wireName(), nextRole.wireName(),
                taskId, delayMs);
        scheduler.schedule(() -> chain(taskId, nextRole, context), delayMs, TimeUnit.MILLISECONDS);
    }

    private void chain(long taskId, AgentRole nextRole, RunContext context) {
        try {
            if (isWorkflowComplete(taskId)) {
                log.info("Task {} workflow complete (re-check), stopping loop", taskId);
                metrics.recordChainingDecision("workflow_complete");
                return;
            }
            if (runStore.hasRunningRun(taskId)) {
                log.info("Another agent already running on task {}, skipping chain to {}", taskId,
                        nextRole.wireName());
                metrics.recordChainingDecision("overlap");
                return;
            }
            starter.start(taskId, nextRole, context).whenComplete((start, ex) -> {
                if (ex != null) {
                    recordFailure(taskId, nextRole, context, ex);
                } else {
                    metrics.recordChainingDecision("started");
                }
            });
        } catch (RuntimeException e) {
            recordFailure(taskId, nextRole, context, e);
        }
    }

    private void recordFailure(long taskId, AgentRole role, RunContext context, Throwable failure) {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause() : failure;
        log.error("Failed to chain to {} for task {}: {}", role.wireName(), taskId, cause.getMessage(), cause);
        metrics.recordChainingDecision("failed");

        if (cause instanceof AgentRunStartException startFailure && startFailure.runId() != null) {
            return;
        }
        try {
            AgentRun failed = runStore.create(taskId, role, AgentRunStatus.FAILED);
            if (context.taskBroadcaster() != null) {
                context.taskBroadcaster().broadcast(taskId,
                        LifecycleEvent.of(EventType.AGENT_RUN_UPDATED, "taskId", taskId, "agentRun", failed));
            }
        } catch (RuntimeException e) {
            log.error("Failed to record chaining failure for task {}: {}", taskId, e.getMessage(), e);
        }
    }

    private boolean isWorkflowComplete(long taskId) {
        return taskStore.findById(taskId).map(TaskInfo::workflowComplete).orElse(false);
    }
}
