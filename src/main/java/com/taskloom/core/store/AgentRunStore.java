package com.taskloom.core.store;

import com.taskloom.core.model.AgentRole;
import com.taskloom.core.model.AgentRun;
import com.taskloom.core.model.AgentRunStatus;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of agent runs.
 */
public interface AgentRunStore {

    AgentRun create(long taskId, AgentRole role, AgentRunStatus status);

    Optional<AgentRun> findById(long runId);

    Optional<AgentRun> findByConversationId(long conversationId);

    /** Runs of a task, newest first. */
    List<AgentRun> findByTask(long taskId);

    AgentRun updateStatus(long runId, AgentRunStatus status);

    AgentRun linkConversation(long runId, long conversationId);

    default Optional<AgentRun> findRunningByTask(long taskId) {
        return findByTask(taskId).stream().filter(AgentRun::isRunning).findFirst();
    }

    default boolean hasRunningRun(long taskId) {
        return findRunningByTask(taskId).isPresent();
    }
}
