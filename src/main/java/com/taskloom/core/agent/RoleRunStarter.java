package com.taskloom.core.agent;

import com.taskloom.core.model.AgentRole;

import java.util.concurrent.CompletableFuture;

/**
 * Starts a run of an agent role against a task.
 * <p>
 * Injected into {@link AgentChainingController} so the controller does not depend
 * on the run-start path directly.
 */
@FunctionalInterface
public interface RoleRunStarter {

    CompletableFuture<AgentRunStart> start(long taskId, AgentRole role, RunContext context);
}
