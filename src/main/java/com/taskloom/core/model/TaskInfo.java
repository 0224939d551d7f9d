package com.taskloom.core.model;

import java.nio.file.Path;

/**
 * A task joined with the project information the orchestrator needs.
 *
 * @param id               task identifier
 * @param projectId        owning project
 * @param title            task title, used in notifications
 * @param status           board status
 * @param workflowComplete set by business logic when the implementation/review loop should stop
 * @param workingDirectory the project's repository folder
 * @param userId           owning user (null when unknown)
 */
public record TaskInfo(
    long id,
    long projectId,
    String title,
    TaskStatus status,
    boolean workflowComplete,
    Path workingDirectory,
    Long userId
) {

    public TaskInfo withStatus(TaskStatus newStatus) {
        return new TaskInfo(id, projectId, title, newStatus, workflowComplete, workingDirectory, userId);
    }

    public TaskInfo withWorkflowComplete(boolean complete) {
        return new TaskInfo(id, projectId, title, status, complete, workingDirectory, userId);
    }
}
