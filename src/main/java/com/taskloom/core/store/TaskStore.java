package com.taskloom.core.store;

import com.taskloom.core.model.TaskInfo;
import com.taskloom.core.model.TaskStatus;

import java.util.Optional;

/**
 * Read access to tasks (joined with project info) and task status updates.
 */
public interface TaskStore {

    Optional<TaskInfo> findById(long taskId);

    void updateStatus(long taskId, TaskStatus status);

    /** Number of the user's tasks in the given status; drives the badge count. */
    int countByUserAndStatus(long userId, TaskStatus status);
}
