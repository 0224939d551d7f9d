package com.taskloom.core.store;

import com.taskloom.core.model.TaskInfo;
import com.taskloom.core.model.TaskStatus;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory {@link TaskStore}. Tasks are registered with {@link #save(TaskInfo)}.
 */
public class InMemoryTaskStore implements TaskStore {

    private final ConcurrentHashMap<Long, TaskInfo> tasks = new ConcurrentHashMap<>();

    public TaskInfo save(TaskInfo task) {
        tasks.put(task.id(), task);
        return task;
    }

    @Override
    public Optional<TaskInfo> findById(long taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public void updateStatus(long taskId, TaskStatus status) {
        tasks.computeIfPresent(taskId, (id, task) -> task.withStatus(status));
    }

    public void setWorkflowComplete(long taskId, boolean complete) {
        tasks.computeIfPresent(taskId, (id, task) -> task.withWorkflowComplete(complete));
    }

    @Override
    public int countByUserAndStatus(long userId, TaskStatus status) {
        return (int) tasks.values().stream()
                .filter(t -> Objects.equals(t.userId(), userId) && t.status() == status)
                .count();
    }
}
