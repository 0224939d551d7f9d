package com.taskloom.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Board status of a task.
 */
public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
