package com.taskloom.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a single agent run.
 */
public enum AgentRunStatus {
    RUNNING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
