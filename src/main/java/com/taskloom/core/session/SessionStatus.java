package com.taskloom.core.session;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a live session record.
 */
public enum SessionStatus {
    ACTIVE,
    ABORTED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
