package com.taskloom.core.conversation;

/**
 * How a streamed exchange terminated.
 */
public enum StreamOutcome {
    COMPLETED,
    FAILED;

    public boolean isError() {
        return this == FAILED;
    }
}
