package com.taskloom.core.events;

/**
 * Fire-and-forget delivery of a lifecycle event to one owner (a conversation or a task).
 */
@FunctionalInterface
public interface Broadcaster {

    void broadcast(long ownerId, LifecycleEvent event);

    /** A broadcaster that drops everything. */
    static Broadcaster none() {
        return (ownerId, event) -> { };
    }
}
