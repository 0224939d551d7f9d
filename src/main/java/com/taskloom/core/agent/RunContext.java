package com.taskloom.core.agent;

import com.taskloom.core.events.Broadcaster;

/**
 * Delivery and routing context carried from one agent run to the next.
 *
 * @param userId          acting user (may be null)
 * @param broadcaster     per-conversation event delivery
 * @param taskBroadcaster task-wide fan-out (may be null)
 */
public record RunContext(Long userId, Broadcaster broadcaster, Broadcaster taskBroadcaster) {

    public RunContext {
        broadcaster = broadcaster == null ? Broadcaster.none() : broadcaster;
    }
}
