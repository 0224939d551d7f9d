package com.taskloom.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for conversation lifecycle events.
 * <p>
 * Events are published to named channels ({@code conversation:<id>} for
 * point-to-point delivery, {@code task:<id>} for task-wide fan-out). Supports
 * per-channel subscriptions and global subscriptions that receive every event.
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private static final String CONVERSATION_PREFIX = "conversation:";
    private static final String TASK_PREFIX = "task:";

    /** Per-channel subscribers keyed by channel name. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<LifecycleEvent>>> channelSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all channels. */
    private final CopyOnWriteArrayList<BiConsumer<String, LifecycleEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public static String conversationChannel(long conversationId) {
        return CONVERSATION_PREFIX + conversationId;
    }

    public static String taskChannel(long taskId) {
        return TASK_PREFIX + taskId;
    }

    /**
     * Publish an event to all subscribers of the channel and to global subscribers.
     *
     * @param channel the channel to publish on
     * @param event   the event to publish
     */
    public void publish(String channel, LifecycleEvent event) {
        log.debug("Publishing event: {} on {}", event.typeName(), channel);

        List<Consumer<LifecycleEvent>> subs = channelSubscribers.get(channel);
        if (subs != null) {
            for (Consumer<LifecycleEvent> subscriber : subs) {
                deliverSafely(channel, subscriber, event);
            }
        }

        for (BiConsumer<String, LifecycleEvent> subscriber : globalSubscribers) {
            try {
                subscriber.accept(channel, event);
            } catch (Exception e) {
                log.warn("Global subscriber threw exception processing event {}: {}",
                        event.typeName(), e.getMessage(), e);
            }
        }
    }

    /**
     * Subscribe to events on a single channel.
     *
     * @param channel  the channel to subscribe to
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String channel, Consumer<LifecycleEvent> consumer) {
        channelSubscribers.computeIfAbsent(channel, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to {}", channel);
        return () -> {
            CopyOnWriteArrayList<Consumer<LifecycleEvent>> subs = channelSubscribers.get(channel);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to events from all channels.
     *
     * @param consumer callback receiving the channel name and the event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(BiConsumer<String, LifecycleEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /** Broadcaster that delivers to {@code conversation:<ownerId>}. */
    public Broadcaster conversationBroadcaster() {
        return (conversationId, event) -> publish(conversationChannel(conversationId), event);
    }

    /** Broadcaster that delivers to {@code task:<ownerId>}. */
    public Broadcaster taskBroadcaster() {
        return (taskId, event) -> publish(taskChannel(taskId), event);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(String channel, Consumer<LifecycleEvent> subscriber, LifecycleEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber on {} threw exception processing event {}: {}",
                    channel, event.typeName(), e.getMessage(), e);
        }
    }
}
