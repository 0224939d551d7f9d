package com.taskloom.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    // -- LifecycleEvent record tests ------------------------------------------

    @Nested
    @DisplayName("LifecycleEvent")
    class LifecycleEventTests {

        @Test
        @DisplayName("builds an ordered payload from key/value pairs")
        void buildsOrderedPayload() {
            var event = LifecycleEvent.of(EventType.STREAMING_STARTED,
                    "conversationId", 7L, "sessionId", "s-1");

            assertEquals("streaming-started", event.typeName());
            assertEquals(List.of("conversationId", "sessionId"), new ArrayList<>(event.payload().keySet()));
            assertEquals(7L, event.get("conversationId"));
            assertNotNull(event.timestamp());
        }

        @Test
        @DisplayName("drops null values")
        void dropsNullValues() {
            var event = LifecycleEvent.of(EventType.STREAMING_ENDED, "conversationId", 1L, "taskId", null);

            assertFalse(event.payload().containsKey("taskId"));
        }

        @Test
        @DisplayName("rejects an odd number of arguments")
        void rejectsOddArguments() {
            assertThrows(IllegalArgumentException.class,
                    () -> LifecycleEvent.of(EventType.CLAUDE_ERROR, "error"));
        }
    }

    // -- Subscribe and publish tests ------------------------------------------

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers only to subscribers of the channel")
        void deliversToChannelSubscribers() {
            List<LifecycleEvent> first = new ArrayList<>();
            List<LifecycleEvent> second = new ArrayList<>();
            eventBus.subscribe(EventBus.conversationChannel(1), first::add);
            eventBus.subscribe(EventBus.conversationChannel(2), second::add);

            eventBus.publish(EventBus.conversationChannel(1), LifecycleEvent.of(EventType.CLAUDE_COMPLETE));

            assertEquals(1, first.size());
            assertTrue(second.isEmpty());
        }

        @Test
        @DisplayName("global subscribers see every channel")
        void globalSubscribersSeeEverything() {
            List<String> channels = new ArrayList<>();
            eventBus.subscribeAll((channel, event) -> channels.add(channel));

            eventBus.conversationBroadcaster().broadcast(3, LifecycleEvent.of(EventType.CLAUDE_COMPLETE));
            eventBus.taskBroadcaster().broadcast(9, LifecycleEvent.of(EventType.AGENT_RUN_UPDATED));

            assertEquals(List.of("conversation:3", "task:9"), channels);
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribeStopsDelivery() {
            List<LifecycleEvent> received = new ArrayList<>();
            var subscription = eventBus.subscribe(EventBus.taskChannel(4), received::add);

            subscription.unsubscribe();
            eventBus.publish(EventBus.taskChannel(4), LifecycleEvent.of(EventType.AGENT_RUN_UPDATED));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("a throwing subscriber does not block the others")
        void throwingSubscriberIsIsolated() {
            List<LifecycleEvent> received = new ArrayList<>();
            eventBus.subscribe("conversation:5", e -> { throw new IllegalStateException("boom"); });
            eventBus.subscribe("conversation:5", received::add);

            eventBus.publish("conversation:5", LifecycleEvent.of(EventType.CLAUDE_COMPLETE));

            assertEquals(1, received.size());
        }
    }
}
