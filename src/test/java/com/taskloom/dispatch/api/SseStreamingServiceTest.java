package com.taskloom.dispatch.api;

import com.taskloom.core.events.EventBus;
import com.taskloom.core.events.EventType;
import com.taskloom.core.events.LifecycleEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link SseStreamingService}.
 */
class SseStreamingServiceTest {

    private EventBus eventBus;
    private SseStreamingService service;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        service = new SseStreamingService(eventBus);
    }

    // -- Emitter creation tests -----------------------------------------------

    @Nested
    @DisplayName("emitters")
    class EmitterTests {

        @Test
        @DisplayName("conversation and task emitters are distinct and counted")
        void createsEmitters() {
            SseEmitter conversation = service.conversationEmitter(10);
            SseEmitter task = service.taskEmitter(1);

            assertNotNull(conversation);
            assertNotSame(conversation, task);
            assertEquals(2, service.activeEmitterCount());
        }

        @Test
        @DisplayName("emitters subscribe to their own channel")
        void subscribesToChannel() {
            List<String> channels = new ArrayList<>();
            eventBus.subscribeAll((channel, event) -> channels.add(channel));
            service.conversationEmitter(10);

            eventBus.conversationBroadcaster().broadcast(10,
                    LifecycleEvent.of(EventType.STREAMING_STARTED, "conversationId", 10L));

            assertEquals(List.of("conversation:10"), channels);
            assertEquals(1, service.activeEmitterCount());
        }
    }

    // -- Heartbeat tests ------------------------------------------------------

    @Nested
    @DisplayName("heartbeats")
    class HeartbeatTests {

        @Test
        @DisplayName("no emitters means nothing to do")
        void noEmitters() {
            assertDoesNotThrow(() -> service.sendHeartbeats());
        }

        @Test
        @DisplayName("heartbeats to live emitters do not throw")
        void liveEmitters() {
            service.taskEmitter(1);
            assertDoesNotThrow(() -> service.sendHeartbeats());
        }
    }

    @Test
    @DisplayName("concurrent event publishing does not throw")
    void concurrentPublishDoesNotThrow() throws InterruptedException {
        service.conversationEmitter(10);

        int threadCount = 5;
        CountDownLatch latch = new CountDownLatch(threadCount);
        for (int t = 0; t < threadCount; t++) {
            new Thread(() -> {
                for (int i = 0; i < 20; i++) {
                    eventBus.conversationBroadcaster().broadcast(10,
                            LifecycleEvent.of(EventType.CLAUDE_RESPONSE, "data", "chunk " + i));
                }
                latch.countDown();
            }).start();
        }

        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }
}
