package com.taskloom.core.notification;

import com.taskloom.core.model.AgentRole;
import com.taskloom.core.model.TaskStatus;
import com.taskloom.core.store.TaskStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PushNotificationServiceTest {

    private static final Executor DIRECT = Runnable::run;

    private PushGateway gateway;
    private TaskStore taskStore;
    private PushNotificationService service;

    @BeforeEach
    void setUp() {
        gateway = mock(PushGateway.class);
        taskStore = mock(TaskStore.class);
        service = new PushNotificationService(gateway, taskStore, DIRECT, true);
    }

    @Nested
    @DisplayName("completion gating")
    class Gating {

        @Test
        @DisplayName("user-initiated conversations always notify")
        void userInitiated() {
            var n = service.buildCompletion("Fix login", 3L, 10, new NotificationMetadata(null, false, null, 5L));

            assertEquals("Claude Response Ready", n.title());
            assertEquals("Response ready for: Fix login", n.message());
            assertEquals("claude_complete", n.data().get("type"));
            assertEquals("claudeui://projects/5/tasks/3/chat/10", n.data().get("deepLink"));
        }

        @Test
        @DisplayName("implementation and review runs are silent until the workflow completes")
        void loopRunsSilent() {
            assertNull(service.buildCompletion("T", 3L, 10,
                    new NotificationMetadata(AgentRole.IMPLEMENTATION, false, null, 5L)));
            assertNull(service.buildCompletion("T", 3L, 10,
                    new NotificationMetadata(AgentRole.REVIEW, false, null, 5L)));
        }

        @Test
        @DisplayName("workflow completion produces the review banner")
        void workflowComplete() {
            var n = service.buildCompletion("T", 3L, 10, new NotificationMetadata(AgentRole.REVIEW, true, null, 5L));

            assertEquals("Task Workflow Complete", n.title());
            assertEquals("Task ready for review: T", n.message());
            assertEquals("workflow_complete", n.data().get("type"));
        }

        @Test
        @DisplayName("planning runs notify")
        void planningNotifies() {
            assertNotNull(service.buildCompletion(null, 3L, 10,
                    new NotificationMetadata(AgentRole.PLANNING, false, null, null)));
        }

        @Test
        @DisplayName("fallback message and no deep link without a title or project")
        void fallbacks() {
            var n = service.buildCompletion(null, 3L, 10, new NotificationMetadata(null, false, null, null));

            assertEquals("Claude has finished responding", n.message());
            assertFalse(n.data().containsKey("deepLink"));
        }
    }

    @Test
    @DisplayName("suppressed completion sends nothing")
    void suppressedSendsNothing() {
        service.notifyComplete(42, "T", 3L, 10, new NotificationMetadata(AgentRole.IMPLEMENTATION, false, null, 5L))
                .join();

        verifyNoInteractions(gateway);
    }

    @Test
    @DisplayName("agent completion banner links to the agent chat")
    void agentBanner() {
        service.notifyAgentComplete(42, "Auditor", 7, 5L, 20).join();

        var captor = ArgumentCaptor.forClass(PushNotification.class);
        verify(gateway).sendBanner(eq(42L), captor.capture());
        assertEquals("Agent Finished", captor.getValue().title());
        assertEquals("Auditor has finished", captor.getValue().message());
        assertEquals("agent_complete", captor.getValue().data().get("type"));
        assertEquals("claudeui://projects/5/agents/7/chat/20", captor.getValue().data().get("deepLink"));
    }

    @Test
    @DisplayName("badge carries the in-progress task count")
    void badge() {
        when(taskStore.countByUserAndStatus(42, TaskStatus.IN_PROGRESS)).thenReturn(3);

        service.updateBadge(42).join();

        verify(gateway).sendBadge(42, 3);
    }

    @Test
    @DisplayName("gateway failures complete the future normally")
    void gatewayFailureContained() {
        doThrow(new IllegalStateException("push down")).when(gateway).sendBanner(anyLong(), any());

        assertDoesNotThrow(() -> service.notifyAgentComplete(42, "A", 7, null, 20).join());
    }

    @Test
    @DisplayName("disabled service sends nothing")
    void disabled() {
        service = new PushNotificationService(gateway, taskStore, DIRECT, false);

        service.updateBadge(42).join();
        service.notifyAgentComplete(42, "A", 7, null, 20).join();

        verifyNoInteractions(gateway, taskStore);
    }
}
