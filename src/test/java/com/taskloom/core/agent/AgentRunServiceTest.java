package com.taskloom.core.agent;

import com.taskloom.core.conversation.ConversationNotFoundException;
import com.taskloom.core.conversation.ConversationOptions;
import com.taskloom.core.conversation.ConversationOrchestrator;
import com.taskloom.core.conversation.ConversationStart;
import com.taskloom.core.conversation.SessionStartTimeoutException;
import com.taskloom.core.conversation.StreamException;
import com.taskloom.core.conversation.StreamOutcome;
import com.taskloom.core.model.AgentRole;
import com.taskloom.core.model.AgentRun;
import com.taskloom.core.model.AgentRunStatus;
import com.taskloom.core.model.TaskInfo;
import com.taskloom.core.model.TaskStatus;
import com.taskloom.core.notification.NotificationService;
import com.taskloom.core.store.InMemoryAgentRunStore;
import com.taskloom.core.store.InMemoryConversationStore;
import com.taskloom.core.store.InMemoryTaskStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AgentRunServiceTest {

    private InMemoryTaskStore taskStore;
    private InMemoryAgentRunStore runStore;
    private InMemoryConversationStore conversationStore;
    private ConversationOrchestrator orchestrator;
    private NotificationService notifications;
    private AgentRunService service;
    private RunContext context;

    @BeforeEach
    void setUp() {
        taskStore = new InMemoryTaskStore();
        runStore = new InMemoryAgentRunStore(Clock.systemUTC());
        conversationStore = new InMemoryConversationStore(Clock.systemUTC());
        orchestrator = mock(ConversationOrchestrator.class);
        notifications = mock(NotificationService.class);
        when(notifications.updateBadge(anyLong())).thenReturn(CompletableFuture.completedFuture(null));
        service = new AgentRunService(taskStore, runStore, conversationStore, orchestrator, notifications,
                new ContextPromptBuilder());
        context = new RunContext(42L, null, null);

        taskStore.save(new TaskInfo(1, 5, "Task", TaskStatus.PENDING, false, Path.of("/nonexistent-repo"), 42L));
    }

    @Test
    @DisplayName("creates a running run linked to a new conversation and starts it")
    void startsRun() throws Exception {
        when(orchestrator.startConversation(eq(1L), anyString(), any())).thenAnswer(inv -> {
            ConversationOptions options = inv.getArgument(2);
            return CompletableFuture.completedFuture(new ConversationStart(options.conversationId(), "s-1",
                    CompletableFuture.completedFuture(StreamOutcome.COMPLETED)));
        });

        AgentRunStart start = service.startAgentRun(1, AgentRole.IMPLEMENTATION, context)
                .get(5, TimeUnit.SECONDS);

        AgentRun run = runStore.findById(start.run().id()).orElseThrow();
        assertEquals(AgentRunStatus.RUNNING, run.status());
        assertEquals(start.conversation().conversationId(), run.conversationId());

        var captor = ArgumentCaptor.forClass(ConversationOptions.class);
        verify(orchestrator).startConversation(eq(1L), contains("Implement task 1"), captor.capture());
        assertEquals(AgentRunService.PERMISSION_MODE, captor.getValue().permissionMode());
        assertEquals(42L, captor.getValue().userId());
        assertNull(captor.getValue().customSystemPrompt());
    }

    @Test
    @DisplayName("moves a pending task to in progress and refreshes the badge")
    void movesPendingTask() {
        when(orchestrator.startConversation(anyLong(), anyString(), any())).thenReturn(new CompletableFuture<>());

        service.startAgentRun(1, AgentRole.IMPLEMENTATION, context);

        assertEquals(TaskStatus.IN_PROGRESS, taskStore.findById(1).orElseThrow().status());
        verify(notifications).updateBadge(42L);
    }

    @Test
    @DisplayName("a failed start marks the run failed and reports its id")
    void failedStartMarksRunFailed() {
        when(orchestrator.startConversation(anyLong(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new StreamException("CLI missing")));

        var future = service.startAgentRun(1, AgentRole.REVIEW, context);

        var thrown = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        var startFailure = assertInstanceOf(AgentRunStartException.class, thrown.getCause());
        AgentRun run = runStore.findById(startFailure.runId()).orElseThrow();
        assertEquals(AgentRunStatus.FAILED, run.status());
        assertFalse(service.getRunningAgentForTask(1).isPresent());
    }

    @Test
    @DisplayName("a start timeout leaves the run running so a late session can settle it")
    void timeoutKeepsRunRunning() {
        var pending = new CompletableFuture<StreamOutcome>();
        when(orchestrator.startConversation(anyLong(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new SessionStartTimeoutException(1, 30, pending)));

        var future = service.startAgentRun(1, AgentRole.IMPLEMENTATION, context);

        var thrown = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        var startFailure = assertInstanceOf(AgentRunStartException.class, thrown.getCause());
        assertEquals(AgentRunStatus.RUNNING, runStore.findById(startFailure.runId()).orElseThrow().status());
        assertTrue(service.getRunningAgentForTask(1).isPresent());

        // The late session finished and the completion handler settled the run.
        runStore.updateStatus(startFailure.runId(), AgentRunStatus.COMPLETED);
        pending.complete(StreamOutcome.COMPLETED);

        assertEquals(AgentRunStatus.COMPLETED, runStore.findById(startFailure.runId()).orElseThrow().status());
    }

    @Test
    @DisplayName("a timed-out run is failed once its stream ends without a session")
    void timeoutFailsRunWhenStreamEndsUnsettled() {
        var pending = new CompletableFuture<StreamOutcome>();
        when(orchestrator.startConversation(anyLong(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new SessionStartTimeoutException(1, 30, pending)));

        var future = service.startAgentRun(1, AgentRole.REVIEW, context);
        var thrown = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        long runId = assertInstanceOf(AgentRunStartException.class, thrown.getCause()).runId();

        pending.complete(StreamOutcome.FAILED);

        assertEquals(AgentRunStatus.FAILED, runStore.findById(runId).orElseThrow().status());
        assertFalse(service.getRunningAgentForTask(1).isPresent());
    }

    @Test
    @DisplayName("a synchronous start failure is raised as AgentRunStartException")
    void synchronousFailure() {
        when(orchestrator.startConversation(anyLong(), anyString(), any()))
                .thenThrow(new StreamException("rejected"));

        var thrown = assertThrows(AgentRunStartException.class,
                () -> service.startAgentRun(1, AgentRole.REVIEW, context));
        assertNotNull(thrown.runId());
    }

    @Test
    @DisplayName("unknown task is rejected before any run is created")
    void unknownTask() {
        assertThrows(ConversationNotFoundException.class,
                () -> service.startAgentRun(99, AgentRole.REVIEW, context));
        assertTrue(runStore.findByTask(99).isEmpty());
    }

    @Test
    @DisplayName("force-completes stuck running runs")
    void forceCompletes() {
        runStore.create(1, AgentRole.IMPLEMENTATION, AgentRunStatus.RUNNING);
        runStore.create(1, AgentRole.REVIEW, AgentRunStatus.FAILED);

        assertEquals(1, service.forceCompleteRunningAgents(1));
        assertTrue(service.getRunningAgentForTask(1).isEmpty());
    }
}
