package com.taskloom.core.scheduler;

import com.taskloom.core.conversation.ConversationOptions;
import com.taskloom.core.conversation.ConversationOrchestrator;
import com.taskloom.core.conversation.ConversationStart;
import com.taskloom.core.conversation.StreamException;
import com.taskloom.core.conversation.StreamOutcome;
import com.taskloom.core.events.Broadcaster;
import com.taskloom.core.metrics.TaskloomMetrics;
import com.taskloom.core.model.Agent;
import com.taskloom.core.store.AgentStore;
import com.taskloom.core.store.InMemoryConversationStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AgentCronSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-01-05T10:00:00Z");

    private AgentStore agentStore;
    private InMemoryConversationStore conversationStore;
    private ConversationOrchestrator orchestrator;
    private SimpleMeterRegistry registry;
    private AgentCronScheduler scheduler;

    @BeforeEach
    void setUp() {
        agentStore = mock(AgentStore.class);
        conversationStore = new InMemoryConversationStore(Clock.fixed(NOW, ZoneOffset.UTC));
        orchestrator = mock(ConversationOrchestrator.class);
        registry = new SimpleMeterRegistry();
        scheduler = new AgentCronScheduler(agentStore, conversationStore, orchestrator, Broadcaster.none(),
                new TaskloomMetrics(registry), Clock.fixed(NOW, ZoneOffset.UTC), ZoneOffset.UTC, false);
    }

    private static Agent agent(long id, String schedule) {
        return new Agent(id, 5, "Agent " + id, 42L, null, Path.of("/repo"), true, schedule,
                "Do the thing", null, NOW.minusSeconds(60));
    }

    private void startsSucceed() {
        when(orchestrator.startAgentConversation(anyLong(), anyString(), any())).thenAnswer(inv -> {
            ConversationOptions options = inv.getArgument(2);
            return CompletableFuture.completedFuture(new ConversationStart(options.conversationId(), "s",
                    new CompletableFuture<StreamOutcome>()));
        });
    }

    private double cronRuns(String result) {
        var counter = registry.find("taskloom.cron.runs").tag("result", result).counter();
        return counter == null ? 0 : counter.count();
    }

    @Test
    @DisplayName("runs a due agent with a cron-triggered conversation and reschedules it")
    void runsDueAgent() {
        startsSucceed();
        when(agentStore.findDue(NOW)).thenReturn(List.of(agent(7, "0 2 * * *")));

        scheduler.checkScheduledAgents();

        var options = ArgumentCaptor.forClass(ConversationOptions.class);
        verify(orchestrator).startAgentConversation(eq(7L), eq("Do the thing"), options.capture());
        assertEquals("cron", options.getValue().triggeredBy());
        assertEquals(AgentCronScheduler.PERMISSION_MODE, options.getValue().permissionMode());
        assertEquals(42L, options.getValue().userId());

        long conversationId = options.getValue().conversationId();
        assertEquals("cron", conversationStore.findById(conversationId).orElseThrow().triggeredBy());
        verify(agentStore).updateScheduleStatus(7L, NOW, Instant.parse("2026-01-06T02:00:00Z"));
        assertEquals(1.0, cronRuns("started"));
        assertFalse(scheduler.isAgentRunning(7));
    }

    @Test
    @DisplayName("an agent listed twice in one tick runs once")
    void duplicateRunsOnce() {
        startsSucceed();
        Agent a = agent(7, "*/5 * * * *");
        when(agentStore.findDue(NOW)).thenReturn(List.of(a, a));

        scheduler.checkScheduledAgents();

        verify(orchestrator, times(1)).startAgentConversation(eq(7L), anyString(), any());
        verify(agentStore, times(1)).updateScheduleStatus(eq(7L), any(), any());
    }

    @Test
    @DisplayName("a failed start still updates the schedule and the next agent runs")
    void failureStillReschedules() {
        when(orchestrator.startAgentConversation(eq(7L), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new StreamException("CLI missing")));
        when(orchestrator.startAgentConversation(eq(8L), anyString(), any())).thenAnswer(inv ->
                CompletableFuture.completedFuture(new ConversationStart(1, "s", new CompletableFuture<>())));
        when(agentStore.findDue(NOW)).thenReturn(List.of(agent(7, "0 2 * * *"), agent(8, "0 3 * * *")));

        scheduler.checkScheduledAgents();

        verify(agentStore).updateScheduleStatus(7L, NOW, Instant.parse("2026-01-06T02:00:00Z"));
        verify(agentStore).updateScheduleStatus(8L, NOW, Instant.parse("2026-01-06T03:00:00Z"));
        assertEquals(1.0, cronRuns("failed"));
        assertEquals(1.0, cronRuns("started"));
    }

    @Test
    @DisplayName("next run is computed from the time the start attempt finished")
    void reschedulesFromAttemptEnd() {
        // The start blocks past the 10:00 slot, so the next run must be 10:05, not 10:00.
        Instant afterStart = NOW.plusSeconds(40);
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenReturn(NOW, afterStart);
        scheduler = new AgentCronScheduler(agentStore, conversationStore, orchestrator, Broadcaster.none(),
                new TaskloomMetrics(registry), clock, ZoneOffset.UTC, false);
        startsSucceed();
        when(agentStore.findDue(NOW)).thenReturn(List.of(agent(7, "*/5 * * * *")));

        scheduler.checkScheduledAgents();

        verify(agentStore).updateScheduleStatus(7L, afterStart, Instant.parse("2026-01-05T10:05:00Z"));
    }

    @Test
    @DisplayName("a store failure does not escape the tick")
    void storeFailureContained() {
        when(agentStore.findDue(any())).thenThrow(new IllegalStateException("db down"));

        assertDoesNotThrow(() -> scheduler.checkScheduledAgents());
        verifyNoInteractions(orchestrator);
    }

    @Test
    @DisplayName("recalculates next run for enabled agents")
    void recalculatesNextRun() {
        when(agentStore.findById(7)).thenReturn(Optional.of(agent(7, "0 2 * * *")));

        assertEquals(Instant.parse("2026-01-06T02:00:00Z"), scheduler.recalculateAgentNextRun(7));
        verify(agentStore).updateNextRun(7L, Instant.parse("2026-01-06T02:00:00Z"));
    }

    @Test
    @DisplayName("clears next run for disabled or missing agents")
    void clearsNextRun() {
        Agent disabled = new Agent(9, 5, "Off", 42L, null, Path.of("/repo"), false, "0 2 * * *",
                "x", null, null);
        when(agentStore.findById(9)).thenReturn(Optional.of(disabled));
        when(agentStore.findById(10)).thenReturn(Optional.empty());

        assertNull(scheduler.recalculateAgentNextRun(9));
        assertNull(scheduler.recalculateAgentNextRun(10));
        verify(agentStore).updateNextRun(9L, null);
        verify(agentStore).updateNextRun(10L, null);
    }

    @Test
    @DisplayName("start and stop are idempotent")
    void startStopIdempotent() {
        scheduler.start();
        scheduler.start();
        assertTrue(scheduler.isStarted());

        scheduler.stop();
        scheduler.stop();
        assertFalse(scheduler.isStarted());

        scheduler.start();
        assertTrue(scheduler.isStarted());
        scheduler.stop();
    }

    @Test
    @DisplayName("validates expressions against the clock")
    void validates() {
        assertTrue(scheduler.validate("0 2 * * *").valid());
        assertEquals(Optional.of(Instant.parse("2026-01-06T02:00:00Z")), scheduler.getNextRunTime("0 2 * * *"));
    }
}
