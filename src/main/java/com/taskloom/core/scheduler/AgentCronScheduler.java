package com.taskloom.core.scheduler;

import com.taskloom.core.conversation.ConversationOptions;
import com.taskloom.core.conversation.ConversationOrchestrator;
import com.taskloom.core.conversation.ConversationStart;
import com.taskloom.core.events.Broadcaster;
import com.taskloom.core.logging.MdcContext;
import com.taskloom.core.metrics.TaskloomMetrics;
import com.taskloom.core.model.Agent;
import com.taskloom.core.model.Conversation;
import com.taskloom.core.store.AgentStore;
import com.taskloom.core.store.ConversationStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Triggers custom agents on their cron schedules.
 * <p>
 * A single tick runs at the start of every minute, plus once immediately on start to
 * catch runs missed while the service was down. Due agents are processed one after the
 * other. An agent that is still marked running is skipped without creating anything;
 * every agent that was attempted gets its last-run and next-run times updated whether
 * or not its run could be started.
 */
public class AgentCronScheduler {

    private static final Logger log = LoggerFactory.getLogger(AgentCronScheduler.class);

    static final String PERMISSION_MODE = "bypassPermissions";
    private static final long TICK_MS = Duration.ofMinutes(1).toMillis();

    private final AgentStore agentStore;
    private final ConversationStore conversationStore;
    private final ConversationOrchestrator orchestrator;
    private final Broadcaster broadcaster;
    private final TaskloomMetrics metrics;
    private final Clock clock;
    private final ZoneId zone;
    private final boolean autoStart;

    /** Agents with a cron-triggered start in progress. */
    private final Set<Long> activeRuns = ConcurrentHashMap.newKeySet();

    private ScheduledExecutorService executor;
    private ScheduledFuture<?> tick;

    public AgentCronScheduler(AgentStore agentStore, ConversationStore conversationStore,
                              ConversationOrchestrator orchestrator, Broadcaster broadcaster,
                              TaskloomMetrics metrics, Clock clock, ZoneId zone, boolean autoStart) {
        this.agentStore = agentStore;
        this.conversationStore = conversationStore;
        this.orchestrator = orchestrator;
        this.broadcaster = broadcaster;
        this.metrics = metrics;
        this.clock = clock;
        this.zone = zone;
        this.autoStart = autoStart;
    }

    @PostConstruct
    void init() {
        if (autoStart) {
            start();
        } else {
            log.info("Cron scheduler disabled");
        }
    }

    @PreDestroy
    void shutdown() {
        stop();
    }

    /** Starts the minute tick. Does nothing if already started. */
    public synchronized void start() {
        if (tick != null) {
            log.info("Cron scheduler already started");
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cron-scheduler");
            t.setDaemon(true);
            return t;
        });
        Instant now = clock.instant();
        long initialDelay = Duration.between(now, now.truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES))
                .toMillis();
        tick = executor.scheduleAtFixedRate(this::checkScheduledAgents, initialDelay, TICK_MS, TimeUnit.MILLISECONDS);
        executor.execute(this::checkScheduledAgents);
        log.info("Cron scheduler started, checking every minute (zone={})", zone);
    }

    /** Cancels the tick. A later {@link #start()} creates a fresh one. */
    public synchronized void stop() {
        if (tick == null) {
            return;
        }
        tick.cancel(false);
        executor.shutdownNow();
        tick = null;
        executor = null;
        log.info("Cron scheduler stopped");
    }

    public synchronized boolean isStarted() {
        return tick != null;
    }

    /**
     * Runs every due agent once. Failures are logged per agent and never end the tick.
     */
    public void checkScheduledAgents() {
        Instant now = clock.instant();
        try {
            List<Agent> due = agentStore.findDue(now);
            if (!due.isEmpty()) {
                log.info("Found {} agent(s) due for execution", due.size());
            }
            Set<Long> seen = new HashSet<>();
            for (Agent agent : due) {
                if (!seen.add(agent.id())) {
                    log.debug("Agent {} listed twice in this tick, ignoring duplicate", agent.id());
                    continue;
                }
                if (!activeRuns.add(agent.id())) {
                    log.info("Skipping agent {} ({}): already running", agent.id(), agent.name());
                    metrics.recordCronRun("skipped_overlap");
                    continue;
                }
                try {
                    runScheduledAgent(agent);
                    metrics.recordCronRun("started");
                } catch (RuntimeException e) {
                    log.error("Error running agent {} ({}): {}", agent.id(), agent.name(), e.getMessage(), e);
                    metrics.recordCronRun("failed");
                } finally {
                    activeRuns.remove(agent.id());
                    updateSchedule(agent, clock.instant());
                }
            }
        } catch (RuntimeException e) {
            log.error("Error checking scheduled agents: {}", e.getMessage(), e);
        }
    }

    private void runScheduledAgent(Agent agent) {
        MdcContext.setAgent(agent.id());
        try {
            log.info("Running scheduled agent {} ({})", agent.name(), agent.id());
            Conversation conversation = conversationStore.createForAgent(agent.id(), ConversationOptions.TRIGGER_CRON);
            ConversationOptions options = ConversationOptions.defaults()
                    .withConversationId(conversation.id())
                    .withBroadcasters(broadcaster, null)
                    .withUserId(agent.userId())
                    .withPermissionMode(PERMISSION_MODE)
                    .withTriggeredBy(ConversationOptions.TRIGGER_CRON);
            ConversationStart start = orchestrator.startAgentConversation(agent.id(), agent.cronPrompt(), options)
                    .join();
            log.info("Started conversation {} (session {}) for agent {}", start.conversationId(),
                    start.externalSessionId(), agent.id());
        } finally {
            MdcContext.clear();
        }
    }

    // Computed after the start attempt, which may block for the whole start timeout.
    private void updateSchedule(Agent agent, Instant ranAt) {
        try {
            Instant next = CronExpressions.nextRun(agent.schedule(), ranAt, zone).orElse(null);
            agentStore.updateScheduleStatus(agent.id(), ranAt, next);
        } catch (RuntimeException e) {
            log.error("Failed to update schedule of agent {}: {}", agent.id(), e.getMessage(), e);
        }
    }

    /**
     * Recomputes and stores an agent's next run after its schedule changed.
     *
     * @return the next run, or null when the agent is missing, disabled or has no expression
     */
    public Instant recalculateAgentNextRun(long agentId) {
        Optional<Agent> agent = agentStore.findById(agentId);
        if (agent.isEmpty() || !agent.get().scheduleEnabled()
                || agent.get().schedule() == null || agent.get().schedule().isBlank()) {
            agentStore.updateNextRun(agentId, null);
            return null;
        }
        Instant next = CronExpressions.nextRun(agent.get().schedule(), clock.instant(), zone).orElse(null);
        agentStore.updateNextRun(agentId, next);
        return next;
    }

    /** True while a cron-triggered start for the agent is in progress. */
    public boolean isAgentRunning(long agentId) {
        return activeRuns.contains(agentId);
    }

    public Optional<Instant> getNextRunTime(String expression) {
        return CronExpressions.nextRun(expression, clock.instant(), zone);
    }

    public CronValidation validate(String expression) {
        return CronExpressions.validate(expression, clock.instant(), zone);
    }
}
