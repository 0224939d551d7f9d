package com.taskloom.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for conversation sessions, chaining and scheduled runs.
 */
@Service
public class TaskloomMetrics {

    private final MeterRegistry registry;

    public TaskloomMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records a session whose identifier became known.
     *
     * @param owner "task" or "agent"
     */
    public void recordSessionStarted(String owner) {
        Counter.builder("taskloom.sessions.started")
                .description("Sessions that received an external identifier")
                .tag("owner", owner)
                .register(registry)
                .increment();
    }

    /**
     * Records how long a streamed exchange ran, from stream open to termination.
     *
     * @param outcome "completed", "failed" or "aborted"
     */
    public void recordSessionDuration(String outcome, long ms) {
        Timer.builder("taskloom.sessions.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSessionAborted() {
        Counter.builder("taskloom.sessions.aborted")
                .register(registry)
                .increment();
    }

    /**
     * Records the outcome of a chaining decision.
     *
     * @param result "started", "workflow_complete", "overlap", "failed" or "skipped"
     */
    public void recordChainingDecision(String result) {
        Counter.builder("taskloom.chaining.decisions")
                .description("Implementation/review chaining decisions")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    /**
     * @param result "started", "skipped_overlap" or "failed"
     */
    public void recordCronRun(String result) {
        Counter.builder("taskloom.cron.runs")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordTokensUsed(long used) {
        DistributionSummary.builder("taskloom.tokens.used")
                .description("Context tokens used at the end of a turn")
                .register(registry)
                .record(used);
    }
}
