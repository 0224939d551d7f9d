package com.taskloom.core.store;

import com.taskloom.core.model.AgentRole;
import com.taskloom.core.model.AgentRun;
import com.taskloom.core.model.AgentRunStatus;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * Thread-safe in-memory {@link AgentRunStore}.
 */
public class InMemoryAgentRunStore implements AgentRunStore {

    private final ConcurrentHashMap<Long, AgentRun> runs = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final Clock clock;

    public InMemoryAgentRunStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public AgentRun create(long taskId, AgentRole role, AgentRunStatus status) {
        var now = clock.instant();
        var run = new AgentRun(ids.incrementAndGet(), taskId, role, status, null, now,
                status == AgentRunStatus.RUNNING ? null : now);
        runs.put(run.id(), run);
        return run;
    }

    @Override
    public Optional<AgentRun> findById(long runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public Optional<AgentRun> findByConversationId(long conversationId) {
        return runs.values().stream()
                .filter(r -> Objects.equals(r.conversationId(), conversationId))
                .findFirst();
    }

    @Override
    public List<AgentRun> findByTask(long taskId) {
        return runs.values().stream()
                .filter(r -> r.taskId() == taskId)
                .sorted(Comparator.comparingLong(AgentRun::id).reversed())
                .toList();
    }

    @Override
    public AgentRun updateStatus(long runId, AgentRunStatus status) {
        return update(runId, run -> run.withStatus(status, clock.instant()));
    }

    @Override
    public AgentRun linkConversation(long runId, long conversationId) {
        return update(runId, run -> run.withConversation(conversationId));
    }

    private AgentRun update(long runId, UnaryOperator<AgentRun> change) {
        AgentRun updated = runs.computeIfPresent(runId, (id, run) -> change.apply(run));
        if (updated == null) {
            throw new IllegalArgumentException("Agent run " + runId + " not found");
        }
        return updated;
    }
}
