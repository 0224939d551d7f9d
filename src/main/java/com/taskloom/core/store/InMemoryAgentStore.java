package com.taskloom.core.store;

import com.taskloom.core.model.Agent;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory {@link AgentStore}. Agents are registered with {@link #save(Agent)}.
 */
public class InMemoryAgentStore implements AgentStore {

    private final ConcurrentHashMap<Long, Agent> agents = new ConcurrentHashMap<>();

    public Agent save(Agent agent) {
        agents.put(agent.id(), agent);
        return agent;
    }

    @Override
    public Optional<Agent> findById(long agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    @Override
    public List<Agent> findDue(Instant now) {
        return agents.values().stream()
                .filter(Agent::scheduleEnabled)
                .filter(a -> a.schedule() != null && !a.schedule().isBlank())
                .filter(a -> a.nextRunAt() != null && !a.nextRunAt().isAfter(now))
                .sorted(Comparator.comparing(Agent::nextRunAt))
                .toList();
    }

    @Override
    public void updateScheduleStatus(long agentId, Instant lastRunAt, Instant nextRunAt) {
        agents.computeIfPresent(agentId, (id, agent) -> agent.withSchedule(lastRunAt, nextRunAt));
    }

    @Override
    public void updateNextRun(long agentId, Instant nextRunAt) {
        agents.computeIfPresent(agentId, (id, agent) -> agent.withNextRunAt(nextRunAt));
    }
}
