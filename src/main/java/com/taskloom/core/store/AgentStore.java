package com.taskloom.core.store;

import com.taskloom.core.model.Agent;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of custom agents and their schedule bookkeeping.
 */
public interface AgentStore {

    Optional<Agent> findById(long agentId);

    /** Enabled agents with an expression whose next run is at or before {@code now}. */
    List<Agent> findDue(Instant now);

    void updateScheduleStatus(long agentId, Instant lastRunAt, Instant nextRunAt);

    void updateNextRun(long agentId, Instant nextRunAt);
}
