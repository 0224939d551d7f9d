package com.taskloom.core.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A reusable custom agent, optionally triggered on a cron schedule.
 *
 * @param id               agent identifier
 * @param projectId        owning project
 * @param name             display name
 * @param userId           owning user (notification target)
 * @param systemPrompt     agent instructions appended to the system prompt
 * @param workingDirectory the project's repository folder
 * @param scheduleEnabled  whether the cron schedule is active
 * @param schedule         five-field cron expression (may be null)
 * @param cronPrompt       prompt sent when the schedule fires
 * @param lastRunAt        last scheduled run (null if never)
 * @param nextRunAt        next scheduled run (null when not scheduled)
 */
public record Agent(
    long id,
    long projectId,
    String name,
    Long userId,
    String systemPrompt,
    Path workingDirectory,
    boolean scheduleEnabled,
    String schedule,
    String cronPrompt,
    Instant lastRunAt,
    Instant nextRunAt
) {

    public Agent withSchedule(Instant newLastRunAt, Instant newNextRunAt) {
        return new Agent(id, projectId, name, userId, systemPrompt, workingDirectory,
                scheduleEnabled, schedule, cronPrompt, newLastRunAt, newNextRunAt);
    }

    public Agent withNextRunAt(Instant newNextRunAt) {
        return withSchedule(lastRunAt, newNextRunAt);
    }
}
