package com.taskloom.core.scheduler;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of validating a cron expression.
 *
 * @param valid       whether the expression parsed
 * @param description human-readable schedule (valid only)
 * @param nextRun     next fire time, ISO-8601 (valid only)
 * @param error       reason for rejection (invalid only)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronValidation(boolean valid, String description, String nextRun, String error) {

    public static CronValidation ok(String description, String nextRun) {
        return new CronValidation(true, description, nextRun, null);
    }

    public static CronValidation invalid(String error) {
        return new CronValidation(false, null, null, error);
    }
}
