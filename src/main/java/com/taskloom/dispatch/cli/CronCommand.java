package com.taskloom.dispatch.cli;

import com.taskloom.core.scheduler.AgentCronScheduler;
import com.taskloom.core.scheduler.CronValidation;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: taskloom cron "<expression>"
 * <p>
 * Validates a five-field cron expression and prints its description and next run.
 * Exits with 1 when the expression is invalid.
 */
@Command(name = "cron", mixinStandardHelpOptions = true,
        description = "Validate a five-field cron expression and show its next run")
@Component
public class CronCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Cron expression, e.g. \"*/15 * * * *\"")
    private String expression;

    private final AgentCronScheduler scheduler;

    public CronCommand(AgentCronScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public Integer call() {
        CronValidation result = scheduler.validate(expression);
        if (!result.valid()) {
            ConsoleOutput.error("Invalid expression: " + result.error());
            return 1;
        }
        ConsoleOutput.success(result.description());
        ConsoleOutput.field("Next run", result.nextRun());
        return 0;
    }
}
