package com.taskloom.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Taskloom.
 * Routes to subcommands: serve, cron.
 */
@Command(
        name = "taskloom",
        mixinStandardHelpOptions = true,
        version = "Taskloom 0.1.0",
        description = "Conversation orchestration for an AI coding assistant",
        subcommands = {
                ServeCommand.class,
                CronCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TaskloomCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // No subcommand given: show usage help
        spec.commandLine().usage(System.out);
    }
}
