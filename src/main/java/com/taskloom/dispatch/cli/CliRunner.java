package com.taskloom.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final TaskloomCommand taskloomCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TaskloomCommand taskloomCommand, IFactory factory) {
        this.taskloomCommand = taskloomCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // Serve mode: the embedded web server owns the JVM lifetime.
        if (isServe(args)) {
            return;
        }
        exitCode = new CommandLine(taskloomCommand, factory).execute(args);
    }

    static boolean isServe(String... args) {
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
