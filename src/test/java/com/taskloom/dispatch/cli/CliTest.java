package com.taskloom.dispatch.cli;

import com.taskloom.core.conversation.ConversationOrchestrator;
import com.taskloom.core.events.Broadcaster;
import com.taskloom.core.metrics.TaskloomMetrics;
import com.taskloom.core.scheduler.AgentCronScheduler;
import com.taskloom.core.store.AgentStore;
import com.taskloom.core.store.ConversationStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * Tests for the Taskloom CLI command structure.
 * These tests exercise picocli directly without Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private static final Instant NOW = Instant.parse("2026-01-05T10:00:00Z");

    private CommandLine.IFactory createFactory() {
        var scheduler = new AgentCronScheduler(mock(AgentStore.class), mock(ConversationStore.class),
                mock(ConversationOrchestrator.class), Broadcaster.none(),
                new TaskloomMetrics(new SimpleMeterRegistry()), Clock.fixed(NOW, ZoneOffset.UTC),
                ZoneOffset.UTC, false);
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == CronCommand.class) {
                    return (K) new CronCommand(scheduler);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new TaskloomCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists the subcommands")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("serve"));
            assertTrue(result.output().contains("cron"));
            assertTrue(result.output().contains("help"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Taskloom 0.1.0"));
        }

        @Test
        @DisplayName("no arguments prints the banner and usage")
        void noArguments() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("TASKLOOM v0.1.0"));
        }
    }

    @Nested
    @DisplayName("cron command")
    class CronCommandTests {

        @Test
        @DisplayName("valid expression prints description and next run")
        void validExpression() {
            CliResult result = execute("cron", "0 9 * * 1-5");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Next run"));
            assertTrue(result.output().contains("2026-01-06T09:00:00Z"));
        }

        @Test
        @DisplayName("invalid expression exits with 1")
        void invalidExpression() {
            CliResult result = execute("cron", "60 * * * *");
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Invalid expression"));
        }

        @Test
        @DisplayName("missing expression is a usage error")
        void missingExpression() {
            CliResult result = execute("cron");
            assertEquals(2, result.exitCode());
        }
    }

    @Test
    @DisplayName("serve is detected anywhere in the arguments")
    void serveDetection() {
        assertTrue(CliRunner.isServe("--debug", "serve"));
        assertFalse(CliRunner.isServe("cron", "* * * * *"));
    }
}
