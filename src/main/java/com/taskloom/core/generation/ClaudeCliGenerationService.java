package com.taskloom.core.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskloom.core.config.TaskloomProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link GenerationService} backed by the {@code claude} CLI in stream-json mode.
 *
 * <p>Each request launches one CLI process in the request's working directory.
 * Every stdout line is one JSON message; lines that do not parse are logged and
 * skipped. The process is interrupted by destroying it, after which the next read
 * reports a {@link GenerationException}.
 *
 * <p>This class shells out via {@link ProcessBuilder} rather than depending on an SDK.
 */
public class ClaudeCliGenerationService implements GenerationService {

    private static final Logger log = LoggerFactory.getLogger(ClaudeCliGenerationService.class);

    /** Tail of stderr kept for error messages. */
    private static final int MAX_STDERR_CHARS = 4_000;

    private final TaskloomProperties properties;
    private final ObjectMapper objectMapper;

    public ClaudeCliGenerationService(TaskloomProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public GenerationStream open(GenerationRequest request) {
        List<String> command = buildCommand(request);
        log.debug("Launching generation CLI in {} (resume={}, permissionMode={})",
                request.workingDirectory(), request.resumeSessionId(), request.permissionMode());
        try {
            var builder = new ProcessBuilder(command).redirectInput(ProcessBuilder.Redirect.from(nullDevice()));
            if (request.workingDirectory() != null) {
                builder.directory(request.workingDirectory().toFile());
            }
            Process process = builder.start();
            return new CliStream(process);
        } catch (IOException e) {
            throw new GenerationException("Failed to start " + properties.getClaudePath() + ": " + e.getMessage(), e);
        }
    }

    List<String> buildCommand(GenerationRequest request) {
        var command = new ArrayList<String>();
        command.add(properties.getClaudePath());
        command.add("-p");
        command.add(request.prompt() != null ? request.prompt() : "");
        command.add("--output-format");
        command.add("stream-json");
        command.add("--verbose");
        command.add("--model");
        command.add(request.model() != null ? request.model() : properties.getModel());

        if (request.permissionMode() != null && !"default".equals(request.permissionMode())) {
            command.add("--permission-mode");
            command.add(request.permissionMode());
        }
        if (request.systemPromptAppend() != null && !request.systemPromptAppend().isBlank()) {
            command.add("--append-system-prompt");
            command.add(request.systemPromptAppend());
        }
        if (request.resumeSessionId() != null) {
            command.add("--resume");
            command.add(request.resumeSessionId());
        }
        if (!request.allowedTools().isEmpty()) {
            command.add("--allowedTools");
            command.add(String.join(",", request.allowedTools()));
        }
        if (!request.disallowedTools().isEmpty()) {
            command.add("--disallowedTools");
            command.add(String.join(",", request.disallowedTools()));
        }
        return command;
    }

    private static java.io.File nullDevice() {
        return new java.io.File(System.getProperty("os.name").startsWith("Windows") ? "NUL" : "/dev/null");
    }

    private final class CliStream implements GenerationStream {

        private final Process process;
        private final BufferedReader stdout;
        private final StringBuilder stderrTail = new StringBuilder();
        private final Thread stderrDrain;
        private volatile boolean interrupted;

        CliStream(Process process) {
            this.process = process;
            this.stdout = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
            this.stderrDrain = new Thread(() -> drain(process.getErrorStream()), "claude-stderr-" + process.pid());
            this.stderrDrain.setDaemon(true);
            this.stderrDrain.start();
        }

        @Override
        public StreamChunk next() {
            try {
                String line;
                while ((line = stdout.readLine()) != null) {
                    if (line.isBlank()) {
                        continue;
                    }
                    try {
                        JsonNode node = objectMapper.readTree(line);
                        if (node != null && node.isObject()) {
                            return StreamChunk.of(node);
                        }
                    } catch (JsonProcessingException e) {
                        log.debug("Skipping non-JSON output line: {}", line);
                    }
                }
            } catch (IOException e) {
                if (interrupted) {
                    throw new GenerationException("Session interrupted", e);
                }
                throw new GenerationException("Failed reading generation output: " + e.getMessage(), e);
            }
            return finish();
        }

        private StreamChunk finish() {
            try {
                int exitCode = process.waitFor();
                stderrDrain.join(TimeUnit.SECONDS.toMillis(1));
                if (interrupted) {
                    throw new GenerationException("Session interrupted");
                }
                if (exitCode != 0) {
                    String detail;
                    synchronized (stderrTail) {
                        detail = stderrTail.toString().trim();
                    }
                    throw new GenerationException("Generation CLI exited with code " + exitCode
                            + (detail.isEmpty() ? "" : ": " + detail));
                }
                return null;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new GenerationException("Interrupted while waiting for generation CLI", e);
            }
        }

        @Override
        public void interrupt() {
            interrupted = true;
            process.destroy();
        }

        @Override
        public void close() {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
            try {
                stdout.close();
            } catch (IOException e) {
                log.debug("Error closing generation output: {}", e.getMessage());
            }
        }

        private void drain(InputStream stream) {
            try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("claude stderr: {}", line);
                    synchronized (stderrTail) {
                        stderrTail.append(line).append('\n');
                        if (stderrTail.length() > MAX_STDERR_CHARS) {
                            stderrTail.delete(0, stderrTail.length() - MAX_STDERR_CHARS);
                        }
                    }
                }
            } catch (IOException e) {
                log.debug("stderr drain ended: {}", e.getMessage());
            }
        }
    }
}
