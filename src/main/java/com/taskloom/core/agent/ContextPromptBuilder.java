package com.taskloom.core.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the system-prompt addition for agent runs from the project's documentation folder.
 * <p>
 * Reads {@code .claude-ui/project.md} and {@code .claude-ui/tasks/task-<id>.md} under the
 * repository root. Missing or unreadable files contribute nothing.
 */
public class ContextPromptBuilder {

    private static final Logger log = LoggerFactory.getLogger(ContextPromptBuilder.class);

    static final String DOCS_DIR = ".claude-ui";
    static final String SECTION_SEPARATOR = "\n\n---\n\n";

    public static String taskDocPath(long taskId) {
        return DOCS_DIR + "/tasks/task-" + taskId + ".md";
    }

    /**
     * @return the combined context, or an empty string when neither document has content
     */
    public String build(Path repoPath, long taskId) {
        if (repoPath == null) {
            return "";
        }
        String projectDoc = read(repoPath.resolve(DOCS_DIR).resolve("project.md"));
        String taskDoc = read(repoPath.resolve(taskDocPath(taskId)));

        List<String> sections = new ArrayList<>();
        if (!projectDoc.isBlank()) {
            sections.add("## Project Context\n\n" + projectDoc.strip());
        }
        if (!taskDoc.isBlank()) {
            sections.add("## Task Context\n\n" + taskDoc.strip());
        }
        return String.join(SECTION_SEPARATOR, sections);
    }

    private static String read(Path file) {
        if (!Files.isRegularFile(file)) {
            return "";
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
            return "";
        }
    }
}
