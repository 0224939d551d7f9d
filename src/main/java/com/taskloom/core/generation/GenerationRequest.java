package com.taskloom.core.generation;

import java.nio.file.Path;
import java.util.List;

/**
 * A single streamed request to the generation service.
 *
 * @param prompt             the user message (after attachment rewriting)
 * @param workingDirectory   directory the assistant operates in
 * @param model              model alias, e.g. "sonnet"
 * @param permissionMode     permission mode; null or "default" means the service default
 * @param systemPromptAppend text appended to the preset system prompt (may be null)
 * @param resumeSessionId    existing session to resume (null for a new session)
 * @param allowedTools       tool allow-list (empty for none)
 * @param disallowedTools    tool deny-list (empty for none)
 */
public record GenerationRequest(
    String prompt,
    Path workingDirectory,
    String model,
    String permissionMode,
    String systemPromptAppend,
    String resumeSessionId,
    List<String> allowedTools,
    List<String> disallowedTools
) {

    public GenerationRequest {
        allowedTools = allowedTools == null ? List.of() : List.copyOf(allowedTools);
        disallowedTools = disallowedTools == null ? List.of() : List.copyOf(disallowedTools);
    }

    public boolean isResume() {
        return resumeSessionId != null;
    }
}
