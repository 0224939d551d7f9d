package com.taskloom.core.conversation;

import java.nio.file.Path;
import java.util.List;

/**
 * A prompt after attachment staging, with the temporary files written for it.
 *
 * @param prompt    the prompt to send
 * @param tempFiles files written (empty when nothing was staged)
 * @param tempDir   directory holding the files (null when nothing was staged)
 */
public record StagedPrompt(String prompt, List<Path> tempFiles, Path tempDir) {

    public StagedPrompt {
        tempFiles = tempFiles == null ? List.of() : List.copyOf(tempFiles);
    }

    public static StagedPrompt unchanged(String prompt) {
        return new StagedPrompt(prompt, List.of(), null);
    }
}
