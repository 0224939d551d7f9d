package com.taskloom.core.conversation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Writes image attachments to a temporary folder under the working directory and
 * rewrites the prompt to list their paths.
 * <p>
 * Files go to {@code <workingDir>/.tmp/images/<epochMillis>/image_<i>.<ext>}.
 */
public class AttachmentStager {

    private static final Logger log = LoggerFactory.getLogger(AttachmentStager.class);

    private static final Pattern DATA_URL = Pattern.compile("^data:([^;]+);base64,(.+)$", Pattern.DOTALL);

    static final String IMAGES_HEADER = "\n\n[Images provided at the following paths:]\n";

    private final Clock clock;

    public AttachmentStager(Clock clock) {
        this.clock = clock;
    }

    /**
     * Stages the attachments. Malformed entries are skipped; if writing fails the
     * original prompt is returned along with whatever was written so far.
     */
    public StagedPrompt stage(String prompt, List<ImageAttachment> attachments, Path workingDirectory) {
        if (attachments == null || attachments.isEmpty()) {
            return StagedPrompt.unchanged(prompt);
        }

        Path base = workingDirectory != null ? workingDirectory : Path.of("").toAbsolutePath();
        Path tempDir = base.resolve(".tmp").resolve("images").resolve(String.valueOf(clock.millis()));
        List<Path> written = new ArrayList<>();

        try {
            Files.createDirectories(tempDir);
            for (int i = 0; i < attachments.size(); i++) {
                ImageAttachment attachment = attachments.get(i);
                if (attachment == null || attachment.data() == null) {
                    continue;
                }
                Matcher m = DATA_URL.matcher(attachment.data());
                if (!m.matches()) {
                    log.debug("Skipping attachment {}: not a base64 data URL", i);
                    continue;
                }
                byte[] bytes;
                try {
                    bytes = Base64.getMimeDecoder().decode(m.group(2));
                } catch (IllegalArgumentException e) {
                    log.debug("Skipping attachment {}: invalid base64", i);
                    continue;
                }
                Path file = tempDir.resolve("image_" + i + "." + extension(m.group(1)));
                Files.write(file, bytes);
                written.add(file);
            }
        } catch (IOException e) {
            log.error("Failed to stage image attachments in {}: {}", tempDir, e.getMessage(), e);
            return new StagedPrompt(prompt, written, tempDir);
        }

        if (written.isEmpty() || prompt == null || prompt.isBlank()) {
            return new StagedPrompt(prompt, written, tempDir);
        }

        var note = new StringBuilder(IMAGES_HEADER);
        for (int i = 0; i < written.size(); i++) {
            if (i > 0) {
                note.append('\n');
            }
            note.append(i + 1).append(". ").append(written.get(i));
        }
        log.info("Staged {} image attachment(s) in {}", written.size(), tempDir);
        return new StagedPrompt(prompt + note, written, tempDir);
    }

    /**
     * Deletes staged files and their directory. Safe to call more than once.
     */
    public void cleanup(List<Path> tempFiles, Path tempDir) {
        if (tempFiles != null) {
            for (Path file : tempFiles) {
                deleteQuietly(file);
            }
        }
        if (tempDir != null && Files.exists(tempDir)) {
            try (Stream<Path> paths = Files.walk(tempDir)) {
                paths.sorted(Comparator.reverseOrder()).forEach(AttachmentStager::deleteQuietly);
            } catch (IOException e) {
                log.warn("Failed to delete temp dir {}: {}", tempDir, e.getMessage());
            }
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", path, e.getMessage());
        }
    }

    private static String extension(String mimeType) {
        int slash = mimeType.indexOf('/');
        String ext = slash >= 0 ? mimeType.substring(slash + 1) : "";
        return ext.isBlank() ? "png" : ext;
    }
}
