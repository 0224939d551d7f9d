package com.taskloom.core.session;

import com.taskloom.core.generation.GenerationStream;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Runtime state of one active external session.
 * <p>
 * Holds the live stream handle (for cancellation) and the temporary files staged
 * for the request, so that whichever path ends the session can delete them.
 */
public final class SessionRecord {

    private final String sessionId;
    private final GenerationStream stream;
    private final Instant startedAt;
    private final List<Path> tempFiles;
    private final Path tempDir;
    private volatile SessionStatus status = SessionStatus.ACTIVE;

    public SessionRecord(String sessionId, GenerationStream stream, Instant startedAt,
                         List<Path> tempFiles, Path tempDir) {
        this.sessionId = sessionId;
        this.stream = stream;
        this.startedAt = startedAt;
        this.tempFiles = tempFiles == null ? List.of() : List.copyOf(tempFiles);
        this.tempDir = tempDir;
    }

    public String sessionId() { return sessionId; }
    public GenerationStream stream() { return stream; }
    public Instant startedAt() { return startedAt; }
    public List<Path> tempFiles() { return tempFiles; }
    public Path tempDir() { return tempDir; }
    public SessionStatus status() { return status; }

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    public void markAborted() {
        this.status = SessionStatus.ABORTED;
    }

    @Override
    public String toString() {
        return "SessionRecord{" + sessionId + ", " + status + ", startedAt=" + startedAt + "}";
    }
}
