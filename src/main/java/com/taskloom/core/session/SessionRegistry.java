package com.taskloom.core.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory map from external session identifier to its {@link SessionRecord}.
 * <p>
 * Mutated only by the conversation orchestrator and its abort path.
 */
@Component
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final ConcurrentHashMap<String, SessionRecord> sessions = new ConcurrentHashMap<>();

    public void register(SessionRecord record) {
        SessionRecord previous = sessions.put(record.sessionId(), record);
        if (previous != null) {
            log.warn("Replaced existing session record for {}", record.sessionId());
        }
    }

    public Optional<SessionRecord> get(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Removes the record if it is still registered.
     *
     * @return the removed record, or empty if it was already gone
     */
    public Optional<SessionRecord> remove(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.remove(sessionId));
    }

    public boolean isActive(String sessionId) {
        return get(sessionId).map(SessionRecord::isActive).orElse(false);
    }

    /** Identifiers of all registered sessions, in no particular order. */
    public List<String> activeSessionIds() {
        return List.copyOf(sessions.keySet());
    }

    public int size() {
        return sessions.size();
    }
}
