package com.taskloom.dispatch.api;

import com.taskloom.core.conversation.ConversationOrchestrator;
import com.taskloom.core.session.StreamingSessionEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for live-session status, abort and event streams.
 */
@RestController
@RequestMapping("/api/v1")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final ConversationOrchestrator orchestrator;
    private final SseStreamingService sseStreamingService;

    public SessionController(ConversationOrchestrator orchestrator, SseStreamingService sseStreamingService) {
        this.orchestrator = orchestrator;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * GET /api/v1/sessions: Active session ids and the live streaming entries.
     */
    @GetMapping("/sessions")
    public ResponseEntity<Map<String, Object>> listSessions() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sessions", orchestrator.getActiveSessions());
        body.put("streaming", orchestrator.getAllActiveStreamingSessions());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<Map<String, Object>> sessionStatus(@PathVariable String sessionId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sessionId", sessionId);
        body.put("active", orchestrator.isSessionActive(sessionId));
        return ResponseEntity.ok(body);
    }

    /**
     * POST /api/v1/sessions/{sessionId}/abort: Interrupt a live session.
     * Returns 404 if the session is not active.
     */
    @PostMapping("/sessions/{sessionId}/abort")
    public ResponseEntity<Map<String, Object>> abort(@PathVariable String sessionId) {
        if (!orchestrator.abortSession(sessionId)) {
            return ResponseEntity.notFound().build();
        }
        log.info("Session {} aborted via API", sessionId);
        return ResponseEntity.ok(Map.of("success", true, "sessionId", sessionId));
    }

    @GetMapping("/conversations/{id}/streaming")
    public ResponseEntity<StreamingSessionEntry> streaming(@PathVariable long id) {
        return orchestrator.getActiveStreamingByConversation(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping(value = "/conversations/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter conversationEvents(@PathVariable long id) {
        return sseStreamingService.conversationEmitter(id);
    }

    @GetMapping(value = "/tasks/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter taskEvents(@PathVariable long id) {
        return sseStreamingService.taskEmitter(id);
    }
}
