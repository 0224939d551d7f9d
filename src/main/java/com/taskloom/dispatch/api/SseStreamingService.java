package com.taskloom.dispatch.api;

import com.taskloom.core.events.EventBus;
import com.taskloom.core.events.LifecycleEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Streams conversation lifecycle events to browsers over SSE.
 * <p>
 * A conversation client ({@link #conversationEmitter}) follows {@code conversation:<id>}
 * and sees the exchange as the orchestrator broadcasts it: {@code streaming-started},
 * each raw {@code claude-response} chunk, {@code token-budget} and {@code claude-status}
 * updates, then {@code claude-complete} or {@code claude-error} and {@code streaming-ended}.
 * The emitter outlives a single exchange, so a resumed conversation keeps streaming to
 * the same connection. A task client ({@link #taskEmitter}) follows {@code task:<id>}
 * for {@code conversation-added} and {@code agent-run-updated} notices.
 * <p>
 * Each SSE event is named after the event type; its data is the flattened payload plus
 * {@code type} and {@code timestamp}. A heartbeat comment is sent every 30 seconds so idle
 * proxies do not drop the connection while the assistant works on a long turn.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
        log.info("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SSE heartbeat scheduler stopped");
    }

    void sendHeartbeats() {
        if (activeRegistrations.isEmpty()) {
            return;
        }
        log.debug("Sending heartbeat to {} active SSE emitters", activeRegistrations.size());
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                // onError/onCompletion callbacks remove the registration
                log.debug("Heartbeat failed on {} (connection likely closed): {}",
                        registration.channel, e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped on {} (emitter not active)", registration.channel);
            }
        }
    }

    /** Emitter streaming the events of one conversation. */
    public SseEmitter conversationEmitter(long conversationId) {
        return createEmitter(EventBus.conversationChannel(conversationId));
    }

    /** Emitter streaming the task-wide notices of one task. */
    public SseEmitter taskEmitter(long taskId) {
        return createEmitter(EventBus.taskChannel(taskId));
    }

    SseEmitter createEmitter(String channel) {
        SseEmitter emitter = new SseEmitter(timeoutMs);

        EventBus.Subscription subscription = eventBus.subscribe(channel, event -> sendEvent(emitter, channel, event));

        var registration = new EmitterRegistration(channel, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed on {}", channel);
            cleanup(registration);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out on {}", channel);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error on {}: {}", channel, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment on {}: {}", channel, e.getMessage());
        }

        log.info("SSE emitter created on {} (timeout={}ms)", channel, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, String channel, LifecycleEvent event) {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("type", event.typeName());
            data.putAll(event.payload());
            data.put("timestamp", event.timestamp().toString());

            emitter.send(SseEmitter.event()
                    .name(event.typeName())
                    .data(data));
        } catch (IOException e) {
            log.debug("Failed to send SSE event {} on {}: {}", event.typeName(), channel, e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
        log.debug("Cleaned up SSE registration on {}", registration.channel);
    }

    private record EmitterRegistration(
            String channel,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
