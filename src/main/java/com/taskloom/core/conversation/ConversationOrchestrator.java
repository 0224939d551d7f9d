package com.taskloom.core.conversation;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskloom.core.events.EventType;
import com.taskloom.core.events.LifecycleEvent;
import com.taskloom.core.generation.GenerationException;
import com.taskloom.core.generation.GenerationRequest;
import com.taskloom.core.generation.GenerationService;
import com.taskloom.core.generation.GenerationStream;
import com.taskloom.core.generation.StreamChunk;
import com.taskloom.core.logging.MdcContext;
import com.taskloom.core.metrics.TaskloomMetrics;
import com.taskloom.core.model.Agent;
import com.taskloom.core.model.Conversation;
import com.taskloom.core.model.TaskInfo;
import com.taskloom.core.session.SessionRecord;
import com.taskloom.core.session.SessionRegistry;
import com.taskloom.core.session.SessionStatus;
import com.taskloom.core.session.StreamingSessionEntry;
import com.taskloom.core.session.StreamingSessionIndex;
import com.taskloom.core.store.AgentStore;
import com.taskloom.core.store.ConversationStore;
import com.taskloom.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Drives streamed exchanges with the generation service from request to terminal state.
 * <p>
 * New conversations are consumed on the stream executor; the start call resolves as soon
 * as the first chunk reveals the session identifier, and {@link ConversationStart#completion()}
 * completes when the stream terminates. Resumed conversations ({@link #sendMessage}) are
 * consumed on the calling thread and return only after the whole stream has ended.
 * <p>
 * While a session is live it is present in both the {@link SessionRegistry} and the
 * {@link StreamingSessionIndex}; every termination path removes it from both and deletes
 * the temporary files staged for the request.
 */
public class ConversationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConversationOrchestrator.class);

    private final GenerationService generationService;
    private final ConversationStore conversationStore;
    private final TaskStore taskStore;
    private final AgentStore agentStore;
    private final SessionRegistry sessionRegistry;
    private final StreamingSessionIndex streamingIndex;
    private final StreamCompletionHandler completionHandler;
    private final AttachmentStager attachmentStager;
    private final TokenBudgetExtractor tokenBudgetExtractor;
    private final TaskloomMetrics metrics;
    private final Executor streamExecutor;
    private final OrchestratorSettings settings;
    private final Clock clock;

    public ConversationOrchestrator(GenerationService generationService,
                                    ConversationStore conversationStore,
                                    TaskStore taskStore,
                                    AgentStore agentStore,
                                    SessionRegistry sessionRegistry,
                                    StreamingSessionIndex streamingIndex,
                                    StreamCompletionHandler completionHandler,
                                    AttachmentStager attachmentStager,
                                    TokenBudgetExtractor tokenBudgetExtractor,
                                    TaskloomMetrics metrics,
                                    Executor streamExecutor,
                                    OrchestratorSettings settings,
                                    Clock clock) {
        this.generationService = generationService;
        this.conversationStore = conversationStore;
        this.taskStore = taskStore;
        this.agentStore = agentStore;
        this.sessionRegistry = sessionRegistry;
        this.streamingIndex = streamingIndex;
        this.completionHandler = completionHandler;
        this.attachmentStager = attachmentStager;
        this.tokenBudgetExtractor = tokenBudgetExtractor;
        this.metrics = metrics;
        this.streamExecutor = streamExecutor;
        this.settings = settings;
        this.clock = clock;
    }

    // -- Start operations --

    /**
     * Starts a new session for a task.
     *
     * @return a future completing with the session identity once the first identifying
     *         chunk arrives, or exceptionally on timeout or on a stream error before that
     * @throws ConversationNotFoundException if the task (or the supplied conversation) does not exist
     * @throws ConversationException         if the supplied conversation is already bound to a session
     */
    public CompletableFuture<ConversationStart> startConversation(long taskId, String message,
                                                                 ConversationOptions options) {
        TaskInfo task = taskStore.findById(taskId).orElseThrow(() -> ConversationNotFoundException.task(taskId));
        if (task.workingDirectory() == null) {
            throw new ConversationException("Task " + taskId + " has no working directory");
        }

        long conversationId;
        if (options.conversationId() != null) {
            conversationId = requireUnboundConversation(options.conversationId()).id();
        } else {
            conversationId = conversationStore.createForTask(taskId, options.triggeredBy()).id();
            log.info("Created conversation {} for task {}", conversationId, taskId);
        }

        var context = new SessionContext(conversationId, taskId, null, null, options.userId(),
                options.broadcaster(), options.taskBroadcaster(), true);
        return launch(context, message, options, options.customSystemPrompt(), task.workingDirectory());
    }

    /**
     * Starts a new session for a custom agent. No chaining follows its completion.
     *
     * @throws ConversationNotFoundException if the agent (or the supplied conversation) does not exist
     */
    public CompletableFuture<ConversationStart> startAgentConversation(long agentId, String message,
                                                                      ConversationOptions options) {
        Agent agent = agentStore.findById(agentId).orElseThrow(() -> ConversationNotFoundException.agent(agentId));

        long conversationId;
        if (options.conversationId() != null) {
            conversationId = requireUnboundConversation(options.conversationId()).id();
        } else {
            conversationId = conversationStore.createForAgent(agentId, options.triggeredBy()).id();
            log.info("Created conversation {} for agent {} (trigger={})", conversationId, agentId,
                    options.triggeredBy());
        }

        String systemPrompt = options.customSystemPrompt() != null ? options.customSystemPrompt() : agent.systemPrompt();
        Long userId = options.userId() != null ? options.userId() : agent.userId();
        var context = new SessionContext(conversationId, null, agentId, null, userId,
                options.broadcaster(), options.taskBroadcaster(), true);
        return launch(context, message, options, systemPrompt, agent.workingDirectory());
    }

    private CompletableFuture<ConversationStart> launch(SessionContext context, String message,
                                                        ConversationOptions options, String systemPrompt,
                                                        Path workingDirectory) {
        StagedPrompt staged = attachmentStager.stage(message, options.attachments(), workingDirectory);
        var request = new GenerationRequest(staged.prompt(), workingDirectory, settings.model(),
                options.permissionMode(), systemPrompt, null, options.allowedTools(), options.disallowedTools());

        CompletableFuture<ConversationStart> started = new CompletableFuture<>();
        CompletableFuture<StreamOutcome> completion = new CompletableFuture<>();
        try {
            streamExecutor.execute(() -> consumeNewSession(context, request, staged, started, completion));
        } catch (RejectedExecutionException e) {
            attachmentStager.cleanup(staged.tempFiles(), staged.tempDir());
            started.completeExceptionally(new StreamException("Stream executor rejected conversation "
                    + context.conversationId(), e));
            return started;
        }

        long timeoutSeconds = settings.startTimeoutSeconds();
        CompletableFuture.runAsync(
                () -> {
                    if (started.completeExceptionally(
                            new SessionStartTimeoutException(context.conversationId(), timeoutSeconds, completion))) {
                        log.warn("No session identifier for conversation {} after {}s",
                                context.conversationId(), timeoutSeconds);
                    }
                },
                CompletableFuture.delayedExecutor(timeoutSeconds, TimeUnit.SECONDS));
        return started;
    }

    private void consumeNewSession(SessionContext base, GenerationRequest request, StagedPrompt staged,
                                   CompletableFuture<ConversationStart> started,
                                   CompletableFuture<StreamOutcome> completion) {
        MdcContext.setConversation(base.conversationId(), base.taskId(), base.agentId());
        long startNanos = System.nanoTime();
        var state = new StreamState(base);
        GenerationStream stream = null;
        try {
            stream = generationService.open(request);
            StreamChunk chunk;
            while ((chunk = stream.next()) != null) {
                if (state.sessionId == null) {
                    String sessionId = chunk.sessionId();
                    if (sessionId == null) {
                        // Held back so that streaming-started precedes every forwarded chunk.
                        state.pending.add(chunk);
                        continue;
                    }
                    activate(state, sessionId, stream, staged);
                    started.complete(new ConversationStart(base.conversationId(), sessionId, completion));
                    for (StreamChunk held : state.pending) {
                        forward(state, held);
                    }
                    state.pending.clear();
                }
                forward(state, chunk);
            }

            if (state.sessionId == null) {
                throw new StreamException("Stream ended without a session identifier");
            }
            finishNormally(state, staged, startNanos);
            completion.complete(StreamOutcome.COMPLETED);
        } catch (RuntimeException e) {
            if (state.sessionId == null) {
                attachmentStager.cleanup(staged.tempFiles(), staged.tempDir());
                log.error("Stream failed before a session was established: {}", e.getMessage(), e);
                started.completeExceptionally(asConversationException(e));
                completion.complete(StreamOutcome.FAILED);
            } else if (state.completionHandled) {
                log.error("Failed after completion of conversation {}: {}", base.conversationId(), e.getMessage(), e);
                completion.complete(StreamOutcome.COMPLETED);
            } else {
                finishWithError(state, staged, startNanos, e);
                started.completeExceptionally(asConversationException(e));
                completion.complete(StreamOutcome.FAILED);
            }
        } finally {
            closeQuietly(stream);
            MdcContext.clear();
        }
    }

    private void activate(StreamState state, String sessionId, GenerationStream stream, StagedPrompt staged) {
        state.sessionId = sessionId;
        state.context = state.context.withSessionId(sessionId);
        SessionContext ctx = state.context;
        MdcContext.setSession(sessionId);

        state.record = register(ctx, stream, staged);
        conversationStore.updateExternalSessionId(ctx.conversationId(), sessionId);
        log.info("Conversation {} bound to session {}", ctx.conversationId(), sessionId);

        emitStreamingStarted(ctx);
        ctx.broadcaster().broadcast(ctx.conversationId(), LifecycleEvent.of(EventType.CONVERSATION_CREATED,
                "conversationId", ctx.conversationId(),
                "claudeSessionId", sessionId));
        if (ctx.isTaskBound() && ctx.taskBroadcaster() != null) {
            ctx.taskBroadcaster().broadcast(ctx.taskId(), LifecycleEvent.of(EventType.CONVERSATION_ADDED,
                    "taskId", ctx.taskId(),
                    "conversationId", ctx.conversationId(),
                    "claudeSessionId", sessionId));
        }
        metrics.recordSessionStarted(ctx.isTaskBound() ? "task" : "agent");
    }

    // -- Resume --

    /**
     * Sends a message to a conversation that already has a session and blocks until the
     * stream has terminated.
     *
     * @throws ConversationNotFoundException if the conversation or its owner does not exist
     * @throws NoSessionYetException         if the conversation has no session identifier
     * @throws StreamException               if the stream failed; raised after the error event
     *                                       and the completion handler
     */
    public void sendMessage(long conversationId, String message, ConversationOptions options) {
        Conversation conversation = requireConversation(conversationId);
        String sessionId = conversation.externalSessionId();
        if (sessionId == null) {
            throw new NoSessionYetException(conversationId);
        }

        Path workingDirectory;
        String systemPrompt = options.customSystemPrompt();
        Long userId = options.userId();
        if (conversation.isTaskBound()) {
            long taskId = conversation.taskId();
            workingDirectory = taskStore.findById(taskId)
                    .orElseThrow(() -> ConversationNotFoundException.task(taskId))
                    .workingDirectory();
        } else {
            long agentId = conversation.agentId();
            Agent agent = agentStore.findById(agentId).orElseThrow(() -> ConversationNotFoundException.agent(agentId));
            workingDirectory = agent.workingDirectory();
            systemPrompt = systemPrompt != null ? systemPrompt : agent.systemPrompt();
            userId = userId != null ? userId : agent.userId();
        }

        var ctx = new SessionContext(conversationId, conversation.taskId(), conversation.agentId(), sessionId,
                userId, options.broadcaster(), options.taskBroadcaster(), false);
        StagedPrompt staged = attachmentStager.stage(message, options.attachments(), workingDirectory);
        var request = new GenerationRequest(staged.prompt(), workingDirectory, settings.model(),
                options.permissionMode(), systemPrompt, sessionId, options.allowedTools(), options.disallowedTools());

        MdcContext.setConversation(conversationId, ctx.taskId(), ctx.agentId());
        MdcContext.setSession(sessionId);
        long startNanos = System.nanoTime();
        var state = new StreamState(ctx);
        state.sessionId = sessionId;
        GenerationStream stream = null;
        try {
            emitStreamingStarted(ctx);
            stream = generationService.open(request);
            state.record = register(ctx, stream, staged);

            StreamChunk chunk;
            while ((chunk = stream.next()) != null) {
                if (!state.sessionCreatedSent && chunk.sessionId() == null) {
                    forwardResponse(ctx, chunk);
                    forwardUsage(ctx, chunk);
                    continue;
                }
                forward(state, chunk);
            }
            finishNormally(state, staged, startNanos);
        } catch (RuntimeException e) {
            if (state.completionHandled) {
                log.error("Failed after completion of conversation {}: {}", conversationId, e.getMessage(), e);
                return;
            }
            finishWithError(state, staged, startNanos, e);
            throw asConversationException(e);
        } finally {
            closeQuietly(stream);
            MdcContext.clear();
        }
    }

    // -- Abort --

    /**
     * Requests cancellation of a live session and removes it from both registries.
     *
     * @return false if the session is unknown or cancellation failed
     */
    public boolean abortSession(String sessionId) {
        Optional<SessionRecord> found = sessionRegistry.get(sessionId);
        if (found.isEmpty()) {
            log.info("Session {} not found, nothing to abort", sessionId);
            return false;
        }
        SessionRecord record = found.get();
        try {
            log.info("Aborting session {}", sessionId);
            record.stream().interrupt();
            record.markAborted();
            attachmentStager.cleanup(record.tempFiles(), record.tempDir());
            sessionRegistry.remove(sessionId);
            streamingIndex.remove(sessionId);
            metrics.recordSessionAborted();
            return true;
        } catch (RuntimeException e) {
            log.error("Error aborting session {}: {}", sessionId, e.getMessage(), e);
            return false;
        }
    }

    // -- Registry reads --

    public boolean isSessionActive(String sessionId) {
        return sessionRegistry.isActive(sessionId);
    }

    public List<String> getActiveSessions() {
        return sessionRegistry.activeSessionIds();
    }

    public Optional<StreamingSessionEntry> getActiveStreamingByConversation(long conversationId) {
        return streamingIndex.findByConversation(conversationId);
    }

    public List<StreamingSessionEntry> getAllActiveStreamingSessions() {
        return streamingIndex.all();
    }

    // -- Chunk forwarding --

    private void forward(StreamState state, StreamChunk chunk) {
        SessionContext ctx = state.context;
        forwardResponse(ctx, chunk);
        if (!state.sessionCreatedSent) {
            state.sessionCreatedSent = true;
            ctx.broadcaster().broadcast(ctx.conversationId(),
                    LifecycleEvent.of(EventType.SESSION_CREATED, "sessionId", state.sessionId));
        }
        forwardUsage(ctx, chunk);
    }

    private void forwardResponse(SessionContext ctx, StreamChunk chunk) {
        ctx.broadcaster().broadcast(ctx.conversationId(), LifecycleEvent.of(EventType.CLAUDE_RESPONSE, "data", chunk));
    }

    private void forwardUsage(SessionContext ctx, StreamChunk chunk) {
        if (chunk.isResult()) {
            tokenBudgetExtractor.extract(chunk).ifPresent(budget -> {
                metrics.recordTokensUsed(budget.used());
                ctx.broadcaster().broadcast(ctx.conversationId(),
                        LifecycleEvent.of(EventType.TOKEN_BUDGET, "data", budget));
            });
        } else if (chunk.isAssistant()) {
            JsonNode usage = chunk.assistantUsage();
            if (usage != null) {
                Map<String, Object> status = new LinkedHashMap<>();
                status.put("tokens", usage.path("input_tokens").asLong(0) + usage.path("output_tokens").asLong(0));
                status.put("can_interrupt", true);
                ctx.broadcaster().broadcast(ctx.conversationId(),
                        LifecycleEvent.of(EventType.CLAUDE_STATUS, "data", status));
            }
        }
    }

    // -- Termination --

    private void finishNormally(StreamState state, StagedPrompt staged, long startNanos) {
        SessionContext ctx = state.context;
        String outcome = deregister(state, staged);
        metrics.recordSessionDuration(outcome, elapsedMs(startNanos));

        broadcastTerminal(ctx, LifecycleEvent.of(EventType.CLAUDE_COMPLETE,
                "sessionId", ctx.sessionId(),
                "exitCode", 0,
                "isNewSession", ctx.newSession()));
        runCompletionHandler(state, false);
    }

    private void finishWithError(StreamState state, StagedPrompt staged, long startNanos, RuntimeException error) {
        SessionContext ctx = state.context;
        String outcome = deregister(state, staged);
        outcome = "aborted".equals(outcome) ? outcome : "failed";
        metrics.recordSessionDuration(outcome, elapsedMs(startNanos));
        log.error("Streaming error in conversation {} ({}): {}", ctx.conversationId(), outcome,
                error.getMessage(), error);

        broadcastTerminal(ctx, LifecycleEvent.of(EventType.CLAUDE_ERROR, "error", String.valueOf(error.getMessage())));
        runCompletionHandler(state, true);
    }

    private void runCompletionHandler(StreamState state, boolean isError) {
        SessionContext ctx = state.context;
        state.completionHandled = true;
        try {
            completionHandler.onStreamingComplete(ctx, isError);
        } catch (RuntimeException e) {
            log.error("Completion handling failed for conversation {}: {}", ctx.conversationId(), e.getMessage(), e);
        }
    }

    // A failing broadcaster must not keep the completion handler from running.
    private static void broadcastTerminal(SessionContext ctx, LifecycleEvent event) {
        try {
            ctx.broadcaster().broadcast(ctx.conversationId(), event);
        } catch (RuntimeException e) {
            log.error("Failed to deliver {} for conversation {}: {}", event.typeName(), ctx.conversationId(),
                    e.getMessage(), e);
        }
    }

    private SessionRecord register(SessionContext ctx, GenerationStream stream, StagedPrompt staged) {
        var record = new SessionRecord(ctx.sessionId(), stream, clock.instant(), staged.tempFiles(), staged.tempDir());
        sessionRegistry.register(record);
        streamingIndex.register(new StreamingSessionEntry(ctx.sessionId(), ctx.taskId(), ctx.agentId(),
                ctx.conversationId()));
        return record;
    }

    /**
     * Removes the session from both registries (if still present) and deletes staged files.
     *
     * @return "aborted" if the session had been aborted, otherwise "completed"
     */
    private String deregister(StreamState state, StagedPrompt staged) {
        if (state.sessionId != null) {
            // Only remove our own record; a resumed session may have re-registered the identifier.
            sessionRegistry.get(state.sessionId)
                    .filter(r -> r == state.record)
                    .ifPresent(r -> {
                        sessionRegistry.remove(state.sessionId);
                        streamingIndex.remove(state.sessionId);
                    });
        }
        attachmentStager.cleanup(staged.tempFiles(), staged.tempDir());
        return state.record != null && state.record.status() == SessionStatus.ABORTED ? "aborted" : "completed";
    }

    private void emitStreamingStarted(SessionContext ctx) {
        ctx.broadcaster().broadcast(ctx.conversationId(), LifecycleEvent.of(EventType.STREAMING_STARTED,
                "taskId", ctx.taskId(),
                "agentId", ctx.agentId(),
                "conversationId", ctx.conversationId(),
                "claudeSessionId", ctx.sessionId()));
        log.info("Streaming started for conversation {}", ctx.conversationId());
    }

    private Conversation requireConversation(long conversationId) {
        return conversationStore.findById(conversationId)
                .orElseThrow(() -> ConversationNotFoundException.conversation(conversationId));
    }

    private Conversation requireUnboundConversation(long conversationId) {
        Conversation conversation = requireConversation(conversationId);
        if (conversation.externalSessionId() != null) {
            throw new ConversationException("Conversation " + conversationId + " is already bound to session "
                    + conversation.externalSessionId() + "; use sendMessage to resume it");
        }
        return conversation;
    }

    private static ConversationException asConversationException(RuntimeException e) {
        if (e instanceof ConversationException ce) {
            return ce;
        }
        if (e instanceof GenerationException) {
            return new StreamException(e.getMessage(), e);
        }
        return new StreamException("Unexpected streaming failure: " + e.getMessage(), e);
    }

    private static void closeQuietly(GenerationStream stream) {
        if (stream == null) {
            return;
        }
        try {
            stream.close();
        } catch (RuntimeException e) {
            log.debug("Error closing generation stream: {}", e.getMessage());
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    /** Mutable per-exchange bookkeeping, confined to the consuming thread. */
    private static final class StreamState {
        SessionContext context;
        String sessionId;
        SessionRecord record;
        boolean sessionCreatedSent;
        boolean completionHandled;
        final List<StreamChunk> pending = new ArrayList<>();

        StreamState(SessionContext context) {
            this.context = context;
        }
    }

    /**
     * Tunables for the orchestrator.
     *
     * @param model               model alias passed with every request
     * @param startTimeoutSeconds how long a start call waits for the session identifier
     */
    public record OrchestratorSettings(String model, long startTimeoutSeconds) {
    }
}
