package com.taskloom.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskloom.core.agent.AgentChainingController;
import com.taskloom.core.agent.AgentRunService;
import com.taskloom.core.agent.ContextPromptBuilder;
import com.taskloom.core.conversation.AttachmentStager;
import com.taskloom.core.conversation.ConversationOrchestrator;
import com.taskloom.core.conversation.StreamCompletionHandler;
import com.taskloom.core.conversation.TokenBudgetExtractor;
import com.taskloom.core.events.EventBus;
import com.taskloom.core.generation.ClaudeCliGenerationService;
import com.taskloom.core.generation.GenerationService;
import com.taskloom.core.metrics.TaskloomMetrics;
import com.taskloom.core.notification.LoggingPushGateway;
import com.taskloom.core.notification.NotificationService;
import com.taskloom.core.notification.PushGateway;
import com.taskloom.core.notification.PushNotificationService;
import com.taskloom.core.scheduler.AgentCronScheduler;
import com.taskloom.core.session.SessionRegistry;
import com.taskloom.core.session.StreamingSessionIndex;
import com.taskloom.core.store.AgentRunStore;
import com.taskloom.core.store.AgentStore;
import com.taskloom.core.store.ConversationStore;
import com.taskloom.core.store.InMemoryAgentRunStore;
import com.taskloom.core.store.InMemoryAgentStore;
import com.taskloom.core.store.InMemoryConversationStore;
import com.taskloom.core.store.InMemoryTaskStore;
import com.taskloom.core.store.TaskStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class TaskloomConfig {

    // -- Infrastructure --

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Consumes new-session streams; one thread per live stream. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService conversationStreamExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("conversation-stream-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService chainingScheduler() {
        return Executors.newSingleThreadScheduledExecutor(daemonThreads("agent-chaining-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService notificationExecutor() {
        return Executors.newFixedThreadPool(2, daemonThreads("notification-"));
    }

    // -- Persistence defaults --

    @Bean
    @ConditionalOnMissingBean
    public ConversationStore conversationStore(Clock clock) {
        return new InMemoryConversationStore(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskStore taskStore() {
        return new InMemoryTaskStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public AgentRunStore agentRunStore(Clock clock) {
        return new InMemoryAgentRunStore(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public AgentStore agentStore() {
        return new InMemoryAgentStore();
    }

    // -- Collaborators --

    @Bean
    @ConditionalOnMissingBean
    public GenerationService generationService(TaskloomProperties properties, ObjectMapper objectMapper) {
        return new ClaudeCliGenerationService(properties, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public PushGateway pushGateway() {
        return new LoggingPushGateway();
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationService notificationService(PushGateway pushGateway, TaskStore taskStore,
                                                   @Qualifier("notificationExecutor") ExecutorService executor,
                                                   TaskloomProperties properties) {
        return new PushNotificationService(pushGateway, taskStore, executor, properties.isNotificationsEnabled());
    }

    // -- Orchestration --

    @Bean
    public AttachmentStager attachmentStager(Clock clock) {
        return new AttachmentStager(clock);
    }

    @Bean
    public TokenBudgetExtractor tokenBudgetExtractor(TaskloomProperties properties) {
        return new TokenBudgetExtractor(properties.getContextWindow());
    }

    @Bean
    public ContextPromptBuilder contextPromptBuilder() {
        return new ContextPromptBuilder();
    }

    /**
     * The controller starts runs through {@link AgentRunService}, which itself depends on the
     * orchestrator; the starter is resolved lazily to keep the bean graph acyclic.
     */
    @Bean
    public AgentChainingController agentChainingController(AgentRunStore runStore, TaskStore taskStore,
                                                           ObjectProvider<AgentRunService> agentRunService,
                                                           @Qualifier("chainingScheduler") ScheduledExecutorService scheduler,
                                                           TaskloomProperties properties,
                                                           TaskloomMetrics metrics) {
        return new AgentChainingController(runStore, taskStore,
                (taskId, role, context) -> agentRunService.getObject().startAgentRun(taskId, role, context),
                scheduler, properties.getChainingDelayMs(), metrics);
    }

    @Bean
    public StreamCompletionHandler streamCompletionHandler(AgentRunStore runStore, TaskStore taskStore,
                                                           AgentStore agentStore,
                                                           AgentChainingController chaining,
                                                           NotificationService notificationService) {
        return new StreamCompletionHandler(runStore, taskStore, agentStore, chaining, notificationService);
    }

    @Bean
    public ConversationOrchestrator conversationOrchestrator(GenerationService generationService,
                                                             ConversationStore conversationStore,
                                                             TaskStore taskStore,
                                                             AgentStore agentStore,
                                                             SessionRegistry sessionRegistry,
                                                             StreamingSessionIndex streamingIndex,
                                                             StreamCompletionHandler completionHandler,
                                                             AttachmentStager attachmentStager,
                                                             TokenBudgetExtractor tokenBudgetExtractor,
                                                             TaskloomMetrics metrics,
                                                             @Qualifier("conversationStreamExecutor") ExecutorService streamExecutor,
                                                             TaskloomProperties properties,
                                                             Clock clock) {
        return new ConversationOrchestrator(generationService, conversationStore, taskStore, agentStore,
                sessionRegistry, streamingIndex, completionHandler, attachmentStager, tokenBudgetExtractor,
                metrics, streamExecutor,
                new ConversationOrchestrator.OrchestratorSettings(properties.getModel(),
                        properties.getStartTimeoutSeconds()),
                clock);
    }

    @Bean
    public AgentRunService agentRunService(TaskStore taskStore, AgentRunStore runStore,
                                           ConversationStore conversationStore,
                                           ConversationOrchestrator orchestrator,
                                           NotificationService notificationService,
                                           ContextPromptBuilder contextPromptBuilder) {
        return new AgentRunService(taskStore, runStore, conversationStore, orchestrator, notificationService,
                contextPromptBuilder);
    }

    @Bean
    public AgentCronScheduler agentCronScheduler(AgentStore agentStore, ConversationStore conversationStore,
                                                 ConversationOrchestrator orchestrator, EventBus eventBus,
                                                 TaskloomMetrics metrics, Clock clock,
                                                 TaskloomProperties properties) {
        return new AgentCronScheduler(agentStore, conversationStore, orchestrator,
                eventBus.conversationBroadcaster(), metrics, clock, properties.getSchedulerZone(),
                properties.isSchedulerEnabled());
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
