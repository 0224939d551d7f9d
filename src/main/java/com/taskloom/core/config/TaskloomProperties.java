package com.taskloom.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.ZoneId;

@Component
@ConfigurationProperties(prefix = "taskloom")
public class TaskloomProperties {

    /** Fallback when no context window is configured. */
    public static final int DEFAULT_CONTEXT_WINDOW = 160_000;

    private Claude claude = new Claude();
    private Session session = new Session();
    private Chaining chaining = new Chaining();
    private Scheduler scheduler = new Scheduler();
    private Notifications notifications = new Notifications();

    // -- Flattened accessors --
    public String getClaudePath() { return claude.path; }
    public String getModel() { return claude.model; }
    public int getStartTimeoutSeconds() { return session.startTimeoutSeconds; }
    public long getChainingDelayMs() { return chaining.delayMs; }
    public boolean isSchedulerEnabled() { return scheduler.enabled; }
    public boolean isNotificationsEnabled() { return notifications.enabled; }

    public int getContextWindow() {
        return claude.contextWindow > 0 ? claude.contextWindow : DEFAULT_CONTEXT_WINDOW;
    }

    /** Zone cron expressions are evaluated in; the system zone unless configured. */
    public ZoneId getSchedulerZone() {
        if (scheduler.zone == null || scheduler.zone.isBlank()) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(scheduler.zone);
    }

    public Claude getClaude() { return claude; }
    public void setClaude(Claude claude) { this.claude = claude; }
    public Session getSession() { return session; }
    public void setSession(Session session) { this.session = session; }
    public Chaining getChaining() { return chaining; }
    public void setChaining(Chaining chaining) { this.chaining = chaining; }
    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }
    public Notifications getNotifications() { return notifications; }
    public void setNotifications(Notifications notifications) { this.notifications = notifications; }

    public static class Claude {
        private String path = "claude";
        private String model = "sonnet";
        private int contextWindow = DEFAULT_CONTEXT_WINDOW;

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public int getContextWindow() { return contextWindow; }
        public void setContextWindow(int contextWindow) { this.contextWindow = contextWindow; }
    }

    public static class Session {
        private int startTimeoutSeconds = 30;

        public int getStartTimeoutSeconds() { return startTimeoutSeconds; }
        public void setStartTimeoutSeconds(int startTimeoutSeconds) { this.startTimeoutSeconds = startTimeoutSeconds; }
    }

    public static class Chaining {
        private long delayMs = 1000;

        public long getDelayMs() { return delayMs; }
        public void setDelayMs(long delayMs) { this.delayMs = delayMs; }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private String zone = "";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getZone() { return zone; }
        public void setZone(String zone) { this.zone = zone; }
    }

    public static class Notifications {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
