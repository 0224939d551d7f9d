package com.taskloom.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Taskloom-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String CONVERSATION_ID = "conversationId";
    public static final String SESSION_ID = "sessionId";
    public static final String TASK_ID = "taskId";
    public static final String AGENT_ID = "agentId";

    private MdcContext() {}

    /** Sets the owner keys of a conversation; exactly one of taskId and agentId is expected. */
    public static void setConversation(long conversationId, Long taskId, Long agentId) {
        MDC.put(CONVERSATION_ID, String.valueOf(conversationId));
        putOrRemove(TASK_ID, taskId);
        putOrRemove(AGENT_ID, agentId);
    }

    public static void setSession(String sessionId) {
        putOrRemove(SESSION_ID, sessionId);
    }

    public static void setAgent(long agentId) {
        MDC.put(AGENT_ID, String.valueOf(agentId));
    }

    public static void clear() {
        MDC.remove(CONVERSATION_ID);
        MDC.remove(SESSION_ID);
        MDC.remove(TASK_ID);
        MDC.remove(AGENT_ID);
    }

    private static void putOrRemove(String key, Object value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, String.valueOf(value));
        }
    }
}
