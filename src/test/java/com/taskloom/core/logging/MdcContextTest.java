package com.taskloom.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setConversation puts conversationId and taskId in MDC")
    void setConversation() {
        MdcContext.setConversation(12, 3L, null);
        assertEquals("12", MDC.get("conversationId"));
        assertEquals("3", MDC.get("taskId"));
        assertNull(MDC.get("agentId"));
    }

    @Test
    @DisplayName("setConversation replaces a stale owner")
    void replacesOwner() {
        MdcContext.setConversation(12, 3L, null);
        MdcContext.setConversation(13, null, 7L);
        assertNull(MDC.get("taskId"));
        assertEquals("7", MDC.get("agentId"));
    }

    @Test
    @DisplayName("setSession puts sessionId in MDC")
    void setSession() {
        MdcContext.setSession("s-1");
        assertEquals("s-1", MDC.get("sessionId"));
    }

    @Test
    @DisplayName("clear removes all Taskloom keys")
    void clear() {
        MdcContext.setConversation(12, 3L, null);
        MdcContext.setSession("s-1");
        MdcContext.setAgent(7);
        MdcContext.clear();
        assertNull(MDC.get("conversationId"));
        assertNull(MDC.get("sessionId"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("agentId"));
    }
}
