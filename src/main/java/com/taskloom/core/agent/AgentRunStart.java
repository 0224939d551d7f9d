package com.taskloom.core.agent;

import com.taskloom.core.conversation.ConversationStart;
import com.taskloom.core.model.AgentRun;

/**
 * A started agent run and the conversation it drives.
 */
public record AgentRunStart(AgentRun run, ConversationStart conversation) {
}
