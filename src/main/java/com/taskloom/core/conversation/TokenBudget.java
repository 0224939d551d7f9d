package com.taskloom.core.conversation;

/**
 * Context-window usage reported at the end of a turn.
 *
 * @param used  tokens used (input + output + cache read + cache creation)
 * @param total configured context-window size
 */
public record TokenBudget(long used, long total) {
}
