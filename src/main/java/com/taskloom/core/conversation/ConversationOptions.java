package com.taskloom.core.conversation;

import com.taskloom.core.events.Broadcaster;

import java.util.List;

/**
 * Caller-supplied lifecycle context for one exchange.
 *
 * @param conversationId     existing conversation to use (null to create one)
 * @param broadcaster        per-conversation event delivery
 * @param taskBroadcaster    task-wide fan-out (null when not needed)
 * @param userId             acting user, for notification routing (may be null)
 * @param permissionMode     permission mode passed to the generation service (null for default)
 * @param customSystemPrompt text appended to the system prompt (may be null)
 * @param attachments        image attachments (empty for none)
 * @param triggeredBy        "user" or "cron"; recorded on created conversations
 * @param allowedTools       tools the assistant may use without asking (empty for no restriction)
 * @param disallowedTools    tools the assistant may not use
 */
public record ConversationOptions(
    Long conversationId,
    Broadcaster broadcaster,
    Broadcaster taskBroadcaster,
    Long userId,
    String permissionMode,
    String customSystemPrompt,
    List<ImageAttachment> attachments,
    String triggeredBy,
    List<String> allowedTools,
    List<String> disallowedTools
) {

    public static final String TRIGGER_USER = "user";
    public static final String TRIGGER_CRON = "cron";

    public ConversationOptions {
        broadcaster = broadcaster == null ? Broadcaster.none() : broadcaster;
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
        triggeredBy = triggeredBy == null ? TRIGGER_USER : triggeredBy;
        allowedTools = allowedTools == null ? List.of() : List.copyOf(allowedTools);
        disallowedTools = disallowedTools == null ? List.of() : List.copyOf(disallowedTools);
    }

    public static ConversationOptions defaults() {
        return new ConversationOptions(null, null, null, null, null, null, null, null, null, null);
    }

    public ConversationOptions withConversationId(Long id) {
        return new ConversationOptions(id, broadcaster, taskBroadcaster, userId, permissionMode,
                customSystemPrompt, attachments, triggeredBy,
                allowedTools, disallowedTools);
    }

    public ConversationOptions withBroadcasters(Broadcaster conversation, Broadcaster task) {
        return new ConversationOptions(conversationId, conversation, task, userId, permissionMode,
                customSystemPrompt, attachments, triggeredBy,
                allowedTools, disallowedTools);
    }

    public ConversationOptions withUserId(Long id) {
        return new ConversationOptions(conversationId, broadcaster, taskBroadcaster, id, permissionMode,
                customSystemPrompt, attachments, triggeredBy,
                allowedTools, disallowedTools);
    }

    public ConversationOptions withPermissionMode(String mode) {
        return new ConversationOptions(conversationId, broadcaster, taskBroadcaster, userId, mode,
                customSystemPrompt, attachments, triggeredBy,
                allowedTools, disallowedTools);
    }

    public ConversationOptions withCustomSystemPrompt(String prompt) {
        return new ConversationOptions(conversationId, broadcaster, taskBroadcaster, userId, permissionMode,
                prompt, attachments, triggeredBy,
                allowedTools, disallowedTools);
    }

    public ConversationOptions withAttachments(List<ImageAttachment> images) {
        return new ConversationOptions(conversationId, broadcaster, taskBroadcaster, userId, permissionMode,
                customSystemPrompt, images, triggeredBy,
                allowedTools, disallowedTools);
    }

    public ConversationOptions withTriggeredBy(String trigger) {
        return new ConversationOptions(conversationId, broadcaster, taskBroadcaster, userId, permissionMode,
                customSystemPrompt, attachments, trigger,
                allowedTools, disallowedTools);
    }

    public ConversationOptions withTools(List<String> allowed, List<String> disallowed) {
        return new ConversationOptions(conversationId, broadcaster, taskBroadcaster, userId, permissionMode,
                customSystemPrompt, attachments, triggeredBy, allowed, disallowed);
    }
}
