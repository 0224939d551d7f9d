package com.taskloom.core.conversation;

/**
 * An image sent with a message, as a {@code data:<mime>;base64,<payload>} URL.
 *
 * @param data the data URL
 */
public record ImageAttachment(String data) {
}
