package com.taskloom.core.generation;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * One message from the generation service's stream.
 * <p>
 * The chunk is kept as an opaque JSON tree and forwarded to clients unchanged.
 * Only the few fields the orchestrator acts on are exposed as accessors.
 */
public final class StreamChunk {

    public static final String TYPE_RESULT = "result";
    public static final String TYPE_ASSISTANT = "assistant";

    private final JsonNode raw;

    private StreamChunk(JsonNode raw) {
        this.raw = Objects.requireNonNull(raw, "raw");
    }

    public static StreamChunk of(JsonNode raw) {
        return new StreamChunk(raw);
    }

    /** The chunk exactly as received; serialised verbatim when forwarded. */
    @JsonValue
    public JsonNode raw() {
        return raw;
    }

    /** Session identifier carried by this chunk, or null. */
    public String sessionId() {
        JsonNode node = raw.get("session_id");
        return node != null && node.isTextual() && !node.asText().isEmpty() ? node.asText() : null;
    }

    /** The chunk's {@code type} tag, or null. */
    public String type() {
        JsonNode node = raw.get("type");
        return node != null && node.isTextual() ? node.asText() : null;
    }

    public boolean isResult() {
        return TYPE_RESULT.equals(type());
    }

    public boolean isAssistant() {
        return TYPE_ASSISTANT.equals(type());
    }

    /** Per-model usage map of a result chunk, or null. */
    public JsonNode modelUsage() {
        JsonNode node = raw.get("modelUsage");
        return node != null && node.isObject() ? node : null;
    }

    /** Incremental usage of an assistant chunk, or null. */
    public JsonNode assistantUsage() {
        JsonNode node = raw.path("message").get("usage");
        return node != null && node.isObject() ? node : null;
    }

    @Override
    public String toString() {
        return raw.toString();
    }
}
