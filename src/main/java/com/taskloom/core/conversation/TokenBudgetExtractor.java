package com.taskloom.core.conversation;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskloom.core.generation.StreamChunk;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Derives a {@link TokenBudget} from the usage map of a terminal result chunk.
 * <p>
 * Only the first model entry is read. For each counter the cumulative value is
 * preferred; a missing or zero cumulative value falls back to the per-turn value.
 */
public final class TokenBudgetExtractor {

    private final long contextWindow;

    public TokenBudgetExtractor(long contextWindow) {
        this.contextWindow = contextWindow;
    }

    public Optional<TokenBudget> extract(StreamChunk chunk) {
        if (chunk == null || !chunk.isResult()) {
            return Optional.empty();
        }
        JsonNode modelUsage = chunk.modelUsage();
        if (modelUsage == null) {
            return Optional.empty();
        }
        Iterator<Map.Entry<String, JsonNode>> models = modelUsage.fields();
        if (!models.hasNext()) {
            return Optional.empty();
        }
        JsonNode usage = models.next().getValue();
        if (usage == null || !usage.isObject()) {
            return Optional.empty();
        }

        long used = counter(usage, "cumulativeInputTokens", "inputTokens")
                + counter(usage, "cumulativeOutputTokens", "outputTokens")
                + counter(usage, "cumulativeCacheReadInputTokens", "cacheReadInputTokens")
                + counter(usage, "cumulativeCacheCreationInputTokens", "cacheCreationInputTokens");
        return Optional.of(new TokenBudget(used, contextWindow));
    }

    private static long counter(JsonNode usage, String cumulative, String perTurn) {
        long value = usage.path(cumulative).asLong(0);
        if (value != 0) {
            return value;
        }
        return usage.path(perTurn).asLong(0);
    }
}
