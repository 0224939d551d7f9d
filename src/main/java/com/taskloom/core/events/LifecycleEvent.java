package com.taskloom.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A lifecycle notice delivered to subscribers of a conversation or task channel.
 * <p>
 * The payload is an ordered key-value map; values may be arbitrary JSON-serialisable
 * objects, including raw stream chunks forwarded verbatim. Null values are dropped.
 *
 * @param type      the event type
 * @param payload   event data
 * @param timestamp when the event was created
 */
public record LifecycleEvent(
    EventType type,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static LifecycleEvent of(EventType type, Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Payload must be given as key/value pairs");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            Object value = keyValues[i + 1];
            if (value != null) {
                payload.put((String) keyValues[i], value);
            }
        }
        return new LifecycleEvent(type, Collections.unmodifiableMap(payload), Instant.now());
    }

    /** Wire name of the event type, e.g. {@code streaming-started}. */
    public String typeName() {
        return type.wireName();
    }

    public Object get(String key) {
        return payload.get(key);
    }
}
