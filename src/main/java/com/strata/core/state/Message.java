package com.strata.core.state;

import java.io.Serializable;
import java.util.Map;

/**
 * A conversational message attached to the workflow, e.g. approval feedback.
 *
 * @param role      "user", "assistant" or "system"
 * @param content   message text
 * @param timestamp epoch millis
 * @param metadata  free-form extra data
 */
public record Message(String role, String content, long timestamp, Map<String, Object> metadata) implements Serializable {

    public Message {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static Message of(String role, String content) {
        return new Message(role, content, System.currentTimeMillis(), Map.of());
    }
}
