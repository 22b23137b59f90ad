package com.wayfarer.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One entry of the run's conversation and event history.
 *
 * @param role      "user", "system" or "workflow" (stage transitions)
 * @param content   human-readable text
 * @param timestamp when the entry was recorded
 */
public record ConversationRecord(
    String role,
    String content,
    Instant timestamp
) implements Serializable {

    public static ConversationRecord user(String content) {
        return new ConversationRecord("user", content, Instant.now());
    }

    public static ConversationRecord system(String content) {
        return new ConversationRecord("system", content, Instant.now());
    }

    public static ConversationRecord workflow(String content) {
        return new ConversationRecord("workflow", content, Instant.now());
    }
}
