package com.wayfarer.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Something that happened during a planning run, used for CLI watch output and logging.
 *
 * @param type      what happened
 * @param runId     the run this event belongs to
 * @param subject   the stage or task kind the event is about, null for run-level events
 * @param payload   extra details; may hold null values
 * @param timestamp when the event occurred
 */
public record WayfarerEvent(
    EventType type,
    String runId,
    String subject,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public WayfarerEvent {
        Objects.requireNonNull(type, "type");
        payload = payload == null || payload.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static WayfarerEvent of(EventType type, String runId, String subject, Map<String, Object> payload) {
        return new WayfarerEvent(type, runId, subject, payload, Instant.now());
    }

    /**
     * One-line rendering used by the watch output, e.g. {@code "flights {reason=timeout}"}.
     */
    public String describe() {
        String details = payload.isEmpty() ? "" : payload.toString();
        if (subject == null) return details;
        return details.isEmpty() ? subject : subject + " " + details;
    }
}
