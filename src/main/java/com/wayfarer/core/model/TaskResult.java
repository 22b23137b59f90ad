package com.wayfarer.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * Last recorded result of a stage or task, kept for inspection and status output.
 */
public record TaskResult(
    boolean success,
    String summary,
    Map<String, String> details
) implements Serializable {

    public TaskResult {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static TaskResult success(String summary) {
        return new TaskResult(true, summary, Map.of());
    }

    public static TaskResult success(String summary, Map<String, String> details) {
        return new TaskResult(true, summary, details);
    }

    public static TaskResult failure(String summary) {
        return new TaskResult(false, summary, Map.of());
    }
}
