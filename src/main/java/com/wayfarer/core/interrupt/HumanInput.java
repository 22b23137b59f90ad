package com.wayfarer.core.interrupt;

import java.util.Map;

/**
 * Input supplied by a person to resume a suspended run.
 *
 * @param message     free-form answer, recorded in the conversation history
 * @param destination a revised destination, or null to keep the current one
 * @param preferences preference values to merge into the run's preferences
 */
public record HumanInput(
    String message,
    String destination,
    Map<String, String> preferences
) {

    public HumanInput {
        preferences = preferences == null ? Map.of() : Map.copyOf(preferences);
    }

    public static HumanInput of(String message) {
        return new HumanInput(message, null, Map.of());
    }
}
