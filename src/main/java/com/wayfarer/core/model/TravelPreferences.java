package com.wayfarer.core.model;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Preferences derived from the request (interests, lodging style, pace, ...).
 * Free-form keyed values so human input can refine any of them.
 */
public record TravelPreferences(
    List<String> interests,
    Map<String, String> values
) implements Serializable {

    public TravelPreferences {
        interests = interests == null ? List.of() : List.copyOf(interests);
        values = values == null ? Map.of() : Map.copyOf(values);
    }

    public static TravelPreferences empty() {
        return new TravelPreferences(List.of(), Map.of());
    }

    public TravelPreferences merge(Map<String, String> updates) {
        if (updates == null || updates.isEmpty()) return this;
        var merged = new LinkedHashMap<>(values);
        merged.putAll(updates);
        return new TravelPreferences(interests, merged);
    }
}
