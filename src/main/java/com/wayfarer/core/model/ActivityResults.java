package com.wayfarer.core.model;

import java.io.Serializable;
import java.util.List;

public record ActivityResults(List<DailyItinerary> itineraries) implements TaskPayload, Serializable {

    public ActivityResults {
        itineraries = itineraries == null ? List.of() : List.copyOf(itineraries);
    }

    @Override
    public TaskKind kind() {
        return TaskKind.ACTIVITIES;
    }
}
