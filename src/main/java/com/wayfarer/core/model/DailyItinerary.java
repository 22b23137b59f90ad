package com.wayfarer.core.model;

import java.io.Serializable;
import java.util.List;

public record DailyItinerary(
    int day,
    String theme,
    List<String> activities
) implements Serializable {

    public DailyItinerary {
        activities = activities == null ? List.of() : List.copyOf(activities);
    }
}
