package com.wayfarer.core.model;

import java.io.Serializable;
import java.util.List;

public record FlightResults(List<FlightOption> options) implements TaskPayload, Serializable {

    public FlightResults {
        options = options == null ? List.of() : List.copyOf(options);
    }

    @Override
    public TaskKind kind() {
        return TaskKind.FLIGHT_SEARCH;
    }
}
