package com.wayfarer.core.model;

import java.io.Serializable;
import java.util.List;

public record AccommodationResults(List<AccommodationOption> options) implements TaskPayload, Serializable {

    public AccommodationResults {
        options = options == null ? List.of() : List.copyOf(options);
    }

    @Override
    public TaskKind kind() {
        return TaskKind.ACCOMMODATION;
    }
}
