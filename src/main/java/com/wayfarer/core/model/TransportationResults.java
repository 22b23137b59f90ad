package com.wayfarer.core.model;

import java.io.Serializable;
import java.util.List;

public record TransportationResults(List<TransportOption> options) implements TaskPayload, Serializable {

    public TransportationResults {
        options = options == null ? List.of() : List.copyOf(options);
    }

    @Override
    public TaskKind kind() {
        return TaskKind.TRANSPORTATION;
    }
}
