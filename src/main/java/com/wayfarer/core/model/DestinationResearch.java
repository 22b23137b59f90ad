package com.wayfarer.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Output of destination research. {@code destination} is blank when research could not
 * settle on a single place; {@code alternatives} then lists the candidates.
 */
public record DestinationResearch(
    String destination,
    String summary,
    List<String> highlights,
    List<String> alternatives
) implements Serializable {

    public DestinationResearch {
        highlights = highlights == null ? List.of() : List.copyOf(highlights);
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    public boolean resolved() {
        return destination != null && !destination.isBlank();
    }
}
