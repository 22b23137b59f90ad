package com.wayfarer.core.model;

import com.wayfarer.core.capability.Capability;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * One member of a concurrent batch: the capability to call, its parameters, and an
 * optional timeout (null means the coordinator default applies).
 */
public record TaskSpec(
    TaskKind kind,
    Capability<? extends TaskPayload> capability,
    Map<String, String> parameters,
    Duration timeout
) {

    public TaskSpec {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(capability, "capability");
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public static TaskSpec of(TaskKind kind, Capability<? extends TaskPayload> capability,
                              Map<String, String> parameters) {
        return new TaskSpec(kind, capability, parameters, null);
    }
}
