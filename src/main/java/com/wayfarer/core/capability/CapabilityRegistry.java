package com.wayfarer.core.capability;

import com.wayfarer.core.model.TaskKind;
import com.wayfarer.core.model.TaskPayload;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Capabilities available to the parallel stages, one per {@link TaskKind}.
 */
public class CapabilityRegistry {

    private final Map<TaskKind, Capability<? extends TaskPayload>> capabilities = new EnumMap<>(TaskKind.class);

    public CapabilityRegistry register(TaskKind kind, Capability<? extends TaskPayload> capability) {
        capabilities.put(kind, capability);
        return this;
    }

    public Optional<Capability<? extends TaskPayload>> find(TaskKind kind) {
        return Optional.ofNullable(capabilities.get(kind));
    }

    /**
     * @throws IllegalStateException if nothing is registered for {@code kind}
     */
    public Capability<? extends TaskPayload> require(TaskKind kind) {
        return find(kind).orElseThrow(() ->
                new IllegalStateException("No capability registered for " + kind));
    }

    public boolean supports(TaskKind kind) {
        return capabilities.containsKey(kind);
    }
}
