package com.wayfarer.core.capability;

import com.wayfarer.core.model.TaskKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.wayfarer.core.PlanningFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class CapabilityRegistryTest {

    @Test
    @DisplayName("finds registered capabilities by kind")
    void findsRegistered() {
        var search = returning(flights(1));
        var registry = new CapabilityRegistry().register(TaskKind.FLIGHT_SEARCH, search);

        assertTrue(registry.supports(TaskKind.FLIGHT_SEARCH));
        assertSame(search, registry.find(TaskKind.FLIGHT_SEARCH).orElseThrow());
    }

    @Test
    @DisplayName("require fails for unregistered kinds")
    void requireMissing() {
        var registry = new CapabilityRegistry();

        assertFalse(registry.supports(TaskKind.BUDGET));
        assertTrue(registry.find(TaskKind.BUDGET).isEmpty());
        var e = assertThrows(IllegalStateException.class, () -> registry.require(TaskKind.BUDGET));
        assertEquals("No capability registered for BUDGET", e.getMessage());
    }

    @Test
    @DisplayName("registering a kind again replaces the capability")
    void replaces() {
        var first = returning(flights(1));
        var second = returning(flights(2));
        var registry = new CapabilityRegistry()
                .register(TaskKind.FLIGHT_SEARCH, first)
                .register(TaskKind.FLIGHT_SEARCH, second);

        assertSame(second, registry.require(TaskKind.FLIGHT_SEARCH));
    }
}
