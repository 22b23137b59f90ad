package com.wayfarer.core.model;

/**
 * Categories of concurrent planning work. Declaration order is the canonical
 * merge order.
 */
public enum TaskKind {
    FLIGHT_SEARCH("flights", FlightResults.class),
    ACCOMMODATION("accommodation", AccommodationResults.class),
    TRANSPORTATION("transportation", TransportationResults.class),
    ACTIVITIES("activities", ActivityResults.class),
    BUDGET("budget", BudgetReport.class);

    private final String label;
    private final Class<? extends TaskPayload> payloadType;

    TaskKind(String label, Class<? extends TaskPayload> payloadType) {
        this.label = label;
        this.payloadType = payloadType;
    }

    /** Lower-case name used in alerts and task-result keys. */
    public String label() {
        return label;
    }

    public Class<? extends TaskPayload> payloadType() {
        return payloadType;
    }

    public boolean accepts(Object payload) {
        return payloadType.isInstance(payload);
    }
}
