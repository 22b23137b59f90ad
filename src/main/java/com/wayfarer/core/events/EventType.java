package com.wayfarer.core.events;

/**
 * Kinds of events a planning run emits. Task events carry the task kind label as their
 * subject; the others carry a stage name or nothing.
 */
public enum EventType {

    RUN_CREATED("run.created"),
    RUN_INTERRUPTED("run.interrupted"),
    RUN_RESUMED("run.resumed"),
    RUN_FAILED("run.failed"),
    RUN_HALTED("run.halted"),
    STAGE_RETRYING("stage.retrying"),
    TASK_STARTED("task.started"),
    TASK_COMPLETED("task.completed"),
    TASK_FAILED("task.failed");

    private final String label;

    EventType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
