package com.wayfarer.core.model;

/**
 * Steps of the travel planning workflow.
 * <p>
 * A stage names the step that has been completed; the handler registered for a stage
 * is the step that runs next from it. {@link #START} is initial, {@link #COMPLETE} and
 * {@link #ERROR} are terminal, and {@link #INTERRUPTED} is a suspended state that
 * carries a resume target.
 */
public enum Stage {
    START,
    QUERY_ANALYZED,
    DESTINATION_RESEARCHED,
    PARALLEL_SEARCH_COMPLETED,
    ACTIVITIES_PLANNED,
    BUDGET_MANAGED,
    COMPLETE,
    ERROR,
    INTERRUPTED;

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }

    /**
     * True when a run sitting at this stage should not be advanced further by the graph.
     */
    public boolean haltsExecution() {
        return isTerminal() || this == INTERRUPTED;
    }
}
