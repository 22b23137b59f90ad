package com.wayfarer.core.recovery;

import com.wayfarer.core.model.Stage;
import com.wayfarer.core.state.PlanningState;
import org.springframework.stereotype.Component;

/**
 * Structural requirements a state must meet before the handler of a stage runs.
 * Checked on every handler invocation, including re-entry after recovery.
 */
@Component
public class StateValidator {

    /**
     * @throws StateInvariantException if {@code state} cannot be handled at {@code stage}
     */
    public void validate(Stage stage, PlanningState state) {
        if (state.concurrencyLimit() < 1) {
            throw new StateInvariantException(stage,
                    "concurrency limit must be at least 1, was " + state.concurrencyLimit());
        }
        if (state.query() == null) {
            throw new StateInvariantException(stage, "travel query is missing");
        }
        switch (stage) {
            case START -> {
                String text = state.query().requestText();
                if (text == null || text.isBlank()) {
                    throw new StateInvariantException(stage, "travel request text is empty");
                }
            }
            default -> {
                if (requiresDestination(stage) && state.destination() == null) {
                    throw new StateInvariantException(stage, "no destination available for " + stage);
                }
            }
        }
    }

    /**
     * True for the stages whose handlers cannot run without a destination.
     */
    public static boolean requiresDestination(Stage stage) {
        return switch (stage) {
            case DESTINATION_RESEARCHED, PARALLEL_SEARCH_COMPLETED, ACTIVITIES_PLANNED, BUDGET_MANAGED -> true;
            default -> false;
        };
    }
}
