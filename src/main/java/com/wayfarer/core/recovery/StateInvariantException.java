package com.wayfarer.core.recovery;

import com.wayfarer.core.model.Stage;

/**
 * The planning state is structurally unfit for the stage about to run. Never retried.
 */
public class StateInvariantException extends RuntimeException {

    private final Stage stage;

    public StateInvariantException(Stage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public Stage getStage() {
        return stage;
    }
}
