package com.wayfarer.core.model;

import java.io.Serializable;

/**
 * A failure of a whole stage, pending classification by error recovery.
 *
 * @param stage   the stage whose handler produced the failure
 * @param origin  the failure category
 * @param message human-readable reason
 */
public record StageFailure(
    Stage stage,
    FailureOrigin origin,
    String message
) implements Serializable {

    public static StageFailure of(Stage stage, FailureOrigin origin, String message) {
        return new StageFailure(stage, origin, message);
    }

    public boolean structural() {
        return origin == FailureOrigin.STATE;
    }
}
