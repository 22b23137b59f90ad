package com.wayfarer.core.model;

/**
 * Status reported to the caller when a run returns.
 */
public enum RunStatus {
    COMPLETED,
    FAILED,
    AWAITING_INPUT;

    public static RunStatus of(Stage stage) {
        return switch (stage) {
            case COMPLETE -> COMPLETED;
            case INTERRUPTED -> AWAITING_INPUT;
            case ERROR -> FAILED;
            default -> throw new IllegalArgumentException("Run has not halted: " + stage);
        };
    }
}
