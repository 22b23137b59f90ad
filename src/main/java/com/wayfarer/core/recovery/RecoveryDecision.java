package com.wayfarer.core.recovery;

import com.wayfarer.core.model.Stage;

/**
 * Outcome of classifying a stage failure.
 */
public sealed interface RecoveryDecision permits RecoveryDecision.Recoverable, RecoveryDecision.Unrecoverable {

    /** Replay the run from {@code resumeStage}; {@code attempt} counts this failure. */
    record Recoverable(Stage resumeStage, int attempt) implements RecoveryDecision {}

    record Unrecoverable(String reason) implements RecoveryDecision {}
}
