package com.wayfarer.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Recorded when a run is suspended for external input.
 *
 * @param resumeStage the stage execution re-enters at on resume
 * @param reason      what input is needed
 * @param requestedAt when the run was suspended
 */
public record Interruption(
    Stage resumeStage,
    String reason,
    Instant requestedAt
) implements Serializable {}
