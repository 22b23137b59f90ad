package com.wayfarer.core.model;

/**
 * Where a stage-level failure came from. Drives recovery classification.
 */
public enum FailureOrigin {
    /** An external capability invoked by the stage failed. */
    CAPABILITY,
    /** A parallel batch produced fewer successes than required. */
    TASK_BATCH,
    /** The handler itself threw. */
    HANDLER,
    /** The planning state violates a structural invariant. */
    STATE
}
