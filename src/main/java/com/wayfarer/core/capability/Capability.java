package com.wayfarer.core.capability;

import com.wayfarer.core.state.PlanningState;

import java.time.Instant;
import java.util.Map;

/**
 * An external provider of one kind of planning answer (flight search, destination
 * research, budgeting, ...).
 * <p>
 * Implementations must return by {@code deadline} and must report internal faults as
 * {@link Outcome.Failure} rather than throwing. Callers still guard against exceptions.
 *
 * @param <P> the payload type produced on success
 */
@FunctionalInterface
public interface Capability<P> {

    /**
     * @param parameters capability-specific inputs
     * @param snapshot   immutable view of the planning state at the time of the call
     * @param deadline   instant by which the call must complete
     */
    Outcome<P> execute(Map<String, String> parameters, PlanningState snapshot, Instant deadline);
}
