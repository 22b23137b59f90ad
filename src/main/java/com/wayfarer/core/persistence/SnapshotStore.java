package com.wayfarer.core.persistence;

import com.wayfarer.core.state.PlanningState;

import java.util.List;
import java.util.Optional;

/**
 * Keeps the latest {@link PlanningState} of each run so suspended runs can be resumed
 * and finished runs inspected.
 */
public interface SnapshotStore {

    void save(PlanningState state);

    Optional<PlanningState> load(String runId);

    List<String> listRunIds();

    /**
     * @return true if a snapshot existed and was removed
     */
    boolean delete(String runId);
}
