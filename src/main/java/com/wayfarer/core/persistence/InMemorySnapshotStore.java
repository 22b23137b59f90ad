package com.wayfarer.core.persistence;

import com.wayfarer.core.state.PlanningState;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Snapshot store that lives only as long as the process.
 */
public class InMemorySnapshotStore implements SnapshotStore {

    private final ConcurrentHashMap<String, PlanningState> snapshots = new ConcurrentHashMap<>();

    @Override
    public void save(PlanningState state) {
        Objects.requireNonNull(state.runId(), "runId");
        snapshots.put(state.runId(), state);
    }

    @Override
    public Optional<PlanningState> load(String runId) {
        return Optional.ofNullable(snapshots.get(runId));
    }

    @Override
    public List<String> listRunIds() {
        return snapshots.keySet().stream().sorted().toList();
    }

    @Override
    public boolean delete(String runId) {
        return snapshots.remove(runId) != null;
    }
}
