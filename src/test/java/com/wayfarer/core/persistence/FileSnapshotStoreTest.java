package com.wayfarer.core.persistence;

import com.wayfarer.core.model.*;
import com.wayfarer.core.state.PlanningState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static com.wayfarer.core.PlanningFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class FileSnapshotStoreTest {

    @TempDir
    Path tempDir;

    private FileSnapshotStore store;

    @BeforeEach
    void setUp() {
        store = new FileSnapshotStore(tempDir.resolve("runs"));
    }

    private static PlanningState richState() {
        PlanningState state = state(Stage.PARALLEL_SEARCH_COMPLETED);
        return state.toBuilder()
                .plan(state.plan()
                        .withDestination(new DestinationResearch("Lisbon", "Hills and tiles", List.of("Alfama"), List.of()))
                        .withPayload(flights(2))
                        .withPayload(budget("3100", false))
                        .withAlert("accommodation: timeout"))
                .queryConfidence(0.8)
                .interruption(new Interruption(Stage.DESTINATION_RESEARCHED, "confirm", Instant.parse("2026-05-01T10:00:00Z")))
                .build()
                .withRetryCount(Stage.DESTINATION_RESEARCHED, 1)
                .addTaskResult("flights", TaskResult.success("2 flight option(s)"))
                .recordHistory(ConversationRecord.user("A week in Lisbon"));
    }

    @Test
    @DisplayName("a saved snapshot loads back equal")
    void saveAndLoad() {
        PlanningState state = richState();

        store.save(state);

        assertEquals(state, store.load(RUN_ID).orElseThrow());
        assertTrue(Files.exists(tempDir.resolve("runs").resolve(RUN_ID + ".json")));
    }

    @Test
    @DisplayName("saving again replaces the previous snapshot")
    void overwrite() {
        store.save(state(Stage.START));
        store.save(state(Stage.COMPLETE));

        assertEquals(Stage.COMPLETE, store.load(RUN_ID).orElseThrow().currentStage());
        assertEquals(List.of(RUN_ID), store.listRunIds());
    }

    @Test
    @DisplayName("missing runs load as empty and list as nothing")
    void missing() {
        assertTrue(store.load("TRIP-2026-9999").isEmpty());
        assertTrue(store.listRunIds().isEmpty());
        assertFalse(store.delete("TRIP-2026-9999"));
    }

    @Test
    @DisplayName("delete removes the snapshot")
    void delete() {
        store.save(state(Stage.START));

        assertTrue(store.delete(RUN_ID));
        assertTrue(store.load(RUN_ID).isEmpty());
    }

    @Test
    @DisplayName("run ids that could escape the directory are rejected")
    void unsafeRunId() {
        assertThrows(IllegalArgumentException.class, () -> store.load("../etc/passwd"));
    }
}
