package com.wayfarer.core.nodes;

import com.wayfarer.core.capability.Capability;
import com.wayfarer.core.capability.CapabilityRegistry;
import com.wayfarer.core.capability.Outcome;
import com.wayfarer.core.events.EventBus;
import com.wayfarer.core.model.*;
import com.wayfarer.core.parallel.ParallelCoordinator;
import com.wayfarer.core.parallel.ResultMerger;
import com.wayfarer.core.state.PlanningState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static com.wayfarer.core.PlanningFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the nodes that delegate to the parallel coordinator.
 */
class BatchNodesTest {

    private ParallelCoordinator coordinator;
    private ResultMerger merger;

    @BeforeEach
    void setUp() {
        coordinator = new ParallelCoordinator(properties(), new EventBus(), null);
        merger = new ResultMerger(properties());
    }

    @Nested
    @DisplayName("ParallelSearchNode")
    class ParallelSearch {

        @Test
        @DisplayName("merges all three searches and summarises them")
        void mergesSearches() {
            var node = new ParallelSearchNode(coordinator, merger, successfulRegistry());

            PlanningState result = node.apply(state(Stage.DESTINATION_RESEARCHED));

            assertEquals(Stage.PARALLEL_SEARCH_COMPLETED, result.currentStage());
            assertEquals(3, result.plan().flights().options().size());
            assertEquals("Completed parallel search: 3 flights, 2 accommodations, 1 transportation options",
                    result.conversationHistory().get(0).content());
        }

        @Test
        @DisplayName("a failed search leaves an alert and zero in the summary")
        void partialFailure() {
            var registry = successfulRegistry().register(TaskKind.FLIGHT_SEARCH, failing("no routes"));
            var node = new ParallelSearchNode(coordinator, merger, registry);

            PlanningState result = node.apply(state(Stage.DESTINATION_RESEARCHED));

            assertNull(result.plan().flights());
            assertTrue(result.plan().alerts().contains("flights: no routes"));
            assertFalse(result.hasFailure());
            assertTrue(result.conversationHistory().get(0).content().contains("0 flights"));
        }

        @Test
        @DisplayName("searches receive the trip parameters")
        void passesParameters() {
            var seen = new AtomicReference<Map<String, String>>();
            Capability<FlightResults> recording = (parameters, snapshot, deadline) -> {
                seen.set(parameters);
                return Outcome.success(flights(1));
            };
            var node = new ParallelSearchNode(coordinator, merger,
                    successfulRegistry().register(TaskKind.FLIGHT_SEARCH, recording));

            node.apply(state(Stage.DESTINATION_RESEARCHED));

            assertEquals("Lisbon", seen.get().get("destination"));
            assertEquals("New York", seen.get().get("origin"));
            assertEquals("2026-05-04", seen.get().get("departureDate"));
            assertEquals("2", seen.get().get("travelers"));
        }
    }

    @Nested
    @DisplayName("PlanActivitiesNode")
    class PlanActivities {

        @Test
        @DisplayName("stores the itinerary and moves to ACTIVITIES_PLANNED")
        void plansActivities() {
            var node = new PlanActivitiesNode(coordinator, merger, successfulRegistry());

            PlanningState result = node.apply(state(Stage.PARALLEL_SEARCH_COMPLETED));

            assertEquals(Stage.ACTIVITIES_PLANNED, result.currentStage());
            assertEquals(7, result.plan().activities().itineraries().size());
        }

        @Test
        @DisplayName("a failed plan escalates as a batch failure")
        void failure() {
            var registry = successfulRegistry().register(TaskKind.ACTIVITIES, failing("no ideas"));
            var node = new PlanActivitiesNode(coordinator, merger, registry);

            PlanningState result = node.apply(state(Stage.PARALLEL_SEARCH_COMPLETED));

            assertEquals(FailureOrigin.TASK_BATCH, result.failure().origin());
            assertEquals(Stage.PARALLEL_SEARCH_COMPLETED, result.failure().stage());
        }
    }

    @Nested
    @DisplayName("ManageBudgetNode")
    class ManageBudget {

        private PlanningState searched() {
            PlanningState state = state(Stage.ACTIVITIES_PLANNED);
            return state.toBuilder()
                    .plan(state.plan().withPayload(flights(3)).withPayload(accommodation(2))
                            .withPayload(transportation(1)).withPayload(activities(7)))
                    .build();
        }

        @Test
        @DisplayName("hands the cheapest options to the estimate")
        void cheapestOptions() {
            var seen = new AtomicReference<Map<String, String>>();
            Capability<BudgetReport> recording = (parameters, snapshot, deadline) -> {
                seen.set(parameters);
                return Outcome.success(budget("3400", true));
            };
            var node = new ManageBudgetNode(coordinator, merger,
                    successfulRegistry().register(TaskKind.BUDGET, recording));

            PlanningState result = node.apply(searched());

            assertEquals("550", seen.get().get("cheapestFlight"));
            assertEquals("130", seen.get().get("cheapestNightlyRate"));
            assertEquals("40", seen.get().get("cheapestTransport"));
            assertEquals("7", seen.get().get("itineraryDays"));
            assertEquals(Stage.BUDGET_MANAGED, result.currentStage());
            assertTrue(result.plan().alerts().isEmpty());
        }

        @Test
        @DisplayName("an estimate over budget adds an alert")
        void overBudget() {
            var node = new ManageBudgetNode(coordinator, merger,
                    successfulRegistry().register(TaskKind.BUDGET, returning(budget("5200", false))));

            PlanningState result = node.apply(searched());

            assertEquals(List.of("budget: estimated 5200 USD exceeds the budget of 4000"),
                    result.plan().alerts());
        }
    }

    @Nested
    @DisplayName("FinalizePlanNode")
    class FinalizePlan {

        @Test
        @DisplayName("summarises a complete plan")
        void complete() {
            PlanningState state = state(Stage.BUDGET_MANAGED);
            state = state.toBuilder()
                    .plan(state.plan().withPayload(flights(1)).withPayload(accommodation(1))
                            .withPayload(transportation(1)).withPayload(activities(2))
                            .withPayload(budget("2000", true)))
                    .build();

            PlanningState result = new FinalizePlanNode().apply(state);

            TaskResult summary = result.taskResults().get(FinalizePlanNode.RESULT_KEY);
            assertEquals("Travel plan ready for Lisbon", summary.summary());
            assertEquals("included", summary.details().get("budget"));
        }

        @Test
        @DisplayName("lists the sections that are missing")
        void missingSections() {
            PlanningState state = state(Stage.BUDGET_MANAGED);
            state = state.toBuilder().plan(state.plan().withPayload(flights(1))).build();

            PlanningState result = new FinalizePlanNode().apply(state);

            assertEquals("Travel plan ready for Lisbon (missing: accommodation, transportation, activities, budget)",
                    result.conversationHistory().get(0).content());
            assertEquals("missing", result.taskResults().get(FinalizePlanNode.RESULT_KEY).details().get("activities"));
        }
    }
}
