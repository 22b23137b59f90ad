package com.wayfarer.core.graph;

import com.wayfarer.core.capability.CapabilityRegistry;
import com.wayfarer.core.events.EventBus;
import com.wayfarer.core.model.*;
import com.wayfarer.core.state.PlanningState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.wayfarer.core.PlanningFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class TravelPlanningGraphTest {

    private static PlanningState start(String request) {
        return PlanningState.initial(RUN_ID, TravelQuery.of(request), 3);
    }

    @Test
    @DisplayName("a clear request runs straight through to COMPLETE")
    void happyPath() {
        TravelPlanningGraph graph = graph(returning(analysis("Lisbon", 0.9)),
                failing("research should not run"), successfulRegistry(), properties(), new EventBus());

        PlanningState result = graph.run(start("A week in Lisbon"));

        assertEquals(Stage.COMPLETE, result.currentStage());
        TravelPlan plan = result.plan();
        assertEquals(3, plan.flights().options().size());
        assertEquals(2, plan.accommodation().options().size());
        assertEquals(7, plan.activities().itineraries().size());
        assertNotNull(plan.budget());
        assertTrue(plan.alerts().isEmpty());
        assertEquals("A week in Lisbon", result.query().requestText());
        assertTrue(result.conversationHistory().stream().anyMatch(r -> r.content()
                .equals("Completed parallel search: 3 flights, 2 accommodations, 1 transportation options")));
        assertTrue(result.taskResults().get("final_plan").success());
    }

    @Test
    @DisplayName("a request without a destination is researched first")
    void researchWhenNoDestination() {
        TravelPlanningGraph graph = graph(returning(analysis(null, 0.9)),
                returning(new DestinationResearch("Kyoto", "Temples and gardens", List.of("Fushimi Inari"), List.of())),
                successfulRegistry(), properties(), new EventBus());

        PlanningState result = graph.run(start("Somewhere calm with temples"));

        assertEquals(Stage.COMPLETE, result.currentStage());
        assertEquals("Kyoto", result.destination());
        assertTrue(result.conversationHistory().stream()
                .anyMatch(r -> r.content().equals("QUERY_ANALYZED -> DESTINATION_RESEARCHED")));
    }

    @Test
    @DisplayName("inconclusive research suspends the run listing the alternatives")
    void inconclusiveResearchSuspends() {
        TravelPlanningGraph graph = graph(returning(analysis(null, 0.9)),
                returning(new DestinationResearch("", "Several fit", List.of(), List.of("Porto", "Madeira"))),
                successfulRegistry(), properties(), new EventBus());

        PlanningState result = graph.run(start("Somewhere in Portugal"));

        assertEquals(Stage.INTERRUPTED, result.currentStage());
        assertEquals(Stage.DESTINATION_RESEARCHED, result.interruption().resumeStage());
        assertTrue(result.interruption().reason().contains("Porto, Madeira"));
    }

    @Test
    @DisplayName("low confidence suspends right after analysis")
    void lowConfidenceSuspends() {
        TravelPlanningGraph graph = graph(returning(analysis("Lisbon", 0.3)),
                failing("unused"), successfulRegistry(), properties(), new EventBus());

        PlanningState result = graph.run(start("lisbon maybe?"));

        assertEquals(Stage.INTERRUPTED, result.currentStage());
        assertEquals(Stage.DESTINATION_RESEARCHED, result.interruption().resumeStage());
        assertNull(result.plan().flights());
    }

    @Test
    @DisplayName("a partially failed search still completes with alerts")
    void partialSearchFailure() {
        CapabilityRegistry registry = successfulRegistry()
                .register(TaskKind.ACCOMMODATION, failing("no availability"));
        TravelPlanningGraph graph = graph(returning(analysis("Lisbon", 0.9)),
                failing("unused"), registry, properties(), new EventBus());

        PlanningState result = graph.run(start("A week in Lisbon"));

        assertEquals(Stage.COMPLETE, result.currentStage());
        assertNull(result.plan().accommodation());
        assertTrue(result.plan().alerts().contains("accommodation: no availability"));
        assertEquals(0, result.retryCount(Stage.DESTINATION_RESEARCHED));
    }

    @Test
    @DisplayName("a search batch with no successes is replayed and then succeeds")
    void searchReplayed() {
        var calls = new AtomicInteger();
        CapabilityRegistry registry = successfulRegistry()
                .register(TaskKind.FLIGHT_SEARCH, failingTimes(1, flights(2), calls))
                .register(TaskKind.ACCOMMODATION, failingTimes(1, accommodation(2), new AtomicInteger()))
                .register(TaskKind.TRANSPORTATION, failingTimes(1, transportation(2), new AtomicInteger()));
        TravelPlanningGraph graph = graph(returning(analysis("Lisbon", 0.9)),
                failing("unused"), registry, properties(), new EventBus());

        PlanningState result = graph.run(start("A week in Lisbon"));

        assertEquals(Stage.COMPLETE, result.currentStage());
        assertEquals(2, calls.get());
        assertEquals(1, result.retryCount(Stage.DESTINATION_RESEARCHED));
        assertEquals(2, result.plan().flights().options().size());
    }

    @Test
    @DisplayName("a search batch that never succeeds ends the run after three attempts")
    void searchExhausted() {
        var calls = new AtomicInteger();
        CapabilityRegistry registry = successfulRegistry()
                .register(TaskKind.FLIGHT_SEARCH, failingTimes(99, flights(1), calls))
                .register(TaskKind.ACCOMMODATION, failing("down"))
                .register(TaskKind.TRANSPORTATION, failing("down"));
        TravelPlanningGraph graph = graph(returning(analysis("Lisbon", 0.9)),
                failing("unused"), registry, properties(), new EventBus());

        PlanningState result = graph.run(start("A week in Lisbon"));

        assertEquals(Stage.ERROR, result.currentStage());
        assertEquals(3, calls.get());
        assertTrue(result.plan().alerts().stream().anyMatch(a -> a.startsWith("workflow: ")));
    }

    @Test
    @DisplayName("routeAfterAnalysis follows the research flag")
    void routeAfterAnalysis() {
        TravelPlanningGraph graph = graph(returning(analysis("Lisbon", 0.9)),
                failing("unused"), successfulRegistry(), properties(), new EventBus());

        assertEquals(TravelPlanningGraph.SEARCH, graph.routeAfterAnalysis(state(Stage.START)));
        assertEquals(TravelPlanningGraph.RESEARCH, graph.routeAfterAnalysis(start("anywhere")));
    }
}
