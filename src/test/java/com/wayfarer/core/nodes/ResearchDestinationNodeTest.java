package com.wayfarer.core.nodes;

import com.wayfarer.core.model.*;
import com.wayfarer.core.state.PlanningState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.wayfarer.core.PlanningFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ResearchDestinationNodeTest {

    private static PlanningState vague() {
        return PlanningState.initial(RUN_ID, TravelQuery.of("Somewhere with temples"), 3)
                .updateStage(Stage.QUERY_ANALYZED);
    }

    @Test
    @DisplayName("a resolved destination becomes the plan destination")
    void resolved() {
        var research = new DestinationResearch("Kyoto", "Temples and gardens", List.of("Gion"), List.of());
        var node = new ResearchDestinationNode(returning(research), Duration.ofSeconds(5));

        PlanningState result = node.apply(vague());

        assertEquals("Kyoto", result.destination());
        assertFalse(result.humanInputRequested());
        assertEquals("Destination researched: Kyoto", result.conversationHistory().get(0).content());
    }

    @Test
    @DisplayName("inconclusive research asks the traveller to choose")
    void alternatives() {
        var research = new DestinationResearch("", "Several fit", List.of(), List.of("Kyoto", "Nara"));
        var node = new ResearchDestinationNode(returning(research), Duration.ofSeconds(5));

        PlanningState result = node.apply(vague());

        assertTrue(result.humanInputRequested());
        assertEquals("Please choose a destination: Kyoto, Nara", result.inputRequestReason());
        assertNull(result.destination());
        assertFalse(result.taskResults().get(ResearchDestinationNode.RESULT_KEY).success());
    }

    @Test
    @DisplayName("research with no candidates asks for a destination")
    void noCandidates() {
        var research = new DestinationResearch(null, "Nothing fits", List.of(), List.of());
        var node = new ResearchDestinationNode(returning(research), Duration.ofSeconds(5));

        PlanningState result = node.apply(vague());

        assertEquals("No destination could be determined; please name one", result.inputRequestReason());
    }

    @Test
    @DisplayName("a capability failure becomes a stage failure")
    void failure() {
        var node = new ResearchDestinationNode(failing("timeout"), Duration.ofSeconds(5));

        PlanningState result = node.apply(vague());

        assertEquals("destination research: timeout", result.failure().message());
        assertEquals(Stage.QUERY_ANALYZED, result.failure().stage());
    }
}
