package com.wayfarer.core.graph;

import com.wayfarer.core.config.WorkflowProperties;
import com.wayfarer.core.interrupt.InterruptionController;
import com.wayfarer.core.metrics.WayfarerMetrics;
import com.wayfarer.core.model.Stage;
import com.wayfarer.core.nodes.*;
import com.wayfarer.core.recovery.ErrorRecovery;
import com.wayfarer.core.recovery.StateValidator;
import com.wayfarer.core.state.PlanningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Builds and holds the {@link StageGraph} that drives travel planning.
 * <pre>
 *   START -> analyze_query -> [routeAfterAnalysis]
 *         -> QUERY_ANALYZED -> research_destination -> DESTINATION_RESEARCHED
 *         -> DESTINATION_RESEARCHED                 (destination already known)
 *   DESTINATION_RESEARCHED -> parallel_search -> PARALLEL_SEARCH_COMPLETED
 *         -> plan_activities -> ACTIVITIES_PLANNED -> manage_budget -> BUDGET_MANAGED
 *         -> finalize_plan -> COMPLETE
 * </pre>
 */
@Component
public class TravelPlanningGraph {

    private static final Logger log = LoggerFactory.getLogger(TravelPlanningGraph.class);

    static final String RESEARCH = "research";
    static final String SEARCH = "search";

    private final StageGraph graph;

    public TravelPlanningGraph(
            AnalyzeQueryNode analyzeNode,
            ResearchDestinationNode researchNode,
            ParallelSearchNode searchNode,
            PlanActivitiesNode activitiesNode,
            ManageBudgetNode budgetNode,
            FinalizePlanNode finalizeNode,
            StateValidator validator,
            ErrorRecovery recovery,
            InterruptionController interruptions,
            WayfarerMetrics metrics,
            WorkflowProperties properties) {

        this.graph = StageGraph.builder(validator, recovery, interruptions)
                .addNode(Stage.START, "analyze_query", analyzeNode::apply)
                .addNode(Stage.QUERY_ANALYZED, "research_destination", researchNode::apply)
                .addNode(Stage.DESTINATION_RESEARCHED, "parallel_search", searchNode::apply)
                .addNode(Stage.PARALLEL_SEARCH_COMPLETED, "plan_activities", activitiesNode::apply)
                .addNode(Stage.ACTIVITIES_PLANNED, "manage_budget", budgetNode::apply)
                .addNode(Stage.BUDGET_MANAGED, "finalize_plan", finalizeNode::apply)
                .addConditionalEdges(Stage.START, this::routeAfterAnalysis,
                        Map.of(RESEARCH, Stage.QUERY_ANALYZED,
                                SEARCH, Stage.DESTINATION_RESEARCHED))
                .addEdge(Stage.QUERY_ANALYZED, Stage.DESTINATION_RESEARCHED)
                .addEdge(Stage.DESTINATION_RESEARCHED, Stage.PARALLEL_SEARCH_COMPLETED)
                .addEdge(Stage.PARALLEL_SEARCH_COMPLETED, Stage.ACTIVITIES_PLANNED)
                .addEdge(Stage.ACTIVITIES_PLANNED, Stage.BUDGET_MANAGED)
                .addEdge(Stage.BUDGET_MANAGED, Stage.COMPLETE)
                .metrics(metrics)
                .maxSteps(properties.getMaxSteps())
                .build();
        log.info("Travel planning graph built with step limit {}", graph.getMaxSteps());
    }

    /**
     * Requests with no clear destination go through research; the rest go straight to search.
     */
    String routeAfterAnalysis(PlanningState state) {
        return AnalyzeQueryNode.researchNeeded(state) ? RESEARCH : SEARCH;
    }

    public PlanningState run(PlanningState state) {
        return graph.run(state);
    }

    public StageGraph getStageGraph() {
        return graph;
    }
}
