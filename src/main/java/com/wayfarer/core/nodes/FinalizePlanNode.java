package com.wayfarer.core.nodes;

import com.wayfarer.core.model.*;
import com.wayfarer.core.state.PlanningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;

/**
 * Records the summary of a finished plan. Missing sections are reported, not failed.
 */
@Component
public class FinalizePlanNode {

    private static final Logger log = LoggerFactory.getLogger(FinalizePlanNode.class);
    public static final String RESULT_KEY = "final_plan";

    public PlanningState apply(PlanningState state) {
        TravelPlan plan = state.plan();
        var details = new LinkedHashMap<String, String>();
        details.put("destination", String.valueOf(state.destination()));
        var missing = new StringBuilder();
        for (TaskKind kind : TaskKind.values()) {
            boolean present = plan.field(kind) != null;
            details.put(kind.label(), present ? "included" : "missing");
            if (!present) {
                missing.append(missing.length() == 0 ? "" : ", ").append(kind.label());
            }
        }
        details.put("alerts", String.valueOf(plan.alerts().size()));

        String summary = "Travel plan ready for " + state.destination()
                + (missing.length() == 0 ? "" : " (missing: " + missing + ")");
        log.info(summary);
        return state
                .recordHistory(ConversationRecord.system(summary))
                .addTaskResult(RESULT_KEY, TaskResult.success(summary, details));
    }
}
