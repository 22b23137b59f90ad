package com.wayfarer.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Wayfarer-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        if (runId != null) MDC.put("runId", runId);
    }

    public static void setStage(String runId, String stage) {
        setRun(runId);
        MDC.put("stage", stage);
    }

    public static void setTask(String runId, String taskKind) {
        setRun(runId);
        MDC.put("taskKind", taskKind);
    }

    public static void clearTask() {
        MDC.remove("taskKind");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("stage");
        MDC.remove("taskKind");
    }
}
