package com.taskloop.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing the loop's MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setIteration(String runId, int iteration) {
        MDC.put("runId", runId);
        MDC.put("iteration", String.valueOf(iteration));
    }

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void clearTask() {
        MDC.remove("taskId");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("taskId");
        MDC.remove("iteration");
    }
}
