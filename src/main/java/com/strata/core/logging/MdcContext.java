package com.strata.core.logging;

import org.slf4j.MDC;

import java.util.Map;

/**
 * Workflow-scoped MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String WORKFLOW_ID = "workflowId";
    public static final String TASK_ID = "taskId";
    public static final String TASK_KIND = "taskKind";
    public static final String LAYER = "layer";

    private MdcContext() {}

    public static void setWorkflow(String workflowId) {
        MDC.put(WORKFLOW_ID, workflowId);
    }

    public static void setTask(String workflowId, String taskId, String taskKind) {
        MDC.put(WORKFLOW_ID, workflowId);
        MDC.put(TASK_ID, taskId);
        MDC.put(TASK_KIND, taskKind);
    }

    public static void setLayer(String workflowId, int layer) {
        MDC.put(WORKFLOW_ID, workflowId);
        MDC.put(LAYER, String.valueOf(layer));
    }

    /** Copy of the caller's MDC for handing to a worker thread; never null. */
    public static Map<String, String> capture() {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return context != null ? context : Map.of();
    }

    public static void restore(Map<String, String> context) {
        MDC.setContextMap(context);
    }

    public static void clear() {
        MDC.remove(WORKFLOW_ID);
        MDC.remove(TASK_ID);
        MDC.remove(TASK_KIND);
        MDC.remove(LAYER);
    }
}
