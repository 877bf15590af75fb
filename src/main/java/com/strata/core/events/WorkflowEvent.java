package com.strata.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a workflow runs, consumed by the CLI progress view and by tests.
 *
 * @param eventType  event type, e.g. "workflow.started", "layer.started", "task.failed"
 * @param workflowId the workflow this event belongs to
 * @param taskId     the task this event relates to (nullable for workflow-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record WorkflowEvent(
    String eventType,
    String workflowId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String WORKFLOW_STARTED = "workflow.started";
    public static final String LAYER_STARTED = "layer.started";
    public static final String TASK_STARTED = "task.started";
    public static final String TASK_COMPLETED = "task.completed";
    public static final String TASK_WARNING = "task.warning";
    public static final String TASK_FAILED = "task.failed";
    public static final String TASK_SKIPPED = "task.skipped";
    public static final String CHECKPOINT_SAVED = "checkpoint.saved";
    public static final String DECISION_REQUIRED = "decision.required";
    public static final String WORKFLOW_REPLANNED = "workflow.replanned";
    public static final String WORKFLOW_COMPLETED = "workflow.completed";
    public static final String WORKFLOW_ABORTED = "workflow.aborted";

    public static WorkflowEvent of(String eventType, String workflowId, String taskId, Map<String, Object> payload) {
        return new WorkflowEvent(eventType, workflowId, taskId, payload == null ? Map.of() : payload, Instant.now());
    }
}
