package com.strata.core.state;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.strata.core.model.TaskResult;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Authoritative in-memory record of a running workflow.
 * <p>
 * Instances are immutable; {@link WorkflowStateReducers#updateState} derives the next state.
 *
 * @param workflowId   never changes for the life of the workflow
 * @param currentLayer index of the last layer that ran, 0 before the first
 * @param messages     append-only
 * @param tasks        task results in completion order, append-only
 * @param decisions    append-only
 * @param context      shared key-value data, shallow-merged
 */
public record WorkflowState(
    String workflowId,
    int currentLayer,
    List<Message> messages,
    List<TaskResult> tasks,
    List<Decision> decisions,
    Map<String, Object> context
) implements Serializable {

    public WorkflowState {
        messages = messages == null ? List.of() : List.copyOf(messages);
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    /**
     * Creates an empty state and checks its invariants.
     */
    public static WorkflowState initial(String workflowId, Map<String, Object> context) {
        var state = new WorkflowState(workflowId, 0, List.of(), List.of(), List.of(), context);
        WorkflowStateReducers.validate(state);
        return state;
    }

    // ── Derived views ───────────────────────────────────────────────────

    /** Latest result per task id. */
    @JsonIgnore
    public Map<String, TaskResult> resultsById() {
        Map<String, TaskResult> byId = new LinkedHashMap<>();
        for (TaskResult result : tasks) {
            byId.put(result.taskId(), result);
        }
        return byId;
    }
}
