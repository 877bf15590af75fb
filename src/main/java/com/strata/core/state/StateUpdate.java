package com.strata.core.state;

import com.strata.core.model.TaskResult;

import java.util.List;
import java.util.Map;

/**
 * Partial state produced by one step. Null fields are left untouched by the reducers.
 */
public record StateUpdate(
    Integer currentLayer,
    List<Message> messages,
    List<TaskResult> tasks,
    List<Decision> decisions,
    Map<String, Object> context
) {

    public static StateUpdate none() {
        return new StateUpdate(null, null, null, null, null);
    }

    public StateUpdate withLayer(int layer) {
        return new StateUpdate(layer, messages, tasks, decisions, context);
    }

    public StateUpdate withMessages(List<Message> messages) {
        return new StateUpdate(currentLayer, messages, tasks, decisions, context);
    }

    public StateUpdate withTasks(List<TaskResult> tasks) {
        return new StateUpdate(currentLayer, messages, tasks, decisions, context);
    }

    public StateUpdate withDecisions(List<Decision> decisions) {
        return new StateUpdate(currentLayer, messages, tasks, decisions, context);
    }

    public StateUpdate withContext(Map<String, Object> context) {
        return new StateUpdate(currentLayer, messages, tasks, decisions, context);
    }
}
