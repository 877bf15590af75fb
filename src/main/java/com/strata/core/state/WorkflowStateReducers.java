package com.strata.core.state;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure reducers that fold a {@link StateUpdate} into a {@link WorkflowState}.
 * <p>
 * Messages, task results and decisions are appended; context is shallow-merged with the
 * update winning on key conflicts. Invariants are checked on the candidate state and a
 * violation rejects the whole update.
 */
public final class WorkflowStateReducers {

    private WorkflowStateReducers() {}

    public static <T> List<T> append(List<T> existing, List<T> update) {
        if (update == null || update.isEmpty()) {
            return existing;
        }
        var merged = new ArrayList<T>(existing.size() + update.size());
        merged.addAll(existing);
        merged.addAll(update);
        return merged;
    }

    public static Map<String, Object> mergeContext(Map<String, Object> existing, Map<String, Object> update) {
        if (update == null || update.isEmpty()) {
            return existing;
        }
        var merged = new LinkedHashMap<>(existing);
        merged.putAll(update);
        return merged;
    }

    /**
     * Applies {@code update} to {@code state}.
     *
     * @return the new state; {@code state} itself is never modified
     * @throws StateInvariantException if the result would violate an invariant
     */
    public static WorkflowState updateState(WorkflowState state, StateUpdate update) {
        var candidate = new WorkflowState(
                state.workflowId(),
                update.currentLayer() != null ? update.currentLayer() : state.currentLayer(),
                append(state.messages(), update.messages()),
                append(state.tasks(), update.tasks()),
                append(state.decisions(), update.decisions()),
                mergeContext(state.context(), update.context()));
        validate(candidate);
        return candidate;
    }

    public static void validate(WorkflowState state) {
        if (state.workflowId() == null || state.workflowId().isBlank()) {
            throw new StateInvariantException("State invariant violated: workflowId must be non-empty");
        }
        if (state.currentLayer() < 0) {
            throw new StateInvariantException(
                    "State invariant violated: currentLayer must be >= 0, got " + state.currentLayer());
        }
        if (state.tasks().size() < state.decisions().size()) {
            throw new StateInvariantException("State invariant violated: tasks.length (%d) must be >= decisions.length (%d)"
                    .formatted(state.tasks().size(), state.decisions().size()));
        }
    }
}
