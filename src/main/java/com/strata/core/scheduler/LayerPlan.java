package com.strata.core.scheduler;

import com.strata.core.model.Task;

import java.util.List;

/**
 * Result of planning the next layer.
 *
 * @param eligible tasks that can run now, in DAG order
 * @param skipped  tasks newly skipped because their condition outcome did not match
 * @param blocked  unsettled tasks that can never run because a dependency failed
 * @param waiting  unsettled tasks that are neither eligible nor blocked
 */
public record LayerPlan(
    List<Task> eligible,
    List<String> skipped,
    List<String> blocked,
    List<String> waiting
) {

    public LayerPlan {
        eligible = List.copyOf(eligible);
        skipped = List.copyOf(skipped);
        blocked = List.copyOf(blocked);
        waiting = List.copyOf(waiting);
    }

    /** Every task has a result or was skipped. */
    public boolean isComplete() {
        return eligible.isEmpty() && blocked.isEmpty() && waiting.isEmpty();
    }

    /** Nothing can run and only failures stand in the way. */
    public boolean isHalted() {
        return eligible.isEmpty() && !blocked.isEmpty() && waiting.isEmpty();
    }

    /** Nothing can run although some task is not blocked by a failure. */
    public boolean isCycle() {
        return eligible.isEmpty() && !waiting.isEmpty();
    }
}
