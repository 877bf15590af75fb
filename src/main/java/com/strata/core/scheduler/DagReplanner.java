package com.strata.core.scheduler;

import com.strata.core.model.DagStructure;
import com.strata.core.model.Task;
import com.strata.core.model.TaskResult;

import java.util.List;
import java.util.Map;

/**
 * Suggests tasks to add when a {@code replan_dag} command arrives without tasks of its own.
 * No implementation ships with the engine; when none is registered such commands are ignored.
 */
@FunctionalInterface
public interface DagReplanner {

    /**
     * @return tasks to merge into the DAG; may depend on existing tasks, must not reuse their ids
     */
    List<Task> replan(Request request);

    /**
     * @param workflowId       the workflow being replanned
     * @param dag              current DAG
     * @param results          results so far, keyed by task id
     * @param newRequirement   what the new tasks should achieve
     * @param availableContext context supplied with the command
     */
    record Request(
        String workflowId,
        DagStructure dag,
        Map<String, TaskResult> results,
        String newRequirement,
        Map<String, Object> availableContext
    ) {}
}
