package com.strata.core.execution;

import com.strata.core.config.ExecutionSettings;
import com.strata.core.model.TaskResult;

import java.util.Map;

/**
 * Run-wide inputs available to every executor.
 *
 * @param workflowId   workflow the task belongs to
 * @param parameters   run parameters, read by {@code parameter} argument sources
 * @param priorResults every result recorded before the current layer, keyed by task id
 * @param settings     settings snapshot the current layer runs with
 */
public record ExecutionContext(
    String workflowId,
    Map<String, Object> parameters,
    Map<String, TaskResult> priorResults,
    ExecutionSettings settings
) {

    public ExecutionContext {
        parameters = parameters == null ? Map.of() : parameters;
        priorResults = priorResults == null ? Map.of() : priorResults;
    }
}
