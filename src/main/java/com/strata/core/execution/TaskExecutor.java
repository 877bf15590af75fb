package com.strata.core.execution;

import com.strata.core.model.Task;
import com.strata.core.model.TaskKind;
import com.strata.core.model.TaskResult;

import java.util.Map;

/**
 * Runs tasks of one {@link TaskKind}. Task-level failures are returned as
 * {@link TaskOutcome#failure}; only {@link ExecutorConfigurationException} is thrown.
 */
public interface TaskExecutor {

    TaskKind kind();

    /**
     * @param task         the task to run; its kind equals {@link #kind()}
     * @param dependencies resolved upstream results, keyed by task id
     * @param context      run-wide inputs
     */
    TaskOutcome execute(Task task, Map<String, TaskResult> dependencies, ExecutionContext context);
}
