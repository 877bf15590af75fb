package com.strata.core.routing;

import com.strata.core.model.Task;
import com.strata.core.model.TaskKind;
import org.springframework.stereotype.Component;

/**
 * Classifies tasks for execution and decides which failures are tolerable.
 */
@Component
public class TaskRouter {

    /**
     * Execution kind of {@code task}; a task without an explicit kind is a tool invocation.
     */
    public TaskKind classify(Task task) {
        return task.kind() != null ? task.kind() : TaskKind.MCP_TOOL;
    }

    public boolean requiresSandbox(TaskKind kind) {
        return kind == TaskKind.CODE_EXECUTION || kind == TaskKind.CAPABILITY;
    }

    /**
     * A failure is tolerated only for code tasks that declare no side effects. Every other
     * failure is critical and stops the task's dependents.
     */
    public boolean isSafeToFail(Task task) {
        return classify(task) == TaskKind.CODE_EXECUTION && !task.sideEffects();
    }
}
