package com.strata.core.execution;

import com.strata.core.model.CodeBlock;
import com.strata.core.model.Task;
import com.strata.core.model.TaskKind;
import com.strata.core.model.TaskResult;
import com.strata.sandbox.SandboxExecutor;
import com.strata.sandbox.SandboxRequest;
import com.strata.sandbox.SandboxResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs {@link TaskKind#CODE_EXECUTION} tasks in the sandbox. The code sees its arguments and
 * a {@code deps} map of upstream results.
 */
@Component
public class CodeExecutor implements TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(CodeExecutor.class);

    private final SandboxExecutor sandbox;

    public CodeExecutor(@Autowired(required = false) SandboxExecutor sandbox) {
        this.sandbox = sandbox;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.CODE_EXECUTION;
    }

    @Override
    public TaskOutcome execute(Task task, Map<String, TaskResult> dependencies, ExecutionContext context) {
        if (sandbox == null) {
            throw new ExecutorConfigurationException(
                    "No sandbox executor configured; code task " + task.id() + " cannot run");
        }
        CodeBlock block = (CodeBlock) task.payload();

        Map<String, Object> sandboxContext = new LinkedHashMap<>(block.arguments());
        sandboxContext.put("deps", dependencies);

        SandboxRequest request = SandboxBudget.request(task, block.code(), sandboxContext,
                context.settings(), context.settings().defaultPermissionSet());
        log.debug("Executing code task {} (timeout {}ms, memory {}MB, permissions {})",
                task.id(), request.timeoutMs(), request.memoryLimitMb(), request.permissionSet().wireName());

        return toOutcome(runSandbox(request));
    }

    SandboxResult runSandbox(SandboxRequest request) {
        if (sandbox == null) {
            throw new ExecutorConfigurationException("No sandbox executor configured");
        }
        long start = System.currentTimeMillis();
        try {
            return sandbox.execute(request);
        } catch (RuntimeException e) {
            log.warn("Sandbox executor threw instead of reporting a result", e);
            return SandboxResult.failed("RuntimeError", String.valueOf(e.getMessage()),
                    System.currentTimeMillis() - start);
        }
    }

    static TaskOutcome toOutcome(SandboxResult result) {
        if (result.success()) {
            return TaskOutcome.success(result.result(), result.elapsedMs());
        }
        String message = result.error() == null
                ? "RuntimeError: sandbox reported failure without details"
                : result.error().type() + ": " + result.error().message();
        return TaskOutcome.failure(message, result.elapsedMs());
    }
}
