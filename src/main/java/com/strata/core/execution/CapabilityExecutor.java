package com.strata.core.execution;

import com.strata.core.capability.CapabilityStore;
import com.strata.core.capability.StoredCapability;
import com.strata.core.model.CapabilityInvocation;
import com.strata.core.model.Task;
import com.strata.core.model.TaskKind;
import com.strata.core.model.TaskResult;
import com.strata.sandbox.PermissionSet;
import com.strata.sandbox.SandboxExecutor;
import com.strata.sandbox.SandboxRequest;
import com.strata.sandbox.SandboxResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Runs {@link TaskKind#CAPABILITY} tasks. The source comes from the task itself or from the
 * {@link CapabilityStore}; either way it runs in the sandbox like a code task, with the
 * capability id and intent added to its context.
 */
@Component
public class CapabilityExecutor implements TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(CapabilityExecutor.class);

    private final CodeExecutor codeExecutor;
    private final CapabilityStore capabilityStore;

    public CapabilityExecutor(CodeExecutor codeExecutor,
                              @Autowired(required = false) CapabilityStore capabilityStore) {
        this.codeExecutor = codeExecutor;
        this.capabilityStore = capabilityStore;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.CAPABILITY;
    }

    @Override
    public TaskOutcome execute(Task task, Map<String, TaskResult> dependencies, ExecutionContext context) {
        CapabilityInvocation invocation = (CapabilityInvocation) task.payload();
        String capabilityId = invocation.capabilityId();

        String code;
        PermissionSet permissions = context.settings().defaultPermissionSet();
        if (invocation.hasInlineCode()) {
            code = invocation.code();
        } else {
            Optional<StoredCapability> stored = requireStore(capabilityId).findById(capabilityId);
            if (stored.isEmpty()) {
                return TaskOutcome.failure("Capability not found: " + capabilityId, 0);
            }
            code = stored.get().codeSnippet();
            if (stored.get().permissionSet() != null) {
                permissions = stored.get().permissionSet();
            }
        }

        Map<String, Object> sandboxContext = new LinkedHashMap<>(invocation.arguments());
        sandboxContext.put("capabilityId", capabilityId);
        sandboxContext.put("intent", invocation.intent());
        sandboxContext.put("deps", dependencies);

        SandboxRequest request = SandboxBudget.request(task, code, sandboxContext, context.settings(), permissions);
        log.debug("Executing capability {} for task {} with permissions {}",
                capabilityId, task.id(), request.permissionSet().wireName());

        SandboxResult result = codeExecutor.runSandbox(request);
        if (!result.success()) {
            return CodeExecutor.toOutcome(result);
        }
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("result", result.result());
        output.put("capabilityId", capabilityId);
        output.put("executionTimeMs", result.elapsedMs());
        return TaskOutcome.success(output, result.elapsedMs());
    }

    /**
     * Permission profile a capability currently runs with; {@link PermissionSet#MINIMAL}
     * when there is no store or the capability is unknown.
     */
    public PermissionSet getCapabilityPermissionSet(String capabilityId) {
        if (capabilityStore == null) {
            return PermissionSet.MINIMAL;
        }
        return capabilityStore.findById(capabilityId)
                .map(StoredCapability::permissionSet)
                .orElse(PermissionSet.MINIMAL);
    }

    private CapabilityStore requireStore(String capabilityId) {
        if (capabilityStore == null) {
            throw new ExecutorConfigurationException(
                    "Capability executor requires a CapabilityStore to look up capability " + capabilityId);
        }
        return capabilityStore;
    }
}
