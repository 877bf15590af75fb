package com.strata.core.execution;

import com.strata.core.config.ExecutionSettings;
import com.strata.core.model.SandboxSettings;
import com.strata.core.model.Task;
import com.strata.sandbox.PermissionSet;
import com.strata.sandbox.SandboxRequest;

import java.util.Map;

/**
 * Builds sandbox requests from per-task overrides and the current settings.
 */
final class SandboxBudget {

    private SandboxBudget() {}

    static SandboxRequest request(Task task, String code, Map<String, Object> context,
                                  ExecutionSettings settings, PermissionSet fallbackPermissions) {
        SandboxSettings overrides = task.sandbox();
        long timeoutMs = overrides != null && overrides.timeoutMs() != null
                ? overrides.timeoutMs()
                : settings.codeTimeoutMs();
        int memoryMb = overrides != null && overrides.memoryLimitMb() != null
                ? overrides.memoryLimitMb()
                : settings.codeMemoryLimitMb();
        PermissionSet permissions = overrides != null && overrides.permissionSet() != null
                ? PermissionSet.fromWire(overrides.permissionSet())
                : fallbackPermissions;
        return new SandboxRequest(code, context, timeoutMs, memoryMb, permissions);
    }
}
