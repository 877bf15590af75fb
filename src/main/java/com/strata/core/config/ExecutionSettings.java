package com.strata.core.config;

import com.strata.sandbox.PermissionSet;

/**
 * Immutable snapshot of the settings the scheduler and executors read while running.
 * A new snapshot with a higher {@code version} replaces the old one through
 * {@link ExecutionSettingsHolder}; running layers keep the snapshot they started with.
 *
 * @param version              increases with every replacement
 * @param maxParallel          upper bound on concurrently running tasks in one layer
 * @param taskTimeoutMs        wall-clock budget for a single task
 * @param approvalMode         when layers pause for approval
 * @param maxReplans           replans allowed per workflow
 * @param codeTimeoutMs        default sandbox timeout for code and capability tasks
 * @param codeMemoryLimitMb    default sandbox memory budget
 * @param defaultPermissionSet permission profile used when a task names none
 */
public record ExecutionSettings(
    long version,
    int maxParallel,
    long taskTimeoutMs,
    ApprovalMode approvalMode,
    int maxReplans,
    long codeTimeoutMs,
    int codeMemoryLimitMb,
    PermissionSet defaultPermissionSet
) {

    public static final long DEFAULT_CODE_TIMEOUT_MS = 30_000;
    public static final int DEFAULT_CODE_MEMORY_MB = 512;

    public ExecutionSettings {
        if (maxParallel < 1) {
            throw new IllegalArgumentException("maxParallel must be >= 1, got " + maxParallel);
        }
        if (approvalMode == null) {
            approvalMode = ApprovalMode.NEVER;
        }
        if (defaultPermissionSet == null) {
            defaultPermissionSet = PermissionSet.MINIMAL;
        }
    }

    public static ExecutionSettings defaults() {
        return new ExecutionSettings(1, 8, 120_000, ApprovalMode.NEVER, 3,
                DEFAULT_CODE_TIMEOUT_MS, DEFAULT_CODE_MEMORY_MB, PermissionSet.MINIMAL);
    }

    public ExecutionSettings withApprovalMode(ApprovalMode mode) {
        return new ExecutionSettings(version, maxParallel, taskTimeoutMs, mode, maxReplans,
                codeTimeoutMs, codeMemoryLimitMb, defaultPermissionSet);
    }

    public ExecutionSettings withMaxParallel(int parallel) {
        return new ExecutionSettings(version, parallel, taskTimeoutMs, approvalMode, maxReplans,
                codeTimeoutMs, codeMemoryLimitMb, defaultPermissionSet);
    }

    ExecutionSettings withVersion(long newVersion) {
        return new ExecutionSettings(newVersion, maxParallel, taskTimeoutMs, approvalMode, maxReplans,
                codeTimeoutMs, codeMemoryLimitMb, defaultPermissionSet);
    }
}
