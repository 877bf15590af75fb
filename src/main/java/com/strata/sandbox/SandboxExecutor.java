package com.strata.sandbox;

import com.strata.core.config.ExecutionSettings;

import java.util.Map;

/**
 * Runs untrusted code in isolation. Implementations report failures through
 * {@link SandboxResult#error()} rather than by throwing.
 */
public interface SandboxExecutor {

    SandboxResult execute(SandboxRequest request);

    /**
     * Runs {@code code} with the default budget and the most restrictive permissions.
     */
    default SandboxResult execute(String code, Map<String, Object> context) {
        return execute(new SandboxRequest(code, context,
                ExecutionSettings.DEFAULT_CODE_TIMEOUT_MS, ExecutionSettings.DEFAULT_CODE_MEMORY_MB,
                PermissionSet.MINIMAL));
    }
}
