package com.strata.sandbox;

import java.util.Map;

/**
 * One sandboxed execution.
 *
 * @param code          source to run; the value of its last {@code return} is the result
 * @param context       values exposed to the code as {@code context}, including {@code deps}
 * @param timeoutMs     wall-clock budget
 * @param memoryLimitMb memory budget
 * @param permissionSet permissions granted to the code
 */
public record SandboxRequest(
    String code,
    Map<String, Object> context,
    long timeoutMs,
    int memoryLimitMb,
    PermissionSet permissionSet
) {
}
