package com.strata.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * Per-task sandbox overrides. Null fields fall back to the configured defaults.
 *
 * @param timeoutMs     wall-clock budget for one execution
 * @param memoryLimitMb memory budget
 * @param permissionSet permission profile name, e.g. "minimal" or "network-api"
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SandboxSettings(Long timeoutMs, Integer memoryLimitMb, String permissionSet) implements Serializable {
}
