package com.strata.core.routing;

import com.strata.core.model.TaskResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of resolving a task's dependencies: either every upstream result, or the first error.
 *
 * @param dependencies upstream results keyed by task id; empty on failure
 * @param error        why resolution failed; null on success
 */
public record DependencyResolution(Map<String, TaskResult> dependencies, String error) {

    public static DependencyResolution resolved(Map<String, TaskResult> dependencies) {
        return new DependencyResolution(Collections.unmodifiableMap(new LinkedHashMap<>(dependencies)), null);
    }

    public static DependencyResolution failed(String error) {
        return new DependencyResolution(Map.of(), error);
    }

    public boolean isResolved() {
        return error == null;
    }
}
