package com.strata.core.routing;

import com.strata.core.model.TaskResult;
import com.strata.core.model.TaskStatus;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the upstream results a task needs before it runs.
 * <p>
 * A dependency that never produced a result, or whose result is an error, fails resolution.
 * Safe failures ({@link TaskStatus#FAILED_SAFE}) are passed through with their status so the
 * dependent can branch on them.
 */
@Component
public class DependencyResolver {

    public DependencyResolution resolve(List<String> dependsOn, Map<String, TaskResult> priorResults) {
        Map<String, TaskResult> dependencies = new LinkedHashMap<>();
        for (String depId : dependsOn) {
            TaskResult result = priorResults.get(depId);
            if (result == null) {
                return DependencyResolution.failed("Dependency task " + depId + " not found in results");
            }
            if (result.status() == TaskStatus.ERROR) {
                return DependencyResolution.failed("Dependency task " + depId + " failed: " + result.error());
            }
            dependencies.put(depId, result);
        }
        return DependencyResolution.resolved(dependencies);
    }

    /**
     * Same as {@link #resolve} but raises instead of returning the failure.
     */
    public Map<String, TaskResult> resolveOrThrow(List<String> dependsOn, Map<String, TaskResult> priorResults) {
        DependencyResolution resolution = resolve(dependsOn, priorResults);
        if (!resolution.isResolved()) {
            throw new DependencyResolutionException(resolution.error());
        }
        return resolution.dependencies();
    }
}
