package com.strata.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * A node of the workflow graph. Immutable; edits such as argument changes produce a new instance.
 *
 * @param id          unique id within its {@link DagStructure}
 * @param payload     kind-specific fields; decides the {@link TaskKind}
 * @param dependsOn   ids of tasks that must settle before this one runs
 * @param sideEffects whether the task changes the outside world
 * @param condition   optional gate on an upstream decision outcome
 * @param sandbox     optional sandbox overrides for code and capability tasks
 */
public record Task(
    String id,
    TaskPayload payload,
    List<String> dependsOn,
    boolean sideEffects,
    TaskCondition condition,
    SandboxSettings sandbox
) implements Serializable {

    public Task {
        Payloads.requireText(id, "Task id must be non-empty");
        if (payload == null) {
            throw new InvalidDagException("Task " + id + " has no payload");
        }
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public static Task tool(String id, String tool, Map<String, Object> arguments, List<String> dependsOn) {
        return new Task(id, new ToolInvocation(tool, arguments), dependsOn, false, null, null);
    }

    public static Task code(String id, String code, List<String> dependsOn, boolean sideEffects) {
        return new Task(id, new CodeBlock(code, Map.of()), dependsOn, sideEffects, null, null);
    }

    public static Task capability(String id, String capabilityId, Map<String, Object> arguments, List<String> dependsOn) {
        return new Task(id, new CapabilityInvocation(capabilityId, null, null, arguments), dependsOn, false, null, null);
    }

    public TaskKind kind() {
        return payload.kind();
    }

    public Map<String, Object> arguments() {
        return payload.arguments();
    }

    public String displayTool() {
        return payload.displayTool();
    }

    public Task withArguments(Map<String, Object> arguments) {
        return new Task(id, payload.withArguments(arguments), dependsOn, sideEffects, condition, sandbox);
    }

    public Task withDependsOn(List<String> dependsOn) {
        return new Task(id, payload, dependsOn, sideEffects, condition, sandbox);
    }

    public Task withCondition(TaskCondition condition) {
        return new Task(id, payload, dependsOn, sideEffects, condition, sandbox);
    }
}
