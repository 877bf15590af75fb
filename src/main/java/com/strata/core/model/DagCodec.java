package com.strata.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the DAG wire format:
 * <pre>
 * {"tasks": [{"id", "kind", "tool", "capabilityId", "code", "intent", "arguments",
 *             "dependsOn", "condition", "sideEffects", "staticArguments", "sandboxConfig"}]}
 * </pre>
 * The flat wire shape is mapped onto the typed {@link TaskPayload} variants; a task
 * without {@code kind} is a tool invocation.
 */
@Component
public class DagCodec {

    private final ObjectMapper objectMapper;

    public DagCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public DagCodec() {
        this(new ObjectMapper());
    }

    public DagStructure read(String json) {
        try {
            return toDag(objectMapper.readValue(json, DagJson.class));
        } catch (JsonProcessingException e) {
            throw new InvalidDagException("Malformed DAG JSON: " + e.getOriginalMessage(), e);
        }
    }

    public DagStructure read(Path path) {
        try {
            return read(Files.readString(path));
        } catch (IOException e) {
            throw new InvalidDagException("Cannot read DAG file " + path, e);
        }
    }

    public DagStructure fromTree(JsonNode node) {
        try {
            return toDag(objectMapper.treeToValue(node, DagJson.class));
        } catch (JsonProcessingException e) {
            throw new InvalidDagException("Malformed DAG JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Parses a list of tasks given in wire form, e.g. from an inject or replan command. */
    public List<Task> tasksFromWire(List<Map<String, Object>> wireTasks) {
        var tasks = new ArrayList<Task>();
        for (Map<String, Object> wire : wireTasks) {
            try {
                tasks.add(toTask(objectMapper.convertValue(wire, TaskJson.class)));
            } catch (IllegalArgumentException e) {
                throw new InvalidDagException("Malformed task: " + e.getMessage(), e);
            }
        }
        return tasks;
    }

    public JsonNode toTree(DagStructure dag) {
        return objectMapper.valueToTree(toJson(dag));
    }

    public String write(DagStructure dag) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(dag));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize DAG", e);
        }
    }

    // ── Mapping ─────────────────────────────────────────────────────────

    private DagStructure toDag(DagJson json) {
        if (json == null || json.tasks() == null) {
            throw new InvalidDagException("DAG JSON has no 'tasks' array");
        }
        return new DagStructure(json.tasks().stream().map(this::toTask).toList());
    }

    private Task toTask(TaskJson json) {
        TaskKind kind = TaskKind.fromWire(json.kind());
        TaskPayload payload = switch (kind) {
            case MCP_TOOL -> new ToolInvocation(json.tool(), json.arguments(), json.staticArguments());
            case CODE_EXECUTION -> new CodeBlock(json.code(), json.arguments());
            case CAPABILITY -> new CapabilityInvocation(json.capabilityId(), json.code(), json.intent(), json.arguments());
        };
        return new Task(json.id(), payload, json.dependsOn(),
                Boolean.TRUE.equals(json.sideEffects()), json.condition(), json.sandboxConfig());
    }

    private DagJson toJson(DagStructure dag) {
        return new DagJson(dag.tasks().stream().map(DagCodec::toJson).toList());
    }

    private static TaskJson toJson(Task task) {
        String tool = null;
        String capabilityId = null;
        String code = null;
        String intent = null;
        Map<String, ArgumentSource> staticArguments = null;
        if (task.payload() instanceof ToolInvocation invocation) {
            tool = invocation.tool();
            staticArguments = invocation.staticArguments().isEmpty() ? null : invocation.staticArguments();
        } else if (task.payload() instanceof CodeBlock block) {
            code = block.code();
        } else if (task.payload() instanceof CapabilityInvocation capability) {
            tool = capability.displayTool();
            capabilityId = capability.capabilityId();
            code = capability.code();
            intent = capability.intent();
        }
        return new TaskJson(task.id(), task.kind().wireName(), tool, capabilityId, code, intent,
                task.arguments(), task.dependsOn(), task.sideEffects() ? Boolean.TRUE : null,
                task.condition(), staticArguments, task.sandbox());
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    record DagJson(List<TaskJson> tasks) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    record TaskJson(
        String id,
        @JsonAlias("type") String kind,
        String tool,
        String capabilityId,
        String code,
        String intent,
        Map<String, Object> arguments,
        List<String> dependsOn,
        Boolean sideEffects,
        TaskCondition condition,
        Map<String, ArgumentSource> staticArguments,
        SandboxSettings sandboxConfig
    ) {}
}
