package com.strata.core.convert;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.strata.core.model.ArgumentSource;

import java.util.Map;

/**
 * Node of a statically analysed code structure.
 *
 * @param id           node id, unique in the structure
 * @param type         node kind
 * @param tool         {@code server:action} for task nodes
 * @param arguments    argument resolution strategies for task nodes
 * @param capabilityId capability id for capability nodes
 * @param condition    condition expression for decision nodes
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StructureNode(
    String id,
    Type type,
    String tool,
    Map<String, ArgumentSource> arguments,
    String capabilityId,
    String condition
) {

    public enum Type {
        @JsonProperty("task") TASK,
        @JsonProperty("capability") CAPABILITY,
        @JsonProperty("decision") DECISION,
        @JsonProperty("fork") FORK,
        @JsonProperty("join") JOIN,
        @JsonEnumDefaultValue UNKNOWN
    }

    public StructureNode {
        arguments = arguments == null ? Map.of() : arguments;
    }

    public static StructureNode task(String id, String tool) {
        return new StructureNode(id, Type.TASK, tool, Map.of(), null, null);
    }

    public static StructureNode capability(String id, String capabilityId) {
        return new StructureNode(id, Type.CAPABILITY, null, Map.of(), capabilityId, null);
    }

    public static StructureNode decision(String id, String condition) {
        return new StructureNode(id, Type.DECISION, null, Map.of(), null, condition);
    }

    public static StructureNode fork(String id) {
        return new StructureNode(id, Type.FORK, null, Map.of(), null, null);
    }

    public static StructureNode join(String id) {
        return new StructureNode(id, Type.JOIN, null, Map.of(), null, null);
    }

    public boolean isExecutable() {
        return type == Type.TASK || type == Type.CAPABILITY;
    }
}
