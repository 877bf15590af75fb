package com.strata.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Execution kind of a task. Decides which executor runs it and whether it needs a sandbox.
 */
public enum TaskKind {
    @JsonProperty("code_execution")
    CODE_EXECUTION("code_execution"),
    @JsonProperty("capability")
    CAPABILITY("capability"),
    @JsonProperty("mcp_tool")
    MCP_TOOL("mcp_tool");

    private final String wireName;

    TaskKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Parses the wire name of a kind. A missing kind means a tool invocation.
     */
    public static TaskKind fromWire(String value) {
        if (value == null || value.isBlank()) {
            return MCP_TOOL;
        }
        for (TaskKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new InvalidDagException("Unknown task kind: " + value);
    }
}
