package com.strata.core.model;

import java.util.Map;

/**
 * Payload of an {@link TaskKind#MCP_TOOL} task: a call to {@code server:action} on an external tool server.
 *
 * @param tool            tool identifier in {@code server:action} form
 * @param arguments       explicit arguments, may contain {@code $OUTPUT[taskId]} references
 * @param staticArguments argument resolution strategies preserved from static analysis
 */
public record ToolInvocation(
    String tool,
    Map<String, Object> arguments,
    Map<String, ArgumentSource> staticArguments
) implements TaskPayload {

    public ToolInvocation {
        Payloads.requireText(tool, "Tool task requires a tool identifier");
        if (tool.indexOf(':') <= 0) {
            throw new InvalidDagException("Tool identifier must have the form server:action, got '" + tool + "'");
        }
        arguments = Payloads.copyOf(arguments);
        staticArguments = Payloads.copyOf(staticArguments);
    }

    public ToolInvocation(String tool, Map<String, Object> arguments) {
        this(tool, arguments, Map.of());
    }

    /** Server part of the identifier. */
    public String server() {
        return tool.substring(0, tool.indexOf(':'));
    }

    /** Everything after the first colon; may itself contain colons. */
    public String action() {
        return tool.substring(tool.indexOf(':') + 1);
    }

    @Override
    public TaskKind kind() {
        return TaskKind.MCP_TOOL;
    }

    @Override
    public String displayTool() {
        return tool;
    }

    @Override
    public ToolInvocation withArguments(Map<String, Object> arguments) {
        return new ToolInvocation(tool, arguments, staticArguments);
    }
}
