package com.strata.core.model;

import java.util.Map;

/**
 * Payload of a {@link TaskKind#CODE_EXECUTION} task.
 *
 * @param code      source executed by the sandbox
 * @param arguments values exposed to the code alongside its dependencies
 */
public record CodeBlock(String code, Map<String, Object> arguments) implements TaskPayload {

    public CodeBlock {
        Payloads.requireText(code, "Code task requires code");
        arguments = Payloads.copyOf(arguments);
    }

    @Override
    public TaskKind kind() {
        return TaskKind.CODE_EXECUTION;
    }

    @Override
    public String displayTool() {
        return "code:execute";
    }

    @Override
    public CodeBlock withArguments(Map<String, Object> arguments) {
        return new CodeBlock(code, arguments);
    }
}
