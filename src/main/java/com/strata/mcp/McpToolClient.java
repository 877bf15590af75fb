package com.strata.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link ToolClient} backed by an MCP server connection. Text content of the tool result is
 * returned as parsed JSON when it is a JSON document, otherwise as plain text.
 */
public class McpToolClient implements ToolClient {

    private final String server;
    private final McpSyncClient client;
    private final ObjectMapper objectMapper;

    public McpToolClient(String server, McpSyncClient client, ObjectMapper objectMapper) {
        this.server = server;
        this.client = client;
        this.objectMapper = objectMapper;
    }

    @Override
    public String server() {
        return server;
    }

    @Override
    public Object call(String action, Map<String, Object> arguments) {
        McpSchema.CallToolResult result;
        try {
            result = client.callTool(new McpSchema.CallToolRequest(action, arguments));
        } catch (RuntimeException e) {
            throw new ToolCallException("Tool " + server + ":" + action + " failed: " + e.getMessage(), e);
        }
        String text = textOf(result.content());
        if (Boolean.TRUE.equals(result.isError())) {
            throw new ToolCallException(text.isBlank() ? "Tool " + server + ":" + action + " reported an error" : text);
        }
        return parseIfJson(text);
    }

    private static String textOf(List<McpSchema.Content> content) {
        if (content == null) {
            return "";
        }
        return content.stream()
                .filter(McpSchema.TextContent.class::isInstance)
                .map(c -> ((McpSchema.TextContent) c).text())
                .collect(Collectors.joining("\n"));
    }

    private Object parseIfJson(String text) {
        String trimmed = text.strip();
        if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
            try {
                return objectMapper.readValue(trimmed, Object.class);
            } catch (JsonProcessingException e) {
                return text;
            }
        }
        return text;
    }
}
