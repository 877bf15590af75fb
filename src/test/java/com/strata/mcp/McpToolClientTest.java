package com.strata.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class McpToolClientTest {

    private McpSyncClient sync;
    private McpToolClient client;

    @BeforeEach
    void setUp() {
        sync = mock(McpSyncClient.class);
        client = new McpToolClient("fs", sync, new ObjectMapper());
    }

    private void respond(Boolean isError, String... texts) {
        var result = mock(McpSchema.CallToolResult.class);
        List<McpSchema.Content> content = Arrays.stream(texts)
                .<McpSchema.Content>map(McpSchema.TextContent::new)
                .toList();
        when(result.content()).thenReturn(content);
        when(result.isError()).thenReturn(isError);
        when(sync.callTool(any(McpSchema.CallToolRequest.class))).thenReturn(result);
    }

    @Test
    @DisplayName("JSON text content is returned parsed")
    void parsesJson() {
        respond(false, "{\"files\": [\"a\", \"b\"]}");

        Object output = client.call("list", Map.of("path", "/"));

        assertEquals(Map.of("files", List.of("a", "b")), output);
    }

    @Test
    @DisplayName("plain text content is returned as is")
    void returnsText() {
        respond(null, "hello", "world");

        assertEquals("hello\nworld", client.call("read", Map.of()));
    }

    @Test
    @DisplayName("an error result raises with the server's message")
    void errorResult() {
        respond(true, "ENOENT");

        var e = assertThrows(ToolCallException.class, () -> client.call("read", Map.of()));
        assertEquals("ENOENT", e.getMessage());
    }

    @Test
    @DisplayName("transport failures are wrapped")
    void transportFailure() {
        when(sync.callTool(any(McpSchema.CallToolRequest.class))).thenThrow(new IllegalStateException("closed"));

        var e = assertThrows(ToolCallException.class, () -> client.call("read", Map.of()));
        assertTrue(e.getMessage().contains("fs:read"));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }
}
