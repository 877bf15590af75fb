package com.strata.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opens one MCP sync client per configured server and registers it with the
 * {@link ToolClientRegistry} under the server's name.
 */
@Component
public class McpClientManager {

    private static final Logger log = LoggerFactory.getLogger(McpClientManager.class);

    private final McpProperties props;
    private final ToolClientRegistry registry;
    private final ObjectMapper objectMapper;

    private final Map<String, McpSyncClient> clients = new ConcurrentHashMap<>();

    public McpClientManager(McpProperties props, ToolClientRegistry registry, ObjectMapper objectMapper) {
        this.props = props;
        this.registry = registry;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    void init() {
        if (!props.isConfigured()) {
            log.info("MCP servers disabled or not configured");
            return;
        }
        for (var entry : props.getServers().entrySet()) {
            String name = entry.getKey();
            var config = entry.getValue();
            if (config.getUrl() == null || config.getUrl().isBlank()) continue;
            try {
                McpSyncClient client = connect(name, config);
                var tools = client.listTools();
                log.info("MCP server '{}' connected at {}, {} tool(s) available", name, config.getUrl(),
                        tools.tools() != null ? tools.tools().size() : 0);
                clients.put(name, client);
                registry.register(new McpToolClient(name, client, objectMapper));
            } catch (RuntimeException e) {
                log.warn("MCP server '{}' could not be connected: {}", name, e.getMessage());
            }
        }
    }

    private McpSyncClient connect(String name, McpProperties.ServerConfig config) {
        var transportBuilder = HttpClientStreamableHttpTransport.builder(config.getUrl());
        String token = config.getToken();
        if (token != null && !token.isBlank()) {
            transportBuilder.customizeRequest(req -> req.header("Authorization", "Bearer " + token));
        }
        var client = McpClient.sync(transportBuilder.build())
                .requestTimeout(config.getRequestTimeout())
                .build();
        client.initialize();
        log.debug("MCP client initialized for server '{}'", name);
        return client;
    }

    public boolean isConnected(String server) {
        return clients.containsKey(server);
    }

    @PreDestroy
    void shutdown() {
        clients.forEach((name, client) -> {
            try {
                client.closeGracefully();
                log.info("MCP client for '{}' closed", name);
            } catch (RuntimeException e) {
                log.warn("Error closing MCP client for '{}': {}", name, e.getMessage());
            }
            registry.unregister(name);
        });
        clients.clear();
    }
}
