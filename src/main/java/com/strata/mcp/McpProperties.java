package com.strata.mcp;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Remote MCP tool servers, keyed by the server name used in {@code server:action} tool ids.
 *
 * <pre>
 * strata:
 *   mcp:
 *     enabled: true
 *     servers:
 *       fs:
 *         url: http://localhost:3001/mcp
 *         token: secret
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "strata.mcp")
public class McpProperties {

    private boolean enabled = false;
    private Map<String, ServerConfig> servers = new HashMap<>();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public Map<String, ServerConfig> getServers() { return servers; }
    public void setServers(Map<String, ServerConfig> servers) { this.servers = servers; }

    /**
     * Returns {@code true} when MCP is enabled and at least one server has a URL.
     */
    public boolean isConfigured() {
        return enabled && servers.values().stream()
                .anyMatch(s -> s.getUrl() != null && !s.getUrl().isBlank());
    }

    public static class ServerConfig {
        private String url = "";
        private String token = "";
        private Duration requestTimeout = Duration.ofSeconds(30);

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    }
}
