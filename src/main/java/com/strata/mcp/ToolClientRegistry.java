package com.strata.mcp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Server name to {@link ToolClient} mapping. Clients declared as beans are registered on
 * construction; remote clients are added as their connections come up.
 */
@Component
public class ToolClientRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolClientRegistry.class);

    private final Map<String, ToolClient> clients = new ConcurrentHashMap<>();

    @Autowired
    public ToolClientRegistry(List<ToolClient> builtIn) {
        builtIn.forEach(this::register);
    }

    public ToolClientRegistry() {
        this(List.of());
    }

    public void register(ToolClient client) {
        ToolClient previous = clients.put(client.server(), client);
        if (previous != null && previous != client) {
            log.warn("Tool client for server '{}' replaced", client.server());
        } else {
            log.debug("Tool client registered for server '{}'", client.server());
        }
    }

    public void unregister(String server) {
        clients.remove(server);
    }

    public Optional<ToolClient> find(String server) {
        return Optional.ofNullable(clients.get(server));
    }

    public Set<String> servers() {
        return new TreeSet<>(clients.keySet());
    }
}
