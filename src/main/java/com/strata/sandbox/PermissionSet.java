package com.strata.sandbox;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Permission profile granted to sandboxed code, from most to least restrictive.
 * Each profile maps to the Deno permission flags passed to the runtime.
 */
public enum PermissionSet {
    MINIMAL("minimal", List.of()),
    READONLY("readonly", List.of("--allow-read=./data,/tmp")),
    FILESYSTEM("filesystem", List.of("--allow-read", "--allow-write=/tmp")),
    NETWORK_API("network-api", List.of("--allow-net")),
    MCP_STANDARD("mcp-standard", List.of("--allow-read", "--allow-write=/tmp,./output", "--allow-net", "--allow-env=HOME,PATH")),
    TRUSTED("trusted", List.of("--allow-all"));

    private final String wireName;
    private final List<String> denoFlags;

    PermissionSet(String wireName, List<String> denoFlags) {
        this.wireName = wireName;
        this.denoFlags = denoFlags;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public List<String> denoFlags() {
        return denoFlags;
    }

    /**
     * Parses a profile name; {@code null} or blank means {@link #MINIMAL}.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static PermissionSet fromWire(String value) {
        if (value == null || value.isBlank()) {
            return MINIMAL;
        }
        for (PermissionSet set : values()) {
            if (set.wireName.equalsIgnoreCase(value) || set.name().equalsIgnoreCase(value)) {
                return set;
            }
        }
        throw new IllegalArgumentException("Unknown permission set: " + value);
    }
}
