package com.strata.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Sandbox configuration bound from {@code strata.sandbox.*}.
 */
@Component
@ConfigurationProperties(prefix = "strata.sandbox")
public class SandboxProperties {

    private String provider = "docker";
    private String image = "denoland/deno:2.1.4";
    private long timeoutMs = 30_000;
    private int memoryLimitMb = 512;
    private int cpuCount = 1;
    private String defaultPermissionSet = "minimal";

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public String getImage() { return image; }
    public void setImage(String image) { this.image = image; }
    public long getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
    public int getMemoryLimitMb() { return memoryLimitMb; }
    public void setMemoryLimitMb(int memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }
    public int getCpuCount() { return cpuCount; }
    public void setCpuCount(int cpuCount) { this.cpuCount = cpuCount; }
    public String getDefaultPermissionSet() { return defaultPermissionSet; }
    public void setDefaultPermissionSet(String defaultPermissionSet) { this.defaultPermissionSet = defaultPermissionSet; }
}
