package com.strata.core.config;

import com.strata.sandbox.PermissionSet;
import com.strata.sandbox.SandboxProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Owns the current {@link ExecutionSettings}. Components ask for {@link #current()} when they
 * start a unit of work; operators swap the settings explicitly with {@link #replace}
 * or {@link #reload}.
 */
@Component
public class ExecutionSettingsHolder {

    private static final Logger log = LoggerFactory.getLogger(ExecutionSettingsHolder.class);

    private final StrataProperties properties;
    private final SandboxProperties sandboxProperties;
    private final AtomicReference<ExecutionSettings> current = new AtomicReference<>();

    @Autowired
    public ExecutionSettingsHolder(StrataProperties properties, SandboxProperties sandboxProperties) {
        this.properties = properties;
        this.sandboxProperties = sandboxProperties;
        current.set(fromProperties(1));
    }

    /** Fixed settings, no backing properties. */
    public ExecutionSettingsHolder(ExecutionSettings initial) {
        this.properties = null;
        this.sandboxProperties = null;
        current.set(initial);
    }

    public ExecutionSettings current() {
        return current.get();
    }

    /**
     * Applies {@code change} to the current settings and installs the result with the next version.
     *
     * @return the installed settings
     */
    public ExecutionSettings replace(UnaryOperator<ExecutionSettings> change) {
        ExecutionSettings updated = current.updateAndGet(
                old -> change.apply(old).withVersion(old.version() + 1));
        log.info("Execution settings replaced, now version {}", updated.version());
        return updated;
    }

    /**
     * Rebuilds the settings from the bound properties.
     */
    public ExecutionSettings reload() {
        if (properties == null) {
            return current();
        }
        return replace(old -> fromProperties(old.version()));
    }

    private ExecutionSettings fromProperties(long version) {
        var scheduler = properties.getScheduler();
        return new ExecutionSettings(
                version,
                scheduler.getMaxParallel(),
                scheduler.getTaskTimeoutMs(),
                scheduler.getApprovalMode(),
                scheduler.getMaxReplans(),
                sandboxProperties.getTimeoutMs(),
                sandboxProperties.getMemoryLimitMb(),
                PermissionSet.fromWire(sandboxProperties.getDefaultPermissionSet()));
    }
}
