package com.strata.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Engine configuration bound from {@code strata.*}.
 *
 * <pre>
 * strata:
 *   scheduler:
 *     max-parallel: 8
 *     task-timeout-ms: 120000
 *     approval-mode: never
 *     max-replans: 3
 *   records:
 *     ttl: 1h
 *     cleanup-interval: 10m
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "strata")
public class StrataProperties {

    private Scheduler scheduler = new Scheduler();
    private Records records = new Records();

    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }
    public Records getRecords() { return records; }
    public void setRecords(Records records) { this.records = records; }

    public static class Scheduler {
        private int maxParallel = 8;
        private long taskTimeoutMs = 120_000;
        private ApprovalMode approvalMode = ApprovalMode.NEVER;
        private int maxReplans = 3;

        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
        public long getTaskTimeoutMs() { return taskTimeoutMs; }
        public void setTaskTimeoutMs(long taskTimeoutMs) { this.taskTimeoutMs = taskTimeoutMs; }
        public ApprovalMode getApprovalMode() { return approvalMode; }
        public void setApprovalMode(ApprovalMode approvalMode) { this.approvalMode = approvalMode; }
        public int getMaxReplans() { return maxReplans; }
        public void setMaxReplans(int maxReplans) { this.maxReplans = maxReplans; }
    }

    public static class Records {
        private Duration ttl = Duration.ofHours(1);
        private Duration cleanupInterval = Duration.ofMinutes(10);

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }
        public Duration getCleanupInterval() { return cleanupInterval; }
        public void setCleanupInterval(Duration cleanupInterval) { this.cleanupInterval = cleanupInterval; }
    }
}
