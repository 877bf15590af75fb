package com.strata.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Removes expired workflow records every {@code strata.records.cleanup-interval}.
 */
@Component
public class RecordCleanupJob {

    private static final Logger log = LoggerFactory.getLogger(RecordCleanupJob.class);

    private final WorkflowEngine engine;

    public RecordCleanupJob(WorkflowEngine engine) {
        this.engine = engine;
    }

    @Scheduled(fixedDelayString = "${strata.records.cleanup-interval:PT10M}",
               initialDelayString = "${strata.records.cleanup-interval:PT10M}")
    public void cleanup() {
        int removed = engine.cleanupExpired();
        log.debug("Scheduled cleanup removed {} expired workflow record(s)", removed);
    }
}
