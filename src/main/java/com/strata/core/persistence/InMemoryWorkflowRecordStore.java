package com.strata.core.persistence;

import com.strata.core.model.DagStructure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link WorkflowRecordStore}, used when no DataSource is configured.
 * Records are lost on restart.
 */
public class InMemoryWorkflowRecordStore implements WorkflowRecordStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkflowRecordStore.class);

    private final Map<String, WorkflowRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public InMemoryWorkflowRecordStore(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    @Override
    public void save(String workflowId, DagStructure dag, String intent, Map<String, Object> context) {
        Instant now = clock.instant();
        records.compute(workflowId, (id, existing) -> new WorkflowRecord(id, dag, intent, context,
                existing != null ? existing.createdAt() : now, now.plus(ttl)));
    }

    @Override
    public Optional<DagStructure> get(String workflowId) {
        return getRecord(workflowId).map(WorkflowRecord::dag);
    }

    @Override
    public Optional<WorkflowRecord> getRecord(String workflowId) {
        WorkflowRecord record = records.get(workflowId);
        return record != null && isLive(record, clock.instant()) ? Optional.of(record) : Optional.empty();
    }

    @Override
    public void update(String workflowId, DagStructure dag) {
        replaceLive(workflowId, dag);
    }

    @Override
    public void extendExpiration(String workflowId) {
        replaceLive(workflowId, null);
    }

    @Override
    public boolean delete(String workflowId) {
        return records.remove(workflowId) != null;
    }

    @Override
    public int cleanupExpired() {
        Instant now = clock.instant();
        int before = records.size();
        records.values().removeIf(r -> !isLive(r, now));
        int deleted = before - records.size();
        if (deleted > 0) {
            log.info("Removed {} expired workflow record(s)", deleted);
        }
        return deleted;
    }

    private void replaceLive(String workflowId, DagStructure dag) {
        Instant now = clock.instant();
        WorkflowRecord updated = records.computeIfPresent(workflowId, (id, existing) -> isLive(existing, now)
                ? new WorkflowRecord(id, dag != null ? dag : existing.dag(), existing.intent(),
                        existing.context(), existing.createdAt(), now.plus(ttl))
                : existing);
        if (updated == null || !updated.expiresAt().isAfter(now)) {
            throw new WorkflowNotFoundException("Workflow " + workflowId + " not found");
        }
    }

    private static boolean isLive(WorkflowRecord record, Instant now) {
        return record.expiresAt().isAfter(now);
    }
}
