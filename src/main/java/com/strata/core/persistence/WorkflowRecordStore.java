package com.strata.core.persistence;

import com.strata.core.model.DagStructure;

import java.util.Map;
import java.util.Optional;

/**
 * Keyed, TTL-aware store of {@link WorkflowRecord}s.
 * <p>
 * Every write sets the expiry to now plus the configured time to live. Expired records are
 * invisible to reads and updates; {@link #cleanupExpired()} removes them physically.
 */
public interface WorkflowRecordStore {

    /**
     * Inserts or replaces the record; keeps the original creation time on replace.
     *
     * @param context initial workflow context, restored when the workflow restarts without a checkpoint
     */
    void save(String workflowId, DagStructure dag, String intent, Map<String, Object> context);

    default void save(String workflowId, DagStructure dag, String intent) {
        save(workflowId, dag, intent, Map.of());
    }

    Optional<DagStructure> get(String workflowId);

    Optional<WorkflowRecord> getRecord(String workflowId);

    /**
     * Replaces the DAG of a live record and extends its expiry.
     *
     * @throws WorkflowNotFoundException if there is no live record
     */
    void update(String workflowId, DagStructure dag);

    /**
     * @throws WorkflowNotFoundException if there is no live record
     */
    void extendExpiration(String workflowId);

    boolean delete(String workflowId);

    /** @return number of records removed */
    int cleanupExpired();
}
