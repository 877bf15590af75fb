package com.strata.core.persistence;

import com.strata.core.model.DagStructure;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Durable record of a workflow: the DAG it runs and what it was started for.
 *
 * @param workflowId primary key
 * @param dag        current DAG, replaced after a replan or injection
 * @param intent     free-text description given at start (nullable)
 * @param context    initial workflow context, including the approval mode and run parameters
 * @param createdAt  first save
 * @param expiresAt  reads ignore the record from this instant on
 */
public record WorkflowRecord(
    String workflowId,
    DagStructure dag,
    String intent,
    Map<String, Object> context,
    Instant createdAt,
    Instant expiresAt
) {

    public WorkflowRecord {
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }
}
