package com.strata.core.persistence;

import com.strata.core.model.DagStructure;
import com.strata.core.state.WorkflowState;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of a workflow taken after a layer ran.
 *
 * @param checkpointId unique id, used by resume and rollback
 * @param workflowId   owning workflow
 * @param layer        index of the layer that had just run
 * @param state        workflow state after that layer
 * @param dag          the DAG as it stood, including any replanned or injected tasks
 * @param skipped      ids of tasks skipped so far
 * @param replans      number of replans applied so far
 * @param savedAt      when the snapshot was taken
 */
public record WorkflowCheckpoint(
    String checkpointId,
    String workflowId,
    int layer,
    WorkflowState state,
    DagStructure dag,
    List<String> skipped,
    int replans,
    Instant savedAt
) {

    public WorkflowCheckpoint {
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }
}
