package com.strata.core.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.core.model.DagCodec;
import com.strata.core.model.DagStructure;
import com.strata.core.state.WorkflowState;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Saves and loads {@link WorkflowCheckpoint}s through a LangGraph4j {@link BaseCheckpointSaver}.
 * <p>
 * Each workflow is a checkpoint thread. The checkpoint state map holds the workflow state
 * and DAG as plain JSON-compatible values, so the same snapshot works with the in-memory
 * and the JDBC saver.
 */
@Service
public class WorkflowCheckpointer {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCheckpointer.class);

    private static final String KEY_WORKFLOW_ID = "workflowId";
    private static final String KEY_LAYER = "layer";
    private static final String KEY_STATE = "state";
    private static final String KEY_DAG = "dag";
    private static final String KEY_SKIPPED = "skipped";
    private static final String KEY_REPLANS = "replans";
    private static final String KEY_SAVED_AT = "savedAt";

    private final BaseCheckpointSaver saver;
    private final ObjectMapper objectMapper;
    private final DagCodec dagCodec;

    /** checkpointId → workflowId for checkpoints written by this process. */
    private final Map<String, String> owners = new ConcurrentHashMap<>();

    public WorkflowCheckpointer(BaseCheckpointSaver saver, ObjectMapper objectMapper, DagCodec dagCodec) {
        this.saver = saver;
        this.objectMapper = objectMapper;
        this.dagCodec = dagCodec;
    }

    public WorkflowCheckpoint save(String workflowId, int layer, WorkflowState state, DagStructure dag,
                                   Collection<String> skipped, int replans) {
        String checkpointId = UUID.randomUUID().toString();
        Instant savedAt = Instant.now();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put(KEY_WORKFLOW_ID, workflowId);
        data.put(KEY_LAYER, layer);
        data.put(KEY_STATE, objectMapper.convertValue(state, new TypeReference<Map<String, Object>>() {}));
        data.put(KEY_DAG, objectMapper.convertValue(dagCodec.toTree(dag), new TypeReference<Map<String, Object>>() {}));
        data.put(KEY_SKIPPED, new ArrayList<>(skipped));
        data.put(KEY_REPLANS, replans);
        data.put(KEY_SAVED_AT, savedAt.toEpochMilli());

        Checkpoint checkpoint = Checkpoint.builder()
                .id(checkpointId)
                .state(data)
                .nodeId("layer-" + layer)
                .nextNodeId("layer-" + (layer + 1))
                .build();
        try {
            saver.put(threadConfig(workflowId), checkpoint);
        } catch (Exception e) {
            throw new WorkflowStoreException("Failed to save checkpoint for workflow " + workflowId, e);
        }
        owners.put(checkpointId, workflowId);
        log.debug("Checkpoint {} saved for workflow {} at layer {}", checkpointId, workflowId, layer);
        return new WorkflowCheckpoint(checkpointId, workflowId, layer, state, dag, List.copyOf(skipped), replans, savedAt);
    }

    /**
     * Loads a checkpoint by id alone.
     *
     * @throws CheckpointNotFoundException if no stored checkpoint has this id
     */
    public WorkflowCheckpoint load(String checkpointId) {
        String workflowId = owners.get(checkpointId);
        if (workflowId == null && saver instanceof JdbcCheckpointSaver jdbc) {
            workflowId = jdbc.findThreadIdByCheckpointId(checkpointId).orElse(null);
        }
        if (workflowId == null) {
            throw new CheckpointNotFoundException("Checkpoint not found: " + checkpointId);
        }
        return load(workflowId, checkpointId);
    }

    public WorkflowCheckpoint load(String workflowId, String checkpointId) {
        var config = RunnableConfig.builder().threadId(workflowId).checkPointId(checkpointId).build();
        return saver.get(config)
                .filter(cp -> checkpointId.equals(cp.getId()))
                .map(this::fromCheckpoint)
                .orElseThrow(() -> new CheckpointNotFoundException(
                        "Checkpoint not found: " + checkpointId + " (workflow " + workflowId + ")"));
    }

    public Optional<WorkflowCheckpoint> latest(String workflowId) {
        return saver.get(threadConfig(workflowId)).map(this::fromCheckpoint);
    }

    /**
     * All checkpoints of a workflow, oldest first.
     */
    public List<WorkflowCheckpoint> history(String workflowId) {
        return saver.list(threadConfig(workflowId)).stream()
                .map(this::fromCheckpoint)
                .sorted(Comparator.comparing(WorkflowCheckpoint::savedAt)
                        .thenComparingInt(WorkflowCheckpoint::layer))
                .toList();
    }

    public void release(String workflowId) {
        try {
            saver.release(threadConfig(workflowId));
        } catch (Exception e) {
            throw new WorkflowStoreException("Failed to release checkpoints for workflow " + workflowId, e);
        }
        owners.values().removeIf(workflowId::equals);
        log.debug("Released checkpoints for workflow {}", workflowId);
    }

    // ── Mapping ─────────────────────────────────────────────────────────

    private WorkflowCheckpoint fromCheckpoint(Checkpoint checkpoint) {
        Map<String, Object> data = checkpoint.getState();
        WorkflowState state = objectMapper.convertValue(data.get(KEY_STATE), WorkflowState.class);
        DagStructure dag = dagCodec.fromTree(objectMapper.valueToTree(data.get(KEY_DAG)));
        List<String> skipped = objectMapper.convertValue(data.get(KEY_SKIPPED), new TypeReference<List<String>>() {});
        String workflowId = (String) data.get(KEY_WORKFLOW_ID);
        owners.putIfAbsent(checkpoint.getId(), workflowId);
        return new WorkflowCheckpoint(
                checkpoint.getId(),
                workflowId,
                ((Number) data.get(KEY_LAYER)).intValue(),
                state,
                dag,
                skipped,
                ((Number) data.get(KEY_REPLANS)).intValue(),
                Instant.ofEpochMilli(((Number) data.get(KEY_SAVED_AT)).longValue()));
    }

    private static RunnableConfig threadConfig(String workflowId) {
        return RunnableConfig.builder().threadId(workflowId).build();
    }
}
