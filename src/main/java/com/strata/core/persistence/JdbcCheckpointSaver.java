package com.strata.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-based {@link BaseCheckpointSaver} that keeps workflow checkpoints in the
 * {@code strata_checkpoints} table, one JSON row per {@code (thread_id, checkpoint_id)}.
 * The thread id is the workflow id.
 * <p>
 * Insertion order is kept in an identity column so that "latest" is well defined even
 * when two checkpoints share a timestamp. Writes use update-then-insert, which runs
 * unchanged on PostgreSQL and H2.
 */
public class JdbcCheckpointSaver implements BaseCheckpointSaver {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointSaver.class);

    private static final String TABLE_NAME = "strata_checkpoints";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                seq           BIGINT GENERATED BY DEFAULT AS IDENTITY,
                thread_id     VARCHAR(255) NOT NULL,
                checkpoint_id VARCHAR(255) NOT NULL,
                node_id       VARCHAR(255),
                next_node_id  VARCHAR(255),
                state         TEXT NOT NULL,
                created_at    TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                PRIMARY KEY (thread_id, checkpoint_id)
            )
            """.formatted(TABLE_NAME);

    private static final String UPDATE_SQL = """
            UPDATE %s SET node_id = ?, next_node_id = ?, state = ?
            WHERE thread_id = ? AND checkpoint_id = ?
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (thread_id, checkpoint_id, node_id, next_node_id, state)
            VALUES (?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_THREAD_SQL = """
            SELECT checkpoint_id, node_id, next_node_id, state
            FROM %s
            WHERE thread_id = ?
            ORDER BY seq ASC
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT checkpoint_id, node_id, next_node_id, state
            FROM %s
            WHERE thread_id = ? AND checkpoint_id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_LATEST_SQL = """
            SELECT checkpoint_id, node_id, next_node_id, state
            FROM %s
            WHERE thread_id = ?
            ORDER BY seq DESC
            LIMIT 1
            """.formatted(TABLE_NAME);

    private static final String SELECT_THREAD_BY_CHECKPOINT_SQL = """
            SELECT thread_id FROM %s WHERE checkpoint_id = ?
            """.formatted(TABLE_NAME);

    private static final String DELETE_BY_THREAD_SQL = """
            DELETE FROM %s WHERE thread_id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcCheckpointSaver(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Creates the checkpoint table if it does not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Checkpoint table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Collection<Checkpoint> list(RunnableConfig config) {
        String threadId = resolveThreadId(config);
        List<Checkpoint> checkpoints = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_THREAD_SQL)) {
            stmt.setString(1, threadId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    checkpoints.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new WorkflowStoreException("Failed to list checkpoints for workflow " + threadId, e);
        }
        return checkpoints;
    }

    @Override
    public Optional<Checkpoint> get(RunnableConfig config) {
        String threadId = resolveThreadId(config);
        Optional<String> checkpointId = config.checkPointId();
        String sql = checkpointId.isPresent() ? SELECT_BY_ID_SQL : SELECT_LATEST_SQL;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, threadId);
            if (checkpointId.isPresent()) {
                stmt.setString(2, checkpointId.get());
            }
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new WorkflowStoreException("Failed to get checkpoint " + checkpointId.orElse("latest")
                    + " for workflow " + threadId, e);
        }
        return Optional.empty();
    }

    @Override
    public RunnableConfig put(RunnableConfig config, Checkpoint checkpoint) throws Exception {
        String threadId = resolveThreadId(config);
        String state = serializeState(checkpoint.getState());

        try (Connection conn = dataSource.getConnection()) {
            int updated;
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL)) {
                stmt.setString(1, checkpoint.getNodeId());
                stmt.setString(2, checkpoint.getNextNodeId());
                stmt.setString(3, state);
                stmt.setString(4, threadId);
                stmt.setString(5, checkpoint.getId());
                updated = stmt.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
                    stmt.setString(1, threadId);
                    stmt.setString(2, checkpoint.getId());
                    stmt.setString(3, checkpoint.getNodeId());
                    stmt.setString(4, checkpoint.getNextNodeId());
                    stmt.setString(5, state);
                    stmt.executeUpdate();
                }
            }
            log.debug("Saved checkpoint '{}' for workflow '{}'", checkpoint.getId(), threadId);
        }

        return RunnableConfig.builder(config)
                .checkPointId(checkpoint.getId())
                .build();
    }

    @Override
    public Tag release(RunnableConfig config) throws Exception {
        String threadId = resolveThreadId(config);
        Collection<Checkpoint> released = list(config);

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_BY_THREAD_SQL)) {
            stmt.setString(1, threadId);
            int deleted = stmt.executeUpdate();
            log.debug("Released {} checkpoints for workflow '{}'", deleted, threadId);
        }
        return new Tag(threadId, released);
    }

    /**
     * Finds the workflow a checkpoint belongs to, for resuming by checkpoint id alone.
     */
    public Optional<String> findThreadIdByCheckpointId(String checkpointId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_THREAD_BY_CHECKPOINT_SQL)) {
            stmt.setString(1, checkpointId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString("thread_id")) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new WorkflowStoreException("Failed to look up checkpoint " + checkpointId, e);
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private String resolveThreadId(RunnableConfig config) {
        return config.threadId().orElse(THREAD_ID_DEFAULT);
    }

    private String serializeState(Map<String, Object> state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize checkpoint state", e);
        }
    }

    private Map<String, Object> deserializeState(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (IOException e) {
            throw new IllegalStateException("Failed to deserialize checkpoint state", e);
        }
    }

    private Checkpoint fromResultSet(ResultSet rs) throws SQLException {
        var builder = Checkpoint.builder()
                .id(rs.getString("checkpoint_id"))
                .state(deserializeState(rs.getString("state")));

        String nodeId = rs.getString("node_id");
        String nextNodeId = rs.getString("next_node_id");
        if (nodeId != null) {
            builder.nodeId(nodeId);
        }
        if (nextNodeId != null) {
            builder.nextNodeId(nextNodeId);
        }
        return builder.build();
    }
}
