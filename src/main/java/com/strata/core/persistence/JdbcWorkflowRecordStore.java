package com.strata.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.core.model.DagCodec;
import com.strata.core.model.DagStructure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link WorkflowRecordStore} on the {@code workflow_records} table.
 */
public class JdbcWorkflowRecordStore implements WorkflowRecordStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkflowRecordStore.class);

    private static final String TABLE_NAME = "workflow_records";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                workflow_id VARCHAR(255) NOT NULL PRIMARY KEY,
                dag         TEXT NOT NULL,
                intent      TEXT,
                context     TEXT,
                created_at  TIMESTAMP NOT NULL,
                expires_at  TIMESTAMP NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String ADD_CONTEXT_COLUMN_SQL = """
            ALTER TABLE %s ADD COLUMN IF NOT EXISTS context TEXT
            """.formatted(TABLE_NAME);

    private static final String REPLACE_SQL = """
            UPDATE %s SET dag = ?, intent = ?, context = ?, expires_at = ?
            WHERE workflow_id = ?
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (workflow_id, dag, intent, context, created_at, expires_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_LIVE_SQL = """
            SELECT workflow_id, dag, intent, context, created_at, expires_at
            FROM %s
            WHERE workflow_id = ? AND expires_at > ?
            """.formatted(TABLE_NAME);

    private static final String UPDATE_DAG_SQL = """
            UPDATE %s SET dag = ?, expires_at = ?
            WHERE workflow_id = ? AND expires_at > ?
            """.formatted(TABLE_NAME);

    private static final String EXTEND_SQL = """
            UPDATE %s SET expires_at = ?
            WHERE workflow_id = ? AND expires_at > ?
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE workflow_id = ?
            """.formatted(TABLE_NAME);

    private static final String DELETE_EXPIRED_SQL = """
            DELETE FROM %s WHERE expires_at <= ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final DagCodec dagCodec;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration ttl;

    public JdbcWorkflowRecordStore(DataSource dataSource, DagCodec dagCodec, ObjectMapper objectMapper,
                                   Clock clock, Duration ttl) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.dagCodec = dagCodec;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.ttl = ttl;
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
                stmt.execute();
            }
            // tables created before the context column existed
            try (PreparedStatement stmt = conn.prepareStatement(ADD_CONTEXT_COLUMN_SQL)) {
                stmt.execute();
            }
            log.info("Workflow record table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void save(String workflowId, DagStructure dag, String intent, Map<String, Object> context) {
        Instant now = clock.instant();
        String dagJson = dagCodec.write(dag);
        String contextJson = writeContext(workflowId, context);
        try (Connection conn = dataSource.getConnection()) {
            int updated;
            try (PreparedStatement stmt = conn.prepareStatement(REPLACE_SQL)) {
                stmt.setString(1, dagJson);
                stmt.setString(2, intent);
                stmt.setString(3, contextJson);
                stmt.setTimestamp(4, Timestamp.from(now.plus(ttl)));
                stmt.setString(5, workflowId);
                updated = stmt.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
                    stmt.setString(1, workflowId);
                    stmt.setString(2, dagJson);
                    stmt.setString(3, intent);
                    stmt.setString(4, contextJson);
                    stmt.setTimestamp(5, Timestamp.from(now));
                    stmt.setTimestamp(6, Timestamp.from(now.plus(ttl)));
                    stmt.executeUpdate();
                }
            }
            log.debug("Saved workflow record {}", workflowId);
        } catch (SQLException e) {
            throw new WorkflowStoreException("Failed to save workflow " + workflowId, e);
        }
    }

    @Override
    public Optional<DagStructure> get(String workflowId) {
        return getRecord(workflowId).map(WorkflowRecord::dag);
    }

    @Override
    public Optional<WorkflowRecord> getRecord(String workflowId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_LIVE_SQL)) {
            stmt.setString(1, workflowId);
            stmt.setTimestamp(2, Timestamp.from(clock.instant()));
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new WorkflowRecord(
                        rs.getString("workflow_id"),
                        dagCodec.read(rs.getString("dag")),
                        rs.getString("intent"),
                        readContext(workflowId, rs.getString("context")),
                        rs.getTimestamp("created_at").toInstant(),
                        rs.getTimestamp("expires_at").toInstant()));
            }
        } catch (SQLException e) {
            throw new WorkflowStoreException("Failed to read workflow " + workflowId, e);
        }
    }

    @Override
    public void update(String workflowId, DagStructure dag) {
        Instant now = clock.instant();
        int updated = executeUpdate(UPDATE_DAG_SQL, workflowId, stmt -> {
            stmt.setString(1, dagCodec.write(dag));
            stmt.setTimestamp(2, Timestamp.from(now.plus(ttl)));
            stmt.setString(3, workflowId);
            stmt.setTimestamp(4, Timestamp.from(now));
        });
        if (updated == 0) {
            throw new WorkflowNotFoundException("Workflow " + workflowId + " not found");
        }
    }

    @Override
    public void extendExpiration(String workflowId) {
        Instant now = clock.instant();
        int updated = executeUpdate(EXTEND_SQL, workflowId, stmt -> {
            stmt.setTimestamp(1, Timestamp.from(now.plus(ttl)));
            stmt.setString(2, workflowId);
            stmt.setTimestamp(3, Timestamp.from(now));
        });
        if (updated == 0) {
            throw new WorkflowNotFoundException("Workflow " + workflowId + " not found");
        }
    }

    @Override
    public boolean delete(String workflowId) {
        return executeUpdate(DELETE_SQL, workflowId, stmt -> stmt.setString(1, workflowId)) > 0;
    }

    @Override
    public int cleanupExpired() {
        Instant now = clock.instant();
        int deleted = executeUpdate(DELETE_EXPIRED_SQL, "expired records",
                stmt -> stmt.setTimestamp(1, Timestamp.from(now)));
        if (deleted > 0) {
            log.info("Removed {} expired workflow record(s)", deleted);
        }
        return deleted;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private String writeContext(String workflowId, Map<String, Object> context) {
        try {
            return objectMapper.writeValueAsString(context == null ? Map.of() : context);
        } catch (JsonProcessingException e) {
            throw new WorkflowStoreException("Failed to serialize context of workflow " + workflowId, e);
        }
    }

    private Map<String, Object> readContext(String workflowId, String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new WorkflowStoreException("Failed to deserialize context of workflow " + workflowId, e);
        }
    }

    @FunctionalInterface
    private interface StatementBinder {
        void bind(PreparedStatement stmt) throws SQLException;
    }

    private int executeUpdate(String sql, String subject, StatementBinder binder) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            binder.bind(stmt);
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new WorkflowStoreException("Record store update failed for " + subject, e);
        }
    }
}
