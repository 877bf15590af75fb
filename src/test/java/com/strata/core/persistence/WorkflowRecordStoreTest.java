package com.strata.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.core.model.DagCodec;
import com.strata.core.model.DagStructure;
import com.strata.core.model.Task;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the same contract against the JDBC store on H2 and the in-memory store.
 */
class WorkflowRecordStoreTest {

    private static final Duration TTL = Duration.ofHours(1);

    private static final DagStructure LINEAR = DagStructure.of(
            Task.tool("a", "fs:read", Map.of("path", "/tmp/in"), List.of()),
            Task.tool("b", "fs:write", Map.of("content", "$OUTPUT[a]"), List.of("a")));

    private static final DagStructure SINGLE = DagStructure.of(
            Task.code("c", "return 1;", List.of(), false));

    abstract static class Contract {

        MutableClock clock;
        WorkflowRecordStore store;

        abstract WorkflowRecordStore createStore(MutableClock clock) throws SQLException;

        @BeforeEach
        void setUp() throws SQLException {
            clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
            store = createStore(clock);
        }

        @Test
        @DisplayName("a saved record reads back with its DAG, intent and expiry")
        void roundTrip() {
            store.save("wf-1", LINEAR, "copy a file");

            WorkflowRecord record = store.getRecord("wf-1").orElseThrow();
            assertEquals(LINEAR, record.dag());
            assertEquals("copy a file", record.intent());
            assertEquals(clock.instant(), record.createdAt());
            assertEquals(clock.instant().plus(TTL), record.expiresAt());
            assertEquals(LINEAR, store.get("wf-1").orElseThrow());
        }

        @Test
        @DisplayName("the initial context reads back with nested run parameters")
        void contextRoundTrip() {
            Map<String, Object> context = Map.of(
                    "approvalMode", "ALWAYS",
                    "intent", "copy a file",
                    "parameters", Map.of("input", "/tmp/in", "limits", List.of(1, 2)));

            store.save("wf-1", LINEAR, "copy a file", context);

            assertEquals(context, store.getRecord("wf-1").orElseThrow().context());
        }

        @Test
        @DisplayName("updating the DAG and extending the expiry keep the context")
        void contextSurvivesUpdates() {
            store.save("wf-1", LINEAR, null, Map.of("approvalMode", "ON_FAILURE"));

            store.update("wf-1", SINGLE);
            store.extendExpiration("wf-1");

            WorkflowRecord record = store.getRecord("wf-1").orElseThrow();
            assertEquals(SINGLE, record.dag());
            assertEquals(Map.of("approvalMode", "ON_FAILURE"), record.context());
        }

        @Test
        @DisplayName("a record saved without context reads back with an empty one")
        void emptyContext() {
            store.save("wf-1", LINEAR, "no context");

            assertTrue(store.getRecord("wf-1").orElseThrow().context().isEmpty());
        }

        @Test
        @DisplayName("an unknown workflow reads as empty")
        void unknown() {
            assertTrue(store.get("nope").isEmpty());
            assertFalse(store.delete("nope"));
        }

        @Test
        @DisplayName("saving again replaces the DAG but keeps the creation time")
        void replace() {
            store.save("wf-1", LINEAR, "first");
            Instant created = clock.instant();
            clock.advance(Duration.ofMinutes(5));

            store.save("wf-1", SINGLE, "second");

            WorkflowRecord record = store.getRecord("wf-1").orElseThrow();
            assertEquals(SINGLE, record.dag());
            assertEquals("second", record.intent());
            assertEquals(created, record.createdAt());
            assertEquals(clock.instant().plus(TTL), record.expiresAt());
        }

        @Test
        @DisplayName("an expired record is invisible until extended in time")
        void expiry() {
            store.save("wf-1", LINEAR, null);
            clock.advance(TTL);

            assertTrue(store.get("wf-1").isEmpty());
            assertThrows(WorkflowNotFoundException.class, () -> store.extendExpiration("wf-1"));
            assertThrows(WorkflowNotFoundException.class, () -> store.update("wf-1", SINGLE));
        }

        @Test
        @DisplayName("extendExpiration pushes the expiry to now + ttl")
        void extend() {
            store.save("wf-1", LINEAR, null);
            clock.advance(Duration.ofMinutes(50));

            store.extendExpiration("wf-1");
            clock.advance(Duration.ofMinutes(50));

            WorkflowRecord record = store.getRecord("wf-1").orElseThrow();
            assertEquals(LINEAR, record.dag());
            assertNull(record.intent());
        }

        @Test
        @DisplayName("update replaces the DAG of a live record")
        void update() {
            store.save("wf-1", LINEAR, "x");

            store.update("wf-1", SINGLE);

            assertEquals(SINGLE, store.get("wf-1").orElseThrow());
            assertThrows(WorkflowNotFoundException.class, () -> store.update("missing", SINGLE));
        }

        @Test
        @DisplayName("cleanupExpired removes only expired records")
        void cleanup() {
            store.save("old", LINEAR, null);
            clock.advance(Duration.ofMinutes(40));
            store.save("young", SINGLE, null);
            clock.advance(Duration.ofMinutes(30));

            assertEquals(1, store.cleanupExpired());
            assertEquals(0, store.cleanupExpired());
            assertTrue(store.get("young").isPresent());
            assertFalse(store.delete("old"));
        }

        @Test
        @DisplayName("delete removes a record")
        void delete() {
            store.save("wf-1", LINEAR, null);

            assertTrue(store.delete("wf-1"));
            assertTrue(store.get("wf-1").isEmpty());
        }
    }

    @Nested
    @DisplayName("JDBC on H2")
    class Jdbc extends Contract {

        private JdbcDataSource dataSource;

        @Override
        WorkflowRecordStore createStore(MutableClock clock) throws SQLException {
            dataSource = new JdbcDataSource();
            dataSource.setURL("jdbc:h2:mem:records-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
            var jdbc = new JdbcWorkflowRecordStore(dataSource, new DagCodec(), new ObjectMapper(), clock, TTL);
            jdbc.createTables();
            jdbc.createTables();
            return jdbc;
        }

        @Test
        @DisplayName("a table created before the context column is upgraded in place")
        void upgradesOlderTable() throws SQLException {
            var legacy = new JdbcDataSource();
            legacy.setURL("jdbc:h2:mem:legacy-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
            try (Connection conn = legacy.getConnection(); Statement stmt = conn.createStatement()) {
                stmt.execute("""
                        CREATE TABLE workflow_records (
                            workflow_id VARCHAR(255) NOT NULL PRIMARY KEY,
                            dag         TEXT NOT NULL,
                            intent      TEXT,
                            created_at  TIMESTAMP NOT NULL,
                            expires_at  TIMESTAMP NOT NULL
                        )
                        """);
            }
            var jdbc = new JdbcWorkflowRecordStore(legacy, new DagCodec(), new ObjectMapper(), clock, TTL);

            jdbc.createTables();
            jdbc.save("wf-1", LINEAR, "after upgrade", Map.of("approvalMode", "ALWAYS"));

            assertEquals(Map.of("approvalMode", "ALWAYS"), jdbc.getRecord("wf-1").orElseThrow().context());
        }

        @Test
        @DisplayName("a row with a null context reads back with an empty one")
        void nullContextColumn() throws SQLException {
            store.save("wf-1", LINEAR, null, Map.of("approvalMode", "ALWAYS"));
            try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
                stmt.executeUpdate("UPDATE workflow_records SET context = NULL");
            }

            assertEquals(Map.of(), store.getRecord("wf-1").orElseThrow().context());
        }
    }

    @Nested
    @DisplayName("In memory")
    class InMemory extends Contract {

        @Override
        WorkflowRecordStore createStore(MutableClock clock) {
            return new InMemoryWorkflowRecordStore(clock, TTL);
        }
    }
}
