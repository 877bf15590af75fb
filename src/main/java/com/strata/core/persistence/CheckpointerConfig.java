package com.strata.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.core.config.StrataProperties;
import com.strata.core.model.DagCodec;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Optional;

/**
 * Persistence beans: the LangGraph4j checkpoint saver and the workflow record store.
 * <p>
 * When a {@link DataSource} is available both are JDBC-backed and create their tables on
 * startup. Otherwise in-memory fallbacks are used, which are fine for development and
 * tests but do not survive a restart.
 */
@Configuration
public class CheckpointerConfig {

    private static final Logger log = LoggerFactory.getLogger(CheckpointerConfig.class);

    @Bean
    public BaseCheckpointSaver checkpointSaver(Optional<DataSource> dataSource) throws SQLException {
        if (dataSource.isPresent()) {
            log.info("Configuring JDBC checkpoint saver");
            var saver = new JdbcCheckpointSaver(dataSource.get());
            saver.createTables();
            return saver;
        }
        log.info("No DataSource available; using in-memory checkpoint saver (state will not persist across restarts)");
        return new MemorySaver();
    }

    @Bean
    public WorkflowRecordStore workflowRecordStore(Optional<DataSource> dataSource, DagCodec dagCodec,
                                                   ObjectMapper objectMapper, Clock clock,
                                                   StrataProperties properties) throws SQLException {
        var ttl = properties.getRecords().getTtl();
        if (dataSource.isPresent()) {
            var store = new JdbcWorkflowRecordStore(dataSource.get(), dagCodec, objectMapper, clock, ttl);
            store.createTables();
            return store;
        }
        log.info("No DataSource available; using in-memory workflow record store");
        return new InMemoryWorkflowRecordStore(clock, ttl);
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }
}
