package com.botflow.botflow_backend.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Adds the partial unique indexes that keep frontend ids unique among a bot's live nodes and
 * edges. Soft-deleted rows are excluded so an id can be reused after a delete.
 * Hibernate's {@code ddl-auto} cannot express partial indexes, hence the raw DDL.
 */
@Slf4j
@Component
@DependsOn("entityManagerFactory")
@RequiredArgsConstructor
public class FlowIndexMigration {

    private final JdbcTemplate jdbcTemplate;

    @PostConstruct
    public void createLiveFrontendIdIndexes() {
        createIndex("uq_flow_nodes_live_frontend_id", "flow_nodes");
        createIndex("uq_flow_edges_live_frontend_id", "flow_edges");
    }

    private void createIndex(String indexName, String table) {
        try {
            jdbcTemplate.execute("CREATE UNIQUE INDEX IF NOT EXISTS " + indexName + " ON " + table
                    + " (bot_id, frontend_id) WHERE is_deleted = false AND frontend_id IS NOT NULL");
            log.debug("Ensured partial unique index {} on {}", indexName, table);
        } catch (Exception e) {
            log.warn("Could not create {} on {} (duplicate live ids or unsupported database): {}",
                    indexName, table, e.getMessage());
        }
    }
}
