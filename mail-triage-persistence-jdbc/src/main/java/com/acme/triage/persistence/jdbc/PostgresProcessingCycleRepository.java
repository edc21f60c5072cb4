package com.acme.triage.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/** PostgreSQL-specific implementation of ProcessingCycleRepository */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresProcessingCycleRepository extends JdbcProcessingCycleRepository {

    public PostgresProcessingCycleRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getFinishSql() {
        return """
                UPDATE processing_cycle
                SET finished_at = ?, scanned = ?, classified = ?, failed = ?, quarantined = ?, skipped = ?,
                    queue_depth_after = ?, duration_ms = ?, timed_out = ?
                WHERE id = ? AND finished_at IS NULL
                """;
    }

    @Override
    protected String getFindRecentSql() {
        return """
                SELECT id, started_at, finished_at, scanned, classified, failed, quarantined, skipped,
                       queue_depth_before, queue_depth_after, duration_ms, timed_out
                FROM processing_cycle
                ORDER BY started_at DESC
                LIMIT ?
                """;
    }
}
