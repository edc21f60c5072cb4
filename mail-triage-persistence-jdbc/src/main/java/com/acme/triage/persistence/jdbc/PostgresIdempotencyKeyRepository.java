package com.acme.triage.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/**
 * PostgreSQL-specific implementation of IdempotencyKeyRepository
 */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresIdempotencyKeyRepository extends JdbcIdempotencyKeyRepository {

    public PostgresIdempotencyKeyRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertClaimSql() {
        return """
                INSERT INTO idempotency_key (idem_key, message_id, schema_version, status, claimed_by, claimed_at)
                VALUES (?, ?, ?, ?, ?, ?)
                ON CONFLICT (idem_key) DO NOTHING
                """;
    }

    @Override
    protected String getUpsertCompletedSql() {
        return """
                INSERT INTO idempotency_key (idem_key, message_id, schema_version, status, claimed_by, claimed_at, completed_at)
                VALUES (?, ?, ?, 'COMPLETED', 'manual-review', ?, ?)
                ON CONFLICT (idem_key) DO UPDATE
                SET status = 'COMPLETED', completed_at = EXCLUDED.completed_at
                """;
    }
}
