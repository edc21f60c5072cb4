package com.acme.triage.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/** H2-specific implementation of IdempotencyKeyRepository */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2IdempotencyKeyRepository extends JdbcIdempotencyKeyRepository {

    public H2IdempotencyKeyRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertClaimSql() {
        return """
                INSERT INTO idempotency_key (idem_key, message_id, schema_version, status, claimed_by, claimed_at)
                VALUES (?, ?, ?, ?, ?, ?)
                """;
    }

    @Override
    protected String getUpsertCompletedSql() {
        return """
                MERGE INTO idempotency_key t
                USING (SELECT CAST(? AS VARCHAR(64)) AS idem_key,
                              CAST(? AS VARCHAR(512)) AS message_id,
                              CAST(? AS VARCHAR(32)) AS schema_version,
                              CAST(? AS TIMESTAMP) AS claimed_at,
                              CAST(? AS TIMESTAMP) AS completed_at) s
                ON t.idem_key = s.idem_key
                WHEN MATCHED THEN
                    UPDATE SET status = 'COMPLETED', completed_at = s.completed_at
                WHEN NOT MATCHED THEN
                    INSERT (idem_key, message_id, schema_version, status, claimed_by, claimed_at, completed_at)
                    VALUES (s.idem_key, s.message_id, s.schema_version, 'COMPLETED', 'manual-review',
                            s.claimed_at, s.completed_at)
                """;
    }
}
