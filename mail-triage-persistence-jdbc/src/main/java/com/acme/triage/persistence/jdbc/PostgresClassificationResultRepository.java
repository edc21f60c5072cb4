package com.acme.triage.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/**
 * PostgreSQL-specific implementation of ClassificationResultRepository.
 * ON CONFLICT without a target covers both the (message_id, schema_version) and idempotency key constraints.
 */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresClassificationResultRepository extends JdbcClassificationResultRepository {

    public PostgresClassificationResultRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertIfAbsentSql() {
        return """
                INSERT INTO classification_result
                (id, message_pk, message_id, schema_version, idempotency_key, primary_category, secondary_categories,
                 priority, deadline_utc, deadline_confidence, confidence, rationale, detected_entities, sentiment,
                 action_items, thread_context, suggested_folder, context_ids, manual, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT DO NOTHING
                """;
    }
}
