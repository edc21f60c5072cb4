package com.acme.triage.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/** H2-specific implementation of ClassificationResultRepository */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2ClassificationResultRepository extends JdbcClassificationResultRepository {

    public H2ClassificationResultRepository(DataSource dataSource) {
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
                """;
    }
}
