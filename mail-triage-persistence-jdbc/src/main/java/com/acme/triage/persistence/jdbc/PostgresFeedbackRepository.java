package com.acme.triage.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/**
 * PostgreSQL-specific implementation of FeedbackRepository
 */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresFeedbackRepository extends JdbcFeedbackRepository {

    public PostgresFeedbackRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getFindPendingSql() {
        return """
                SELECT id, message_pk, original_category, corrected_category, reason, submitted_at,
                       incorporated, incorporated_at
                FROM feedback
                WHERE NOT incorporated
                ORDER BY submitted_at, id
                LIMIT ?
                """;
    }
}
