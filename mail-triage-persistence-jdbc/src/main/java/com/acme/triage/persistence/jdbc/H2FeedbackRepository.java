package com.acme.triage.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/** H2-specific implementation of FeedbackRepository */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2FeedbackRepository extends JdbcFeedbackRepository {

    public H2FeedbackRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getFindPendingSql() {
        return """
                SELECT id, message_pk, original_category, corrected_category, reason, submitted_at,
                       incorporated, incorporated_at
                FROM feedback
                WHERE incorporated = FALSE
                ORDER BY submitted_at, id
                LIMIT ?
                """;
    }
}
