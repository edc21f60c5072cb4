package com.acme.triage.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/**
 * PostgreSQL-specific implementation of FailureTallyRepository
 */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresFailureTallyRepository extends JdbcFailureTallyRepository {

    public PostgresFailureTallyRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getIncrementSql() {
        return """
                INSERT INTO failure_tally (tally_key, consecutive_failures, last_failure_at, last_error_class, last_error_message)
                VALUES (?, 1, ?, ?, ?)
                ON CONFLICT (tally_key) DO UPDATE
                SET consecutive_failures = failure_tally.consecutive_failures + 1,
                    last_failure_at = EXCLUDED.last_failure_at,
                    last_error_class = EXCLUDED.last_error_class,
                    last_error_message = EXCLUDED.last_error_message
                RETURNING tally_key, consecutive_failures, last_failure_at, last_error_class, last_error_message
                """;
    }

    @Override
    protected boolean incrementReturnsRow() {
        return true;
    }
}
