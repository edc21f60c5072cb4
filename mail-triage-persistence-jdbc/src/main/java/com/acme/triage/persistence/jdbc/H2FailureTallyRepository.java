package com.acme.triage.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/** H2-specific implementation of FailureTallyRepository */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2FailureTallyRepository extends JdbcFailureTallyRepository {

    public H2FailureTallyRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getIncrementSql() {
        return """
                MERGE INTO failure_tally t
                USING (SELECT CAST(? AS VARCHAR(512)) AS tally_key,
                              CAST(? AS TIMESTAMP) AS failed_at,
                              CAST(? AS VARCHAR(255)) AS error_class,
                              CAST(? AS VARCHAR(2000)) AS error_message) s
                ON t.tally_key = s.tally_key
                WHEN MATCHED THEN
                    UPDATE SET consecutive_failures = t.consecutive_failures + 1,
                               last_failure_at = s.failed_at,
                               last_error_class = s.error_class,
                               last_error_message = s.error_message
                WHEN NOT MATCHED THEN
                    INSERT (tally_key, consecutive_failures, last_failure_at, last_error_class, last_error_message)
                    VALUES (s.tally_key, 1, s.failed_at, s.error_class, s.error_message)
                """;
    }
}
