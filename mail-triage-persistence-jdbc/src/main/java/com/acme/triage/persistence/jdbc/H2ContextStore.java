package com.acme.triage.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/** H2-specific implementation of ContextStore */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2ContextStore extends JdbcContextStore {

    public H2ContextStore(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getUpsertSql() {
        return """
                MERGE INTO context_entry t
                USING (SELECT CAST(? AS VARCHAR(255)) AS id,
                              CAST(? AS VARCHAR(10000)) AS content,
                              CAST(? AS VARCHAR(128)) AS category,
                              CAST(? AS VARCHAR(32)) AS source,
                              CAST(? AS TIMESTAMP) AS created_at,
                              CAST(? AS TIMESTAMP) AS updated_at) s
                ON t.id = s.id
                WHEN MATCHED THEN
                    UPDATE SET content = s.content, category = s.category, source = s.source,
                               updated_at = s.updated_at
                WHEN NOT MATCHED THEN
                    INSERT (id, content, category, source, created_at, updated_at)
                    VALUES (s.id, s.content, s.category, s.source, s.created_at, s.updated_at)
                """;
    }
}
