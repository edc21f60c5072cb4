package com.acme.triage.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/**
 * PostgreSQL-specific implementation of ContextStore
 */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresContextStore extends JdbcContextStore {

    public PostgresContextStore(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getUpsertSql() {
        return """
                INSERT INTO context_entry (id, content, category, source, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?)
                ON CONFLICT (id) DO UPDATE
                SET content = EXCLUDED.content,
                    category = EXCLUDED.category,
                    source = EXCLUDED.source,
                    updated_at = EXCLUDED.updated_at
                """;
    }
}
