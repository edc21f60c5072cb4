package com.acme.triage.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/**
 * PostgreSQL-specific implementation of TagRepository
 */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresTagRepository extends JdbcTagRepository {

    public PostgresTagRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getUpsertSql() {
        return """
                INSERT INTO tag (name, description, category_type, active, priority_order, created_at)
                VALUES (?, ?, ?, ?, ?, ?)
                ON CONFLICT (name) DO UPDATE
                SET description = EXCLUDED.description,
                    category_type = EXCLUDED.category_type,
                    active = EXCLUDED.active,
                    priority_order = EXCLUDED.priority_order
                """;
    }
}
