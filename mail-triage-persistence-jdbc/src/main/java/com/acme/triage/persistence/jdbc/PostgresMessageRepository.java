package com.acme.triage.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/**
 * PostgreSQL-specific implementation of MessageRepository
 */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresMessageRepository extends JdbcMessageRepository {

    public PostgresMessageRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertIfAbsentSql() {
        return """
                INSERT INTO message
                (id, message_id, sender, sender_domain, subject, body, body_hash, status, received_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (message_id) DO NOTHING
                """;
    }
}
