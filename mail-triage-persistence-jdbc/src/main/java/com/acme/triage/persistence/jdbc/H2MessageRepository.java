package com.acme.triage.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/**
 * H2-specific implementation of MessageRepository.
 * A lost race surfaces as a unique violation, which the base class reads as "already present".
 */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2MessageRepository extends JdbcMessageRepository {

    public H2MessageRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertIfAbsentSql() {
        return """
                INSERT INTO message
                (id, message_id, sender, sender_domain, subject, body, body_hash, status, received_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
    }
}
