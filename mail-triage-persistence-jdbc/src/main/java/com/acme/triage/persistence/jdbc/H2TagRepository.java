package com.acme.triage.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/** H2-specific implementation of TagRepository */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2TagRepository extends JdbcTagRepository {

    public H2TagRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getUpsertSql() {
        return """
                MERGE INTO tag t
                USING (SELECT CAST(? AS VARCHAR(128)) AS name,
                              CAST(? AS VARCHAR(1000)) AS description,
                              CAST(? AS VARCHAR(32)) AS category_type,
                              CAST(? AS BOOLEAN) AS active,
                              CAST(? AS INT) AS priority_order,
                              CAST(? AS TIMESTAMP) AS created_at) s
                ON t.name = s.name
                WHEN MATCHED THEN
                    UPDATE SET description = s.description, category_type = s.category_type,
                               active = s.active, priority_order = s.priority_order
                WHEN NOT MATCHED THEN
                    INSERT (name, description, category_type, active, priority_order, created_at)
                    VALUES (s.name, s.description, s.category_type, s.active, s.priority_order, s.created_at)
                """;
    }
}
