package com.acme.triage.persistence.jdbc;

import com.acme.triage.domain.ContextEntry;
import com.acme.triage.spi.ContextStore;
import io.micronaut.transaction.annotation.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Abstract JDBC implementation of ContextStore.
 * Upserts are keyed on the entry id, so replaying an upsert never duplicates an entry.
 */
public abstract class JdbcContextStore implements ContextStore {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcContextStore.class);

    static final String COLUMNS = "id, content, category, source, created_at, updated_at";

    protected final DataSource dataSource;

    protected JdbcContextStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public void upsert(ContextEntry entry) {
        Instant now = Instant.now();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getUpsertSql())) {

            ps.setString(1, entry.id());
            ps.setString(2, entry.text());
            ps.setString(3, entry.category());
            ps.setString(4, entry.source());
            ps.setTimestamp(5, JdbcSupport.timestamp(entry.createdAt() != null ? entry.createdAt() : now));
            ps.setTimestamp(6, JdbcSupport.timestamp(now));
            ps.executeUpdate();
            LOG.debug("Upserted context entry {}", entry.id());

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "upsert context entry", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ContextEntry> findById(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT " + COLUMNS + " FROM context_entry WHERE id = ?")) {

            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find context entry", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<ContextEntry> search(Set<String> terms, int limit) {
        if (terms.isEmpty() || limit <= 0) {
            return List.of();
        }
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM context_entry WHERE ");
        for (int i = 0; i < terms.size(); i++) {
            sql.append(i == 0 ? "" : " OR ").append("LOWER(content) LIKE ?");
        }
        sql.append(" ORDER BY updated_at DESC LIMIT ?");

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            int i = 1;
            for (String term : terms) {
                ps.setString(i++, "%" + escapeLike(term.toLowerCase(Locale.ROOT)) + "%");
            }
            ps.setInt(i, limit);

            List<ContextEntry> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(map(rs));
                }
            }
            return results;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "search context entries", LOG);
        }
    }

    private static String escapeLike(String term) {
        return term.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private ContextEntry map(ResultSet rs) throws SQLException {
        return new ContextEntry(
                rs.getString("id"),
                rs.getString("content"),
                rs.getString("category"),
                rs.getString("source"),
                JdbcSupport.instant(rs, "created_at"),
                JdbcSupport.instant(rs, "updated_at"));
    }

    // Template method for database-specific SQL

    /**
     * Parameters: id, content, category, source, created_at, updated_at. An existing row keeps its created_at.
     */
    protected abstract String getUpsertSql();
}
