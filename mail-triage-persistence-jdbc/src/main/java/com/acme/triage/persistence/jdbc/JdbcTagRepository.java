package com.acme.triage.persistence.jdbc;

import com.acme.triage.domain.CategoryType;
import com.acme.triage.domain.Tag;
import com.acme.triage.repository.TagRepository;
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
import java.util.Optional;

/**
 * Abstract JDBC implementation of TagRepository.
 * Subclasses supply the dialect's upsert statement.
 */
public abstract class JdbcTagRepository implements TagRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcTagRepository.class);

    static final String COLUMNS = "name, description, category_type, active, priority_order";

    protected final DataSource dataSource;

    protected JdbcTagRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Tag> findActive() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps =
                     conn.prepareStatement("SELECT " + COLUMNS + " FROM tag WHERE active = TRUE ORDER BY name")) {

            List<Tag> tags = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    tags.add(map(rs));
                }
            }
            return tags;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find active tags", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Tag> findByName(String name) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT " + COLUMNS + " FROM tag WHERE name = ?")) {

            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find tag", LOG);
        }
    }

    @Override
    @Transactional
    public void upsert(Tag tag) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getUpsertSql())) {

            ps.setString(1, tag.name());
            ps.setString(2, tag.description());
            ps.setString(3, tag.categoryType().name());
            ps.setBoolean(4, tag.active());
            ps.setInt(5, tag.priorityOrder());
            ps.setTimestamp(6, JdbcSupport.timestamp(Instant.now()));
            ps.executeUpdate();
            LOG.debug("Upserted tag {} (active={})", tag.name(), tag.active());

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "upsert tag", LOG);
        }
    }

    private Tag map(ResultSet rs) throws SQLException {
        return new Tag(
                rs.getString("name"),
                rs.getString("description"),
                CategoryType.valueOf(rs.getString("category_type")),
                rs.getBoolean("active"),
                rs.getInt("priority_order"));
    }

    // Template method for database-specific SQL

    protected abstract String getUpsertSql();
}
