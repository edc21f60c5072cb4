package com.acme.triage.persistence.jdbc;

import com.acme.triage.domain.FeedbackRecord;
import com.acme.triage.repository.FeedbackRepository;
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
import java.util.UUID;

/**
 * Abstract JDBC implementation of FeedbackRepository.
 * The incorporated flag only ever moves from false to true.
 */
public abstract class JdbcFeedbackRepository implements FeedbackRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcFeedbackRepository.class);

    static final String COLUMNS =
            "id, message_pk, original_category, corrected_category, reason, submitted_at, incorporated, incorporated_at";

    protected final DataSource dataSource;

    protected JdbcFeedbackRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public void insert(FeedbackRecord record) {
        String sql = "INSERT INTO feedback (id, message_pk, original_category, corrected_category, reason, "
                + "submitted_at, incorporated) VALUES (?, ?, ?, ?, ?, ?, FALSE)";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, record.getId());
            ps.setObject(2, record.getMessagePk());
            ps.setString(3, record.getOriginalCategory());
            ps.setString(4, record.getCorrectedCategory());
            ps.setString(5, JdbcSupport.truncate(record.getReason(), 2000));
            ps.setTimestamp(6, JdbcSupport.timestamp(record.getSubmittedAt()));
            ps.executeUpdate();
            LOG.debug("Stored feedback {} for message {}", record.getId(), record.getMessagePk());

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "insert feedback", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<FeedbackRecord> findById(UUID id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT " + COLUMNS + " FROM feedback WHERE id = ?")) {

            ps.setObject(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find feedback", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<FeedbackRecord> findPending(int limit) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getFindPendingSql())) {

            ps.setInt(1, limit);
            List<FeedbackRecord> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(map(rs));
                }
            }
            return results;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find pending feedback", LOG);
        }
    }

    @Override
    @Transactional
    public boolean markIncorporated(UUID id) {
        String sql = "UPDATE feedback SET incorporated = TRUE, incorporated_at = ? WHERE id = ? AND incorporated = FALSE";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, JdbcSupport.timestamp(Instant.now()));
            ps.setObject(2, id);
            return ps.executeUpdate() > 0;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "mark feedback incorporated", LOG);
        }
    }

    private FeedbackRecord map(ResultSet rs) throws SQLException {
        return new FeedbackRecord(
                JdbcSupport.uuid(rs, "id"),
                JdbcSupport.uuid(rs, "message_pk"),
                rs.getString("original_category"),
                rs.getString("corrected_category"),
                rs.getString("reason"),
                JdbcSupport.instant(rs, "submitted_at"),
                rs.getBoolean("incorporated"),
                JdbcSupport.instant(rs, "incorporated_at"));
    }

    // Template method for database-specific SQL

    protected abstract String getFindPendingSql();
}
