package com.acme.triage.persistence.jdbc;

import com.acme.triage.core.TransientException;
import com.acme.triage.domain.FailureTally;
import com.acme.triage.repository.FailureTallyRepository;
import io.micronaut.transaction.annotation.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

/**
 * Abstract JDBC implementation of FailureTallyRepository.
 * The increment is a single upsert statement; dialects that cannot return the row re-read it.
 */
public abstract class JdbcFailureTallyRepository implements FailureTallyRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcFailureTallyRepository.class);

    static final String COLUMNS =
            "tally_key, consecutive_failures, last_failure_at, last_error_class, last_error_message";

    // Concurrent first failures can both miss the MATCHED branch; the loser retries once
    private static final int INCREMENT_ATTEMPTS = 2;

    protected final DataSource dataSource;

    protected JdbcFailureTallyRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public FailureTally increment(String tallyKey, String errorClass, String errorMessage) {
        for (int attempt = 1; ; attempt++) {
            try (Connection conn = dataSource.getConnection()) {
                FailureTally tally = doIncrement(conn, tallyKey, errorClass, errorMessage);
                LOG.debug("Failure tally {} now {}", tallyKey, tally.consecutiveFailures());
                return tally;
            } catch (SQLException e) {
                if (ExceptionTranslator.isUniqueViolation(e) && attempt < INCREMENT_ATTEMPTS) {
                    LOG.debug("Tally insert race on {}, retrying", tallyKey);
                    continue;
                }
                throw ExceptionTranslator.translateException(e, "increment failure tally", LOG);
            }
        }
    }

    private FailureTally doIncrement(Connection conn, String tallyKey, String errorClass, String errorMessage)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(getIncrementSql())) {
            ps.setString(1, tallyKey);
            ps.setTimestamp(2, JdbcSupport.timestamp(Instant.now()));
            ps.setString(3, JdbcSupport.truncate(errorClass, 255));
            ps.setString(4, JdbcSupport.truncate(errorMessage, 2000));

            if (incrementReturnsRow()) {
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        return map(rs);
                    }
                }
            } else {
                ps.executeUpdate();
            }
        }
        return findWith(conn, tallyKey)
                .orElseThrow(() -> new TransientException("Failure tally vanished after increment: " + tallyKey));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<FailureTally> find(String tallyKey) {
        try (Connection conn = dataSource.getConnection()) {
            return findWith(conn, tallyKey);
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find failure tally", LOG);
        }
    }

    @Override
    @Transactional
    public void reset(String tallyKey) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("DELETE FROM failure_tally WHERE tally_key = ?")) {

            ps.setString(1, tallyKey);
            if (ps.executeUpdate() > 0) {
                LOG.debug("Failure tally {} reset", tallyKey);
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "reset failure tally", LOG);
        }
    }

    private Optional<FailureTally> findWith(Connection conn, String tallyKey) throws SQLException {
        try (PreparedStatement ps =
                     conn.prepareStatement("SELECT " + COLUMNS + " FROM failure_tally WHERE tally_key = ?")) {
            ps.setString(1, tallyKey);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    private FailureTally map(ResultSet rs) throws SQLException {
        return new FailureTally(
                rs.getString("tally_key"),
                rs.getInt("consecutive_failures"),
                JdbcSupport.instant(rs, "last_failure_at"),
                rs.getString("last_error_class"),
                rs.getString("last_error_message"));
    }

    // Template methods for database-specific SQL

    /**
     * Upsert that creates the tally at 1 or adds 1. Parameters: key, timestamp, error class, error message.
     */
    protected abstract String getIncrementSql();

    /**
     * Whether {@link #getIncrementSql()} returns the updated row.
     */
    protected boolean incrementReturnsRow() {
        return false;
    }
}
