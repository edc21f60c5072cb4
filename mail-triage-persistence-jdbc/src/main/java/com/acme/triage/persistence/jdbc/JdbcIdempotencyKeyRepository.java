package com.acme.triage.persistence.jdbc;

import com.acme.triage.domain.IdempotencyRecord;
import com.acme.triage.repository.IdempotencyKeyRepository;
import io.micronaut.transaction.annotation.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Abstract JDBC implementation of IdempotencyKeyRepository using Template Method pattern.
 * A key row is CLAIMED while a worker classifies and COMPLETED once the result is stored.
 */
public abstract class JdbcIdempotencyKeyRepository implements IdempotencyKeyRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcIdempotencyKeyRepository.class);

    protected static final String CLAIMED = IdempotencyRecord.State.CLAIMED.name();
    protected static final String COMPLETED = IdempotencyRecord.State.COMPLETED.name();

    protected final DataSource dataSource;

    protected JdbcIdempotencyKeyRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public int insertClaim(String key, String messageId, String schemaVersion, String claimedBy) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getInsertClaimSql())) {

            ps.setString(1, key);
            ps.setString(2, messageId);
            ps.setString(3, schemaVersion);
            ps.setString(4, CLAIMED);
            ps.setString(5, claimedBy);
            ps.setTimestamp(6, JdbcSupport.timestamp(Instant.now()));

            int inserted = ps.executeUpdate();
            if (inserted > 0) {
                LOG.debug("Claimed key {} for messageId={} by {}", key, messageId, claimedBy);
            }
            return inserted;

        } catch (SQLException e) {
            if (ExceptionTranslator.isUniqueViolation(e)) {
                return 0;
            }
            throw ExceptionTranslator.translateException(e, "claim idempotency key", LOG);
        }
    }

    @Override
    @Transactional
    public void upsertCompleted(String key, String messageId, String schemaVersion) {
        Instant now = Instant.now();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getUpsertCompletedSql())) {

            ps.setString(1, key);
            ps.setString(2, messageId);
            ps.setString(3, schemaVersion);
            ps.setTimestamp(4, JdbcSupport.timestamp(now));
            ps.setTimestamp(5, JdbcSupport.timestamp(now));
            ps.executeUpdate();
            LOG.debug("Key {} completed for messageId={}", key, messageId);

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "upsert completed idempotency key", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<IdempotencyRecord> find(String key) {
        String sql = "SELECT idem_key, message_id, schema_version, status, claimed_by, claimed_at, completed_at "
                + "FROM idempotency_key WHERE idem_key = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new IdempotencyRecord(
                        rs.getString("idem_key"),
                        rs.getString("message_id"),
                        rs.getString("schema_version"),
                        IdempotencyRecord.State.valueOf(rs.getString("status")),
                        rs.getString("claimed_by"),
                        JdbcSupport.instant(rs, "claimed_at"),
                        JdbcSupport.instant(rs, "completed_at")));
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find idempotency key", LOG);
        }
    }

    @Override
    @Transactional
    public boolean markCompleted(String key) {
        String sql = "UPDATE idempotency_key SET status = ?, completed_at = ? WHERE idem_key = ? AND status = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, COMPLETED);
            ps.setTimestamp(2, JdbcSupport.timestamp(Instant.now()));
            ps.setString(3, key);
            ps.setString(4, CLAIMED);

            int updated = ps.executeUpdate();
            if (updated == 0) {
                LOG.warn("No claim to complete for key {}", key);
            }
            return updated > 0;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "complete idempotency key", LOG);
        }
    }

    @Override
    @Transactional
    public int deleteClaim(String key) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps =
                     conn.prepareStatement("DELETE FROM idempotency_key WHERE idem_key = ? AND status = ?")) {

            ps.setString(1, key);
            ps.setString(2, CLAIMED);
            return ps.executeUpdate();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "release idempotency claim", LOG);
        }
    }

    @Override
    @Transactional
    public int recoverStale(Duration olderThan) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps =
                     conn.prepareStatement("DELETE FROM idempotency_key WHERE status = ? AND claimed_at < ?")) {

            ps.setString(1, CLAIMED);
            ps.setTimestamp(2, JdbcSupport.timestamp(Instant.now().minus(olderThan)));

            int recovered = ps.executeUpdate();
            if (recovered > 0) {
                LOG.info("Recovered {} stale idempotency claims older than {}", recovered, olderThan);
            }
            return recovered;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "recover stale idempotency claims", LOG);
        }
    }

    // Template methods for database-specific SQL

    protected abstract String getInsertClaimSql();

    protected abstract String getUpsertCompletedSql();
}
