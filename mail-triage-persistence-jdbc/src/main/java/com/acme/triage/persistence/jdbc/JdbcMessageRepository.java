package com.acme.triage.persistence.jdbc;

import com.acme.triage.domain.Message;
import com.acme.triage.domain.MessageStatus;
import com.acme.triage.repository.MessageRepository;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Abstract JDBC implementation of MessageRepository using Template Method pattern.
 * Subclasses supply the dialect's insert-if-absent statement.
 */
public abstract class JdbcMessageRepository implements MessageRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcMessageRepository.class);

    static final String COLUMNS =
            "id, message_id, sender, sender_domain, subject, body, body_hash, status, last_error_class, "
                    + "last_error_message, received_at, updated_at";

    protected final DataSource dataSource;

    protected JdbcMessageRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public int insertIfAbsent(Message message) {
        Instant now = Instant.now();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getInsertIfAbsentSql())) {

            ps.setObject(1, message.getId());
            ps.setString(2, message.getMessageId());
            ps.setString(3, message.getSender());
            ps.setString(4, message.getSenderDomain());
            ps.setString(5, message.getSubject());
            ps.setString(6, message.getBody());
            ps.setString(7, message.getBodyHash());
            ps.setString(8, message.getStatus().dbValue());
            ps.setTimestamp(9, JdbcSupport.timestamp(message.getReceivedAt()));
            ps.setTimestamp(10, JdbcSupport.timestamp(now));

            int inserted = ps.executeUpdate();
            if (inserted > 0) {
                message.setUpdatedAt(now);
                LOG.debug("Registered message: messageId={}, id={}", message.getMessageId(), message.getId());
            }
            return inserted;

        } catch (SQLException e) {
            if (ExceptionTranslator.isUniqueViolation(e)) {
                LOG.debug("Message already registered: messageId={}", message.getMessageId());
                return 0;
            }
            throw ExceptionTranslator.translateException(e, "insert message", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Message> findById(UUID id) {
        return findOne("SELECT " + COLUMNS + " FROM message WHERE id = ?", id, "find message by id");
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Message> findByMessageId(String messageId) {
        return findOne(
                "SELECT " + COLUMNS + " FROM message WHERE message_id = ?", messageId, "find message by messageId");
    }

    @Override
    @Transactional(readOnly = true)
    public List<Message> findEligibleForPickup(int limit) {
        String sql = "SELECT " + COLUMNS + " FROM message WHERE status IN (?, ?) "
                + "ORDER BY received_at, id LIMIT ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, MessageStatus.PENDING.dbValue());
            ps.setString(2, MessageStatus.FAILED.dbValue());
            ps.setInt(3, limit);

            List<Message> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(map(rs));
                }
            }
            return results;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find messages eligible for pickup", LOG);
        }
    }

    @Override
    @Transactional
    public boolean transition(UUID id, Set<MessageStatus> from, MessageStatus to) {
        String sql = "UPDATE message SET status = ?, updated_at = ? WHERE id = ? AND status IN ("
                + JdbcSupport.placeholders(from.size()) + ")";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            ps.setString(i++, to.dbValue());
            ps.setTimestamp(i++, JdbcSupport.timestamp(Instant.now()));
            ps.setObject(i++, id);
            for (MessageStatus s : from) {
                ps.setString(i++, s.dbValue());
            }
            return logTransition(id, from, to, ps.executeUpdate());

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "transition message to " + to.dbValue(), LOG);
        }
    }

    @Override
    @Transactional
    public boolean transition(
            UUID id, Set<MessageStatus> from, MessageStatus to, String errorClass, String errorMessage) {
        String sql = "UPDATE message SET status = ?, last_error_class = ?, last_error_message = ?, updated_at = ? "
                + "WHERE id = ? AND status IN (" + JdbcSupport.placeholders(from.size()) + ")";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            ps.setString(i++, to.dbValue());
            ps.setString(i++, JdbcSupport.truncate(errorClass, 255));
            ps.setString(i++, JdbcSupport.truncate(errorMessage, 2000));
            ps.setTimestamp(i++, JdbcSupport.timestamp(Instant.now()));
            ps.setObject(i++, id);
            for (MessageStatus s : from) {
                ps.setString(i++, s.dbValue());
            }
            return logTransition(id, from, to, ps.executeUpdate());

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "transition message to " + to.dbValue(), LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public long countByStatus(Set<MessageStatus> statuses) {
        String sql = "SELECT COUNT(*) FROM message WHERE status IN (" + JdbcSupport.placeholders(statuses.size()) + ")";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            for (MessageStatus s : statuses) {
                ps.setString(i++, s.dbValue());
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "count messages by status", LOG);
        }
    }

    @Override
    public List<Message> findStuck(Duration olderThan) {
        String sql = "SELECT " + COLUMNS + " FROM message WHERE status = ? AND updated_at < ? "
                + "ORDER BY updated_at, id";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, MessageStatus.CLASSIFYING.dbValue());
            ps.setTimestamp(2, JdbcSupport.timestamp(Instant.now().minus(olderThan)));

            List<Message> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(map(rs));
                }
            }
            return results;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find stuck messages", LOG);
        }
    }

    private boolean logTransition(UUID id, Set<MessageStatus> from, MessageStatus to, int updated) {
        if (updated == 0) {
            LOG.debug("Transition rejected: id={}, expected one of {}, target {}", id, from, to);
            return false;
        }
        LOG.debug("Message {} -> {}", id, to);
        return true;
    }

    private Optional<Message> findOne(String sql, Object param, String operation) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, operation, LOG);
        }
    }

    private Message map(ResultSet rs) throws SQLException {
        Message m = new Message();
        m.setId(JdbcSupport.uuid(rs, "id"));
        m.setMessageId(rs.getString("message_id"));
        m.setSender(rs.getString("sender"));
        m.setSenderDomain(rs.getString("sender_domain"));
        m.setSubject(rs.getString("subject"));
        m.setBody(rs.getString("body"));
        m.setBodyHash(rs.getString("body_hash"));
        m.setStatus(MessageStatus.fromDb(rs.getString("status")));
        m.setLastErrorClass(rs.getString("last_error_class"));
        m.setLastErrorMessage(rs.getString("last_error_message"));
        m.setReceivedAt(JdbcSupport.instant(rs, "received_at"));
        m.setUpdatedAt(JdbcSupport.instant(rs, "updated_at"));
        return m;
    }

    // Template method for database-specific SQL

    protected abstract String getInsertIfAbsentSql();
}
