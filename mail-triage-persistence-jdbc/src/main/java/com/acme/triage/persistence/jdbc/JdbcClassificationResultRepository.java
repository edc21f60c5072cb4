package com.acme.triage.persistence.jdbc;

import com.acme.triage.core.Jsons;
import com.acme.triage.domain.ActionItem;
import com.acme.triage.domain.ClassificationResult;
import com.acme.triage.domain.DeadlineConfidence;
import com.acme.triage.domain.DetectedEntities;
import com.acme.triage.domain.Priority;
import com.acme.triage.domain.Sentiment;
import com.acme.triage.domain.ThreadContext;
import com.acme.triage.repository.ClassificationResultRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import io.micronaut.transaction.annotation.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Abstract JDBC implementation of ClassificationResultRepository.
 * List-valued and structured fields are stored as JSON.
 */
public abstract class JdbcClassificationResultRepository implements ClassificationResultRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcClassificationResultRepository.class);

    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {
    };
    private static final TypeReference<List<ActionItem>> ACTION_ITEMS = new TypeReference<>() {
    };

    static final String COLUMNS =
            "id, message_pk, message_id, schema_version, idempotency_key, primary_category, secondary_categories, "
                    + "priority, deadline_utc, deadline_confidence, confidence, rationale, detected_entities, sentiment, "
                    + "action_items, thread_context, suggested_folder, context_ids, manual, created_at";

    protected final DataSource dataSource;

    protected JdbcClassificationResultRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public int insertIfAbsent(ClassificationResult result) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getInsertIfAbsentSql())) {

            ps.setObject(1, result.id());
            ps.setObject(2, result.messagePk());
            ps.setString(3, result.messageId());
            ps.setString(4, result.schemaVersion());
            ps.setString(5, result.idempotencyKey());
            ps.setString(6, result.primaryCategory());
            ps.setString(7, Jsons.toJson(result.secondaryCategories()));
            ps.setString(8, result.priority().dbValue());
            ps.setTimestamp(9, JdbcSupport.timestamp(result.deadlineUtc()));
            ps.setString(10, result.deadlineConfidence().dbValue());
            ps.setDouble(11, result.confidence());
            ps.setString(12, result.rationale());
            ps.setString(13, Jsons.toJson(result.detectedEntities()));
            ps.setString(14, result.sentiment().dbValue());
            ps.setString(15, Jsons.toJson(result.actionItems()));
            ps.setString(16, Jsons.toJson(result.threadContext()));
            ps.setString(17, result.suggestedFolder());
            ps.setString(18, Jsons.toJson(result.contextIds()));
            ps.setBoolean(19, result.manual());
            ps.setTimestamp(20, JdbcSupport.timestamp(result.createdAt()));

            int inserted = ps.executeUpdate();
            if (inserted > 0) {
                LOG.debug("Stored classification: messageId={}, schemaVersion={}, category={}",
                        result.messageId(), result.schemaVersion(), result.primaryCategory());
            } else {
                LOG.debug("Classification already stored: messageId={}, schemaVersion={}",
                        result.messageId(), result.schemaVersion());
            }
            return inserted;

        } catch (SQLException e) {
            if (ExceptionTranslator.isUniqueViolation(e)) {
                LOG.debug("Classification already stored: messageId={}, schemaVersion={}",
                        result.messageId(), result.schemaVersion());
                return 0;
            }
            throw ExceptionTranslator.translateException(e, "insert classification result", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ClassificationResult> find(String messageId, String schemaVersion) {
        String sql = "SELECT " + COLUMNS + " FROM classification_result WHERE message_id = ? AND schema_version = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, messageId);
            ps.setString(2, schemaVersion);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find classification result", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<ClassificationResult> findByMessageId(String messageId) {
        String sql = "SELECT " + COLUMNS + " FROM classification_result WHERE message_id = ? ORDER BY created_at";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, messageId);
            List<ClassificationResult> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(map(rs));
                }
            }
            return results;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find classification results by messageId", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public long countByMessageId(String messageId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps =
                     conn.prepareStatement("SELECT COUNT(*) FROM classification_result WHERE message_id = ?")) {

            ps.setString(1, messageId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "count classification results", LOG);
        }
    }

    private ClassificationResult map(ResultSet rs) throws SQLException {
        return new ClassificationResult(
                JdbcSupport.uuid(rs, "id"),
                JdbcSupport.uuid(rs, "message_pk"),
                rs.getString("message_id"),
                rs.getString("schema_version"),
                rs.getString("idempotency_key"),
                rs.getString("primary_category"),
                Jsons.listFromJson(rs.getString("secondary_categories"), STRINGS),
                Priority.fromDb(rs.getString("priority")),
                JdbcSupport.instant(rs, "deadline_utc"),
                DeadlineConfidence.fromDb(rs.getString("deadline_confidence")),
                rs.getDouble("confidence"),
                rs.getString("rationale"),
                Jsons.fromJson(rs.getString("detected_entities"), DetectedEntities.class),
                Sentiment.fromDb(rs.getString("sentiment")),
                Jsons.listFromJson(rs.getString("action_items"), ACTION_ITEMS),
                Jsons.fromJson(rs.getString("thread_context"), ThreadContext.class),
                rs.getString("suggested_folder"),
                Jsons.listFromJson(rs.getString("context_ids"), STRINGS),
                rs.getBoolean("manual"),
                JdbcSupport.instant(rs, "created_at"));
    }

    // Template method for database-specific SQL

    protected abstract String getInsertIfAbsentSql();
}
