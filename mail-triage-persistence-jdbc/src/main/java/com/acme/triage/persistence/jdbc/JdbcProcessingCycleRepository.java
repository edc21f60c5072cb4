package com.acme.triage.persistence.jdbc;

import com.acme.triage.domain.ProcessingCycle;
import com.acme.triage.repository.ProcessingCycleRepository;
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
import java.util.UUID;

/**
 * Abstract JDBC implementation of ProcessingCycleRepository.
 */
public abstract class JdbcProcessingCycleRepository implements ProcessingCycleRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcProcessingCycleRepository.class);

    static final String COLUMNS =
            "id, started_at, finished_at, scanned, classified, failed, quarantined, skipped, "
                    + "queue_depth_before, queue_depth_after, duration_ms, timed_out";

    protected final DataSource dataSource;

    protected JdbcProcessingCycleRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public void insert(ProcessingCycle cycle) {
        String sql = "INSERT INTO processing_cycle (id, started_at, queue_depth_before) VALUES (?, ?, ?)";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, cycle.getId());
            ps.setTimestamp(2, JdbcSupport.timestamp(cycle.getStartedAt()));
            ps.setLong(3, cycle.getQueueDepthBefore());
            ps.executeUpdate();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "insert processing cycle", LOG);
        }
    }

    @Override
    @Transactional
    public void finish(ProcessingCycle cycle) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getFinishSql())) {

            ps.setTimestamp(1, JdbcSupport.timestamp(cycle.getFinishedAt()));
            ps.setInt(2, cycle.getScanned());
            ps.setInt(3, cycle.getClassified());
            ps.setInt(4, cycle.getFailed());
            ps.setInt(5, cycle.getQuarantined());
            ps.setInt(6, cycle.getSkipped());
            ps.setLong(7, cycle.getQueueDepthAfter());
            ps.setLong(8, cycle.getDurationMs());
            ps.setBoolean(9, cycle.isTimedOut());
            ps.setObject(10, cycle.getId());

            if (ps.executeUpdate() == 0) {
                LOG.warn("No processing cycle row to finish: id={}", cycle.getId());
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "finish processing cycle", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ProcessingCycle> findById(UUID id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps =
                     conn.prepareStatement("SELECT " + COLUMNS + " FROM processing_cycle WHERE id = ?")) {

            ps.setObject(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find processing cycle", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<ProcessingCycle> findRecent(int limit) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getFindRecentSql())) {

            ps.setInt(1, limit);
            List<ProcessingCycle> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(map(rs));
                }
            }
            return results;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find recent processing cycles", LOG);
        }
    }

    private ProcessingCycle map(ResultSet rs) throws SQLException {
        ProcessingCycle c = new ProcessingCycle();
        c.setId(JdbcSupport.uuid(rs, "id"));
        c.setStartedAt(JdbcSupport.instant(rs, "started_at"));
        c.setFinishedAt(JdbcSupport.instant(rs, "finished_at"));
        c.setScanned(rs.getInt("scanned"));
        c.setClassified(rs.getInt("classified"));
        c.setFailed(rs.getInt("failed"));
        c.setQuarantined(rs.getInt("quarantined"));
        c.setSkipped(rs.getInt("skipped"));
        c.setQueueDepthBefore(rs.getLong("queue_depth_before"));
        c.setQueueDepthAfter(rs.getLong("queue_depth_after"));
        c.setDurationMs(rs.getLong("duration_ms"));
        c.setTimedOut(rs.getBoolean("timed_out"));
        return c;
    }

    // Template methods for database-specific SQL

    protected abstract String getFinishSql();

    protected abstract String getFindRecentSql();
}
