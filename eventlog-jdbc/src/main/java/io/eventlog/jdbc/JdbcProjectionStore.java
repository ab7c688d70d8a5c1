package io.eventlog.jdbc;

import io.eventlog.DomainEvent;
import io.eventlog.jdbc.spi.Dialect;
import io.eventlog.model.HealthStatus;
import io.eventlog.model.ProjectionCheckpoint;
import io.eventlog.model.ProjectionFailure;
import io.eventlog.model.ProjectionHealthMetric;
import io.eventlog.model.ResolutionMethod;
import io.eventlog.spi.HealthUpdate;
import io.eventlog.spi.ProjectionStore;
import io.eventlog.util.Errors;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link ProjectionStore} over the {@code projection_failures},
 * {@code projection_checkpoints} and {@code projection_health_metrics} tables.
 */
public final class JdbcProjectionStore implements ProjectionStore {
    private static final String FAILURE_COLUMNS = "failure_id, event_id, event_type, projection_name, " +
            "error_message, error_trace, retry_count, max_retries, failed_at, next_retry_at, " +
            "resolved_at, resolution_method";

    private static final JdbcTemplate.RowMapper<ProjectionFailure> FAILURE_ROW_MAPPER = rs -> {
        String method = rs.getString("resolution_method");
        return new ProjectionFailure(
                rs.getString("failure_id"),
                rs.getString("event_id"),
                rs.getString("event_type"),
                rs.getString("projection_name"),
                rs.getString("error_message"),
                rs.getString("error_trace"),
                rs.getInt("retry_count"),
                rs.getInt("max_retries"),
                JdbcTemplate.instant(rs, "failed_at"),
                JdbcTemplate.instant(rs, "next_retry_at"),
                JdbcTemplate.instant(rs, "resolved_at"),
                method == null ? null : ResolutionMethod.fromCode(method));
    };

    private static final JdbcTemplate.RowMapper<ProjectionCheckpoint> CHECKPOINT_ROW_MAPPER =
            rs -> new ProjectionCheckpoint(
                    rs.getString("projection_name"),
                    rs.getString("last_event_id"),
                    rs.getString("last_event_type"),
                    rs.getLong("last_event_sequence"),
                    rs.getLong("events_processed"),
                    JdbcTemplate.instant(rs, "checkpoint_at"));

    private static final JdbcTemplate.RowMapper<ProjectionHealthMetric> HEALTH_ROW_MAPPER =
            JdbcProjectionStore::mapHealth;

    private final Dialect dialect;
    private final String failuresTable;
    private final String checkpointsTable;
    private final String healthTable;

    public JdbcProjectionStore(Dialect dialect) {
        this(dialect, TableNames.PROJECTION_FAILURES, TableNames.PROJECTION_CHECKPOINTS,
                TableNames.PROJECTION_HEALTH);
    }

    public JdbcProjectionStore(Dialect dialect, String failuresTable, String checkpointsTable, String healthTable) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.failuresTable = TableNames.validate(failuresTable);
        this.checkpointsTable = TableNames.validate(checkpointsTable);
        this.healthTable = TableNames.validate(healthTable);
    }

    // ── Failures ──

    @Override
    public void insertFailure(Connection conn, ProjectionFailure failure) {
        String sql = "INSERT INTO " + failuresTable + " (" + FAILURE_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?)";
        ResolutionMethod method = failure.resolutionMethod();
        JdbcTemplate.update(conn, sql,
                failure.id(), failure.eventId(), failure.eventType(), failure.projectionName(),
                Errors.truncate(failure.errorMessage()), failure.errorTrace(),
                failure.retryCount(), failure.maxRetries(), failure.failedAt(), failure.nextRetryAt(),
                failure.resolvedAt(), method == null ? null : method.code());
    }

    @Override
    public int updateFailure(Connection conn, ProjectionFailure failure) {
        String sql = "UPDATE " + failuresTable +
                " SET error_message=?, error_trace=?, retry_count=?, failed_at=?, next_retry_at=?" +
                " WHERE failure_id=?";
        return JdbcTemplate.update(conn, sql,
                Errors.truncate(failure.errorMessage()), failure.errorTrace(), failure.retryCount(),
                failure.failedAt(), failure.nextRetryAt(), failure.id());
    }

    @Override
    public Optional<ProjectionFailure> findFailure(Connection conn, String failureId) {
        String sql = "SELECT " + FAILURE_COLUMNS + " FROM " + failuresTable + " WHERE failure_id=?";
        return JdbcTemplate.queryOne(conn, sql, FAILURE_ROW_MAPPER, failureId);
    }

    @Override
    public Optional<ProjectionFailure> findUnresolvedFailure(Connection conn, String eventId, String projectionName) {
        String sql = "SELECT " + FAILURE_COLUMNS + " FROM " + failuresTable +
                " WHERE event_id=? AND projection_name=? AND resolved_at IS NULL ORDER BY failed_at DESC";
        return JdbcTemplate.queryOne(conn, sql, FAILURE_ROW_MAPPER, eventId, projectionName);
    }

    @Override
    public int resolveFailure(Connection conn, String failureId, Instant resolvedAt, ResolutionMethod method) {
        String sql = "UPDATE " + failuresTable +
                " SET resolved_at=?, resolution_method=?, next_retry_at=NULL" +
                " WHERE failure_id=? AND resolved_at IS NULL";
        return JdbcTemplate.update(conn, sql, resolvedAt, method.code(), failureId);
    }

    @Override
    public int resolveFailures(Connection conn, String eventId, String projectionName,
                               Instant resolvedAt, ResolutionMethod method) {
        String sql = "UPDATE " + failuresTable +
                " SET resolved_at=?, resolution_method=?, next_retry_at=NULL" +
                " WHERE event_id=? AND projection_name=? AND resolved_at IS NULL";
        return JdbcTemplate.update(conn, sql, resolvedAt, method.code(), eventId, projectionName);
    }

    @Override
    public int resolveAllFailures(Connection conn, String projectionName, Instant resolvedAt,
                                  ResolutionMethod method) {
        String sql = "UPDATE " + failuresTable +
                " SET resolved_at=?, resolution_method=?, next_retry_at=NULL" +
                " WHERE projection_name=? AND resolved_at IS NULL";
        return JdbcTemplate.update(conn, sql, resolvedAt, method.code(), projectionName);
    }

    @Override
    public List<ProjectionFailure> failuresDueForRetry(Connection conn, Instant now, int limit) {
        String sql = "SELECT " + FAILURE_COLUMNS + " FROM " + failuresTable +
                " WHERE resolved_at IS NULL AND next_retry_at IS NOT NULL AND next_retry_at<=?" +
                " AND retry_count<max_retries ORDER BY next_retry_at LIMIT ?";
        return JdbcTemplate.query(conn, sql, FAILURE_ROW_MAPPER, now, limit);
    }

    @Override
    public List<ProjectionFailure> failures(Connection conn, String projectionName, boolean includeResolved,
                                            int limit) {
        String sql = "SELECT " + FAILURE_COLUMNS + " FROM " + failuresTable +
                " WHERE projection_name=?" + (includeResolved ? "" : " AND resolved_at IS NULL") +
                " ORDER BY failed_at DESC LIMIT ?";
        return JdbcTemplate.query(conn, sql, FAILURE_ROW_MAPPER, projectionName, limit);
    }

    @Override
    public int countActiveFailures(Connection conn, String projectionName) {
        return (int) JdbcTemplate.queryLong(conn, "SELECT COUNT(*) FROM " + failuresTable +
                " WHERE projection_name=? AND resolved_at IS NULL", projectionName);
    }

    // ── Checkpoints ──

    @Override
    public void saveCheckpoint(Connection conn, String projectionName, DomainEvent event, Instant checkpointAt) {
        JdbcTemplate.update(conn, dialect.upsertCheckpointSql(checkpointsTable),
                projectionName, event.eventId(), event.eventType(), event.sequence(), checkpointAt);
    }

    @Override
    public Optional<ProjectionCheckpoint> findCheckpoint(Connection conn, String projectionName) {
        String sql = "SELECT projection_name, last_event_id, last_event_type, last_event_sequence," +
                " events_processed, checkpoint_at FROM " + checkpointsTable + " WHERE projection_name=?";
        return JdbcTemplate.queryOne(conn, sql, CHECKPOINT_ROW_MAPPER, projectionName);
    }

    @Override
    public int deleteCheckpoint(Connection conn, String projectionName) {
        return JdbcTemplate.update(conn, "DELETE FROM " + checkpointsTable + " WHERE projection_name=?",
                projectionName);
    }

    // ── Health ──

    @Override
    public void saveHealth(Connection conn, HealthUpdate update) {
        JdbcTemplate.update(conn, dialect.upsertHealthSql(healthTable),
                update.projectionName(), update.healthStatus().code(),
                update.eventsProcessedDelta(), update.failuresDelta(), update.activeFailures(),
                update.successAt(), update.failureAt(), Instant.now());
    }

    @Override
    public Optional<ProjectionHealthMetric> findHealth(Connection conn, String projectionName) {
        String sql = "SELECT projection_name, health_status, total_events_processed, total_failures," +
                " active_failures, last_success_at, last_failure_at FROM " + healthTable +
                " WHERE projection_name=?";
        return JdbcTemplate.queryOne(conn, sql, HEALTH_ROW_MAPPER, projectionName);
    }

    @Override
    public List<ProjectionHealthMetric> allHealth(Connection conn) {
        String sql = "SELECT projection_name, health_status, total_events_processed, total_failures," +
                " active_failures, last_success_at, last_failure_at FROM " + healthTable +
                " ORDER BY projection_name";
        return JdbcTemplate.query(conn, sql, HEALTH_ROW_MAPPER);
    }

    private static ProjectionHealthMetric mapHealth(ResultSet rs) throws SQLException {
        return new ProjectionHealthMetric(
                rs.getString("projection_name"),
                HealthStatus.fromCode(rs.getString("health_status")),
                rs.getLong("total_events_processed"),
                rs.getLong("total_failures"),
                rs.getInt("active_failures"),
                JdbcTemplate.instant(rs, "last_success_at"),
                JdbcTemplate.instant(rs, "last_failure_at"));
    }
}
