package io.eventlog.spi;

import io.eventlog.DomainEvent;
import io.eventlog.model.ProjectionCheckpoint;
import io.eventlog.model.ProjectionFailure;
import io.eventlog.model.ProjectionHealthMetric;
import io.eventlog.model.ResolutionMethod;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for projection bookkeeping: failure records, checkpoints and health rows.
 *
 * <p>Every write is scoped to a single projection or failure key, so no locking beyond
 * the statement itself is required. Callers own the transaction.
 *
 * @see io.eventlog.jdbc.JdbcProjectionStore
 */
public interface ProjectionStore {

    // ── Failures ──

    void insertFailure(Connection conn, ProjectionFailure failure);

    /**
     * Overwrites retry bookkeeping of an existing failure: retry count, error, failure time
     * and next retry time.
     *
     * @return rows updated
     */
    int updateFailure(Connection conn, ProjectionFailure failure);

    Optional<ProjectionFailure> findFailure(Connection conn, String failureId);

    Optional<ProjectionFailure> findUnresolvedFailure(Connection conn, String eventId, String projectionName);

    /**
     * Resolves one failure if it is still unresolved.
     *
     * @return {@code 1} if resolved, {@code 0} if missing or already resolved
     */
    int resolveFailure(Connection conn, String failureId, Instant resolvedAt, ResolutionMethod method);

    /**
     * Resolves the unresolved failure(s) of an event for one projection.
     */
    int resolveFailures(Connection conn, String eventId, String projectionName,
                        Instant resolvedAt, ResolutionMethod method);

    /**
     * Resolves every unresolved failure of a projection.
     */
    int resolveAllFailures(Connection conn, String projectionName, Instant resolvedAt, ResolutionMethod method);

    /**
     * Unresolved failures with {@code next_retry_at <= now} and {@code retry_count < max_retries},
     * oldest due first.
     */
    List<ProjectionFailure> failuresDueForRetry(Connection conn, Instant now, int limit);

    /**
     * Failure history of a projection, most recent first.
     */
    List<ProjectionFailure> failures(Connection conn, String projectionName, boolean includeResolved, int limit);

    int countActiveFailures(Connection conn, String projectionName);

    // ── Checkpoints ──

    /**
     * Upserts the projection's checkpoint: increments {@code events_processed} and moves the
     * last event forward only if {@code event.sequence()} is not behind the stored one.
     */
    void saveCheckpoint(Connection conn, String projectionName, DomainEvent event, Instant checkpointAt);

    Optional<ProjectionCheckpoint> findCheckpoint(Connection conn, String projectionName);

    int deleteCheckpoint(Connection conn, String projectionName);

    // ── Health ──

    void saveHealth(Connection conn, HealthUpdate update);

    Optional<ProjectionHealthMetric> findHealth(Connection conn, String projectionName);

    List<ProjectionHealthMetric> allHealth(Connection conn);
}
