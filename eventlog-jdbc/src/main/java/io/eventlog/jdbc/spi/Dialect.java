package io.eventlog.jdbc.spi;

import java.sql.SQLException;
import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide the database-specific SQL of the JDBC stores: row locking,
 * JSON parameters and the upserts of snapshots, checkpoints and health metrics.
 * Register custom dialects via {@code META-INF/services/io.eventlog.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: PostgreSQL, H2.
 *
 * @see io.eventlog.jdbc.dialect.Dialects
 */
public interface Dialect {

    /**
     * Unique identifier for this dialect (e.g., "postgresql", "h2").
     */
    String name();

    /**
     * JDBC URL prefixes this dialect handles (e.g., "jdbc:postgresql:").
     */
    List<String> jdbcUrlPrefixes();

    /**
     * Placeholder for a JSON text parameter, e.g. {@code ?} or {@code CAST(? AS JSONB)}.
     */
    String jsonParameter();

    /**
     * SQL that locks every event row of an aggregate and reads the current version over the
     * locked rows.
     *
     * <p>Parameters: aggregate_id (String). The result is either a single row holding the
     * maximum version, or one row per locked version; callers take the largest value, and
     * no row or {@code 0} means a new aggregate.
     */
    String lockedVersionSql(String table);

    /**
     * Whether {@code e} means a concurrent writer got there first (unique violation,
     * serialization failure, lock timeout) rather than the store being unavailable.
     */
    boolean isWriteConflict(SQLException e);

    /**
     * Upsert of the snapshot row of an aggregate; an older version never replaces a newer one.
     *
     * <p>Parameters (in order):
     * <ol>
     *   <li>aggregate_id (String)</li>
     *   <li>aggregate_type (String)</li>
     *   <li>aggregate_version (long)</li>
     *   <li>schema_version (int)</li>
     *   <li>state (String/JSON)</li>
     *   <li>created_at (Timestamp)</li>
     * </ol>
     */
    String upsertSnapshotSql(String table);

    /**
     * Upsert of a projection checkpoint. Increments {@code events_processed}; the last
     * event columns only move to a higher sequence.
     *
     * <p>Parameters (in order):
     * <ol>
     *   <li>projection_name (String)</li>
     *   <li>last_event_id (String)</li>
     *   <li>last_event_type (String)</li>
     *   <li>last_event_sequence (long)</li>
     *   <li>checkpoint_at (Timestamp)</li>
     * </ol>
     */
    String upsertCheckpointSql(String table);

    /**
     * Upsert of projection health. Totals are incremented by the given deltas; last
     * success and failure times are only replaced by non-null values.
     *
     * <p>Parameters (in order):
     * <ol>
     *   <li>projection_name (String)</li>
     *   <li>health_status (String)</li>
     *   <li>total_events_processed delta (long)</li>
     *   <li>total_failures delta (long)</li>
     *   <li>active_failures (int)</li>
     *   <li>last_success_at (Timestamp, nullable)</li>
     *   <li>last_failure_at (Timestamp, nullable)</li>
     *   <li>updated_at (Timestamp)</li>
     * </ol>
     */
    String upsertHealthSql(String table);
}
