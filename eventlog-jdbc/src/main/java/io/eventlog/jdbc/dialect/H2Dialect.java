package io.eventlog.jdbc.dialect;

import java.sql.SQLException;
import java.util.List;

/**
 * H2 dialect. Upserts use {@code MERGE INTO ... USING}.
 */
public final class H2Dialect extends AbstractDialect {
    private static final int CONCURRENT_UPDATE = 90131;
    private static final int LOCK_TIMEOUT = 50200;

    @Override
    public String name() {
        return "h2";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:h2:");
    }

    /**
     * H2 accepts {@code FOR UPDATE} only on a top-level query, so every locked version is
     * returned and the store takes the maximum.
     */
    @Override
    public String lockedVersionSql(String table) {
        return "SELECT event_version FROM " + table + " WHERE aggregate_id=? FOR UPDATE";
    }

    @Override
    public boolean isWriteConflict(SQLException e) {
        int code = e.getErrorCode();
        return code == CONCURRENT_UPDATE || code == LOCK_TIMEOUT || super.isWriteConflict(e);
    }

    @Override
    public String upsertSnapshotSql(String table) {
        return "MERGE INTO " + table + " AS cur USING (SELECT" +
                " CAST(? AS VARCHAR(255)) AS aggregate_id," +
                " CAST(? AS VARCHAR(255)) AS aggregate_type," +
                " CAST(? AS BIGINT) AS aggregate_version," +
                " CAST(? AS INT) AS schema_version," +
                " CAST(? AS CLOB) AS state," +
                " CAST(? AS TIMESTAMP) AS created_at) AS src" +
                " ON cur.aggregate_id = src.aggregate_id" +
                " WHEN MATCHED AND cur.aggregate_version <= src.aggregate_version THEN UPDATE SET" +
                " aggregate_type = src.aggregate_type, aggregate_version = src.aggregate_version," +
                " schema_version = src.schema_version, state = src.state, created_at = src.created_at" +
                " WHEN NOT MATCHED THEN INSERT" +
                " (aggregate_id, aggregate_type, aggregate_version, schema_version, state, created_at)" +
                " VALUES (src.aggregate_id, src.aggregate_type, src.aggregate_version," +
                " src.schema_version, src.state, src.created_at)";
    }

    @Override
    public String upsertCheckpointSql(String table) {
        return "MERGE INTO " + table + " AS cur USING (SELECT" +
                " CAST(? AS VARCHAR(255)) AS projection_name," +
                " CAST(? AS VARCHAR(64)) AS last_event_id," +
                " CAST(? AS VARCHAR(255)) AS last_event_type," +
                " CAST(? AS BIGINT) AS last_event_sequence," +
                " CAST(? AS TIMESTAMP) AS checkpoint_at) AS src" +
                " ON cur.projection_name = src.projection_name" +
                " WHEN MATCHED THEN UPDATE SET" +
                " last_event_id = CASE WHEN src.last_event_sequence > cur.last_event_sequence" +
                " THEN src.last_event_id ELSE cur.last_event_id END," +
                " last_event_type = CASE WHEN src.last_event_sequence > cur.last_event_sequence" +
                " THEN src.last_event_type ELSE cur.last_event_type END," +
                " last_event_sequence = GREATEST(cur.last_event_sequence, src.last_event_sequence)," +
                " events_processed = cur.events_processed + 1," +
                " checkpoint_at = src.checkpoint_at" +
                " WHEN NOT MATCHED THEN INSERT" +
                " (projection_name, last_event_id, last_event_type, last_event_sequence, events_processed," +
                " checkpoint_at)" +
                " VALUES (src.projection_name, src.last_event_id, src.last_event_type," +
                " src.last_event_sequence, 1, src.checkpoint_at)";
    }

    @Override
    public String upsertHealthSql(String table) {
        return "MERGE INTO " + table + " AS cur USING (SELECT" +
                " CAST(? AS VARCHAR(255)) AS projection_name," +
                " CAST(? AS VARCHAR(16)) AS health_status," +
                " CAST(? AS BIGINT) AS processed_delta," +
                " CAST(? AS BIGINT) AS failures_delta," +
                " CAST(? AS INT) AS active_failures," +
                " CAST(? AS TIMESTAMP) AS last_success_at," +
                " CAST(? AS TIMESTAMP) AS last_failure_at," +
                " CAST(? AS TIMESTAMP) AS updated_at) AS src" +
                " ON cur.projection_name = src.projection_name" +
                " WHEN MATCHED THEN UPDATE SET" +
                " health_status = src.health_status," +
                " total_events_processed = cur.total_events_processed + src.processed_delta," +
                " total_failures = cur.total_failures + src.failures_delta," +
                " active_failures = src.active_failures," +
                " last_success_at = COALESCE(src.last_success_at, cur.last_success_at)," +
                " last_failure_at = COALESCE(src.last_failure_at, cur.last_failure_at)," +
                " updated_at = src.updated_at" +
                " WHEN NOT MATCHED THEN INSERT" +
                " (projection_name, health_status, total_events_processed, total_failures, active_failures," +
                " last_success_at, last_failure_at, updated_at)" +
                " VALUES (src.projection_name, src.health_status, src.processed_delta, src.failures_delta," +
                " src.active_failures, src.last_success_at, src.last_failure_at, src.updated_at)";
    }
}
