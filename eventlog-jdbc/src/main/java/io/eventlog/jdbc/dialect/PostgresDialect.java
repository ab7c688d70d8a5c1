package io.eventlog.jdbc.dialect;

import java.util.List;

/**
 * PostgreSQL dialect. JSON columns are {@code JSONB}; upserts use {@code ON CONFLICT}.
 */
public final class PostgresDialect extends AbstractDialect {

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:postgresql:");
    }

    @Override
    public String jsonParameter() {
        return "CAST(? AS JSONB)";
    }

    @Override
    public String upsertSnapshotSql(String table) {
        return "INSERT INTO " + table + " AS cur" +
                " (aggregate_id, aggregate_type, aggregate_version, schema_version, state, created_at)" +
                " VALUES (?,?,?,?,CAST(? AS JSONB),?)" +
                " ON CONFLICT (aggregate_id) DO UPDATE SET" +
                " aggregate_type = EXCLUDED.aggregate_type, aggregate_version = EXCLUDED.aggregate_version," +
                " schema_version = EXCLUDED.schema_version, state = EXCLUDED.state," +
                " created_at = EXCLUDED.created_at" +
                " WHERE cur.aggregate_version <= EXCLUDED.aggregate_version";
    }

    @Override
    public String upsertCheckpointSql(String table) {
        return "INSERT INTO " + table + " AS cur" +
                " (projection_name, last_event_id, last_event_type, last_event_sequence, events_processed," +
                " checkpoint_at)" +
                " VALUES (?,?,?,?,1,?)" +
                " ON CONFLICT (projection_name) DO UPDATE SET" +
                " last_event_id = CASE WHEN EXCLUDED.last_event_sequence > cur.last_event_sequence" +
                " THEN EXCLUDED.last_event_id ELSE cur.last_event_id END," +
                " last_event_type = CASE WHEN EXCLUDED.last_event_sequence > cur.last_event_sequence" +
                " THEN EXCLUDED.last_event_type ELSE cur.last_event_type END," +
                " last_event_sequence = GREATEST(cur.last_event_sequence, EXCLUDED.last_event_sequence)," +
                " events_processed = cur.events_processed + 1," +
                " checkpoint_at = EXCLUDED.checkpoint_at";
    }

    @Override
    public String upsertHealthSql(String table) {
        return "INSERT INTO " + table + " AS cur" +
                " (projection_name, health_status, total_events_processed, total_failures, active_failures," +
                " last_success_at, last_failure_at, updated_at)" +
                " VALUES (?,?,?,?,?,?,?,?)" +
                " ON CONFLICT (projection_name) DO UPDATE SET" +
                " health_status = EXCLUDED.health_status," +
                " total_events_processed = cur.total_events_processed + EXCLUDED.total_events_processed," +
                " total_failures = cur.total_failures + EXCLUDED.total_failures," +
                " active_failures = EXCLUDED.active_failures," +
                " last_success_at = COALESCE(EXCLUDED.last_success_at, cur.last_success_at)," +
                " last_failure_at = COALESCE(EXCLUDED.last_failure_at, cur.last_failure_at)," +
                " updated_at = EXCLUDED.updated_at";
    }
}
