package io.eventlog.jdbc;

import io.eventlog.SnapshotCorruptionException;
import io.eventlog.jdbc.spi.Dialect;
import io.eventlog.model.Snapshot;
import io.eventlog.spi.JsonCodec;
import io.eventlog.spi.SnapshotStore;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link SnapshotStore} keeping the newest snapshot per aggregate.
 *
 * <p>State that does not parse as a JSON object raises {@link SnapshotCorruptionException};
 * it is never replaced by an empty state.
 */
public final class JdbcSnapshotStore implements SnapshotStore {
    private final Dialect dialect;
    private final JsonCodec jsonCodec;
    private final String table;

    public JdbcSnapshotStore(Dialect dialect, JsonCodec jsonCodec) {
        this(dialect, jsonCodec, TableNames.SNAPSHOTS);
    }

    public JdbcSnapshotStore(Dialect dialect, JsonCodec jsonCodec, String tableName) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
        this.table = TableNames.validate(tableName);
    }

    @Override
    public void save(Connection conn, Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        JdbcTemplate.update(conn, dialect.upsertSnapshotSql(table),
                snapshot.aggregateId(), snapshot.aggregateType(), snapshot.version(),
                snapshot.schemaVersion(), jsonCodec.toJson(snapshot.state()), snapshot.createdAt());
    }

    @Override
    public Optional<Snapshot> load(Connection conn, String aggregateId) {
        String sql = "SELECT aggregate_id, aggregate_type, aggregate_version, schema_version, state, created_at" +
                " FROM " + table + " WHERE aggregate_id=?";
        return JdbcTemplate.queryOne(conn, sql, this::mapSnapshot, aggregateId);
    }

    @Override
    public boolean delete(Connection conn, String aggregateId) {
        return JdbcTemplate.update(conn, "DELETE FROM " + table + " WHERE aggregate_id=?", aggregateId) > 0;
    }

    private Snapshot mapSnapshot(ResultSet rs) throws SQLException {
        String aggregateId = rs.getString("aggregate_id");
        long version = rs.getLong("aggregate_version");
        Map<String, Object> state;
        try {
            state = jsonCodec.parseObject(rs.getString("state"));
        } catch (IllegalArgumentException e) {
            throw new SnapshotCorruptionException(aggregateId,
                    "Snapshot state at version " + version + " is not a JSON object", e);
        }
        return new Snapshot(aggregateId, rs.getString("aggregate_type"), version,
                rs.getInt("schema_version"), state, rs.getTimestamp("created_at").toInstant());
    }
}
