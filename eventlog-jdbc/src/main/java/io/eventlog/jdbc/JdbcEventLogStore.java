package io.eventlog.jdbc;

import io.eventlog.DomainEvent;
import io.eventlog.StoreUnavailableException;
import io.eventlog.jdbc.spi.Dialect;
import io.eventlog.spi.AppendResult;
import io.eventlog.spi.EventLogStore;
import io.eventlog.spi.JsonCodec;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link EventLogStore}.
 *
 * <p>{@link #append} locks every event row of the aggregate, reads the current version over
 * the locked rows, compares it with the expected version and inserts the new events in the
 * caller's transaction. The unique constraint on {@code (aggregate_id, event_version)}
 * catches writers that raced past the lock (for example two creators of the same new
 * aggregate); such a violation is rolled back to a savepoint and reported as a
 * {@link AppendResult.VersionConflict}.
 *
 * <p>Global sequences come from the {@code event_sequence} identity column and are read
 * back after the insert.
 */
public final class JdbcEventLogStore implements EventLogStore {
    private static final String COLUMNS = "event_sequence, event_id, aggregate_id, aggregate_type, event_type, " +
            "event_version, schema_version, payload, occurred_at";

    private final Dialect dialect;
    private final JsonCodec jsonCodec;
    private final String table;
    private final JdbcTemplate.RowMapper<DomainEvent> eventMapper;

    public JdbcEventLogStore(Dialect dialect, JsonCodec jsonCodec) {
        this(dialect, jsonCodec, TableNames.EVENTS);
    }

    public JdbcEventLogStore(Dialect dialect, JsonCodec jsonCodec, String tableName) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
        this.table = TableNames.validate(tableName);
        this.eventMapper = this::mapEvent;
    }

    @Override
    public AppendResult append(Connection conn, String aggregateId, List<DomainEvent> events, long expectedVersion) {
        Objects.requireNonNull(aggregateId, "aggregateId");
        checkVersions(aggregateId, events, expectedVersion);
        if (events.isEmpty()) {
            return new AppendResult.Appended(List.of());
        }
        try {
            if (conn.getAutoCommit()) {
                throw new IllegalStateException("append requires a connection with auto-commit disabled");
            }
            Savepoint savepoint = conn.setSavepoint();
            try {
                long current = lockAggregate(conn, aggregateId);
                if (current != expectedVersion) {
                    conn.releaseSavepoint(savepoint);
                    return new AppendResult.VersionConflict(aggregateId, expectedVersion, current);
                }
                insert(conn, events);
            } catch (SQLException e) {
                if (!dialect.isWriteConflict(e)) {
                    throw e;
                }
                conn.rollback(savepoint);
                return new AppendResult.VersionConflict(aggregateId, expectedVersion,
                        currentVersion(conn, aggregateId));
            }
            conn.releaseSavepoint(savepoint);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to append events for aggregate " + aggregateId, e);
        }
        return new AppendResult.Appended(withSequences(conn, aggregateId, events, expectedVersion));
    }

    private static void checkVersions(String aggregateId, List<DomainEvent> events, long expectedVersion) {
        long version = expectedVersion;
        for (DomainEvent event : events) {
            version++;
            if (!aggregateId.equals(event.aggregateId())) {
                throw new IllegalArgumentException("Event " + event.eventId() + " belongs to aggregate "
                        + event.aggregateId() + ", not " + aggregateId);
            }
            if (event.version() != version) {
                throw new IllegalArgumentException("Event " + event.eventId() + " has version "
                        + event.version() + ", expected " + version);
            }
        }
    }

    private long lockAggregate(Connection conn, String aggregateId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(dialect.lockedVersionSql(table))) {
            ps.setString(1, aggregateId);
            long current = 0L;
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    current = Math.max(current, rs.getLong(1));
                }
            }
            return current;
        }
    }

    private void insert(Connection conn, List<DomainEvent> events) throws SQLException {
        String sql = "INSERT INTO " + table + " (event_id, aggregate_id, aggregate_type, event_type, " +
                "event_version, schema_version, payload, occurred_at) VALUES (?,?,?,?,?,?," +
                dialect.jsonParameter() + ",?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (DomainEvent event : events) {
                ps.setString(1, event.eventId());
                ps.setString(2, event.aggregateId());
                ps.setString(3, event.aggregateType());
                ps.setString(4, event.eventType());
                ps.setLong(5, event.version());
                ps.setInt(6, event.schemaVersion());
                ps.setString(7, jsonCodec.toJson(event.payload()));
                ps.setTimestamp(8, Timestamp.from(event.occurredAt()));
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private List<DomainEvent> withSequences(Connection conn, String aggregateId, List<DomainEvent> events,
                                            long expectedVersion) {
        String sql = "SELECT event_id, event_sequence FROM " + table +
                " WHERE aggregate_id=? AND event_version>? ORDER BY event_version";
        Map<String, Long> sequences = new HashMap<>();
        for (Map.Entry<String, Long> row : JdbcTemplate.query(conn, sql,
                rs -> Map.entry(rs.getString(1), rs.getLong(2)), aggregateId, expectedVersion)) {
            sequences.put(row.getKey(), row.getValue());
        }
        List<DomainEvent> appended = new ArrayList<>(events.size());
        for (DomainEvent event : events) {
            Long sequence = sequences.get(event.eventId());
            if (sequence == null) {
                throw new IllegalStateException("Appended event " + event.eventId() + " was not found");
            }
            appended.add(event.withSequence(sequence));
        }
        return appended;
    }

    @Override
    public List<DomainEvent> load(Connection conn, String aggregateId, long fromVersion) {
        String sql = "SELECT " + COLUMNS + " FROM " + table +
                " WHERE aggregate_id=? AND event_version>? ORDER BY event_version";
        return JdbcTemplate.query(conn, sql, eventMapper, aggregateId, fromVersion);
    }

    @Override
    public List<DomainEvent> loadAll(Connection conn, long fromSequence, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
        String sql = "SELECT " + COLUMNS + " FROM " + table +
                " WHERE event_sequence>=? ORDER BY event_sequence LIMIT ?";
        return JdbcTemplate.query(conn, sql, eventMapper, fromSequence, limit);
    }

    @Override
    public Optional<DomainEvent> findEvent(Connection conn, String eventId) {
        String sql = "SELECT " + COLUMNS + " FROM " + table + " WHERE event_id=?";
        return JdbcTemplate.queryOne(conn, sql, eventMapper, eventId);
    }

    @Override
    public long latestSequence(Connection conn) {
        return JdbcTemplate.queryLong(conn, "SELECT MAX(event_sequence) FROM " + table);
    }

    @Override
    public long currentVersion(Connection conn, String aggregateId) {
        return JdbcTemplate.queryLong(conn,
                "SELECT MAX(event_version) FROM " + table + " WHERE aggregate_id=?", aggregateId);
    }

    private DomainEvent mapEvent(ResultSet rs) throws SQLException {
        String eventId = rs.getString("event_id");
        Map<String, Object> payload;
        try {
            payload = jsonCodec.parseObject(rs.getString("payload"));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Stored payload of event " + eventId + " is not a JSON object", e);
        }
        return DomainEvent.builder(rs.getString("event_type"))
                .eventId(eventId)
                .aggregateId(rs.getString("aggregate_id"))
                .aggregateType(rs.getString("aggregate_type"))
                .version(rs.getLong("event_version"))
                .sequence(rs.getLong("event_sequence"))
                .schemaVersion(rs.getInt("schema_version"))
                .payload(payload)
                .occurredAt(rs.getTimestamp("occurred_at").toInstant())
                .build();
    }
}
