package io.eventlog.spi;

import io.eventlog.model.Snapshot;

import java.sql.Connection;
import java.util.Optional;

/**
 * Stores the latest full-state snapshot per aggregate.
 *
 * @see io.eventlog.jdbc.JdbcSnapshotStore
 */
public interface SnapshotStore {

    /**
     * Inserts or replaces the snapshot for {@code snapshot.aggregateId()}.
     */
    void save(Connection conn, Snapshot snapshot);

    /**
     * Loads the latest snapshot of an aggregate.
     *
     * @throws io.eventlog.SnapshotCorruptionException if the stored state cannot be decoded
     */
    Optional<Snapshot> load(Connection conn, String aggregateId);

    /**
     * Deletes the snapshot of an aggregate.
     *
     * @return {@code true} if a snapshot was deleted
     */
    boolean delete(Connection conn, String aggregateId);
}
