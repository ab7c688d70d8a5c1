package io.eventlog.testing;

import io.eventlog.model.Snapshot;
import io.eventlog.spi.SnapshotStore;

import java.sql.Connection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * SnapshotStore keeping the latest snapshot per aggregate in memory.
 */
public final class InMemorySnapshotStore implements SnapshotStore {
    private final Map<String, Snapshot> snapshots = new ConcurrentHashMap<>();
    private final List<Snapshot> saved = new CopyOnWriteArrayList<>();
    private volatile boolean failOnSave;

    @Override
    public void save(Connection conn, Snapshot snapshot) {
        if (failOnSave) {
            throw new IllegalStateException("snapshot storage is full");
        }
        saved.add(snapshot);
        snapshots.merge(snapshot.aggregateId(), snapshot,
                (current, next) -> next.version() >= current.version() ? next : current);
    }

    @Override
    public Optional<Snapshot> load(Connection conn, String aggregateId) {
        return Optional.ofNullable(snapshots.get(aggregateId));
    }

    @Override
    public boolean delete(Connection conn, String aggregateId) {
        return snapshots.remove(aggregateId) != null;
    }

    /**
     * Replaces a snapshot without any checks.
     */
    public void put(Snapshot snapshot) {
        snapshots.put(snapshot.aggregateId(), snapshot);
    }

    public List<Snapshot> saved() {
        return List.copyOf(saved);
    }

    public void failOnSave(boolean failOnSave) {
        this.failOnSave = failOnSave;
    }
}
