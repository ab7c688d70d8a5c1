package io.eventlog.aggregate;

import io.eventlog.DomainEvent;
import io.eventlog.model.Snapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for event-sourced aggregates.
 *
 * <p>State changes happen only through {@link #raise}: the event is applied via
 * {@link #when(DomainEvent)} and queued as pending until the
 * {@linkplain io.eventlog.repository.AggregateRepository repository} appends it.
 * {@link #version()} always equals the number of events ever applied, pending ones included.
 *
 * <p>Subclasses implement {@link #serializeState()} and {@link #restoreState(Map)} so that
 * restoring a snapshot yields the same observable state as replaying every event.
 * {@code restoreState} must default fields that are absent from older snapshots.
 *
 * <p>Instances are not thread-safe.
 */
public abstract class Aggregate {
    private final String id;
    private long version;
    private final List<DomainEvent> pendingEvents = new ArrayList<>();

    protected Aggregate(String id) {
        this.id = Objects.requireNonNull(id, "id");
        if (id.isEmpty()) {
            throw new IllegalArgumentException("id cannot be empty");
        }
    }

    /**
     * Type name recorded on every event and snapshot of this aggregate (e.g. {@code "Document"}).
     */
    public abstract String aggregateType();

    /**
     * Mutates in-memory state for one event. Called for new and replayed events alike;
     * must not raise further events.
     */
    protected abstract void when(DomainEvent event);

    /**
     * Serializes every field needed to rebuild this aggregate without replay.
     */
    public abstract Map<String, Object> serializeState();

    /**
     * Restores state written by {@link #serializeState()}, defaulting missing fields.
     *
     * @throws RuntimeException if the state has an unexpected shape
     */
    public abstract void restoreState(Map<String, Object> state);

    /**
     * Schema version of the map returned by {@link #serializeState()}.
     */
    public int stateSchemaVersion() {
        return 1;
    }

    public final String id() {
        return id;
    }

    public final long version() {
        return version;
    }

    /**
     * Events raised since the last successful save, oldest first.
     */
    public final List<DomainEvent> pendingEvents() {
        return Collections.unmodifiableList(new ArrayList<>(pendingEvents));
    }

    /**
     * Applies a new event and queues it for the next save.
     *
     * @param eventType event type name
     * @param payload   event payload
     * @return the raised event
     */
    protected final DomainEvent raise(String eventType, Map<String, Object> payload) {
        DomainEvent event = DomainEvent.builder(eventType)
                .aggregateId(id)
                .aggregateType(aggregateType())
                .version(version + 1)
                .payload(payload)
                .build();
        when(event);
        version = event.version();
        pendingEvents.add(event);
        return event;
    }

    /**
     * Applies a stored event during replay.
     *
     * @throws IllegalStateException if the event does not directly follow the current version
     */
    public final void applyEvent(DomainEvent event) {
        Objects.requireNonNull(event, "event");
        if (!id.equals(event.aggregateId())) {
            throw new IllegalArgumentException("Event " + event.eventId()
                    + " belongs to aggregate " + event.aggregateId() + ", not " + id);
        }
        if (event.version() != version + 1) {
            throw new IllegalStateException("Out-of-order event for aggregate " + id
                    + ": expected version " + (version + 1) + ", got " + event.version());
        }
        when(event);
        version = event.version();
    }

    /**
     * Captures the current state as a snapshot at the current version.
     */
    public final Snapshot toSnapshot() {
        return new Snapshot(id, aggregateType(), version, stateSchemaVersion(), serializeState(), Instant.now());
    }

    /**
     * Restores state and version from a snapshot. Only valid on a fresh instance.
     */
    public final void restore(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        if (version != 0 || !pendingEvents.isEmpty()) {
            throw new IllegalStateException("Snapshot can only be restored into a fresh aggregate");
        }
        restoreState(snapshot.state());
        version = snapshot.version();
    }

    /**
     * Clears pending events after they have been appended.
     */
    public final void markCommitted() {
        pendingEvents.clear();
    }
}
