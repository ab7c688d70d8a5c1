package io.eventlog.upcast;

import io.eventlog.DomainEvent;
import io.eventlog.model.Snapshot;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of event and snapshot upcasters, keyed by {@code (type, fromSchemaVersion)}.
 *
 * <p>{@link #upcast(DomainEvent)} and {@link #upcast(Snapshot)} apply consecutive upcasters
 * until no step is registered for the current version. A missing step leaves the payload
 * at its stored version.
 *
 * <p>This class is thread-safe.
 */
public final class UpcasterRegistry {
    private final Map<String, Upcaster> eventUpcasters = new ConcurrentHashMap<>();
    private final Map<String, Upcaster> snapshotUpcasters = new ConcurrentHashMap<>();

    /**
     * Returns an empty registry.
     */
    public static UpcasterRegistry empty() {
        return new UpcasterRegistry();
    }

    /**
     * Registers an event payload upcaster.
     *
     * @return this registry
     * @throws IllegalArgumentException if a step for the same event type and version exists
     */
    public UpcasterRegistry registerEvent(Upcaster upcaster) {
        register(eventUpcasters, upcaster, "event");
        return this;
    }

    /**
     * Registers a snapshot state upcaster; {@link Upcaster#type()} is the aggregate type.
     *
     * @return this registry
     * @throws IllegalArgumentException if a step for the same aggregate type and version exists
     */
    public UpcasterRegistry registerSnapshot(Upcaster upcaster) {
        register(snapshotUpcasters, upcaster, "snapshot");
        return this;
    }

    /**
     * Brings an event payload to the newest registered schema version.
     */
    public DomainEvent upcast(DomainEvent event) {
        Objects.requireNonNull(event, "event");
        int version = event.schemaVersion();
        Map<String, Object> payload = event.payload();
        Upcaster step;
        while ((step = eventUpcasters.get(key(event.eventType(), version))) != null) {
            payload = step.upcast(payload);
            version++;
        }
        return version == event.schemaVersion() ? event : event.withPayload(payload, version);
    }

    /**
     * Brings snapshot state to the newest registered schema version.
     */
    public Snapshot upcast(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        int version = snapshot.schemaVersion();
        Map<String, Object> state = snapshot.state();
        Upcaster step;
        while ((step = snapshotUpcasters.get(key(snapshot.aggregateType(), version))) != null) {
            state = step.upcast(state);
            version++;
        }
        return version == snapshot.schemaVersion() ? snapshot : snapshot.withState(state, version);
    }

    private static void register(Map<String, Upcaster> target, Upcaster upcaster, String kind) {
        Objects.requireNonNull(upcaster, "upcaster");
        Objects.requireNonNull(upcaster.type(), "type");
        if (upcaster.fromSchemaVersion() < 1) {
            throw new IllegalArgumentException("fromSchemaVersion must be >= 1, got: " + upcaster.fromSchemaVersion());
        }
        String key = key(upcaster.type(), upcaster.fromSchemaVersion());
        if (target.putIfAbsent(key, upcaster) != null) {
            throw new IllegalArgumentException("Duplicate " + kind + " upcaster for " + upcaster.type()
                    + " v" + upcaster.fromSchemaVersion());
        }
    }

    private static String key(String type, int version) {
        return type + "#" + version;
    }
}
