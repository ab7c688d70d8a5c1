package io.eventlog.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Full-state capture of an aggregate at a given version.
 *
 * @param aggregateId   aggregate identifier
 * @param aggregateType aggregate type name
 * @param version       aggregate version the state corresponds to
 * @param schemaVersion state schema version, used for upcasting
 * @param state         structured aggregate state
 * @param createdAt     when the snapshot was taken
 */
public record Snapshot(
        String aggregateId,
        String aggregateType,
        long version,
        int schemaVersion,
        Map<String, Object> state,
        Instant createdAt) {

    public Snapshot {
        Objects.requireNonNull(aggregateId, "aggregateId");
        Objects.requireNonNull(aggregateType, "aggregateType");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(createdAt, "createdAt");
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1, got: " + version);
        }
        if (schemaVersion < 1) {
            throw new IllegalArgumentException("schemaVersion must be >= 1, got: " + schemaVersion);
        }
        state = Collections.unmodifiableMap(new LinkedHashMap<>(state));
    }

    /**
     * Returns a copy carrying a state migrated to a newer schema version.
     */
    public Snapshot withState(Map<String, Object> state, int schemaVersion) {
        return new Snapshot(aggregateId, aggregateType, version, schemaVersion, state, createdAt);
    }
}
