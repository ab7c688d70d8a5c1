package io.eventlog.spi;

import io.eventlog.DomainEvent;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link EventLogStore#append}.
 *
 * <ul>
 *   <li>{@link Appended}: events were written; they carry their assigned versions and sequences.</li>
 *   <li>{@link VersionConflict}: the aggregate's stored version did not match the expected
 *       version; nothing was written.</li>
 * </ul>
 */
public sealed interface AppendResult permits AppendResult.Appended, AppendResult.VersionConflict {

    /**
     * Events were appended.
     *
     * @param events the appended events in version order, with store-assigned sequences
     */
    record Appended(List<DomainEvent> events) implements AppendResult {
        public Appended {
            events = List.copyOf(Objects.requireNonNull(events, "events"));
        }
    }

    /**
     * Another writer got there first.
     *
     * @param aggregateId     the contended aggregate
     * @param expectedVersion version the caller based its events on
     * @param actualVersion   version found in the store
     */
    record VersionConflict(String aggregateId, long expectedVersion, long actualVersion) implements AppendResult {
        public VersionConflict {
            Objects.requireNonNull(aggregateId, "aggregateId");
        }
    }
}
