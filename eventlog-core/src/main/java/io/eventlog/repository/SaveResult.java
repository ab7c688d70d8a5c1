package io.eventlog.repository;

import io.eventlog.ConcurrencyException;
import io.eventlog.DomainEvent;
import io.eventlog.spi.AppendResult;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link AggregateRepository#save}.
 *
 * <ul>
 *   <li>{@link Saved}: pending events were appended (or there were none).</li>
 *   <li>{@link Conflict}: another writer kept winning until the retry budget ran out; the
 *       caller should reload the aggregate and re-run its command.</li>
 * </ul>
 */
public sealed interface SaveResult permits SaveResult.Saved, SaveResult.Conflict {

    /**
     * Returns the saved result, or throws {@link ConcurrencyException} for a conflict.
     *
     * @return this result as {@link Saved}
     * @throws ConcurrencyException if the save lost to a concurrent writer
     */
    default Saved orThrow() {
        if (this instanceof Conflict conflict) {
            AppendResult.VersionConflict c = conflict.conflict();
            throw new ConcurrencyException(c.aggregateId(), c.expectedVersion(), c.actualVersion());
        }
        return (Saved) this;
    }

    /**
     * Events were appended.
     *
     * @param aggregateId the saved aggregate
     * @param version     the aggregate version after the save
     * @param events      the appended events with their global sequences
     */
    record Saved(String aggregateId, long version, List<DomainEvent> events) implements SaveResult {
        public Saved {
            Objects.requireNonNull(aggregateId, "aggregateId");
            events = List.copyOf(events);
        }
    }

    /**
     * The save lost to a concurrent writer.
     *
     * @param conflict the last version conflict seen
     * @param attempts number of append attempts made
     */
    record Conflict(AppendResult.VersionConflict conflict, int attempts) implements SaveResult {
        public Conflict {
            Objects.requireNonNull(conflict, "conflict");
        }
    }
}
