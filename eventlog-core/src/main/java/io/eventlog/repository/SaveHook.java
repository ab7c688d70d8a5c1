package io.eventlog.repository;

import io.eventlog.DomainEvent;

import java.util.List;

/**
 * Callback invoked by {@link AggregateRepository#save} after the append transaction commits.
 *
 * @see io.eventlog.publish.PublisherSaveHook
 */
@FunctionalInterface
public interface SaveHook {

    /**
     * Hook that does nothing.
     */
    SaveHook NOOP = events -> {
    };

    /**
     * Receives the appended events, in version order, with their global sequences.
     */
    void afterSave(List<DomainEvent> events);
}
