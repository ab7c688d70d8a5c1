package io.eventlog.projection;

import io.eventlog.DomainEvent;

/**
 * A read model built by folding events.
 *
 * <p>{@link #handle(DomainEvent)} must be idempotent: handling the same event twice (inline
 * retry, background retry, replay) must leave the read model as if it were handled once,
 * typically by upserting rows keyed by the domain entity id.
 *
 * @see EventTypeProjection
 * @see ProjectionRegistry
 */
public interface Projection {

    /**
     * Unique name used for checkpoints, failure records and health metrics.
     */
    String name();

    /**
     * Returns whether this projection is interested in the event.
     */
    boolean canHandle(DomainEvent event);

    /**
     * Applies the event to the read model.
     *
     * @param event the event to apply
     * @throws Exception on any failure; the event will be retried and tracked
     */
    void handle(DomainEvent event) throws Exception;

    /**
     * Discards the whole read model before a rebuild. Projections without owned storage
     * keep the default no-op.
     *
     * @throws Exception if the read model cannot be cleared
     */
    default void reset() throws Exception {
    }
}
