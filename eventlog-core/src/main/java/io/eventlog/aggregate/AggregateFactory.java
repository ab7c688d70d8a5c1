package io.eventlog.aggregate;

/**
 * Creates empty aggregate instances for the repository to restore or replay into.
 *
 * @param <A> aggregate type
 */
@FunctionalInterface
public interface AggregateFactory<A extends Aggregate> {

    /**
     * Creates an aggregate with the given id at version 0.
     */
    A create(String id);
}
