package io.eventlog;

/**
 * Thrown by {@link io.eventlog.repository.AggregateRepository#get(String)} when neither
 * a snapshot nor any event exists for the requested aggregate.
 */
public final class AggregateNotFoundException extends RuntimeException {
    private final String aggregateId;

    public AggregateNotFoundException(String aggregateId) {
        super("Aggregate not found: " + aggregateId);
        this.aggregateId = aggregateId;
    }

    public String aggregateId() {
        return aggregateId;
    }
}
