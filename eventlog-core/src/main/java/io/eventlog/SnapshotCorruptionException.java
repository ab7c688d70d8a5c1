package io.eventlog;

/**
 * Thrown when a stored snapshot cannot be decoded or restored.
 *
 * <p>Indicates storage-format drift that requires operator intervention. It is never
 * converted into a default-valued aggregate.
 */
public final class SnapshotCorruptionException extends RuntimeException {
    private final String aggregateId;

    public SnapshotCorruptionException(String aggregateId, String message, Throwable cause) {
        super("Corrupt snapshot for aggregate " + aggregateId + ": " + message, cause);
        this.aggregateId = aggregateId;
    }

    public String aggregateId() {
        return aggregateId;
    }
}
