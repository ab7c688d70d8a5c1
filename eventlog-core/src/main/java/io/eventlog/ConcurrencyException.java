package io.eventlog;

/**
 * Raised when an aggregate could not be saved because another writer appended events
 * first, even after the repository's bounded retries.
 *
 * <p>This is a retryable business error: the caller should reload the aggregate and
 * re-run the originating command.
 *
 * @see io.eventlog.repository.SaveResult#orThrow()
 */
public final class ConcurrencyException extends RuntimeException {
    private final String aggregateId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyException(String aggregateId, long expectedVersion, long actualVersion) {
        super("Concurrent modification of aggregate " + aggregateId
                + ": expected version " + expectedVersion + ", actual " + actualVersion);
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String aggregateId() {
        return aggregateId;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    public long actualVersion() {
        return actualVersion;
    }
}
