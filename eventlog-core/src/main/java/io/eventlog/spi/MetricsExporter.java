package io.eventlog.spi;

/**
 * Observability hook for exporting event log and projection counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of events appended to the log.
     *
     * @param aggregateType aggregate type of the appended events
     * @param count         number of events appended
     */
    void incrementEventsAppended(String aggregateType, int count);

    /**
     * Increments the count of version conflicts seen on append (each retried attempt counts).
     *
     * @param aggregateType aggregate type of the contended aggregate
     */
    void incrementConcurrencyConflicts(String aggregateType);

    /**
     * Increments the count of events replayed while loading aggregates.
     */
    default void incrementEventsLoaded(String aggregateType, int count) {
    }

    /**
     * Increments the count of snapshots written.
     */
    default void incrementSnapshotsWritten(String aggregateType) {
    }

    /**
     * Increments the count of successful projection handlings.
     */
    void incrementProjectionSuccess(String projectionName);

    /**
     * Increments the count of projection failures recorded with the failure tracker.
     */
    void incrementProjectionFailure(String projectionName);

    /**
     * Increments the count of background retry attempts.
     */
    default void incrementProjectionRetries(String projectionName) {
    }

    /**
     * Records the current number of unresolved failures of a projection.
     */
    void recordActiveFailures(String projectionName, int activeFailures);

    /**
     * Records the time spent inside a projection handler.
     *
     * @param durationMs handler execution time in milliseconds (always non-negative)
     */
    default void recordHandlerDurationMs(String projectionName, long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEventsAppended(String aggregateType, int count) {
        }

        @Override
        public void incrementConcurrencyConflicts(String aggregateType) {
        }

        @Override
        public void incrementProjectionSuccess(String projectionName) {
        }

        @Override
        public void incrementProjectionFailure(String projectionName) {
        }

        @Override
        public void recordActiveFailures(String projectionName, int activeFailures) {
        }
    }
}
