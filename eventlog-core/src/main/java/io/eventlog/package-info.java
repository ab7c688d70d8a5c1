/**
 * Event-sourced aggregate persistence with read-model projections.
 *
 * <p>{@link io.eventlog.EventLog} is the entry point: it wires the stores, the
 * {@linkplain io.eventlog.publish.ProjectionPublisher publisher}, the
 * {@linkplain io.eventlog.tracking.ProjectionFailureTracker failure tracker}, the
 * {@linkplain io.eventlog.tracking.ProjectionRetryWorker retry worker} and the
 * {@linkplain io.eventlog.admin.ProjectionAdmin admin surface}. Aggregates extend
 * {@link io.eventlog.aggregate.Aggregate} and are loaded and saved through an
 * {@link io.eventlog.repository.AggregateRepository}.
 *
 * <p>Storage is pluggable through the SPIs in {@link io.eventlog.spi}; the
 * {@code eventlog-jdbc} module provides H2 and PostgreSQL implementations.
 */
package io.eventlog;
