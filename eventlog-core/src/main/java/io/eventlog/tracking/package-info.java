/**
 * Projection failure tracking, checkpoints, health metrics and the background retry worker.
 *
 * <p>{@link io.eventlog.tracking.ProjectionFailureTracker} persists every projection outcome;
 * {@link io.eventlog.tracking.ProjectionRetryWorker} periodically retries failures whose
 * {@code next_retry_at} has passed, re-reading the event from the event log.
 */
package io.eventlog.tracking;
