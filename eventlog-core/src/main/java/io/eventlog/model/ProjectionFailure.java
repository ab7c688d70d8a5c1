package io.eventlog.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A failed attempt of one projection to handle one event.
 *
 * <p>At most one unresolved record exists per {@code (eventId, projectionName)} pair; it
 * is updated in place on each further failure. {@code nextRetryAt} is {@code null} once
 * the retry budget is exhausted, leaving the failure for manual resolution.
 *
 * @param id               failure identifier
 * @param eventId          the event that failed
 * @param eventType        type of the failed event
 * @param projectionName   the projection that failed
 * @param errorMessage     last error message (truncated)
 * @param errorTrace       last stack trace (truncated)
 * @param retryCount       number of retries after the first failure
 * @param maxRetries       retry budget for the background worker
 * @param failedAt         time of the most recent failure
 * @param nextRetryAt      when the background worker may retry, or {@code null}
 * @param resolvedAt       resolution time, or {@code null} while active
 * @param resolutionMethod how it was resolved, or {@code null} while active
 */
public record ProjectionFailure(
        String id,
        String eventId,
        String eventType,
        String projectionName,
        String errorMessage,
        String errorTrace,
        int retryCount,
        int maxRetries,
        Instant failedAt,
        Instant nextRetryAt,
        Instant resolvedAt,
        ResolutionMethod resolutionMethod) {

    public ProjectionFailure {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(projectionName, "projectionName");
        Objects.requireNonNull(failedAt, "failedAt");
    }

    public boolean resolved() {
        return resolvedAt != null;
    }

    /**
     * Returns whether the background worker may still retry this failure at {@code now}.
     */
    public boolean dueForRetry(Instant now) {
        return !resolved() && nextRetryAt != null && !nextRetryAt.isAfter(now) && retryCount < maxRetries;
    }
}
