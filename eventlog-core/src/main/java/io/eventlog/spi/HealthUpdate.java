package io.eventlog.spi;

import io.eventlog.model.HealthStatus;

import java.time.Instant;
import java.util.Objects;

/**
 * Incremental change applied to a projection's health row by
 * {@link ProjectionStore#saveHealth}.
 *
 * @param projectionName        projection name
 * @param healthStatus          newly derived status
 * @param eventsProcessedDelta  added to {@code total_events_processed}
 * @param failuresDelta         added to {@code total_failures}
 * @param activeFailures        replaces {@code active_failures}
 * @param successAt             replaces {@code last_success_at} when non-null
 * @param failureAt             replaces {@code last_failure_at} when non-null
 */
public record HealthUpdate(
        String projectionName,
        HealthStatus healthStatus,
        long eventsProcessedDelta,
        long failuresDelta,
        int activeFailures,
        Instant successAt,
        Instant failureAt) {

    public HealthUpdate {
        Objects.requireNonNull(projectionName, "projectionName");
        Objects.requireNonNull(healthStatus, "healthStatus");
    }
}
