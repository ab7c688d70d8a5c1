package io.eventlog.model;

import java.time.Instant;

/**
 * Aggregated health counters for one projection.
 *
 * @param projectionName       projection name
 * @param healthStatus         status derived from {@code activeFailures}
 * @param totalEventsProcessed successful handlings over the projection's lifetime
 * @param totalFailures        distinct (event, projection) failures ever recorded
 * @param activeFailures       currently unresolved failures
 * @param lastSuccessAt        time of the last success, or {@code null}
 * @param lastFailureAt        time of the last failure, or {@code null}
 */
public record ProjectionHealthMetric(
        String projectionName,
        HealthStatus healthStatus,
        long totalEventsProcessed,
        long totalFailures,
        int activeFailures,
        Instant lastSuccessAt,
        Instant lastFailureAt) {

    /**
     * Metric for a projection that has not processed or failed anything yet.
     */
    public static ProjectionHealthMetric empty(String projectionName) {
        return new ProjectionHealthMetric(projectionName, HealthStatus.HEALTHY, 0, 0, 0, null, null);
    }
}
