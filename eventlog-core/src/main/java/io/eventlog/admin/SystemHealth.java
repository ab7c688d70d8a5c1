package io.eventlog.admin;

import io.eventlog.model.HealthStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated health across all registered projections.
 *
 * @param overallStatus        {@link HealthStatus#CRITICAL} if any projection is critical or offline,
 *                             else {@link HealthStatus#DEGRADED} if any is degraded, else healthy
 * @param statusCounts         number of projections per status (every status present)
 * @param totalActiveFailures  sum of active failures
 * @param totalEventsProcessed sum of events processed
 * @param latestSequence       latest global sequence in the event log
 * @param projections          per-projection health, in registration order
 * @param checkedAt            when the health was computed
 */
public record SystemHealth(
        HealthStatus overallStatus,
        Map<HealthStatus, Integer> statusCounts,
        long totalActiveFailures,
        long totalEventsProcessed,
        long latestSequence,
        List<ProjectionHealth> projections,
        Instant checkedAt) {

    public SystemHealth {
        statusCounts = Collections.unmodifiableMap(new EnumMap<>(statusCounts));
        projections = List.copyOf(projections);
    }

    /**
     * Builds the system view from per-projection health.
     */
    public static SystemHealth of(List<ProjectionHealth> projections, long latestSequence, Instant checkedAt) {
        Map<HealthStatus, Integer> counts = new EnumMap<>(HealthStatus.class);
        for (HealthStatus status : HealthStatus.values()) {
            counts.put(status, 0);
        }
        long active = 0;
        long processed = 0;
        for (ProjectionHealth health : projections) {
            counts.merge(health.healthStatus(), 1, Integer::sum);
            active += health.activeFailures();
            processed += health.metric().totalEventsProcessed();
        }
        HealthStatus overall;
        if (counts.get(HealthStatus.CRITICAL) > 0 || counts.get(HealthStatus.OFFLINE) > 0) {
            overall = HealthStatus.CRITICAL;
        } else if (counts.get(HealthStatus.DEGRADED) > 0) {
            overall = HealthStatus.DEGRADED;
        } else {
            overall = HealthStatus.HEALTHY;
        }
        return new SystemHealth(overall, counts, active, processed, latestSequence, projections, checkedAt);
    }
}
