package io.eventlog.admin;

import io.eventlog.model.HealthStatus;
import io.eventlog.model.ProjectionCheckpoint;
import io.eventlog.model.ProjectionHealthMetric;

import java.time.Duration;
import java.util.Objects;

/**
 * Health of one projection as seen by operators.
 *
 * @param metric     stored health counters
 * @param checkpoint last durably processed event, or {@code null} if none
 * @param lagEvents  latest global sequence minus the checkpointed sequence
 * @param lag        time between the checkpointed event and the latest event
 */
public record ProjectionHealth(
        ProjectionHealthMetric metric,
        ProjectionCheckpoint checkpoint,
        long lagEvents,
        Duration lag) {

    public ProjectionHealth {
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(lag, "lag");
    }

    public String projectionName() {
        return metric.projectionName();
    }

    public HealthStatus healthStatus() {
        return metric.healthStatus();
    }

    public int activeFailures() {
        return metric.activeFailures();
    }
}
