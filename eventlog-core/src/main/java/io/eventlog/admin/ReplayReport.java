package io.eventlog.admin;

import java.time.Instant;

/**
 * Result of {@link ProjectionAdmin#replay}.
 *
 * @param projectionName the replayed projection
 * @param fromSequence   first global sequence considered
 * @param toSequence     last global sequence considered
 * @param eventsReplayed events the projection handled successfully
 * @param eventsSkipped  events skipped because they had an unresolved failure
 * @param eventsFailed   events whose handling failed (recorded as failures)
 * @param startedAt      replay start
 * @param completedAt    replay end
 * @param status         overall outcome
 */
public record ReplayReport(
        String projectionName,
        long fromSequence,
        long toSequence,
        long eventsReplayed,
        long eventsSkipped,
        long eventsFailed,
        Instant startedAt,
        Instant completedAt,
        Status status) {

    public enum Status {
        COMPLETED,
        COMPLETED_WITH_FAILURES
    }
}
