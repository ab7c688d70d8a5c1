package io.eventlog.model;

import java.time.Instant;

/**
 * The last event a projection has durably processed.
 *
 * @param projectionName    projection name (one row per projection)
 * @param lastEventId       id of the furthest event handled
 * @param lastEventType     type of the furthest event handled
 * @param lastEventSequence global sequence of the furthest event handled; never decreases
 * @param eventsProcessed   number of successful handlings, replays included
 * @param checkpointAt      time of the last update
 */
public record ProjectionCheckpoint(
        String projectionName,
        String lastEventId,
        String lastEventType,
        long lastEventSequence,
        long eventsProcessed,
        Instant checkpointAt) {
}
