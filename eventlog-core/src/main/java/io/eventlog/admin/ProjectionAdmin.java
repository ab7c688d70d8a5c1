package io.eventlog.admin;

import io.eventlog.DomainEvent;
import io.eventlog.model.ProjectionCheckpoint;
import io.eventlog.model.ProjectionFailure;
import io.eventlog.model.ProjectionHealthMetric;
import io.eventlog.model.ResolutionMethod;
import io.eventlog.projection.Projection;
import io.eventlog.projection.ProjectionRegistry;
import io.eventlog.spi.ConnectionProvider;
import io.eventlog.spi.EventLogStore;
import io.eventlog.spi.ProjectionStore;
import io.eventlog.tracking.ProjectionFailureTracker;
import io.eventlog.upcast.UpcasterRegistry;
import io.eventlog.util.Errors;
import io.eventlog.util.Transactions;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator surface for projection health and compensation.
 *
 * <p>Read operations report per-projection and system-wide health, checkpoints and failure
 * history. Write operations replay a sequence range into a projection, reset a projection
 * for a full rebuild, and resolve single failures. Every outcome of a write operation goes
 * through the {@link ProjectionFailureTracker}, so checkpoints and health stay consistent
 * with what the background worker and the publisher record.
 *
 * <p>Operations that take a projection name throw {@link UnknownProjectionException} when
 * no projection is registered under it. Create instances via {@link #builder()}.
 */
public final class ProjectionAdmin {
    private static final Logger logger = Logger.getLogger(ProjectionAdmin.class.getName());

    private final ConnectionProvider connectionProvider;
    private final EventLogStore eventLogStore;
    private final ProjectionStore projectionStore;
    private final ProjectionFailureTracker tracker;
    private final ProjectionRegistry projections;
    private final UpcasterRegistry upcasters;
    private final int replayBatchSize;
    private final Clock clock;

    private ProjectionAdmin(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.eventLogStore = Objects.requireNonNull(builder.eventLogStore, "eventLogStore");
        this.projectionStore = Objects.requireNonNull(builder.projectionStore, "projectionStore");
        this.tracker = Objects.requireNonNull(builder.tracker, "tracker");
        this.projections = Objects.requireNonNull(builder.projections, "projections");
        if (builder.replayBatchSize < 1) {
            throw new IllegalArgumentException("replayBatchSize must be >= 1");
        }
        this.replayBatchSize = builder.replayBatchSize;
        this.upcasters = builder.upcasters != null ? builder.upcasters : UpcasterRegistry.empty();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ── Reads ──

    public ProjectionHealth health(String projectionName) {
        require(projectionName);
        return Transactions.withConnection(connectionProvider, "read health of " + projectionName, conn -> {
            long latestSequence = eventLogStore.latestSequence(conn);
            return health(conn, projectionName, latestSequence, latestEvent(conn, latestSequence));
        });
    }

    /**
     * Health of every registered projection, in registration order.
     */
    public List<ProjectionHealth> health() {
        return Transactions.withConnection(connectionProvider, "read projection health", conn -> {
            long latestSequence = eventLogStore.latestSequence(conn);
            return allHealth(conn, latestSequence);
        });
    }

    public SystemHealth systemHealth() {
        return Transactions.withConnection(connectionProvider, "read system health", conn -> {
            long latestSequence = eventLogStore.latestSequence(conn);
            return SystemHealth.of(allHealth(conn, latestSequence), latestSequence, clock.instant());
        });
    }

    public Optional<ProjectionCheckpoint> checkpoint(String projectionName) {
        require(projectionName);
        return Transactions.withConnection(connectionProvider, "read checkpoint of " + projectionName,
                conn -> projectionStore.findCheckpoint(conn, projectionName));
    }

    /**
     * Failure history of a projection, newest first.
     *
     * @param includeResolved whether resolved failures are included
     * @param limit           maximum number of records
     */
    public List<ProjectionFailure> failures(String projectionName, boolean includeResolved, int limit) {
        require(projectionName);
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
        return Transactions.withConnection(connectionProvider, "read failures of " + projectionName,
                conn -> projectionStore.failures(conn, projectionName, includeResolved, limit));
    }

    public Optional<ProjectionFailure> failure(String failureId) {
        Objects.requireNonNull(failureId, "failureId");
        return Transactions.withConnection(connectionProvider, "read failure " + failureId,
                conn -> projectionStore.findFailure(conn, failureId));
    }

    private List<ProjectionHealth> allHealth(Connection conn, long latestSequence) {
        DomainEvent latest = latestEvent(conn, latestSequence);
        List<ProjectionHealth> result = new ArrayList<>();
        for (Projection projection : projections.all()) {
            result.add(health(conn, projection.name(), latestSequence, latest));
        }
        return result;
    }

    private ProjectionHealth health(Connection conn, String projectionName, long latestSequence, DomainEvent latest) {
        ProjectionHealthMetric metric = projectionStore.findHealth(conn, projectionName)
                .orElseGet(() -> ProjectionHealthMetric.empty(projectionName));
        ProjectionCheckpoint checkpoint = projectionStore.findCheckpoint(conn, projectionName).orElse(null);
        long processedSequence = checkpoint == null ? 0 : checkpoint.lastEventSequence();
        long lagEvents = Math.max(0, latestSequence - processedSequence);
        return new ProjectionHealth(metric, checkpoint, lagEvents, lag(conn, checkpoint, lagEvents, latest));
    }

    private Duration lag(Connection conn, ProjectionCheckpoint checkpoint, long lagEvents, DomainEvent latest) {
        if (lagEvents == 0 || latest == null) {
            return Duration.ZERO;
        }
        Instant processedUpTo;
        if (checkpoint == null) {
            List<DomainEvent> first = eventLogStore.loadAll(conn, 1, 1);
            processedUpTo = first.isEmpty() ? latest.occurredAt() : first.get(0).occurredAt();
        } else {
            processedUpTo = eventLogStore.findEvent(conn, checkpoint.lastEventId())
                    .map(DomainEvent::occurredAt)
                    .orElse(checkpoint.checkpointAt());
        }
        Duration lag = Duration.between(processedUpTo, latest.occurredAt());
        return lag.isNegative() ? Duration.ZERO : lag;
    }

    private DomainEvent latestEvent(Connection conn, long latestSequence) {
        if (latestSequence <= 0) {
            return null;
        }
        List<DomainEvent> events = eventLogStore.loadAll(conn, latestSequence, 1);
        return events.isEmpty() ? null : events.get(0);
    }

    // ── Writes ──

    /**
     * Replays a range of the global event log into one projection.
     *
     * <p>Each event is handled once; successes and failures are recorded through the
     * tracker (successes resolve matching failures as {@link ResolutionMethod#REPLAY}).
     * Events are upcast before they reach the projection. Events the projection does not
     * handle are passed over without being counted; a {@code canHandle} that throws counts
     * as a failure of that event.
     *
     * @param projectionName the projection to replay
     * @param fromSequence   first sequence, or {@code null} for the checkpoint + 1
     * @param toSequence     last sequence, or {@code null} for the latest sequence
     * @param skipFailed     skip events that have an unresolved failure for this projection
     * @return the replay report
     */
    public ReplayReport replay(String projectionName, Long fromSequence, Long toSequence, boolean skipFailed) {
        Projection projection = require(projectionName);
        Instant startedAt = clock.instant();
        long from;
        if (fromSequence != null) {
            from = fromSequence;
        } else {
            from = checkpoint(projectionName).map(cp -> cp.lastEventSequence() + 1).orElse(1L);
        }
        long to;
        if (toSequence != null) {
            to = toSequence;
        } else {
            Long latest = Transactions.withConnection(connectionProvider, "read latest sequence",
                    eventLogStore::latestSequence);
            to = latest;
        }
        if (from < 1) {
            throw new IllegalArgumentException("fromSequence must be >= 1, got: " + from);
        }
        logger.log(Level.INFO, "Replaying projection " + projectionName + " from sequence " + from + " to " + to);

        long replayed = 0;
        long skipped = 0;
        long failed = 0;
        long cursor = from;
        while (cursor <= to) {
            long batchStart = cursor;
            List<DomainEvent> batch = Transactions.withConnection(connectionProvider, "load events for replay",
                    conn -> eventLogStore.loadAll(conn, batchStart, replayBatchSize));
            if (batch.isEmpty()) {
                break;
            }
            for (DomainEvent stored : batch) {
                if (stored.sequence() > to) {
                    cursor = to + 1;
                    break;
                }
                cursor = stored.sequence() + 1;
                DomainEvent event = upcasters.upcast(stored);
                boolean handles;
                try {
                    handles = projection.canHandle(event);
                } catch (RuntimeException e) {
                    logger.log(Level.WARNING, "Projection " + projectionName + " could not decide on event "
                            + event.eventId() + " during replay", e);
                    tracker.recordFailure(event, projectionName, e);
                    failed++;
                    continue;
                }
                if (!handles) {
                    continue;
                }
                if (skipFailed && hasUnresolvedFailure(event, projectionName)) {
                    skipped++;
                    continue;
                }
                try {
                    projection.handle(event);
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Replay of event " + event.eventId() + " into projection "
                            + projectionName + " failed", e);
                    tracker.recordFailure(event, projectionName, e);
                    failed++;
                    continue;
                }
                tracker.recordSuccess(event, projectionName, ResolutionMethod.REPLAY);
                replayed++;
            }
            if (batch.size() < replayBatchSize) {
                break;
            }
        }

        ReplayReport.Status status = failed > 0
                ? ReplayReport.Status.COMPLETED_WITH_FAILURES : ReplayReport.Status.COMPLETED;
        logger.log(Level.INFO, "Replay of projection " + projectionName + " finished: " + replayed
                + " replayed, " + skipped + " skipped, " + failed + " failed");
        return new ReplayReport(projectionName, from, to, replayed, skipped, failed,
                startedAt, clock.instant(), status);
    }

    private boolean hasUnresolvedFailure(DomainEvent event, String projectionName) {
        return Transactions.withConnection(connectionProvider, "look up failure for event " + event.eventId(),
                conn -> projectionStore.findUnresolvedFailure(conn, event.eventId(), projectionName).isPresent());
    }

    /**
     * Clears a projection's read model and bookkeeping so it can be rebuilt by replay.
     *
     * <p>The projection's own {@link Projection#reset()} runs first; if it fails, the
     * checkpoint and failures are left untouched.
     *
     * @return number of open failures resolved as {@link ResolutionMethod#MANUAL_RESET}
     */
    public int reset(String projectionName) {
        Projection projection = require(projectionName);
        try {
            projection.reset();
        } catch (Exception e) {
            throw new IllegalStateException("Failed to reset read model of projection " + projectionName, e);
        }
        int resolved = tracker.reset(projectionName);
        logger.log(Level.WARNING, "Projection " + projectionName + " was reset; " + resolved
                + " open failure(s) resolved");
        return resolved;
    }

    /**
     * Resolves one failure with an operator-chosen strategy.
     *
     * @param failureId the failure id
     * @param strategy  how to resolve it
     * @return the outcome
     */
    public ResolveResult resolve(String failureId, ResolutionStrategy strategy) {
        Objects.requireNonNull(failureId, "failureId");
        Objects.requireNonNull(strategy, "strategy");
        Optional<ProjectionFailure> found = failure(failureId);
        if (found.isEmpty()) {
            return new ResolveResult.NotFound(failureId);
        }
        ProjectionFailure failure = found.get();
        if (failure.resolved()) {
            return new ResolveResult.AlreadyResolved(failureId, failure.resolutionMethod(), failure.resolvedAt());
        }
        if (strategy == ResolutionStrategy.RETRY) {
            return retry(failure);
        }
        if (!tracker.resolve(failureId, strategy.method())) {
            return alreadyResolved(failureId);
        }
        logger.log(Level.INFO, "Failure " + failureId + " of projection " + failure.projectionName()
                + " resolved as " + strategy.method().code());
        return new ResolveResult.Resolved(failureId, strategy.method());
    }

    private ResolveResult retry(ProjectionFailure failure) {
        Projection projection = require(failure.projectionName());
        Optional<DomainEvent> event = Transactions.withConnection(connectionProvider,
                "load event " + failure.eventId(),
                conn -> eventLogStore.findEvent(conn, failure.eventId()).map(upcasters::upcast));
        if (event.isEmpty()) {
            return new ResolveResult.RetryFailed(failure.id(),
                    "Event " + failure.eventId() + " no longer exists in the event log");
        }
        try {
            projection.handle(event.get());
        } catch (Exception e) {
            logger.log(Level.WARNING, "Manual retry of failure " + failure.id() + " failed", e);
            tracker.recordFailure(event.get(), failure.projectionName(), e);
            return new ResolveResult.RetryFailed(failure.id(), Errors.message(e));
        }
        tracker.recordSuccess(event.get(), failure.projectionName(), ResolutionMethod.MANUAL_RETRY);
        return new ResolveResult.Resolved(failure.id(), ResolutionMethod.MANUAL_RETRY);
    }

    private ResolveResult alreadyResolved(String failureId) {
        ProjectionFailure current = failure(failureId).orElseThrow(() ->
                new IllegalStateException("Failure " + failureId + " disappeared while resolving"));
        return new ResolveResult.AlreadyResolved(failureId, current.resolutionMethod(), current.resolvedAt());
    }

    private Projection require(String projectionName) {
        Objects.requireNonNull(projectionName, "projectionName");
        return projections.find(projectionName).orElseThrow(() -> new UnknownProjectionException(projectionName));
    }

    /**
     * Builder for {@link ProjectionAdmin}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private EventLogStore eventLogStore;
        private ProjectionStore projectionStore;
        private ProjectionFailureTracker tracker;
        private ProjectionRegistry projections;
        private int replayBatchSize = 500;
        private UpcasterRegistry upcasters;
        private Clock clock;

        private Builder() {
        }

        /** <b>Required.</b> */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /** <b>Required.</b> */
        public Builder eventLogStore(EventLogStore eventLogStore) {
            this.eventLogStore = eventLogStore;
            return this;
        }

        /** <b>Required.</b> */
        public Builder projectionStore(ProjectionStore projectionStore) {
            this.projectionStore = projectionStore;
            return this;
        }

        /** <b>Required.</b> */
        public Builder tracker(ProjectionFailureTracker tracker) {
            this.tracker = tracker;
            return this;
        }

        /** <b>Required.</b> */
        public Builder projections(ProjectionRegistry projections) {
            this.projections = projections;
            return this;
        }

        /**
         * Sets the number of events loaded per replay batch.
         *
         * <p>Optional. Defaults to {@code 500}. Must be &ge; 1.
         *
         * @param replayBatchSize events per batch
         * @return this builder
         */
        public Builder replayBatchSize(int replayBatchSize) {
            this.replayBatchSize = replayBatchSize;
            return this;
        }

        /**
         * Sets the upcasters applied to events read back for replay and manual retry.
         *
         * <p>Optional. Defaults to {@link UpcasterRegistry#empty()}.
         */
        public Builder upcasters(UpcasterRegistry upcasters) {
            this.upcasters = upcasters;
            return this;
        }

        /**
         * Optional. Defaults to {@link Clock#systemUTC()}.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ProjectionAdmin build() {
            return new ProjectionAdmin(this);
        }
    }
}
