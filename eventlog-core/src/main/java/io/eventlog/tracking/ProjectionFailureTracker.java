package io.eventlog.tracking;

import com.github.f4b6a3.ulid.UlidCreator;
import io.eventlog.DomainEvent;
import io.eventlog.model.HealthStatus;
import io.eventlog.model.ProjectionFailure;
import io.eventlog.model.ResolutionMethod;
import io.eventlog.spi.ConnectionProvider;
import io.eventlog.spi.HealthUpdate;
import io.eventlog.spi.MetricsExporter;
import io.eventlog.spi.ProjectionStore;
import io.eventlog.util.Errors;
import io.eventlog.util.Transactions;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Records projection outcomes: failure records with a retry schedule, checkpoints and
 * per-projection health.
 *
 * <p>Every call runs in its own transaction and recomputes the projection's
 * {@code active_failures} and {@link HealthStatus} in that same transaction.
 *
 * <h2>Retry schedule</h2>
 * <p>A new failure starts with {@code retryCount = 0}; each further failure of the same
 * (event, projection) pair increments it. The next attempt is due after
 * {@code schedule[min(retryCount, schedule.size() - 1)]} (default 1, 2, 4, 8, 16 seconds).
 * Once {@code retryCount} reaches {@code maxRetries} no further retry is scheduled and the
 * failure waits for manual resolution while counting against health.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see ProjectionRetryWorker
 */
public final class ProjectionFailureTracker {
    private static final Logger logger = Logger.getLogger(ProjectionFailureTracker.class.getName());

    /** Default delays before background retries: 1, 2, 4, 8, 16 seconds. */
    public static final List<Duration> DEFAULT_RETRY_SCHEDULE = List.of(
            Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4),
            Duration.ofSeconds(8), Duration.ofSeconds(16));

    private final ConnectionProvider connectionProvider;
    private final ProjectionStore projectionStore;
    private final List<Duration> retrySchedule;
    private final int maxRetries;
    private final int batchSize;
    private final MetricsExporter metrics;
    private final Clock clock;

    private ProjectionFailureTracker(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.projectionStore = Objects.requireNonNull(builder.projectionStore, "projectionStore");
        List<Duration> schedule = builder.retrySchedule == null ? DEFAULT_RETRY_SCHEDULE : List.copyOf(builder.retrySchedule);
        if (schedule.isEmpty()) {
            throw new IllegalArgumentException("retrySchedule must not be empty");
        }
        for (Duration delay : schedule) {
            if (delay.isNegative()) {
                throw new IllegalArgumentException("retrySchedule must not contain negative delays");
            }
        }
        if (builder.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        this.retrySchedule = schedule;
        this.maxRetries = builder.maxRetries;
        this.batchSize = builder.batchSize;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Records a failed handling of {@code event} by {@code projectionName}.
     *
     * <p>Updates the unresolved failure for this (event, projection) pair if one exists,
     * otherwise creates one.
     *
     * @param event          the event that could not be handled
     * @param projectionName the failing projection
     * @param error          the cause
     * @return the id of the created or updated failure record
     * @throws io.eventlog.StoreUnavailableException if the failure could not be persisted
     */
    public String recordFailure(DomainEvent event, String projectionName, Throwable error) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(projectionName, "projectionName");
        Instant now = clock.instant();
        String message = Errors.message(error);
        String trace = Errors.stackTrace(error);

        String failureId = Transactions.inTransaction(connectionProvider, "record projection failure", conn -> {
            Optional<ProjectionFailure> existing =
                    projectionStore.findUnresolvedFailure(conn, event.eventId(), projectionName);
            long newFailures;
            String id;
            if (existing.isPresent()) {
                ProjectionFailure previous = existing.get();
                int retryCount = previous.retryCount() + 1;
                projectionStore.updateFailure(conn, new ProjectionFailure(
                        previous.id(), previous.eventId(), previous.eventType(), projectionName,
                        message, trace, retryCount, previous.maxRetries(), now,
                        nextRetryAt(now, retryCount, previous.maxRetries()), null, null));
                id = previous.id();
                newFailures = 0;
            } else {
                id = UlidCreator.getMonotonicUlid().toString();
                projectionStore.insertFailure(conn, new ProjectionFailure(
                        id, event.eventId(), event.eventType(), projectionName,
                        message, trace, 0, maxRetries, now,
                        nextRetryAt(now, 0, maxRetries), null, null));
                newFailures = 1;
            }
            refreshHealth(conn, projectionName, 0, newFailures, null, now);
            return id;
        });
        metrics.incrementProjectionFailure(projectionName);
        return failureId;
    }

    /**
     * Records a successful handling and resolves a prior failure of the same event as
     * {@link ResolutionMethod#AUTO_RETRY}.
     */
    public void recordSuccess(DomainEvent event, String projectionName) {
        recordSuccess(event, projectionName, ResolutionMethod.AUTO_RETRY);
    }

    /**
     * Records a successful handling: advances the checkpoint, resolves any unresolved failure
     * for this exact event with {@code resolution}, and recomputes health.
     *
     * @param event          the handled event (must carry its global sequence)
     * @param projectionName the projection that handled it
     * @param resolution     method recorded on a resolved failure
     */
    public void recordSuccess(DomainEvent event, String projectionName, ResolutionMethod resolution) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(projectionName, "projectionName");
        Objects.requireNonNull(resolution, "resolution");
        Instant now = clock.instant();
        Transactions.inTransaction(connectionProvider, "record projection success", conn -> {
            projectionStore.saveCheckpoint(conn, projectionName, event, now);
            int resolved = projectionStore.resolveFailures(conn, event.eventId(), projectionName, now, resolution);
            if (resolved > 0) {
                logger.log(Level.INFO, "Resolved failure of projection " + projectionName
                        + " for event " + event.eventId() + " (" + resolution.code() + ")");
            }
            refreshHealth(conn, projectionName, 1, 0, now, null);
            return null;
        });
        metrics.incrementProjectionSuccess(projectionName);
    }

    /**
     * Counts a retry that could not run at all against the failure's budget, for example
     * when its projection is not registered or its event is missing from the log.
     *
     * <p>The failure moves back in the retry queue by the regular schedule; once the budget
     * is spent it stays unresolved without a next retry time.
     *
     * @param failureId the failure that was due
     * @param reason    stored as the failure's error message
     * @return {@code true} if an unresolved failure was updated
     */
    public boolean deferFailure(String failureId, String reason) {
        Objects.requireNonNull(failureId, "failureId");
        Objects.requireNonNull(reason, "reason");
        Instant now = clock.instant();
        return Transactions.inTransaction(connectionProvider, "defer projection failure", conn -> {
            Optional<ProjectionFailure> found = projectionStore.findFailure(conn, failureId);
            if (found.isEmpty() || found.get().resolved()) {
                return false;
            }
            ProjectionFailure previous = found.get();
            int retryCount = previous.retryCount() + 1;
            projectionStore.updateFailure(conn, new ProjectionFailure(
                    previous.id(), previous.eventId(), previous.eventType(), previous.projectionName(),
                    Errors.truncate(reason), previous.errorTrace(), retryCount, previous.maxRetries(), now,
                    nextRetryAt(now, retryCount, previous.maxRetries()), null, null));
            return true;
        });
    }

    /**
     * Returns unresolved failures whose next retry is due and whose retry budget is not
     * exhausted, oldest due first, at most {@code batchSize}.
     */
    public List<ProjectionFailure> failuresDueForRetry() {
        Instant now = clock.instant();
        return Transactions.withConnection(connectionProvider, "query failures due for retry",
                conn -> projectionStore.failuresDueForRetry(conn, now, batchSize));
    }

    /**
     * Resolves one failure manually.
     *
     * @return {@code true} if the failure was unresolved and is now resolved
     */
    public boolean resolve(String failureId, ResolutionMethod method) {
        Objects.requireNonNull(failureId, "failureId");
        Objects.requireNonNull(method, "method");
        Instant now = clock.instant();
        return Transactions.inTransaction(connectionProvider, "resolve projection failure", conn -> {
            Optional<ProjectionFailure> failure = projectionStore.findFailure(conn, failureId);
            if (failure.isEmpty()) {
                return false;
            }
            if (projectionStore.resolveFailure(conn, failureId, now, method) == 0) {
                return false;
            }
            refreshHealth(conn, failure.get().projectionName(), 0, 0, null, null);
            return true;
        });
    }

    /**
     * Clears a projection's bookkeeping for a rebuild: deletes its checkpoint, resolves all
     * open failures as {@link ResolutionMethod#MANUAL_RESET}, and recomputes health.
     *
     * @return number of failures that were resolved
     */
    public int reset(String projectionName) {
        Objects.requireNonNull(projectionName, "projectionName");
        Instant now = clock.instant();
        return Transactions.inTransaction(connectionProvider, "reset projection " + projectionName, conn -> {
            projectionStore.deleteCheckpoint(conn, projectionName);
            int resolved = projectionStore.resolveAllFailures(conn, projectionName, now, ResolutionMethod.MANUAL_RESET);
            refreshHealth(conn, projectionName, 0, 0, null, null);
            return resolved;
        });
    }

    /**
     * Delay before the retry that follows {@code retryCount} previous retries.
     */
    public Duration retryDelay(int retryCount) {
        int index = Math.min(Math.max(retryCount, 0), retrySchedule.size() - 1);
        return retrySchedule.get(index);
    }

    public int maxRetries() {
        return maxRetries;
    }

    private Instant nextRetryAt(Instant now, int retryCount, int budget) {
        if (retryCount >= budget) {
            return null;
        }
        return now.plus(retryDelay(retryCount));
    }

    private void refreshHealth(Connection conn, String projectionName, long processedDelta,
                               long failuresDelta, Instant successAt, Instant failureAt) {
        int active = projectionStore.countActiveFailures(conn, projectionName);
        HealthStatus status = HealthStatus.fromActiveFailures(active);
        projectionStore.saveHealth(conn, new HealthUpdate(projectionName, status,
                processedDelta, failuresDelta, active, successAt, failureAt));
        metrics.recordActiveFailures(projectionName, active);
    }

    /**
     * Builder for {@link ProjectionFailureTracker}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private ProjectionStore projectionStore;
        private List<Duration> retrySchedule;
        private int maxRetries = 5;
        private int batchSize = 100;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /**
         * Sets the connection provider used for each tracking transaction.
         *
         * <p><b>Required.</b>
         *
         * @param connectionProvider the connection provider
         * @return this builder
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * Sets the store for failures, checkpoints and health rows.
         *
         * <p><b>Required.</b>
         *
         * @param projectionStore the persistence backend
         * @return this builder
         */
        public Builder projectionStore(ProjectionStore projectionStore) {
            this.projectionStore = projectionStore;
            return this;
        }

        /**
         * Sets the delays between background retries. The last delay repeats for later retries.
         *
         * <p>Optional. Defaults to {@link #DEFAULT_RETRY_SCHEDULE}. Must not be empty.
         *
         * @param retrySchedule retry delays
         * @return this builder
         */
        public Builder retrySchedule(List<Duration> retrySchedule) {
            this.retrySchedule = retrySchedule;
            return this;
        }

        /**
         * Sets how many background retries a failure gets before it needs manual resolution.
         *
         * <p>Optional. Defaults to {@code 5}. Must be &ge; 0.
         *
         * @param maxRetries retry budget
         * @return this builder
         */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Sets the maximum number of due failures returned per query.
         *
         * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
         *
         * @param batchSize max failures per retry cycle
         * @return this builder
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Sets the metrics exporter for failure counters and active-failure gauges.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the clock used for failure, retry and checkpoint timestamps.
         *
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ProjectionFailureTracker build() {
            return new ProjectionFailureTracker(this);
        }
    }
}
