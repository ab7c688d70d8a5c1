package io.eventlog.tracking;

import io.eventlog.DomainEvent;
import io.eventlog.model.ProjectionFailure;
import io.eventlog.model.ResolutionMethod;
import io.eventlog.projection.Projection;
import io.eventlog.projection.ProjectionRegistry;
import io.eventlog.spi.ConnectionProvider;
import io.eventlog.spi.EventLogStore;
import io.eventlog.spi.MetricsExporter;
import io.eventlog.upcast.UpcasterRegistry;
import io.eventlog.util.DaemonThreadFactory;
import io.eventlog.util.Transactions;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background worker that re-invokes projections for failures whose retry is due.
 *
 * <p>Each cycle asks the {@link ProjectionFailureTracker} for due failures, loads the
 * original event by id from the {@link EventLogStore}, upcasts it, and hands it to the
 * projection registered under the failure's name. A failure whose projection is not
 * registered or whose event is missing is deferred through
 * {@link ProjectionFailureTracker#deferFailure}, so it spends its budget and cannot hold
 * back the rest of the queue. Outcomes are fed back through
 * {@link ProjectionFailureTracker#recordSuccess} and {@link ProjectionFailureTracker#recordFailure}.
 *
 * <p>Cancellation is cooperative: {@link #stop()} raises a stop flag that is checked before
 * each failure, and waits for the in-flight retry to finish. A stopped worker can be
 * started again; a {@linkplain #close() closed} one cannot.
 *
 * <p>Create instances via {@link #builder()}. The {@link #start()}, {@link #stop()} and
 * {@link #close()} methods are synchronized.
 */
public final class ProjectionRetryWorker implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ProjectionRetryWorker.class.getName());

    private final ConnectionProvider connectionProvider;
    private final EventLogStore eventLogStore;
    private final ProjectionFailureTracker tracker;
    private final ProjectionRegistry projections;
    private final long intervalMs;
    private final long stopTimeoutMs;
    private final MetricsExporter metrics;
    private final UpcasterRegistry upcasters;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> pollTask;
    private volatile boolean stopping;
    private volatile boolean closed;

    private ProjectionRetryWorker(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.eventLogStore = Objects.requireNonNull(builder.eventLogStore, "eventLogStore");
        this.tracker = Objects.requireNonNull(builder.tracker, "tracker");
        this.projections = Objects.requireNonNull(builder.projections, "projections");
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        if (builder.stopTimeoutMs < 0L) {
            throw new IllegalArgumentException("stopTimeoutMs must be >= 0");
        }
        this.intervalMs = builder.intervalMs;
        this.stopTimeoutMs = builder.stopTimeoutMs;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.upcasters = builder.upcasters != null ? builder.upcasters : UpcasterRegistry.empty();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the scheduled retry loop. Subsequent calls are no-ops if already running.
     *
     * @throws IllegalStateException if the worker has been closed
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("ProjectionRetryWorker has been closed");
        }
        if (pollTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("eventlog-retry-worker-"));
        pollTask = scheduler.scheduleWithFixedDelay(this::poll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        logger.log(Level.INFO, "Projection retry worker started (interval " + intervalMs + " ms)");
    }

    /**
     * Stops scheduling further cycles. The current cycle finishes the retry in progress and
     * skips the rest; the call waits for it up to the configured stop timeout.
     */
    public synchronized void stop() {
        stopping = true;
        try {
            cancelSchedule();
        } finally {
            stopping = false;
        }
    }

    private void cancelSchedule() {
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(stopTimeoutMs, TimeUnit.MILLISECONDS)) {
                    logger.log(Level.WARNING, "Retry worker did not finish within " + stopTimeoutMs
                            + " ms; interrupting");
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            scheduler = null;
            logger.log(Level.INFO, "Projection retry worker stopped");
        }
    }

    /**
     * Returns whether retry cycles are currently scheduled.
     */
    public synchronized boolean isRunning() {
        return pollTask != null;
    }

    /**
     * Executes a single retry cycle. Called by the scheduler, but may also be invoked
     * directly (for example from tests or an admin trigger).
     *
     * @return number of failures that were retried in this cycle
     */
    public int poll() {
        if (closed) {
            return 0;
        }
        int retried = 0;
        try {
            List<ProjectionFailure> due = tracker.failuresDueForRetry();
            for (ProjectionFailure failure : due) {
                if (stopping) {
                    break;
                }
                if (retry(failure)) {
                    retried++;
                }
            }
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Retry cycle failed", t);
        }
        return retried;
    }

    private boolean retry(ProjectionFailure failure) {
        Optional<Projection> projection = projections.find(failure.projectionName());
        if (projection.isEmpty()) {
            logger.log(Level.WARNING, "No projection registered as " + failure.projectionName()
                    + "; deferring failure " + failure.id());
            tracker.deferFailure(failure.id(), "No projection registered as " + failure.projectionName());
            return false;
        }
        Optional<DomainEvent> event = Transactions.withConnection(connectionProvider, "load event " + failure.eventId(),
                conn -> eventLogStore.findEvent(conn, failure.eventId()).map(upcasters::upcast));
        if (event.isEmpty()) {
            logger.log(Level.SEVERE, "Event " + failure.eventId() + " for failure " + failure.id()
                    + " is missing from the event log; deferring it");
            tracker.deferFailure(failure.id(), "Event " + failure.eventId() + " is missing from the event log");
            return false;
        }

        metrics.incrementProjectionRetries(failure.projectionName());
        try {
            projection.get().handle(event.get());
        } catch (Exception e) {
            logger.log(Level.WARNING, "Retry " + (failure.retryCount() + 1) + " of projection "
                    + failure.projectionName() + " failed for event " + failure.eventId(), e);
            tracker.recordFailure(event.get(), failure.projectionName(), e);
            return true;
        }
        tracker.recordSuccess(event.get(), failure.projectionName(), ResolutionMethod.AUTO_RETRY);
        return true;
    }

    /**
     * Stops the worker permanently.
     */
    @Override
    public synchronized void close() {
        closed = true;
        stop();
    }

    /**
     * Builder for {@link ProjectionRetryWorker}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private EventLogStore eventLogStore;
        private ProjectionFailureTracker tracker;
        private ProjectionRegistry projections;
        private long intervalMs = 10_000;
        private long stopTimeoutMs = 30_000;
        private MetricsExporter metrics;
        private UpcasterRegistry upcasters;

        private Builder() {
        }

        /**
         * Sets the connection provider used to load events by id.
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
         * Sets the event log the failed events are re-read from.
         *
         * <p><b>Required.</b>
         *
         * @param eventLogStore the event log store
         * @return this builder
         */
        public Builder eventLogStore(EventLogStore eventLogStore) {
            this.eventLogStore = eventLogStore;
            return this;
        }

        /**
         * Sets the tracker that supplies due failures and records outcomes.
         *
         * <p><b>Required.</b>
         *
         * @param tracker the failure tracker
         * @return this builder
         */
        public Builder tracker(ProjectionFailureTracker tracker) {
            this.tracker = tracker;
            return this;
        }

        /**
         * Sets the registry used to find projections by name.
         *
         * <p><b>Required.</b>
         *
         * @param projections the projection registry
         * @return this builder
         */
        public Builder projections(ProjectionRegistry projections) {
            this.projections = projections;
            return this;
        }

        /**
         * Sets the delay between retry cycles in milliseconds.
         *
         * <p>Optional. Defaults to {@code 10000} ms. Must be &gt; 0.
         *
         * @param intervalMs cycle interval
         * @return this builder
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /**
         * Sets how long {@link #stop()} waits for an in-flight retry before interrupting it.
         *
         * <p>Optional. Defaults to {@code 30000} ms. Must be &ge; 0.
         *
         * @param stopTimeoutMs stop timeout
         * @return this builder
         */
        public Builder stopTimeoutMs(long stopTimeoutMs) {
            this.stopTimeoutMs = stopTimeoutMs;
            return this;
        }

        /**
         * Sets the metrics exporter for retry counters.
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
         * Sets the upcasters applied to events re-read from the log.
         *
         * <p>Optional. Defaults to {@link UpcasterRegistry#empty()}.
         *
         * @param upcasters the upcaster registry
         * @return this builder
         */
        public Builder upcasters(UpcasterRegistry upcasters) {
            this.upcasters = upcasters;
            return this;
        }

        public ProjectionRetryWorker build() {
            return new ProjectionRetryWorker(this);
        }
    }
}
