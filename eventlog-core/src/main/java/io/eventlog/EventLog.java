package io.eventlog;

import io.eventlog.admin.ProjectionAdmin;
import io.eventlog.aggregate.Aggregate;
import io.eventlog.aggregate.AggregateFactory;
import io.eventlog.projection.ProjectionRegistry;
import io.eventlog.publish.ProjectionPublisher;
import io.eventlog.publish.PublisherSaveHook;
import io.eventlog.repository.AggregateRepository;
import io.eventlog.retry.ExponentialBackoffRetryPolicy;
import io.eventlog.retry.Sleeper;
import io.eventlog.spi.ConnectionProvider;
import io.eventlog.spi.EventLogStore;
import io.eventlog.spi.MetricsExporter;
import io.eventlog.spi.ProjectionStore;
import io.eventlog.spi.SnapshotStore;
import io.eventlog.tracking.ProjectionFailureTracker;
import io.eventlog.tracking.ProjectionRetryWorker;
import io.eventlog.upcast.UpcasterRegistry;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Wires the event log, snapshot and projection stores into one service object.
 *
 * <p>An {@code EventLog} owns the {@link ProjectionFailureTracker}, the
 * {@link ProjectionPublisher}, the {@link ProjectionRetryWorker} and the
 * {@link ProjectionAdmin}, and hands out {@link AggregateRepository repositories} whose
 * saves are published to the registered projections. Pass it by reference to whatever
 * needs it; nothing here is global.
 *
 * <pre>{@code
 * EventLog eventLog = EventLog.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .eventLogStore(new JdbcEventLogStore(dialect, codec))
 *     .snapshotStore(new JdbcSnapshotStore(dialect, codec))
 *     .projectionStore(new JdbcProjectionStore(dialect))
 *     .projections(new DefaultProjectionRegistry().register(new DocumentListProjection(dataSource)))
 *     .build();
 * eventLog.start();
 *
 * AggregateRepository<Document> documents = eventLog.repository(Document::new);
 * }</pre>
 *
 * <p>{@link #close()} stops the retry worker, then drains and stops the publisher.
 */
public final class EventLog implements AutoCloseable {
    private final ConnectionProvider connectionProvider;
    private final EventLogStore eventLogStore;
    private final SnapshotStore snapshotStore;
    private final ProjectionRegistry projections;
    private final UpcasterRegistry upcasters;
    private final MetricsExporter metrics;
    private final int saveMaxAttempts;
    private final long saveRetryBaseDelayMs;
    private final int snapshotThreshold;
    private final boolean publishAsync;
    private final Sleeper sleeper;

    private final ProjectionFailureTracker tracker;
    private final ProjectionPublisher publisher;
    private final ProjectionRetryWorker worker;
    private final ProjectionAdmin admin;

    private EventLog(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.eventLogStore = Objects.requireNonNull(builder.eventLogStore, "eventLogStore");
        ProjectionStore projectionStore = Objects.requireNonNull(builder.projectionStore, "projectionStore");
        this.projections = Objects.requireNonNull(builder.projections, "projections");
        this.snapshotStore = builder.snapshotStore;
        this.upcasters = builder.upcasters != null ? builder.upcasters : UpcasterRegistry.empty();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.THREAD;
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.saveMaxAttempts = builder.saveMaxAttempts;
        this.saveRetryBaseDelayMs = builder.saveRetryBaseDelayMs;
        this.snapshotThreshold = builder.snapshotThreshold;
        this.publishAsync = builder.publishAsync;

        this.tracker = ProjectionFailureTracker.builder()
                .connectionProvider(connectionProvider)
                .projectionStore(projectionStore)
                .retrySchedule(builder.retrySchedule)
                .maxRetries(builder.maxRetries)
                .batchSize(builder.retryBatchSize)
                .metrics(metrics)
                .clock(clock)
                .build();
        this.publisher = ProjectionPublisher.builder()
                .projections(projections)
                .tracker(tracker)
                .inlineMaxAttempts(builder.publishMaxAttempts)
                .retryPolicy(ExponentialBackoffRetryPolicy.withoutJitter(builder.publishRetryBaseDelayMs,
                        Math.max(builder.publishRetryBaseDelayMs, 60_000)))
                .sleeper(sleeper)
                .metrics(metrics)
                .workerCount(builder.publisherWorkers)
                .drainTimeoutMs(builder.drainTimeoutMs)
                .build();
        this.worker = ProjectionRetryWorker.builder()
                .connectionProvider(connectionProvider)
                .eventLogStore(eventLogStore)
                .tracker(tracker)
                .projections(projections)
                .intervalMs(builder.retryIntervalMs)
                .metrics(metrics)
                .upcasters(upcasters)
                .build();
        this.admin = ProjectionAdmin.builder()
                .connectionProvider(connectionProvider)
                .eventLogStore(eventLogStore)
                .projectionStore(projectionStore)
                .tracker(tracker)
                .projections(projections)
                .upcasters(upcasters)
                .clock(clock)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a repository for one aggregate type whose saves are published to the
     * registered projections.
     *
     * @param factory creates empty aggregates by id
     * @param <A>     the aggregate type
     * @return a new repository
     */
    public <A extends Aggregate> AggregateRepository<A> repository(AggregateFactory<A> factory) {
        return AggregateRepository.<A>builder()
                .connectionProvider(connectionProvider)
                .eventLogStore(eventLogStore)
                .snapshotStore(snapshotStore)
                .factory(factory)
                .upcasters(upcasters)
                .saveHook(new PublisherSaveHook(publisher, publishAsync))
                .metrics(metrics)
                .maxAttempts(saveMaxAttempts)
                .retryPolicy(ExponentialBackoffRetryPolicy.withoutJitter(saveRetryBaseDelayMs,
                        Math.max(saveRetryBaseDelayMs, 5_000)))
                .snapshotThreshold(snapshotThreshold)
                .sleeper(sleeper)
                .build();
    }

    /**
     * Starts the background retry worker.
     */
    public void start() {
        worker.start();
    }

    public ProjectionFailureTracker tracker() {
        return tracker;
    }

    public ProjectionPublisher publisher() {
        return publisher;
    }

    public ProjectionRetryWorker worker() {
        return worker;
    }

    public ProjectionAdmin admin() {
        return admin;
    }

    public ProjectionRegistry projections() {
        return projections;
    }

    @Override
    public void close() {
        RuntimeException failure = null;
        try {
            worker.close();
        } catch (RuntimeException e) {
            failure = e;
        }
        try {
            publisher.close();
        } catch (RuntimeException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Builder for {@link EventLog}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private EventLogStore eventLogStore;
        private SnapshotStore snapshotStore;
        private ProjectionStore projectionStore;
        private ProjectionRegistry projections;
        private UpcasterRegistry upcasters;
        private MetricsExporter metrics;
        private Clock clock;
        private Sleeper sleeper;
        private int saveMaxAttempts = 3;
        private long saveRetryBaseDelayMs = 50;
        private int snapshotThreshold = 10;
        private int publishMaxAttempts = 3;
        private long publishRetryBaseDelayMs = 1_000;
        private boolean publishAsync = true;
        private int publisherWorkers = 1;
        private long drainTimeoutMs = 10_000;
        private List<Duration> retrySchedule = ProjectionFailureTracker.DEFAULT_RETRY_SCHEDULE;
        private int maxRetries = 5;
        private int retryBatchSize = 100;
        private long retryIntervalMs = 10_000;

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

        /** Optional. Without a snapshot store, aggregates are always fully replayed. */
        public Builder snapshotStore(SnapshotStore snapshotStore) {
            this.snapshotStore = snapshotStore;
            return this;
        }

        /** <b>Required.</b> */
        public Builder projectionStore(ProjectionStore projectionStore) {
            this.projectionStore = projectionStore;
            return this;
        }

        /** <b>Required.</b> */
        public Builder projections(ProjectionRegistry projections) {
            this.projections = projections;
            return this;
        }

        /** Optional. Defaults to {@link UpcasterRegistry#empty()}. */
        public Builder upcasters(UpcasterRegistry upcasters) {
            this.upcasters = upcasters;
            return this;
        }

        /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /** Optional. Defaults to {@link Clock#systemUTC()}. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /** Optional. Defaults to {@link Sleeper#THREAD}. */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /** Total append attempts on version conflicts. Defaults to {@code 3}. */
        public Builder saveMaxAttempts(int saveMaxAttempts) {
            this.saveMaxAttempts = saveMaxAttempts;
            return this;
        }

        /** First delay between conflicting append attempts. Defaults to {@code 50} ms. */
        public Builder saveRetryBaseDelayMs(long saveRetryBaseDelayMs) {
            this.saveRetryBaseDelayMs = saveRetryBaseDelayMs;
            return this;
        }

        /** Snapshot interval in events; {@code 0} disables snapshots. Defaults to {@code 10}. */
        public Builder snapshotThreshold(int snapshotThreshold) {
            this.snapshotThreshold = snapshotThreshold;
            return this;
        }

        /** Inline attempts per projection before a failure is recorded. Defaults to {@code 3}. */
        public Builder publishMaxAttempts(int publishMaxAttempts) {
            this.publishMaxAttempts = publishMaxAttempts;
            return this;
        }

        /** First delay between inline projection attempts. Defaults to {@code 1000} ms. */
        public Builder publishRetryBaseDelayMs(long publishRetryBaseDelayMs) {
            this.publishRetryBaseDelayMs = publishRetryBaseDelayMs;
            return this;
        }

        /**
         * Whether saves hand events to publisher workers ({@code true}, the default) or
         * publish them in the saving thread.
         */
        public Builder publishAsync(boolean publishAsync) {
            this.publishAsync = publishAsync;
            return this;
        }

        /** Publisher worker threads. Defaults to {@code 1}. */
        public Builder publisherWorkers(int publisherWorkers) {
            this.publisherWorkers = publisherWorkers;
            return this;
        }

        /** How long {@link EventLog#close()} waits for queued batches. Defaults to {@code 10000} ms. */
        public Builder drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        /** Background retry delays. Defaults to 1, 2, 4, 8, 16 seconds. */
        public Builder retrySchedule(List<Duration> retrySchedule) {
            this.retrySchedule = retrySchedule;
            return this;
        }

        /** Background retries before a failure needs manual resolution. Defaults to {@code 5}. */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        /** Due failures fetched per worker cycle. Defaults to {@code 100}. */
        public Builder retryBatchSize(int retryBatchSize) {
            this.retryBatchSize = retryBatchSize;
            return this;
        }

        /** Delay between worker cycles. Defaults to {@code 10000} ms. */
        public Builder retryIntervalMs(long retryIntervalMs) {
            this.retryIntervalMs = retryIntervalMs;
            return this;
        }

        public EventLog build() {
            return new EventLog(this);
        }
    }
}
