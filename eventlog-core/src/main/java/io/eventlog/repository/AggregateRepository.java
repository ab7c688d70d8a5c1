package io.eventlog.repository;

import io.eventlog.AggregateNotFoundException;
import io.eventlog.DomainEvent;
import io.eventlog.SnapshotCorruptionException;
import io.eventlog.aggregate.Aggregate;
import io.eventlog.aggregate.AggregateFactory;
import io.eventlog.model.Snapshot;
import io.eventlog.retry.ExponentialBackoffRetryPolicy;
import io.eventlog.retry.RetryPolicy;
import io.eventlog.retry.Sleeper;
import io.eventlog.spi.AppendResult;
import io.eventlog.spi.ConnectionProvider;
import io.eventlog.spi.EventLogStore;
import io.eventlog.spi.MetricsExporter;
import io.eventlog.spi.SnapshotStore;
import io.eventlog.upcast.UpcasterRegistry;
import io.eventlog.util.Transactions;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads aggregates from snapshots plus events and saves their pending events with
 * optimistic concurrency.
 *
 * <p>Loading restores the latest snapshot (if any) and replays the events recorded after
 * it; both pass through the {@link UpcasterRegistry} first. Saving appends all pending
 * events atomically, expecting the stored version to be
 * {@code aggregate.version() - pendingEvents.size()}. A {@link AppendResult.VersionConflict}
 * is retried up to {@code maxAttempts} total attempts with exponential backoff
 * (50, 100, 200 ms ... by default) and returned to the caller as
 * {@link SaveResult.Conflict} once the budget is spent. Store failures are not retried.
 *
 * <p>After a successful append the aggregate's pending events are cleared, a snapshot is
 * written when the version crosses a multiple of the snapshot threshold, and the
 * {@link SaveHook} receives the appended events.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe; aggregate
 * instances are not.
 *
 * @param <A> the aggregate type
 */
public final class AggregateRepository<A extends Aggregate> {
    private static final Logger logger = Logger.getLogger(AggregateRepository.class.getName());

    private final ConnectionProvider connectionProvider;
    private final EventLogStore eventLogStore;
    private final SnapshotStore snapshotStore;
    private final AggregateFactory<A> factory;
    private final UpcasterRegistry upcasters;
    private final SaveHook saveHook;
    private final MetricsExporter metrics;
    private final int maxAttempts;
    private final RetryPolicy retryPolicy;
    private final int snapshotThreshold;
    private final Sleeper sleeper;

    private AggregateRepository(Builder<A> builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.eventLogStore = Objects.requireNonNull(builder.eventLogStore, "eventLogStore");
        this.factory = Objects.requireNonNull(builder.factory, "factory");
        this.snapshotStore = builder.snapshotStore;
        this.upcasters = builder.upcasters != null ? builder.upcasters : UpcasterRegistry.empty();
        this.saveHook = builder.saveHook != null ? builder.saveHook : SaveHook.NOOP;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.retryPolicy = builder.retryPolicy != null
                ? builder.retryPolicy : ExponentialBackoffRetryPolicy.withoutJitter(50, 5_000);
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.THREAD;
        if (builder.maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (builder.snapshotThreshold < 0) {
            throw new IllegalArgumentException("snapshotThreshold must be >= 0");
        }
        this.maxAttempts = builder.maxAttempts;
        this.snapshotThreshold = builder.snapshotThreshold;
    }

    public static <A extends Aggregate> Builder<A> builder() {
        return new Builder<>();
    }

    /**
     * Loads an aggregate.
     *
     * @param aggregateId the aggregate id
     * @return the aggregate at its latest version, with no pending events
     * @throws AggregateNotFoundException  if neither a snapshot nor events exist
     * @throws SnapshotCorruptionException if the stored snapshot cannot be restored
     */
    public A get(String aggregateId) {
        return find(aggregateId).orElseThrow(() -> new AggregateNotFoundException(aggregateId));
    }

    /**
     * Loads an aggregate if it exists.
     *
     * @param aggregateId the aggregate id
     * @return the aggregate, or empty if neither a snapshot nor events exist
     * @throws SnapshotCorruptionException if the stored snapshot cannot be restored
     */
    public Optional<A> find(String aggregateId) {
        Objects.requireNonNull(aggregateId, "aggregateId");
        return Transactions.withConnection(connectionProvider, "load aggregate " + aggregateId, conn -> {
            A aggregate = factory.create(aggregateId);
            boolean restored = false;
            if (snapshotStore != null) {
                Optional<Snapshot> snapshot = snapshotStore.load(conn, aggregateId);
                if (snapshot.isPresent()) {
                    restore(aggregate, upcasters.upcast(snapshot.get()));
                    restored = true;
                }
            }
            List<DomainEvent> events = eventLogStore.load(conn, aggregateId, aggregate.version());
            if (!restored && events.isEmpty()) {
                return Optional.empty();
            }
            for (DomainEvent event : events) {
                aggregate.applyEvent(upcasters.upcast(event));
            }
            metrics.incrementEventsLoaded(aggregate.aggregateType(), events.size());
            return Optional.of(aggregate);
        });
    }

    private void restore(A aggregate, Snapshot snapshot) {
        try {
            aggregate.restore(snapshot);
        } catch (SnapshotCorruptionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SnapshotCorruptionException(snapshot.aggregateId(),
                    "Snapshot at version " + snapshot.version() + " could not be restored", e);
        }
    }

    /**
     * Appends the aggregate's pending events.
     *
     * @param aggregate the aggregate to save
     * @return {@link SaveResult.Saved} on success (also when there was nothing to save), or
     *         {@link SaveResult.Conflict} when concurrent writers won every attempt
     * @throws io.eventlog.StoreUnavailableException if the store cannot be reached
     */
    public SaveResult save(A aggregate) {
        Objects.requireNonNull(aggregate, "aggregate");
        List<DomainEvent> pending = aggregate.pendingEvents();
        if (pending.isEmpty()) {
            return new SaveResult.Saved(aggregate.id(), aggregate.version(), List.of());
        }
        long expectedVersion = aggregate.version() - pending.size();
        String aggregateType = aggregate.aggregateType();

        AppendResult.VersionConflict lastConflict = null;
        int attempt = 0;
        while (attempt < maxAttempts) {
            attempt++;
            AppendResult result = Transactions.inTransaction(connectionProvider,
                    "append events for aggregate " + aggregate.id(),
                    conn -> eventLogStore.append(conn, aggregate.id(), pending, expectedVersion));
            if (result instanceof AppendResult.Appended appended) {
                return committed(aggregate, expectedVersion, appended.events());
            }
            lastConflict = (AppendResult.VersionConflict) result;
            metrics.incrementConcurrencyConflicts(aggregateType);
            if (attempt < maxAttempts) {
                long delayMs = retryPolicy.computeDelayMs(attempt);
                logger.log(Level.FINE, "Version conflict on " + aggregate.id() + " (expected "
                        + lastConflict.expectedVersion() + ", found " + lastConflict.actualVersion()
                        + "); retrying in " + delayMs + " ms");
                try {
                    sleeper.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        logger.log(Level.FINE, "Giving up on " + aggregate.id() + " after " + attempt + " conflicting attempt(s)");
        return new SaveResult.Conflict(lastConflict, attempt);
    }

    private SaveResult committed(A aggregate, long expectedVersion, List<DomainEvent> appended) {
        aggregate.markCommitted();
        metrics.incrementEventsAppended(aggregate.aggregateType(), appended.size());
        if (crossesSnapshotThreshold(expectedVersion, aggregate.version())) {
            writeSnapshot(aggregate);
        }
        try {
            saveHook.afterSave(appended);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Save hook failed for aggregate " + aggregate.id()
                    + "; events are stored but were not published", e);
        }
        return new SaveResult.Saved(aggregate.id(), aggregate.version(), appended);
    }

    private boolean crossesSnapshotThreshold(long fromVersion, long toVersion) {
        return snapshotStore != null
                && snapshotThreshold > 0
                && toVersion / snapshotThreshold > fromVersion / snapshotThreshold;
    }

    private void writeSnapshot(A aggregate) {
        try {
            Snapshot snapshot = aggregate.toSnapshot();
            Transactions.inTransaction(connectionProvider, "write snapshot for aggregate " + aggregate.id(), conn -> {
                snapshotStore.save(conn, snapshot);
                return null;
            });
            metrics.incrementSnapshotsWritten(aggregate.aggregateType());
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to write snapshot for aggregate " + aggregate.id()
                    + " at version " + aggregate.version(), e);
        }
    }

    /**
     * Builder for {@link AggregateRepository}.
     *
     * @param <A> the aggregate type
     */
    public static final class Builder<A extends Aggregate> {
        private ConnectionProvider connectionProvider;
        private EventLogStore eventLogStore;
        private SnapshotStore snapshotStore;
        private AggregateFactory<A> factory;
        private UpcasterRegistry upcasters;
        private SaveHook saveHook;
        private MetricsExporter metrics;
        private int maxAttempts = 3;
        private RetryPolicy retryPolicy;
        private int snapshotThreshold = 10;
        private Sleeper sleeper;

        private Builder() {
        }

        /**
         * Sets the connection provider.
         *
         * <p><b>Required.</b>
         *
         * @param connectionProvider the connection provider
         * @return this builder
         */
        public Builder<A> connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * Sets the event log store.
         *
         * <p><b>Required.</b>
         *
         * @param eventLogStore the event log store
         * @return this builder
         */
        public Builder<A> eventLogStore(EventLogStore eventLogStore) {
            this.eventLogStore = eventLogStore;
            return this;
        }

        /**
         * Sets the snapshot store.
         *
         * <p>Optional. Without one, aggregates are always rebuilt from their full history.
         *
         * @param snapshotStore the snapshot store
         * @return this builder
         */
        public Builder<A> snapshotStore(SnapshotStore snapshotStore) {
            this.snapshotStore = snapshotStore;
            return this;
        }

        /**
         * Sets the factory creating empty aggregates before replay.
         *
         * <p><b>Required.</b>
         *
         * @param factory the aggregate factory
         * @return this builder
         */
        public Builder<A> factory(AggregateFactory<A> factory) {
            this.factory = factory;
            return this;
        }

        /**
         * Sets the upcasters applied to loaded events and snapshots.
         *
         * <p>Optional. Defaults to {@link UpcasterRegistry#empty()}.
         *
         * @param upcasters the upcaster registry
         * @return this builder
         */
        public Builder<A> upcasters(UpcasterRegistry upcasters) {
            this.upcasters = upcasters;
            return this;
        }

        /**
         * Sets the hook that receives appended events after commit.
         *
         * <p>Optional. Defaults to {@link SaveHook#NOOP}.
         *
         * @param saveHook the save hook
         * @return this builder
         */
        public Builder<A> saveHook(SaveHook saveHook) {
            this.saveHook = saveHook;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder<A> metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the total number of append attempts on version conflicts.
         *
         * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
         *
         * @param maxAttempts total attempts
         * @return this builder
         */
        public Builder<A> maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Sets the delay policy between conflicting attempts.
         *
         * <p>Optional. Defaults to exponential backoff without jitter from 50 ms, capped at 5 s.
         *
         * @param retryPolicy the retry policy
         * @return this builder
         */
        public Builder<A> retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * Sets the snapshot interval in events.
         *
         * <p>Optional. Defaults to {@code 10}. {@code 0} disables snapshots. Must be &ge; 0.
         *
         * @param snapshotThreshold snapshot interval
         * @return this builder
         */
        public Builder<A> snapshotThreshold(int snapshotThreshold) {
            this.snapshotThreshold = snapshotThreshold;
            return this;
        }

        /**
         * Sets how the repository waits between attempts.
         *
         * <p>Optional. Defaults to {@link Sleeper#THREAD}.
         *
         * @param sleeper the sleeper
         * @return this builder
         */
        public Builder<A> sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public AggregateRepository<A> build() {
            return new AggregateRepository<>(this);
        }
    }
}
