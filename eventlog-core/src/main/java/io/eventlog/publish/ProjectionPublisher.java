package io.eventlog.publish;

import io.eventlog.DomainEvent;
import io.eventlog.projection.Projection;
import io.eventlog.projection.ProjectionRegistry;
import io.eventlog.retry.ExponentialBackoffRetryPolicy;
import io.eventlog.retry.RetryPolicy;
import io.eventlog.retry.Sleeper;
import io.eventlog.spi.MetricsExporter;
import io.eventlog.tracking.ProjectionFailureTracker;
import io.eventlog.util.DaemonThreadFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Dispatches appended events to every projection that can handle them.
 *
 * <p>Each (event, projection) pair is attempted up to {@code inlineMaxAttempts} times with
 * backoff between attempts (1 s, 2 s, 4 s ... by default). A success is recorded with the
 * {@link ProjectionFailureTracker}, which advances the projection's checkpoint. After the
 * final failed attempt the failure is logged at {@link Level#SEVERE} and recorded for
 * background retry. One projection failing never prevents dispatch to the others, nor to
 * later events.
 *
 * <p>{@link #publish(DomainEvent)} runs in the caller's thread. {@link #publishAsync(List)}
 * hands a batch to a pool of daemon workers; with the default single worker, batches are
 * handled in submission order.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} for graceful shutdown with a configurable drain timeout.
 *
 * @see PublisherSaveHook
 */
public final class ProjectionPublisher implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ProjectionPublisher.class.getName());

    private final ProjectionRegistry projections;
    private final ProjectionFailureTracker tracker;
    private final RetryPolicy retryPolicy;
    private final int inlineMaxAttempts;
    private final Sleeper sleeper;
    private final MetricsExporter metrics;
    private final long drainTimeoutMs;
    private final ExecutorService workers;
    private final AtomicBoolean accepting = new AtomicBoolean(true);

    private ProjectionPublisher(Builder builder) {
        this.projections = Objects.requireNonNull(builder.projections, "projections");
        this.tracker = Objects.requireNonNull(builder.tracker, "tracker");
        this.retryPolicy = builder.retryPolicy != null
                ? builder.retryPolicy : ExponentialBackoffRetryPolicy.withoutJitter(1_000, 60_000);
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.THREAD;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

        if (builder.inlineMaxAttempts < 1) {
            throw new IllegalArgumentException("inlineMaxAttempts must be >= 1");
        }
        if (builder.workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1");
        }
        if (builder.drainTimeoutMs < 0) {
            throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
        }
        this.inlineMaxAttempts = builder.inlineMaxAttempts;
        this.drainTimeoutMs = builder.drainTimeoutMs;
        this.workers = Executors.newFixedThreadPool(builder.workerCount,
                new DaemonThreadFactory("eventlog-publisher-"));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Dispatches one event to all applicable projections in the calling thread.
     *
     * @param event an appended event (carrying its global sequence)
     */
    public void publish(DomainEvent event) {
        Objects.requireNonNull(event, "event");
        for (Projection projection : projections.all()) {
            if (accepts(projection, event)) {
                dispatch(event, projection);
            }
        }
    }

    /**
     * Dispatches events in order in the calling thread.
     */
    public void publishAll(List<DomainEvent> events) {
        for (DomainEvent event : events) {
            publish(event);
        }
    }

    /**
     * Queues a batch of events for dispatch on a publisher worker.
     *
     * <p>If the publisher is closed or its pool rejects the batch, the events are published
     * in the calling thread instead so that no projection misses them.
     *
     * @param events appended events, in order
     * @return {@code true} if the batch was queued, {@code false} if it was published inline
     */
    public boolean publishAsync(List<DomainEvent> events) {
        List<DomainEvent> batch = List.copyOf(events);
        if (batch.isEmpty()) {
            return true;
        }
        if (accepting.get()) {
            try {
                workers.execute(new QueuedBatch(batch));
                return true;
            } catch (RejectedExecutionException e) {
                logger.log(Level.WARNING, "Publisher rejected a batch of " + batch.size()
                        + " events; publishing inline", e);
            }
        } else {
            logger.log(Level.WARNING, "Publisher is closed; publishing " + batch.size() + " events inline");
        }
        publishAll(batch);
        return false;
    }

    private boolean accepts(Projection projection, DomainEvent event) {
        try {
            return projection.canHandle(event);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Projection " + projection.name() + " failed to evaluate canHandle for event "
                    + event.eventId(), e);
            recordFailure(event, projection, e);
            return false;
        }
    }

    private void dispatch(DomainEvent event, Projection projection) {
        String name = projection.name();
        Exception lastError = null;
        int attempt = 0;
        while (attempt < inlineMaxAttempts) {
            attempt++;
            long start = System.nanoTime();
            try {
                projection.handle(event);
                metrics.recordHandlerDurationMs(name, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
                recordSuccess(event, projection);
                return;
            } catch (Exception e) {
                lastError = e;
            }
            if (attempt < inlineMaxAttempts) {
                long delayMs = retryPolicy.computeDelayMs(attempt);
                logger.log(Level.FINE, "Projection " + name + " failed on attempt " + attempt
                        + " for event " + event.eventId() + "; retrying in " + delayMs + " ms");
                try {
                    sleeper.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        logger.log(Level.SEVERE, "Projection " + name + " failed for event " + event.eventId()
                + " (" + event.eventType() + ") after " + attempt + " attempt(s); recording failure", lastError);
        recordFailure(event, projection, lastError);
    }

    private void recordSuccess(DomainEvent event, Projection projection) {
        try {
            tracker.recordSuccess(event, projection.name());
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Projection " + projection.name() + " handled event " + event.eventId()
                    + " but its checkpoint could not be recorded", e);
        }
    }

    private void recordFailure(DomainEvent event, Projection projection, Exception error) {
        try {
            tracker.recordFailure(event, projection.name(), error);
        } catch (RuntimeException e) {
            e.addSuppressed(error);
            logger.log(Level.SEVERE, "Could not record failure of projection " + projection.name()
                    + " for event " + event.eventId() + "; read model is out of date until replayed", e);
        }
    }

    /**
     * Stops accepting batches, drains queued batches within the drain timeout, then shuts
     * down the worker threads.
     *
     * <p>Batches still queued when the timeout expires are published in the closing thread,
     * so each of their events ends in a checkpoint or a recorded failure.
     */
    @Override
    public void close() {
        accepting.set(false);
        workers.shutdown();
        List<Runnable> abandoned = List.of();
        try {
            if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.log(Level.WARNING, "Drain timeout exceeded; forcing publisher shutdown");
                abandoned = workers.shutdownNow();
                workers.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            abandoned = workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        for (Runnable task : abandoned) {
            if (task instanceof QueuedBatch queued) {
                logger.log(Level.WARNING, "Publishing " + queued.events.size()
                        + " undrained events inline on close");
                publishAll(queued.events);
            }
        }
    }

    private final class QueuedBatch implements Runnable {
        private final List<DomainEvent> events;

        QueuedBatch(List<DomainEvent> events) {
            this.events = events;
        }

        @Override
        public void run() {
            publishAll(events);
        }
    }

    /** Builder for {@link ProjectionPublisher}. */
    public static final class Builder {
        private ProjectionRegistry projections;
        private ProjectionFailureTracker tracker;
        private RetryPolicy retryPolicy;
        private int inlineMaxAttempts = 3;
        private Sleeper sleeper;
        private MetricsExporter metrics;
        private int workerCount = 1;
        private long drainTimeoutMs = 10_000;

        private Builder() {
        }

        /**
         * Sets the projections events are dispatched to.
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
         * Sets the tracker recording successes (checkpoints) and final failures.
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
         * Sets the delay policy between inline attempts.
         *
         * <p>Optional. Defaults to exponential backoff without jitter: 1 s, 2 s, 4 s ... capped at 60 s.
         *
         * @param retryPolicy the retry policy
         * @return this builder
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * Sets the total number of inline attempts per (event, projection) before the
         * failure is handed to the tracker.
         *
         * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
         *
         * @param inlineMaxAttempts attempts per projection
         * @return this builder
         */
        public Builder inlineMaxAttempts(int inlineMaxAttempts) {
            this.inlineMaxAttempts = inlineMaxAttempts;
            return this;
        }

        /**
         * Sets how the publisher waits between attempts.
         *
         * <p>Optional. Defaults to {@link Sleeper#THREAD}.
         *
         * @param sleeper the sleeper
         * @return this builder
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /**
         * Sets the metrics exporter for handler timings.
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
         * Sets the number of threads serving {@link #publishAsync(List)}.
         *
         * <p>Optional. Defaults to {@code 1}, which keeps batches in submission order. Must be &ge; 1.
         *
         * @param workerCount worker thread count
         * @return this builder
         */
        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        /**
         * Sets how long {@link #close()} waits for queued batches.
         *
         * <p>Optional. Defaults to {@code 10000} ms. Must be &ge; 0.
         *
         * @param drainTimeoutMs drain timeout in milliseconds
         * @return this builder
         */
        public Builder drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        public ProjectionPublisher build() {
            return new ProjectionPublisher(this);
        }
    }
}
