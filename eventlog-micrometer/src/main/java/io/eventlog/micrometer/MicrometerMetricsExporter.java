package io.eventlog.micrometer;

import io.eventlog.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers tagged counters, gauges and timers with a {@link MeterRegistry} for export
 * to Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventlog.events.appended} (tag {@code aggregate_type})</li>
 *   <li>{@code eventlog.events.loaded} (tag {@code aggregate_type})</li>
 *   <li>{@code eventlog.concurrency.conflicts} (tag {@code aggregate_type})</li>
 *   <li>{@code eventlog.snapshots.written} (tag {@code aggregate_type})</li>
 *   <li>{@code eventlog.projection.success} (tag {@code projection})</li>
 *   <li>{@code eventlog.projection.failure} (tag {@code projection})</li>
 *   <li>{@code eventlog.projection.retries} (tag {@code projection})</li>
 * </ul>
 *
 * <h3>Gauges and timers</h3>
 * <ul>
 *   <li>{@code eventlog.projection.active.failures} (tag {@code projection})</li>
 *   <li>{@code eventlog.projection.handler.duration} (tag {@code projection})</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
    static final String AGGREGATE_TYPE_TAG = "aggregate_type";
    static final String PROJECTION_TAG = "projection";

    private final MeterRegistry registry;
    private final String namePrefix;
    private final Map<Meter.Id, Meter> meters = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> activeFailures = new ConcurrentHashMap<>();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "eventlog"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "eventlog");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "documents.eventlog"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }
        this.registry = registry;
        this.namePrefix = namePrefix;
    }

    @Override
    public void incrementEventsAppended(String aggregateType, int count) {
        if (closed) return;
        counter(".events.appended", "Events appended to the event log", AGGREGATE_TYPE_TAG, aggregateType)
                .increment(count);
    }

    @Override
    public void incrementEventsLoaded(String aggregateType, int count) {
        if (closed) return;
        counter(".events.loaded", "Events replayed while loading aggregates", AGGREGATE_TYPE_TAG, aggregateType)
                .increment(count);
    }

    @Override
    public void incrementConcurrencyConflicts(String aggregateType) {
        if (closed) return;
        counter(".concurrency.conflicts", "Appends rejected by a version conflict", AGGREGATE_TYPE_TAG,
                aggregateType).increment();
    }

    @Override
    public void incrementSnapshotsWritten(String aggregateType) {
        if (closed) return;
        counter(".snapshots.written", "Snapshots written", AGGREGATE_TYPE_TAG, aggregateType).increment();
    }

    @Override
    public void incrementProjectionSuccess(String projectionName) {
        if (closed) return;
        counter(".projection.success", "Events handled by a projection", PROJECTION_TAG, projectionName)
                .increment();
    }

    @Override
    public void incrementProjectionFailure(String projectionName) {
        if (closed) return;
        counter(".projection.failure", "Projection failures recorded", PROJECTION_TAG, projectionName)
                .increment();
    }

    @Override
    public void incrementProjectionRetries(String projectionName) {
        if (closed) return;
        counter(".projection.retries", "Background retries of failed projections", PROJECTION_TAG,
                projectionName).increment();
    }

    @Override
    public void recordActiveFailures(String projectionName, int activeFailures) {
        if (closed) return;
        this.activeFailures.computeIfAbsent(projectionName, this::registerActiveFailuresGauge).set(activeFailures);
    }

    @Override
    public void recordHandlerDurationMs(String projectionName, long durationMs) {
        if (closed) return;
        Timer timer = Timer.builder(namePrefix + ".projection.handler.duration")
                .description("Time spent in projection handlers")
                .tag(PROJECTION_TAG, projectionName)
                .register(registry);
        meters.putIfAbsent(timer.getId(), timer);
        timer.record(Duration.ofMillis(durationMs));
    }

    private Counter counter(String suffix, String description, String tagKey, String tagValue) {
        Counter counter = Counter.builder(namePrefix + suffix)
                .description(description)
                .tag(tagKey, tagValue)
                .register(registry);
        meters.putIfAbsent(counter.getId(), counter);
        return counter;
    }

    private AtomicInteger registerActiveFailuresGauge(String projectionName) {
        AtomicInteger value = new AtomicInteger();
        Gauge gauge = Gauge.builder(namePrefix + ".projection.active.failures", value, AtomicInteger::get)
                .description("Unresolved failures of a projection")
                .tag(PROJECTION_TAG, projectionName)
                .register(registry);
        meters.put(gauge.getId(), gauge);
        return value;
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this when the exporter is no longer needed (e.g. when the
     * {@link io.eventlog.EventLog} is closed) to prevent stale gauges.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : meters.values()) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        meters.clear();
        activeFailures.clear();
        if (first != null) throw first;
    }
}
