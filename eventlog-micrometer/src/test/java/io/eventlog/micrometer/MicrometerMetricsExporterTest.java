package io.eventlog.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsExporter exporter;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        exporter = new MicrometerMetricsExporter(registry);
    }

    @Test
    void eventsAppendedAreCountedPerAggregateType() {
        exporter.incrementEventsAppended("Document", 3);
        exporter.incrementEventsAppended("Document", 2);
        exporter.incrementEventsAppended("Policy", 1);

        assertEquals(5.0, counter("eventlog.events.appended", "aggregate_type", "Document").count());
        assertEquals(1.0, counter("eventlog.events.appended", "aggregate_type", "Policy").count());
    }

    @Test
    void concurrencyConflictsAndSnapshots() {
        exporter.incrementConcurrencyConflicts("Document");
        exporter.incrementConcurrencyConflicts("Document");
        exporter.incrementSnapshotsWritten("Document");
        exporter.incrementEventsLoaded("Document", 12);

        assertEquals(2.0, counter("eventlog.concurrency.conflicts", "aggregate_type", "Document").count());
        assertEquals(1.0, counter("eventlog.snapshots.written", "aggregate_type", "Document").count());
        assertEquals(12.0, counter("eventlog.events.loaded", "aggregate_type", "Document").count());
    }

    @Test
    void projectionCountersAreTaggedByProjection() {
        exporter.incrementProjectionSuccess("document_list");
        exporter.incrementProjectionFailure("document_list");
        exporter.incrementProjectionFailure("audit_trail");
        exporter.incrementProjectionRetries("audit_trail");

        assertEquals(1.0, counter("eventlog.projection.success", "projection", "document_list").count());
        assertEquals(1.0, counter("eventlog.projection.failure", "projection", "document_list").count());
        assertEquals(1.0, counter("eventlog.projection.failure", "projection", "audit_trail").count());
        assertEquals(1.0, counter("eventlog.projection.retries", "projection", "audit_trail").count());
    }

    @Test
    void activeFailuresGaugeTracksLatestValue() {
        exporter.recordActiveFailures("document_list", 12);
        assertEquals(12.0, gauge("eventlog.projection.active.failures", "document_list").value());

        exporter.recordActiveFailures("document_list", 0);
        assertEquals(0.0, gauge("eventlog.projection.active.failures", "document_list").value());
    }

    @Test
    void handlerDurationIsTimed() {
        exporter.recordHandlerDurationMs("document_list", 40);
        exporter.recordHandlerDurationMs("document_list", 60);

        Timer timer = registry.find("eventlog.projection.handler.duration").tag("projection", "document_list").timer();
        assertNotNull(timer);
        assertEquals(2, timer.count());
        assertEquals(100.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
    }

    @Test
    void customNamePrefix() {
        var custom = new MicrometerMetricsExporter(registry, "documents.eventlog");
        custom.incrementEventsAppended("Document", 1);
        custom.recordActiveFailures("document_list", 4);

        assertEquals(1.0, counter("documents.eventlog.events.appended", "aggregate_type", "Document").count());
        assertEquals(4.0, gauge("documents.eventlog.projection.active.failures", "document_list").value());
    }

    @Test
    void closeRemovesMetersAndIgnoresLaterUpdates() {
        exporter.incrementEventsAppended("Document", 1);
        exporter.recordActiveFailures("document_list", 3);
        exporter.close();

        assertNull(registry.find("eventlog.events.appended").counter());
        assertNull(registry.find("eventlog.projection.active.failures").gauge());

        exporter.incrementEventsAppended("Document", 1);
        assertNull(registry.find("eventlog.events.appended").counter());
    }

    @Test
    void nullRegistryThrows() {
        assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    }

    @Test
    void invalidPrefixThrows() {
        assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
        assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
        assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "eventlog."));
    }

    private Counter counter(String name, String tagKey, String tagValue) {
        Counter c = registry.find(name).tag(tagKey, tagValue).counter();
        assertNotNull(c, "Counter not found: " + name + " " + tagKey + "=" + tagValue);
        return c;
    }

    private Gauge gauge(String name, String projection) {
        Gauge g = registry.find(name).tag("projection", projection).gauge();
        assertNotNull(g, "Gauge not found: " + name + " projection=" + projection);
        return g;
    }
}
