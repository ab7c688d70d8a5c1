package io.eventlog.publish;

import io.eventlog.DomainEvent;
import io.eventlog.model.HealthStatus;
import io.eventlog.model.ProjectionFailure;
import io.eventlog.projection.DefaultProjectionRegistry;
import io.eventlog.projection.Projection;
import io.eventlog.retry.ExponentialBackoffRetryPolicy;
import io.eventlog.testing.InMemoryProjectionStore;
import io.eventlog.testing.RecordingProjection;
import io.eventlog.testing.RecordingSleeper;
import io.eventlog.testing.StubConnections;
import io.eventlog.tracking.ProjectionFailureTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProjectionPublisherTest {

    private InMemoryProjectionStore projectionStore;
    private ProjectionFailureTracker tracker;
    private RecordingSleeper sleeper;

    @BeforeEach
    void setUp() {
        projectionStore = new InMemoryProjectionStore();
        tracker = ProjectionFailureTracker.builder()
                .connectionProvider(new StubConnections())
                .projectionStore(projectionStore)
                .build();
        sleeper = new RecordingSleeper();
    }

    private ProjectionPublisher publisher(Projection... projections) {
        DefaultProjectionRegistry registry = new DefaultProjectionRegistry();
        for (Projection projection : projections) {
            registry.register(projection);
        }
        return ProjectionPublisher.builder()
                .projections(registry)
                .tracker(tracker)
                .sleeper(sleeper)
                .build();
    }

    private static DomainEvent event(String type, long sequence) {
        return DomainEvent.builder(type)
                .aggregateId("doc-" + sequence)
                .aggregateType("Document")
                .version(1)
                .sequence(sequence)
                .payload(Map.of("title", "T" + sequence))
                .build();
    }

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void builderRejectsMissingTracker() {
        assertThrows(NullPointerException.class, () ->
                ProjectionPublisher.builder().projections(new DefaultProjectionRegistry()).build());
    }

    @Test
    void builderRejectsMissingProjections() {
        assertThrows(NullPointerException.class, () -> ProjectionPublisher.builder().tracker(tracker).build());
    }

    @Test
    void builderRejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class, () ->
                ProjectionPublisher.builder()
                        .projections(new DefaultProjectionRegistry())
                        .tracker(tracker)
                        .inlineMaxAttempts(0)
                        .build());
    }

    // ── Dispatch ────────────────────────────────────────────────────

    @Test
    void successAdvancesCheckpoint() {
        RecordingProjection titles = new RecordingProjection("titles");
        try (ProjectionPublisher publisher = publisher(titles)) {
            publisher.publish(event("DocumentCreated", 7));
        }

        assertEquals("T7", titles.titles().get("doc-7"));
        var checkpoint = projectionStore.findCheckpoint(null, "titles").orElseThrow();
        assertEquals(7, checkpoint.lastEventSequence());
        assertEquals(1, checkpoint.eventsProcessed());
        assertTrue(sleeper.delays().isEmpty());
    }

    @Test
    void failingProjectionDoesNotAffectOthers() {
        RecordingProjection broken = new RecordingProjection("broken").failAlways(true);
        RecordingProjection healthy = new RecordingProjection("healthy");
        try (ProjectionPublisher publisher = publisher(broken, healthy)) {
            publisher.publish(event("DocumentCreated", 1));
        }

        assertEquals(3, broken.attempts());
        assertEquals(1, healthy.attempts());
        assertEquals("T1", healthy.titles().get("doc-1"));
        assertEquals(List.of(1000L, 2000L), sleeper.delays());

        List<ProjectionFailure> failures = projectionStore.allFailures();
        assertEquals(1, failures.size());
        assertEquals("broken", failures.get(0).projectionName());
        assertEquals(0, failures.get(0).retryCount());
        assertTrue(failures.get(0).errorMessage().contains("read model unavailable"));
        assertEquals(HealthStatus.DEGRADED, projectionStore.findHealth(null, "broken").orElseThrow().healthStatus());
        assertTrue(projectionStore.findCheckpoint(null, "broken").isEmpty());
    }

    @Test
    void recoversWithinInlineAttempts() {
        RecordingProjection flaky = new RecordingProjection("flaky").failNext(2);
        try (ProjectionPublisher publisher = publisher(flaky)) {
            publisher.publish(event("DocumentCreated", 1));
        }

        assertEquals(3, flaky.attempts());
        assertTrue(projectionStore.allFailures().isEmpty());
        assertEquals(1, projectionStore.findCheckpoint(null, "flaky").orElseThrow().lastEventSequence());
    }

    @Test
    void laterEventsStillDispatchedAfterAFailure() {
        RecordingProjection projection = new RecordingProjection("titles");
        DomainEvent first = event("DocumentCreated", 1);
        projection.failOn(first.eventId());
        try (ProjectionPublisher publisher = publisher(projection)) {
            publisher.publishAll(List.of(first, event("DocumentCreated", 2)));
        }

        assertEquals("T2", projection.titles().get("doc-2"));
        assertEquals(1, projectionStore.allFailures().size());
        assertEquals(2, projectionStore.findCheckpoint(null, "titles").orElseThrow().lastEventSequence());
    }

    @Test
    void skipsProjectionsThatDoNotHandleTheEvent() {
        RecordingProjection archive = new RecordingProjection("archive", "DocumentArchived");
        try (ProjectionPublisher publisher = publisher(archive)) {
            publisher.publish(event("DocumentCreated", 1));
        }

        assertEquals(0, archive.attempts());
        assertTrue(projectionStore.findCheckpoint(null, "archive").isEmpty());
    }

    @Test
    void canHandleExceptionIsRecordedAsFailure() {
        Projection picky = new Projection() {
            @Override
            public String name() {
                return "picky";
            }

            @Override
            public boolean canHandle(DomainEvent event) {
                throw new IllegalArgumentException("bad filter");
            }

            @Override
            public void handle(DomainEvent event) {
            }
        };
        RecordingProjection other = new RecordingProjection("other");
        try (ProjectionPublisher publisher = publisher(picky, other)) {
            publisher.publish(event("DocumentCreated", 1));
        }

        assertEquals(1, projectionStore.allFailures().size());
        assertEquals(1, other.attempts());
    }

    @Test
    void trackerFailureIsLoggedNotThrown() {
        projectionStore.failWrites(true);
        RecordingProjection broken = new RecordingProjection("broken").failAlways(true);
        try (ProjectionPublisher publisher = publisher(broken)) {
            assertDoesNotThrow(() -> publisher.publish(event("DocumentCreated", 1)));
        }
        assertEquals(3, broken.attempts());
    }

    @Test
    void customRetryPolicyAndAttempts() {
        RecordingProjection broken = new RecordingProjection("broken").failAlways(true);
        DefaultProjectionRegistry registry = new DefaultProjectionRegistry().register(broken);
        try (ProjectionPublisher publisher = ProjectionPublisher.builder()
                .projections(registry)
                .tracker(tracker)
                .sleeper(sleeper)
                .inlineMaxAttempts(4)
                .retryPolicy(ExponentialBackoffRetryPolicy.withoutJitter(10, 25))
                .build()) {
            publisher.publish(event("DocumentCreated", 1));
        }

        assertEquals(4, broken.attempts());
        assertEquals(List.of(10L, 20L, 25L), sleeper.delays());
    }

    // ── Async ───────────────────────────────────────────────────────

    @Test
    void asyncBatchesAreDrainedOnClose() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        RecordingProjection titles = new RecordingProjection("titles");
        Projection gate = new Projection() {
            @Override
            public String name() {
                return "gate";
            }

            @Override
            public boolean canHandle(DomainEvent event) {
                return true;
            }

            @Override
            public void handle(DomainEvent event) throws Exception {
                release.await(5, TimeUnit.SECONDS);
            }
        };
        ProjectionPublisher publisher = publisher(gate, titles);

        assertTrue(publisher.publishAsync(List.of(event("DocumentCreated", 1), event("DocumentCreated", 2))));
        release.countDown();
        publisher.close();

        assertEquals(2, titles.handled().size());
        assertEquals(List.of(1L, 2L), titles.handled().stream().map(DomainEvent::sequence).toList());
    }

    @Test
    void batchesLeftAfterDrainTimeoutArePublishedOnClose() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        RecordingProjection titles = new RecordingProjection("titles");
        Projection stuck = new Projection() {
            @Override
            public String name() {
                return "stuck";
            }

            @Override
            public boolean canHandle(DomainEvent event) {
                return true;
            }

            @Override
            public void handle(DomainEvent event) throws Exception {
                if (event.sequence() != 1) {
                    return;
                }
                entered.countDown();
                try {
                    new CountDownLatch(1).await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        };
        DefaultProjectionRegistry registry = new DefaultProjectionRegistry();
        registry.register(stuck);
        registry.register(titles);
        ProjectionPublisher publisher = ProjectionPublisher.builder()
                .projections(registry)
                .tracker(tracker)
                .sleeper(sleeper)
                .drainTimeoutMs(0)
                .build();

        assertTrue(publisher.publishAsync(List.of(event("DocumentCreated", 1))));
        assertTrue(publisher.publishAsync(List.of(event("DocumentCreated", 2))));
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        publisher.close();

        assertEquals(List.of(1L, 2L), titles.handled().stream().map(DomainEvent::sequence).toList());
        assertEquals(2, projectionStore.findCheckpoint(null, "stuck").orElseThrow().lastEventSequence());
        List<ProjectionFailure> failures = projectionStore.allFailures();
        assertEquals(1, failures.size());
        assertEquals("stuck", failures.get(0).projectionName());
        assertFalse(failures.get(0).resolved());
    }

    @Test
    void publishAsyncAfterCloseRunsInline() {
        RecordingProjection titles = new RecordingProjection("titles");
        ProjectionPublisher publisher = publisher(titles);
        publisher.close();

        assertFalse(publisher.publishAsync(List.of(event("DocumentCreated", 1))));
        assertEquals(1, titles.handled().size());
    }
}
