package io.eventlog.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventLogPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(EventLogProperties.class);
            assertEquals("events", props.getTables().getEvents());
            assertEquals("snapshots", props.getTables().getSnapshots());
            assertEquals("projection_failures", props.getTables().getProjectionFailures());
            assertEquals("projection_checkpoints", props.getTables().getProjectionCheckpoints());
            assertEquals("projection_health_metrics", props.getTables().getProjectionHealth());
            assertEquals(3, props.getRepository().getMaxAttempts());
            assertEquals(50, props.getRepository().getRetryBaseDelayMs());
            assertEquals(10, props.getRepository().getSnapshotThreshold());
            assertEquals(3, props.getPublisher().getMaxAttempts());
            assertEquals(1000, props.getPublisher().getRetryBaseDelayMs());
            assertTrue(props.getPublisher().isAsync());
            assertEquals(1, props.getPublisher().getWorkerCount());
            assertEquals(10000, props.getPublisher().getDrainTimeoutMs());
            assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4),
                    Duration.ofSeconds(8), Duration.ofSeconds(16)), props.getTracker().getRetrySchedule());
            assertEquals(5, props.getTracker().getMaxRetries());
            assertEquals(100, props.getTracker().getBatchSize());
            assertTrue(props.getWorker().isEnabled());
            assertEquals(10000, props.getWorker().getIntervalMs());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("eventlog", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "eventlog.tables.events=my_events",
                "eventlog.tables.projection-health=my_health",
                "eventlog.repository.max-attempts=5",
                "eventlog.repository.retry-base-delay-ms=20",
                "eventlog.repository.snapshot-threshold=0",
                "eventlog.publisher.max-attempts=4",
                "eventlog.publisher.retry-base-delay-ms=250",
                "eventlog.publisher.async=false",
                "eventlog.publisher.worker-count=3",
                "eventlog.publisher.drain-timeout-ms=2000",
                "eventlog.tracker.retry-schedule=PT1S,PT30S",
                "eventlog.tracker.max-retries=2",
                "eventlog.tracker.batch-size=10",
                "eventlog.worker.enabled=false",
                "eventlog.worker.interval-ms=500",
                "eventlog.metrics.enabled=false",
                "eventlog.metrics.name-prefix=app.events"
        ).run(ctx -> {
            var props = ctx.getBean(EventLogProperties.class);
            assertEquals("my_events", props.getTables().getEvents());
            assertEquals("my_health", props.getTables().getProjectionHealth());
            assertEquals(5, props.getRepository().getMaxAttempts());
            assertEquals(20, props.getRepository().getRetryBaseDelayMs());
            assertEquals(0, props.getRepository().getSnapshotThreshold());
            assertEquals(4, props.getPublisher().getMaxAttempts());
            assertEquals(250, props.getPublisher().getRetryBaseDelayMs());
            assertFalse(props.getPublisher().isAsync());
            assertEquals(3, props.getPublisher().getWorkerCount());
            assertEquals(2000, props.getPublisher().getDrainTimeoutMs());
            assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(30)),
                    props.getTracker().getRetrySchedule());
            assertEquals(2, props.getTracker().getMaxRetries());
            assertEquals(10, props.getTracker().getBatchSize());
            assertFalse(props.getWorker().isEnabled());
            assertEquals(500, props.getWorker().getIntervalMs());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("app.events", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(EventLogProperties.class)
    static class PropsConfig {
    }
}
