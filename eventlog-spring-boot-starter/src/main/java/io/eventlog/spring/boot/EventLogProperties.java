package io.eventlog.spring.boot;

import io.eventlog.jdbc.TableNames;
import io.eventlog.tracking.ProjectionFailureTracker;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the event log.
 *
 * @see EventLogAutoConfiguration
 */
@ConfigurationProperties(prefix = "eventlog")
public class EventLogProperties {

    private final Tables tables = new Tables();
    private final Repository repository = new Repository();
    private final Publisher publisher = new Publisher();
    private final Tracker tracker = new Tracker();
    private final Worker worker = new Worker();
    private final Metrics metrics = new Metrics();

    public Tables getTables() {
        return tables;
    }

    public Repository getRepository() {
        return repository;
    }

    public Publisher getPublisher() {
        return publisher;
    }

    public Tracker getTracker() {
        return tracker;
    }

    public Worker getWorker() {
        return worker;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Tables {
        private String events = TableNames.EVENTS;
        private String snapshots = TableNames.SNAPSHOTS;
        private String projectionFailures = TableNames.PROJECTION_FAILURES;
        private String projectionCheckpoints = TableNames.PROJECTION_CHECKPOINTS;
        private String projectionHealth = TableNames.PROJECTION_HEALTH;

        public String getEvents() {
            return events;
        }

        public void setEvents(String events) {
            this.events = events;
        }

        public String getSnapshots() {
            return snapshots;
        }

        public void setSnapshots(String snapshots) {
            this.snapshots = snapshots;
        }

        public String getProjectionFailures() {
            return projectionFailures;
        }

        public void setProjectionFailures(String projectionFailures) {
            this.projectionFailures = projectionFailures;
        }

        public String getProjectionCheckpoints() {
            return projectionCheckpoints;
        }

        public void setProjectionCheckpoints(String projectionCheckpoints) {
            this.projectionCheckpoints = projectionCheckpoints;
        }

        public String getProjectionHealth() {
            return projectionHealth;
        }

        public void setProjectionHealth(String projectionHealth) {
            this.projectionHealth = projectionHealth;
        }
    }

    public static class Repository {
        /**
         * Total save attempts on version conflicts, including the first.
         */
        private int maxAttempts = 3;
        private long retryBaseDelayMs = 50;
        /**
         * Snapshot every N versions; 0 disables snapshots.
         */
        private int snapshotThreshold = 10;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getRetryBaseDelayMs() {
            return retryBaseDelayMs;
        }

        public void setRetryBaseDelayMs(long retryBaseDelayMs) {
            this.retryBaseDelayMs = retryBaseDelayMs;
        }

        public int getSnapshotThreshold() {
            return snapshotThreshold;
        }

        public void setSnapshotThreshold(int snapshotThreshold) {
            this.snapshotThreshold = snapshotThreshold;
        }
    }

    public static class Publisher {
        private int maxAttempts = 3;
        private long retryBaseDelayMs = 1000;
        /**
         * Publish saved events on background threads instead of the saving thread.
         */
        private boolean async = true;
        private int workerCount = 1;
        private long drainTimeoutMs = 10000;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getRetryBaseDelayMs() {
            return retryBaseDelayMs;
        }

        public void setRetryBaseDelayMs(long retryBaseDelayMs) {
            this.retryBaseDelayMs = retryBaseDelayMs;
        }

        public boolean isAsync() {
            return async;
        }

        public void setAsync(boolean async) {
            this.async = async;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    public static class Tracker {
        private List<Duration> retrySchedule = new ArrayList<>(ProjectionFailureTracker.DEFAULT_RETRY_SCHEDULE);
        private int maxRetries = 5;
        private int batchSize = 100;

        public List<Duration> getRetrySchedule() {
            return retrySchedule;
        }

        public void setRetrySchedule(List<Duration> retrySchedule) {
            this.retrySchedule = retrySchedule;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Worker {
        /**
         * Start the background retry worker with the application context.
         */
        private boolean enabled = true;
        private long intervalMs = 10000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "eventlog";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
