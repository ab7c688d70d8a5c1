package io.eventlog.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.eventlog.EventLog;
import io.eventlog.admin.ProjectionAdmin;
import io.eventlog.jdbc.DataSourceConnectionProvider;
import io.eventlog.jdbc.JacksonJsonCodec;
import io.eventlog.jdbc.JdbcEventLogStore;
import io.eventlog.jdbc.JdbcProjectionStore;
import io.eventlog.jdbc.JdbcSnapshotStore;
import io.eventlog.jdbc.dialect.Dialects;
import io.eventlog.jdbc.spi.Dialect;
import io.eventlog.projection.DefaultProjectionRegistry;
import io.eventlog.spi.ConnectionProvider;
import io.eventlog.spi.EventLogStore;
import io.eventlog.spi.JsonCodec;
import io.eventlog.spi.MetricsExporter;
import io.eventlog.spi.ProjectionStore;
import io.eventlog.spi.SnapshotStore;
import io.eventlog.tracking.ProjectionFailureTracker;
import io.eventlog.upcast.UpcasterRegistry;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the event log.
 *
 * <p>Wires an {@link EventLog} from a {@link DataSource} and {@link EventLogProperties}:
 * the dialect is detected from the JDBC URL, every {@link io.eventlog.projection.Projection}
 * bean is registered, and the retry worker starts with the context unless
 * {@code eventlog.worker.enabled=false}.
 *
 * @see EventLogProperties
 * @see EventLogMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(EventLog.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(EventLogProperties.class)
public class EventLogAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Dialect eventLogDialect(DataSource dataSource) {
        return Dialects.detect(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public JsonCodec eventLogJsonCodec(ObjectProvider<ObjectMapper> objectMapper) {
        ObjectMapper mapper = objectMapper.getIfAvailable();
        return mapper != null ? new JacksonJsonCodec(mapper) : new JacksonJsonCodec();
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public EventLogStore eventLogStore(Dialect dialect, JsonCodec jsonCodec, EventLogProperties props) {
        return new JdbcEventLogStore(dialect, jsonCodec, props.getTables().getEvents());
    }

    @Bean
    @ConditionalOnMissingBean
    public SnapshotStore snapshotStore(Dialect dialect, JsonCodec jsonCodec, EventLogProperties props) {
        return new JdbcSnapshotStore(dialect, jsonCodec, props.getTables().getSnapshots());
    }

    @Bean
    @ConditionalOnMissingBean
    public ProjectionStore projectionStore(Dialect dialect, EventLogProperties props) {
        EventLogProperties.Tables tables = props.getTables();
        return new JdbcProjectionStore(dialect, tables.getProjectionFailures(),
                tables.getProjectionCheckpoints(), tables.getProjectionHealth());
    }

    @Bean
    @ConditionalOnMissingBean
    public DefaultProjectionRegistry projectionRegistry() {
        return new DefaultProjectionRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProjectionBeanRegistrar projectionBeanRegistrar(ListableBeanFactory beanFactory,
                                                           DefaultProjectionRegistry projectionRegistry) {
        return new ProjectionBeanRegistrar(beanFactory, projectionRegistry);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public EventLog eventLog(EventLogProperties props,
                             ConnectionProvider connectionProvider,
                             EventLogStore eventLogStore,
                             SnapshotStore snapshotStore,
                             ProjectionStore projectionStore,
                             DefaultProjectionRegistry projectionRegistry,
                             ObjectProvider<UpcasterRegistry> upcastersProvider,
                             ObjectProvider<MetricsExporter> metricsProvider) {
        EventLogProperties.Repository repository = props.getRepository();
        EventLogProperties.Publisher publisher = props.getPublisher();
        EventLogProperties.Tracker tracker = props.getTracker();

        var builder = EventLog.builder()
                .connectionProvider(connectionProvider)
                .eventLogStore(eventLogStore)
                .snapshotStore(snapshotStore)
                .projectionStore(projectionStore)
                .projections(projectionRegistry)
                .saveMaxAttempts(repository.getMaxAttempts())
                .saveRetryBaseDelayMs(repository.getRetryBaseDelayMs())
                .snapshotThreshold(repository.getSnapshotThreshold())
                .publishMaxAttempts(publisher.getMaxAttempts())
                .publishRetryBaseDelayMs(publisher.getRetryBaseDelayMs())
                .publishAsync(publisher.isAsync())
                .publisherWorkers(publisher.getWorkerCount())
                .drainTimeoutMs(publisher.getDrainTimeoutMs())
                .retrySchedule(tracker.getRetrySchedule())
                .maxRetries(tracker.getMaxRetries())
                .retryBatchSize(tracker.getBatchSize())
                .retryIntervalMs(props.getWorker().getIntervalMs());
        UpcasterRegistry upcasters = upcastersProvider.getIfAvailable();
        if (upcasters != null) {
            builder.upcasters(upcasters);
        }
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        EventLog eventLog = builder.build();
        if (props.getWorker().isEnabled()) {
            eventLog.start();
        }
        return eventLog;
    }

    @Bean
    @ConditionalOnMissingBean
    public ProjectionFailureTracker projectionFailureTracker(EventLog eventLog) {
        return eventLog.tracker();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProjectionAdmin projectionAdmin(EventLog eventLog) {
        return eventLog.admin();
    }
}
