package io.eventlog.spring.boot;

import io.eventlog.micrometer.MicrometerMetricsExporter;
import io.eventlog.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code eventlog.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link EventLogAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the {@link io.eventlog.EventLog} composite.
 */
@AutoConfiguration(before = EventLogAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "eventlog.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(EventLogProperties.class)
public class EventLogMicrometerAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(MetricsExporter.class)
    public MicrometerMetricsExporter micrometerMetricsExporter(MeterRegistry meterRegistry,
                                                               EventLogProperties props) {
        return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
