/**
 * Service provider interfaces: storage ({@link io.eventlog.spi.EventLogStore},
 * {@link io.eventlog.spi.SnapshotStore}, {@link io.eventlog.spi.ProjectionStore}),
 * connections ({@link io.eventlog.spi.ConnectionProvider}) and metrics
 * ({@link io.eventlog.spi.MetricsExporter}).
 *
 * <p>The built-in storage implementations live in the {@code eventlog-jdbc} module.
 */
package io.eventlog.spi;
