/**
 * Micrometer bridge for the event log's {@link io.eventlog.spi.MetricsExporter}.
 */
package io.eventlog.micrometer;
