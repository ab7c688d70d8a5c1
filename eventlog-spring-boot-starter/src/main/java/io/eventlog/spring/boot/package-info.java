/**
 * Spring Boot auto-configuration for the event log.
 *
 * <p>{@link io.eventlog.spring.boot.EventLogAutoConfiguration} wires an {@link io.eventlog.EventLog}
 * instance from {@code eventlog.*} application properties. Every
 * {@link io.eventlog.projection.Projection} bean in the context is registered with the
 * projection registry by {@link io.eventlog.spring.boot.ProjectionBeanRegistrar}.
 *
 * @see io.eventlog.spring.boot.EventLogAutoConfiguration
 * @see io.eventlog.spring.boot.EventLogProperties
 */
package io.eventlog.spring.boot;
