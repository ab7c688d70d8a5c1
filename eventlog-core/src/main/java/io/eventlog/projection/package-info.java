/**
 * Projection contract and registry.
 *
 * <p>A {@link io.eventlog.projection.Projection} is any component with
 * {@code canHandle(event)} and {@code handle(event)}. The
 * {@linkplain io.eventlog.publish.ProjectionPublisher publisher} dispatches each appended
 * event to every projection that can handle it.
 */
package io.eventlog.projection;
