package io.eventlog.projection;

import io.eventlog.DomainEvent;

import java.util.List;
import java.util.Optional;

/**
 * Lookup of registered projections, used by the publisher, the retry worker and the admin facade.
 *
 * @see DefaultProjectionRegistry
 */
public interface ProjectionRegistry {

    /**
     * All projections, in registration order.
     */
    List<Projection> all();

    /**
     * Finds a projection by name.
     */
    Optional<Projection> find(String name);

    /**
     * Projections whose {@link Projection#canHandle(DomainEvent)} accepts the event, in
     * registration order.
     */
    default List<Projection> projectionsFor(DomainEvent event) {
        return all().stream().filter(p -> p.canHandle(event)).toList();
    }
}
