package io.eventlog.projection;

import io.eventlog.DomainEvent;

/**
 * Handler for a single event type inside an {@link EventTypeProjection}.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(DomainEvent event) throws Exception;
}
