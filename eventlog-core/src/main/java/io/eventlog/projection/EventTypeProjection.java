package io.eventlog.projection;

import io.eventlog.DomainEvent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Projection that routes events to handlers registered per event type.
 *
 * <pre>{@code
 * class DocumentViewProjection extends EventTypeProjection {
 *     DocumentViewProjection(DataSource ds) {
 *         super("document_view");
 *         on("DocumentCreated", this::upsertDocument);
 *         on("DocumentRenamed", this::renameDocument);
 *     }
 * }
 * }</pre>
 *
 * <p>Register handlers from the constructor only.
 */
public abstract class EventTypeProjection implements Projection {
    private final String name;
    private final Map<String, EventHandler> handlers = new LinkedHashMap<>();

    protected EventTypeProjection(String name) {
        this.name = Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be empty");
        }
    }

    /**
     * Registers the handler for one event type.
     *
     * @throws IllegalArgumentException if the event type already has a handler
     */
    protected final void on(String eventType, EventHandler handler) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(handler, "handler");
        if (handlers.putIfAbsent(eventType, handler) != null) {
            throw new IllegalArgumentException("Handler already registered for " + eventType + " in " + name);
        }
    }

    /**
     * Event types with a registered handler.
     */
    public Set<String> handledEventTypes() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public boolean canHandle(DomainEvent event) {
        return handlers.containsKey(event.eventType());
    }

    @Override
    public void handle(DomainEvent event) throws Exception {
        EventHandler handler = handlers.get(event.eventType());
        if (handler == null) {
            throw new IllegalArgumentException("Projection " + name + " cannot handle " + event.eventType());
        }
        handler.handle(event);
    }
}
