package io.eventlog.projection;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe registry of projections with unique names.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ProjectionRegistry registry = new DefaultProjectionRegistry()
 *     .register(new DocumentViewProjection(dataSource))
 *     .register(new AuditTrailProjection(dataSource));
 * }</pre>
 *
 * @see Projection
 */
public final class DefaultProjectionRegistry implements ProjectionRegistry {
    private final Map<String, Projection> byName = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Projection> ordered = new CopyOnWriteArrayList<>();

    /**
     * Registers a projection.
     *
     * @param projection the projection
     * @return this registry for chaining
     * @throws IllegalArgumentException if a projection with the same name is registered
     */
    public DefaultProjectionRegistry register(Projection projection) {
        Objects.requireNonNull(projection, "projection");
        String name = Objects.requireNonNull(projection.name(), "projection.name()");
        if (byName.putIfAbsent(name, projection) != null) {
            throw new IllegalArgumentException("Duplicate projection name: " + name);
        }
        ordered.add(projection);
        return this;
    }

    @Override
    public List<Projection> all() {
        return List.copyOf(ordered);
    }

    @Override
    public Optional<Projection> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(byName.get(name));
    }
}
