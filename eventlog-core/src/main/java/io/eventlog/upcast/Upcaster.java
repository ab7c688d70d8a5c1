package io.eventlog.upcast;

import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Migrates an event payload or snapshot state from one schema version to the next.
 *
 * <p>An upcaster for schema version {@code n} produces the shape of version {@code n + 1}.
 * Chains are applied once, at load time.
 *
 * @see UpcasterRegistry
 */
public interface Upcaster {

    /**
     * Event type (for event upcasters) or aggregate type (for snapshot upcasters) this applies to.
     */
    String type();

    /**
     * The schema version this upcaster reads.
     */
    int fromSchemaVersion();

    /**
     * Converts a payload of {@link #fromSchemaVersion()} to the next version.
     *
     * @param payload the old payload (unmodifiable)
     * @return the migrated payload
     */
    Map<String, Object> upcast(Map<String, Object> payload);

    /**
     * Creates an upcaster from a function.
     */
    static Upcaster of(String type, int fromSchemaVersion, UnaryOperator<Map<String, Object>> fn) {
        return new Upcaster() {
            @Override
            public String type() {
                return type;
            }

            @Override
            public int fromSchemaVersion() {
                return fromSchemaVersion;
            }

            @Override
            public Map<String, Object> upcast(Map<String, Object> payload) {
                return fn.apply(payload);
            }
        };
    }
}
