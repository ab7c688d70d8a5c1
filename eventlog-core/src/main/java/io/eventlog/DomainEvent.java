package io.eventlog;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable domain event recorded in the event log.
 *
 * <p>{@code version} is the per-aggregate position (1-based, strictly consecutive).
 * {@code sequence} is the global position assigned by the store on append; it is
 * {@code 0} for events that have not been appended yet. Each event is assigned a
 * ULID-based {@code eventId} by default.
 *
 * <p>The payload is a structured map whose values are strings, numbers, booleans,
 * {@code null}, nested maps or lists. {@code schemaVersion} identifies the payload
 * shape and drives {@linkplain io.eventlog.upcast.UpcasterRegistry upcasting} at load time.
 */
public final class DomainEvent {
    private final String eventId;
    private final String aggregateId;
    private final String aggregateType;
    private final String eventType;
    private final long version;
    private final long sequence;
    private final int schemaVersion;
    private final Map<String, Object> payload;
    private final Instant occurredAt;

    private DomainEvent(Builder builder) {
        this.eventId = builder.eventId == null ? newEventId() : builder.eventId;
        this.eventType = Objects.requireNonNull(builder.eventType, "eventType");
        if (this.eventType.isEmpty()) {
            throw new IllegalArgumentException("eventType cannot be empty");
        }
        this.aggregateId = Objects.requireNonNull(builder.aggregateId, "aggregateId");
        this.aggregateType = Objects.requireNonNull(builder.aggregateType, "aggregateType");
        if (builder.version < 0) {
            throw new IllegalArgumentException("version must be >= 0, got: " + builder.version);
        }
        if (builder.sequence < 0) {
            throw new IllegalArgumentException("sequence must be >= 0, got: " + builder.sequence);
        }
        if (builder.schemaVersion < 1) {
            throw new IllegalArgumentException("schemaVersion must be >= 1, got: " + builder.schemaVersion);
        }
        this.version = builder.version;
        this.sequence = builder.sequence;
        this.schemaVersion = builder.schemaVersion;
        this.payload = builder.payload == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.payload));
        this.occurredAt = builder.occurredAt == null ? Instant.now() : builder.occurredAt;
    }

    /**
     * Creates a builder for an event of the given type.
     *
     * @param eventType the event type name
     * @return a new builder
     */
    public static Builder builder(String eventType) {
        return new Builder(eventType);
    }

    public String eventId() {
        return eventId;
    }

    public String aggregateId() {
        return aggregateId;
    }

    public String aggregateType() {
        return aggregateType;
    }

    public String eventType() {
        return eventType;
    }

    public long version() {
        return version;
    }

    public long sequence() {
        return sequence;
    }

    public int schemaVersion() {
        return schemaVersion;
    }

    public Map<String, Object> payload() {
        return payload;
    }

    public Instant occurredAt() {
        return occurredAt;
    }

    /**
     * Returns a copy of this event carrying the store-assigned global sequence.
     *
     * @param sequence the global sequence
     * @return a new event
     */
    public DomainEvent withSequence(long sequence) {
        return toBuilder().sequence(sequence).build();
    }

    /**
     * Returns a copy of this event with a payload migrated to a newer schema version.
     *
     * @param payload       the migrated payload
     * @param schemaVersion the payload's schema version
     * @return a new event
     */
    public DomainEvent withPayload(Map<String, Object> payload, int schemaVersion) {
        return toBuilder().payload(payload).schemaVersion(schemaVersion).build();
    }

    private Builder toBuilder() {
        return new Builder(eventType)
                .eventId(eventId)
                .aggregateId(aggregateId)
                .aggregateType(aggregateType)
                .version(version)
                .sequence(sequence)
                .schemaVersion(schemaVersion)
                .payload(payload)
                .occurredAt(occurredAt);
    }

    private static String newEventId() {
        return UlidCreator.getMonotonicUlid().toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DomainEvent other)) return false;
        return version == other.version
                && sequence == other.sequence
                && schemaVersion == other.schemaVersion
                && eventId.equals(other.eventId)
                && aggregateId.equals(other.aggregateId)
                && aggregateType.equals(other.aggregateType)
                && eventType.equals(other.eventType)
                && payload.equals(other.payload)
                && occurredAt.equals(other.occurredAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, aggregateId, version, sequence);
    }

    @Override
    public String toString() {
        return "DomainEvent{eventId=" + eventId
                + ", eventType=" + eventType
                + ", aggregateType=" + aggregateType
                + ", aggregateId=" + aggregateId
                + ", version=" + version
                + ", sequence=" + sequence
                + ", occurredAt=" + occurredAt
                + '}';
    }

    /**
     * Builder for {@link DomainEvent}.
     */
    public static final class Builder {
        private final String eventType;
        private String eventId;
        private String aggregateId;
        private String aggregateType;
        private long version;
        private long sequence;
        private int schemaVersion = 1;
        private Map<String, Object> payload;
        private Instant occurredAt;

        private Builder(String eventType) {
            this.eventType = eventType;
        }

        /**
         * Sets the event ID.
         *
         * <p>Optional. Defaults to a new monotonic ULID.
         *
         * @param eventId unique event identifier
         * @return this builder
         */
        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        /**
         * Sets the ID of the aggregate that produced the event.
         *
         * <p><b>Required.</b>
         *
         * @param aggregateId aggregate identifier
         * @return this builder
         */
        public Builder aggregateId(String aggregateId) {
            this.aggregateId = aggregateId;
            return this;
        }

        /**
         * Sets the aggregate type (e.g. {@code "Document"}).
         *
         * <p><b>Required.</b>
         *
         * @param aggregateType aggregate type name
         * @return this builder
         */
        public Builder aggregateType(String aggregateType) {
            this.aggregateType = aggregateType;
            return this;
        }

        /**
         * Sets the per-aggregate version of this event.
         *
         * <p>Optional. Defaults to {@code 0}; the store assigns versions on append.
         *
         * @param version per-aggregate version
         * @return this builder
         */
        public Builder version(long version) {
            this.version = version;
            return this;
        }

        /**
         * Sets the global sequence. Normally assigned by the store.
         *
         * @param sequence global sequence
         * @return this builder
         */
        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        /**
         * Sets the payload schema version.
         *
         * <p>Optional. Defaults to {@code 1}. Must be &ge; 1.
         *
         * @param schemaVersion payload schema version
         * @return this builder
         */
        public Builder schemaVersion(int schemaVersion) {
            this.schemaVersion = schemaVersion;
            return this;
        }

        /**
         * Sets the structured payload. The map is copied.
         *
         * <p>Optional. Defaults to an empty map.
         *
         * @param payload event payload
         * @return this builder
         */
        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        /**
         * Sets the time the event occurred.
         *
         * <p>Optional. Defaults to {@link Instant#now()}.
         *
         * @param occurredAt occurrence timestamp
         * @return this builder
         */
        public Builder occurredAt(Instant occurredAt) {
            this.occurredAt = occurredAt;
            return this;
        }

        public DomainEvent build() {
            return new DomainEvent(this);
        }
    }
}
