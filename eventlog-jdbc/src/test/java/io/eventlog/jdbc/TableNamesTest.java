package io.eventlog.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableNamesTest {

    @Test
    void validTableNameReturnsName() {
        assertEquals("events", TableNames.validate("events"));
        assertEquals("EventLog", TableNames.validate("EventLog"));
        assertEquals("events_v2", TableNames.validate("events_v2"));
        assertEquals("_shadow", TableNames.validate("_shadow"));
    }

    @Test
    void defaultTableNames() {
        assertEquals("events", TableNames.EVENTS);
        assertEquals("snapshots", TableNames.SNAPSHOTS);
        assertEquals("projection_failures", TableNames.PROJECTION_FAILURES);
        assertEquals("projection_checkpoints", TableNames.PROJECTION_CHECKPOINTS);
        assertEquals("projection_health_metrics", TableNames.PROJECTION_HEALTH);
    }

    @Test
    void nullTableNameThrows() {
        assertThrows(NullPointerException.class, () -> TableNames.validate(null));
    }

    @Test
    void invalidTableNamesThrow() {
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1events"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("my-events"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("public.events"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("events; DROP TABLE x"));
    }

    @Test
    void storesValidateTableNames() {
        var dialect = new io.eventlog.jdbc.dialect.H2Dialect();
        var codec = new JacksonJsonCodec();
        assertThrows(IllegalArgumentException.class, () -> new JdbcEventLogStore(dialect, codec, "bad name"));
        assertThrows(IllegalArgumentException.class, () -> new JdbcSnapshotStore(dialect, codec, "bad name"));
        assertThrows(IllegalArgumentException.class, () ->
                new JdbcProjectionStore(dialect, "ok", "bad name", "ok2"));
    }
}
