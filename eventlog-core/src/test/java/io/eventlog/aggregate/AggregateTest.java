package io.eventlog.aggregate;

import io.eventlog.DomainEvent;
import io.eventlog.model.Snapshot;
import io.eventlog.testing.Document;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AggregateTest {

    @Test
    void raisingAppliesAndQueuesEvents() {
        Document document = Document.create("doc-1", "Draft", "ana");
        document.rename("Final");

        assertEquals(2, document.version());
        assertEquals("Final", document.title());
        List<DomainEvent> pending = document.pendingEvents();
        assertEquals(2, pending.size());
        assertEquals(1, pending.get(0).version());
        assertEquals(2, pending.get(1).version());
        assertEquals("Document", pending.get(0).aggregateType());
        assertEquals(0, pending.get(0).sequence());
    }

    @Test
    void markCommittedClearsPendingButKeepsVersion() {
        Document document = Document.create("doc-1", "Draft", null);

        document.markCommitted();

        assertTrue(document.pendingEvents().isEmpty());
        assertEquals(1, document.version());
    }

    @Test
    void replayRejectsOutOfOrderEvents() {
        Document source = Document.create("doc-1", "Draft", null);
        source.rename("Final");
        DomainEvent second = source.pendingEvents().get(1);

        Document replayed = new Document("doc-1");

        assertThrows(IllegalStateException.class, () -> replayed.applyEvent(second));
    }

    @Test
    void replayRejectsEventsOfOtherAggregates() {
        DomainEvent foreign = Document.create("doc-2", "Other", null).pendingEvents().get(0);

        assertThrows(IllegalArgumentException.class, () -> new Document("doc-1").applyEvent(foreign));
    }

    @Test
    void snapshotRestoreEqualsFullReplay() {
        Document source = Document.create("doc-1", "Draft", null);
        source.tag("legal");
        source.rename("Contract");
        source.archive();

        Document replayed = new Document("doc-1");
        source.pendingEvents().forEach(replayed::applyEvent);

        Snapshot snapshot = source.toSnapshot();
        Document restored = new Document("doc-1");
        restored.restore(snapshot);

        assertEquals(replayed.serializeState(), restored.serializeState());
        assertEquals(replayed.version(), restored.version());
        assertNull(restored.owner());
        assertTrue(restored.archived());
    }

    @Test
    void restoreDefaultsMissingFields() {
        Document restored = new Document("doc-1");
        restored.restore(new Snapshot("doc-1", "Document", 3, 1, Map.of("title", "Old"), java.time.Instant.now()));

        assertEquals("Old", restored.title());
        assertEquals(List.of(), restored.tags());
        assertFalse(restored.archived());
        assertEquals(3, restored.version());
    }

    @Test
    void restoreOnlyIntoFreshAggregate() {
        Document document = Document.create("doc-1", "Draft", null);

        assertThrows(IllegalStateException.class, () -> document.restore(document.toSnapshot()));
    }

    @Test
    void rejectsEmptyId() {
        assertThrows(IllegalArgumentException.class, () -> new Document(""));
        assertThrows(NullPointerException.class, () -> new Document(null));
    }
}
