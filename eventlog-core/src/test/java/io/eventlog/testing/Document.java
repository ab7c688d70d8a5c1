package io.eventlog.testing;

import io.eventlog.DomainEvent;
import io.eventlog.aggregate.Aggregate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sample aggregate: a titled document with an optional owner and tags.
 */
public final class Document extends Aggregate {
    public static final String TYPE = "Document";

    private String title;
    private String owner;
    private final List<String> tags = new ArrayList<>();
    private boolean archived;

    public Document(String id) {
        super(id);
    }

    public static Document create(String id, String title, String owner) {
        Document document = new Document(id);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", title);
        payload.put("owner", owner);
        document.raise("DocumentCreated", payload);
        return document;
    }

    public void rename(String newTitle) {
        if (archived) {
            throw new IllegalStateException("Document " + id() + " is archived");
        }
        raise("DocumentRenamed", Map.of("title", newTitle));
    }

    public void tag(String tag) {
        raise("DocumentTagged", Map.of("tag", tag));
    }

    public void archive() {
        raise("DocumentArchived", Map.of());
    }

    public String title() {
        return title;
    }

    public String owner() {
        return owner;
    }

    public List<String> tags() {
        return List.copyOf(tags);
    }

    public boolean archived() {
        return archived;
    }

    @Override
    public String aggregateType() {
        return TYPE;
    }

    @Override
    protected void when(DomainEvent event) {
        Map<String, Object> payload = event.payload();
        switch (event.eventType()) {
            case "DocumentCreated" -> {
                title = (String) payload.get("title");
                owner = (String) payload.get("owner");
            }
            case "DocumentRenamed" -> title = (String) payload.get("title");
            case "DocumentTagged" -> tags.add((String) payload.get("tag"));
            case "DocumentArchived" -> archived = true;
            default -> throw new IllegalArgumentException("Unknown event type " + event.eventType());
        }
    }

    @Override
    public Map<String, Object> serializeState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("title", title);
        state.put("owner", owner);
        state.put("tags", List.copyOf(tags));
        state.put("archived", archived);
        return state;
    }

    @Override
    public void restoreState(Map<String, Object> state) {
        title = (String) state.get("title");
        owner = (String) state.get("owner");
        tags.clear();
        Object storedTags = state.getOrDefault("tags", List.of());
        for (Object tag : (List<?>) storedTags) {
            tags.add((String) tag);
        }
        archived = Boolean.TRUE.equals(state.get("archived"));
    }
}
