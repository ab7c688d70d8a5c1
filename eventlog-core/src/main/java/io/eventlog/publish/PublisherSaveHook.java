package io.eventlog.publish;

import io.eventlog.DomainEvent;
import io.eventlog.repository.SaveHook;

import java.util.List;
import java.util.Objects;

/**
 * {@link SaveHook} that forwards committed events to a {@link ProjectionPublisher}.
 *
 * <p>In asynchronous mode (the default) the command thread returns as soon as the batch is
 * queued; in synchronous mode it waits until every projection has handled or recorded
 * a failure for every event.
 */
public final class PublisherSaveHook implements SaveHook {
    private final ProjectionPublisher publisher;
    private final boolean async;

    public PublisherSaveHook(ProjectionPublisher publisher) {
        this(publisher, true);
    }

    public PublisherSaveHook(ProjectionPublisher publisher, boolean async) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.async = async;
    }

    @Override
    public void afterSave(List<DomainEvent> events) {
        if (async) {
            publisher.publishAsync(events);
        } else {
            publisher.publishAll(events);
        }
    }
}
