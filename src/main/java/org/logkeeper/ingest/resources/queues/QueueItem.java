package org.logkeeper.ingest.resources.queues;

import org.logkeeper.ingest.api.events.EventOrigin;
import org.logkeeper.ingest.api.events.IngestEvent;

import java.time.Instant;
import java.util.Objects;

/**
 * An event waiting in an {@link EventQueue}.
 *
 * @param event      The event.
 * @param enqueuedAt When the event entered the queue.
 * @param ticket     The commit ticket of the backfill page the event belongs to, or {@code null} for live events.
 */
public record QueueItem(IngestEvent event, Instant enqueuedAt, CommitTicket ticket) {

    public QueueItem {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(enqueuedAt, "enqueuedAt");
    }

    public static QueueItem live(IngestEvent event, Instant now) {
        return new QueueItem(event, now, null);
    }

    public EventOrigin origin() {
        return event.origin();
    }
}
