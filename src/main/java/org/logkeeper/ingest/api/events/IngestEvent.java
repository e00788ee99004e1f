package org.logkeeper.ingest.api.events;

import java.time.Instant;

/**
 * An immutable snapshot of an upstream event taken at ingestion time.
 * <p>
 * Implementations are records. The {@link #id()} is unique within the storage table of
 * the event's {@link #kind()}; storing the same id again overwrites the row according to
 * last-write-wins on {@link #versionAt()}.
 */
public interface IngestEvent {

    /**
     * @return The entity kind, which selects the queue and the storage table.
     */
    EventKind kind();

    /**
     * @return The stable external identifier assigned by the source.
     */
    String id();

    /**
     * @return The grouping key (typically a channel) under which checkpoints are tracked.
     */
    String scopeId();

    /**
     * @return The guild the scope belongs to, or {@code null} for direct conversations.
     */
    String guildId();

    /**
     * @return The source-assigned timestamp of the event.
     */
    Instant occurredAt();

    /**
     * @return Which path produced this event.
     */
    EventOrigin origin();

    /**
     * Returns the timestamp used for last-write-wins conflict resolution.
     * Defaults to {@link #occurredAt()}; variants with a finer version marker override it.
     *
     * @return The version timestamp.
     */
    default Instant versionAt() {
        return occurredAt();
    }

    default boolean isBackfilled() {
        return origin() == EventOrigin.BACKFILL;
    }

    /**
     * Returns a copy of this event tagged with the given origin.
     *
     * @param origin The new origin.
     * @return A copy, or this instance if the origin is unchanged.
     */
    IngestEvent withOrigin(EventOrigin origin);
}
