package org.logkeeper.ingest.api.storage;

import org.logkeeper.ingest.api.errors.StorageException;
import org.logkeeper.ingest.api.events.EventKind;
import org.logkeeper.ingest.api.events.IngestEvent;
import org.logkeeper.ingest.api.metadata.ChannelInfo;
import org.logkeeper.ingest.api.metadata.GuildInfo;

import java.util.List;
import java.util.Optional;

/**
 * The storage capability for events: upsert rows by their unique id.
 * <p>
 * Conflict resolution is last-write-wins on {@link IngestEvent#versionAt()}. On equal version
 * timestamps a live version replaces a backfilled one but not the other way round; between
 * versions of the same origin the later write wins. The capture time recorded on first
 * insert is never overwritten.
 * <p>
 * Guild and channel metadata is kept alongside the events, one row per id, and simply replaced
 * on every write.
 */
public interface IEventStore {

    /**
     * Upserts all events of one kind in a single storage call.
     *
     * @param kind   The kind of every event in the batch.
     * @param events The events to write, in enqueue order.
     * @return The number of rows written plus any individually refused rows.
     * @throws StorageException if the call as a whole failed; use the subclass to decide on retrying.
     */
    UpsertResult upsertBatch(EventKind kind, List<? extends IngestEvent> events) throws StorageException;

    /**
     * Reads back a stored event.
     *
     * @param kind The kind.
     * @param id   The event id.
     * @return The stored version, or empty if absent.
     * @throws StorageException if the read failed.
     */
    Optional<IngestEvent> findById(EventKind kind, String id) throws StorageException;

    /**
     * @param kind The kind.
     * @return The number of stored rows of that kind.
     * @throws StorageException if the read failed.
     */
    long count(EventKind kind) throws StorageException;

    /**
     * Inserts or replaces the metadata of a guild.
     *
     * @param guild The guild.
     * @throws StorageException if the write failed.
     */
    void upsertGuild(GuildInfo guild) throws StorageException;

    /**
     * Inserts or replaces the metadata of a channel.
     *
     * @param channel The channel.
     * @throws StorageException if the write failed.
     */
    void upsertChannel(ChannelInfo channel) throws StorageException;

    Optional<GuildInfo> findGuild(String guildId) throws StorageException;

    Optional<ChannelInfo> findChannel(String channelId) throws StorageException;
}
