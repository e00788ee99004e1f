package org.logkeeper.ingest.resources.memory;

import org.logkeeper.ingest.api.events.EventKind;
import org.logkeeper.ingest.api.events.IngestEvent;
import org.logkeeper.ingest.api.metadata.ChannelInfo;
import org.logkeeper.ingest.api.metadata.GuildInfo;
import org.logkeeper.ingest.api.storage.IEventStore;
import org.logkeeper.ingest.api.storage.UpsertResult;
import org.logkeeper.ingest.resources.AbstractResource;
import org.logkeeper.ingest.utils.EventOrdering;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Event store held in process memory, with the same upsert semantics as the relational store.
 * Used for {@code storage.type = memory} and in tests.
 */
public class InMemoryEventStore extends AbstractResource implements IEventStore {

    private final Map<EventKind, ConcurrentHashMap<String, StoredRow>> tables = new EnumMap<>(EventKind.class);
    private final ConcurrentHashMap<String, GuildInfo> guilds = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ChannelInfo> channels = new ConcurrentHashMap<>();
    private final Clock clock;
    private final AtomicLong upsertCalls = new AtomicLong(0);
    private final AtomicLong rowsWritten = new AtomicLong(0);

    /**
     * A stored version plus the time it was first captured.
     *
     * @param event           The winning version.
     * @param firstCapturedAt When the id was first written.
     */
    public record StoredRow(IngestEvent event, Instant firstCapturedAt) {
    }

    public InMemoryEventStore(String name, Clock clock) {
        super(name);
        this.clock = clock;
        for (EventKind kind : EventKind.values()) {
            tables.put(kind, new ConcurrentHashMap<>());
        }
    }

    public InMemoryEventStore() {
        this("memory-events", Clock.systemUTC());
    }

    @Override
    public UpsertResult upsertBatch(EventKind kind, List<? extends IngestEvent> events) {
        upsertCalls.incrementAndGet();
        ConcurrentHashMap<String, StoredRow> table = tables.get(kind);
        Instant now = clock.instant();
        for (IngestEvent event : events) {
            table.compute(event.id(), (id, existing) -> {
                if (existing == null) {
                    return new StoredRow(event, now);
                }
                return EventOrdering.supersedes(event, existing.event())
                    ? new StoredRow(event, existing.firstCapturedAt())
                    : existing;
            });
        }
        rowsWritten.addAndGet(events.size());
        return UpsertResult.of(events.size());
    }

    @Override
    public Optional<IngestEvent> findById(EventKind kind, String id) {
        return findRow(kind, id).map(StoredRow::event);
    }

    @Override
    public long count(EventKind kind) {
        return tables.get(kind).size();
    }

    @Override
    public void upsertGuild(GuildInfo guild) {
        guilds.put(guild.guildId(), guild);
    }

    @Override
    public void upsertChannel(ChannelInfo channel) {
        channels.put(channel.channelId(), channel);
    }

    @Override
    public Optional<GuildInfo> findGuild(String guildId) {
        return Optional.ofNullable(guilds.get(guildId));
    }

    @Override
    public Optional<ChannelInfo> findChannel(String channelId) {
        return Optional.ofNullable(channels.get(channelId));
    }

    /**
     * @return The stored row including capture metadata.
     */
    public Optional<StoredRow> findRow(EventKind kind, String id) {
        return Optional.ofNullable(tables.get(kind).get(id));
    }

    public long getUpsertCalls() {
        return upsertCalls.get();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("upsert_calls", upsertCalls.get());
        metrics.put("rows_written", rowsWritten.get());
        metrics.put("guilds", guilds.size());
        metrics.put("channels", channels.size());
        for (EventKind kind : EventKind.values()) {
            metrics.put("rows_" + kind.name().toLowerCase(), tables.get(kind).size());
        }
    }
}
