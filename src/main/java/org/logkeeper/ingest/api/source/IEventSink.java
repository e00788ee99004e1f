package org.logkeeper.ingest.api.source;

import org.logkeeper.ingest.api.events.IngestEvent;
import org.logkeeper.ingest.api.metadata.ChannelInfo;
import org.logkeeper.ingest.api.metadata.GuildInfo;

/**
 * Callback through which the event source delivers live events, one at a time, at least once.
 * {@link #submit(IngestEvent)} must return promptly and never block on I/O.
 * <p>
 * Guild and channel metadata arrives rarely, when the source connects or joins a guild, and is
 * written straight through. Sinks without metadata storage keep the defaults, which store nothing.
 */
@FunctionalInterface
public interface IEventSink {

    EnqueueResult submit(IngestEvent event);

    /**
     * @return {@code true} if the guild metadata was stored.
     */
    default boolean storeGuild(GuildInfo guild) {
        return false;
    }

    /**
     * @return {@code true} if the channel metadata was stored.
     */
    default boolean storeChannel(ChannelInfo channel) {
        return false;
    }
}
