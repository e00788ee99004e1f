package org.logkeeper.ingest.api.metadata;

/**
 * Descriptive data of a channel, i.e. of a scope.
 *
 * @param channelId   The channel id, equal to the scope id of its events.
 * @param guildId     The guild, or {@code null} for direct-message channels.
 * @param name        The channel name.
 * @param channelType The platform's channel type, e.g. {@code text} or {@code voice}.
 * @param topic       The topic, or {@code null}.
 * @param position    The sort position within the guild, or {@code null}.
 * @param categoryId  The parent category, or {@code null}.
 */
public record ChannelInfo(
    String channelId,
    String guildId,
    String name,
    String channelType,
    String topic,
    Integer position,
    String categoryId
) {

    public ChannelInfo {
        if (channelId == null || channelId.isBlank()) {
            throw new IllegalArgumentException("channelId must not be blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name of channel " + channelId + " must not be blank");
        }
        if (channelType == null || channelType.isBlank()) {
            throw new IllegalArgumentException("channelType of channel " + channelId + " must not be blank");
        }
    }
}
