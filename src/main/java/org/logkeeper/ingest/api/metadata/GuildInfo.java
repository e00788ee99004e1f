package org.logkeeper.ingest.api.metadata;

import java.time.Instant;

/**
 * Descriptive data of a guild, refreshed whenever the source connects or joins the guild.
 *
 * @param guildId     The guild id.
 * @param name        The guild name.
 * @param description The description, or {@code null}.
 * @param ownerId     The owner's user id, or {@code null} if unknown.
 * @param memberCount The member count at capture time.
 * @param createdAt   When the guild was created, or {@code null} if unknown.
 * @param iconUrl     The icon URL, or {@code null}.
 * @param bannerUrl   The banner URL, or {@code null}.
 */
public record GuildInfo(
    String guildId,
    String name,
    String description,
    String ownerId,
    int memberCount,
    Instant createdAt,
    String iconUrl,
    String bannerUrl
) {

    public GuildInfo {
        if (guildId == null || guildId.isBlank()) {
            throw new IllegalArgumentException("guildId must not be blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name of guild " + guildId + " must not be blank");
        }
        if (memberCount < 0) {
            throw new IllegalArgumentException("memberCount of guild " + guildId + " must not be negative, got " + memberCount);
        }
    }
}
