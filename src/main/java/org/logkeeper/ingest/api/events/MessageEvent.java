package org.logkeeper.ingest.api.events;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A chat message, either newly posted or edited.
 *
 * @param id         The message id.
 * @param scopeId    The channel the message was posted in.
 * @param guildId    The guild, or {@code null} for direct messages.
 * @param authorId   The author's user id.
 * @param authorName The author's display name at capture time.
 * @param content    The text content, may be {@code null} for attachment-only messages.
 * @param bot        Whether the author is a bot account.
 * @param system     Whether the message was generated by the platform.
 * @param webhookId  The webhook that posted the message, or {@code null}.
 * @param occurredAt When the message was created.
 * @param editedAt   When the message was last edited, or {@code null}.
 * @param attributes Attachments, embeds, mentions and other semi-structured data.
 * @param origin     The producing path.
 */
public record MessageEvent(
    String id,
    String scopeId,
    String guildId,
    String authorId,
    String authorName,
    String content,
    boolean bot,
    boolean system,
    String webhookId,
    Instant occurredAt,
    Instant editedAt,
    Map<String, Object> attributes,
    EventOrigin origin
) implements IngestEvent {

    public MessageEvent {
        attributes = attributes == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        origin = origin == null ? EventOrigin.LIVE : origin;
    }

    @Override
    public EventKind kind() {
        return EventKind.MESSAGE;
    }

    /**
     * An edit produces a newer version of the same message, so the edit timestamp wins when present.
     */
    @Override
    public Instant versionAt() {
        return editedAt != null ? editedAt : occurredAt;
    }

    @Override
    public MessageEvent withOrigin(EventOrigin newOrigin) {
        if (newOrigin == origin) {
            return this;
        }
        return new MessageEvent(id, scopeId, guildId, authorId, authorName, content, bot, system,
            webhookId, occurredAt, editedAt, attributes, newOrigin);
    }
}
