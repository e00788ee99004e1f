package org.logkeeper.ingest.api.events;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A moderation or administrative action, typically taken from the audit log.
 *
 * @param id         The audit entry id.
 * @param scopeId    The channel (or guild, for guild-wide actions) the action is tracked under.
 * @param guildId    The guild the action happened in.
 * @param actionType The action type.
 * @param actorId    The user who performed the action, if known.
 * @param targetId   The affected user, message, role or channel, if any.
 * @param occurredAt When the action happened.
 * @param actionData Action-specific attributes (reason, counts, ...).
 * @param beforeData State before the action, for updates and deletions.
 * @param afterData  State after the action, for updates.
 * @param origin     The producing path.
 */
public record ActionEvent(
    String id,
    String scopeId,
    String guildId,
    ActionType actionType,
    String actorId,
    String targetId,
    Instant occurredAt,
    Map<String, Object> actionData,
    Map<String, Object> beforeData,
    Map<String, Object> afterData,
    EventOrigin origin
) implements IngestEvent {

    public ActionEvent {
        actionData = copyOf(actionData);
        beforeData = copyOf(beforeData);
        afterData = copyOf(afterData);
        origin = origin == null ? EventOrigin.LIVE : origin;
    }

    @Override
    public EventKind kind() {
        return EventKind.ACTION;
    }

    @Override
    public ActionEvent withOrigin(EventOrigin newOrigin) {
        if (newOrigin == origin) {
            return this;
        }
        return new ActionEvent(id, scopeId, guildId, actionType, actorId, targetId, occurredAt,
            actionData, beforeData, afterData, newOrigin);
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        return source == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
