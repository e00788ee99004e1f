package org.logkeeper.ingest;

import org.logkeeper.ingest.api.events.ActionEvent;
import org.logkeeper.ingest.api.events.ActionType;
import org.logkeeper.ingest.api.events.EventOrigin;
import org.logkeeper.ingest.api.events.MessageEvent;

import java.time.Instant;
import java.util.Map;

/**
 * Factories for test events.
 */
public final class TestEvents {

    public static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    private TestEvents() {
    }

    public static MessageEvent message(String id, String scopeId, Instant occurredAt) {
        return message(id, scopeId, occurredAt, null, "content " + id, EventOrigin.LIVE);
    }

    public static MessageEvent message(String id, String scopeId, Instant occurredAt, Instant editedAt,
                                       String content, EventOrigin origin) {
        return new MessageEvent(id, scopeId, "guild-1", "author-1", "alice", content, false, false,
            null, occurredAt, editedAt, Map.of("pinned", false), origin);
    }

    public static MessageEvent botMessage(String id, String scopeId) {
        return new MessageEvent(id, scopeId, "guild-1", "bot-1", "helper", "beep", true, false,
            null, T0, null, Map.of(), EventOrigin.LIVE);
    }

    public static MessageEvent webhookMessage(String id, String scopeId, String webhookId) {
        return new MessageEvent(id, scopeId, "guild-1", "hook-1", "Deploy Bot", "deployed", true, false,
            webhookId, T0, null, Map.of(), EventOrigin.LIVE);
    }

    public static ActionEvent action(String id, String scopeId, Instant occurredAt) {
        return new ActionEvent(id, scopeId, "guild-1", ActionType.MEMBER_BAN, "mod-1", "user-9", occurredAt,
            Map.of("reason", "spam"), Map.of(), Map.of("banned", true), EventOrigin.LIVE);
    }
}
