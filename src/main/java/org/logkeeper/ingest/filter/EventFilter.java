package org.logkeeper.ingest.filter;

import org.logkeeper.ingest.PipelineSettings.FilterSettings;
import org.logkeeper.ingest.api.events.IngestEvent;
import org.logkeeper.ingest.api.events.MessageEvent;

/**
 * Decides which scopes, guilds and authors are ingested.
 * <p>
 * Ignore-lists take precedence over allow-lists; an empty allow-list admits everything.
 * Events without a guild (direct conversations) pass the guild check.
 */
public class EventFilter {

    private final FilterSettings settings;

    public EventFilter(FilterSettings settings) {
        this.settings = settings;
    }

    public boolean accepts(IngestEvent event) {
        if (!acceptsScope(event.scopeId()) || !acceptsGuild(event.guildId())) {
            return false;
        }
        if (event instanceof MessageEvent) {
            MessageEvent message = (MessageEvent) event;
            if (message.bot() && !settings.processBotMessages()) {
                return false;
            }
            return !message.system() || settings.processSystemMessages();
        }
        return true;
    }

    public boolean acceptsScope(String scopeId) {
        if (settings.ignoredScopes().contains(scopeId)) {
            return false;
        }
        return settings.allowedScopes().isEmpty() || settings.allowedScopes().contains(scopeId);
    }

    public boolean acceptsGuild(String guildId) {
        if (guildId == null) {
            return true;
        }
        if (settings.ignoredGuilds().contains(guildId)) {
            return false;
        }
        return settings.allowedGuilds().isEmpty() || settings.allowedGuilds().contains(guildId);
    }
}
