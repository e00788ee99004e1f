package org.logkeeper.ingest.filter;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.logkeeper.ingest.PipelineSettings.FilterSettings;
import org.logkeeper.ingest.api.events.EventOrigin;
import org.logkeeper.ingest.api.events.MessageEvent;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.logkeeper.ingest.TestEvents.T0;
import static org.logkeeper.ingest.TestEvents.action;
import static org.logkeeper.ingest.TestEvents.botMessage;
import static org.logkeeper.ingest.TestEvents.message;

@Tag("unit")
class EventFilterTest {

    @Test
    void emptyListsAdmitEverything() {
        EventFilter filter = new EventFilter(new FilterSettings(Set.of(), Set.of(), Set.of(), Set.of(), true, false));

        assertThat(filter.accepts(message("1", "any", T0))).isTrue();
        assertThat(filter.accepts(action("a1", "any", T0))).isTrue();
    }

    @Test
    void ignoreListWinsOverAllowList() {
        EventFilter filter = new EventFilter(new FilterSettings(Set.of("s1", "s2"), Set.of("s2"), Set.of(), Set.of(), true, false));

        assertThat(filter.acceptsScope("s1")).isTrue();
        assertThat(filter.acceptsScope("s2")).isFalse();
        assertThat(filter.acceptsScope("s3")).isFalse();
    }

    @Test
    void guildFilterLetsDirectConversationsPass() {
        EventFilter filter = new EventFilter(new FilterSettings(Set.of(), Set.of(), Set.of("guild-1"), Set.of(), true, false));

        assertThat(filter.acceptsGuild("guild-1")).isTrue();
        assertThat(filter.acceptsGuild("guild-2")).isFalse();
        assertThat(filter.acceptsGuild(null)).isTrue();
    }

    @Test
    void botAndSystemMessagesFollowTheirSwitches() {
        MessageEvent system = new MessageEvent("2", "s1", "guild-1", "sys", "system", "joined", false, true,
            null, T0, null, Map.of(), EventOrigin.LIVE);

        EventFilter defaults = new EventFilter(new FilterSettings(Set.of(), Set.of(), Set.of(), Set.of(), true, false));
        assertThat(defaults.accepts(botMessage("1", "s1"))).isTrue();
        assertThat(defaults.accepts(system)).isFalse();

        EventFilter strict = new EventFilter(new FilterSettings(Set.of(), Set.of(), Set.of(), Set.of(), false, true));
        assertThat(strict.accepts(botMessage("1", "s1"))).isFalse();
        assertThat(strict.accepts(system)).isTrue();
    }
}
