package org.logkeeper.ingest.api.source;

import org.logkeeper.ingest.api.events.IngestEvent;

import java.util.List;

/**
 * One page of historical events, ordered oldest to newest.
 *
 * @param items   The events in the page.
 * @param hasMore Whether more pages follow after the last item.
 */
public record HistoryPage(List<IngestEvent> items, boolean hasMore) {

    public HistoryPage {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static HistoryPage last(List<IngestEvent> items) {
        return new HistoryPage(items, false);
    }
}
