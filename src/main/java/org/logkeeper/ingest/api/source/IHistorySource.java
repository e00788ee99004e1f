package org.logkeeper.ingest.api.source;

import org.logkeeper.ingest.api.errors.HistoryFetchException;

/**
 * Pull-style access to the past events of a scope.
 */
public interface IHistorySource {

    /**
     * Fetches the page of events that directly follows {@code afterId}, oldest first.
     *
     * @param scopeId The scope to read.
     * @param afterId The id of the last event already processed, or {@code null} to start from the beginning.
     * @param limit   The page size hint.
     * @return The page; an empty page with {@code hasMore == false} ends the history.
     * @throws HistoryFetchException if the page could not be fetched.
     * @throws InterruptedException  if the calling thread was interrupted while waiting for the source.
     */
    HistoryPage fetchPage(String scopeId, String afterId, int limit) throws HistoryFetchException, InterruptedException;
}
