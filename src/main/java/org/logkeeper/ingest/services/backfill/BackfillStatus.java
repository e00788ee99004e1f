package org.logkeeper.ingest.services.backfill;

import java.time.Instant;

/**
 * Read-only snapshot of a backfill run.
 *
 * @param scopeId        The scope being backfilled.
 * @param state          The current state.
 * @param pagesFetched   Number of history pages fetched.
 * @param itemsEnqueued  Number of items handed to the queues.
 * @param itemsCommitted Number of items durably written.
 * @param itemsSkipped   Number of items skipped by age or filter.
 * @param cursor         The id the next page starts after, or {@code null} at the beginning.
 * @param startedAt      When the run was started.
 * @param finishedAt     When the run reached a terminal state, or {@code null}.
 * @param lastError      The error that aborted the run, or {@code null}.
 */
public record BackfillStatus(
    String scopeId,
    BackfillState state,
    long pagesFetched,
    long itemsEnqueued,
    long itemsCommitted,
    long itemsSkipped,
    String cursor,
    Instant startedAt,
    Instant finishedAt,
    String lastError
) {
}
