package org.logkeeper.node.processes.http.api.pipeline.dto;

import org.logkeeper.ingest.services.backfill.BackfillStatus;

import java.time.Instant;

/**
 * A Data Transfer Object for a backfill run. Timestamps are ISO-8601 strings, or {@code null}.
 */
public record BackfillStatusDto(
    String scopeId,
    String state,
    long pagesFetched,
    long itemsEnqueued,
    long itemsCommitted,
    long itemsSkipped,
    String cursor,
    String startedAt,
    String finishedAt,
    String lastError
) {
    public static BackfillStatusDto from(final BackfillStatus status) {
        return new BackfillStatusDto(
            status.scopeId(),
            status.state().name(),
            status.pagesFetched(),
            status.itemsEnqueued(),
            status.itemsCommitted(),
            status.itemsSkipped(),
            status.cursor(),
            format(status.startedAt()),
            format(status.finishedAt()),
            status.lastError());
    }

    private static String format(final Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
