package org.logkeeper.ingest;

import org.logkeeper.ingest.api.events.EventKind;
import org.logkeeper.ingest.api.resources.OperationalError;
import org.logkeeper.ingest.services.backfill.BackfillStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only snapshot of the pipeline's counters and states.
 *
 * @param capturedAt         When the snapshot was taken.
 * @param accepting          Whether the pipeline accepts events.
 * @param queues             Queue depth and drop counters per kind.
 * @param processed          Durably written events per kind.
 * @param duplicatesSkipped  Live events skipped by the deduplicator.
 * @param filtered           Live events excluded by the filter.
 * @param rejectedStopped    Live events rejected because the pipeline was stopped.
 * @param validationFailures Events dropped as invalid.
 * @param rejectedRows       Rows rejected by the storage.
 * @param fatalBatches       Batches dropped after a fatal or persistent storage failure.
 * @param lostEvents         Live events lost with fatal batches or at shutdown.
 * @param backfills          Backfill run snapshots by scope.
 * @param lastErrors         The most recent operational error per component.
 */
public record PipelineStatistics(
    Instant capturedAt,
    boolean accepting,
    Map<EventKind, QueueStatistics> queues,
    Map<EventKind, Long> processed,
    long duplicatesSkipped,
    long filtered,
    long rejectedStopped,
    long validationFailures,
    long rejectedRows,
    long fatalBatches,
    long lostEvents,
    Map<String, BackfillStatus> backfills,
    Map<String, OperationalError> lastErrors
) {

    public PipelineStatistics {
        queues = Map.copyOf(queues);
        processed = Map.copyOf(processed);
        backfills = Map.copyOf(backfills);
        lastErrors = Map.copyOf(lastErrors);
    }

    /**
     * @param size             Items currently buffered.
     * @param capacity         Maximum number of buffered items.
     * @param dropped          Live items dropped because the queue was full.
     * @param deferredBackfill Backfill offers turned away by the backfill ceiling.
     */
    public record QueueStatistics(int size, int capacity, long dropped, long deferredBackfill) {
    }
}
