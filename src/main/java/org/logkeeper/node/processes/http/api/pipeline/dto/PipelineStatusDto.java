package org.logkeeper.node.processes.http.api.pipeline.dto;

import java.util.List;
import java.util.Map;

/**
 * The top-level object returned by the status endpoint.
 *
 * @param nodeId             A unique identifier for the node, typically the hostname.
 * @param status             "RUNNING", "DEGRADED" or "STOPPED".
 * @param capturedAt         ISO-8601 time of the snapshot.
 * @param queues             Queue status by event kind.
 * @param processed          Durably written events by event kind.
 * @param duplicatesSkipped  Live events skipped as duplicates.
 * @param filtered           Live events excluded by the filter.
 * @param rejectedStopped    Live events rejected while stopped.
 * @param validationFailures Events dropped as invalid.
 * @param rejectedRows       Rows rejected by the storage.
 * @param fatalBatches       Batches dropped after fatal storage failures.
 * @param lostEvents         Live events lost with fatal batches or at shutdown.
 * @param backfills          Backfill runs, ordered by scope.
 * @param components         Status of every monitorable component.
 */
public record PipelineStatusDto(
    String nodeId,
    String status,
    String capturedAt,
    Map<String, QueueStatusDto> queues,
    Map<String, Long> processed,
    long duplicatesSkipped,
    long filtered,
    long rejectedStopped,
    long validationFailures,
    long rejectedRows,
    long fatalBatches,
    long lostEvents,
    List<BackfillStatusDto> backfills,
    List<ComponentStatusDto> components
) {
}
