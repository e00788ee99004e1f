package org.logkeeper.node.processes.http.api.pipeline.dto;

import org.logkeeper.ingest.PipelineStatistics;

/**
 * Depth and drop counters of one event queue.
 */
public record QueueStatusDto(
    int size,
    int capacity,
    long dropped,
    long deferredBackfill
) {
    public static QueueStatusDto from(final PipelineStatistics.QueueStatistics stats) {
        return new QueueStatusDto(stats.size(), stats.capacity(), stats.dropped(), stats.deferredBackfill());
    }
}
