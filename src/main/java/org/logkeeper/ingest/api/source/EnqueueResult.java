package org.logkeeper.ingest.api.source;

/**
 * The caller-visible outcome of handing an event to the pipeline. None of these is an error
 * for the caller; the pipeline never blocks or throws on the live path.
 */
public enum EnqueueResult {
    /** Buffered for the next flush. */
    ACCEPTED,
    /** Skipped because the same version was seen recently. */
    DUPLICATE,
    /** Skipped because its scope, guild or author type is excluded by configuration. */
    FILTERED,
    /** Dropped because the queue for its kind is full; counted in statistics. */
    DROPPED_QUEUE_FULL,
    /** Rejected because the pipeline is not accepting events (stopped or shutting down). */
    REJECTED_STOPPED
}
