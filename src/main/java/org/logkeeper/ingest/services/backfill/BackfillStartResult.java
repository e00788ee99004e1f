package org.logkeeper.ingest.services.backfill;

/**
 * Outcome of a backfill start request.
 */
public enum BackfillStartResult {
    STARTED,
    /** A run for the scope is active here or holds the claim on another instance. */
    ALREADY_RUNNING,
    /** The scope is excluded by the filter configuration. */
    FILTERED,
    /** The pipeline is not accepting work. */
    STOPPED
}
