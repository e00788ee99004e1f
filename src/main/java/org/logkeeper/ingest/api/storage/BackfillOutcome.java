package org.logkeeper.ingest.api.storage;

/**
 * How a backfill run released its claim on a scope.
 */
public enum BackfillOutcome {
    /** History exhausted. Clears the in-progress flag and stamps the completion time. */
    COMPLETED,
    /** Graceful stop. Keeps the in-progress flag and expires the lease so the next start resumes. */
    PAUSED,
    /** Unrecoverable failure. Clears the in-progress flag without a completion time. */
    ABORTED
}
