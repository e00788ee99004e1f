package org.logkeeper.ingest.services.backfill;

/**
 * Lifecycle of a backfill run: {@code IDLE -> RUNNING -> COMPLETED | PAUSED | ABORTED}.
 */
public enum BackfillState {
    /** Claimed and queued for execution, not yet fetching. */
    IDLE,
    RUNNING,
    /** All history pages were written; the claim is released. */
    COMPLETED,
    /** Stopped on request or shutdown; the cursor and the claim flag are kept for resuming. */
    PAUSED,
    /** Stopped by a fatal error; the claim is released and the run is not resumed automatically. */
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == PAUSED || this == ABORTED;
    }
}
