package org.logkeeper.ingest.api.storage;

/**
 * Processing kinds with independent checkpoint rows per scope.
 */
public enum CheckpointKind {
    /** Progress of the live stream, advanced by the batch writer. */
    LIVE,
    /** Cursor of the historical replay, advanced by the backfill coordinator. */
    BACKFILL
}
