package org.logkeeper.ingest.api.storage;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable progress marker for one (scope, kind) pair.
 *
 * @param scopeId                 The scope.
 * @param kind                    The processing kind.
 * @param lastProcessedId         The id of the last processed event, or {@code null} if none yet.
 * @param lastProcessedAt         The version timestamp of that event, or {@code null}.
 * @param totalProcessed          Monotonic counter of processed events.
 * @param backfillInProgress      Whether a backfill run holds (or paused with) the claim on the scope.
 * @param lastBackfillCompletedAt When the last backfill run completed, or {@code null}.
 * @param backfillOwner           The instance holding the backfill claim, or {@code null}.
 * @param backfillLeaseUntil      When the claim expires unless renewed, or {@code null}.
 * @param updatedAt               When the row was last written.
 */
public record Checkpoint(
    String scopeId,
    CheckpointKind kind,
    String lastProcessedId,
    Instant lastProcessedAt,
    long totalProcessed,
    boolean backfillInProgress,
    Instant lastBackfillCompletedAt,
    String backfillOwner,
    Instant backfillLeaseUntil,
    Instant updatedAt
) {

    public Checkpoint {
        Objects.requireNonNull(scopeId, "scopeId");
        Objects.requireNonNull(kind, "kind");
    }

    /**
     * Creates the initial state of a checkpoint that has never been written.
     */
    public static Checkpoint empty(String scopeId, CheckpointKind kind) {
        return new Checkpoint(scopeId, kind, null, null, 0L, false, null, null, null, null);
    }

    /**
     * Returns a copy with a new progress position and an incremented counter.
     *
     * @param id        The new last processed id.
     * @param at        The new last processed timestamp.
     * @param processed The number of events to add to {@link #totalProcessed()}.
     * @return The updated checkpoint.
     */
    public Checkpoint withProgress(String id, Instant at, long processed) {
        return new Checkpoint(scopeId, kind, id, at, totalProcessed + processed, backfillInProgress,
            lastBackfillCompletedAt, backfillOwner, backfillLeaseUntil, updatedAt);
    }
}
