package org.logkeeper.ingest.api.storage;

import org.logkeeper.ingest.api.errors.StorageException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of processing progress per (scope, kind).
 * <p>
 * Progress and the backfill claim are written through separate operations: {@link #save(Checkpoint)}
 * never touches the claim columns, and the claim operations never touch progress. Every claim
 * transition is a conditional update on the stored row, so the claim is exclusive across
 * all instances sharing the store.
 */
public interface ICheckpointStore {

    Optional<Checkpoint> load(String scopeId, CheckpointKind kind) throws StorageException;

    /**
     * Upserts the progress fields of a checkpoint (last id, last timestamp, total).
     * Creates the row if it does not exist.
     *
     * @param checkpoint The checkpoint to persist.
     * @throws StorageException if the write failed.
     */
    void save(Checkpoint checkpoint) throws StorageException;

    /**
     * Claims the backfill of a scope. Succeeds only if no run holds the claim, the holder's
     * lease has expired (a crashed or paused run), or the holder is {@code ownerId} itself, which
     * lets a restarted instance resume the claim it left behind. Creates the BACKFILL row lazily.
     *
     * @param scopeId The scope.
     * @param ownerId The claiming instance.
     * @param now     The current time.
     * @param lease   How long the claim stays valid without renewal.
     * @return {@code true} if the claim was taken, {@code false} if another run holds it.
     * @throws StorageException if the store could not be reached.
     */
    boolean tryAcquireBackfill(String scopeId, String ownerId, Instant now, Duration lease) throws StorageException;

    /**
     * Extends the lease of a held claim.
     *
     * @return {@code false} if the claim is no longer held by {@code ownerId}.
     */
    boolean renewBackfillLease(String scopeId, String ownerId, Instant now, Duration lease) throws StorageException;

    /**
     * Releases a held claim according to the run's outcome. Does nothing if {@code ownerId}
     * no longer holds the claim.
     */
    void releaseBackfill(String scopeId, String ownerId, BackfillOutcome outcome, Instant now) throws StorageException;

    /**
     * @return All stored checkpoints, ordered by scope and kind.
     */
    List<Checkpoint> listAll() throws StorageException;
}
