package org.logkeeper.ingest.checkpoint;

import org.logkeeper.ingest.api.errors.StorageException;
import org.logkeeper.ingest.api.storage.Checkpoint;
import org.logkeeper.ingest.api.storage.CheckpointKind;
import org.logkeeper.ingest.api.storage.ICheckpointStore;
import org.logkeeper.ingest.utils.EventOrdering;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes checkpoint updates per scope on top of an {@link ICheckpointStore}.
 * <p>
 * Each scope has its own lock, so updates of different scopes proceed in parallel while
 * read-modify-write cycles on the same scope never interleave. The stored position only moves
 * forward in {@code (lastProcessedAt, lastProcessedId)} order; an older position still adds its
 * item count but leaves the position untouched.
 */
public class CheckpointTracker {

    private static final Logger log = LoggerFactory.getLogger(CheckpointTracker.class);

    private final ICheckpointStore store;
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public CheckpointTracker(ICheckpointStore store) {
        this.store = store;
    }

    /**
     * Advances a checkpoint to the given position if it is newer than the stored one.
     *
     * @param scopeId   The scope.
     * @param kind      Which cursor to advance.
     * @param id        Id of the last processed item.
     * @param at        Time of the last processed item.
     * @param processed Number of items processed since the previous update.
     * @return The checkpoint as stored after the update.
     * @throws StorageException if the store fails.
     */
    public Checkpoint advance(String scopeId, CheckpointKind kind, String id, Instant at, long processed)
        throws StorageException {
        ReentrantLock lock = locks.computeIfAbsent(scopeId, k -> new ReentrantLock());
        lock.lock();
        try {
            Checkpoint current = store.load(scopeId, kind).orElse(Checkpoint.empty(scopeId, kind));
            boolean newer = current.lastProcessedId() == null
                || EventOrdering.comparePositions(at, id, current.lastProcessedAt(), current.lastProcessedId()) > 0;
            Checkpoint updated = newer
                ? current.withProgress(id, at, processed)
                : current.withProgress(current.lastProcessedId(), current.lastProcessedAt(), processed);
            if (!newer) {
                log.debug("Checkpoint {}/{} already past {}, only counting {} items", scopeId, kind, id, processed);
            }
            store.save(updated);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Loads a checkpoint under the scope lock, so the result reflects all completed updates.
     */
    public Optional<Checkpoint> current(String scopeId, CheckpointKind kind) throws StorageException {
        ReentrantLock lock = locks.computeIfAbsent(scopeId, k -> new ReentrantLock());
        lock.lock();
        try {
            return store.load(scopeId, kind);
        } finally {
            lock.unlock();
        }
    }

    public ICheckpointStore getStore() {
        return store;
    }
}
