package org.logkeeper.ingest.resources.memory;

import org.logkeeper.ingest.api.storage.BackfillOutcome;
import org.logkeeper.ingest.api.storage.Checkpoint;
import org.logkeeper.ingest.api.storage.CheckpointKind;
import org.logkeeper.ingest.api.storage.ICheckpointStore;
import org.logkeeper.ingest.resources.AbstractResource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Checkpoint store held in process memory. All operations are synchronized, which makes the
 * claim operations atomic within one process. Shared state across processes needs the
 * relational store.
 */
public class InMemoryCheckpointStore extends AbstractResource implements ICheckpointStore {

    private final Map<Key, Checkpoint> rows = new HashMap<>();
    private final Clock clock;

    private record Key(String scopeId, CheckpointKind kind) {
    }

    public InMemoryCheckpointStore(String name, Clock clock) {
        super(name);
        this.clock = clock;
    }

    public InMemoryCheckpointStore() {
        this("memory-checkpoints", Clock.systemUTC());
    }

    @Override
    public synchronized Optional<Checkpoint> load(String scopeId, CheckpointKind kind) {
        return Optional.ofNullable(rows.get(new Key(scopeId, kind)));
    }

    @Override
    public synchronized void save(Checkpoint checkpoint) {
        Key key = new Key(checkpoint.scopeId(), checkpoint.kind());
        Checkpoint existing = rows.getOrDefault(key, Checkpoint.empty(checkpoint.scopeId(), checkpoint.kind()));
        rows.put(key, new Checkpoint(checkpoint.scopeId(), checkpoint.kind(), checkpoint.lastProcessedId(),
            checkpoint.lastProcessedAt(), checkpoint.totalProcessed(), existing.backfillInProgress(),
            existing.lastBackfillCompletedAt(), existing.backfillOwner(), existing.backfillLeaseUntil(),
            clock.instant()));
    }

    @Override
    public synchronized boolean tryAcquireBackfill(String scopeId, String ownerId, Instant now, Duration lease) {
        Key key = new Key(scopeId, CheckpointKind.BACKFILL);
        Checkpoint current = rows.getOrDefault(key, Checkpoint.empty(scopeId, CheckpointKind.BACKFILL));
        boolean free = !current.backfillInProgress()
            || current.backfillLeaseUntil() == null
            || !current.backfillLeaseUntil().isAfter(now)
            || Objects.equals(current.backfillOwner(), ownerId);
        if (!free) {
            return false;
        }
        rows.put(key, withClaim(current, true, ownerId, now.plus(lease), current.lastBackfillCompletedAt()));
        return true;
    }

    @Override
    public synchronized boolean renewBackfillLease(String scopeId, String ownerId, Instant now, Duration lease) {
        Key key = new Key(scopeId, CheckpointKind.BACKFILL);
        Checkpoint current = rows.get(key);
        if (current == null || !current.backfillInProgress() || !Objects.equals(current.backfillOwner(), ownerId)) {
            return false;
        }
        rows.put(key, withClaim(current, true, ownerId, now.plus(lease), current.lastBackfillCompletedAt()));
        return true;
    }

    @Override
    public synchronized void releaseBackfill(String scopeId, String ownerId, BackfillOutcome outcome, Instant now) {
        Key key = new Key(scopeId, CheckpointKind.BACKFILL);
        Checkpoint current = rows.get(key);
        if (current == null || !Objects.equals(current.backfillOwner(), ownerId)) {
            return;
        }
        Checkpoint released;
        switch (outcome) {
            case COMPLETED:
                released = withClaim(current, false, null, null, now);
                break;
            case PAUSED:
                released = withClaim(current, true, ownerId, now, current.lastBackfillCompletedAt());
                break;
            case ABORTED:
            default:
                released = withClaim(current, false, null, null, current.lastBackfillCompletedAt());
                break;
        }
        rows.put(key, released);
    }

    @Override
    public synchronized List<Checkpoint> listAll() {
        List<Checkpoint> all = new ArrayList<>(rows.values());
        all.sort(Comparator.comparing(Checkpoint::scopeId).thenComparing(Checkpoint::kind));
        return all;
    }

    private Checkpoint withClaim(Checkpoint current, boolean inProgress, String owner, Instant leaseUntil,
                                 Instant completedAt) {
        return new Checkpoint(current.scopeId(), current.kind(), current.lastProcessedId(), current.lastProcessedAt(),
            current.totalProcessed(), inProgress, completedAt, owner, leaseUntil, clock.instant());
    }
}
