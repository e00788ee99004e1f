package org.logkeeper.ingest.services.backfill;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mutable state of one backfill run. Written by the run's worker thread, read by anyone
 * through {@link #snapshot()}.
 */
final class BackfillRun {

    private final String scopeId;
    private final Instant startedAt;
    private final CompletableFuture<BackfillState> completion = new CompletableFuture<>();

    private final AtomicLong pagesFetched = new AtomicLong(0);
    private final AtomicLong itemsEnqueued = new AtomicLong(0);
    private final AtomicLong itemsCommitted = new AtomicLong(0);
    private final AtomicLong itemsSkipped = new AtomicLong(0);

    private volatile BackfillState state = BackfillState.IDLE;
    private volatile boolean pauseRequested = false;
    private volatile String cursor;
    private volatile Instant finishedAt;
    private volatile String lastError;

    BackfillRun(String scopeId, Instant startedAt) {
        this.scopeId = scopeId;
        this.startedAt = startedAt;
    }

    String scopeId() {
        return scopeId;
    }

    BackfillState state() {
        return state;
    }

    boolean isActive() {
        return !state.isTerminal();
    }

    void markRunning(String cursor) {
        this.cursor = cursor;
        this.state = BackfillState.RUNNING;
    }

    void requestPause() {
        pauseRequested = true;
    }

    boolean isPauseRequested() {
        return pauseRequested;
    }

    void pageFetched() {
        pagesFetched.incrementAndGet();
    }

    void enqueued(long count) {
        itemsEnqueued.addAndGet(count);
    }

    void committed(long count) {
        itemsCommitted.addAndGet(count);
    }

    void skipped(long count) {
        itemsSkipped.addAndGet(count);
    }

    void advanceCursor(String cursor) {
        this.cursor = cursor;
    }

    void finish(BackfillState terminal, Instant at, String error) {
        this.lastError = error;
        this.finishedAt = at;
        this.state = terminal;
        completion.complete(terminal);
    }

    CompletableFuture<BackfillState> completion() {
        return completion;
    }

    BackfillStatus snapshot() {
        return new BackfillStatus(scopeId, state, pagesFetched.get(), itemsEnqueued.get(), itemsCommitted.get(),
            itemsSkipped.get(), cursor, startedAt, finishedAt, lastError);
    }
}
