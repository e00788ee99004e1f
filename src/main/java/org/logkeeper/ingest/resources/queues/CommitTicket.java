package org.logkeeper.ingest.resources.queues;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks a group of queued items (one backfill page) until every item has been handled by
 * the batch writer. The ticket completes with the number of durably committed items once
 * all items are either committed or dropped as invalid, and fails as soon as one of its
 * items is lost with its batch.
 */
public final class CommitTicket {

    private final AtomicInteger outstanding;
    private final AtomicInteger committed = new AtomicInteger();
    private final CompletableFuture<Integer> completion = new CompletableFuture<>();

    public CommitTicket(int items) {
        if (items < 0) {
            throw new IllegalArgumentException("items must not be negative");
        }
        this.outstanding = new AtomicInteger(items);
        if (items == 0) {
            completion.complete(0);
        }
    }

    /**
     * Marks items as durably stored.
     */
    public void markCommitted(int count) {
        committed.addAndGet(count);
        release(count);
    }

    /**
     * Marks items as permanently dropped for item-scoped reasons (validation, rejected row).
     * They are handled, so they do not hold the ticket open.
     */
    public void markDropped(int count) {
        release(count);
    }

    /**
     * Fails the ticket. Has no effect if the ticket already completed.
     */
    public void fail(Throwable cause) {
        completion.completeExceptionally(cause);
    }

    public CompletableFuture<Integer> completion() {
        return completion;
    }

    public boolean isDone() {
        return completion.isDone();
    }

    public int outstanding() {
        return Math.max(0, outstanding.get());
    }

    private void release(int count) {
        if (outstanding.addAndGet(-count) <= 0) {
            completion.complete(committed.get());
        }
    }
}
