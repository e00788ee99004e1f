package org.logkeeper.ingest.services;

import org.logkeeper.ingest.PipelineSettings;
import org.logkeeper.ingest.api.errors.FatalBatchException;
import org.logkeeper.ingest.api.errors.PipelineShutdownException;
import org.logkeeper.ingest.api.errors.StorageException;
import org.logkeeper.ingest.api.errors.ValidationException;
import org.logkeeper.ingest.api.events.EventKind;
import org.logkeeper.ingest.api.events.EventOrigin;
import org.logkeeper.ingest.api.events.IngestEvent;
import org.logkeeper.ingest.api.storage.CheckpointKind;
import org.logkeeper.ingest.api.storage.IEventStore;
import org.logkeeper.ingest.api.storage.RejectedRow;
import org.logkeeper.ingest.api.storage.UpsertResult;
import org.logkeeper.ingest.checkpoint.CheckpointTracker;
import org.logkeeper.ingest.resources.queues.CommitTicket;
import org.logkeeper.ingest.resources.queues.EventQueue;
import org.logkeeper.ingest.resources.queues.QueueItem;
import org.logkeeper.ingest.retry.ErrorClass;
import org.logkeeper.ingest.retry.RetryPolicy;
import org.logkeeper.ingest.retry.Sleeper;
import org.logkeeper.ingest.utils.EventOrdering;
import org.logkeeper.ingest.validation.EventValidator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drains the event queues and writes their contents to the {@link IEventStore} in batches.
 * <p>
 * <strong>Flush triggers:</strong> a flush runs every {@code flushInterval}, or as soon as a queue
 * holds {@code batchSize} items ({@link #notifyEnqueued(EventKind)} releases a semaphore the writer
 * thread waits on, so producers never block).
 * <p>
 * <strong>Per batch:</strong>
 * <ol>
 *   <li>Invalid items are dropped and counted; the rest of the batch proceeds.</li>
 *   <li>Items with the same id are collapsed to the last-write-wins winner.</li>
 *   <li>One {@code upsertBatch} call per kind. Rows the store rejects are dropped and counted.</li>
 *   <li>On success the live checkpoint of each scope advances and backfill tickets are settled.</li>
 * </ol>
 * <p>
 * <strong>Failures:</strong> retryable storage errors are retried according to the {@link RetryPolicy}.
 * An exhausted batch is requeued at the front of its kind and retried on the next flush, until the
 * time since its first failure reaches the retry ceiling; then it is dropped as a fatal batch.
 * Fatal storage errors drop the batch immediately.
 * <p>
 * <strong>Shutdown:</strong> {@link #stop()} does not interrupt the writer. It finishes its current
 * batch, then drains and flushes what is left within {@code shutdownTimeout}. Items that could not
 * be written by then are given up, failing their tickets with {@link PipelineShutdownException}.
 * <p>
 * <strong>Thread Safety:</strong> all batch handling happens on the writer thread; the requeue slots
 * are confined to it. Counters and {@link #notifyEnqueued(EventKind)} are safe from any thread.
 */
public class BatchWriter extends AbstractService {

    private final Map<EventKind, EventQueue> queues;
    private final IEventStore store;
    private final CheckpointTracker checkpoints;
    private final EventValidator validator;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final Clock clock;

    private final int batchSize;
    private final Duration flushInterval;
    private final Duration shutdownTimeout;
    private final Duration retryCeiling;
    private final Duration maxRetryDelay;

    private final Semaphore flushSignal = new Semaphore(0);
    private final Map<EventKind, PendingBatch> requeued = new EnumMap<>(EventKind.class);

    private final Map<EventKind, AtomicLong> processed = new EnumMap<>(EventKind.class);
    private final AtomicLong batchesFlushed = new AtomicLong(0);
    private final AtomicLong batchesRequeued = new AtomicLong(0);
    private final AtomicLong fatalBatches = new AtomicLong(0);
    private final AtomicLong validationFailures = new AtomicLong(0);
    private final AtomicLong rejectedRows = new AtomicLong(0);
    private final AtomicLong collapsedDuplicates = new AtomicLong(0);
    private final AtomicLong lostEvents = new AtomicLong(0);
    private final AtomicLong checkpointFailures = new AtomicLong(0);

    /**
     * A batch that exhausted its retries and waits at the front of its kind.
     *
     * @param items          The validated items, in queue order.
     * @param firstFailureAt When the first write attempt of this batch failed.
     */
    private record PendingBatch(List<QueueItem> items, Instant firstFailureAt) {
    }

    /**
     * Creates a batch writer.
     *
     * @param name        The service name, also used as thread name.
     * @param queues      One queue per event kind.
     * @param store       The event storage.
     * @param checkpoints The tracker for live checkpoint updates.
     * @param validator   The item validator.
     * @param retryPolicy The retry policy for storage failures.
     * @param settings    The pipeline settings (batch and retry ceiling are used).
     * @param sleeper     Waits between retry attempts.
     * @param clock       Time source for retry budgets and the shutdown deadline.
     */
    public BatchWriter(String name, Map<EventKind, EventQueue> queues, IEventStore store, CheckpointTracker checkpoints,
                       EventValidator validator, RetryPolicy retryPolicy, PipelineSettings settings,
                       Sleeper sleeper, Clock clock) {
        super(name);
        this.queues = new EnumMap<>(queues);
        for (EventKind kind : EventKind.values()) {
            if (!this.queues.containsKey(kind)) {
                throw new IllegalArgumentException("No queue configured for " + kind);
            }
            processed.put(kind, new AtomicLong(0));
        }
        this.store = store;
        this.checkpoints = checkpoints;
        this.validator = validator;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.clock = clock;
        this.batchSize = settings.batch().size();
        this.flushInterval = settings.batch().flushInterval();
        this.shutdownTimeout = settings.batch().shutdownTimeout();
        this.retryCeiling = settings.retry().ceiling();
        this.maxRetryDelay = settings.retry().maxDelay();
    }

    @Override
    protected void logStarted() {
        log.info("BatchWriter started: batch=[size={}, interval={}ms], retry=[max={}, elapsed={}ms, ceiling={}ms]",
            batchSize, flushInterval.toMillis(), retryPolicy.getMaxAttempts(), retryPolicy.getMaxElapsed().toMillis(),
            retryCeiling.toMillis());
    }

    /**
     * Signals the writer after an enqueue. Triggers a flush once the queue of {@code kind} holds a
     * full batch. Never blocks.
     */
    public void notifyEnqueued(EventKind kind) {
        if (queues.get(kind).size() >= batchSize) {
            requestFlush();
        }
    }

    /**
     * Triggers a flush without waiting for the flush interval. Never blocks.
     */
    public void requestFlush() {
        if (flushSignal.availablePermits() == 0) {
            flushSignal.release();
        }
    }

    @Override
    protected void onStopRequested(Thread thread) {
        flushSignal.release();
    }

    @Override
    protected Duration getStopTimeout() {
        return shutdownTimeout.plus(maxRetryDelay).plusSeconds(5);
    }

    @Override
    protected void run() throws InterruptedException {
        while (!isStopRequested()) {
            flushSignal.tryAcquire(flushInterval.toMillis(), TimeUnit.MILLISECONDS);
            flushSignal.drainPermits();
            if (isStopRequested()) {
                break;
            }
            flushAll(null);
        }
        finalFlush();
    }

    /**
     * Flushes all kinds in rounds until the queues are empty. A kind whose batch was requeued
     * in this flush is skipped until the next one.
     *
     * @param deadline Latest time to start another write, or {@code null} for none.
     */
    private void flushAll(Instant deadline) throws InterruptedException {
        Set<EventKind> blocked = EnumSet.noneOf(EventKind.class);
        boolean progressed;
        do {
            progressed = false;
            for (EventKind kind : EventKind.values()) {
                if (blocked.contains(kind) || (deadline == null && isStopRequested())) {
                    continue;
                }
                if (deadline != null && !clock.instant().isBefore(deadline)) {
                    return;
                }
                FlushResult result = flushNext(kind, deadline);
                if (result == FlushResult.WRITTEN) {
                    progressed = true;
                } else if (result == FlushResult.REQUEUED) {
                    blocked.add(kind);
                }
            }
        } while (progressed && (deadline != null || !isStopRequested()));
    }

    private enum FlushResult {
        EMPTY,
        WRITTEN,
        REQUEUED
    }

    private FlushResult flushNext(EventKind kind, Instant deadline) throws InterruptedException {
        PendingBatch pending = requeued.remove(kind);
        List<QueueItem> items;
        Instant firstFailureAt = null;
        if (pending != null) {
            items = pending.items();
            firstFailureAt = pending.firstFailureAt();
        } else {
            items = queues.get(kind).drain(batchSize);
        }
        if (items.isEmpty()) {
            return FlushResult.EMPTY;
        }
        return writeBatch(kind, items, firstFailureAt, deadline);
    }

    private FlushResult writeBatch(EventKind kind, List<QueueItem> items,
                                   Instant firstFailureAt, Instant deadline) throws InterruptedException {
        List<QueueItem> valid = validate(kind, items);
        if (valid.isEmpty()) {
            return FlushResult.WRITTEN;
        }
        List<IngestEvent> events = collapse(valid);

        Instant cycleStart = clock.instant();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                UpsertResult result = store.upsertBatch(kind, events);
                onCommitted(kind, valid, result);
                return FlushResult.WRITTEN;
            } catch (StorageException | RuntimeException e) {
                Instant now = clock.instant();
                Instant failedSince = firstFailureAt != null ? firstFailureAt : cycleStart;

                if (retryPolicy.classify(e) == ErrorClass.FATAL) {
                    dropFatal(kind, valid, "non-retryable storage error", e);
                    return FlushResult.WRITTEN;
                }
                boolean retry = retryPolicy.shouldRetry(attempt, Duration.between(cycleStart, now))
                    && (deadline != null || !isStopRequested());
                Duration delay = retry ? retryPolicy.nextDelay(attempt) : Duration.ZERO;
                if (retry && deadline != null && now.plus(delay).isAfter(deadline)) {
                    retry = false;
                }
                if (!retry) {
                    return onExhausted(kind, valid, failedSince, attempt, e);
                }
                log.debug("Upsert of {} {} events failed (attempt {}/{}): {}, retrying in {}ms",
                    valid.size(), kind, attempt, retryPolicy.getMaxAttempts(), e.getMessage(), delay.toMillis());
                sleeper.sleep(delay);
            }
        }
    }

    private List<QueueItem> validate(
        EventKind kind, List<QueueItem> items) {
        List<QueueItem> valid = new ArrayList<>(items.size());
        for (QueueItem item : items) {
            try {
                validator.validate(item.event());
                valid.add(item);
            } catch (ValidationException e) {
                validationFailures.incrementAndGet();
                log.warn("Dropping invalid {} '{}': {}", kind, item.event().id(), e.getMessage());
                recordError("VALIDATION_FAILED", "Invalid " + kind + " dropped",
                    String.format("id=%s, scope=%s, field=%s, reason=%s",
                        item.event().id(), item.event().scopeId(), e.getField(), e.getMessage()));
                if (item.ticket() != null) {
                    item.ticket().markDropped(1);
                }
            }
        }
        return valid;
    }

    /**
     * Reduces the batch to one event per id, keeping the last-write-wins winner at the position
     * of the id's first occurrence.
     */
    private List<IngestEvent> collapse(List<QueueItem> items) {
        Map<String, IngestEvent> winners = new LinkedHashMap<>();
        for (QueueItem item : items) {
            IngestEvent event = item.event();
            IngestEvent current = winners.get(event.id());
            if (current == null) {
                winners.put(event.id(), event);
            } else {
                collapsedDuplicates.incrementAndGet();
                if (EventOrdering.supersedes(event, current)) {
                    winners.put(event.id(), event);
                }
            }
        }
        return new ArrayList<>(winners.values());
    }

    private void onCommitted(EventKind kind, List<QueueItem> items,
                             UpsertResult result) {
        Set<String> rejectedIds = new HashSet<>();
        for (RejectedRow row : result.rejected()) {
            rejectedIds.add(row.id());
        }
        if (!rejectedIds.isEmpty()) {
            rejectedRows.addAndGet(rejectedIds.size());
            log.warn("Storage rejected {} of {} {} rows", rejectedIds.size(), items.size(), kind);
            recordError("ROWS_REJECTED", "Storage rejected " + kind + " rows", "ids=" + rejectedIds);
        }

        Map<String, LiveProgress> liveProgress = new HashMap<>();
        int committed = 0;
        for (QueueItem item : items) {
            IngestEvent event = item.event();
            if (rejectedIds.contains(event.id())) {
                if (item.ticket() != null) {
                    item.ticket().markDropped(1);
                }
                continue;
            }
            committed++;
            if (item.ticket() != null) {
                item.ticket().markCommitted(1);
            }
            if (event.origin() == EventOrigin.LIVE) {
                liveProgress.computeIfAbsent(event.scopeId(), s -> new LiveProgress()).add(event);
            }
        }
        processed.get(kind).addAndGet(committed);
        batchesFlushed.incrementAndGet();
        log.debug("Flushed {} {} events ({} rows upserted, {} rejected)", committed, kind, result.upserted(), rejectedIds.size());

        for (Map.Entry<String, LiveProgress> entry : liveProgress.entrySet()) {
            LiveProgress progress = entry.getValue();
            try {
                checkpoints.advance(entry.getKey(), CheckpointKind.LIVE, progress.lastId, progress.lastAt, progress.count);
            } catch (StorageException e) {
                checkpointFailures.incrementAndGet();
                log.warn("Failed to advance live checkpoint of scope {}: {}", entry.getKey(), e.getMessage());
                recordError("CHECKPOINT_FAILED", "Live checkpoint not advanced",
                    String.format("scope=%s, position=%s@%s, error=%s", entry.getKey(), progress.lastId, progress.lastAt, e.getMessage()));
            }
        }
    }

    private FlushResult onExhausted(EventKind kind, List<QueueItem> items,
                                    Instant failedSince, int attempts, Exception cause) {
        Duration failingFor = Duration.between(failedSince, clock.instant());
        if (failingFor.compareTo(retryCeiling) >= 0) {
            dropFatal(kind, items, "still failing after " + failingFor.toMillis() + "ms", cause);
            return FlushResult.WRITTEN;
        }
        requeued.put(kind, new PendingBatch(items, failedSince));
        batchesRequeued.incrementAndGet();
        log.warn("Upsert of {} {} events failed after {} attempts, requeued: {}", items.size(), kind, attempts, cause.getMessage());
        recordError("BATCH_REQUEUED", "Batch requeued after exhausted retries",
            String.format("kind=%s, size=%d, attempts=%d, failingForMs=%d, error=%s",
                kind, items.size(), attempts, failingFor.toMillis(), cause.getMessage()));
        return FlushResult.REQUEUED;
    }

    private void dropFatal(EventKind kind, List<QueueItem> items,
                           String reason, Exception cause) {
        fatalBatches.incrementAndGet();
        String message = String.format("Dropped %s batch of %d events: %s: %s", kind, items.size(), reason, cause.getMessage());
        log.error(message);
        log.debug("Fatal batch cause:", cause);
        recordError("FATAL_BATCH", "Batch dropped", message);

        FatalBatchException failure = new FatalBatchException(kind, items.size(), message, cause);
        Set<CommitTicket> tickets = new LinkedHashSet<>();
        for (QueueItem item : items) {
            if (item.ticket() != null) {
                tickets.add(item.ticket());
            } else {
                lostEvents.incrementAndGet();
            }
        }
        tickets.forEach(ticket -> ticket.fail(failure));
    }

    private void finalFlush() throws InterruptedException {
        Instant deadline = clock.instant().plus(shutdownTimeout);
        try {
            flushAll(deadline);
        } finally {
            giveUpLeftovers();
        }
    }

    private void giveUpLeftovers() {
        for (EventKind kind : EventKind.values()) {
            List<QueueItem> leftovers = new ArrayList<>();
            PendingBatch pending = requeued.remove(kind);
            if (pending != null) {
                leftovers.addAll(pending.items());
            }
            leftovers.addAll(queues.get(kind).drain(Integer.MAX_VALUE));
            if (leftovers.isEmpty()) {
                continue;
            }
            PipelineShutdownException failure = new PipelineShutdownException(
                "Shutdown before " + leftovers.size() + " " + kind + " events were written");
            int live = 0;
            for (QueueItem item : leftovers) {
                if (item.ticket() != null) {
                    item.ticket().fail(failure);
                } else {
                    live++;
                }
            }
            lostEvents.addAndGet(live);
            log.warn("Shutdown: {} {} events not written within {}ms ({} live)",
                leftovers.size(), kind, shutdownTimeout.toMillis(), live);
            recordError("SHUTDOWN_UNFLUSHED", "Events not written before shutdown",
                String.format("kind=%s, count=%d, live=%d", kind, leftovers.size(), live));
        }
    }

    /**
     * Maximum (versionAt, id) position and item count of the live events of one scope in a batch.
     */
    private static final class LiveProgress {
        private String lastId;
        private Instant lastAt;
        private long count;

        void add(IngestEvent event) {
            count++;
            if (lastId == null || EventOrdering.comparePositions(event.versionAt(), event.id(), lastAt, lastId) > 0) {
                lastId = event.id();
                lastAt = event.versionAt();
            }
        }
    }

    public long getProcessedCount(EventKind kind) {
        return processed.get(kind).get();
    }

    public long getBatchesFlushed() {
        return batchesFlushed.get();
    }

    public long getBatchesRequeued() {
        return batchesRequeued.get();
    }

    public long getFatalBatches() {
        return fatalBatches.get();
    }

    public long getValidationFailures() {
        return validationFailures.get();
    }

    public long getRejectedRows() {
        return rejectedRows.get();
    }

    /**
     * @return Live events lost with fatal batches or at shutdown.
     */
    public long getLostEvents() {
        return lostEvents.get();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("messages_processed", processed.get(EventKind.MESSAGE).get());
        metrics.put("actions_processed", processed.get(EventKind.ACTION).get());
        metrics.put("batches_flushed", batchesFlushed.get());
        metrics.put("batches_requeued", batchesRequeued.get());
        metrics.put("fatal_batches", fatalBatches.get());
        metrics.put("validation_failures", validationFailures.get());
        metrics.put("rejected_rows", rejectedRows.get());
        metrics.put("collapsed_duplicates", collapsedDuplicates.get());
        metrics.put("lost_events", lostEvents.get());
        metrics.put("checkpoint_failures", checkpointFailures.get());
    }
}
