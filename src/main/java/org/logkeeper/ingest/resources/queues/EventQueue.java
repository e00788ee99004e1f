package org.logkeeper.ingest.resources.queues;

import org.logkeeper.ingest.api.events.EventKind;
import org.logkeeper.ingest.api.events.EventOrigin;
import org.logkeeper.ingest.api.source.EnqueueResult;
import org.logkeeper.ingest.resources.AbstractResource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A bounded, in-memory buffer for the events of one {@link EventKind}, based on
 * {@link ArrayBlockingQueue}. Producers never block: an item that does not fit is rejected.
 * <p>
 * Live and backfill items share the buffer, but backfill items are admitted only while the
 * buffer is below its backfill ceiling ({@code capacity * backfillShare}). The space above the
 * ceiling stays reserved for live events. The ceiling is soft under concurrent backfill producers
 * (each may overshoot by one item); the capacity itself is always enforced.
 */
public class EventQueue extends AbstractResource {

    private final EventKind kind;
    private final ArrayBlockingQueue<QueueItem> queue;
    private final int capacity;
    private final int backfillCapacity;

    private final AtomicLong totalEnqueued = new AtomicLong(0);
    private final AtomicLong totalDrained = new AtomicLong(0);
    private final AtomicLong droppedLive = new AtomicLong(0);
    private final AtomicLong deferredBackfill = new AtomicLong(0);

    /**
     * Constructs an EventQueue.
     *
     * @param kind          The kind of events this queue buffers.
     * @param capacity      The maximum number of buffered items.
     * @param backfillShare The fraction of the capacity backfill items may occupy, in (0, 1].
     * @throws IllegalArgumentException if capacity or share are out of range.
     */
    public EventQueue(EventKind kind, int capacity, double backfillShare) {
        super(kind.name().toLowerCase() + "-queue");
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive for resource '" + resourceName + "'.");
        }
        if (backfillShare <= 0.0 || backfillShare > 1.0) {
            throw new IllegalArgumentException("backfillShare must be in (0, 1] for resource '" + resourceName + "'.");
        }
        this.kind = kind;
        this.capacity = capacity;
        this.backfillCapacity = Math.max(1, (int) Math.floor(capacity * backfillShare));
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Offers an item without blocking.
     * <p>
     * A rejected live item is dropped and counted. A rejected backfill item is only counted as
     * deferred; its producer is expected to retry later.
     *
     * @param item The item to buffer.
     * @return {@link EnqueueResult#ACCEPTED} or {@link EnqueueResult#DROPPED_QUEUE_FULL}.
     */
    public EnqueueResult enqueue(QueueItem item) {
        if (item.event().kind() != kind) {
            throw new IllegalArgumentException("Queue '" + resourceName + "' only accepts " + kind + " events");
        }
        boolean backfill = item.origin() == EventOrigin.BACKFILL;
        if (backfill && queue.size() >= backfillCapacity) {
            deferredBackfill.incrementAndGet();
            return EnqueueResult.DROPPED_QUEUE_FULL;
        }
        if (queue.offer(item)) {
            totalEnqueued.incrementAndGet();
            return EnqueueResult.ACCEPTED;
        }
        if (backfill) {
            deferredBackfill.incrementAndGet();
        } else {
            droppedLive.incrementAndGet();
        }
        return EnqueueResult.DROPPED_QUEUE_FULL;
    }

    /**
     * Removes up to {@code maxItems} items in FIFO order without blocking.
     *
     * @param maxItems The maximum number of items to return.
     * @return The drained items, possibly empty.
     */
    public List<QueueItem> drain(int maxItems) {
        List<QueueItem> drained = new ArrayList<>(Math.min(maxItems, queue.size()));
        if (maxItems <= 0) {
            return drained;
        }
        int count = queue.drainTo(drained, maxItems);
        totalDrained.addAndGet(count);
        return drained;
    }

    public EventKind getKind() {
        return kind;
    }

    public int size() {
        return queue.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public int getBackfillCapacity() {
        return backfillCapacity;
    }

    /**
     * @return The number of live items dropped because the queue was full.
     */
    public long getDroppedCount() {
        return droppedLive.get();
    }

    /**
     * @return The number of backfill offers turned away by the backfill ceiling.
     */
    public long getDeferredBackfillCount() {
        return deferredBackfill.get();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("capacity", capacity);
        metrics.put("backfill_capacity", backfillCapacity);
        metrics.put("current_size", queue.size());
        metrics.put("total_enqueued", totalEnqueued.get());
        metrics.put("total_drained", totalDrained.get());
        metrics.put("dropped_live", droppedLive.get());
        metrics.put("deferred_backfill", deferredBackfill.get());
    }
}
