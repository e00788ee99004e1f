package org.logkeeper.ingest.resources.dedup;

import org.logkeeper.ingest.api.dedup.IDeduplicator;
import org.logkeeper.ingest.resources.AbstractResource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-size in-memory deduplicator with a guaranteed memory bound.
 * <p>
 * Keys are held in a synchronized {@link LinkedHashMap} in insertion order together with their
 * first-seen time. When {@code maxKeys} is reached the oldest key is evicted, so the number of
 * tracked keys never exceeds the ceiling regardless of traffic. With a non-zero window, keys
 * older than the window are treated as unseen and pruned from the head on the next write.
 * <p>
 * <strong>Limitations:</strong>
 * <ul>
 *   <li>Not shared between instances</li>
 *   <li>Lost on process restart</li>
 *   <li>A key reappearing after more than {@code maxKeys} newer keys is not detected</li>
 * </ul>
 * All three only cost a redundant, idempotent write.
 */
public class InMemoryDeduplicator extends AbstractResource implements IDeduplicator {

    private final LinkedHashMap<String, Instant> trackedKeys;
    private final int maxKeys;
    private final Duration window;
    private final Clock clock;

    private final AtomicLong totalChecks = new AtomicLong(0);
    private final AtomicLong totalDuplicates = new AtomicLong(0);
    private final AtomicLong totalEvictions = new AtomicLong(0);

    /**
     * Constructs an InMemoryDeduplicator.
     *
     * @param name    The resource name.
     * @param maxKeys Maximum number of keys to track before FIFO eviction.
     * @param window  How long a key counts as seen; {@link Duration#ZERO} disables expiry.
     * @param clock   Time source for first-seen timestamps.
     */
    public InMemoryDeduplicator(String name, int maxKeys, Duration window, Clock clock) {
        super(name);
        if (maxKeys <= 0) {
            throw new IllegalArgumentException("maxKeys must be positive for resource '" + name + "'.");
        }
        if (window.isNegative()) {
            throw new IllegalArgumentException("window must not be negative for resource '" + name + "'.");
        }
        this.maxKeys = maxKeys;
        this.window = window;
        this.clock = clock;
        this.trackedKeys = new LinkedHashMap<>(Math.min(maxKeys, 1 << 16));
    }

    @Override
    public synchronized boolean seen(String key) {
        totalChecks.incrementAndGet();
        return isLive(key, clock.instant());
    }

    @Override
    public synchronized void record(String key) {
        Instant now = clock.instant();
        pruneExpired(now);
        if (trackedKeys.remove(key) == null) {
            evictIfFull();
        }
        trackedKeys.put(key, now);
    }

    @Override
    public synchronized boolean checkAndRecord(String key) {
        totalChecks.incrementAndGet();
        Instant now = clock.instant();
        if (isLive(key, now)) {
            totalDuplicates.incrementAndGet();
            return false;
        }
        pruneExpired(now);
        trackedKeys.remove(key);
        evictIfFull();
        trackedKeys.put(key, now);
        return true;
    }

    @Override
    public synchronized int size() {
        return trackedKeys.size();
    }

    public int getMaxKeys() {
        return maxKeys;
    }

    public long getTotalEvictions() {
        return totalEvictions.get();
    }

    public long getTotalDuplicates() {
        return totalDuplicates.get();
    }

    private boolean isLive(String key, Instant now) {
        Instant firstSeen = trackedKeys.get(key);
        if (firstSeen == null) {
            return false;
        }
        return window.isZero() || firstSeen.plus(window).isAfter(now);
    }

    // Insertion order equals time order, so expired keys are always at the head.
    private void pruneExpired(Instant now) {
        if (window.isZero()) {
            return;
        }
        Iterator<Map.Entry<String, Instant>> iterator = trackedKeys.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, Instant> oldest = iterator.next();
            if (oldest.getValue().plus(window).isAfter(now)) {
                break;
            }
            iterator.remove();
        }
    }

    private void evictIfFull() {
        if (trackedKeys.size() >= maxKeys) {
            Iterator<String> iterator = trackedKeys.keySet().iterator();
            if (iterator.hasNext()) {
                iterator.next();
                iterator.remove();
                totalEvictions.incrementAndGet();
            }
        }
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("total_checks", totalChecks.get());
        metrics.put("total_duplicates_detected", totalDuplicates.get());
        metrics.put("tracked_keys", size());
        metrics.put("max_keys", maxKeys);
        metrics.put("total_evictions", totalEvictions.get());
        metrics.put("capacity_utilization_percent", (size() * 100.0) / maxKeys);
    }
}
