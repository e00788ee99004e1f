package org.logkeeper.ingest.api.dedup;

/**
 * Bounded recency set used to skip redelivered live events.
 * <p>
 * This is a performance optimization only. Correctness never depends on it, because the
 * storage upserts by id; forgetting a key only costs a redundant write.
 */
public interface IDeduplicator {

    /**
     * @param key The event key.
     * @return {@code true} if the key was recorded within the tracking window.
     */
    boolean seen(String key);

    /**
     * Records a key, evicting the oldest entry if the capacity is reached.
     *
     * @param key The event key.
     */
    void record(String key);

    /**
     * Atomically checks and records a key.
     *
     * @param key The event key.
     * @return {@code true} if the key is new and has been recorded, {@code false} if it is a duplicate.
     */
    boolean checkAndRecord(String key);

    /**
     * @return The number of tracked keys.
     */
    int size();
}
