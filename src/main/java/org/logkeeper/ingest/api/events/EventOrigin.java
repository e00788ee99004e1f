package org.logkeeper.ingest.api.events;

/**
 * Identifies which path produced an event. The origin travels with the event through the
 * shared queue and writer so both paths obey the same persistence contract.
 */
public enum EventOrigin {
    /** Delivered by the live event callback. */
    LIVE,
    /** Replayed from the paginated history by a backfill run. */
    BACKFILL
}
