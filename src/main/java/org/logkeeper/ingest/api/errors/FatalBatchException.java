package org.logkeeper.ingest.api.errors;

import org.logkeeper.ingest.api.events.EventKind;

/**
 * Signals that a batch was dropped after a fatal storage error or after its retries
 * exceeded the retry ceiling. Used to fail the commit tickets of the dropped items.
 */
public class FatalBatchException extends Exception {

    private final EventKind kind;
    private final int batchSize;

    public FatalBatchException(EventKind kind, int batchSize, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.batchSize = batchSize;
    }

    public EventKind getKind() {
        return kind;
    }

    public int getBatchSize() {
        return batchSize;
    }
}
