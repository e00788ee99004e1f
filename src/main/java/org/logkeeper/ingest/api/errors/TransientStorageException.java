package org.logkeeper.ingest.api.errors;

/**
 * A storage failure expected to clear up on its own (lost connection, timeout, lock
 * contention, busy server). Operations failing this way are retried.
 */
public class TransientStorageException extends StorageException {

    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public TransientStorageException(String message) {
        super(message, null);
    }
}
