package org.logkeeper.ingest.api.errors;

/**
 * Base class for failures of the storage capability. Callers decide between retrying and
 * giving up by the concrete subclass, see {@link TransientStorageException} and
 * {@link FatalStorageException}.
 */
public abstract class StorageException extends Exception {

    protected StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
