package org.logkeeper.ingest.api.errors;

/**
 * A storage failure that retrying cannot fix (schema mismatch, missing permission, bad
 * credentials). Aborts the current batch or backfill run.
 */
public class FatalStorageException extends StorageException {

    public FatalStorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public FatalStorageException(String message) {
        super(message, null);
    }
}
