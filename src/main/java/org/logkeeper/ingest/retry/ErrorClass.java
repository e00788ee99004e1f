package org.logkeeper.ingest.retry;

/**
 * Result of classifying a failure.
 */
public enum ErrorClass {
    /** Expected to clear up; the operation is retried. */
    RETRYABLE,
    /** Retrying cannot help; the operation fails immediately. */
    FATAL
}
