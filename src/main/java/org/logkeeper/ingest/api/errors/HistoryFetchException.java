package org.logkeeper.ingest.api.errors;

/**
 * Thrown by a history source when a page cannot be fetched. The source states whether the
 * failure is worth retrying (rate limits, server errors) or final (scope deleted, access revoked).
 */
public class HistoryFetchException extends Exception {

    private final boolean retryable;

    public HistoryFetchException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public HistoryFetchException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
