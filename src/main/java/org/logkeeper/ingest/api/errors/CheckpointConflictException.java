package org.logkeeper.ingest.api.errors;

/**
 * Thrown when a backfill run finds that another owner holds the backfill claim on its scope.
 */
public class CheckpointConflictException extends Exception {

    private final String scopeId;

    public CheckpointConflictException(String scopeId, String message) {
        super(message);
        this.scopeId = scopeId;
    }

    public String getScopeId() {
        return scopeId;
    }
}
