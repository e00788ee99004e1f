package org.logkeeper.ingest.api.errors;

/**
 * Thrown when a single event fails validation. The failure is item-scoped: the event is
 * dropped and the rest of its batch is still committed.
 */
public class ValidationException extends Exception {

    private final String field;

    public ValidationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public ValidationException(String field, String message, Throwable cause) {
        super(field + ": " + message, cause);
        this.field = field;
    }

    /**
     * @return The name of the offending field.
     */
    public String getField() {
        return field;
    }
}
