package org.logkeeper.ingest.api.storage;

/**
 * A single row the storage refused (constraint or data error) while the rest of its batch was written.
 *
 * @param id     The event id of the refused row.
 * @param reason The storage's explanation.
 */
public record RejectedRow(String id, String reason) {
}
