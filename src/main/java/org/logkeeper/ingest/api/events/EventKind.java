package org.logkeeper.ingest.api.events;

/**
 * The entity kinds the pipeline persists. Each kind has its own queue and storage table.
 */
public enum EventKind {
    MESSAGE,
    ACTION
}
