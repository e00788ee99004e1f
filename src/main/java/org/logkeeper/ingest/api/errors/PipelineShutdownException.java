package org.logkeeper.ingest.api.errors;

/**
 * Signals that work could not be completed because the pipeline is shutting down.
 */
public class PipelineShutdownException extends Exception {

    public PipelineShutdownException(String message) {
        super(message);
    }
}
