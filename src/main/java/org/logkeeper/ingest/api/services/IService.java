package org.logkeeper.ingest.api.services;

import org.logkeeper.ingest.api.resources.OperationalError;

import java.util.List;

/**
 * The lifecycle contract of a long-running pipeline service.
 */
public interface IService {

    enum State {
        STOPPED,
        RUNNING,
        ERROR
    }

    /**
     * Starts the service on its own thread.
     *
     * @throws IllegalStateException if the service is not stopped.
     */
    void start();

    /**
     * Signals the service to stop and waits for its thread to terminate.
     *
     * @throws IllegalStateException if the service is not running.
     */
    void stop();

    State getCurrentState();

    List<OperationalError> getErrors();

    void clearErrors();
}
