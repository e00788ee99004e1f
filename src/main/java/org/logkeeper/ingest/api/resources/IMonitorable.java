package org.logkeeper.ingest.api.resources;

import java.util.List;
import java.util.Map;

/**
 * An interface for components that can be monitored.
 * <p>
 * Services and resources report metrics, recent operational errors and a health flag
 * through this interface. The statistics snapshot and the HTTP status endpoint read it.
 */
public interface IMonitorable {

    /**
     * Returns a map of metrics for the component.
     * <p>
     * The keys are metric names (e.g., "batches_flushed", "queue_size") and the
     * values are the corresponding numeric values.
     *
     * @return A map of metric names to their current values.
     */
    Map<String, Number> getMetrics();

    /**
     * Returns the operational errors recorded by the component, oldest first.
     *
     * @return A list of {@link OperationalError}s.
     */
    List<OperationalError> getErrors();

    /**
     * Clears the list of operational errors.
     */
    void clearErrors();

    /**
     * Indicates whether the component is currently operational.
     *
     * @return true if the component is healthy, false if it is in a degraded or failed state.
     */
    boolean isHealthy();
}
