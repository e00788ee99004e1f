package org.logkeeper.ingest.resources;

import org.logkeeper.ingest.api.resources.IMonitorable;
import org.logkeeper.ingest.api.resources.IResource;
import org.logkeeper.ingest.api.resources.OperationalError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Abstract base class for all IResource implementations, providing name handling and
 * monitoring infrastructure.
 * <p>
 * Follows the same error-tracking patterns as {@link org.logkeeper.ingest.services.AbstractService}.
 */
public abstract class AbstractResource implements IResource, IMonitorable {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String resourceName;

    /**
     * Operational errors that did not prevent the resource from functioning.
     * Private to enforce use of {@link #recordError(String, String, String)}.
     */
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    /**
     * Maximum number of errors to keep in memory. When exceeded, oldest errors are removed.
     */
    protected int getMaxErrors() {
        return 1000;
    }

    protected AbstractResource(String name) {
        this.resourceName = Objects.requireNonNull(name, "Resource name cannot be null");
    }

    @Override
    public String getResourceName() {
        return resourceName;
    }

    /**
     * Records an operational error for tracking and monitoring.
     * <p>
     * <strong>Error Handling Guidelines for Resources:</strong>
     * <ul>
     *   <li><strong>Transient errors</strong> (resource keeps working): {@code log.warn("message", args)}
     *       without the exception, plus this method. May still throw if the caller has to react.</li>
     *   <li><strong>Fatal errors</strong> (resource is broken): {@code log.error("message", args)} and throw.
     *       Do not record, the resource is unusable anyway.</li>
     *   <li><strong>Retry attempts</strong>: {@code log.debug()} only.</li>
     * </ul>
     * Stack traces go to DEBUG, never to {@code log.error(..., e)}.
     *
     * @param code    Error code for categorization (e.g., "WRITE_FAILED", "ROW_REJECTED")
     * @param message Human-readable error message
     * @param details Additional context about the error
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));

        int maxErrors = getMaxErrors();
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    /**
     * Any recorded error marks the resource unhealthy until the errors are cleared.
     * Subclasses with their own health criteria override this.
     */
    @Override
    public boolean isHealthy() {
        return errors.isEmpty();
    }

    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook for resource-specific metrics. Always call {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics Mutable map already containing the base metrics
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }
}
