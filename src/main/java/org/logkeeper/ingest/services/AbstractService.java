package org.logkeeper.ingest.services;

import org.logkeeper.ingest.api.resources.IMonitorable;
import org.logkeeper.ingest.api.resources.OperationalError;
import org.logkeeper.ingest.api.services.IService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An abstract base class for pipeline services, providing lifecycle management, thread
 * handling and error tracking. Subclasses implement {@link #run()}.
 * <p>
 * Error Tracking: Services use {@link #recordError(String, String, String)} to track
 * transient errors that affect data quality but don't require service termination.
 */
public abstract class AbstractService implements IService, IMonitorable {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String serviceName;
    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private volatile boolean stopRequested = false;
    private Thread serviceThread;

    /**
     * Operational errors that did not stop the service. Bounded by {@link #getMaxErrors()}.
     * Private to enforce use of {@link #recordError(String, String, String)}.
     */
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    protected int getMaxErrors() {
        return 10000;
    }

    protected AbstractService(String name) {
        this.serviceName = name;
    }

    @Override
    public final void start() {
        if (!currentState.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot start service '%s' as it is already in state %s", serviceName, getCurrentState()));
        }
        stopRequested = false;
        serviceThread = new Thread(this::runService);
        serviceThread.setName(serviceName);
        serviceThread.start();
        logStarted();
    }

    /**
     * Template method for logging service startup. Default implementation logs a simple message.
     */
    protected void logStarted() {
        log.info("{} started", this.getClass().getSimpleName());
    }

    @Override
    public final void stop() {
        State state = getCurrentState();
        if (state != State.RUNNING) {
            throw new IllegalStateException(String.format("Cannot stop service '%s' as it is in state %s", serviceName, state));
        }
        stopRequested = true;
        if (serviceThread != null) {
            onStopRequested(serviceThread);
            long timeoutMs = getStopTimeout().toMillis();
            try {
                serviceThread.join(timeoutMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted while waiting for service thread to stop", this.getClass().getSimpleName());
            }

            if (serviceThread.isAlive()) {
                log.error("{} thread did not stop within {} ms! Forcing ERROR state.", this.getClass().getSimpleName(), timeoutMs);
                serviceThread.interrupt();
                currentState.set(State.ERROR);
                return;
            }
        }
        if (getCurrentState() != State.STOPPED && getCurrentState() != State.ERROR) {
            currentState.set(State.STOPPED);
        }
        log.debug("{} stopped", this.getClass().getSimpleName());
    }

    /**
     * Signals the service thread to finish. The default interrupts it; services that need to
     * finish their current work gracefully override this and watch {@link #isStopRequested()}.
     *
     * @param thread The service thread.
     */
    protected void onStopRequested(Thread thread) {
        thread.interrupt();
    }

    /**
     * How long {@link #stop()} waits for the service thread before forcing the ERROR state.
     */
    protected Duration getStopTimeout() {
        return Duration.ofSeconds(5);
    }

    protected boolean isStopRequested() {
        return stopRequested;
    }

    @Override
    public State getCurrentState() {
        return currentState.get();
    }

    /**
     * Wraps {@link #run()} with error handling and state management.
     * <ul>
     *   <li><strong>Transient errors</strong>: caught inside {@code run()}, logged, recorded, service continues</li>
     *   <li><strong>Fatal errors</strong>: thrown out of {@code run()}, the service transitions to ERROR</li>
     * </ul>
     */
    private void runService() {
        try {
            run();
        } catch (InterruptedException e) {
            log.debug("Service thread interrupted, shutting down.");
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("{} stopped with ERROR due to {}: {}",
                this.getClass().getSimpleName(),
                e.getClass().getSimpleName(),
                e.getMessage());
            log.debug("Exception details:", e);
            currentState.set(State.ERROR);
        } finally {
            if (getCurrentState() != State.ERROR) {
                currentState.set(State.STOPPED);
            }
            log.debug("Service thread for {} has terminated.", this.getClass().getSimpleName());
        }
    }

    /**
     * The main logic of the service, executed in a dedicated thread.
     * <p>
     * <strong>Error Handling Guidelines:</strong>
     * <ul>
     *   <li><strong>Transient errors</strong>: {@code log.warn("message", args)} without the exception,
     *       plus {@link #recordError(String, String, String)}. Do not throw.</li>
     *   <li><strong>Fatal errors</strong>: {@code log.error("message", args)} and throw; the service
     *       goes to ERROR. Do not record.</li>
     *   <li><strong>Shutdown</strong>: re-throw {@link InterruptedException}.</li>
     *   <li><strong>Retry attempts</strong>: {@code log.debug()} only.</li>
     * </ul>
     * Stack traces are logged at DEBUG by this class; services never use {@code log.error(..., e)}.
     *
     * @throws InterruptedException if the service thread is interrupted.
     */
    protected abstract void run() throws InterruptedException;

    /**
     * Records an operational error for tracking and monitoring.
     *
     * @param code    Error code for categorization (e.g., "BATCH_REQUEUED", "FATAL_BATCH")
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
     * A service is healthy while it is not in the ERROR state. Recorded errors are reported
     * through {@link #getErrors()} and do not affect health.
     */
    @Override
    public boolean isHealthy() {
        return getCurrentState() != State.ERROR;
    }

    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook for service-specific metrics. Always call {@code super.addCustomMetrics(metrics)} first.
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }
}
