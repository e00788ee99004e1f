package org.logkeeper.ingest.services.backfill;

import org.logkeeper.ingest.PipelineSettings.BackfillSettings;
import org.logkeeper.ingest.api.errors.CheckpointConflictException;
import org.logkeeper.ingest.api.errors.FatalBatchException;
import org.logkeeper.ingest.api.errors.HistoryFetchException;
import org.logkeeper.ingest.api.errors.PipelineShutdownException;
import org.logkeeper.ingest.api.errors.StorageException;
import org.logkeeper.ingest.api.events.EventOrigin;
import org.logkeeper.ingest.api.events.IngestEvent;
import org.logkeeper.ingest.api.source.EnqueueResult;
import org.logkeeper.ingest.api.source.HistoryPage;
import org.logkeeper.ingest.api.source.IHistorySource;
import org.logkeeper.ingest.api.storage.BackfillOutcome;
import org.logkeeper.ingest.api.storage.Checkpoint;
import org.logkeeper.ingest.api.storage.CheckpointKind;
import org.logkeeper.ingest.api.storage.ICheckpointStore;
import org.logkeeper.ingest.checkpoint.CheckpointTracker;
import org.logkeeper.ingest.filter.EventFilter;
import org.logkeeper.ingest.resources.AbstractResource;
import org.logkeeper.ingest.resources.queues.CommitTicket;
import org.logkeeper.ingest.resources.queues.QueueItem;
import org.logkeeper.ingest.retry.ErrorClass;
import org.logkeeper.ingest.retry.RetryPolicy;
import org.logkeeper.ingest.retry.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Runs per-scope backfills over an {@link IHistorySource}.
 * <p>
 * A run pages through the history of its scope from the stored BACKFILL cursor onwards, hands
 * each page to the queues as {@link EventOrigin#BACKFILL} items sharing one {@link CommitTicket},
 * waits for the batch writer to commit them, and only then moves the cursor past the page. A run
 * that stops for any reason therefore resumes after the last fully written page.
 * <p>
 * Only one run per scope exists across all instances sharing the checkpoint store: a run starts
 * only after {@link ICheckpointStore#tryAcquireBackfill} granted it the claim, and renews the
 * claim's lease after every page. Losing the lease aborts the run.
 * <p>
 * Runs execute on a fixed pool of {@code maxConcurrentRuns} threads; further runs wait in
 * {@link BackfillState#IDLE}.
 * <p>
 * A startup backfill whose scope is claimed by another owner is retried once that claim's lease
 * has run out, so a claim left behind by a crashed instance does not block the scope for good.
 */
public class BackfillCoordinator extends AbstractResource {

    private static final Duration DEFERRED_RETRY_DELAY = Duration.ofMillis(50);
    private static final Duration CLAIM_RETRY_GRACE = Duration.ofMillis(500);

    private final IHistorySource source;
    private final Function<QueueItem, EnqueueResult> enqueuer;
    private final CheckpointTracker checkpoints;
    private final ICheckpointStore claims;
    private final EventFilter filter;
    private final RetryPolicy retryPolicy;
    private final BackfillSettings settings;
    private final String ownerId;
    private final Sleeper sleeper;
    private final Clock clock;
    private final ExecutorService executor;
    private final ScheduledExecutorService claimRetries;

    private final ConcurrentHashMap<String, BackfillRun> runs = new ConcurrentHashMap<>();
    private volatile boolean accepting = true;

    private final AtomicLong runsStarted = new AtomicLong(0);
    private final AtomicLong runsCompleted = new AtomicLong(0);
    private final AtomicLong runsPaused = new AtomicLong(0);
    private final AtomicLong runsAborted = new AtomicLong(0);
    private final AtomicLong pagesFetched = new AtomicLong(0);
    private final AtomicLong deferredEnqueues = new AtomicLong(0);

    /**
     * Creates a coordinator.
     *
     * @param name        The resource name.
     * @param source      The history source.
     * @param enqueuer    Hands a backfill item to the queues. Returns {@link EnqueueResult#DROPPED_QUEUE_FULL}
     *                    when the item must be offered again later, {@link EnqueueResult#REJECTED_STOPPED}
     *                    when the pipeline stops.
     * @param checkpoints The tracker holding the BACKFILL cursors.
     * @param filter      The scope and item filter.
     * @param retryPolicy The retry policy for history fetches.
     * @param settings    The backfill settings.
     * @param ownerId     The identity of this instance in backfill claims.
     * @param sleeper     Waits between pages and retries.
     * @param clock       Time source for leases and the age limit.
     */
    public BackfillCoordinator(String name, IHistorySource source, Function<QueueItem, EnqueueResult> enqueuer,
                               CheckpointTracker checkpoints, EventFilter filter, RetryPolicy retryPolicy,
                               BackfillSettings settings, String ownerId, Sleeper sleeper, Clock clock) {
        super(name);
        this.source = source;
        this.enqueuer = enqueuer;
        this.checkpoints = checkpoints;
        this.claims = checkpoints.getStore();
        this.filter = filter;
        this.retryPolicy = retryPolicy;
        this.settings = settings;
        this.ownerId = ownerId;
        this.sleeper = sleeper;
        this.clock = clock;
        this.executor = Executors.newFixedThreadPool(settings.maxConcurrentRuns(), new RunThreadFactory(name));
        this.claimRetries = Executors.newSingleThreadScheduledExecutor(new RunThreadFactory(name + "-claim"));
    }

    /**
     * Starts a backfill of a scope, resuming from its stored cursor.
     *
     * @param scopeId The scope to backfill.
     * @return The outcome of the request.
     * @throws StorageException if the claim could not be checked.
     */
    public BackfillStartResult start(String scopeId) throws StorageException {
        if (!accepting) {
            return BackfillStartResult.STOPPED;
        }
        if (!filter.acceptsScope(scopeId)) {
            log.info("Backfill of scope {} not started: scope is filtered", scopeId);
            return BackfillStartResult.FILTERED;
        }
        synchronized (runs) {
            BackfillRun existing = runs.get(scopeId);
            if (existing != null && existing.isActive()) {
                log.info("Backfill of scope {} already running", scopeId);
                return BackfillStartResult.ALREADY_RUNNING;
            }
            if (!claims.tryAcquireBackfill(scopeId, ownerId, clock.instant(), settings.lease())) {
                log.info("Backfill of scope {} already running on another instance", scopeId);
                return BackfillStartResult.ALREADY_RUNNING;
            }
            BackfillRun run = new BackfillRun(scopeId, clock.instant());
            runs.put(scopeId, run);
            try {
                executor.execute(() -> execute(run));
            } catch (RejectedExecutionException e) {
                release(run, BackfillOutcome.PAUSED);
                run.finish(BackfillState.PAUSED, clock.instant(), null);
                return BackfillStartResult.STOPPED;
            }
            runsStarted.incrementAndGet();
            log.info("Backfill of scope {} started", scopeId);
            return BackfillStartResult.STARTED;
        }
    }

    /**
     * Starts the backfills configured to run at startup. Failures are logged per scope. Scopes
     * claimed by another owner are retried after the claim's lease expires.
     */
    public void startConfigured() {
        for (String scopeId : settings.startOnStartup()) {
            startConfigured(scopeId);
        }
    }

    private void startConfigured(String scopeId) {
        if (!accepting) {
            return;
        }
        try {
            BackfillStartResult result = start(scopeId);
            log.info("Startup backfill of scope {}: {}", scopeId, result);
            if (result == BackfillStartResult.ALREADY_RUNNING && !isRunningLocally(scopeId)) {
                scheduleClaimRetry(scopeId);
            }
        } catch (StorageException e) {
            log.warn("Startup backfill of scope {} could not be claimed: {}", scopeId, e.getMessage());
            recordError("BACKFILL_START_FAILED", "Startup backfill not started", "scope=" + scopeId + ", error=" + e.getMessage());
        }
    }

    private boolean isRunningLocally(String scopeId) {
        BackfillRun run = runs.get(scopeId);
        return run != null && run.isActive();
    }

    private void scheduleClaimRetry(String scopeId) {
        Instant now = clock.instant();
        Duration remaining = settings.lease();
        String holder = "another instance";
        try {
            Optional<Checkpoint> claim = claims.load(scopeId, CheckpointKind.BACKFILL);
            if (claim.isPresent() && claim.get().backfillLeaseUntil() != null) {
                remaining = Duration.between(now, claim.get().backfillLeaseUntil());
                holder = claim.get().backfillOwner();
            }
        } catch (StorageException e) {
            log.debug("Loading backfill claim of scope {} failed, retrying after a full lease: {}", scopeId, e.getMessage());
        }
        Duration delay = (remaining.isNegative() ? Duration.ZERO : remaining).plus(CLAIM_RETRY_GRACE);
        log.warn("Startup backfill of scope {} is claimed by {}, retrying in {}ms", scopeId, holder, delay.toMillis());
        try {
            claimRetries.schedule(() -> startConfigured(scopeId), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Coordinator stopping, claim retry of scope {} dropped", scopeId);
        }
    }

    /**
     * Requests a pause. The run stops after the page it is working on.
     *
     * @param scopeId The scope.
     * @return {@code false} if no run of the scope is active.
     */
    public boolean pause(String scopeId) {
        BackfillRun run = runs.get(scopeId);
        if (run == null || !run.isActive()) {
            return false;
        }
        run.requestPause();
        log.info("Pause of backfill of scope {} requested", scopeId);
        return true;
    }

    /**
     * Stops accepting starts and requests a pause of every active run.
     */
    public void pauseAll() {
        accepting = false;
        claimRetries.shutdownNow();
        runs.values().forEach(BackfillRun::requestPause);
    }

    /**
     * Waits for all runs to finish and shuts the pool down.
     *
     * @param timeout Maximum time to wait.
     * @return {@code true} if all runs finished in time.
     */
    public boolean awaitRuns(Duration timeout) {
        accepting = false;
        claimRetries.shutdownNow();
        executor.shutdown();
        try {
            if (executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            log.warn("Backfill runs did not finish within {}ms, interrupting", timeout.toMillis());
            executor.shutdownNow();
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            return false;
        }
    }

    public Optional<BackfillStatus> getStatus(String scopeId) {
        BackfillRun run = runs.get(scopeId);
        return run == null ? Optional.empty() : Optional.of(run.snapshot());
    }

    /**
     * @return Snapshots of all runs of this instance, by scope.
     */
    public Map<String, BackfillStatus> getStatuses() {
        Map<String, BackfillStatus> statuses = new TreeMap<>();
        runs.forEach((scope, run) -> statuses.put(scope, run.snapshot()));
        return statuses;
    }

    /**
     * @return A future completing with the terminal state of the scope's current run.
     */
    public Optional<CompletableFuture<BackfillState>> completion(String scopeId) {
        BackfillRun run = runs.get(scopeId);
        return run == null ? Optional.empty() : Optional.of(run.completion());
    }

    public int getActiveRuns() {
        return (int) runs.values().stream().filter(BackfillRun::isActive).count();
    }

    private void execute(BackfillRun run) {
        final String scopeId = run.scopeId();
        BackfillOutcome outcome = BackfillOutcome.ABORTED;
        String error = null;
        try {
            Checkpoint checkpoint = checkpoints.current(scopeId, CheckpointKind.BACKFILL)
                .orElse(Checkpoint.empty(scopeId, CheckpointKind.BACKFILL));
            String cursor = checkpoint.lastProcessedId();
            run.markRunning(cursor);
            log.debug("Backfill of scope {} running from cursor {}", scopeId, cursor);

            while (true) {
                if (run.isPauseRequested()) {
                    outcome = BackfillOutcome.PAUSED;
                    break;
                }
                HistoryPage page = fetchWithRetry(scopeId, cursor);
                run.pageFetched();
                pagesFetched.incrementAndGet();

                if (!page.items().isEmpty()) {
                    int committed = writePage(run, page.items());
                    IngestEvent last = page.items().get(page.items().size() - 1);
                    checkpoints.advance(scopeId, CheckpointKind.BACKFILL, last.id(), last.occurredAt(), committed);
                    cursor = last.id();
                    run.advanceCursor(cursor);
                }
                if (!page.hasMore()) {
                    outcome = BackfillOutcome.COMPLETED;
                    break;
                }
                if (!claims.renewBackfillLease(scopeId, ownerId, clock.instant(), settings.lease())) {
                    throw new CheckpointConflictException(scopeId, "backfill claim of scope " + scopeId + " was taken over");
                }
                if (!settings.pageDelay().isZero()) {
                    sleeper.sleep(settings.pageDelay());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = BackfillOutcome.PAUSED;
            log.debug("Backfill of scope {} interrupted", scopeId);
        } catch (PipelineShutdownException e) {
            outcome = BackfillOutcome.PAUSED;
            log.debug("Backfill of scope {} paused by shutdown: {}", scopeId, e.getMessage());
        } catch (HistoryFetchException | StorageException | CheckpointConflictException | FatalBatchException
                 | RuntimeException e) {
            outcome = BackfillOutcome.ABORTED;
            error = e.getClass().getSimpleName() + ": " + e.getMessage();
            log.error("Backfill of scope {} aborted: {}", scopeId, error);
            log.debug("Abort cause:", e);
            recordError("BACKFILL_ABORTED", "Backfill aborted", "scope=" + scopeId + ", error=" + error);
        } finally {
            release(run, outcome);
            BackfillState terminal = toState(outcome);
            run.finish(terminal, clock.instant(), error);
            countOutcome(outcome);
            log.info("Backfill of scope {} {}: {} pages, {} items committed", scopeId, terminal,
                run.snapshot().pagesFetched(), run.snapshot().itemsCommitted());
        }
    }

    private HistoryPage fetchWithRetry(String scopeId, String cursor) throws HistoryFetchException, InterruptedException {
        Instant cycleStart = clock.instant();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return source.fetchPage(scopeId, cursor, settings.pageSize());
            } catch (HistoryFetchException e) {
                boolean retry = retryPolicy.classify(e) == ErrorClass.RETRYABLE
                    && retryPolicy.shouldRetry(attempt, Duration.between(cycleStart, clock.instant()));
                if (!retry) {
                    throw e;
                }
                Duration delay = retryPolicy.nextDelay(attempt);
                log.debug("Fetching history of scope {} after {} failed (attempt {}/{}): {}, retrying in {}ms",
                    scopeId, cursor, attempt, retryPolicy.getMaxAttempts(), e.getMessage(), delay.toMillis());
                sleeper.sleep(delay);
            }
        }
    }

    /**
     * Enqueues the accepted items of a page and waits until they are committed.
     *
     * @return The number of committed items.
     */
    private int writePage(BackfillRun run, List<IngestEvent> items)
        throws InterruptedException, PipelineShutdownException, FatalBatchException {
        Instant oldestAllowed = settings.maxAge() != null ? clock.instant().minus(settings.maxAge()) : null;
        List<IngestEvent> accepted = new ArrayList<>(items.size());
        for (IngestEvent item : items) {
            if ((oldestAllowed != null && item.occurredAt().isBefore(oldestAllowed)) || !filter.accepts(item)) {
                continue;
            }
            accepted.add(item.withOrigin(EventOrigin.BACKFILL));
        }
        run.skipped(items.size() - accepted.size());
        if (accepted.isEmpty()) {
            return 0;
        }

        CommitTicket ticket = new CommitTicket(accepted.size());
        for (IngestEvent event : accepted) {
            QueueItem item = new QueueItem(event, clock.instant(), ticket);
            EnqueueResult result = enqueuer.apply(item);
            while (result == EnqueueResult.DROPPED_QUEUE_FULL) {
                deferredEnqueues.incrementAndGet();
                sleeper.sleep(DEFERRED_RETRY_DELAY);
                result = enqueuer.apply(item);
            }
            if (result == EnqueueResult.REJECTED_STOPPED) {
                throw new PipelineShutdownException("Pipeline stopped while enqueuing backfill of scope " + run.scopeId());
            }
        }
        run.enqueued(accepted.size());

        try {
            int committed = ticket.completion().get();
            run.committed(committed);
            return committed;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PipelineShutdownException) {
                throw (PipelineShutdownException) cause;
            }
            if (cause instanceof FatalBatchException) {
                throw (FatalBatchException) cause;
            }
            throw new IllegalStateException("Backfill page of scope " + run.scopeId() + " failed", cause);
        }
    }

    private void release(BackfillRun run, BackfillOutcome outcome) {
        try {
            claims.releaseBackfill(run.scopeId(), ownerId, outcome, clock.instant());
        } catch (StorageException e) {
            log.warn("Failed to release backfill claim of scope {} ({}): {}", run.scopeId(), outcome, e.getMessage());
            recordError("BACKFILL_RELEASE_FAILED", "Backfill claim not released",
                "scope=" + run.scopeId() + ", outcome=" + outcome + ", error=" + e.getMessage());
        }
    }

    private static BackfillState toState(BackfillOutcome outcome) {
        return switch (outcome) {
            case COMPLETED -> BackfillState.COMPLETED;
            case PAUSED -> BackfillState.PAUSED;
            case ABORTED -> BackfillState.ABORTED;
        };
    }

    private void countOutcome(BackfillOutcome outcome) {
        switch (outcome) {
            case COMPLETED -> runsCompleted.incrementAndGet();
            case PAUSED -> runsPaused.incrementAndGet();
            default -> runsAborted.incrementAndGet();
        }
    }

    /**
     * Aborted runs are reported through {@link #getErrors()} and {@link #getStatuses()}; they
     * affect only their scope, so the coordinator itself stays healthy.
     */
    @Override
    public boolean isHealthy() {
        return true;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("active_runs", getActiveRuns());
        metrics.put("runs_started", runsStarted.get());
        metrics.put("runs_completed", runsCompleted.get());
        metrics.put("runs_paused", runsPaused.get());
        metrics.put("runs_aborted", runsAborted.get());
        metrics.put("pages_fetched", pagesFetched.get());
        metrics.put("deferred_enqueues", deferredEnqueues.get());
    }

    private static final class RunThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        RunThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
