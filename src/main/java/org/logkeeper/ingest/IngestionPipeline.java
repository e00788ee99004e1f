package org.logkeeper.ingest;

import org.logkeeper.ingest.api.dedup.IDeduplicator;
import org.logkeeper.ingest.api.errors.StorageException;
import org.logkeeper.ingest.api.events.EventKind;
import org.logkeeper.ingest.api.events.EventOrigin;
import org.logkeeper.ingest.api.events.IngestEvent;
import org.logkeeper.ingest.api.metadata.ChannelInfo;
import org.logkeeper.ingest.api.metadata.GuildInfo;
import org.logkeeper.ingest.api.resources.IMonitorable;
import org.logkeeper.ingest.api.resources.OperationalError;
import org.logkeeper.ingest.api.services.IService;
import org.logkeeper.ingest.api.source.EnqueueResult;
import org.logkeeper.ingest.api.source.IEventSink;
import org.logkeeper.ingest.api.source.IHistorySource;
import org.logkeeper.ingest.api.storage.ICheckpointStore;
import org.logkeeper.ingest.api.storage.IEventStore;
import org.logkeeper.ingest.checkpoint.CheckpointTracker;
import org.logkeeper.ingest.filter.EventFilter;
import org.logkeeper.ingest.resources.dedup.InMemoryDeduplicator;
import org.logkeeper.ingest.resources.queues.EventQueue;
import org.logkeeper.ingest.resources.queues.QueueItem;
import org.logkeeper.ingest.retry.RetryPolicy;
import org.logkeeper.ingest.retry.Sleeper;
import org.logkeeper.ingest.services.BatchWriter;
import org.logkeeper.ingest.services.backfill.BackfillCoordinator;
import org.logkeeper.ingest.services.backfill.BackfillStartResult;
import org.logkeeper.ingest.services.backfill.BackfillStatus;
import org.logkeeper.ingest.validation.EventValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Composition root of the ingestion pipeline. Owns the queues, the deduplicator, the batch
 * writer and the backfill coordinator, and is the {@link IEventSink} live sources deliver to.
 * <p>
 * <strong>Live path:</strong> {@link #submit(IngestEvent)} filters, deduplicates and enqueues
 * without blocking. Deduplication is an optimization only; storage upserts keep ingestion
 * idempotent without it.
 * <p>
 * <strong>Metadata path:</strong> guild and channel metadata that passes the filter is written
 * directly to the event store. A failed write is logged and counted, never thrown to the source.
 * <p>
 * <strong>Shutdown</strong> ({@link #stop()}): stop accepting, request a pause of all backfill
 * runs, stop the writer (which flushes what is buffered within its shutdown timeout), then wait
 * for the runs to settle in PAUSED.
 */
public class IngestionPipeline implements IEventSink {

    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private final PipelineSettings settings;
    private final IEventStore eventStore;
    private final ICheckpointStore checkpointStore;
    private final Clock clock;
    private final Map<EventKind, EventQueue> queues = new EnumMap<>(EventKind.class);
    private final IDeduplicator deduplicator;
    private final EventFilter filter;
    private final BatchWriter writer;
    private final BackfillCoordinator coordinator;

    private volatile boolean accepting = false;
    private volatile boolean started = false;

    private final AtomicLong duplicatesSkipped = new AtomicLong(0);
    private final AtomicLong filtered = new AtomicLong(0);
    private final AtomicLong rejectedStopped = new AtomicLong(0);
    private final AtomicLong metadataStored = new AtomicLong(0);
    private final AtomicLong metadataFailures = new AtomicLong(0);

    /**
     * Creates a pipeline with the system clock and real sleeps.
     */
    public IngestionPipeline(PipelineSettings settings, IEventStore eventStore, ICheckpointStore checkpointStore,
                             IHistorySource historySource) {
        this(settings, eventStore, checkpointStore, historySource, Sleeper.SYSTEM, Clock.systemUTC(),
            settings.backfill().ownerId() != null ? settings.backfill().ownerId() : localHostName());
    }

    /**
     * Creates a pipeline.
     *
     * @param settings        The validated settings.
     * @param eventStore      Storage for events.
     * @param checkpointStore Storage for checkpoints and backfill claims.
     * @param historySource   The history source for backfills.
     * @param sleeper         Waits between retries and pages.
     * @param clock           Time source.
     * @param ownerId         The identity of this instance in backfill claims.
     */
    public IngestionPipeline(PipelineSettings settings, IEventStore eventStore, ICheckpointStore checkpointStore,
                             IHistorySource historySource, Sleeper sleeper, Clock clock, String ownerId) {
        this.settings = settings;
        this.eventStore = eventStore;
        this.checkpointStore = checkpointStore;
        this.clock = clock;
        queues.put(EventKind.MESSAGE, new EventQueue(EventKind.MESSAGE,
            settings.queues().messagesCapacity(), settings.queues().backfillShare()));
        queues.put(EventKind.ACTION, new EventQueue(EventKind.ACTION,
            settings.queues().actionsCapacity(), settings.queues().backfillShare()));
        this.deduplicator = new InMemoryDeduplicator("deduplicator",
            settings.dedup().maxKeys(), settings.dedup().window(), clock);
        this.filter = new EventFilter(settings.filter());

        RetryPolicy retryPolicy = new RetryPolicy(settings.retry());
        CheckpointTracker checkpoints = new CheckpointTracker(checkpointStore);
        this.writer = new BatchWriter("batch-writer", queues, eventStore, checkpoints,
            new EventValidator(settings.maxContentLength()), retryPolicy, settings, sleeper, clock);
        this.coordinator = new BackfillCoordinator("backfill", historySource, this::enqueueBackfill,
            checkpoints, filter, retryPolicy, settings.backfill(), ownerId, sleeper, clock);
    }

    /**
     * Starts the writer, opens the live path and starts the configured startup backfills.
     *
     * @throws IllegalStateException if the pipeline was already started.
     */
    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Pipeline already started");
        }
        started = true;
        writer.start();
        accepting = true;
        coordinator.startConfigured();
        log.info("Ingestion pipeline started: queues=[messages={}, actions={}], batch={}, backfill=[page={}, runs={}]",
            settings.queues().messagesCapacity(), settings.queues().actionsCapacity(), settings.batch().size(),
            settings.backfill().pageSize(), settings.backfill().maxConcurrentRuns());
    }

    /**
     * Stops the pipeline gracefully. Safe to call more than once.
     */
    public synchronized void stop() {
        if (!started || !accepting) {
            return;
        }
        accepting = false;
        coordinator.pauseAll();
        if (writer.getCurrentState() == IService.State.RUNNING) {
            writer.stop();
        } else {
            log.warn("Batch writer is in state {}, buffered events are not flushed", writer.getCurrentState());
        }
        Duration runTimeout = settings.batch().shutdownTimeout().plusSeconds(5);
        if (!coordinator.awaitRuns(runTimeout)) {
            log.warn("Backfill runs did not settle within {}ms", runTimeout.toMillis());
        }
        log.info("Ingestion pipeline stopped: {} messages and {} actions written",
            writer.getProcessedCount(EventKind.MESSAGE), writer.getProcessedCount(EventKind.ACTION));
    }

    /**
     * Accepts a live event. Never blocks.
     *
     * @param event The event; its origin is treated as {@link EventOrigin#LIVE}.
     * @return What happened to the event.
     */
    @Override
    public EnqueueResult submit(IngestEvent event) {
        if (!accepting) {
            rejectedStopped.incrementAndGet();
            return EnqueueResult.REJECTED_STOPPED;
        }
        if (!filter.accepts(event)) {
            filtered.incrementAndGet();
            return EnqueueResult.FILTERED;
        }
        String key = dedupKey(event);
        if (deduplicator.seen(key)) {
            duplicatesSkipped.incrementAndGet();
            return EnqueueResult.DUPLICATE;
        }
        IngestEvent live = event.origin() == EventOrigin.LIVE ? event : event.withOrigin(EventOrigin.LIVE);
        EnqueueResult result = queues.get(live.kind()).enqueue(QueueItem.live(live, clock.instant()));
        if (result == EnqueueResult.ACCEPTED) {
            deduplicator.record(key);
            writer.notifyEnqueued(live.kind());
        } else {
            log.debug("Dropped live {} '{}': queue full", live.kind(), live.id());
            writer.requestFlush();
        }
        return result;
    }

    @Override
    public boolean storeGuild(GuildInfo guild) {
        if (!accepting || !filter.acceptsGuild(guild.guildId())) {
            return false;
        }
        try {
            eventStore.upsertGuild(guild);
            metadataStored.incrementAndGet();
            log.debug("Stored guild info for {} ({})", guild.name(), guild.guildId());
            return true;
        } catch (StorageException e) {
            metadataFailures.incrementAndGet();
            log.warn("Failed to store guild info for {}: {}", guild.guildId(), e.getMessage());
            return false;
        }
    }

    @Override
    public boolean storeChannel(ChannelInfo channel) {
        if (!accepting || !filter.acceptsGuild(channel.guildId()) || !filter.acceptsScope(channel.channelId())) {
            return false;
        }
        try {
            eventStore.upsertChannel(channel);
            metadataStored.incrementAndGet();
            log.debug("Stored channel info for {} ({})", channel.name(), channel.channelId());
            return true;
        } catch (StorageException e) {
            metadataFailures.incrementAndGet();
            log.warn("Failed to store channel info for {}: {}", channel.channelId(), e.getMessage());
            return false;
        }
    }

    private EnqueueResult enqueueBackfill(QueueItem item) {
        if (!accepting) {
            return EnqueueResult.REJECTED_STOPPED;
        }
        EventKind kind = item.event().kind();
        EnqueueResult result = queues.get(kind).enqueue(item);
        if (result == EnqueueResult.ACCEPTED) {
            writer.notifyEnqueued(kind);
        } else {
            writer.requestFlush();
        }
        return result;
    }

    /**
     * Deduplication key. The version is part of the key, so an edit of a seen event is not skipped.
     */
    static String dedupKey(IngestEvent event) {
        return event.kind() + ":" + event.id() + ":" + event.versionAt().toEpochMilli();
    }

    /**
     * Starts or resumes the backfill of a scope.
     *
     * @throws StorageException if the backfill claim could not be checked.
     */
    public BackfillStartResult startBackfill(String scopeId) throws StorageException {
        if (!accepting) {
            return BackfillStartResult.STOPPED;
        }
        return coordinator.start(scopeId);
    }

    /**
     * Requests a pause of the scope's backfill run.
     *
     * @return {@code false} if no run of the scope is active.
     */
    public boolean pauseBackfill(String scopeId) {
        return coordinator.pause(scopeId);
    }

    public Optional<BackfillStatus> getBackfillStatus(String scopeId) {
        return coordinator.getStatus(scopeId);
    }

    public PipelineStatistics getStatistics() {
        Map<EventKind, PipelineStatistics.QueueStatistics> queueStats = new EnumMap<>(EventKind.class);
        Map<EventKind, Long> processed = new EnumMap<>(EventKind.class);
        for (Map.Entry<EventKind, EventQueue> entry : queues.entrySet()) {
            EventQueue queue = entry.getValue();
            queueStats.put(entry.getKey(), new PipelineStatistics.QueueStatistics(
                queue.size(), queue.getCapacity(), queue.getDroppedCount(), queue.getDeferredBackfillCount()));
            processed.put(entry.getKey(), writer.getProcessedCount(entry.getKey()));
        }

        Map<String, OperationalError> lastErrors = new LinkedHashMap<>();
        for (Map.Entry<String, IMonitorable> component : components().entrySet()) {
            List<OperationalError> errors = component.getValue().getErrors();
            if (!errors.isEmpty()) {
                lastErrors.put(component.getKey(), errors.get(errors.size() - 1));
            }
        }

        return new PipelineStatistics(
            clock.instant(),
            accepting,
            queueStats,
            processed,
            duplicatesSkipped.get(),
            filtered.get(),
            rejectedStopped.get(),
            writer.getValidationFailures(),
            writer.getRejectedRows(),
            writer.getFatalBatches(),
            writer.getLostEvents(),
            coordinator.getStatuses(),
            lastErrors);
    }

    /**
     * @return The monitorable components by name, including the stores where they are monitorable.
     */
    public Map<String, IMonitorable> components() {
        Map<String, IMonitorable> components = new LinkedHashMap<>();
        components.put("batch-writer", writer);
        components.put("backfill", coordinator);
        queues.values().forEach(queue -> components.put(queue.getResourceName(), queue));
        if (deduplicator instanceof IMonitorable) {
            components.put("deduplicator", (IMonitorable) deduplicator);
        }
        if (eventStore instanceof IMonitorable) {
            components.put("event-store", (IMonitorable) eventStore);
        }
        if (checkpointStore instanceof IMonitorable && checkpointStore != eventStore) {
            components.put("checkpoint-store", (IMonitorable) checkpointStore);
        }
        return components;
    }

    /**
     * The pipeline is healthy while it accepts events, its writer runs and its event store is healthy.
     */
    public boolean isHealthy() {
        boolean storeHealthy = !(eventStore instanceof IMonitorable) || ((IMonitorable) eventStore).isHealthy();
        return accepting && writer.getCurrentState() == IService.State.RUNNING && storeHealthy;
    }

    public boolean isAccepting() {
        return accepting;
    }

    public long getMetadataStored() {
        return metadataStored.get();
    }

    public long getMetadataFailures() {
        return metadataFailures.get();
    }

    public PipelineSettings getSettings() {
        return settings;
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Local host name not resolvable, backfill claims use owner 'unknown-host': {}", e.getMessage());
            return "unknown-host";
        }
    }
}
