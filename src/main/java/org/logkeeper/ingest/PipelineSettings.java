package org.logkeeper.ingest;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validated settings of the ingestion pipeline, read from the {@code pipeline} block of the
 * HOCON configuration. Missing keys fall back to the built-in defaults, which mirror
 * {@code reference.conf}.
 */
public record PipelineSettings(
    QueueSettings queues,
    BatchSettings batch,
    RetrySettings retry,
    BackfillSettings backfill,
    DedupSettings dedup,
    FilterSettings filter,
    int maxContentLength
) {

    private static final Config DEFAULTS = ConfigFactory.parseMap(Map.ofEntries(
        Map.entry("queues.messages.capacity", 10000),
        Map.entry("queues.actions.capacity", 10000),
        Map.entry("queues.backfill-share", 0.5),
        Map.entry("batch.size", 50),
        Map.entry("batch.flush-interval-ms", 30000),
        Map.entry("batch.shutdown-timeout-ms", 10000),
        Map.entry("retry.max-attempts", 3),
        Map.entry("retry.initial-delay-ms", 4000),
        Map.entry("retry.multiplier", 2.0),
        Map.entry("retry.max-delay-ms", 10000),
        Map.entry("retry.jitter-factor", 0.2),
        Map.entry("retry.max-elapsed-ms", 60000),
        Map.entry("retry.ceiling-ms", 600000),
        Map.entry("backfill.page-size", 100),
        Map.entry("backfill.page-delay-ms", 1000),
        Map.entry("backfill.lease-ms", 300000),
        Map.entry("backfill.max-concurrent-runs", 2),
        Map.entry("backfill.start-on-startup", List.of()),
        Map.entry("backfill.owner-id", ""),
        Map.entry("dedup.max-keys", 10000),
        Map.entry("dedup.window-ms", 300000),
        Map.entry("filter.allowed-scopes", List.of()),
        Map.entry("filter.ignored-scopes", List.of()),
        Map.entry("filter.allowed-guilds", List.of()),
        Map.entry("filter.ignored-guilds", List.of()),
        Map.entry("filter.process-bot-messages", true),
        Map.entry("filter.process-system-messages", false),
        Map.entry("validation.max-content-length", 4000)
    ));

    /**
     * @param messagesCapacity Capacity of the message queue.
     * @param actionsCapacity  Capacity of the action queue.
     * @param backfillShare    Fraction of each queue backfill items may occupy.
     */
    public record QueueSettings(int messagesCapacity, int actionsCapacity, double backfillShare) {
    }

    /**
     * @param size              Number of buffered items that triggers a flush, and the per-kind batch limit.
     * @param flushInterval     Maximum time between flushes.
     * @param shutdownTimeout   Upper bound for the final flush on shutdown.
     */
    public record BatchSettings(int size, Duration flushInterval, Duration shutdownTimeout) {
    }

    /**
     * @param maxAttempts  Attempts per operation, including the first one.
     * @param initialDelay Delay before the second attempt.
     * @param multiplier   Growth factor of the delay per attempt.
     * @param maxDelay     Cap of a single delay.
     * @param jitterFactor Relative random spread applied to each delay, in [0, 1].
     * @param maxElapsed   Time budget of one retry cycle.
     * @param ceiling      Total time a requeued batch may keep failing before it is dropped.
     */
    public record RetrySettings(int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay,
                                double jitterFactor, Duration maxElapsed, Duration ceiling) {
    }

    /**
     * @param pageSize          History page size.
     * @param pageDelay         Pause between page fetches.
     * @param maxAge            Items older than this are skipped, or {@code null} for no limit.
     * @param lease             Validity of a backfill claim between renewals.
     * @param maxConcurrentRuns Number of scopes backfilled in parallel.
     * @param startOnStartup    Scopes to backfill when the pipeline starts.
     * @param ownerId           Identity of this instance in backfill claims, or {@code null} for the
     *                          local host name. Must survive restarts for a restarted instance to
     *                          resume its own claims.
     */
    public record BackfillSettings(int pageSize, Duration pageDelay, Duration maxAge, Duration lease,
                                   int maxConcurrentRuns, List<String> startOnStartup, String ownerId) {
    }

    /**
     * @param maxKeys Maximum number of tracked keys.
     * @param window  How long a key counts as seen, zero for no expiry.
     */
    public record DedupSettings(int maxKeys, Duration window) {
    }

    /**
     * Empty allow-lists admit everything; ignore-lists win over allow-lists.
     */
    public record FilterSettings(Set<String> allowedScopes, Set<String> ignoredScopes,
                                 Set<String> allowedGuilds, Set<String> ignoredGuilds,
                                 boolean processBotMessages, boolean processSystemMessages) {
    }

    /**
     * @return The settings with every value at its default.
     */
    public static PipelineSettings defaults() {
        return fromConfig(ConfigFactory.empty());
    }

    /**
     * Reads and validates the settings.
     *
     * @param pipelineConfig The {@code pipeline} block (keys relative to it).
     * @return The validated settings.
     * @throws IllegalArgumentException if a value is missing, malformed or out of range.
     */
    public static PipelineSettings fromConfig(Config pipelineConfig) {
        Config config = pipelineConfig.withFallback(DEFAULTS);
        try {
            QueueSettings queues = new QueueSettings(
                range(config, "queues.messages.capacity", 1, Integer.MAX_VALUE),
                range(config, "queues.actions.capacity", 1, Integer.MAX_VALUE),
                config.getDouble("queues.backfill-share"));
            if (queues.backfillShare() <= 0.0 || queues.backfillShare() > 1.0) {
                throw new IllegalArgumentException("pipeline.queues.backfill-share must be in (0, 1], got " + queues.backfillShare());
            }

            BatchSettings batch = new BatchSettings(
                range(config, "batch.size", 1, 500),
                positiveMillis(config, "batch.flush-interval-ms"),
                positiveMillis(config, "batch.shutdown-timeout-ms"));

            RetrySettings retry = new RetrySettings(
                range(config, "retry.max-attempts", 1, 10),
                nonNegativeMillis(config, "retry.initial-delay-ms"),
                config.getDouble("retry.multiplier"),
                nonNegativeMillis(config, "retry.max-delay-ms"),
                config.getDouble("retry.jitter-factor"),
                nonNegativeMillis(config, "retry.max-elapsed-ms"),
                nonNegativeMillis(config, "retry.ceiling-ms"));
            if (retry.multiplier() < 1.0) {
                throw new IllegalArgumentException("pipeline.retry.multiplier must be >= 1.0, got " + retry.multiplier());
            }
            if (retry.jitterFactor() < 0.0 || retry.jitterFactor() > 1.0) {
                throw new IllegalArgumentException("pipeline.retry.jitter-factor must be in [0, 1], got " + retry.jitterFactor());
            }

            Duration maxAge = config.hasPath("backfill.max-age-days")
                ? Duration.ofDays(range(config, "backfill.max-age-days", 1, 36500))
                : null;
            BackfillSettings backfill = new BackfillSettings(
                range(config, "backfill.page-size", 1, 1000),
                nonNegativeMillis(config, "backfill.page-delay-ms"),
                maxAge,
                positiveMillis(config, "backfill.lease-ms"),
                range(config, "backfill.max-concurrent-runs", 1, 64),
                List.copyOf(config.getStringList("backfill.start-on-startup")),
                config.hasPath("backfill.owner-id") && !config.getString("backfill.owner-id").isBlank()
                    ? config.getString("backfill.owner-id").trim()
                    : null);

            DedupSettings dedup = new DedupSettings(
                range(config, "dedup.max-keys", 1, Integer.MAX_VALUE),
                nonNegativeMillis(config, "dedup.window-ms"));

            FilterSettings filter = new FilterSettings(
                Set.copyOf(config.getStringList("filter.allowed-scopes")),
                Set.copyOf(config.getStringList("filter.ignored-scopes")),
                Set.copyOf(config.getStringList("filter.allowed-guilds")),
                Set.copyOf(config.getStringList("filter.ignored-guilds")),
                config.getBoolean("filter.process-bot-messages"),
                config.getBoolean("filter.process-system-messages"));

            return new PipelineSettings(queues, batch, retry, backfill, dedup, filter,
                range(config, "validation.max-content-length", 1, Integer.MAX_VALUE));
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid pipeline configuration: " + e.getMessage(), e);
        }
    }

    private static int range(Config config, String path, int min, int max) {
        int value = config.getInt(path);
        if (value < min || value > max) {
            throw new IllegalArgumentException(
                "pipeline." + path + " must be between " + min + " and " + max + ", got " + value);
        }
        return value;
    }

    private static Duration positiveMillis(Config config, String path) {
        long value = config.getLong(path);
        if (value <= 0) {
            throw new IllegalArgumentException("pipeline." + path + " must be positive, got " + value);
        }
        return Duration.ofMillis(value);
    }

    private static Duration nonNegativeMillis(Config config, String path) {
        long value = config.getLong(path);
        if (value < 0) {
            throw new IllegalArgumentException("pipeline." + path + " must not be negative, got " + value);
        }
        return Duration.ofMillis(value);
    }
}
