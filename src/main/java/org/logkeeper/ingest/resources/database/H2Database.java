package org.logkeeper.ingest.resources.database;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.logkeeper.ingest.api.errors.FatalStorageException;
import org.logkeeper.ingest.api.errors.StorageException;
import org.logkeeper.ingest.api.errors.TransientStorageException;
import org.logkeeper.ingest.api.events.ActionEvent;
import org.logkeeper.ingest.api.events.ActionType;
import org.logkeeper.ingest.api.events.EventKind;
import org.logkeeper.ingest.api.events.EventOrigin;
import org.logkeeper.ingest.api.events.IngestEvent;
import org.logkeeper.ingest.api.events.MessageEvent;
import org.logkeeper.ingest.api.metadata.ChannelInfo;
import org.logkeeper.ingest.api.metadata.GuildInfo;
import org.logkeeper.ingest.api.storage.BackfillOutcome;
import org.logkeeper.ingest.api.storage.Checkpoint;
import org.logkeeper.ingest.api.storage.CheckpointKind;
import org.logkeeper.ingest.api.storage.ICheckpointStore;
import org.logkeeper.ingest.api.storage.IEventStore;
import org.logkeeper.ingest.api.storage.RejectedRow;
import org.logkeeper.ingest.api.storage.UpsertResult;
import org.logkeeper.ingest.resources.AbstractResource;
import org.logkeeper.ingest.retry.ErrorClass;
import org.logkeeper.ingest.retry.RetryPolicy;
import org.logkeeper.ingest.utils.JsonPayloads;

import java.sql.BatchUpdateException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * H2 database implementation of the event and checkpoint storage, using HikariCP for
 * connection pooling. One pool serves both capabilities.
 * <p>
 * Events are written with standard {@code MERGE ... USING} statements in a JDBC batch, one
 * statement execution per row and one round trip per batch. The {@code WHEN MATCHED} condition
 * implements last-write-wins (see {@link IEventStore}); {@code first_captured_at} is only set by
 * the {@code WHEN NOT MATCHED} branch.
 * <p>
 * If a batch fails with a data error (SQLState class 22 or 23) it is rolled back and replayed row
 * by row, so the offending rows are reported as rejected and the rest is committed.
 * <p>
 * <strong>Configuration Options:</strong>
 * <ul>
 *   <li><b>jdbcUrl</b>: JDBC URL (required), e.g. {@code jdbc:h2:./data/logkeeper}</li>
 *   <li><b>username</b> / <b>password</b>: credentials (default: sa / empty)</li>
 *   <li><b>maxPoolSize</b>: maximum pool size (default: 10)</li>
 *   <li><b>minIdle</b>: minimum idle connections (default: 2)</li>
 * </ul>
 */
public class H2Database extends AbstractResource implements IEventStore, ICheckpointStore, AutoCloseable {

    private static final String MESSAGE_MERGE =
        "MERGE INTO messages t USING (VALUES (" +
        "CAST(? AS VARCHAR(64)), CAST(? AS VARCHAR(128)), CAST(? AS VARCHAR(128)), CAST(? AS VARCHAR(128)), " +
        "CAST(? AS VARCHAR(256)), CAST(? AS CHARACTER VARYING), CAST(? AS BOOLEAN), CAST(? AS BOOLEAN), " +
        "CAST(? AS VARCHAR(128)), CAST(? AS TIMESTAMP WITH TIME ZONE), CAST(? AS TIMESTAMP WITH TIME ZONE), " +
        "CAST(? AS TIMESTAMP WITH TIME ZONE), CAST(? AS CHARACTER VARYING), CAST(? AS BOOLEAN), CAST(? AS TIMESTAMP WITH TIME ZONE))) " +
        "s(id, scope_id, guild_id, author_id, author_name, content, is_bot, is_system, webhook_id, occurred_at, " +
        "edited_at, version_at, attributes, is_backfilled, captured_at) " +
        "ON t.id = s.id " +
        "WHEN MATCHED AND (s.version_at > t.version_at OR (s.version_at = t.version_at " +
        "AND (s.is_backfilled = FALSE OR t.is_backfilled = TRUE))) THEN UPDATE SET " +
        "scope_id = s.scope_id, guild_id = s.guild_id, author_id = s.author_id, author_name = s.author_name, " +
        "content = s.content, is_bot = s.is_bot, is_system = s.is_system, webhook_id = s.webhook_id, " +
        "occurred_at = s.occurred_at, edited_at = s.edited_at, version_at = s.version_at, attributes = s.attributes, " +
        "is_backfilled = s.is_backfilled, updated_at = s.captured_at " +
        "WHEN NOT MATCHED THEN INSERT (id, scope_id, guild_id, author_id, author_name, content, is_bot, is_system, " +
        "webhook_id, occurred_at, edited_at, version_at, attributes, is_backfilled, first_captured_at, updated_at) " +
        "VALUES (s.id, s.scope_id, s.guild_id, s.author_id, s.author_name, s.content, s.is_bot, s.is_system, " +
        "s.webhook_id, s.occurred_at, s.edited_at, s.version_at, s.attributes, s.is_backfilled, s.captured_at, s.captured_at)";

    private static final String ACTION_MERGE =
        "MERGE INTO actions t USING (VALUES (" +
        "CAST(? AS VARCHAR(64)), CAST(? AS VARCHAR(128)), CAST(? AS VARCHAR(128)), CAST(? AS VARCHAR(32)), " +
        "CAST(? AS VARCHAR(128)), CAST(? AS VARCHAR(128)), CAST(? AS TIMESTAMP WITH TIME ZONE), " +
        "CAST(? AS TIMESTAMP WITH TIME ZONE), CAST(? AS CHARACTER VARYING), CAST(? AS CHARACTER VARYING), " +
        "CAST(? AS CHARACTER VARYING), CAST(? AS BOOLEAN), CAST(? AS TIMESTAMP WITH TIME ZONE))) " +
        "s(id, scope_id, guild_id, action_type, actor_id, target_id, occurred_at, version_at, action_data, " +
        "before_data, after_data, is_backfilled, captured_at) " +
        "ON t.id = s.id " +
        "WHEN MATCHED AND (s.version_at > t.version_at OR (s.version_at = t.version_at " +
        "AND (s.is_backfilled = FALSE OR t.is_backfilled = TRUE))) THEN UPDATE SET " +
        "scope_id = s.scope_id, guild_id = s.guild_id, action_type = s.action_type, actor_id = s.actor_id, " +
        "target_id = s.target_id, occurred_at = s.occurred_at, version_at = s.version_at, " +
        "action_data = s.action_data, before_data = s.before_data, after_data = s.after_data, " +
        "is_backfilled = s.is_backfilled, updated_at = s.captured_at " +
        "WHEN NOT MATCHED THEN INSERT (id, scope_id, guild_id, action_type, actor_id, target_id, occurred_at, " +
        "version_at, action_data, before_data, after_data, is_backfilled, first_captured_at, updated_at) " +
        "VALUES (s.id, s.scope_id, s.guild_id, s.action_type, s.actor_id, s.target_id, s.occurred_at, " +
        "s.version_at, s.action_data, s.before_data, s.after_data, s.is_backfilled, s.captured_at, s.captured_at)";

    private static final String GUILD_MERGE =
        "MERGE INTO guilds (guild_id, name, description, owner_id, member_count, created_at, icon_url, banner_url, " +
        "updated_at) KEY (guild_id) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String CHANNEL_MERGE =
        "MERGE INTO channels (channel_id, guild_id, name, channel_type, topic, position, category_id, updated_at) " +
        "KEY (channel_id) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String CHECKPOINT_SAVE =
        "MERGE INTO checkpoints t USING (VALUES (CAST(? AS VARCHAR(128)), CAST(? AS VARCHAR(16)), " +
        "CAST(? AS VARCHAR(64)), CAST(? AS TIMESTAMP WITH TIME ZONE), CAST(? AS BIGINT), " +
        "CAST(? AS TIMESTAMP WITH TIME ZONE))) s(scope_id, kind, last_id, last_at, total, now) " +
        "ON t.scope_id = s.scope_id AND t.kind = s.kind " +
        "WHEN MATCHED THEN UPDATE SET last_processed_id = s.last_id, last_processed_at = s.last_at, " +
        "total_processed = s.total, updated_at = s.now " +
        "WHEN NOT MATCHED THEN INSERT (scope_id, kind, last_processed_id, last_processed_at, total_processed, " +
        "backfill_in_progress, created_at, updated_at) VALUES (s.scope_id, s.kind, s.last_id, s.last_at, s.total, " +
        "FALSE, s.now, s.now)";

    private static final String CHECKPOINT_ENSURE =
        "MERGE INTO checkpoints t USING (VALUES (CAST(? AS VARCHAR(128)), CAST(? AS VARCHAR(16)), " +
        "CAST(? AS TIMESTAMP WITH TIME ZONE))) s(scope_id, kind, now) " +
        "ON t.scope_id = s.scope_id AND t.kind = s.kind " +
        "WHEN NOT MATCHED THEN INSERT (scope_id, kind, total_processed, backfill_in_progress, created_at, updated_at) " +
        "VALUES (s.scope_id, s.kind, 0, FALSE, s.now, s.now)";

    private static final String CHECKPOINT_COLUMNS =
        "scope_id, kind, last_processed_id, last_processed_at, total_processed, backfill_in_progress, " +
        "last_backfill_completed_at, backfill_owner, backfill_lease_until, updated_at";

    private final HikariDataSource dataSource;

    private final AtomicLong queriesExecuted = new AtomicLong(0);
    private final AtomicLong rowsUpserted = new AtomicLong(0);
    private final AtomicLong rowsRejected = new AtomicLong(0);
    private final AtomicLong writeErrors = new AtomicLong(0);
    private final AtomicLong readErrors = new AtomicLong(0);

    /**
     * Opens the connection pool and creates the schema if it does not exist.
     *
     * @param name    The resource name, also used as pool name.
     * @param options The database options.
     * @throws IllegalArgumentException if {@code jdbcUrl} is missing.
     * @throws IllegalStateException    if the pool cannot be started or the schema cannot be created.
     */
    public H2Database(String name, Config options) {
        super(name);
        Config defaults = ConfigFactory.parseMap(Map.of(
            "username", "sa",
            "password", "",
            "maxPoolSize", 10,
            "minIdle", 2
        ));
        Config config = options.withFallback(defaults);
        if (!config.hasPath("jdbcUrl")) {
            throw new IllegalArgumentException("'jdbcUrl' must be configured for H2Database.");
        }
        final String jdbcUrl = config.getString("jdbcUrl");

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setDriverClassName("org.h2.Driver");
        hikariConfig.setMaximumPoolSize(config.getInt("maxPoolSize"));
        hikariConfig.setMinimumIdle(config.getInt("minIdle"));
        hikariConfig.setUsername(config.getString("username"));
        hikariConfig.setPassword(config.getString("password"));
        hikariConfig.setPoolName(name);

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
            log.debug("H2 database '{}' connection pool started (max={}, minIdle={})",
                name, hikariConfig.getMaximumPoolSize(), hikariConfig.getMinimumIdle());
        } catch (Exception e) {
            Throwable cause = rootCause(e);
            String causeMsg = cause.getMessage() != null ? cause.getMessage() : "";

            if (causeMsg.contains("already in use") || causeMsg.contains("file is locked")) {
                String errorMsg = String.format(
                    "Cannot open H2 database '%s': file already in use by another process. URL: %s", name, jdbcUrl);
                log.error(errorMsg);
                throw new IllegalStateException(errorMsg, e);
            }
            if (causeMsg.contains("Wrong user name or password")) {
                String errorMsg = String.format(
                    "Failed to connect to H2 database '%s': wrong username/password. URL=%s", name, jdbcUrl);
                log.error(errorMsg);
                throw new IllegalStateException(errorMsg, e);
            }
            String errorMsg = String.format("Failed to initialize H2 database '%s': %s. Database: %s. Error: %s",
                name, cause.getClass().getSimpleName(), jdbcUrl, causeMsg);
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg, e);
        }

        try {
            createSchema();
        } catch (SQLException e) {
            dataSource.close();
            log.error("Failed to create schema in H2 database '{}': {}", name, e.getMessage());
            throw new IllegalStateException("Schema creation failed for H2 database '" + name + "'", e);
        }
    }

    private void createSchema() throws SQLException {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(
                "CREATE TABLE IF NOT EXISTS messages (" +
                "  id VARCHAR(64) PRIMARY KEY," +
                "  scope_id VARCHAR(128) NOT NULL," +
                "  guild_id VARCHAR(128)," +
                "  author_id VARCHAR(128) NOT NULL," +
                "  author_name VARCHAR(256)," +
                "  content CHARACTER VARYING," +
                "  is_bot BOOLEAN NOT NULL DEFAULT FALSE," +
                "  is_system BOOLEAN NOT NULL DEFAULT FALSE," +
                "  webhook_id VARCHAR(128)," +
                "  occurred_at TIMESTAMP WITH TIME ZONE NOT NULL," +
                "  edited_at TIMESTAMP WITH TIME ZONE," +
                "  version_at TIMESTAMP WITH TIME ZONE NOT NULL," +
                "  attributes CHARACTER VARYING," +
                "  is_backfilled BOOLEAN NOT NULL DEFAULT FALSE," +
                "  first_captured_at TIMESTAMP WITH TIME ZONE NOT NULL," +
                "  updated_at TIMESTAMP WITH TIME ZONE NOT NULL" +
                ")");
            // databases created before webhook support
            stmt.execute("ALTER TABLE messages ADD COLUMN IF NOT EXISTS webhook_id VARCHAR(128)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_messages_scope ON messages (scope_id, occurred_at)");
            stmt.execute(
                "CREATE TABLE IF NOT EXISTS actions (" +
                "  id VARCHAR(64) PRIMARY KEY," +
                "  scope_id VARCHAR(128) NOT NULL," +
                "  guild_id VARCHAR(128)," +
                "  action_type VARCHAR(32) NOT NULL," +
                "  actor_id VARCHAR(128)," +
                "  target_id VARCHAR(128)," +
                "  occurred_at TIMESTAMP WITH TIME ZONE NOT NULL," +
                "  version_at TIMESTAMP WITH TIME ZONE NOT NULL," +
                "  action_data CHARACTER VARYING," +
                "  before_data CHARACTER VARYING," +
                "  after_data CHARACTER VARYING," +
                "  is_backfilled BOOLEAN NOT NULL DEFAULT FALSE," +
                "  first_captured_at TIMESTAMP WITH TIME ZONE NOT NULL," +
                "  updated_at TIMESTAMP WITH TIME ZONE NOT NULL" +
                ")");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_actions_scope ON actions (scope_id, occurred_at)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_actions_type ON actions (action_type)");
            stmt.execute(
                "CREATE TABLE IF NOT EXISTS guilds (" +
                "  guild_id VARCHAR(128) PRIMARY KEY," +
                "  name VARCHAR(256) NOT NULL," +
                "  description CHARACTER VARYING," +
                "  owner_id VARCHAR(128)," +
                "  member_count INT NOT NULL DEFAULT 0," +
                "  created_at TIMESTAMP WITH TIME ZONE," +
                "  icon_url CHARACTER VARYING," +
                "  banner_url CHARACTER VARYING," +
                "  updated_at TIMESTAMP WITH TIME ZONE NOT NULL" +
                ")");
            stmt.execute(
                "CREATE TABLE IF NOT EXISTS channels (" +
                "  channel_id VARCHAR(128) PRIMARY KEY," +
                "  guild_id VARCHAR(128)," +
                "  name VARCHAR(256) NOT NULL," +
                "  channel_type VARCHAR(32) NOT NULL," +
                "  topic CHARACTER VARYING," +
                "  position INT," +
                "  category_id VARCHAR(128)," +
                "  updated_at TIMESTAMP WITH TIME ZONE NOT NULL" +
                ")");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_channels_guild ON channels (guild_id)");
            stmt.execute(
                "CREATE TABLE IF NOT EXISTS checkpoints (" +
                "  scope_id VARCHAR(128) NOT NULL," +
                "  kind VARCHAR(16) NOT NULL," +
                "  last_processed_id VARCHAR(64)," +
                "  last_processed_at TIMESTAMP WITH TIME ZONE," +
                "  total_processed BIGINT NOT NULL DEFAULT 0," +
                "  backfill_in_progress BOOLEAN NOT NULL DEFAULT FALSE," +
                "  last_backfill_completed_at TIMESTAMP WITH TIME ZONE," +
                "  backfill_owner VARCHAR(128)," +
                "  backfill_lease_until TIMESTAMP WITH TIME ZONE," +
                "  created_at TIMESTAMP WITH TIME ZONE NOT NULL," +
                "  updated_at TIMESTAMP WITH TIME ZONE NOT NULL," +
                "  PRIMARY KEY (scope_id, kind)" +
                ")");
        }
        log.debug("H2 database '{}' schema ready", resourceName);
    }

    // ========== IEventStore ==========

    @Override
    public UpsertResult upsertBatch(EventKind kind, List<? extends IngestEvent> events) throws StorageException {
        if (events.isEmpty()) {
            return UpsertResult.of(0);
        }
        final String sql = kind == EventKind.MESSAGE ? MESSAGE_MERGE : ACTION_MERGE;
        final Instant capturedAt = Instant.now();

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                UpsertResult result = executeBatch(conn, sql, kind, events, capturedAt);
                conn.commit();
                queriesExecuted.incrementAndGet();
                rowsUpserted.addAndGet(result.upserted());
                return result;
            } catch (SQLException e) {
                rollbackQuietly(conn);
                if (isDataError(e)) {
                    log.debug("Batch of {} {} rows hit a data error, isolating rows: {}", events.size(), kind, e.getMessage());
                    UpsertResult result = executeRowByRow(conn, sql, kind, events, capturedAt);
                    conn.commit();
                    rowsUpserted.addAndGet(result.upserted());
                    return result;
                }
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            writeErrors.incrementAndGet();
            throw translate("Upsert of " + events.size() + " " + kind + " rows failed", e);
        }
    }

    private UpsertResult executeBatch(Connection conn, String sql, EventKind kind,
                                      List<? extends IngestEvent> events, Instant capturedAt) throws SQLException {
        List<RejectedRow> rejected = new ArrayList<>();
        int bound = 0;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (IngestEvent event : events) {
                String problem = bind(stmt, kind, event, capturedAt);
                if (problem != null) {
                    rejected.add(new RejectedRow(event.id(), problem));
                    continue;
                }
                stmt.addBatch();
                bound++;
            }
            if (bound > 0) {
                stmt.executeBatch();
            }
        }
        recordRejected(kind, rejected);
        return new UpsertResult(bound, rejected);
    }

    private UpsertResult executeRowByRow(Connection conn, String sql, EventKind kind,
                                         List<? extends IngestEvent> events, Instant capturedAt) throws SQLException {
        List<RejectedRow> rejected = new ArrayList<>();
        int written = 0;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (IngestEvent event : events) {
                String problem = bind(stmt, kind, event, capturedAt);
                if (problem != null) {
                    rejected.add(new RejectedRow(event.id(), problem));
                    continue;
                }
                try {
                    stmt.executeUpdate();
                    queriesExecuted.incrementAndGet();
                    written++;
                } catch (SQLException e) {
                    if (!isDataError(e)) {
                        throw e;
                    }
                    rejected.add(new RejectedRow(event.id(), e.getMessage()));
                }
            }
        }
        recordRejected(kind, rejected);
        return new UpsertResult(written, rejected);
    }

    private void recordRejected(EventKind kind, List<RejectedRow> rejected) {
        if (rejected.isEmpty()) {
            return;
        }
        rowsRejected.addAndGet(rejected.size());
        for (RejectedRow row : rejected) {
            log.warn("Rejected {} row '{}': {}", kind, row.id(), row.reason());
            recordError("ROW_REJECTED", "Storage rejected " + kind + " row", "id=" + row.id() + ", reason=" + row.reason());
        }
    }

    /**
     * Binds one event to the merge statement.
     *
     * @return {@code null} on success, otherwise the reason the row cannot be written.
     */
    private String bind(PreparedStatement stmt, EventKind kind, IngestEvent event, Instant capturedAt)
        throws SQLException {
        try {
            if (kind == EventKind.MESSAGE) {
                MessageEvent m = (MessageEvent) event;
                stmt.setString(1, m.id());
                stmt.setString(2, m.scopeId());
                stmt.setString(3, m.guildId());
                stmt.setString(4, m.authorId());
                stmt.setString(5, m.authorName());
                stmt.setString(6, m.content());
                stmt.setBoolean(7, m.bot());
                stmt.setBoolean(8, m.system());
                stmt.setString(9, m.webhookId());
                setInstant(stmt, 10, m.occurredAt());
                setInstant(stmt, 11, m.editedAt());
                setInstant(stmt, 12, m.versionAt());
                stmt.setString(13, JsonPayloads.toJson(m.attributes()));
                stmt.setBoolean(14, m.isBackfilled());
                setInstant(stmt, 15, capturedAt);
            } else {
                ActionEvent a = (ActionEvent) event;
                stmt.setString(1, a.id());
                stmt.setString(2, a.scopeId());
                stmt.setString(3, a.guildId());
                stmt.setString(4, a.actionType().name());
                stmt.setString(5, a.actorId());
                stmt.setString(6, a.targetId());
                setInstant(stmt, 7, a.occurredAt());
                setInstant(stmt, 8, a.versionAt());
                stmt.setString(9, JsonPayloads.toJson(a.actionData()));
                stmt.setString(10, JsonPayloads.toJson(a.beforeData()));
                stmt.setString(11, JsonPayloads.toJson(a.afterData()));
                stmt.setBoolean(12, a.isBackfilled());
                setInstant(stmt, 13, capturedAt);
            }
            return null;
        } catch (JsonProcessingException e) {
            return "payload not serializable: " + e.getOriginalMessage();
        } catch (ClassCastException e) {
            return "event is not a " + kind;
        }
    }

    @Override
    public Optional<IngestEvent> findById(EventKind kind, String id) throws StorageException {
        final String sql = kind == EventKind.MESSAGE
            ? "SELECT * FROM messages WHERE id = ?"
            : "SELECT * FROM actions WHERE id = ?";
        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, id);
            queriesExecuted.incrementAndGet();
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(kind == EventKind.MESSAGE ? readMessage(rs) : readAction(rs));
            }
        } catch (SQLException e) {
            readErrors.incrementAndGet();
            throw translate("Reading " + kind + " '" + id + "' failed", e);
        } catch (JsonProcessingException e) {
            readErrors.incrementAndGet();
            throw new FatalStorageException("Stored payload of " + kind + " '" + id + "' is not valid JSON", e);
        }
    }

    /**
     * Reads the capture time recorded when the row was first inserted.
     */
    public Optional<Instant> findFirstCapturedAt(EventKind kind, String id) throws StorageException {
        final String sql = kind == EventKind.MESSAGE
            ? "SELECT first_captured_at FROM messages WHERE id = ?"
            : "SELECT first_captured_at FROM actions WHERE id = ?";
        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.ofNullable(getInstant(rs, "first_captured_at")) : Optional.empty();
            }
        } catch (SQLException e) {
            readErrors.incrementAndGet();
            throw translate("Reading capture time of " + kind + " '" + id + "' failed", e);
        }
    }

    @Override
    public long count(EventKind kind) throws StorageException {
        final String sql = kind == EventKind.MESSAGE ? "SELECT COUNT(*) FROM messages" : "SELECT COUNT(*) FROM actions";
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            queriesExecuted.incrementAndGet();
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            readErrors.incrementAndGet();
            throw translate("Counting " + kind + " rows failed", e);
        }
    }

    @Override
    public void upsertGuild(GuildInfo guild) throws StorageException {
        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(GUILD_MERGE)) {
            stmt.setString(1, guild.guildId());
            stmt.setString(2, guild.name());
            stmt.setString(3, guild.description());
            stmt.setString(4, guild.ownerId());
            stmt.setInt(5, guild.memberCount());
            setInstant(stmt, 6, guild.createdAt());
            stmt.setString(7, guild.iconUrl());
            stmt.setString(8, guild.bannerUrl());
            setInstant(stmt, 9, Instant.now());
            stmt.executeUpdate();
            queriesExecuted.incrementAndGet();
        } catch (SQLException e) {
            writeErrors.incrementAndGet();
            throw translate("Storing guild " + guild.guildId() + " failed", e);
        }
    }

    @Override
    public void upsertChannel(ChannelInfo channel) throws StorageException {
        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(CHANNEL_MERGE)) {
            stmt.setString(1, channel.channelId());
            stmt.setString(2, channel.guildId());
            stmt.setString(3, channel.name());
            stmt.setString(4, channel.channelType());
            stmt.setString(5, channel.topic());
            if (channel.position() != null) {
                stmt.setInt(6, channel.position());
            } else {
                stmt.setNull(6, Types.INTEGER);
            }
            stmt.setString(7, channel.categoryId());
            setInstant(stmt, 8, Instant.now());
            stmt.executeUpdate();
            queriesExecuted.incrementAndGet();
        } catch (SQLException e) {
            writeErrors.incrementAndGet();
            throw translate("Storing channel " + channel.channelId() + " failed", e);
        }
    }

    @Override
    public Optional<GuildInfo> findGuild(String guildId) throws StorageException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT * FROM guilds WHERE guild_id = ?")) {
            stmt.setString(1, guildId);
            queriesExecuted.incrementAndGet();
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new GuildInfo(
                    rs.getString("guild_id"),
                    rs.getString("name"),
                    rs.getString("description"),
                    rs.getString("owner_id"),
                    rs.getInt("member_count"),
                    getInstant(rs, "created_at"),
                    rs.getString("icon_url"),
                    rs.getString("banner_url")));
            }
        } catch (SQLException e) {
            readErrors.incrementAndGet();
            throw translate("Reading guild " + guildId + " failed", e);
        }
    }

    @Override
    public Optional<ChannelInfo> findChannel(String channelId) throws StorageException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT * FROM channels WHERE channel_id = ?")) {
            stmt.setString(1, channelId);
            queriesExecuted.incrementAndGet();
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                Integer position = rs.getInt("position");
                if (rs.wasNull()) {
                    position = null;
                }
                return Optional.of(new ChannelInfo(
                    rs.getString("channel_id"),
                    rs.getString("guild_id"),
                    rs.getString("name"),
                    rs.getString("channel_type"),
                    rs.getString("topic"),
                    position,
                    rs.getString("category_id")));
            }
        } catch (SQLException e) {
            readErrors.incrementAndGet();
            throw translate("Reading channel " + channelId + " failed", e);
        }
    }

    private MessageEvent readMessage(ResultSet rs) throws SQLException, JsonProcessingException {
        return new MessageEvent(
            rs.getString("id"),
            rs.getString("scope_id"),
            rs.getString("guild_id"),
            rs.getString("author_id"),
            rs.getString("author_name"),
            rs.getString("content"),
            rs.getBoolean("is_bot"),
            rs.getBoolean("is_system"),
            rs.getString("webhook_id"),
            getInstant(rs, "occurred_at"),
            getInstant(rs, "edited_at"),
            JsonPayloads.fromJson(rs.getString("attributes")),
            rs.getBoolean("is_backfilled") ? EventOrigin.BACKFILL : EventOrigin.LIVE);
    }

    private ActionEvent readAction(ResultSet rs) throws SQLException, JsonProcessingException {
        return new ActionEvent(
            rs.getString("id"),
            rs.getString("scope_id"),
            rs.getString("guild_id"),
            ActionType.valueOf(rs.getString("action_type")),
            rs.getString("actor_id"),
            rs.getString("target_id"),
            getInstant(rs, "occurred_at"),
            JsonPayloads.fromJson(rs.getString("action_data")),
            JsonPayloads.fromJson(rs.getString("before_data")),
            JsonPayloads.fromJson(rs.getString("after_data")),
            rs.getBoolean("is_backfilled") ? EventOrigin.BACKFILL : EventOrigin.LIVE);
    }

    // ========== ICheckpointStore ==========

    @Override
    public Optional<Checkpoint> load(String scopeId, CheckpointKind kind) throws StorageException {
        final String sql = "SELECT " + CHECKPOINT_COLUMNS + " FROM checkpoints WHERE scope_id = ? AND kind = ?";
        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, scopeId);
            stmt.setString(2, kind.name());
            queriesExecuted.incrementAndGet();
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(readCheckpoint(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            readErrors.incrementAndGet();
            throw translate("Loading checkpoint " + scopeId + "/" + kind + " failed", e);
        }
    }

    @Override
    public void save(Checkpoint checkpoint) throws StorageException {
        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(CHECKPOINT_SAVE)) {
            stmt.setString(1, checkpoint.scopeId());
            stmt.setString(2, checkpoint.kind().name());
            stmt.setString(3, checkpoint.lastProcessedId());
            setInstant(stmt, 4, checkpoint.lastProcessedAt());
            stmt.setLong(5, checkpoint.totalProcessed());
            setInstant(stmt, 6, Instant.now());
            stmt.executeUpdate();
            queriesExecuted.incrementAndGet();
        } catch (SQLException e) {
            writeErrors.incrementAndGet();
            throw translate("Saving checkpoint " + checkpoint.scopeId() + "/" + checkpoint.kind() + " failed", e);
        }
    }

    @Override
    public boolean tryAcquireBackfill(String scopeId, String ownerId, Instant now, Duration lease) throws StorageException {
        try (Connection conn = dataSource.getConnection()) {
            ensureBackfillRow(conn, scopeId, now);
            try (PreparedStatement stmt = conn.prepareStatement(
                "UPDATE checkpoints SET backfill_in_progress = TRUE, backfill_owner = ?, backfill_lease_until = ?, " +
                "updated_at = ? WHERE scope_id = ? AND kind = ? AND (backfill_in_progress = FALSE " +
                "OR backfill_lease_until IS NULL OR backfill_lease_until <= ? OR backfill_owner = ?)")) {
                stmt.setString(1, ownerId);
                setInstant(stmt, 2, now.plus(lease));
                setInstant(stmt, 3, now);
                stmt.setString(4, scopeId);
                stmt.setString(5, CheckpointKind.BACKFILL.name());
                setInstant(stmt, 6, now);
                stmt.setString(7, ownerId);
                queriesExecuted.incrementAndGet();
                return stmt.executeUpdate() == 1;
            }
        } catch (SQLException e) {
            writeErrors.incrementAndGet();
            throw translate("Claiming backfill of scope " + scopeId + " failed", e);
        }
    }

    private void ensureBackfillRow(Connection conn, String scopeId, Instant now) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(CHECKPOINT_ENSURE)) {
            stmt.setString(1, scopeId);
            stmt.setString(2, CheckpointKind.BACKFILL.name());
            setInstant(stmt, 3, now);
            stmt.executeUpdate();
        } catch (SQLException e) {
            // A concurrent claim inserted the row first.
            if (!"23505".equals(e.getSQLState())) {
                throw e;
            }
            log.debug("Checkpoint row for scope {} created concurrently", scopeId);
        }
    }

    @Override
    public boolean renewBackfillLease(String scopeId, String ownerId, Instant now, Duration lease) throws StorageException {
        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(
            "UPDATE checkpoints SET backfill_lease_until = ?, updated_at = ? " +
            "WHERE scope_id = ? AND kind = ? AND backfill_in_progress = TRUE AND backfill_owner = ?")) {
            setInstant(stmt, 1, now.plus(lease));
            setInstant(stmt, 2, now);
            stmt.setString(3, scopeId);
            stmt.setString(4, CheckpointKind.BACKFILL.name());
            stmt.setString(5, ownerId);
            queriesExecuted.incrementAndGet();
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            writeErrors.incrementAndGet();
            throw translate("Renewing backfill lease of scope " + scopeId + " failed", e);
        }
    }

    @Override
    public void releaseBackfill(String scopeId, String ownerId, BackfillOutcome outcome, Instant now) throws StorageException {
        final String sql;
        switch (outcome) {
            case COMPLETED:
                sql = "UPDATE checkpoints SET backfill_in_progress = FALSE, backfill_owner = NULL, " +
                      "backfill_lease_until = NULL, last_backfill_completed_at = ?, updated_at = ? " +
                      "WHERE scope_id = ? AND kind = ? AND backfill_owner = ?";
                break;
            case PAUSED:
                sql = "UPDATE checkpoints SET backfill_lease_until = ?, updated_at = ? " +
                      "WHERE scope_id = ? AND kind = ? AND backfill_owner = ?";
                break;
            case ABORTED:
            default:
                sql = "UPDATE checkpoints SET backfill_in_progress = FALSE, backfill_owner = NULL, " +
                      "backfill_lease_until = NULL, updated_at = ? " +
                      "WHERE scope_id = ? AND kind = ? AND backfill_owner = ?";
                break;
        }
        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            int index = 1;
            if (outcome != BackfillOutcome.ABORTED) {
                setInstant(stmt, index++, now);
            }
            setInstant(stmt, index++, now);
            stmt.setString(index++, scopeId);
            stmt.setString(index++, CheckpointKind.BACKFILL.name());
            stmt.setString(index, ownerId);
            queriesExecuted.incrementAndGet();
            if (stmt.executeUpdate() == 0) {
                log.debug("Backfill claim of scope {} no longer held by {}, release ({}) skipped", scopeId, ownerId, outcome);
            }
        } catch (SQLException e) {
            writeErrors.incrementAndGet();
            throw translate("Releasing backfill of scope " + scopeId + " failed", e);
        }
    }

    @Override
    public List<Checkpoint> listAll() throws StorageException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT " + CHECKPOINT_COLUMNS + " FROM checkpoints ORDER BY scope_id, kind")) {
            queriesExecuted.incrementAndGet();
            List<Checkpoint> all = new ArrayList<>();
            while (rs.next()) {
                all.add(readCheckpoint(rs));
            }
            return all;
        } catch (SQLException e) {
            readErrors.incrementAndGet();
            throw translate("Listing checkpoints failed", e);
        }
    }

    private Checkpoint readCheckpoint(ResultSet rs) throws SQLException {
        return new Checkpoint(
            rs.getString("scope_id"),
            CheckpointKind.valueOf(rs.getString("kind")),
            rs.getString("last_processed_id"),
            getInstant(rs, "last_processed_at"),
            rs.getLong("total_processed"),
            rs.getBoolean("backfill_in_progress"),
            getInstant(rs, "last_backfill_completed_at"),
            rs.getString("backfill_owner"),
            getInstant(rs, "backfill_lease_until"),
            getInstant(rs, "updated_at"));
    }

    // ========== Helpers ==========

    private static void setInstant(PreparedStatement stmt, int index, Instant value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            stmt.setObject(index, value.atOffset(ZoneOffset.UTC));
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    private static boolean isDataError(SQLException e) {
        String state = sqlState(e);
        return state != null && (state.startsWith("22") || state.startsWith("23"));
    }

    // BatchUpdateException often carries the row's SQLState only on the chained exception.
    private static String sqlState(SQLException e) {
        if (e.getSQLState() != null) {
            return e.getSQLState();
        }
        if (e instanceof BatchUpdateException && e.getNextException() != null) {
            return e.getNextException().getSQLState();
        }
        if (e.getCause() instanceof SQLException) {
            return ((SQLException) e.getCause()).getSQLState();
        }
        return null;
    }

    private StorageException translate(String message, SQLException e) {
        boolean transientError = e instanceof SQLTransientException
            || e instanceof SQLRecoverableException
            || RetryPolicy.classifySqlState(sqlState(e)) == ErrorClass.RETRYABLE;
        if (transientError) {
            log.debug("{} (transient, SQLState {}): {}", message, sqlState(e), e.getMessage());
            return new TransientStorageException(message + ": " + e.getMessage(), e);
        }
        log.debug("{} (fatal, SQLState {}): {}", message, sqlState(e), e.getMessage());
        return new FatalStorageException(message + ": " + e.getMessage(), e);
    }

    private static void rollbackQuietly(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            // The original failure is the one reported; a failed rollback leaves nothing to undo.
            org.slf4j.LoggerFactory.getLogger(H2Database.class).debug("Rollback failed: {}", e.getMessage());
        }
    }

    private static Throwable rootCause(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Runs a trivial query to verify the database is reachable.
     *
     * @return {@code true} if the query succeeded.
     */
    public boolean ping() {
        if (dataSource.isClosed()) {
            return false;
        }
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("SELECT 1");
            return true;
        } catch (SQLException e) {
            log.debug("Ping of H2 database '{}' failed: {}", resourceName, e.getMessage());
            return false;
        }
    }

    /**
     * Rejected rows are reported per batch and do not make the database unhealthy;
     * only an unreachable database does.
     */
    @Override
    public boolean isHealthy() {
        return ping();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("queries_executed", queriesExecuted.get());
        metrics.put("rows_upserted", rowsUpserted.get());
        metrics.put("rows_rejected", rowsRejected.get());
        metrics.put("write_errors", writeErrors.get());
        metrics.put("read_errors", readErrors.get());
        if (!dataSource.isClosed()) {
            metrics.put("h2_pool_active_connections", dataSource.getHikariPoolMXBean().getActiveConnections());
            metrics.put("h2_pool_idle_connections", dataSource.getHikariPoolMXBean().getIdleConnections());
            metrics.put("h2_pool_total_connections", dataSource.getHikariPoolMXBean().getTotalConnections());
            metrics.put("h2_pool_threads_awaiting", dataSource.getHikariPoolMXBean().getThreadsAwaitingConnection());
        }
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            log.debug("H2 database '{}' connection pool closed", resourceName);
        }
    }
}
