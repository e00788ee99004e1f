package org.logkeeper.ingest.resources.database;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
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
import org.logkeeper.ingest.api.storage.UpsertResult;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.logkeeper.ingest.TestEvents.T0;
import static org.logkeeper.ingest.TestEvents.action;
import static org.logkeeper.ingest.TestEvents.message;
import static org.logkeeper.ingest.TestEvents.webhookMessage;

/**
 * Runs the H2 store against an in-memory database, one per test.
 */
@Tag("integration")
class H2DatabaseTest {

    private H2Database database;

    @BeforeEach
    void setUp() {
        Config options = ConfigFactory.parseMap(Map.of(
            "jdbcUrl", "jdbc:h2:mem:logkeeper-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
            "maxPoolSize", 4,
            "minIdle", 1));
        database = new H2Database("test-db", options);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void upsertBatch_insertsMessagesAndActions() throws Exception {
        UpsertResult messages = database.upsertBatch(EventKind.MESSAGE,
            List.of(message("m1", "c1", T0), message("m2", "c1", T0.plusSeconds(1))));
        UpsertResult actions = database.upsertBatch(EventKind.ACTION, List.of(action("a1", "c1", T0)));

        assertThat(messages.upserted()).isEqualTo(2);
        assertThat(messages.rejected()).isEmpty();
        assertThat(actions.upserted()).isEqualTo(1);
        assertThat(database.count(EventKind.MESSAGE)).isEqualTo(2);
        assertThat(database.count(EventKind.ACTION)).isEqualTo(1);

        ActionEvent stored = (ActionEvent) database.findById(EventKind.ACTION, "a1").orElseThrow();
        assertThat(stored.actionData()).containsEntry("reason", "spam");
        assertThat(stored.afterData()).containsEntry("banned", true);
        assertThat(stored.occurredAt()).isEqualTo(T0);
    }

    @Test
    void upsertBatch_keepsNewestVersion() throws Exception {
        database.upsertBatch(EventKind.MESSAGE,
            List.of(message("m1", "c1", T0, T0.plusSeconds(60), "edited", EventOrigin.LIVE)));

        // An older version arriving late must not overwrite the edit.
        database.upsertBatch(EventKind.MESSAGE,
            List.of(message("m1", "c1", T0, null, "original", EventOrigin.BACKFILL)));

        MessageEvent stored = (MessageEvent) database.findById(EventKind.MESSAGE, "m1").orElseThrow();
        assertThat(stored.content()).isEqualTo("edited");
        assertThat(stored.editedAt()).isEqualTo(T0.plusSeconds(60));
        assertThat(stored.origin()).isEqualTo(EventOrigin.LIVE);

        database.upsertBatch(EventKind.MESSAGE,
            List.of(message("m1", "c1", T0, T0.plusSeconds(120), "edited twice", EventOrigin.LIVE)));
        stored = (MessageEvent) database.findById(EventKind.MESSAGE, "m1").orElseThrow();
        assertThat(stored.content()).isEqualTo("edited twice");
    }

    @Test
    void upsertBatch_liveWinsVersionTie() throws Exception {
        database.upsertBatch(EventKind.MESSAGE,
            List.of(message("m1", "c1", T0, null, "from live", EventOrigin.LIVE)));
        database.upsertBatch(EventKind.MESSAGE,
            List.of(message("m1", "c1", T0, null, "from history", EventOrigin.BACKFILL)));

        MessageEvent stored = (MessageEvent) database.findById(EventKind.MESSAGE, "m1").orElseThrow();
        assertThat(stored.content()).isEqualTo("from live");
        assertThat(stored.isBackfilled()).isFalse();

        database.upsertBatch(EventKind.MESSAGE,
            List.of(message("m2", "c1", T0, null, "from history", EventOrigin.BACKFILL)));
        database.upsertBatch(EventKind.MESSAGE,
            List.of(message("m2", "c1", T0, null, "from live", EventOrigin.LIVE)));

        stored = (MessageEvent) database.findById(EventKind.MESSAGE, "m2").orElseThrow();
        assertThat(stored.content()).isEqualTo("from live");
        assertThat(stored.origin()).isEqualTo(EventOrigin.LIVE);
    }

    @Test
    void upsertBatch_preservesFirstCaptureTime() throws Exception {
        database.upsertBatch(EventKind.MESSAGE, List.of(message("m1", "c1", T0)));
        Instant firstCapture = database.findFirstCapturedAt(EventKind.MESSAGE, "m1").orElseThrow();

        database.upsertBatch(EventKind.MESSAGE,
            List.of(message("m1", "c1", T0, T0.plusSeconds(30), "edited", EventOrigin.LIVE)));

        assertThat(database.findFirstCapturedAt(EventKind.MESSAGE, "m1")).contains(firstCapture);
        assertThat(database.findFirstCapturedAt(EventKind.MESSAGE, "missing")).isEmpty();
    }

    @Test
    void upsertBatch_rejectsOnlyTheOffendingRow() throws Exception {
        MessageEvent noAuthor = new MessageEvent("m2", "c1", "guild-1", null, "ghost", "boo", false, false,
            null, T0, null, Map.of(), EventOrigin.LIVE);
        List<IngestEvent> batch = List.of(message("m1", "c1", T0), noAuthor, message("m3", "c1", T0));

        UpsertResult result = database.upsertBatch(EventKind.MESSAGE, batch);

        assertThat(result.upserted()).isEqualTo(2);
        assertThat(result.rejected()).singleElement().satisfies(row -> assertThat(row.id()).isEqualTo("m2"));
        assertThat(database.findById(EventKind.MESSAGE, "m1")).isPresent();
        assertThat(database.findById(EventKind.MESSAGE, "m2")).isEmpty();
        assertThat(database.findById(EventKind.MESSAGE, "m3")).isPresent();
        assertThat(database.getMetrics()).containsEntry("rows_rejected", 1L);
    }

    @Test
    void upsertBatch_emptyBatchIsNoOp() throws Exception {
        assertThat(database.upsertBatch(EventKind.MESSAGE, List.of()).upserted()).isZero();
        assertThat(database.count(EventKind.MESSAGE)).isZero();
    }

    @Test
    void saveAndLoadCheckpoint() throws Exception {
        assertThat(database.load("c1", CheckpointKind.LIVE)).isEmpty();

        database.save(Checkpoint.empty("c1", CheckpointKind.LIVE).withProgress("m5", T0, 5));
        database.save(Checkpoint.empty("c1", CheckpointKind.LIVE).withProgress("m9", T0.plusSeconds(9), 9));

        Checkpoint loaded = database.load("c1", CheckpointKind.LIVE).orElseThrow();
        assertThat(loaded.lastProcessedId()).isEqualTo("m9");
        assertThat(loaded.lastProcessedAt()).isEqualTo(T0.plusSeconds(9));
        assertThat(loaded.totalProcessed()).isEqualTo(9);
        assertThat(loaded.backfillInProgress()).isFalse();
        assertThat(loaded.updatedAt()).isNotNull();
    }

    @Test
    void tryAcquireBackfill_isExclusiveUntilLeaseExpires() throws Exception {
        Duration lease = Duration.ofMinutes(1);

        assertThat(database.tryAcquireBackfill("c1", "node-a", T0, lease)).isTrue();
        assertThat(database.tryAcquireBackfill("c1", "node-b", T0.plusSeconds(10), lease)).isFalse();
        assertThat(database.renewBackfillLease("c1", "node-a", T0.plusSeconds(30), lease)).isTrue();

        // node-a renewed until T0+90s, so node-b only gets in after that.
        assertThat(database.tryAcquireBackfill("c1", "node-b", T0.plusSeconds(80), lease)).isFalse();
        assertThat(database.tryAcquireBackfill("c1", "node-b", T0.plusSeconds(91), lease)).isTrue();
        assertThat(database.renewBackfillLease("c1", "node-a", T0.plusSeconds(95), lease)).isFalse();

        Checkpoint claimed = database.load("c1", CheckpointKind.BACKFILL).orElseThrow();
        assertThat(claimed.backfillInProgress()).isTrue();
        assertThat(claimed.backfillOwner()).isEqualTo("node-b");
        assertThat(claimed.backfillLeaseUntil()).isEqualTo(T0.plusSeconds(151));
    }

    @Test
    void tryAcquireBackfill_regrantsLiveClaimToItsOwner() throws Exception {
        database.save(Checkpoint.empty("c1", CheckpointKind.BACKFILL).withProgress("m4", T0, 4));
        database.tryAcquireBackfill("c1", "host-aaaa", T0, Duration.ofMinutes(5));

        assertThat(database.tryAcquireBackfill("c1", "host-bbbb", T0.plusSeconds(10), Duration.ofMinutes(5))).isFalse();
        assertThat(database.tryAcquireBackfill("c1", "host-aaaa", T0.plusSeconds(10), Duration.ofMinutes(5))).isTrue();

        Checkpoint regranted = database.load("c1", CheckpointKind.BACKFILL).orElseThrow();
        assertThat(regranted.backfillOwner()).isEqualTo("host-aaaa");
        assertThat(regranted.backfillLeaseUntil()).isEqualTo(T0.plusSeconds(310));
        assertThat(regranted.lastProcessedId()).isEqualTo("m4");
    }

    @Test
    void claimDoesNotTouchProgress() throws Exception {
        database.save(Checkpoint.empty("c1", CheckpointKind.BACKFILL).withProgress("m3", T0, 3));
        database.tryAcquireBackfill("c1", "node-a", T0, Duration.ofMinutes(1));

        Checkpoint loaded = database.load("c1", CheckpointKind.BACKFILL).orElseThrow();
        assertThat(loaded.lastProcessedId()).isEqualTo("m3");
        assertThat(loaded.totalProcessed()).isEqualTo(3);
        assertThat(loaded.backfillInProgress()).isTrue();
    }

    @Test
    void releaseBackfill_completedClearsClaim() throws Exception {
        database.tryAcquireBackfill("c1", "node-a", T0, Duration.ofMinutes(1));

        database.releaseBackfill("c1", "node-a", BackfillOutcome.COMPLETED, T0.plusSeconds(5));

        Checkpoint released = database.load("c1", CheckpointKind.BACKFILL).orElseThrow();
        assertThat(released.backfillInProgress()).isFalse();
        assertThat(released.backfillOwner()).isNull();
        assertThat(released.lastBackfillCompletedAt()).isEqualTo(T0.plusSeconds(5));
        assertThat(database.tryAcquireBackfill("c1", "node-b", T0.plusSeconds(6), Duration.ofMinutes(1))).isTrue();
    }

    @Test
    void releaseBackfill_pausedKeepsFlagButExpiresLease() throws Exception {
        database.tryAcquireBackfill("c1", "node-a", T0, Duration.ofMinutes(1));

        database.releaseBackfill("c1", "node-a", BackfillOutcome.PAUSED, T0.plusSeconds(5));

        Checkpoint paused = database.load("c1", CheckpointKind.BACKFILL).orElseThrow();
        assertThat(paused.backfillInProgress()).isTrue();
        assertThat(paused.backfillLeaseUntil()).isEqualTo(T0.plusSeconds(5));
        assertThat(database.tryAcquireBackfill("c1", "node-b", T0.plusSeconds(6), Duration.ofMinutes(1))).isTrue();
    }

    @Test
    void releaseBackfill_byStaleOwnerIsIgnored() throws Exception {
        database.tryAcquireBackfill("c1", "node-a", T0, Duration.ofMinutes(1));

        database.releaseBackfill("c1", "node-b", BackfillOutcome.ABORTED, T0.plusSeconds(5));

        assertThat(database.load("c1", CheckpointKind.BACKFILL).orElseThrow().backfillOwner()).isEqualTo("node-a");
    }

    @Test
    void listAll_ordersByScopeAndKind() throws Exception {
        database.save(Checkpoint.empty("c2", CheckpointKind.LIVE).withProgress("x", T0, 1));
        database.save(Checkpoint.empty("c1", CheckpointKind.LIVE).withProgress("y", T0, 1));
        database.save(Checkpoint.empty("c1", CheckpointKind.BACKFILL).withProgress("z", T0, 1));

        assertThat(database.listAll())
            .extracting(c -> c.scopeId() + "/" + c.kind())
            .containsExactly("c1/BACKFILL", "c1/LIVE", "c2/LIVE");
    }

    @Test
    void pingFailsAfterClose() {
        assertThat(database.ping()).isTrue();
        assertThat(database.isHealthy()).isTrue();

        database.close();

        assertThat(database.ping()).isFalse();
    }

    @Test
    void webhookIdAndWebhookActionsRoundTrip() throws Exception {
        ActionEvent hookCreated = new ActionEvent("a-hook", "c1", "guild-1", ActionType.WEBHOOK_CREATE, "admin-1",
            "hook-77", T0, Map.of("name", "Deploy Bot"), Map.of(), Map.of(), EventOrigin.LIVE);

        database.upsertBatch(EventKind.MESSAGE, List.of(webhookMessage("w1", "c1", "hook-77"), message("m1", "c1", T0)));
        database.upsertBatch(EventKind.ACTION, List.of(hookCreated));

        assertThat(((MessageEvent) database.findById(EventKind.MESSAGE, "w1").orElseThrow()).webhookId())
            .isEqualTo("hook-77");
        assertThat(((MessageEvent) database.findById(EventKind.MESSAGE, "m1").orElseThrow()).webhookId()).isNull();
        assertThat(((ActionEvent) database.findById(EventKind.ACTION, "a-hook").orElseThrow()).actionType())
            .isEqualTo(ActionType.WEBHOOK_CREATE);
    }

    @Test
    void messagesTableWithoutWebhookColumnIsUpgraded() throws Exception {
        String url = "jdbc:h2:mem:legacy-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        try (Connection conn = DriverManager.getConnection(url, "sa", ""); Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE messages (id VARCHAR(64) PRIMARY KEY, scope_id VARCHAR(128) NOT NULL, "
                + "guild_id VARCHAR(128), author_id VARCHAR(128) NOT NULL, author_name VARCHAR(256), "
                + "content CHARACTER VARYING, is_bot BOOLEAN NOT NULL DEFAULT FALSE, "
                + "is_system BOOLEAN NOT NULL DEFAULT FALSE, occurred_at TIMESTAMP WITH TIME ZONE NOT NULL, "
                + "edited_at TIMESTAMP WITH TIME ZONE, version_at TIMESTAMP WITH TIME ZONE NOT NULL, "
                + "attributes CHARACTER VARYING, is_backfilled BOOLEAN NOT NULL DEFAULT FALSE, "
                + "first_captured_at TIMESTAMP WITH TIME ZONE NOT NULL, updated_at TIMESTAMP WITH TIME ZONE NOT NULL)");
        }

        try (H2Database legacy = new H2Database("legacy-db", ConfigFactory.parseMap(Map.of("jdbcUrl", url)))) {
            legacy.upsertBatch(EventKind.MESSAGE, List.of(webhookMessage("w1", "c1", "hook-77")));

            assertThat(((MessageEvent) legacy.findById(EventKind.MESSAGE, "w1").orElseThrow()).webhookId())
                .isEqualTo("hook-77");
        }
    }

    @Test
    void guildAndChannelMetadataIsReplacedOnEveryWrite() throws Exception {
        database.upsertGuild(new GuildInfo("guild-1", "Makers", null, "owner-1", 40, T0, null, null));
        GuildInfo renamed = new GuildInfo("guild-1", "Makers & Friends", "a description", "owner-1", 41, T0,
            "https://cdn.example/icon.png", null);
        database.upsertGuild(renamed);
        ChannelInfo general = new ChannelInfo("c1", "guild-1", "general", "text", null, null, "cat-1");
        database.upsertChannel(general);

        assertThat(database.findGuild("guild-1")).contains(renamed);
        assertThat(database.findChannel("c1")).contains(general);
        assertThat(database.findChannel("c2")).isEmpty();
        assertThat(database.findGuild("guild-2")).isEmpty();
    }
}
