package org.logkeeper.ingest.resources.dedup;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.logkeeper.ingest.MutableClock;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.logkeeper.ingest.TestEvents.T0;

@Tag("unit")
class InMemoryDeduplicatorTest {

    private static InMemoryDeduplicator withoutExpiry(int maxKeys) {
        return new InMemoryDeduplicator("dedup", maxKeys, Duration.ZERO, new MutableClock(T0));
    }

    @Test
    void checkAndRecordReportsFirstSightingOnly() {
        InMemoryDeduplicator dedup = withoutExpiry(100);

        assertThat(dedup.checkAndRecord("MESSAGE:1:1000")).isTrue();
        assertThat(dedup.checkAndRecord("MESSAGE:1:1000")).isFalse();
        assertThat(dedup.checkAndRecord("MESSAGE:1:2000")).isTrue();
        assertThat(dedup.getTotalDuplicates()).isEqualTo(1);
    }

    @Test
    void seenDoesNotRecord() {
        InMemoryDeduplicator dedup = withoutExpiry(100);

        assertThat(dedup.seen("k")).isFalse();
        assertThat(dedup.seen("k")).isFalse();
        dedup.record("k");
        assertThat(dedup.seen("k")).isTrue();
    }

    @Test
    void evictsOldestKeyWhenFull() {
        InMemoryDeduplicator dedup = withoutExpiry(3);
        dedup.record("a");
        dedup.record("b");
        dedup.record("c");

        dedup.record("d");

        assertThat(dedup.size()).isEqualTo(3);
        assertThat(dedup.seen("a")).isFalse();
        assertThat(dedup.seen("d")).isTrue();
        assertThat(dedup.getTotalEvictions()).isEqualTo(1);
    }

    @Test
    void keysExpireAfterTheWindow() {
        MutableClock clock = new MutableClock(T0);
        InMemoryDeduplicator dedup = new InMemoryDeduplicator("dedup", 100, Duration.ofMinutes(5), clock);
        dedup.record("k");

        clock.advance(Duration.ofMinutes(4));
        assertThat(dedup.seen("k")).isTrue();

        clock.advance(Duration.ofMinutes(2));
        assertThat(dedup.seen("k")).isFalse();
        assertThat(dedup.checkAndRecord("k")).isTrue();
    }
}
