package com.detox.datashift.source;

import com.detox.datashift.exception.LogSourceUnavailableException;
import com.detox.datashift.model.LogRecord;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.detox.datashift.testutil.TestFactory.NOW;
import static com.detox.datashift.testutil.TestFactory.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class BufferedLogSourceTest {

    private BufferedLogSource source(int maxRecords, Instant now) {
        return new BufferedLogSource(60, maxRecords, Clock.fixed(now, ZoneOffset.UTC));
    }

    @Test
    void testUnavailableUntilConsumerStarts() {
        BufferedLogSource source = source(100, NOW);

        assertThat(source.isAvailable()).isFalse();
        assertThatThrownBy(() -> source.fetch(NOW.minusSeconds(60), NOW))
                .isInstanceOf(LogSourceUnavailableException.class)
                .hasMessageContaining("has not started");

        source.markAvailable();

        assertThat(source.fetch(NOW.minusSeconds(60), NOW)).isEmpty();
    }

    @Test
    void testFetchReturnsInclusiveWindow() {
        BufferedLogSource source = source(100, NOW);
        source.append(record("before", "en", NOW.minusSeconds(601)));
        source.append(record("start", "en", NOW.minusSeconds(600)));
        source.append(record("middle", "en", NOW.minusSeconds(300)));
        source.append(record("end", "en", NOW));

        List<LogRecord> window = source.fetch(NOW.minusSeconds(600), NOW);

        assertThat(window).extracting(LogRecord::getText).containsExactly("start", "middle", "end");
    }

    @Test
    void testRecordsWithSameTimestampAreKept() {
        BufferedLogSource source = source(100, NOW);
        source.append(record("a", "en", NOW));
        source.append(record("b", "en", NOW));

        assertThat(source.fetch(NOW, NOW)).hasSize(2);
        assertThat(source.size()).isEqualTo(2);
    }

    @Test
    void testReversedWindowRejected() {
        BufferedLogSource source = source(100, NOW);
        source.markAvailable();

        assertThatThrownBy(() -> source.fetch(NOW, NOW.minusSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testCapacityEvictsOldest() {
        BufferedLogSource source = source(2, NOW);
        source.append(record("old", "en", NOW.minusSeconds(30)));
        source.append(record("mid", "en", NOW.minusSeconds(20)));
        source.append(record("new", "en", NOW.minusSeconds(10)));

        assertThat(source.size()).isEqualTo(2);
        assertThat(source.fetch(NOW.minusSeconds(60), NOW))
                .extracting(LogRecord::getText)
                .containsExactly("mid", "new");
    }

    @Test
    void testRetentionEviction() {
        // retention is 60 minutes
        BufferedLogSource source = source(100, NOW);
        source.append(record("expired", "en", NOW.minusSeconds(2 * 3600)));
        source.append(record("fresh", "en", NOW.minusSeconds(600)));

        int evicted = source.evictExpired();

        assertThat(evicted).isEqualTo(1);
        assertThat(source.size()).isEqualTo(1);
    }

    @Test
    void testMarkUnavailableCarriesReason() {
        BufferedLogSource source = source(100, NOW);
        source.markAvailable();
        source.markUnavailable("consumer stopped (NORMAL)");

        assertThatThrownBy(() -> source.fetch(NOW.minusSeconds(60), NOW))
                .isInstanceOf(LogSourceUnavailableException.class)
                .hasMessageContaining("consumer stopped");
    }

    @Test
    void testNonPositiveCapacityRejected() {
        assertThatThrownBy(() -> source(0, NOW))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("log-buffer.max-records");
    }

    @Test
    void testNonPositiveRetentionRejected() {
        assertThatThrownBy(() -> new BufferedLogSource(0, 100, Clock.fixed(NOW, ZoneOffset.UTC)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("log-buffer.retention-minutes");
    }
}
