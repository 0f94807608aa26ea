package com.detox.datashift.engine;

import com.detox.datashift.exception.InvalidBaselineException;
import com.detox.datashift.exception.LogSourceUnavailableException;
import com.detox.datashift.metrics.NoOpMetrics;
import com.detox.datashift.model.Baseline;
import com.detox.datashift.model.CheckPhase;
import com.detox.datashift.model.CheckStatus;
import com.detox.datashift.model.LogRecord;
import com.detox.datashift.model.ShiftDeltas;
import com.detox.datashift.model.ShiftReport;
import com.detox.datashift.output.InMemoryShiftReportSink;
import com.detox.datashift.scoring.DisabledQualityScorer;
import com.detox.datashift.scoring.FakeQualityScorer;
import com.detox.datashift.source.ScriptedLogSource;
import com.detox.datashift.state.BaselineStore;
import com.detox.datashift.state.ShiftResultCache;
import com.detox.datashift.testutil.TestFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.detox.datashift.testutil.TestFactory.NOW;
import static com.detox.datashift.testutil.TestFactory.scoredRecord;
import static com.detox.datashift.testutil.TestFactory.workedExampleBaseline;
import static com.detox.datashift.testutil.TestFactory.workedExampleBatch;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class ShiftMonitorTest {

    private static final Duration LOOKBACK = Duration.ofMinutes(60);

    @TempDir
    Path tempDir;

    private ScriptedLogSource source;
    private BaselineStore baselineStore;
    private ShiftResultCache cache;
    private InMemoryShiftReportSink sink;
    private ShiftMonitor monitor;

    @BeforeEach
    void setUp() {
        source = new ScriptedLogSource();
        baselineStore = TestFactory.baselineStore(tempDir);
        cache = new ShiftResultCache();
        sink = new InMemoryShiftReportSink();
        monitor = TestFactory.createMonitor(source, new DisabledQualityScorer(), baselineStore, cache, sink);
    }

    @Test
    void testEmptyWindowGivesNoData() {
        ShiftReport report = monitor.checkOnce(LOOKBACK);

        assertThat(report.status()).isEqualTo(CheckStatus.NO_DATA);
        assertThat(report.deltas()).isEqualTo(ShiftDeltas.ZERO);
        assertThat(report.totalRequests()).isZero();
        assertThat(report.message()).isEqualTo("No recent logs found for analysis");
        assertThat(cache.totalChecks()).isEqualTo(1);
        assertThat(sink.records()).containsExactly(report);
    }

    @Test
    void testFetchesTheLookbackWindowEndingNow() {
        monitor.checkOnce(LOOKBACK);

        Instant[] window = source.requestedWindows().get(0);
        assertThat(window[0]).isEqualTo(NOW.minus(LOOKBACK));
        assertThat(window[1]).isEqualTo(NOW);
    }

    @Test
    void testWorkedExampleReport() {
        baselineStore.replace(workedExampleBaseline());
        source.returning(workedExampleBatch());

        ShiftReport report = monitor.checkOnce(LOOKBACK);

        assertThat(report.status()).isEqualTo(CheckStatus.SUCCESS);
        assertThat(report.textLengthChangePct()).isCloseTo(30.0, within(1e-9));
        assertThat(report.languageDistributionChangeScore()).isCloseTo(20.0, within(1e-9));
        assertThat(report.requestVolumeChangePct()).isCloseTo(0.0, within(1e-9));
        assertThat(report.totalRequests()).isEqualTo(10);
        assertThat(report.lookbackMinutes()).isEqualTo(60);
        assertThat(report.significantChanges()).containsExactly(ShiftDeltas.TEXT_LENGTH_CHANGE);
    }

    /**
     * The report carries the exact baseline it was compared against, even if
     * the baseline is replaced afterwards.
     */
    @Test
    void testReportEmbedsBaselineUsed() {
        Baseline used = workedExampleBaseline();
        baselineStore.replace(used);
        source.returning(workedExampleBatch());

        ShiftReport report = monitor.checkOnce(LOOKBACK);
        monitor.updateBaseline(new Baseline(500.0, 1.0, Map.of("en", 100.0), 1.0, null, "later"));

        assertThat(report.baseline()).isEqualTo(used);
    }

    @Test
    void testSourceFailureGivesErrorReportAndMonitorSurvives() {
        source.failingWith(new LogSourceUnavailableException("consumer stopped"));

        ShiftReport failed = monitor.checkOnce(LOOKBACK);

        assertThat(failed.status()).isEqualTo(CheckStatus.ERROR);
        assertThat(failed.message()).contains("consumer stopped");
        assertThat(failed.deltas()).isEqualTo(ShiftDeltas.ZERO);
        assertThat(monitor.currentPhase()).isEqualTo(CheckPhase.IDLE);

        source.returning(workedExampleBatch());
        ShiftReport recovered = monitor.checkOnce(LOOKBACK);

        assertThat(recovered.status()).isEqualTo(CheckStatus.SUCCESS);
        assertThat(cache.totalChecks()).isEqualTo(2);
        assertThat(cache.lastReport()).contains(recovered);
    }

    @Test
    void testErrorWithoutMessageUsesExceptionName() {
        source.failingWith(new IllegalStateException());

        ShiftReport report = monitor.checkOnce(LOOKBACK);

        assertThat(report.message()).isEqualTo("IllegalStateException");
    }

    @Test
    void testRepeatedChecksOverSameDataAreIdentical() {
        source.returning(workedExampleBatch());

        ShiftReport first = monitor.checkOnce(LOOKBACK);
        ShiftReport second = monitor.checkOnce(LOOKBACK);

        assertThat(second.deltas()).isEqualTo(first.deltas());
        assertThat(second.currentMetrics()).isEqualTo(first.currentMetrics());
    }

    @Test
    void testScoringFailureStillProducesSuccess() {
        ShiftMonitor scoringMonitor = TestFactory.createMonitor(
                source, new FakeQualityScorer().failing(), baselineStore, cache, sink);
        source.returning(List.of(
                scoredRecord("you are dumb", "en", "you are wrong", NOW.minusSeconds(120)),
                scoredRecord("shut up", "en", "please stop", NOW.minusSeconds(60))
        ));

        ShiftReport report = scoringMonitor.checkOnce(LOOKBACK);

        assertThat(report.status()).isEqualTo(CheckStatus.SUCCESS);
        assertThat(report.currentMetrics().modelPerformance()).isEmpty();
        assertThat(report.currentMetrics().scoringFailure()).isNotNull();
    }

    @Test
    void testHistoryWriteFailureDoesNotChangeReport() {
        sink.failWrites();
        source.returning(workedExampleBatch());

        ShiftReport report = monitor.checkOnce(LOOKBACK);

        assertThat(report.status()).isEqualTo(CheckStatus.SUCCESS);
        assertThat(cache.lastReport()).contains(report);
    }

    @Test
    void testMetricsFailureDoesNotEscapeCheck() {
        NoOpMetrics brokenMetrics = new NoOpMetrics() {
            @Override
            public void onCheckCompleted(ShiftReport report) {
                throw new IllegalStateException("meter registration failed");
            }
        };
        ShiftMonitor failingExport = TestFactory.createMonitor(
                source, new DisabledQualityScorer(), baselineStore, cache, sink, brokenMetrics);
        source.returning(workedExampleBatch());

        ShiftReport report = failingExport.checkOnce(LOOKBACK);

        assertThat(report.status()).isEqualTo(CheckStatus.SUCCESS);
        assertThat(cache.lastReport()).contains(report);
        assertThat(sink.records()).containsExactly(report);
        assertThat(failingExport.currentPhase()).isEqualTo(CheckPhase.IDLE);
    }

    @Test
    void testUpdateBaselineStampsAndPersists() {
        Baseline candidate = new Baseline(120.0, 40.0, Map.of("en", 70.0, "es", 30.0), 12.0, null, "weekly");

        Baseline stored = monitor.updateBaseline(candidate);

        assertThat(stored.updatedAt()).isEqualTo(NOW);
        assertThat(monitor.getBaseline()).isEqualTo(stored);
        assertThat(TestFactory.baselineStore(tempDir).get()).isEqualTo(stored);
    }

    @Test
    void testInvalidBaselineLeavesActiveOneUntouched() {
        Baseline before = monitor.getBaseline();

        assertThatThrownBy(() -> monitor.updateBaseline(
                new Baseline(-5.0, 1.0, Map.of("en", 100.0), 1.0, null, null)))
                .isInstanceOf(InvalidBaselineException.class);

        assertThat(monitor.getBaseline()).isEqualTo(before);
    }

    @Test
    void testBatchOfInvalidRecordsReportsRawCount() {
        source.returning(List.of(
                LogRecord.builder().timestamp(NOW).build(),
                LogRecord.builder().timestamp(NOW).build()
        ));

        ShiftReport report = monitor.checkOnce(LOOKBACK);

        assertThat(report.status()).isEqualTo(CheckStatus.SUCCESS);
        assertThat(report.totalRequests()).isEqualTo(2);
        assertThat(report.currentMetrics().textLength().count()).isZero();
    }
}
