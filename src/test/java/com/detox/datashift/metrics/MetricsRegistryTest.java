package com.detox.datashift.metrics;

import com.detox.datashift.model.Baseline;
import com.detox.datashift.model.CurrentMetrics;
import com.detox.datashift.model.ScoreStats;
import com.detox.datashift.model.ShiftDeltas;
import com.detox.datashift.model.ShiftReport;
import com.detox.datashift.model.TextLengthStats;
import com.detox.datashift.state.ShiftResultCache;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.detox.datashift.testutil.TestFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;

public class MetricsRegistryTest {

    private SimpleMeterRegistry meterRegistry;
    private ShiftResultCache cache;
    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        cache = new ShiftResultCache();
        metrics = new MetricsRegistry(meterRegistry, cache);
    }

    private void complete(ShiftReport report) {
        cache.publish(report);
        metrics.onCheckCompleted(report);
    }

    private ShiftReport successReport(Map<String, Double> languages) {
        CurrentMetrics current = new CurrentMetrics(
                new TextLengthStats(130.0, 10.0, 100.0, 160.0, 130.0, 10),
                languages,
                10.0,
                Map.of("en", Map.of("STA", new ScoreStats(0.9, 0.05, 10))),
                10,
                null
        );
        return ShiftReport.success(
                NOW, 60, new ShiftDeltas(30.0, 20.0, 0.0), current,
                Baseline.defaults(NOW), List.of(ShiftDeltas.TEXT_LENGTH_CHANGE));
    }

    private double gauge(String name) {
        return meterRegistry.get(name).gauge().value();
    }

    @Test
    void testGaugesReadZeroBeforeFirstCheck() {
        assertThat(gauge("data.shift.text.length.mean.change")).isZero();
        assertThat(gauge("data.shift.last.check.timestamp")).isZero();
        assertThat(metrics.snapshot().lastStatus()).isNull();
    }

    @Test
    void testGaugesFollowLastReport() {
        complete(successReport(Map.of("en", 60.0, "es", 40.0)));

        assertThat(gauge("data.shift.text.length.mean.change")).isEqualTo(30.0);
        assertThat(gauge("data.shift.language.distribution.change")).isEqualTo(20.0);
        assertThat(gauge("data.shift.request.volume.change")).isZero();
        assertThat(gauge("data.shift.total.requests")).isEqualTo(10.0);
        assertThat(gauge("data.shift.text.length.mean")).isEqualTo(130.0);
        assertThat(gauge("data.shift.last.check.timestamp")).isEqualTo(NOW.getEpochSecond());
        assertThat(meterRegistry.get("data.shift.language.percentage").tag("language", "es").gauge().value())
                .isEqualTo(40.0);
        assertThat(meterRegistry.get("data.shift.model.performance")
                .tag("language", "en").tag("metric", "STA").tag("stat", "mean")
                .gauge().value())
                .isEqualTo(0.9);
    }

    /**
     * A language absent from the latest window reports 0 rather than its old value.
     */
    @Test
    void testLanguageGaugeDropsToZeroWhenLanguageDisappears() {
        complete(successReport(Map.of("en", 60.0, "es", 40.0)));
        complete(successReport(Map.of("en", 100.0)));

        assertThat(meterRegistry.get("data.shift.language.percentage").tag("language", "es").gauge().value())
                .isZero();
    }

    @Test
    void testFailedCheckResetsDeltasAndCountsByStatus() {
        complete(successReport(Map.of("en", 100.0)));
        complete(ShiftReport.error(NOW.plusSeconds(300), 60, "source down"));
        complete(ShiftReport.noData(NOW.plusSeconds(600), 60));

        assertThat(gauge("data.shift.text.length.mean.change")).isZero();
        assertThat(meterRegistry.get("monitoring.checks").tag("status", "success").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("monitoring.checks").tag("status", "error").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("monitoring.checks").tag("status", "no_data").counter().count()).isEqualTo(1.0);

        MetricsSnapshot snapshot = metrics.snapshot();
        assertThat(snapshot.totalChecks()).isEqualTo(3);
        assertThat(snapshot.successfulChecks()).isEqualTo(1);
        assertThat(snapshot.failedChecks()).isEqualTo(1);
        assertThat(snapshot.noDataChecks()).isEqualTo(1);
        assertThat(snapshot.lastStatus()).isEqualTo("no_data");
        assertThat(snapshot.lastCheckTimestamp()).isEqualTo(NOW.plusSeconds(600));
    }
}
