package com.detox.datashift.engine;

import com.detox.datashift.metrics.Metrics;
import com.detox.datashift.model.Baseline;
import com.detox.datashift.model.CheckPhase;
import com.detox.datashift.model.CurrentMetrics;
import com.detox.datashift.model.LogRecord;
import com.detox.datashift.model.ShiftDeltas;
import com.detox.datashift.model.ShiftReport;
import com.detox.datashift.output.ShiftReportSink;
import com.detox.datashift.source.LogSource;
import com.detox.datashift.state.BaselineStore;
import com.detox.datashift.state.ShiftResultCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Core shift detection engine.
 *
 * One check cycle:
 * 1. Fetch the log records of the lookback window
 * 2. Aggregate them into current metrics
 * 3. Compare against the baseline and classify each delta
 * 4. Publish the report to the result cache, the exporter and the report history
 *
 * Cycles are serialized: a manual trigger that arrives during a scheduled cycle
 * waits for it and then runs its own. A failing cycle produces an error report and
 * never propagates out of {@link #checkOnce(Duration)}.
 */
@Slf4j
@Component
public class ShiftMonitor {

    private final LogSource logSource;
    private final MetricAggregator aggregator;
    private final DriftCalculator driftCalculator;
    private final BaselineStore baselineStore;
    private final ShiftResultCache resultCache;
    private final ShiftReportSink reportSink;
    private final Metrics metrics;
    private final Clock clock;
    private final double significanceThresholdPct;

    private final ReentrantLock checkLock = new ReentrantLock(true);
    private volatile CheckPhase phase = CheckPhase.IDLE;

    public ShiftMonitor(
            LogSource logSource,
            MetricAggregator aggregator,
            DriftCalculator driftCalculator,
            BaselineStore baselineStore,
            ShiftResultCache resultCache,
            ShiftReportSink reportSink,
            Metrics metrics,
            Clock clock,
            @Value("${monitor.significance-threshold-pct:20}") double significanceThresholdPct
    ) {
        this.logSource = logSource;
        this.aggregator = aggregator;
        this.driftCalculator = driftCalculator;
        this.baselineStore = baselineStore;
        this.resultCache = resultCache;
        this.reportSink = reportSink;
        this.metrics = metrics;
        this.clock = clock;
        this.significanceThresholdPct = significanceThresholdPct;
    }

    /**
     * Runs one full check over the window ending now.
     */
    public ShiftReport checkOnce(Duration lookback) {
        checkLock.lock();
        try {
            ShiftReport report = runCheck(lookback);
            publish(report);
            return report;
        } finally {
            phase = CheckPhase.IDLE;
            checkLock.unlock();
        }
    }

    private ShiftReport runCheck(Duration lookback) {
        Instant now = clock.instant();
        long lookbackMinutes = lookback.toMinutes();

        try {
            phase = CheckPhase.FETCHING;
            List<LogRecord> records = logSource.fetch(now.minus(lookback), now);

            if (records.isEmpty()) {
                phase = CheckPhase.NO_DATA;
                log.warn("No logs found in the last {} minutes", lookbackMinutes);
                return ShiftReport.noData(now, lookbackMinutes);
            }

            phase = CheckPhase.AGGREGATING;
            CurrentMetrics current = aggregator.aggregate(records);

            phase = CheckPhase.COMPARING;
            Baseline baseline = baselineStore.get();
            ShiftDeltas deltas = driftCalculator.compare(current, baseline);
            List<String> significant = ShiftClassifier.significantChanges(deltas, significanceThresholdPct);

            deltas.asMap().forEach((name, value) -> {
                if (significant.contains(name)) {
                    log.warn("Significant change detected in {}: {}%", name, String.format("%.2f", value));
                }
            });

            phase = CheckPhase.DONE;
            log.info("Shift check completed: {} records, text_length_change={}, " +
                            "language_distribution_change={}, request_volume_change={}",
                    current.totalRequests(),
                    String.format("%.2f", deltas.textLengthChangePct()),
                    String.format("%.2f", deltas.languageDistributionChangeScore()),
                    String.format("%.2f", deltas.requestVolumeChangePct()));

            return ShiftReport.success(now, lookbackMinutes, deltas, current, baseline, significant);

        } catch (RuntimeException e) {
            phase = CheckPhase.ERROR;
            log.error("Shift check failed", e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ShiftReport.error(now, lookbackMinutes, message);
        }
    }

    private void publish(ShiftReport report) {
        resultCache.publish(report);
        try {
            metrics.onCheckCompleted(report);
        } catch (RuntimeException e) {
            log.error("Failed to export metrics for shift report from {}", report.timestamp(), e);
        }
        try {
            reportSink.write(report);
        } catch (RuntimeException e) {
            log.error("Failed to persist shift report from {}", report.timestamp(), e);
        }
    }

    public CheckPhase currentPhase() {
        return phase;
    }

    public Baseline getBaseline() {
        return baselineStore.get();
    }

    /**
     * Validates and persists a new baseline. The in-memory baseline only changes
     * once the file write has succeeded; a check already comparing keeps the
     * baseline it read.
     */
    public Baseline updateBaseline(Baseline candidate) {
        BaselineValidator.validate(candidate);
        Baseline stamped = candidate.withUpdatedAt(clock.instant());
        baselineStore.replace(stamped);
        log.info("Baseline updated: avg_text_length={}, avg_request_volume={}, languages={}",
                stamped.avgTextLength(), stamped.avgRequestVolume(), stamped.languageDistribution().keySet());
        return stamped;
    }
}
