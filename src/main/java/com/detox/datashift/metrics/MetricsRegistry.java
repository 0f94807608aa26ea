package com.detox.datashift.metrics;

import com.detox.datashift.model.CheckStatus;
import com.detox.datashift.model.CurrentMetrics;
import com.detox.datashift.model.ScoreStats;
import com.detox.datashift.model.ShiftReport;
import com.detox.datashift.state.CheckSnapshot;
import com.detox.datashift.state.ShiftResultCache;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.ToDoubleFunction;

/**
 * Micrometer-backed exporter over the last published shift report.
 *
 * Gauges read the result cache at scrape time, so a scrape always sees the last
 * completed report and never waits for a running check. Per-language and
 * per-quality-metric gauges are registered the first time a key shows up and
 * report 0 once it disappears from the window.
 */
@Slf4j
@Component
public class MetricsRegistry implements Metrics {

    private final MeterRegistry meterRegistry;
    private final ShiftResultCache resultCache;

    private final Map<CheckStatus, Counter> checkCounters = new EnumMap<>(CheckStatus.class);
    private final Set<String> languageGauges = ConcurrentHashMap.newKeySet();
    private final Set<String> performanceGauges = ConcurrentHashMap.newKeySet();

    private final AtomicReference<Instant> lastUpdatedAt =
            new AtomicReference<>(Instant.now());

    public MetricsRegistry(MeterRegistry meterRegistry, ShiftResultCache resultCache) {
        this.meterRegistry = meterRegistry;
        this.resultCache = resultCache;

        registerReportGauge("data.shift.text.length.mean.change",
                "Percentage change in average text length compared to baseline",
                ShiftReport::textLengthChangePct);

        registerReportGauge("data.shift.language.distribution.change",
                "Mean absolute change in language distribution compared to baseline, in percentage points",
                ShiftReport::languageDistributionChangeScore);

        registerReportGauge("data.shift.request.volume.change",
                "Percentage change in request volume compared to baseline",
                ShiftReport::requestVolumeChangePct);

        registerReportGauge("data.shift.total.requests",
                "Raw log records in the last check window",
                ShiftReport::totalRequests);

        registerReportGauge("data.shift.text.length.mean",
                "Average input text length in the last check window",
                report -> report.currentMetrics() != null ? report.currentMetrics().textLength().mean() : 0.0);

        registerReportGauge("data.shift.request.volume",
                "Requests per minute in the last check window",
                report -> report.currentMetrics() != null ? report.currentMetrics().requestVolume() : 0.0);

        Gauge.builder("data.shift.last.check.timestamp", resultCache, cache -> {
                    Instant last = cache.latest().lastCheckTimestamp();
                    return last != null ? last.toEpochMilli() / 1000.0 : 0.0;
                })
                .description("Timestamp of last data shift check")
                .register(meterRegistry);

        for (CheckStatus status : CheckStatus.values()) {
            checkCounters.put(status, Counter.builder("monitoring.checks")
                    .tag("status", status.wireName())
                    .description("Total number of monitoring checks performed")
                    .register(meterRegistry));
        }
    }

    @Override
    public void onCheckCompleted(ShiftReport report) {
        checkCounters.get(report.status()).increment();

        CurrentMetrics current = report.currentMetrics();
        if (current != null) {
            current.languageDistribution().keySet().forEach(this::registerLanguageGauge);
            current.modelPerformance().forEach((language, scores) ->
                    scores.keySet().forEach(metric -> registerPerformanceGauges(language, metric)));
        }
        touch();
    }

    /* ---------- Snapshot ---------- */

    @Override
    public MetricsSnapshot snapshot() {
        CheckSnapshot latest = resultCache.latest();
        Optional<ShiftReport> report = Optional.ofNullable(latest.lastReport());
        Optional<CurrentMetrics> current = report.map(ShiftReport::currentMetrics);

        return new MetricsSnapshot(
                latest.totalChecks(),
                count(CheckStatus.SUCCESS),
                count(CheckStatus.NO_DATA),
                count(CheckStatus.ERROR),
                report.map(r -> r.status().wireName()).orElse(null),
                latest.lastCheckTimestamp(),
                report.map(ShiftReport::textLengthChangePct).orElse(0.0),
                report.map(ShiftReport::languageDistributionChangeScore).orElse(0.0),
                report.map(ShiftReport::requestVolumeChangePct).orElse(0.0),
                report.map(ShiftReport::totalRequests).orElse(0L),
                current.map(CurrentMetrics::languageDistribution).orElse(Map.of()),
                current.map(CurrentMetrics::modelPerformance).orElse(Map.of()),
                lastUpdatedAt.get()
        );
    }

    private void registerReportGauge(String name, String description, ToDoubleFunction<ShiftReport> value) {
        Gauge.builder(name, resultCache, cache -> cache.lastReport()
                        .map(value::applyAsDouble)
                        .orElse(0.0))
                .description(description)
                .register(meterRegistry);
    }

    private void registerLanguageGauge(String language) {
        if (!languageGauges.add(language)) {
            return;
        }
        Gauge.builder("data.shift.language.percentage", resultCache, cache -> currentMetrics(cache)
                        .map(m -> m.languageDistribution().getOrDefault(language, 0.0))
                        .orElse(0.0))
                .tag("language", language)
                .description("Share of language-tagged requests in the last check window")
                .register(meterRegistry);
        log.debug("Registered language gauge for {}", language);
    }

    private void registerPerformanceGauges(String language, String metric) {
        if (!performanceGauges.add(language + "/" + metric)) {
            return;
        }
        registerPerformanceGauge(language, metric, "mean", ScoreStats::mean);
        registerPerformanceGauge(language, metric, "std", ScoreStats::std);
    }

    private void registerPerformanceGauge(
            String language,
            String metric,
            String stat,
            ToDoubleFunction<ScoreStats> value
    ) {
        Gauge.builder("data.shift.model.performance", resultCache, cache -> currentMetrics(cache)
                        .map(m -> m.modelPerformance().getOrDefault(language, Map.of()).get(metric))
                        .map(value::applyAsDouble)
                        .orElse(0.0))
                .tag("language", language)
                .tag("metric", metric)
                .tag("stat", stat)
                .description("Quality sub-score of the rewriting model in the last check window")
                .register(meterRegistry);
    }

    private static Optional<CurrentMetrics> currentMetrics(ShiftResultCache cache) {
        return cache.lastReport().map(ShiftReport::currentMetrics);
    }

    private long count(CheckStatus status) {
        return (long) checkCounters.get(status).count();
    }

    private void touch() {
        lastUpdatedAt.set(Instant.now());
    }
}
