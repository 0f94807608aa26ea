package com.detox.datashift.engine;

import com.detox.datashift.exception.QualityScoringException;
import com.detox.datashift.model.CurrentMetrics;
import com.detox.datashift.model.LogRecord;
import com.detox.datashift.model.ScoreStats;
import com.detox.datashift.model.TextLengthStats;
import com.detox.datashift.scoring.QualityScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Reduces a batch of inference log records into {@link CurrentMetrics}.
 *
 * Holds no state between calls. The only collaborator is the quality scorer,
 * which is called at most once per batch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricAggregator {

    public static final String UNKNOWN_LANGUAGE = "unknown";

    private static final double MILLIS_PER_MINUTE = 60_000.0;

    private final QualityScorer qualityScorer;

    public CurrentMetrics aggregate(List<LogRecord> records) {
        if (records == null || records.isEmpty()) {
            return CurrentMetrics.empty(0);
        }

        List<LogRecord> valid = records.stream()
                .filter(Objects::nonNull)
                .filter(LogRecord::isValid)
                .toList();

        int dropped = records.size() - valid.size();
        if (dropped > 0) {
            log.debug("Dropped {} of {} log records without text and language", dropped, records.size());
        }
        if (valid.isEmpty()) {
            return CurrentMetrics.empty(records.size());
        }

        log.info("Processing {} log entries ({} valid)", records.size(), valid.size());

        ModelPerformance performance = modelPerformance(valid);

        return new CurrentMetrics(
                textLengthStats(valid),
                languageDistribution(valid),
                requestVolume(valid),
                performance.byLanguage(),
                records.size(),
                performance.failure()
        );
    }

    TextLengthStats textLengthStats(List<LogRecord> records) {
        List<Double> lengths = records.stream()
                .map(LogRecord::getTextLength)
                .filter(Objects::nonNull)
                .map(Integer::doubleValue)
                .toList();

        if (lengths.isEmpty()) {
            return TextLengthStats.empty();
        }

        double mean = mean(lengths);
        return new TextLengthStats(
                mean,
                sampleStd(lengths, mean),
                lengths.stream().mapToDouble(Double::doubleValue).min().orElse(0.0),
                lengths.stream().mapToDouble(Double::doubleValue).max().orElse(0.0),
                median(lengths),
                lengths.size()
        );
    }

    /**
     * Percentage of language-tagged records per language. Records without a
     * language code are left out of the denominator.
     */
    Map<String, Double> languageDistribution(List<LogRecord> records) {
        Map<String, Long> counts = records.stream()
                .filter(LogRecord::hasLanguage)
                .collect(Collectors.groupingBy(LogRecord::getLanguageId, TreeMap::new, Collectors.counting()));

        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        if (total == 0) {
            return Map.of();
        }

        Map<String, Double> distribution = new TreeMap<>();
        counts.forEach((language, count) -> distribution.put(language, count * 100.0 / total));
        return distribution;
    }

    /**
     * Records per minute between the earliest and latest timestamp. The span is
     * floored at one minute so a burst inside a single minute does not inflate the rate.
     */
    double requestVolume(List<LogRecord> records) {
        List<Instant> timestamps = records.stream()
                .map(LogRecord::getTimestamp)
                .filter(Objects::nonNull)
                .toList();

        if (timestamps.isEmpty()) {
            return 0.0;
        }

        Instant first = timestamps.stream().min(Comparator.naturalOrder()).orElseThrow();
        Instant last = timestamps.stream().max(Comparator.naturalOrder()).orElseThrow();
        double spanMinutes = Duration.between(first, last).toMillis() / MILLIS_PER_MINUTE;

        return records.size() / Math.max(spanMinutes, 1.0);
    }

    private ModelPerformance modelPerformance(List<LogRecord> records) {
        List<LogRecord> scorable = records.stream()
                .filter(LogRecord::isScorable)
                .toList();

        if (scorable.isEmpty()) {
            return ModelPerformance.NONE;
        }

        List<String> inputs = scorable.stream().map(LogRecord::getText).toList();
        List<String> outputs = scorable.stream().map(LogRecord::getDetoxifiedText).toList();

        Map<String, List<Double>> scores;
        try {
            scores = qualityScorer.score(inputs, outputs);
            verifyParallel(scores, inputs.size());
        } catch (RuntimeException e) {
            log.warn("Quality scoring failed for {} text pairs, model performance omitted this cycle: {}",
                    scorable.size(), e.getMessage(), e);
            return new ModelPerformance(Map.of(), describe(e));
        }

        Map<String, Map<String, List<Double>>> grouped = new HashMap<>();
        scores.forEach((metric, values) -> {
            for (int i = 0; i < values.size(); i++) {
                Double value = values.get(i);
                if (value == null || !Double.isFinite(value)) {
                    continue;
                }
                String language = languageOf(scorable.get(i));
                grouped.computeIfAbsent(language, l -> new TreeMap<>())
                        .computeIfAbsent(metric, m -> new ArrayList<>())
                        .add(value);
            }
        });

        Map<String, Map<String, ScoreStats>> byLanguage = new TreeMap<>();
        grouped.forEach((language, metrics) -> byLanguage.put(
                language,
                metrics.entrySet().stream().collect(Collectors.toMap(
                        Map.Entry::getKey,
                        entry -> scoreStats(entry.getValue()),
                        (a, b) -> a,
                        TreeMap::new
                ))
        ));

        return new ModelPerformance(byLanguage, null);
    }

    private static void verifyParallel(Map<String, List<Double>> scores, int expectedSize) {
        if (scores == null) {
            throw new QualityScoringException("Quality scorer returned no result");
        }
        scores.forEach((metric, values) -> {
            if (values == null || values.size() != expectedSize) {
                throw new QualityScoringException(String.format(
                        "Quality metric '%s' returned %d scores for %d inputs",
                        metric, values == null ? 0 : values.size(), expectedSize));
            }
        });
    }

    private static String languageOf(LogRecord record) {
        return record.hasLanguage() ? record.getLanguageId() : UNKNOWN_LANGUAGE;
    }

    private static ScoreStats scoreStats(List<Double> values) {
        double mean = mean(values);
        return new ScoreStats(mean, sampleStd(values, mean), values.size());
    }

    static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    /**
     * Sample standard deviation (n - 1); zero below two samples.
     */
    static double sampleStd(List<Double> values, double mean) {
        if (values.size() < 2) {
            return 0.0;
        }
        double squares = values.stream()
                .mapToDouble(v -> (v - mean) * (v - mean))
                .sum();
        return Math.sqrt(squares / (values.size() - 1));
    }

    static double median(List<Double> values) {
        List<Double> sorted = values.stream().sorted().toList();
        int middle = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(middle);
        }
        return (sorted.get(middle - 1) + sorted.get(middle)) / 2.0;
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private record ModelPerformance(Map<String, Map<String, ScoreStats>> byLanguage, String failure) {
        static final ModelPerformance NONE = new ModelPerformance(Map.of(), null);
    }
}
