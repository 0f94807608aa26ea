package com.detox.datashift.metrics;

import com.detox.datashift.model.ScoreStats;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable snapshot of the exported metrics.
 *
 * This is a READ MODEL:
 * - No logic
 * - Nulls indicate "no check has completed yet"
 */
public record MetricsSnapshot(

        /* -------- Check counters -------- */
        long totalChecks,
        long successfulChecks,
        long noDataChecks,
        long failedChecks,

        /* -------- Last report -------- */
        String lastStatus,
        Instant lastCheckTimestamp,
        double textLengthChangePct,
        double languageDistributionChangeScore,
        double requestVolumeChangePct,
        long totalRequests,

        /* -------- Current window breakdown -------- */
        Map<String, Double> languageDistribution,
        Map<String, Map<String, ScoreStats>> modelPerformance,

        /* -------- Health -------- */
        Instant lastUpdatedAt
) {}
