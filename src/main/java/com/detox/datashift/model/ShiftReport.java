package com.detox.datashift.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Result of one check cycle. Always complete: failed cycles carry zero deltas and a message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ShiftReport(

        @JsonProperty("status")
        CheckStatus status,

        @JsonProperty("timestamp")
        Instant timestamp,

        @JsonProperty("lookback_minutes")
        long lookbackMinutes,

        @JsonProperty("text_length_change")
        double textLengthChangePct,

        @JsonProperty("language_distribution_change")
        double languageDistributionChangeScore,

        @JsonProperty("request_volume_change")
        double requestVolumeChangePct,

        @JsonProperty("current_metrics")
        CurrentMetrics currentMetrics,

        @JsonProperty("baseline_metrics")
        Baseline baseline,

        @JsonProperty("total_requests")
        long totalRequests,

        @JsonProperty("message")
        String message,

        @JsonProperty("significant_changes")
        List<String> significantChanges
) {

    public ShiftReport {
        significantChanges = significantChanges != null ? List.copyOf(significantChanges) : List.of();
    }

    public static ShiftReport success(
            Instant timestamp,
            long lookbackMinutes,
            ShiftDeltas deltas,
            CurrentMetrics currentMetrics,
            Baseline baseline,
            List<String> significantChanges
    ) {
        return new ShiftReport(
                CheckStatus.SUCCESS,
                timestamp,
                lookbackMinutes,
                deltas.textLengthChangePct(),
                deltas.languageDistributionChangeScore(),
                deltas.requestVolumeChangePct(),
                currentMetrics,
                baseline,
                currentMetrics.totalRequests(),
                null,
                significantChanges
        );
    }

    public static ShiftReport noData(Instant timestamp, long lookbackMinutes) {
        return new ShiftReport(
                CheckStatus.NO_DATA,
                timestamp,
                lookbackMinutes,
                0.0,
                0.0,
                0.0,
                null,
                null,
                0,
                "No recent logs found for analysis",
                List.of()
        );
    }

    public static ShiftReport error(Instant timestamp, long lookbackMinutes, String message) {
        return new ShiftReport(
                CheckStatus.ERROR,
                timestamp,
                lookbackMinutes,
                0.0,
                0.0,
                0.0,
                null,
                null,
                0,
                message,
                List.of()
        );
    }

    public ShiftDeltas deltas() {
        return new ShiftDeltas(textLengthChangePct, languageDistributionChangeScore, requestVolumeChangePct);
    }
}
