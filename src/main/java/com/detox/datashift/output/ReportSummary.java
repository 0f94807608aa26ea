package com.detox.datashift.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One row of the persisted report history.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportSummary(
        @JsonProperty("id") long id,
        @JsonProperty("status") String status,
        @JsonProperty("checked_at") Instant checkedAt,
        @JsonProperty("text_length_change") double textLengthChangePct,
        @JsonProperty("language_distribution_change") double languageDistributionChangeScore,
        @JsonProperty("request_volume_change") double requestVolumeChangePct,
        @JsonProperty("total_requests") long totalRequests,
        @JsonProperty("message") String message
) {}
