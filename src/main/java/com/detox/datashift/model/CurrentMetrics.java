package com.detox.datashift.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Metrics computed from one check window.
 *
 * Created fresh per check and never mutated afterwards; maps are copied into
 * sorted, unmodifiable views on construction.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CurrentMetrics(

        @JsonProperty("text_length")
        TextLengthStats textLength,

        @JsonProperty("language_distribution")
        Map<String, Double> languageDistribution,

        @JsonProperty("request_volume")
        double requestVolume,

        @JsonProperty("model_performance")
        Map<String, Map<String, ScoreStats>> modelPerformance,

        @JsonProperty("total_requests")
        long totalRequests,

        @JsonProperty("scoring_failure")
        String scoringFailure
) {

    public CurrentMetrics {
        textLength = textLength != null ? textLength : TextLengthStats.empty();
        languageDistribution = languageDistribution != null
                ? Collections.unmodifiableMap(new TreeMap<>(languageDistribution))
                : Map.of();
        if (modelPerformance != null) {
            Map<String, Map<String, ScoreStats>> copy = new TreeMap<>();
            modelPerformance.forEach((language, scores) ->
                    copy.put(language, Collections.unmodifiableMap(new TreeMap<>(scores))));
            modelPerformance = Collections.unmodifiableMap(copy);
        } else {
            modelPerformance = Map.of();
        }
    }

    public static CurrentMetrics empty(long totalRequests) {
        return new CurrentMetrics(TextLengthStats.empty(), Map.of(), 0.0, Map.of(), totalRequests, null);
    }
}
