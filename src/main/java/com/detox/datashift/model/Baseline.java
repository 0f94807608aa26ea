package com.detox.datashift.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reference snapshot of "normal" traffic.
 *
 * Stored on disk with snake_case keys. The four statistics are required; unknown
 * keys from older documents (for example {@code created_at}) are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Baseline(

        @JsonProperty(value = "avg_text_length", required = true)
        double avgTextLength,

        @JsonProperty(value = "text_length_std", required = true)
        double textLengthStd,

        @JsonProperty(value = "language_distribution", required = true)
        Map<String, Double> languageDistribution,

        @JsonProperty(value = "avg_request_volume", required = true)
        double avgRequestVolume,

        @JsonProperty("updated_at")
        Instant updatedAt,

        @JsonProperty("description")
        String description
) {

    public Baseline {
        languageDistribution = languageDistribution != null
                ? Collections.unmodifiableMap(new TreeMap<>(languageDistribution))
                : Map.of();
    }

    /**
     * Placeholder used until an operator supplies a real baseline.
     */
    public static Baseline defaults(Instant now) {
        Map<String, Double> languages = new LinkedHashMap<>();
        languages.put("en", 80.0);
        languages.put("es", 10.0);
        languages.put("fr", 5.0);
        languages.put("de", 3.0);
        languages.put("it", 2.0);
        return new Baseline(
                100.0,
                50.0,
                languages,
                10.0,
                now,
                "Default baseline - please update with actual data"
        );
    }

    public Baseline withUpdatedAt(Instant updatedAt) {
        return new Baseline(
                avgTextLength,
                textLengthStd,
                languageDistribution,
                avgRequestVolume,
                updatedAt,
                description
        );
    }
}
