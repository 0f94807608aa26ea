package com.detox.datashift.api;

import com.detox.datashift.model.Baseline;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Body of {@code POST /baseline/update}. Field names match the stored baseline document,
 * so a body fetched from {@code GET /baseline} can be posted back as is.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BaselineUpdateRequest {

    @NotNull
    @PositiveOrZero
    @JsonProperty("avg_text_length")
    private Double avgTextLength;

    @NotNull
    @PositiveOrZero
    @JsonProperty("text_length_std")
    private Double textLengthStd;

    @NotEmpty
    @JsonProperty("language_distribution")
    private Map<String, Double> languageDistribution;

    @NotNull
    @PositiveOrZero
    @JsonProperty("avg_request_volume")
    private Double avgRequestVolume;

    @JsonProperty("description")
    private String description;

    public Baseline toBaseline() {
        return new Baseline(
                avgTextLength,
                textLengthStd,
                languageDistribution,
                avgRequestVolume,
                null,
                description != null ? description : "Updated baseline"
        );
    }
}
