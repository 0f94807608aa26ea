package com.detox.datashift.scoring;

import com.detox.datashift.exception.QualityScoringException;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;

/**
 * Calls the external evaluation service, which answers with one score list per
 * quality dimension (for example {@code STA} for style transfer accuracy and
 * {@code SIM} for similarity).
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "scoring.enabled", havingValue = "true")
public class HttpQualityScorer implements QualityScorer {

    private static final ParameterizedTypeReference<Map<String, List<Double>>> SCORES_TYPE =
            new ParameterizedTypeReference<>() {};

    private final RestClient scoringRestClient;

    public HttpQualityScorer(@Qualifier("scoringRestClient") RestClient scoringRestClient) {
        this.scoringRestClient = scoringRestClient;
    }

    @Override
    public Map<String, List<Double>> score(List<String> inputs, List<String> outputs) {
        log.debug("Requesting quality scores for {} text pairs", inputs.size());
        try {
            Map<String, List<Double>> scores = scoringRestClient.post()
                    .uri("/evaluate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new EvaluationRequest(inputs, outputs))
                    .retrieve()
                    .body(SCORES_TYPE);

            if (scores == null) {
                throw new QualityScoringException("Evaluation service returned an empty body");
            }
            return scores;

        } catch (RestClientException e) {
            throw new QualityScoringException("Evaluation service call failed: " + e.getMessage(), e);
        }
    }

    record EvaluationRequest(
            @JsonProperty("original_texts") List<String> originalTexts,
            @JsonProperty("rewritten_texts") List<String> rewrittenTexts
    ) {}
}
