package com.detox.datashift.scoring;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Used when no evaluation service is configured. Model performance stays empty.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "scoring.enabled", havingValue = "false", matchIfMissing = true)
public class DisabledQualityScorer implements QualityScorer {

    public DisabledQualityScorer() {
        log.info("Quality scoring disabled; model performance metrics will be empty");
    }

    @Override
    public Map<String, List<Double>> score(List<String> inputs, List<String> outputs) {
        return Map.of();
    }
}
