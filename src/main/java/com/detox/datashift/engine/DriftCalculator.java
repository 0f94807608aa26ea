package com.detox.datashift.engine;

import com.detox.datashift.model.Baseline;
import com.detox.datashift.model.CurrentMetrics;
import com.detox.datashift.model.ShiftDeltas;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Compares current metrics against the baseline.
 *
 * Produces three independent percentages and never combines them into an
 * overall score; deciding what is significant is left to {@link ShiftClassifier}.
 */
@Component
public class DriftCalculator {

    public ShiftDeltas compare(CurrentMetrics current, Baseline baseline) {
        return new ShiftDeltas(
                percentChange(current.textLength().mean(), baseline.avgTextLength()),
                distributionChange(current.languageDistribution(), baseline.languageDistribution()),
                percentChange(current.requestVolume(), baseline.avgRequestVolume())
        );
    }

    /**
     * Signed change relative to the reference. A non-positive reference yields 0.
     */
    static double percentChange(double current, double reference) {
        if (reference <= 0) {
            return 0.0;
        }
        return (current - reference) / reference * 100.0;
    }

    /**
     * Mean absolute difference of percentages over the union of language keys,
     * a missing key counting as 0%.
     * <p>
     * Not a Jensen-Shannon divergence: a symmetric L1-style distance in percentage points.
     */
    static double distributionChange(Map<String, Double> current, Map<String, Double> reference) {
        if (current.isEmpty() || reference.isEmpty()) {
            return 0.0;
        }

        Set<String> languages = new HashSet<>(current.keySet());
        languages.addAll(reference.keySet());

        double totalDifference = 0.0;
        for (String language : languages) {
            totalDifference += Math.abs(
                    current.getOrDefault(language, 0.0) - reference.getOrDefault(language, 0.0)
            );
        }
        return totalDifference / languages.size();
    }
}
