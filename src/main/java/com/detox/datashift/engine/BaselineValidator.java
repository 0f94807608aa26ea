package com.detox.datashift.engine;

import com.detox.datashift.exception.InvalidBaselineException;
import com.detox.datashift.model.Baseline;

import java.util.Map;

/**
 * Rejects baselines that would make every later comparison meaningless.
 */
public final class BaselineValidator {

    private BaselineValidator() {
    }

    public static void validate(Baseline baseline) {
        if (baseline == null) {
            throw new InvalidBaselineException("Baseline must not be null");
        }
        requireNonNegative("avg_text_length", baseline.avgTextLength());
        requireNonNegative("text_length_std", baseline.textLengthStd());
        requireNonNegative("avg_request_volume", baseline.avgRequestVolume());

        for (Map.Entry<String, Double> entry : baseline.languageDistribution().entrySet()) {
            String language = entry.getKey();
            Double pct = entry.getValue();
            if (language == null || language.isBlank()) {
                throw new InvalidBaselineException("language_distribution contains a blank language code");
            }
            if (pct == null || !Double.isFinite(pct) || pct < 0.0 || pct > 100.0) {
                throw new InvalidBaselineException(
                        "language_distribution[" + language + "] must be a percentage in [0, 100], got " + pct);
            }
        }
    }

    private static void requireNonNegative(String field, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new InvalidBaselineException(field + " must be a finite non-negative number, got " + value);
        }
    }
}
