package com.detox.datashift.engine;

import com.detox.datashift.model.ShiftDeltas;

import java.util.List;
import java.util.Map;

/**
 * Threshold test for "significant" deltas. Independent of any logging sink.
 */
public final class ShiftClassifier {

    public static final double DEFAULT_THRESHOLD_PCT = 20.0;

    private ShiftClassifier() {}

    public static boolean isSignificant(double delta, double thresholdPct) {
        return Math.abs(delta) > thresholdPct;
    }

    /**
     * @return names of the deltas whose magnitude exceeds the threshold, in report order
     */
    public static List<String> significantChanges(ShiftDeltas deltas, double thresholdPct) {
        return deltas.asMap().entrySet().stream()
                .filter(entry -> isSignificant(entry.getValue(), thresholdPct))
                .map(Map.Entry::getKey)
                .toList();
    }
}
