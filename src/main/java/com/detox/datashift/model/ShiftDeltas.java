package com.detox.datashift.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The three independent change signals of one comparison, all in percent.
 */
public record ShiftDeltas(
        double textLengthChangePct,
        double languageDistributionChangeScore,
        double requestVolumeChangePct
) {

    public static final String TEXT_LENGTH_CHANGE = "text_length_change";
    public static final String LANGUAGE_DISTRIBUTION_CHANGE = "language_distribution_change";
    public static final String REQUEST_VOLUME_CHANGE = "request_volume_change";

    public static final ShiftDeltas ZERO = new ShiftDeltas(0.0, 0.0, 0.0);

    public Map<String, Double> asMap() {
        Map<String, Double> named = new LinkedHashMap<>();
        named.put(TEXT_LENGTH_CHANGE, textLengthChangePct);
        named.put(LANGUAGE_DISTRIBUTION_CHANGE, languageDistributionChangeScore);
        named.put(REQUEST_VOLUME_CHANGE, requestVolumeChangePct);
        return named;
    }
}
