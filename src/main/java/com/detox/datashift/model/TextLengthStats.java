package com.detox.datashift.model;

/**
 * Text length statistics over the valid records of one batch.
 */
public record TextLengthStats(
        double mean,
        double std,
        double min,
        double max,
        double median,
        long count
) {

    public static TextLengthStats empty() {
        return new TextLengthStats(0.0, 0.0, 0.0, 0.0, 0.0, 0);
    }
}
