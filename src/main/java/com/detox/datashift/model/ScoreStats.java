package com.detox.datashift.model;

public record ScoreStats(
        double mean,
        double std,
        long count
) {}
