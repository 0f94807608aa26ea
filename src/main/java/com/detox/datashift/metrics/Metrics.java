package com.detox.datashift.metrics;

import com.detox.datashift.model.ShiftReport;

/**
 * Metrics API used by the shift monitor and exposed via /metrics and the Prometheus scrape.
 */
public interface Metrics {

    void onCheckCompleted(ShiftReport report);

    MetricsSnapshot snapshot();
}
