package com.detox.datashift.state;

import com.detox.datashift.model.ShiftReport;

import java.time.Instant;

/**
 * The last published report together with the number of checks run so far.
 * Both fields change together, so readers never see a count from one check
 * and a report from another.
 */
public record CheckSnapshot(
        ShiftReport lastReport,
        long totalChecks
) {

    public static final CheckSnapshot EMPTY = new CheckSnapshot(null, 0);

    public Instant lastCheckTimestamp() {
        return lastReport != null ? lastReport.timestamp() : null;
    }
}
