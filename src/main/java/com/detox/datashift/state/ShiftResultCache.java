package com.detox.datashift.state;

import com.detox.datashift.model.ShiftReport;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single "last result" cell shared by the monitor (writer) and the exporter and
 * status endpoints (readers). Reads never block on a running check.
 */
@Component
public class ShiftResultCache {

    private final AtomicReference<CheckSnapshot> latest =
            new AtomicReference<>(CheckSnapshot.EMPTY);

    public CheckSnapshot publish(ShiftReport report) {
        return latest.updateAndGet(previous ->
                new CheckSnapshot(report, previous.totalChecks() + 1));
    }

    public CheckSnapshot latest() {
        return latest.get();
    }

    public Optional<ShiftReport> lastReport() {
        return Optional.ofNullable(latest.get().lastReport());
    }

    public long totalChecks() {
        return latest.get().totalChecks();
    }
}
