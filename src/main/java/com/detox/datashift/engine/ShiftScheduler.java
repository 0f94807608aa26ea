package com.detox.datashift.engine;

import com.detox.datashift.model.CheckPhase;
import com.detox.datashift.model.ShiftReport;
import com.detox.datashift.state.CheckSnapshot;
import com.detox.datashift.state.ShiftResultCache;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives the shift monitor on a fixed delay and serves manual triggers.
 */
@Slf4j
@Component
public class ShiftScheduler {

    private final ShiftMonitor monitor;
    private final ShiftResultCache resultCache;
    private final Duration lookback;
    private final AtomicBoolean active;

    public ShiftScheduler(
            ShiftMonitor monitor,
            ShiftResultCache resultCache,
            @Value("${monitor.enabled:true}") boolean enabled,
            @Value("${monitor.lookback-minutes:60}") long lookbackMinutes
    ) {
        if (lookbackMinutes <= 0) {
            throw new IllegalArgumentException("monitor.lookback-minutes must be positive, got " + lookbackMinutes);
        }
        this.monitor = monitor;
        this.resultCache = resultCache;
        this.lookback = Duration.ofMinutes(lookbackMinutes);
        this.active = new AtomicBoolean(enabled);
        log.info("Shift monitoring {} with a {} minute lookback", enabled ? "enabled" : "disabled", lookbackMinutes);
    }

    @Scheduled(
            fixedDelayString = "${monitor.check-interval-ms:300000}",
            initialDelayString = "${monitor.initial-delay-ms:10000}"
    )
    public void scheduledCheck() {
        if (!active.get()) {
            return;
        }
        try {
            monitor.checkOnce(lookback);
        } catch (RuntimeException e) {
            // keep the schedule alive
            log.error("Scheduled shift check failed", e);
        }
    }

    public ShiftReport triggerCheck() {
        log.info("Manual shift check triggered");
        return monitor.checkOnce(lookback);
    }

    public MonitorStatus status() {
        CheckSnapshot snapshot = resultCache.latest();
        return new MonitorStatus(
                active.get(),
                monitor.currentPhase(),
                snapshot.lastReport(),
                snapshot.lastCheckTimestamp(),
                snapshot.totalChecks()
        );
    }

    public boolean isActive() {
        return active.get();
    }

    public Duration getLookback() {
        return lookback;
    }

    @PreDestroy
    public void stop() {
        if (active.compareAndSet(true, false)) {
            log.info("Shift monitoring stopped");
        }
    }

    public record MonitorStatus(
            @JsonProperty("monitoring_active") boolean monitoringActive,
            @JsonProperty("phase") CheckPhase phase,
            @JsonProperty("last_check_result") ShiftReport lastCheckResult,
            @JsonProperty("last_check_timestamp") Instant lastCheckTimestamp,
            @JsonProperty("total_checks") long totalChecks
    ) {
    }
}
