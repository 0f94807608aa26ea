package com.detox.datashift.api;

import com.detox.datashift.engine.ShiftMonitor;
import com.detox.datashift.engine.ShiftScheduler;
import com.detox.datashift.model.Baseline;
import com.detox.datashift.model.CheckStatus;
import com.detox.datashift.model.ShiftReport;
import com.detox.datashift.output.ReportSummary;
import com.detox.datashift.output.ShiftReportSink;
import com.detox.datashift.source.LogSource;
import com.detox.datashift.state.BaselineStore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Control surface of the monitor: manual checks, status, baseline management,
 * health and report history.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ShiftMonitorController {

    private static final int MAX_REPORTS = 500;

    private final ShiftScheduler scheduler;
    private final ShiftMonitor monitor;
    private final BaselineStore baselineStore;
    private final LogSource logSource;
    private final ShiftReportSink reportSink;
    private final Clock clock;

    @PostMapping("/trigger-check")
    public ResponseEntity<ShiftReport> triggerCheck() {
        ShiftReport report = scheduler.triggerCheck();
        HttpStatus status = report.status() == CheckStatus.ERROR
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.OK;
        return ResponseEntity.status(status).body(report);
    }

    @GetMapping("/status")
    public ShiftScheduler.MonitorStatus status() {
        return scheduler.status();
    }

    @GetMapping("/baseline")
    public BaselineResponse baseline() {
        return new BaselineResponse("success", null, monitor.getBaseline());
    }

    @PostMapping("/baseline/update")
    public BaselineResponse updateBaseline(@Valid @RequestBody BaselineUpdateRequest request) {
        Baseline updated = monitor.updateBaseline(request.toBaseline());
        return new BaselineResponse("success", "Baseline updated successfully", updated);
    }

    @GetMapping("/health")
    public HealthResponse health() {
        boolean sourceAvailable = logSource.isAvailable();
        boolean baselineLoaded = baselineStore.isLoaded();
        return new HealthResponse(
                sourceAvailable && baselineLoaded ? "healthy" : "degraded",
                scheduler.isActive(),
                sourceAvailable,
                baselineLoaded,
                baselineStore.getBaselinePath().toString(),
                clock.instant()
        );
    }

    @GetMapping("/reports")
    public List<ReportSummary> reports(@RequestParam(defaultValue = "20") int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_REPORTS));
        return reportSink.recent(bounded);
    }

    public record BaselineResponse(
            @JsonProperty("status") String status,
            @JsonProperty("message") String message,
            @JsonProperty("baseline") Baseline baseline
    ) {
    }

    public record HealthResponse(
            @JsonProperty("status") String status,
            @JsonProperty("monitoring_active") boolean monitoringActive,
            @JsonProperty("log_source_available") boolean logSourceAvailable,
            @JsonProperty("baseline_loaded") boolean baselineLoaded,
            @JsonProperty("baseline_path") String baselinePath,
            @JsonProperty("timestamp") Instant timestamp
    ) {
    }
}
