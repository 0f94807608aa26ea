package com.detox.datashift.source;

import com.detox.datashift.exception.LogSourceUnavailableException;
import com.detox.datashift.model.LogRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory, time-indexed window over the inference log stream.
 *
 * The Kafka listener appends, the monitor reads windows. Records are kept for the
 * configured retention and the buffer is capped by record count; the oldest
 * records go first when either limit is hit.
 * <p>
 * The source reports itself unavailable until the consumer has started, and again
 * whenever the consumer stops or stops polling, so that a check never mistakes a
 * dead stream for a quiet one.
 */
@Slf4j
@Component
public class BufferedLogSource implements LogSource {

    private final Duration retention;
    private final int maxRecords;
    private final Clock clock;

    /**
     * timestamp -> records received with that timestamp, in arrival order
     */
    private final NavigableMap<Instant, List<LogRecord>> recordsByTime = new TreeMap<>();
    private int size;

    private final AtomicBoolean available = new AtomicBoolean(false);
    private volatile String unavailableReason = "inference log consumer has not started";

    public BufferedLogSource(
            @Value("${log-buffer.retention-minutes:1440}") long retentionMinutes,
            @Value("${log-buffer.max-records:200000}") int maxRecords,
            Clock clock
    ) {
        if (maxRecords <= 0) {
            throw new IllegalArgumentException("log-buffer.max-records must be positive, got " + maxRecords);
        }
        if (retentionMinutes <= 0) {
            throw new IllegalArgumentException("log-buffer.retention-minutes must be positive, got " + retentionMinutes);
        }
        this.retention = Duration.ofMinutes(retentionMinutes);
        this.maxRecords = maxRecords;
        this.clock = clock;
        log.info("Initialized BufferedLogSource with retention {} minutes and capacity {}",
                retentionMinutes, maxRecords);
    }

    public void append(LogRecord record) {
        if (record.getTimestamp() == null) {
            throw new IllegalArgumentException("Buffered log records need a timestamp");
        }
        synchronized (recordsByTime) {
            recordsByTime.computeIfAbsent(record.getTimestamp(), t -> new ArrayList<>()).add(record);
            size++;
            while (size > maxRecords) {
                evictOldest();
            }
        }
        if (!available.get()) {
            markAvailable();
        }
    }

    @Override
    public List<LogRecord> fetch(Instant start, Instant end) {
        if (!available.get()) {
            throw new LogSourceUnavailableException("Inference log stream unavailable: " + unavailableReason);
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Window end " + end + " is before start " + start);
        }

        List<LogRecord> window = new ArrayList<>();
        synchronized (recordsByTime) {
            recordsByTime.subMap(start, true, end, true)
                    .values()
                    .forEach(window::addAll);
        }

        log.info("Retrieved {} log entries between {} and {}", window.size(), start, end);
        return window;
    }

    /**
     * Drop records older than the retention window.
     *
     * @return number of records evicted
     */
    @Scheduled(fixedRateString = "${log-buffer.eviction-interval-ms:60000}")
    public int evictExpired() {
        Instant cutoff = clock.instant().minus(retention);
        int evicted = 0;

        synchronized (recordsByTime) {
            Iterator<Map.Entry<Instant, List<LogRecord>>> it =
                    recordsByTime.headMap(cutoff, false).entrySet().iterator();
            while (it.hasNext()) {
                evicted += it.next().getValue().size();
                it.remove();
            }
            size -= evicted;
        }

        if (evicted > 0) {
            log.debug("Evicted {} log records older than {}", evicted, cutoff);
        }
        return evicted;
    }

    public void markAvailable() {
        if (available.compareAndSet(false, true)) {
            log.info("Inference log stream available");
        }
    }

    public void markUnavailable(String reason) {
        unavailableReason = reason;
        if (available.compareAndSet(true, false)) {
            log.warn("Inference log stream unavailable: {}", reason);
        }
    }

    @Override
    public boolean isAvailable() {
        return available.get();
    }

    public int size() {
        synchronized (recordsByTime) {
            return size;
        }
    }

    private void evictOldest() {
        Map.Entry<Instant, List<LogRecord>> oldest = recordsByTime.firstEntry();
        List<LogRecord> records = oldest.getValue();
        records.remove(0);
        size--;
        if (records.isEmpty()) {
            recordsByTime.remove(oldest.getKey());
        }
    }
}
