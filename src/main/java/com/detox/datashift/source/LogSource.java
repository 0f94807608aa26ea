package com.detox.datashift.source;

import com.detox.datashift.model.LogRecord;

import java.time.Instant;
import java.util.List;

/**
 * Supplies inference log records for a time window.
 */
public interface LogSource {

    /**
     * Return the records with {@code start <= timestamp <= end}, oldest first.
     * <p>
     * An empty list means the window had no traffic. Implementations must throw
     * {@link com.detox.datashift.exception.LogSourceUnavailableException} instead of
     * returning partial data when the transport is broken.
     */
    List<LogRecord> fetch(Instant start, Instant end);

    boolean isAvailable();
}
