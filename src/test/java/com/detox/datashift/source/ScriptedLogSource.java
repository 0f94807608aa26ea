package com.detox.datashift.source;

import com.detox.datashift.model.LogRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Log source returning a fixed batch, or failing, regardless of the window asked for.
 */
public class ScriptedLogSource implements LogSource {

    private volatile List<LogRecord> batch = List.of();
    private volatile RuntimeException failure;
    private final List<Instant[]> requestedWindows = new CopyOnWriteArrayList<>();

    public ScriptedLogSource returning(List<LogRecord> records) {
        this.batch = new ArrayList<>(records);
        this.failure = null;
        return this;
    }

    public ScriptedLogSource failingWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    @Override
    public List<LogRecord> fetch(Instant start, Instant end) {
        requestedWindows.add(new Instant[]{start, end});
        if (failure != null) {
            throw failure;
        }
        return batch;
    }

    @Override
    public boolean isAvailable() {
        return failure == null;
    }

    public List<Instant[]> requestedWindows() {
        return requestedWindows;
    }
}
