package com.detox.datashift.state;

import com.detox.datashift.engine.BaselineValidator;
import com.detox.datashift.exception.BaselinePersistenceException;
import com.detox.datashift.exception.InvalidBaselineException;
import com.detox.datashift.model.Baseline;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the single active baseline and its JSON document on disk.
 *
 * Writes go to a temp file in the same directory, are forced to disk and then
 * moved over the document, so a crash mid-write leaves the previous document intact.
 * The in-memory value is swapped only after the file is in place.
 */
@Slf4j
@Component
public class BaselineStore {

    private final Path baselinePath;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final AtomicReference<Baseline> active = new AtomicReference<>();
    private final Object writeLock = new Object();

    public BaselineStore(
            @Value("${monitor.baseline.path:./data/baseline.json}") String baselinePath,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.baselinePath = Paths.get(baselinePath).toAbsolutePath();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @PostConstruct
    public void initialize() {
        synchronized (writeLock) {
            active.set(load());
        }
    }

    /**
     * @return the active baseline; immutable, safe to hold across a whole check
     */
    public Baseline get() {
        Baseline baseline = active.get();
        if (baseline == null) {
            throw new IllegalStateException("Baseline store has not been initialized");
        }
        return baseline;
    }

    /**
     * Persist and activate a new baseline. If the write fails the previous
     * baseline stays active.
     */
    public void replace(Baseline baseline) {
        synchronized (writeLock) {
            write(baseline);
            active.set(baseline);
        }
        log.info("Baseline data saved to {}", baselinePath);
    }

    public boolean isLoaded() {
        return active.get() != null;
    }

    public Path getBaselinePath() {
        return baselinePath;
    }

    private Baseline load() {
        if (Files.exists(baselinePath)) {
            Baseline baseline;
            try {
                baseline = objectMapper.readValue(baselinePath.toFile(), Baseline.class);
            } catch (IOException e) {
                throw new BaselinePersistenceException("Failed to read baseline from " + baselinePath, e);
            }
            try {
                BaselineValidator.validate(baseline);
            } catch (InvalidBaselineException e) {
                throw new BaselinePersistenceException(
                        "Baseline document " + baselinePath + " is invalid: " + e.getMessage(), e);
            }
            log.info("Loaded baseline data from {}", baselinePath);
            return baseline;
        }

        Baseline defaults = Baseline.defaults(clock.instant());
        write(defaults);
        log.warn("Created default baseline at {}", baselinePath);
        return defaults;
    }

    private void write(Baseline baseline) {
        Path directory = baselinePath.getParent();
        Path tempFile = null;
        try {
            Files.createDirectories(directory);
            tempFile = Files.createTempFile(directory, baselinePath.getFileName().toString(), ".tmp");

            byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(baseline);
            try (FileChannel channel = FileChannel.open(tempFile, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(json);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }

            moveIntoPlace(tempFile);
            tempFile = null;

        } catch (IOException e) {
            throw new BaselinePersistenceException("Failed to write baseline to " + baselinePath, e);
        } finally {
            deleteQuietly(tempFile);
        }
    }

    private void moveIntoPlace(Path tempFile) throws IOException {
        try {
            Files.move(tempFile, baselinePath, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", baselinePath);
            Files.move(tempFile, baselinePath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path tempFile) {
        if (tempFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            log.warn("Could not delete temporary baseline file {}", tempFile, e);
        }
    }
}
