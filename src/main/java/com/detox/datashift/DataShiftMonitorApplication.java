package com.detox.datashift;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application for the Data Shift Monitor.
 *
 * Consumes detoxification inference logs from Kafka and periodically compares the
 * recent traffic against a stored baseline to detect distribution shift.
 */
@Slf4j
@SpringBootApplication
public class DataShiftMonitorApplication {

    public static void main(String[] args) {
        log.info("Starting Data Shift Monitor...");
        SpringApplication.run(DataShiftMonitorApplication.class, args);
        log.info("Data Shift Monitor started successfully");
    }
}
