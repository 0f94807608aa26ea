package com.detox.datashift.output;

import com.detox.datashift.config.MonitorConfig;
import com.detox.datashift.model.ShiftReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Appends every produced shift report to a SQLite history table.
 *
 * The table is an audit trail only; the monitor never reads it back to decide
 * anything, and a failed write does not change the report that was published.
 */
@Slf4j
@Component
public class ShiftReportSink {

    private final String databasePath;
    private final ObjectMapper objectMapper;
    private final AtomicLong writeCount = new AtomicLong(0);

    private Connection connection;
    private PreparedStatement insertStatement;

    public ShiftReportSink(@Value("${output.database.path:./data/shift_reports.db}") String databasePath) {
        this.databasePath = databasePath;
        this.objectMapper = MonitorConfig.createObjectMapper();
    }

    @PostConstruct
    public void initialize() throws SQLException {
        log.info("Initializing shift report history with database: {}", databasePath);

        File dbFile = new File(databasePath).getAbsoluteFile();
        dbFile.getParentFile().mkdirs();

        connection = DriverManager.getConnection("jdbc:sqlite:" + dbFile.getPath());
        connection.setAutoCommit(true);

        createTable();

        String insertSql = """
            INSERT INTO shift_reports
            (status, checked_at, lookback_minutes, text_length_change, language_distribution_change,
             request_volume_change, total_requests, message, json_data)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        insertStatement = connection.prepareStatement(insertSql);

        log.info("Shift report history initialized successfully");
    }

    private void createTable() throws SQLException {
        String createTableSql = """
            CREATE TABLE IF NOT EXISTS shift_reports (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                status TEXT NOT NULL,
                checked_at TEXT NOT NULL,
                lookback_minutes INTEGER NOT NULL,
                text_length_change REAL NOT NULL,
                language_distribution_change REAL NOT NULL,
                request_volume_change REAL NOT NULL,
                total_requests INTEGER NOT NULL,
                message TEXT,
                json_data TEXT NOT NULL,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """;

        try (Statement stmt = connection.createStatement()) {
            stmt.execute(createTableSql);
            log.info("Table 'shift_reports' created or already exists");
        }
    }

    /**
     * Append a report to the history table.
     *
     * @param report the report to persist
     */
    public synchronized void write(ShiftReport report) {
        try {
            String jsonData = objectMapper.writeValueAsString(report);

            insertStatement.setString(1, report.status().wireName());
            insertStatement.setString(2, report.timestamp().toString());
            insertStatement.setLong(3, report.lookbackMinutes());
            insertStatement.setDouble(4, report.textLengthChangePct());
            insertStatement.setDouble(5, report.languageDistributionChangeScore());
            insertStatement.setDouble(6, report.requestVolumeChangePct());
            insertStatement.setLong(7, report.totalRequests());
            insertStatement.setString(8, report.message());
            insertStatement.setString(9, jsonData);

            insertStatement.executeUpdate();
            long count = writeCount.incrementAndGet();

            log.debug("Written shift report {} at {} (total writes: {})",
                    report.status().wireName(), report.timestamp(), count);

        } catch (Exception e) {
            log.error("Failed to write shift report from {}", report.timestamp(), e);
            throw new RuntimeException("Shift report history write failed", e);
        }
    }

    /**
     * Most recent reports first.
     */
    public synchronized List<ReportSummary> recent(int limit) {
        String sql = """
            SELECT id, status, checked_at, text_length_change, language_distribution_change,
                   request_volume_change, total_requests, message
            FROM shift_reports
            ORDER BY id DESC
            LIMIT ?
            """;

        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setInt(1, limit);
            List<ReportSummary> summaries = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    summaries.add(new ReportSummary(
                            rs.getLong("id"),
                            rs.getString("status"),
                            Instant.parse(rs.getString("checked_at")),
                            rs.getDouble("text_length_change"),
                            rs.getDouble("language_distribution_change"),
                            rs.getDouble("request_volume_change"),
                            rs.getLong("total_requests"),
                            rs.getString("message")
                    ));
                }
            }
            return summaries;

        } catch (SQLException e) {
            log.error("Failed to read shift report history", e);
            throw new RuntimeException("Shift report history read failed", e);
        }
    }

    public long getWriteCount() {
        return writeCount.get();
    }

    @PreDestroy
    public void close() {
        try {
            if (insertStatement != null) {
                insertStatement.close();
            }
            if (connection != null) {
                connection.close();
            }
            log.info("Shift report history closed (total writes: {})", writeCount.get());
        } catch (SQLException e) {
            log.error("Error closing shift report history", e);
        }
    }
}
