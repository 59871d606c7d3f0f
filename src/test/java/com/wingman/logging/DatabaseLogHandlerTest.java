package com.wingman.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatabaseLogHandlerTest {

    private static final String JDBC_URL = "jdbc:h2:mem:analyzer-logs;MODE=PostgreSQL;DATABASE_TO_UPPER=false;DB_CLOSE_DELAY=-1";
    private static final String JDBC_USER = "sa";
    private static final String JDBC_PASS = "";

    @BeforeAll
    static void setUpDatabase() throws SQLException {
        try {
            Class.forName("org.h2.Driver");
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("H2 driver not found on classpath", e);
        }
        try (Connection connection = DriverManager.getConnection(JDBC_URL, JDBC_USER, JDBC_PASS);
             Statement statement = connection.createStatement()) {
            statement.execute("DROP TABLE IF EXISTS analyzer_logs");
            statement.execute("""
                CREATE TABLE analyzer_logs (
                    logged_at   TIMESTAMP NOT NULL,
                    level       VARCHAR(16) NOT NULL,
                    logger      VARCHAR(128),
                    message     TEXT,
                    thread_name VARCHAR(64),
                    host        VARCHAR(128),
                    thrown_type VARCHAR(256),
                    thrown_msg  TEXT
                )
                """);
        }
    }

    @AfterEach
    void clearTable() throws SQLException {
        try (Connection connection = DriverManager.getConnection(JDBC_URL, JDBC_USER, JDBC_PASS);
             Statement statement = connection.createStatement()) {
            statement.executeUpdate("DELETE FROM analyzer_logs");
        }
    }

    @Test
    void publishPersistsFormattedRecord() throws Exception {
        DatabaseLogHandler handler = new DatabaseLogHandler(
            new DatabaseLogHandler.SinkConfig(JDBC_URL, JDBC_USER, JDBC_PASS, 2));
        boolean closed = false;
        try {
            LogRecord record = new LogRecord(Level.WARNING, "Skipping {0}: {1}");
            record.setLoggerName("com.wingman.CampaignAnalyzer");
            record.setParameters(new Object[]{"CampaignLog.json", "unexpected end"});
            record.setThrown(new IllegalStateException("boom"));

            handler.publish(record);

            handler.close();
            closed = true;

            try (Connection connection = DriverManager.getConnection(JDBC_URL, JDBC_USER, JDBC_PASS);
                 PreparedStatement statement = connection.prepareStatement(
                     "SELECT level, logger, message, thrown_type, thrown_msg FROM analyzer_logs")) {
                ResultSet resultSet = statement.executeQuery();
                assertTrue(resultSet.next(), "No log record persisted");
                assertEquals("WARNING", resultSet.getString("level"));
                assertEquals("com.wingman.CampaignAnalyzer", resultSet.getString("logger"));
                assertEquals("Skipping CampaignLog.json: unexpected end", resultSet.getString("message"));
                assertEquals(IllegalStateException.class.getName(), resultSet.getString("thrown_type"));
                assertEquals("boom", resultSet.getString("thrown_msg"));
                assertFalse(resultSet.next(), "Exactly one row expected");
            }
        } finally {
            if (!closed) {
                handler.close();
            }
        }
    }

    @Test
    void missingUrlDisablesTheSink() {
        assertThrows(IllegalStateException.class,
            () -> new DatabaseLogHandler(new DatabaseLogHandler.SinkConfig(" ", null, null, 1)));
    }
}
