package com.wingman.logging;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.text.MessageFormat;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * Ships JUL records in batches to a central PostgreSQL {@code analyzer_logs} table.
 * Construction fails with {@link IllegalStateException} when no JDBC url is configured,
 * which callers treat as "console logging only".
 */
public final class DatabaseLogHandler extends Handler {

    private static final String INSERT_SQL = """
        INSERT INTO analyzer_logs (
            logged_at,
            level,
            logger,
            message,
            thread_name,
            host,
            thrown_type,
            thrown_msg
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        """;
    private static final int MAX_BATCH = 64;

    private final BlockingQueue<LogRecord> queue = new LinkedBlockingQueue<>(2048);
    private final HikariDataSource dataSource;
    private final String hostName;
    private final Thread worker;

    private volatile boolean running = true;

    public DatabaseLogHandler() {
        this(SinkConfig.load());
    }

    DatabaseLogHandler(SinkConfig config) {
        if (!config.enabled()) {
            throw new IllegalStateException("no JDBC url configured for central logging");
        }
        this.dataSource = createDataSource(config);
        this.hostName = resolveHostName();
        this.worker = new Thread(this::drainLoop, "analyzer-log-writer");
        this.worker.setDaemon(true);
        this.worker.start();
        setLevel(Level.ALL);
    }

    private void drainLoop() {
        List<LogRecord> batch = new ArrayList<>(MAX_BATCH);
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                LogRecord first = queue.poll(1, TimeUnit.SECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                queue.drainTo(batch, MAX_BATCH - 1);
                writeBatch(batch);
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
            } catch (Exception ex) {
                System.err.println("DatabaseLogHandler failure: " + ex.getMessage());
            } finally {
                batch.clear();
            }
        }

        // flush what is left on shutdown
        queue.drainTo(batch);
        if (!batch.isEmpty()) {
            try {
                writeBatch(batch);
            } catch (Exception ex) {
                System.err.println("DatabaseLogHandler shutdown failure: " + ex.getMessage());
            }
        }
    }

    @Override
    public void publish(LogRecord record) {
        Objects.requireNonNull(record);
        if (!isLoggable(record) || !running) {
            return;
        }
        if (!queue.offer(record)) {
            queue.poll();
            queue.offer(record);
        }
    }

    @Override
    public void flush() {
        // records are persisted asynchronously
    }

    @Override
    public void close() throws SecurityException {
        running = false;
        worker.interrupt();
        try {
            worker.join(TimeUnit.SECONDS.toMillis(2));
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
        dataSource.close();
    }

    private void writeBatch(List<LogRecord> records) throws SQLException {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(INSERT_SQL)) {
            for (LogRecord record : records) {
                statement.setTimestamp(1, Timestamp.from(Instant.ofEpochMilli(record.getMillis())));
                statement.setString(2, record.getLevel().getName());
                statement.setString(3, record.getLoggerName());
                statement.setString(4, renderMessage(record));
                statement.setString(5, "thread-" + record.getLongThreadID());
                statement.setString(6, hostName);
                Throwable thrown = record.getThrown();
                statement.setString(7, thrown == null ? null : thrown.getClass().getName());
                statement.setString(8, thrown == null ? null : thrown.getMessage());
                statement.addBatch();
            }
            statement.executeBatch();
        }
    }

    private static String renderMessage(LogRecord record) {
        String message = record.getMessage();
        Object[] params = record.getParameters();
        if (message == null) {
            return "";
        }
        if (params == null || params.length == 0) {
            return message;
        }
        try {
            return MessageFormat.format(message, params);
        } catch (IllegalArgumentException ex) {
            return message;
        }
    }

    private static String resolveHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown-host";
        }
    }

    private static HikariDataSource createDataSource(SinkConfig config) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(config.url());
        hikariConfig.setUsername(config.username());
        hikariConfig.setPassword(config.password());
        hikariConfig.setMaximumPoolSize(config.poolSize());
        hikariConfig.setPoolName("AnalyzerLoggingPool");
        hikariConfig.setAutoCommit(true);
        hikariConfig.setInitializationFailTimeout(-1);
        return new HikariDataSource(hikariConfig);
    }

    record SinkConfig(String url, String username, String password, int poolSize) {

        boolean enabled() {
            return url != null && !url.isBlank();
        }

        static SinkConfig load() {
            Properties fileProps = loadFileProperties();
            String url = firstNonBlank(
                System.getProperty("logging.jdbc.url"),
                System.getenv("LOGGING_JDBC_URL"),
                fileProps.getProperty("jdbc.url")
            );
            String username = firstNonBlank(
                System.getProperty("logging.jdbc.user"),
                System.getenv("LOGGING_JDBC_USER"),
                fileProps.getProperty("jdbc.username")
            );
            String password = firstNonBlank(
                System.getProperty("logging.jdbc.pass"),
                System.getenv("LOGGING_JDBC_PASS"),
                fileProps.getProperty("jdbc.password")
            );
            int poolSize = parsePoolSize(firstNonBlank(
                System.getProperty("logging.jdbc.poolSize"),
                System.getenv("LOGGING_JDBC_POOL"),
                fileProps.getProperty("jdbc.poolSize")
            ));
            return new SinkConfig(url, username, password, poolSize);
        }

        private static Properties loadFileProperties() {
            Properties props = new Properties();
            try (InputStream stream = DatabaseLogHandler.class
                .getClassLoader()
                .getResourceAsStream("logging-db.properties")) {
                if (stream != null) {
                    props.load(stream);
                }
            } catch (IOException ignored) {
                // malformed property file: fall back to env and system properties
            }
            return props;
        }

        private static String firstNonBlank(String... values) {
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    return value.trim();
                }
            }
            return null;
        }

        private static int parsePoolSize(String raw) {
            try {
                return raw == null ? 2 : Math.max(1, Integer.parseInt(raw));
            } catch (NumberFormatException ex) {
                return 2;
            }
        }
    }
}
