package com.wingman.logging;

import java.util.Locale;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Provides the shared logger configuration for the analyzer.
 */
public final class AppLogger {
    private static final Logger LOGGER = createLogger();

    private AppLogger() {
    }

    public static Logger get() {
        return LOGGER;
    }

    private static Logger createLogger() {
        Logger logger = Logger.getLogger("com.wingman.CampaignAnalyzer");
        logger.setUseParentHandlers(false);
        Formatter formatter = new Formatter() {
            @Override
            public String format(LogRecord record) {
                String message = formatMessage(record);
                if (record.getThrown() != null) {
                    message = message + " (" + record.getThrown() + ")";
                }
                return "%s %s%n".formatted(record.getLevel().getName(), message);
            }
        };

        StreamHandler consoleHandler = new StreamHandler(System.err, formatter) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        try {
            consoleHandler.setEncoding(UTF_8.name());
        } catch (Exception ignored) {
            // fall back to platform default when UTF-8 is unavailable
        }
        consoleHandler.setLevel(Level.ALL);
        logger.addHandler(consoleHandler);
        logger.setLevel(resolveLevel());

        try {
            DatabaseLogHandler dbHandler = new DatabaseLogHandler();
            dbHandler.setLevel(Level.INFO);
            logger.addHandler(dbHandler);
        } catch (IllegalStateException ex) {
            logger.fine("Central logging disabled: " + ex.getMessage());
        } catch (Exception ex) {
            logger.warning("Failed to initialize central logging: " + ex.getMessage());
        }
        return logger;
    }

    private static Level resolveLevel() {
        String configured = System.getProperty("wingman.logLevel");
        if (configured == null || configured.isBlank()) {
            return Level.INFO;
        }
        try {
            return Level.parse(configured.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return Level.INFO;
        }
    }
}
