package com.sysmuse.logik.util;

import com.sysmuse.logik.LogikConfig;

import java.io.IOException;
import java.util.logging.*;

/**
 * Centralized logging for the Logik engine.
 * Thin wrapper around java.util.logging with a simpler interface.
 */
public class LoggingUtil {

    private static final Logger logger = Logger.getLogger("com.sysmuse.logik");
    private static boolean initialized = false;
    private static Level currentLevel = Level.INFO;
    private static String logFileName = null;

    // Flushes after every record so CLI output and log lines interleave correctly
    private static class StdErrHandler extends StreamHandler {
        public StdErrHandler(Level level) {
            super(System.err, new SimpleFormatter());
            setLevel(level);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            super.publish(record);
            flush();
        }
    }

    /**
     * Initialize (or re-initialize) logging from a Logik configuration.
     */
    public static synchronized void initialize(LogikConfig config) {
        configure(config.getLoggingLevel(),
                config.isConsoleLoggingEnabled(),
                config.isFileLoggingEnabled(),
                config.getLogFileName());
    }

    /**
     * Initialize with explicit settings.
     */
    public static synchronized void initialize(String levelStr, boolean consoleEnabled, boolean fileEnabled, String fileName) {
        configure(levelStr, consoleEnabled, fileEnabled, fileName);
    }

    private static void configure(String levelStr, boolean consoleEnabled, boolean fileEnabled, String fileName) {
        currentLevel = parseLevel(levelStr);
        clearHandlers();

        if (consoleEnabled) {
            logger.addHandler(new StdErrHandler(currentLevel));
        }

        logFileName = null;
        if (fileEnabled && fileName != null && !fileName.isEmpty()) {
            try {
                FileHandler fileHandler = new FileHandler(fileName);
                fileHandler.setFormatter(new SimpleFormatter());
                fileHandler.setLevel(currentLevel);
                logger.addHandler(fileHandler);
                logFileName = fileName;
            } catch (IOException e) {
                logger.log(Level.SEVERE, "Failed to create log file: " + fileName, e);
            }
        }

        logger.setLevel(currentLevel);
        logger.setUseParentHandlers(false);
        initialized = true;

        logger.fine("Logging initialized: level=" + currentLevel +
                ", console=" + consoleEnabled +
                ", file=" + (logFileName != null ? logFileName : "disabled"));
    }

    static Level parseLevel(String levelStr) {
        if (levelStr == null) {
            return Level.INFO;
        }
        switch (levelStr.trim().toUpperCase()) {
            case "OFF": return Level.OFF;
            case "SEVERE":
            case "ERROR": return Level.SEVERE;
            case "WARNING":
            case "WARN": return Level.WARNING;
            case "DEBUG": return Level.FINE;
            case "TRACE": return Level.FINEST;
            default: return Level.INFO;
        }
    }

    private static void clearHandlers() {
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
            handler.close();
        }
    }

    public static void debug(String message) {
        ensureInitialized();
        logger.fine(message);
    }

    public static void info(String message) {
        ensureInitialized();
        logger.info(message);
    }

    public static void warn(String message) {
        ensureInitialized();
        logger.warning(message);
    }

    public static void warn(String message, Throwable t) {
        ensureInitialized();
        logger.log(Level.WARNING, message, t);
    }

    public static void error(String message) {
        ensureInitialized();
        logger.severe(message);
    }

    public static void error(String message, Throwable t) {
        ensureInitialized();
        logger.log(Level.SEVERE, message, t);
    }

    public static boolean isDebugEnabled() {
        ensureInitialized();
        return currentLevel.intValue() <= Level.FINE.intValue();
    }

    public static Level getLevel() {
        ensureInitialized();
        return currentLevel;
    }

    private static synchronized void ensureInitialized() {
        if (!initialized) {
            configure("INFO", true, false, null);
        }
    }
}
