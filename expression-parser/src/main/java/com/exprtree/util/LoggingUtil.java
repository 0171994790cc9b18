package com.exprtree.util;

import java.io.IOException;
import java.util.logging.*;

/**
 * Central logging for the expression parser.
 * Thin static wrapper around a java.util.logging logger with console and file output.
 */
public class LoggingUtil {

    private static final Logger logger = Logger.getLogger("com.exprtree");
    private static boolean initialized = false;
    private static Level currentLevel = Level.INFO;
    private static boolean fileLogging = false;
    private static String logFileName = ParserConfig.DEFAULT_LOG_FILE;

    private static class FlushingStreamHandler extends StreamHandler {
        FlushingStreamHandler(java.io.PrintStream stream, Level level) {
            super(stream, new SimpleFormatter());
            setLevel(level);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            super.publish(record);
            flush();
        }
    }

    /**
     * Initialize logging from the parser configuration.
     */
    public static synchronized void initialize(ParserConfig config) {
        initialize(config.getLoggingLevel(), config.isConsoleLoggingEnabled(),
                config.isFileLoggingEnabled(), config.getLogFileName());
    }

    public static synchronized void initialize(String levelStr, boolean consoleEnabled,
                                               boolean fileEnabled, String fileName) {
        if (initialized) {
            return;
        }

        currentLevel = parseLevel(levelStr);
        clearHandlers();

        if (consoleEnabled) {
            setupConsoleHandlers();
        }

        if (fileEnabled && fileName != null && !fileName.isEmpty()) {
            try {
                FileHandler fileHandler = new FileHandler(fileName);
                fileHandler.setFormatter(new SimpleFormatter());
                fileHandler.setLevel(currentLevel);
                logger.addHandler(fileHandler);
                fileLogging = true;
                logFileName = fileName;
            } catch (IOException e) {
                fileLogging = false;
                logger.log(Level.SEVERE, "Failed to create log file: " + fileName, e);
            }
        }

        logger.setLevel(currentLevel);
        logger.setUseParentHandlers(false);
        initialized = true;

        logger.fine("Logging initialized: level=" + currentLevel +
                ", console=" + consoleEnabled +
                ", file=" + (fileLogging ? logFileName : "disabled"));
    }

    /**
     * Drop all handlers so the next call to initialize starts over.
     */
    public static synchronized void reset() {
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
            handler.close();
        }
        fileLogging = false;
        initialized = false;
    }

    static Level parseLevel(String levelStr) {
        if (levelStr == null) return Level.INFO;
        switch (levelStr.toUpperCase()) {
            case "SEVERE": return Level.SEVERE;
            case "WARNING": return Level.WARNING;
            case "DEBUG": return Level.FINE;
            case "TRACE": return Level.FINEST;
            default: return Level.INFO;
        }
    }

    private static void clearHandlers() {
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
        }
    }

    /**
     * SEVERE records go to stderr only; everything below SEVERE goes to stdout.
     */
    private static void setupConsoleHandlers() {
        FlushingStreamHandler outHandler = new FlushingStreamHandler(System.out, currentLevel);
        outHandler.setFilter(record -> record.getLevel().intValue() < Level.SEVERE.intValue());
        logger.addHandler(outHandler);
        logger.addHandler(new FlushingStreamHandler(System.err, Level.SEVERE));
    }

    static Handler[] handlers() {
        return logger.getHandlers();
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

    public static void error(String message, Throwable t) {
        ensureInitialized();
        logger.log(Level.SEVERE, message, t);
    }

    public static boolean isDebugEnabled() {
        return currentLevel.intValue() <= Level.FINE.intValue();
    }

    public static Level getLevel() {
        return currentLevel;
    }

    private static void ensureInitialized() {
        if (!initialized) {
            initialize("INFO", true, false, ParserConfig.DEFAULT_LOG_FILE);
        }
    }
}
