package com.formatengine.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.*;

/**
 * Configures java.util.logging once for the whole application and hands out loggers.
 *
 * <p>{@code /logging.properties} on the classpath wins; without it a console handler and an
 * appending file handler are installed on the root logger.</p>
 */
public class LoggerUtil {
    private static final Logger rootLogger = Logger.getLogger("");
    private static final String DEFAULT_LOG_CONFIG = "/logging.properties";
    private static final Path FALLBACK_LOG_FILE = Paths.get("formatengine.log");
    private static boolean initialized = false;
    private static Level consoleLevel = Level.INFO;

    /**
     * Initializes the logging system. Later calls do nothing.
     */
    public static synchronized void initialize() {
        if (initialized) {
            return;
        }

        try (InputStream is = LoggerUtil.class.getResourceAsStream(DEFAULT_LOG_CONFIG)) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            } else {
                _installFallbackHandlers();
            }
            initialized = true;
        } catch (IOException e) {
            System.err.println("Failed to initialize logging: " + e.getMessage());
        }
    }

    private static void _installFallbackHandlers() throws IOException {
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(consoleLevel);
        consoleHandler.setFormatter(new SimpleFormatter());
        rootLogger.addHandler(consoleHandler);

        FileHandler fileHandler = new FileHandler(FALLBACK_LOG_FILE.toString(), true);
        fileHandler.setLevel(Level.ALL);
        fileHandler.setFormatter(new SimpleFormatter());
        rootLogger.addHandler(fileHandler);

        rootLogger.setLevel(Level.ALL);
    }

    /**
     * Sets the level of console output, e.g. {@link Level#FINE} for {@code --verbose}.
     * The application loggers are opened up to the same level.
     */
    public static synchronized void setConsoleLevel(Level level) {
        consoleLevel = level;

        if (!initialized) {
            initialize();
        }
        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
        Logger applicationLogger = Logger.getLogger("com.formatengine");
        if (applicationLogger.getLevel() == null || applicationLogger.getLevel().intValue() > level.intValue()) {
            applicationLogger.setLevel(level);
        }
    }

    /**
     * Gets a logger for a specific class.
     */
    public static Logger getLogger(Class<?> clazz) {
        return getLogger(clazz.getName());
    }

    /**
     * Gets a logger for a specific name.
     */
    public static Logger getLogger(String name) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(name);
    }

    /**
     * Flushes and closes all handlers.
     */
    public static void shutdown() {
        for (Handler handler : rootLogger.getHandlers()) {
            handler.flush();
            handler.close();
        }
    }
}
