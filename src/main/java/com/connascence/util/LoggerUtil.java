package com.connascence.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.*;

/**
 * Utility class for configuring and handing out loggers for the engine.
 * Configuration is read once from {@code /logging.properties} on the classpath.
 */
public class LoggerUtil {
    private static final Logger rootLogger = Logger.getLogger("");
    private static final String DEFAULT_LOG_CONFIG = "/logging.properties";
    private static boolean initialized = false;

    /**
     * Initializes the logging system, preferring the bundled properties file.
     */
    public static synchronized void initialize() {
        if (initialized) {
            return;
        }

        try (InputStream is = LoggerUtil.class.getResourceAsStream(DEFAULT_LOG_CONFIG)) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            } else {
                configureConsoleLogging();
            }
        } catch (IOException e) {
            configureConsoleLogging();
            Logger.getLogger(LoggerUtil.class.getName())
                    .log(Level.WARNING, "Failed to read " + DEFAULT_LOG_CONFIG + ", using console logging", e);
        }
        initialized = true;
    }

    /**
     * Sets up a single console handler on the root logger.
     */
    private static void configureConsoleLogging() {
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(Level.INFO);
        consoleHandler.setFormatter(new SimpleFormatter());

        rootLogger.addHandler(consoleHandler);
        rootLogger.setLevel(Level.INFO);
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
}
