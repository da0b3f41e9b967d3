package com.stylefixer.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumMap;
import java.util.Map;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Boots {@code java.util.logging} once for the fixer and hands out loggers.
 *
 * <p>A {@code /logging.properties} resource on the classpath wins; otherwise a console handler and
 * an appending {@code style-fixer.log} file handler are installed on the root logger.
 *
 * <p>Levels can be tuned per {@link Area}. The rewrite core logs one FINE record per fix and is
 * usually kept quieter than the engine, which logs one record per file.
 */
public class LoggerUtil {
    /**
     * Logger hierarchies of the fixer, each rooted at one package.
     */
    public enum Area {
        ENGINE("com.stylefixer.core", Level.INFO),
        PLUGINS("com.stylefixer.plugins", Level.INFO),
        REWRITE("com.stylefixer.rewrite", Level.WARNING),
        CONFIG("com.stylefixer.config", Level.INFO);

        private final String packageName;
        private final Level defaultLevel;

        Area(String packageName, Level defaultLevel) {
            this.packageName = packageName;
            this.defaultLevel = defaultLevel;
        }

        public String getPackageName() {
            return packageName;
        }

        public Level getDefaultLevel() {
            return defaultLevel;
        }
    }

    // Held strongly so levels set on package loggers are not lost to garbage collection
    private static final Map<Area, Logger> areaLoggers = new EnumMap<>(Area.class);

    private static final Logger rootLogger = Logger.getLogger("");
    private static final String DEFAULT_LOG_CONFIG = "/logging.properties";
    private static boolean initialized = false;
    private static Level consoleLevel = Level.INFO;
    private static Path logFilePath = Paths.get("style-fixer.log");

    /**
     * Initializes logging from the classpath configuration or the built-in handlers.
     */
    public static synchronized void initialize() {
        if (initialized) {
            return;
        }

        try {
            try (InputStream is = LoggerUtil.class.getResourceAsStream(DEFAULT_LOG_CONFIG)) {
                if (is != null) {
                    LogManager.getLogManager().readConfiguration(is);
                    initialized = true;
                    return;
                }
            }

            configureBasicLogging();
            initialized = true;
        } catch (IOException | SecurityException e) {
            System.err.println("Failed to initialize logging: " + e.getMessage());
        }
    }

    private static void configureBasicLogging() throws IOException {
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(consoleLevel);
        consoleHandler.setFormatter(new SimpleFormatter());

        FileHandler fileHandler = new FileHandler(logFilePath.toString(), true);
        fileHandler.setLevel(Level.ALL);
        fileHandler.setFormatter(new SimpleFormatter());

        rootLogger.addHandler(consoleHandler);
        rootLogger.addHandler(fileHandler);
        rootLogger.setLevel(Level.ALL);

        for (Area area : Area.values()) {
            _areaLogger(area).setLevel(area.getDefaultLevel());
        }
    }

    /**
     * Sets the level of every logger below {@code area}'s package.
     */
    public static synchronized void setLevel(Area area, Level level) {
        if (!initialized) {
            initialize();
        }
        _areaLogger(area).setLevel(level);
    }

    /**
     * Effective level of {@code area}: its own level or the nearest configured ancestor's.
     */
    public static synchronized Level getLevel(Area area) {
        if (!initialized) {
            initialize();
        }
        for (Logger logger = _areaLogger(area); logger != null; logger = logger.getParent()) {
            if (logger.getLevel() != null) {
                return logger.getLevel();
            }
        }
        return Level.INFO;
    }

    private static Logger _areaLogger(Area area) {
        return areaLoggers.computeIfAbsent(area, a -> Logger.getLogger(a.getPackageName()));
    }

    /**
     * Sets the level of every console handler, now and after initialization.
     */
    public static synchronized void setConsoleLevel(Level level) {
        consoleLevel = level;

        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
    }

    /**
     * Redirects file logging; takes effect immediately when logging is already running.
     */
    public static synchronized void setLogFilePath(Path path) {
        logFilePath = path;

        if (initialized) {
            try {
                for (Handler handler : rootLogger.getHandlers()) {
                    if (handler instanceof FileHandler) {
                        rootLogger.removeHandler(handler);
                        handler.close();
                    }
                }

                FileHandler fileHandler = new FileHandler(logFilePath.toString(), true);
                fileHandler.setLevel(Level.ALL);
                fileHandler.setFormatter(new SimpleFormatter());
                rootLogger.addHandler(fileHandler);
            } catch (IOException e) {
                Logger.getLogger(LoggerUtil.class.getName()).log(
                        Level.SEVERE, "Failed to update log file path", e);
            }
        }
    }

    public static Logger getLogger(Class<?> clazz) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(clazz.getName());
    }

    /**
     * Closes all root handlers, flushing the log file.
     */
    public static void shutdown() {
        for (Handler handler : rootLogger.getHandlers()) {
            handler.close();
        }
    }
}
