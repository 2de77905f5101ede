package org.qthought.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the {@code logging} section of the configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   format = "PLAIN"        # "PLAIN" prints bare messages, "DETAILED" adds time, thread and logger
 *   default-level = "INFO"
 *   levels {
 *     "org.qthought.runtime.inference" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    static final String FORMAT_PROPERTY = "qthought.logging.format";
    static final String DETAILED_APPENDER = "STDOUT";
    static final String PLAIN_APPENDER = "STDOUT_PLAIN";
    private static final String DETAILED_PATTERN = "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";
    private static final String PLAIN_PATTERN = "%msg%n";
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String FORMAT_KEY = "format";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
        // static only
    }

    /**
     * Configures logging once; later calls have no effect until {@link #reset()}.
     *
     * @param config the application configuration.
     */
    public static synchronized void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }
        loggingConfigured = true;

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }

        final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext)) {
            LOGGER.warn("Logging backend is not Logback, ignoring logging configuration.");
            return;
        }
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        configureFormat(loggingConfig, context);
        configureDefaultLevel(loggingConfig, context);
        configureSpecificLevels(loggingConfig, context);
        LOGGER.debug("Logging configuration applied.");
    }

    private static void configureFormat(final Config loggingConfig, final LoggerContext context) {
        final String format = loggingConfig.hasPath(FORMAT_KEY) ? loggingConfig.getString(FORMAT_KEY) : "PLAIN";
        final String appender = "DETAILED".equalsIgnoreCase(format) ? DETAILED_APPENDER : PLAIN_APPENDER;
        context.putProperty(FORMAT_PROPERTY, appender);
        System.setProperty(FORMAT_PROPERTY, appender);
        switchConsoleAppender(context, appender);
        LOGGER.debug("Configured logging format: {}", appender);
    }

    /**
     * logback.xml resolves the format property once, when the context starts, so the root logger's
     * console appender is swapped here. Roots without either console appender are left alone.
     */
    private static void switchConsoleAppender(final LoggerContext context, final String appenderName) {
        final Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root.getAppender(appenderName) != null) {
            return;
        }
        final String otherName = DETAILED_APPENDER.equals(appenderName) ? PLAIN_APPENDER : DETAILED_APPENDER;
        final Appender<ILoggingEvent> replaced = root.getAppender(otherName);
        if (replaced == null) {
            LOGGER.debug("Root logger has no console appender, keeping its appenders.");
            return;
        }

        final PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(DETAILED_APPENDER.equals(appenderName) ? DETAILED_PATTERN : PLAIN_PATTERN);
        encoder.start();

        final ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(appenderName);
        appender.setEncoder(encoder);
        appender.start();

        root.addAppender(appender);
        root.detachAppender(replaced);
        replaced.stop();
    }

    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.INFO);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }
    }

    private static void configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            return;
        }
        int configuredCount = 0;
        for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = String.valueOf(entry.getValue().unwrapped());
            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown level '{}' for logger '{}'", levelName, loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
            configuredCount++;
        }
        LOGGER.debug("Configured {} specific logger levels.", configuredCount);
    }

    /**
     * Resets the configured flag. Intended for tests.
     */
    public static synchronized void reset() {
        loggingConfigured = false;
    }
}
