package org.logkeeper.node.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Map;

/**
 * Applies the {@code logging} block of the configuration to Logback at runtime.
 *
 * <pre>
 * logging {
 *   format = "PLAIN"          # PLAIN or JSON, defaults to JSON
 *   default-level = "WARN"
 *   levels {
 *     "org.logkeeper.ingest" = "INFO"
 *   }
 * }
 * </pre>
 * The format selects the appender of {@code logback.xml} through the {@code logkeeper.logging.format}
 * property, so Logback is reloaded when the format is set.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    static final String FORMAT_PROPERTY = "logkeeper.logging.format";
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String FORMAT_KEY = "format";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
    }

    /**
     * Configures logging. Idempotent: later calls have no effect until {@link #reset()}.
     *
     * @param config The application configuration.
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
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        if (loggingConfig.hasPath(FORMAT_KEY)) {
            configureFormat(loggingConfig.getString(FORMAT_KEY), context);
        }
        configureDefaultLevel(loggingConfig, context);
        configureSpecificLevels(loggingConfig, context);
        LOGGER.debug("Logging configuration applied successfully.");
    }

    private static void configureFormat(final String format, final LoggerContext context) {
        final String appender = "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT";
        System.setProperty(FORMAT_PROPERTY, appender);
        final URL configUrl = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (configUrl != null) {
            try {
                final JoranConfigurator configurator = new JoranConfigurator();
                configurator.setContext(context);
                context.reset();
                configurator.doConfigure(configUrl);
            } catch (final JoranException e) {
                LOGGER.warn("Failed to reload Logback for format '{}': {}", format, e.getMessage());
            }
        }
        // reset() clears the context properties
        context.putProperty(FORMAT_PROPERTY, appender);
        LOGGER.debug("Configured logging format: {}", format);
    }

    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.WARN);
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
                LOGGER.warn("Ignoring unknown log level '{}' for logger '{}'", levelName, loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
            configuredCount++;
        }
        LOGGER.debug("Configured {} specific logger levels.", configuredCount);
    }

    /**
     * Allows {@link #configure(Config)} to run again. For tests.
     */
    public static synchronized void reset() {
        loggingConfigured = false;
    }
}
