package org.logkeeper.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Loads the application configuration with this precedence (first wins):
 * <ol>
 *   <li>Environment variables prefixed {@code LOGKEEPER_}</li>
 *   <li>Java system properties ({@code -Dkey=value})</li>
 *   <li>The configuration file ({@code logkeeper.conf} in the working directory by default)</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Environment variable names map to paths like Typesafe Config's {@code CONFIG_FORCE_} overrides:
 * after the prefix, {@code _} becomes {@code .}, {@code __} becomes {@code -} and {@code ___}
 * becomes {@code _}; the path is lower-cased. {@code LOGKEEPER_PIPELINE_BATCH_FLUSH__INTERVAL__MS=500}
 * sets {@code pipeline.batch.flush-interval-ms}.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "logkeeper.conf";
    static final String ENV_PREFIX = "LOGKEEPER_";

    private ConfigLoader() {
    }

    /**
     * Loads the configuration using {@code logkeeper.conf} in the working directory, if present.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration using the given file, if it exists.
     *
     * @param configFile The configuration file.
     * @return The resolved configuration.
     */
    public static Config load(final File configFile) {
        final Config fileConfig;
        if (configFile != null && configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.info("Configuration file '{}' not found. Using defaults.", configFile != null ? configFile.getPath() : CONFIG_FILE_NAME);
            fileConfig = ConfigFactory.empty();
        }
        return load(System.getenv(), fileConfig);
    }

    static Config load(final Map<String, String> environment, final Config fileConfig) {
        final Config envConfig = environmentOverrides(environment);
        final Config cliConfig = ConfigFactory.systemProperties();
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        return envConfig
            .withFallback(cliConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }

    /**
     * Converts {@code LOGKEEPER_} environment variables into a configuration.
     */
    static Config environmentOverrides(final Map<String, String> environment) {
        final Map<String, Object> overrides = new HashMap<>();
        for (final Map.Entry<String, String> entry : environment.entrySet()) {
            if (!entry.getKey().startsWith(ENV_PREFIX) || entry.getKey().length() == ENV_PREFIX.length()) {
                continue;
            }
            final String path = entry.getKey().substring(ENV_PREFIX.length())
                .replace("___", "\u0000")
                .replace("__", "-")
                .replace('_', '.')
                .replace('\u0000', '_')
                .toLowerCase(Locale.ROOT);
            overrides.put(path, entry.getValue());
        }
        if (!overrides.isEmpty()) {
            LOG.debug("Applying {} environment override(s): {}", overrides.size(), overrides.keySet());
        }
        return ConfigFactory.parseMap(overrides, "environment variables");
    }
}
