package org.logkeeper.node.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LoggingConfiguratorTest {

    private LoggerContext context;

    @BeforeEach
    void setUp() {
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() throws JoranException {
        LoggingConfigurator.reset();
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
        // restore the test logging setup
        context.reset();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        configurator.doConfigure(getClass().getClassLoader().getResource("logback-test.xml"));
    }

    @Test
    @DisplayName("Should apply the default level and per-logger levels")
    void configure_shouldApplyLevels() {
        // Arrange
        Config config = ConfigFactory.parseString("""
            logging {
              default-level = "INFO"
              levels {
                "org.logkeeper.ingest.services" = "DEBUG"
                "com.zaxxer.hikari" = "ERROR"
              }
            }
            """);

        // Act
        LoggingConfigurator.configure(config);

        // Assert
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.INFO);
        assertThat(context.getLogger("org.logkeeper.ingest.services").getLevel()).isEqualTo(Level.DEBUG);
        assertThat(context.getLogger("com.zaxxer.hikari").getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    @DisplayName("Should ignore unknown level names")
    void configure_shouldIgnoreUnknownLevel() {
        // Arrange
        context.getLogger("org.logkeeper.node").setLevel(Level.WARN);
        Config config = ConfigFactory.parseString("logging.levels { \"org.logkeeper.node\" = \"LOUD\" }");

        // Act
        LoggingConfigurator.configure(config);

        // Assert
        assertThat(context.getLogger("org.logkeeper.node").getLevel()).isEqualTo(Level.WARN);
    }

    @Test
    @DisplayName("Should only apply the first configuration until reset")
    void configure_shouldBeIdempotentUntilReset() {
        // Arrange
        Config first = ConfigFactory.parseString("logging.levels { \"org.logkeeper.cli\" = \"INFO\" }");
        Config second = ConfigFactory.parseString("logging.levels { \"org.logkeeper.cli\" = \"TRACE\" }");

        // Act & Assert
        LoggingConfigurator.configure(first);
        LoggingConfigurator.configure(second);
        assertThat(context.getLogger("org.logkeeper.cli").getLevel()).isEqualTo(Level.INFO);

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(second);
        assertThat(context.getLogger("org.logkeeper.cli").getLevel()).isEqualTo(Level.TRACE);
    }

    @Test
    @DisplayName("PLAIN format should select the plain console appender")
    void configure_plainFormat_shouldSelectPlainAppender() {
        // Act
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.format = \"PLAIN\""));

        // Assert
        assertThat(context.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT_PLAIN");
        assertThat(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT_PLAIN");
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("STDOUT_PLAIN")).isNotNull();
    }

    @Test
    @DisplayName("JSON format should select the logstash console appender")
    void configure_jsonFormat_shouldSelectJsonAppender() {
        // Act
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.format = \"JSON\""));

        // Assert
        assertThat(context.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT");
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("STDOUT")).isNotNull();
    }
}
