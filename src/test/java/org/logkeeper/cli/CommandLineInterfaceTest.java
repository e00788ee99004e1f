package org.logkeeper.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.logkeeper.node.config.LoggingConfigurator;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the CLI subcommands in-process and checks exit codes and output.
 */
@Tag("integration")
class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    private Path writeConfig(String content) throws IOException {
        Path file = tempDir.resolve("logkeeper.conf");
        // logging = null keeps the test logging setup in place
        Files.writeString(file, "logging = null\n" + content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    @DisplayName("config-check should print the effective settings of a valid configuration")
    void configCheck_validConfig_returnsZero() throws IOException {
        Path config = writeConfig("pipeline.batch.size = 25\n");

        int exitCode = commandLine.execute("--config", config.toString(), "config-check");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Configuration OK").contains("size=25");
    }

    @Test
    @DisplayName("config-check should reject out-of-range values with exit code 2")
    void configCheck_invalidConfig_returnsTwo() throws IOException {
        Path config = writeConfig("pipeline.queues.backfill-share = 2.0\n");

        int exitCode = commandLine.execute("--config", config.toString(), "config-check");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Invalid configuration").contains("backfill-share");
        assertThat(out.toString()).doesNotContain("Configuration OK");
    }

    @Test
    @DisplayName("A missing --config file should be a usage error")
    void missingConfigFile_isUsageError() {
        int exitCode = commandLine.execute("--config", tempDir.resolve("absent.conf").toString(), "config-check");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("was not found");
    }

    @Test
    @DisplayName("db-stats should print row counts and checkpoints of the database")
    void dbStats_printsCounts() {
        String jdbcUrl = "jdbc:h2:mem:cli-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";

        int exitCode = commandLine.execute("db-stats", "--jdbc-url", jdbcUrl);

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("message")
            .contains("action")
            .contains("0 rows")
            .contains("Checkpoints (0):");
    }
}
