package org.logkeeper.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.logkeeper.cli.commands.ConfigCheckCommand;
import org.logkeeper.cli.commands.DbStatsCommand;
import org.logkeeper.cli.commands.RunCommand;
import org.logkeeper.node.config.ConfigLoader;
import org.logkeeper.node.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "logkeeper",
    mixinStandardHelpOptions = true,
    version = "logkeeper 1.0",
    description = "logkeeper - chat message and moderation event ingestion",
    subcommands = {
        RunCommand.class,
        DbStatsCommand.class,
        ConfigCheckCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to the configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("logkeeper");
        System.exit(commandLine.execute(args));
    }

    /**
     * Loads the configuration on first use and applies its logging block.
     *
     * @throws CommandLine.ParameterException if the given file does not exist or cannot be parsed.
     */
    public Config getConfig(final CommandLine commandLine) {
        if (config != null) {
            return config;
        }
        if (configFile != null && !configFile.isFile()) {
            throw new CommandLine.ParameterException(commandLine,
                "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
        }
        try {
            config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
        } catch (final ConfigException e) {
            throw new CommandLine.ParameterException(commandLine, "Failed to load configuration: " + e.getMessage(), e, null, null);
        }
        LoggingConfigurator.configure(config);
        return config;
    }
}
