package org.logkeeper.cli.commands;

import com.typesafe.config.Config;
import org.logkeeper.cli.CommandLineInterface;
import org.logkeeper.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Starts the ingestion node and runs until terminated."
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final Config config = parent.getConfig(spec.commandLine());
        LOGGER.info("Starting node in foreground...");

        final Node node = new Node(config);
        node.start();

        // The node's shutdown hook stops the processes on SIGTERM.
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            node.stop();
        }
        return 0;
    }
}
