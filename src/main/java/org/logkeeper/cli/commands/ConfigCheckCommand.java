package org.logkeeper.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.logkeeper.cli.CommandLineInterface;
import org.logkeeper.ingest.PipelineSettings;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
    name = "config-check",
    description = "Validates the pipeline configuration and prints the effective settings."
)
public class ConfigCheckCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final Config config = parent.getConfig(spec.commandLine());
        final PipelineSettings settings;
        try {
            settings = PipelineSettings.fromConfig(config.hasPath("pipeline") ? config.getConfig("pipeline") : ConfigFactory.empty());
        } catch (final IllegalArgumentException e) {
            spec.commandLine().getErr().println("Invalid configuration: " + e.getMessage());
            return 2;
        }

        final PrintWriter out = spec.commandLine().getOut();
        out.println("Configuration OK");
        out.println("  queues:     " + settings.queues());
        out.println("  batch:      " + settings.batch());
        out.println("  retry:      " + settings.retry());
        out.println("  backfill:   " + settings.backfill());
        out.println("  dedup:      " + settings.dedup());
        out.println("  filter:     " + settings.filter());
        out.println("  validation: maxContentLength=" + settings.maxContentLength());
        out.flush();
        return 0;
    }
}
