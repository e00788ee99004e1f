package org.logkeeper.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.logkeeper.cli.CommandLineInterface;
import org.logkeeper.ingest.api.errors.StorageException;
import org.logkeeper.ingest.api.events.EventKind;
import org.logkeeper.ingest.api.storage.Checkpoint;
import org.logkeeper.ingest.resources.database.H2Database;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "db-stats",
    description = "Prints row counts and checkpoints of the H2 database."
)
public class DbStatsCommand implements Callable<Integer> {

    static final String STORAGE_PATH = "node.processes.ingestion.options.storage";

    @Option(
        names = {"--jdbc-url"},
        description = "JDBC URL of the database (default: the ingestion storage from the configuration)"
    )
    private String jdbcUrl;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final Config storageConfig = resolveStorageConfig();

        try (H2Database database = new H2Database("db-stats", storageConfig)) {
            for (final EventKind kind : EventKind.values()) {
                out.printf("%-8s %d rows%n", kind.name().toLowerCase(), database.count(kind));
            }
            final List<Checkpoint> checkpoints = database.listAll();
            out.printf("%nCheckpoints (%d):%n", checkpoints.size());
            for (final Checkpoint cp : checkpoints) {
                out.printf("  %-24s %-8s last=%s at=%s total=%d backfill=%s owner=%s completed=%s%n",
                    cp.scopeId(), cp.kind(), cp.lastProcessedId(), cp.lastProcessedAt(), cp.totalProcessed(),
                    cp.backfillInProgress() ? "IN_PROGRESS" : "-", cp.backfillOwner(), cp.lastBackfillCompletedAt());
            }
            out.flush();
            return 0;
        } catch (final StorageException e) {
            spec.commandLine().getErr().println("Failed to read database statistics: " + e.getMessage());
            return 1;
        }
    }

    private Config resolveStorageConfig() {
        if (jdbcUrl != null) {
            return ConfigFactory.parseMap(Map.of("jdbcUrl", jdbcUrl, "minIdle", 0, "maxPoolSize", 2));
        }
        final Config config = parent.getConfig(spec.commandLine());
        if (!config.hasPath(STORAGE_PATH + ".jdbcUrl")) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "No H2 storage configured at '" + STORAGE_PATH + "'; use --jdbc-url.");
        }
        return config.getConfig(STORAGE_PATH);
    }
}
