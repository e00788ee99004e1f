package org.logkeeper.node.processes;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.logkeeper.ingest.IngestionPipeline;
import org.logkeeper.ingest.PipelineSettings;
import org.logkeeper.ingest.api.source.HistoryPage;
import org.logkeeper.ingest.api.source.IEventSourceConnector;
import org.logkeeper.ingest.api.source.IHistorySource;
import org.logkeeper.ingest.api.storage.ICheckpointStore;
import org.logkeeper.ingest.api.storage.IEventStore;
import org.logkeeper.ingest.resources.database.H2Database;
import org.logkeeper.ingest.resources.memory.InMemoryCheckpointStore;
import org.logkeeper.ingest.resources.memory.InMemoryEventStore;
import org.logkeeper.node.spi.IServiceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the storage, the optional source connector and the {@link IngestionPipeline}, and
 * exposes the pipeline to dependent processes.
 *
 * <pre>
 * options {
 *   storage { type = "h2", jdbcUrl = "jdbc:h2:./data/logkeeper" }   # or type = "memory"
 *   connector { className = "com.example.MyConnector", options { ... } }   # optional
 *   pipeline = ${pipeline}
 * }
 * </pre>
 * Without a connector the pipeline only receives events through its sink and backfill runs
 * see an empty history.
 */
public class IngestionProcess extends AbstractProcess implements IServiceProvider {
    private static final Logger LOGGER = LoggerFactory.getLogger(IngestionProcess.class);

    private final H2Database database;
    private final IEventSourceConnector connector;
    private final IngestionPipeline pipeline;

    public IngestionProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options);

        final PipelineSettings settings = PipelineSettings.fromConfig(
            options.hasPath("pipeline") ? options.getConfig("pipeline") : ConfigFactory.empty());
        this.connector = options.hasPath("connector.className") ? createConnector(options.getConfig("connector")) : null;
        final IHistorySource historySource = connector != null
            ? connector
            : (scopeId, afterId, limit) -> HistoryPage.last(List.of());

        final String storageType = options.hasPath("storage.type")
            ? options.getString("storage.type").toLowerCase(Locale.ROOT)
            : "h2";
        final IEventStore eventStore;
        final ICheckpointStore checkpointStore;
        switch (storageType) {
            case "h2" -> {
                this.database = new H2Database("h2-database", options.getConfig("storage"));
                eventStore = database;
                checkpointStore = database;
            }
            case "memory" -> {
                this.database = null;
                eventStore = new InMemoryEventStore();
                checkpointStore = new InMemoryCheckpointStore();
            }
            default -> throw new IllegalArgumentException("Unknown storage.type '" + storageType + "', expected h2 or memory");
        }

        this.pipeline = new IngestionPipeline(settings, eventStore, checkpointStore, historySource);
        LOGGER.debug("IngestionProcess '{}' initialized with {} storage, connector: {}",
            processName, storageType, connector != null ? connector.getClass().getSimpleName() : "none");
    }

    @Override
    public void start() {
        pipeline.start();
        if (connector != null) {
            connector.connect(pipeline);
            LOGGER.info("Connector {} connected", connector.getClass().getSimpleName());
        }
        LOGGER.info("Ingestion pipeline started");
    }

    @Override
    public void stop() {
        if (connector != null) {
            try {
                connector.disconnect();
            } catch (final RuntimeException e) {
                LOGGER.warn("Connector {} failed to disconnect: {}", connector.getClass().getSimpleName(), e.getMessage());
            }
        }
        pipeline.stop();
        if (database != null) {
            database.close();
        }
        LOGGER.info("Ingestion pipeline stopped");
    }

    @Override
    public Object getExposedService() {
        return pipeline;
    }

    public IngestionPipeline getPipeline() {
        return pipeline;
    }

    private static IEventSourceConnector createConnector(final Config connectorConfig) {
        final String className = connectorConfig.getString("className");
        final Config connectorOptions = connectorConfig.hasPath("options")
            ? connectorConfig.getConfig("options")
            : ConfigFactory.empty();
        try {
            final Class<?> connectorClass = Class.forName(className);
            if (!IEventSourceConnector.class.isAssignableFrom(connectorClass)) {
                throw new IllegalArgumentException("Class " + className + " does not implement IEventSourceConnector.");
            }
            return (IEventSourceConnector) connectorClass.getConstructor(Config.class).newInstance(connectorOptions);
        } catch (final InvocationTargetException e) {
            final Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalStateException("Connector " + className + " failed to initialize: " + cause.getMessage(), cause);
        } catch (final ReflectiveOperationException e) {
            throw new IllegalArgumentException("Cannot instantiate connector " + className + ": " + e.getMessage(), e);
        }
    }
}
