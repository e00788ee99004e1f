package org.logkeeper.node.processes.http;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import io.javalin.Javalin;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.logkeeper.ingest.IngestionPipeline;
import org.logkeeper.node.processes.AbstractProcess;
import org.logkeeper.node.spi.IController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs a Javalin HTTP server whose routes come from the {@code routes} block of the options.
 * Nested keys form the URL path; a {@code "$controller"} object at a path mounts the named
 * {@link IController} there:
 * <pre>
 * routes {
 *   api {
 *     pipeline {
 *       "$controller" { className = "org.logkeeper.node.processes.http.api.pipeline.PipelineController" }
 *     }
 *   }
 * }
 * </pre>
 * Requires the {@code pipeline} dependency. Controllers are created with the pipeline and their options.
 */
public class HttpServerProcess extends AbstractProcess {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpServerProcess.class);

    private static final String ROUTES_CONFIG_KEY = "routes";
    private static final String CONTROLLER_ACTION_KEY = "$controller";

    private final IngestionPipeline pipeline;
    private final List<ControllerRoute> controllerRoutes = new ArrayList<>();
    private Javalin app;

    public HttpServerProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options);
        this.pipeline = getDependency("pipeline", IngestionPipeline.class);
        parseRoutes();
        LOGGER.debug("HttpServerProcess '{}' initialized with {} controller route(s).", processName, controllerRoutes.size());
    }

    @Override
    public void start() {
        if (app != null) {
            LOGGER.warn("HTTP server is already running.");
            return;
        }

        final String host = options.hasPath("network.host") ? options.getString("network.host") : "0.0.0.0";
        final int port = options.hasPath("network.port") ? options.getInt("network.port") : 8080;

        app = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.requestLogger.http((ctx, ms) -> {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Request: {} {} (completed in {} ms)", ctx.method(), ctx.path(), ms);
                }
            });

            final int minThreads = options.hasPath("network.threadPool.minThreads")
                ? options.getInt("network.threadPool.minThreads")
                : 4;
            final int maxThreads = options.hasPath("network.threadPool.maxThreads")
                ? options.getInt("network.threadPool.maxThreads")
                : 32;
            final int idleTimeout = options.hasPath("network.threadPool.idleTimeoutMs")
                ? options.getInt("network.threadPool.idleTimeoutMs")
                : 60000;
            final QueuedThreadPool threadPool = new QueuedThreadPool(maxThreads, minThreads, idleTimeout);
            threadPool.setName(processName);
            config.jetty.threadPool = threadPool;
        });

        for (final ControllerRoute route : controllerRoutes) {
            createController(route).registerRoutes(app, route.basePath());
            LOGGER.debug("Registered controller '{}' at base path '{}'", route.className(), route.basePath());
        }

        app.start(host, port);
        LOGGER.info("HTTP server started on {}:{}", host, port);
    }

    @Override
    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
            LOGGER.info("HTTP server stopped.");
        }
    }

    /**
     * @return The port the server listens on, or -1 when it is not running.
     */
    public int getPort() {
        return app != null ? app.port() : -1;
    }

    private void parseRoutes() {
        if (!options.hasPath(ROUTES_CONFIG_KEY)) {
            LOGGER.warn("No '{}' block found in the configuration of '{}'. No routes will be served.", ROUTES_CONFIG_KEY, processName);
            return;
        }
        parseConfigLevel(options.getConfig(ROUTES_CONFIG_KEY).root(), "/");
    }

    private void parseConfigLevel(final ConfigObject configObject, final String currentPath) {
        for (final Map.Entry<String, ConfigValue> entry : configObject.entrySet()) {
            final ConfigValue value = entry.getValue();
            if (value.valueType() != ConfigValueType.OBJECT) {
                LOGGER.warn("Ignoring non-object route entry '{}' at path '{}'", entry.getKey(), currentPath);
                continue;
            }
            if (entry.getKey().equals(CONTROLLER_ACTION_KEY)) {
                final Config controllerConfig = ((ConfigObject) value).toConfig();
                if (!controllerConfig.hasPath("className")) {
                    throw new IllegalArgumentException("'$controller' at path '" + currentPath + "' has no className.");
                }
                final Config controllerOptions = controllerConfig.hasPath("options")
                    ? controllerConfig.getConfig("options")
                    : ConfigFactory.empty();
                controllerRoutes.add(new ControllerRoute(currentPath, controllerConfig.getString("className"), controllerOptions));
            } else {
                parseConfigLevel((ConfigObject) value, (currentPath + entry.getKey() + "/").replaceAll("//", "/"));
            }
        }
    }

    private IController createController(final ControllerRoute route) {
        try {
            final Class<?> controllerClass = Class.forName(route.className());
            if (!IController.class.isAssignableFrom(controllerClass)) {
                throw new IllegalArgumentException("Class " + route.className() + " does not implement IController.");
            }
            return (IController) controllerClass.getConstructor(IngestionPipeline.class, Config.class)
                .newInstance(pipeline, route.options());
        } catch (final InvocationTargetException e) {
            final Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalStateException("Controller " + route.className() + " failed to initialize: " + cause.getMessage(), cause);
        } catch (final ReflectiveOperationException e) {
            throw new IllegalArgumentException("Cannot instantiate controller " + route.className() + ": " + e.getMessage(), e);
        }
    }

    private record ControllerRoute(String basePath, String className, Config options) {
    }
}
