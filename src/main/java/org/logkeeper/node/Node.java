package org.logkeeper.node;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import org.logkeeper.node.spi.IProcess;
import org.logkeeper.node.spi.IServiceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Hosts the configured processes of a logkeeper node and manages their lifecycle.
 *
 * <p>Processes are declared under {@code node.processes}. Each names its class, its options and,
 * in {@code require}, the processes whose exposed service it needs. Processes are instantiated
 * dependencies first, started in that order and stopped in reverse.</p>
 */
public final class Node {
    private static final Logger LOGGER = LoggerFactory.getLogger(Node.class);
    private static final String PROCESSES_CONFIG_PATH = "node.processes";

    private final Map<String, IProcess> managedProcesses = new LinkedHashMap<>();
    private Thread shutdownHook;
    private boolean stopped = false;

    /**
     * Constructs the Node and instantiates every configured process.
     *
     * @param config The fully resolved application configuration.
     * @throws IllegalStateException if a process cannot be created or the dependencies form a cycle.
     */
    public Node(final Config config) {
        initializeProcesses(config);
    }

    /**
     * Starts all processes and registers a shutdown hook. A process that fails to start stops the
     * processes started before it.
     *
     * @throws IllegalStateException if a process fails to start.
     */
    public void start() {
        if (managedProcesses.isEmpty()) {
            LOGGER.warn("No processes configured to start. The node will be idle.");
        }
        final List<String> started = new ArrayList<>();
        for (final Map.Entry<String, IProcess> entry : managedProcesses.entrySet()) {
            try {
                LOGGER.debug("Starting process '{}'...", entry.getKey());
                entry.getValue().start();
                started.add(entry.getKey());
            } catch (final RuntimeException e) {
                LOGGER.error("Failed to start process '{}': {}", entry.getKey(), e.getMessage());
                LOGGER.debug("Start failure of process '{}'", entry.getKey(), e);
                Collections.reverse(started);
                stopAll(started);
                throw new IllegalStateException("Process '" + entry.getKey() + "' failed to start", e);
            }
        }

        shutdownHook = new Thread(this::stop, "shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        LOGGER.info("Node started with {} process(es). Running until interrupted.", managedProcesses.size());
    }

    /**
     * Stops all processes, last started first. Safe to call more than once.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        LOGGER.info("Shutdown sequence initiated...");

        if (shutdownHook != null && Thread.currentThread() != shutdownHook) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (final IllegalStateException e) {
                // JVM is already shutting down
                LOGGER.debug("Could not remove shutdown hook: {}", e.getMessage());
            }
        }

        final List<String> processNames = new ArrayList<>(managedProcesses.keySet());
        Collections.reverse(processNames);
        stopAll(processNames);
        LOGGER.info("All processes stopped.");
    }

    /**
     * @return The processes by name, in start order.
     */
    public Map<String, IProcess> getProcesses() {
        return Collections.unmodifiableMap(managedProcesses);
    }

    private void stopAll(final List<String> processNames) {
        for (final String name : processNames) {
            try {
                LOGGER.debug("Stopping process '{}'...", name);
                managedProcesses.get(name).stop();
            } catch (final RuntimeException e) {
                LOGGER.error("Error while stopping process '{}': {}", name, e.getMessage());
                LOGGER.debug("Stop failure of process '{}'", name, e);
            }
        }
    }

    private void initializeProcesses(final Config config) {
        if (!config.hasPath(PROCESSES_CONFIG_PATH)) {
            LOGGER.warn("Configuration path '{}' not found. No processes will be loaded.", PROCESSES_CONFIG_PATH);
            return;
        }

        final ConfigObject processesConfig = config.getObject(PROCESSES_CONFIG_PATH);
        final Map<String, ProcessDefinition> processDefs = new LinkedHashMap<>();
        for (final String processName : processesConfig.keySet()) {
            final Config processConfig = processesConfig.toConfig().getConfig("\"" + processName + "\"");
            if (!processConfig.hasPath("className")) {
                throw new IllegalStateException("Process '" + processName + "' has no 'className'.");
            }
            final Config options = processConfig.hasPath("options")
                ? processConfig.getConfig("options")
                : ConfigFactory.empty();
            final Map<String, String> requires = new LinkedHashMap<>();
            if (processConfig.hasPath("require")) {
                final ConfigObject requireConfig = processConfig.getObject("require");
                for (final String localName : requireConfig.keySet()) {
                    requires.put(localName, String.valueOf(requireConfig.get(localName).unwrapped()));
                }
            }
            processDefs.put(processName, new ProcessDefinition(processName, processConfig.getString("className"), options, requires));
        }

        final List<String> order = topologicalSort(processDefs);
        LOGGER.debug("Process instantiation order: {}", order);

        final Map<String, Object> exposedServices = new HashMap<>();
        for (final String processName : order) {
            final ProcessDefinition def = processDefs.get(processName);
            final Map<String, Object> injected = new HashMap<>();
            for (final Map.Entry<String, String> requirement : def.requires().entrySet()) {
                final Object service = exposedServices.get(requirement.getValue());
                if (service == null) {
                    throw new IllegalStateException("Process '" + processName + "' requires a service from '"
                        + requirement.getValue() + "', which exposes none.");
                }
                injected.put(requirement.getKey(), service);
            }

            final IProcess process = instantiate(def, injected);
            managedProcesses.put(processName, process);
            if (process instanceof IServiceProvider) {
                final Object exposed = ((IServiceProvider) process).getExposedService();
                if (exposed != null) {
                    exposedServices.put(processName, exposed);
                    LOGGER.debug("Process '{}' exposes service: {}", processName, exposed.getClass().getSimpleName());
                }
            }
        }
        LOGGER.info("Initialized {} process(es): {}", managedProcesses.size(), managedProcesses.keySet());
    }

    private IProcess instantiate(final ProcessDefinition def, final Map<String, Object> dependencies) {
        try {
            final Class<?> processClass = Class.forName(def.className());
            if (!IProcess.class.isAssignableFrom(processClass)) {
                throw new IllegalStateException("Class " + def.className() + " does not implement IProcess.");
            }
            final Constructor<?> constructor = processClass.getConstructor(String.class, Map.class, Config.class);
            return (IProcess) constructor.newInstance(def.name(), dependencies, def.options());
        } catch (final InvocationTargetException e) {
            final Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalStateException("Failed to initialize process '" + def.name() + "': " + cause.getMessage(), cause);
        } catch (final ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot instantiate process '" + def.name() + "' from class "
                + def.className() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Orders the processes so that every process comes after the processes it requires (Kahn's algorithm).
     *
     * @throws IllegalStateException on an unknown requirement or a circular dependency.
     */
    static List<String> topologicalSort(final Map<String, ProcessDefinition> processDefs) {
        final Map<String, Set<String>> dependents = new HashMap<>();
        final Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (final String name : processDefs.keySet()) {
            dependents.put(name, new LinkedHashSet<>());
            inDegree.put(name, 0);
        }
        for (final ProcessDefinition def : processDefs.values()) {
            for (final String required : def.requires().values()) {
                if (!processDefs.containsKey(required)) {
                    throw new IllegalStateException("Process '" + def.name() + "' depends on '" + required
                        + "' which is not defined in the configuration.");
                }
                if (dependents.get(required).add(def.name())) {
                    inDegree.merge(def.name(), 1, Integer::sum);
                }
            }
        }

        final Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((name, degree) -> {
            if (degree == 0) {
                ready.add(name);
            }
        });
        final List<String> result = new ArrayList<>();
        while (!ready.isEmpty()) {
            final String current = ready.poll();
            result.add(current);
            for (final String dependent : dependents.get(current)) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (result.size() != processDefs.size()) {
            final List<String> remaining = new ArrayList<>(processDefs.keySet());
            remaining.removeAll(result);
            throw new IllegalStateException("Circular dependency detected among processes: " + remaining);
        }
        return result;
    }

    record ProcessDefinition(String name, String className, Config options, Map<String, String> requires) {
    }
}
