package org.logkeeper.node.processes;

import com.typesafe.config.Config;
import org.logkeeper.node.spi.IProcess;

import java.util.Collections;
import java.util.Map;

/**
 * Base class for {@link IProcess} implementations, giving every process the constructor the
 * Node instantiates it with.
 */
public abstract class AbstractProcess implements IProcess {

    protected final String processName;
    protected final Map<String, Object> dependencies;
    protected final Config options;

    /**
     * @param processName  The name of this process instance from the configuration.
     * @param dependencies Dependency instances by the local names declared in {@code require}.
     * @param options      The options block of this process.
     */
    public AbstractProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        this.processName = processName;
        this.dependencies = dependencies != null ? dependencies : Collections.emptyMap();
        this.options = options;
    }

    public String getProcessName() {
        return processName;
    }

    /**
     * Retrieves a required dependency with type safety.
     *
     * @throws IllegalArgumentException if the dependency is missing or has the wrong type.
     */
    protected <T> T getDependency(final String name, final Class<T> expectedType) {
        final Object dep = dependencies.get(name);
        if (dep == null) {
            throw new IllegalArgumentException(
                "Required dependency '" + name + "' not found for process '" + processName + "'");
        }
        if (!expectedType.isInstance(dep)) {
            throw new IllegalArgumentException(
                "Dependency '" + name + "' for process '" + processName + "' is " +
                dep.getClass().getName() + " but expected " + expectedType.getName());
        }
        return expectedType.cast(dep);
    }
}
