package org.logkeeper.node;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.logkeeper.node.Node.ProcessDefinition;
import org.logkeeper.node.spi.IProcess;
import org.logkeeper.node.spi.IServiceProvider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for Node to verify configuration parsing, dependency injection,
 * and IProcess lifecycle management.
 */
@Tag("unit")
class NodeTest {

    static final List<String> EVENTS = new CopyOnWriteArrayList<>();

    private Node testNode;

    @BeforeEach
    void setUp() {
        EVENTS.clear();
    }

    @AfterEach
    void tearDown() {
        if (testNode != null) {
            testNode.stop();
            testNode = null;
        }
    }

    private static ProcessDefinition def(String name, String... requires) {
        Map<String, String> required = new LinkedHashMap<>();
        for (String dependency : requires) {
            required.put(dependency, dependency);
        }
        return new ProcessDefinition(name, RecordingProcess.class.getName(), ConfigFactory.empty(), required);
    }

    private static Map<String, ProcessDefinition> defs(ProcessDefinition... definitions) {
        Map<String, ProcessDefinition> result = new LinkedHashMap<>();
        for (ProcessDefinition definition : definitions) {
            result.put(definition.name(), definition);
        }
        return result;
    }

    @Test
    @DisplayName("topologicalSort should place every process after the processes it requires")
    void topologicalSort_shouldOrderDependenciesFirst() {
        // Arrange
        Map<String, ProcessDefinition> processDefs = defs(def("http", "ingestion"), def("ingestion", "storage"),
            def("storage"), def("standalone"));

        // Act
        List<String> order = Node.topologicalSort(processDefs);

        // Assert
        assertThat(order).containsExactlyInAnyOrder("http", "ingestion", "storage", "standalone");
        assertThat(order.indexOf("storage")).isLessThan(order.indexOf("ingestion"));
        assertThat(order.indexOf("ingestion")).isLessThan(order.indexOf("http"));
    }

    @Test
    @DisplayName("topologicalSort should reject a circular dependency")
    void topologicalSort_shouldRejectCycle() {
        Map<String, ProcessDefinition> processDefs = defs(def("a", "b"), def("b", "c"), def("c", "a"), def("d"));

        assertThatThrownBy(() -> Node.topologicalSort(processDefs))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Circular dependency")
            .hasMessageEndingWith("[a, b, c]");
    }

    @Test
    @DisplayName("topologicalSort should reject a requirement on an undefined process")
    void topologicalSort_shouldRejectUnknownDependency() {
        Map<String, ProcessDefinition> processDefs = defs(def("http", "ingestion"));

        assertThatThrownBy(() -> Node.topologicalSort(processDefs))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("'ingestion' which is not defined");
    }

    @Test
    @DisplayName("Should inject exposed services, start dependencies first and stop in reverse order")
    void lifecycle_shouldFollowDependencyOrder() {
        // Arrange
        Config config = ConfigFactory.parseString("""
            node.processes {
              consumer {
                className = "org.logkeeper.node.NodeTest$RecordingProcess"
                require { upstream = "producer" }
              }
              producer {
                className = "org.logkeeper.node.NodeTest$RecordingProcess"
              }
            }
            """);

        // Act
        testNode = new Node(config);
        testNode.start();
        testNode.stop();

        // Assert
        assertThat(testNode.getProcesses()).containsOnlyKeys("producer", "consumer");
        RecordingProcess consumer = (RecordingProcess) testNode.getProcesses().get("consumer");
        assertThat(consumer.dependencies()).containsEntry("upstream", "service:producer");
        assertThat(EVENTS).containsExactly("start:producer", "start:consumer", "stop:consumer", "stop:producer");
    }

    @Test
    @DisplayName("stop should only stop the processes once")
    void stop_shouldBeIdempotent() {
        // Arrange
        testNode = new Node(ConfigFactory.parseString(
            "node.processes.only.className = \"org.logkeeper.node.NodeTest$RecordingProcess\""));
        testNode.start();

        // Act
        testNode.stop();
        testNode.stop();

        // Assert
        assertThat(EVENTS).containsExactly("start:only", "stop:only");
    }

    @Test
    @DisplayName("A failing start should stop the processes already started and fail the node")
    void start_withFailingProcess_shouldRollBack() {
        // Arrange
        testNode = new Node(ConfigFactory.parseString("""
            node.processes {
              first { className = "org.logkeeper.node.NodeTest$RecordingProcess" }
              broken {
                className = "org.logkeeper.node.NodeTest$FailingStartProcess"
                require { upstream = "first" }
              }
            }
            """));

        // Act & Assert
        assertThatThrownBy(() -> testNode.start())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("'broken' failed to start")
            .hasRootCauseMessage("port in use");
        assertThat(EVENTS).containsExactly("start:first", "stop:first");
    }

    @Test
    @DisplayName("Should handle missing process configuration gracefully")
    void constructor_shouldHandleMissingProcessConfiguration() {
        // Arrange
        Config emptyConfig = ConfigFactory.parseString("node { }");

        // Act
        testNode = new Node(emptyConfig);
        testNode.start();

        // Assert
        assertThat(testNode.getProcesses()).isEmpty();
    }

    @Test
    @DisplayName("Should reject a process without className")
    void constructor_shouldRejectMissingClassName() {
        Config config = ConfigFactory.parseString("node.processes.nameless.options { a = 1 }");

        assertThatThrownBy(() -> new Node(config))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("'nameless' has no 'className'");
    }

    @Test
    @DisplayName("Should fail on an unknown process class")
    void constructor_shouldRejectUnknownClass() {
        Config config = ConfigFactory.parseString("node.processes.ghost.className = \"org.nonexistent.GhostProcess\"");

        assertThatThrownBy(() -> new Node(config))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Cannot instantiate process 'ghost'")
            .hasCauseInstanceOf(ClassNotFoundException.class);
    }

    @Test
    @DisplayName("Should fail on a class that doesn't implement IProcess")
    void constructor_shouldRejectNonProcessClass() {
        Config config = ConfigFactory.parseString("node.processes.text.className = \"java.lang.String\"");

        assertThatThrownBy(() -> new Node(config))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("does not implement IProcess");
    }

    @Test
    @DisplayName("Should surface the cause when a process constructor throws")
    void constructor_shouldSurfaceInitializationFailure() {
        Config config = ConfigFactory.parseString(
            "node.processes.bad.className = \"org.logkeeper.node.NodeTest$FailingInitProcess\"");

        assertThatThrownBy(() -> new Node(config))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Failed to initialize process 'bad': missing jdbcUrl")
            .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should fail when a required process exposes no service")
    void constructor_shouldRejectRequirementWithoutService() {
        Config config = ConfigFactory.parseString("""
            node.processes {
              silent { className = "org.logkeeper.node.NodeTest$FailingStartProcess" }
              consumer {
                className = "org.logkeeper.node.NodeTest$RecordingProcess"
                require { upstream = "silent" }
              }
            }
            """);

        assertThatThrownBy(() -> new Node(config))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("requires a service from 'silent', which exposes none");
    }

    public static class RecordingProcess implements IProcess, IServiceProvider {
        private final String name;
        private final Map<String, Object> dependencies;

        public RecordingProcess(String name, Map<String, Object> dependencies, Config options) {
            this.name = name;
            this.dependencies = dependencies;
        }

        @Override
        public void start() {
            EVENTS.add("start:" + name);
        }

        @Override
        public void stop() {
            EVENTS.add("stop:" + name);
        }

        @Override
        public Object getExposedService() {
            return "service:" + name;
        }

        Map<String, Object> dependencies() {
            return dependencies;
        }
    }

    public static class FailingStartProcess implements IProcess {
        public FailingStartProcess(String name, Map<String, Object> dependencies, Config options) {
        }

        @Override
        public void start() {
            throw new IllegalStateException("port in use");
        }

        @Override
        public void stop() {
            EVENTS.add("stop:broken");
        }
    }

    public static class FailingInitProcess implements IProcess {
        public FailingInitProcess(String name, Map<String, Object> dependencies, Config options) {
            throw new IllegalArgumentException("missing jdbcUrl");
        }

        @Override
        public void start() {
        }

        @Override
        public void stop() {
        }
    }
}
