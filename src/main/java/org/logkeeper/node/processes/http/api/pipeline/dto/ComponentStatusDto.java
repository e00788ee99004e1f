package org.logkeeper.node.processes.http.api.pipeline.dto;

import org.logkeeper.ingest.api.resources.IMonitorable;
import org.logkeeper.ingest.api.resources.OperationalError;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A Data Transfer Object representing the status of a single pipeline component.
 *
 * @param name    The name of the component.
 * @param type    The class name of the component implementation.
 * @param metrics The component's metrics.
 * @param errors  Recent error messages, prefixed with their type.
 * @param healthy Whether the component is healthy.
 */
public record ComponentStatusDto(
    String name,
    String type,
    Map<String, Number> metrics,
    List<String> errors,
    boolean healthy
) {
    public static ComponentStatusDto from(final String name, final IMonitorable component) {
        final List<String> errorMessages = component.getErrors().stream()
            .map(ComponentStatusDto::describe)
            .collect(Collectors.toList());
        return new ComponentStatusDto(name, component.getClass().getSimpleName(), component.getMetrics(),
            errorMessages, component.isHealthy());
    }

    private static String describe(final OperationalError error) {
        return error.errorType() + ": " + error.message();
    }
}
