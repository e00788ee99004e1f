package org.logkeeper.node.processes.http.api.pipeline.dto;

/**
 * @param status    "UP" or "DOWN".
 * @param accepting Whether the pipeline accepts events.
 */
public record HealthDto(
    String status,
    boolean accepting
) {}
