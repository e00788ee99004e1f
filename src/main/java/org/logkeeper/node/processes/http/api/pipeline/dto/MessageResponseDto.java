package org.logkeeper.node.processes.http.api.pipeline.dto;

/**
 * Acknowledgment of an accepted command.
 *
 * @param message The response message
 */
public record MessageResponseDto(
    String message
) {}
