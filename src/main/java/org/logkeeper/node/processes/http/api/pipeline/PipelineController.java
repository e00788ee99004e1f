package org.logkeeper.node.processes.http.api.pipeline;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.logkeeper.ingest.IngestionPipeline;
import org.logkeeper.ingest.PipelineStatistics;
import org.logkeeper.ingest.api.errors.StorageException;
import org.logkeeper.ingest.services.backfill.BackfillStartResult;
import org.logkeeper.ingest.services.backfill.BackfillStatus;
import org.logkeeper.node.processes.http.AbstractController;
import org.logkeeper.node.processes.http.api.pipeline.dto.BackfillStatusDto;
import org.logkeeper.node.processes.http.api.pipeline.dto.ComponentStatusDto;
import org.logkeeper.node.processes.http.api.pipeline.dto.ErrorResponseDto;
import org.logkeeper.node.processes.http.api.pipeline.dto.HealthDto;
import org.logkeeper.node.processes.http.api.pipeline.dto.MessageResponseDto;
import org.logkeeper.node.processes.http.api.pipeline.dto.PipelineStatusDto;
import org.logkeeper.node.processes.http.api.pipeline.dto.QueueStatusDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST API for monitoring the ingestion pipeline and controlling backfill runs.
 * <ul>
 *   <li>{@code GET  {base}status}: statistics snapshot</li>
 *   <li>{@code GET  {base}health}: 200 when healthy, 503 otherwise</li>
 *   <li>{@code GET  {base}backfill/{scopeId}}: status of the scope's latest run</li>
 *   <li>{@code POST {base}backfill/{scopeId}}: start or resume a run</li>
 *   <li>{@code POST {base}backfill/{scopeId}/pause}: pause a run</li>
 * </ul>
 */
public class PipelineController extends AbstractController {

    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineController.class);
    private final String nodeId;

    public PipelineController(final IngestionPipeline pipeline, final Config options) {
        super(pipeline, options);
        this.nodeId = determineNodeId();
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        final String fullPath = basePath.replaceAll("//", "/");

        app.get(fullPath + "status", this::getPipelineStatus);
        app.get(fullPath + "health", this::getHealth);
        app.get(fullPath + "backfill/{scopeId}", this::getBackfillStatus);
        app.post(fullPath + "backfill/{scopeId}", this::handleStartBackfill);
        app.post(fullPath + "backfill/{scopeId}/pause", this::handlePauseBackfill);

        app.exception(StorageException.class, (e, ctx) -> {
            LOGGER.warn("Storage unavailable for request {}: {}", ctx.path(), e.getMessage());
            error(ctx, HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
        });
        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            LOGGER.warn("Bad request {}: {}", ctx.path(), e.getMessage());
            error(ctx, HttpStatus.BAD_REQUEST, e.getMessage());
        });
        app.exception(Exception.class, (e, ctx) -> {
            LOGGER.error("Unhandled exception for request {}: {}", ctx.path(), e.getMessage());
            LOGGER.debug("Unhandled exception for request {}", ctx.path(), e);
            error(ctx, HttpStatus.INTERNAL_SERVER_ERROR, "An internal server error occurred.");
        });
    }

    void getPipelineStatus(final Context ctx) {
        final PipelineStatistics stats = pipeline.getStatistics();

        final Map<String, QueueStatusDto> queues = new LinkedHashMap<>();
        stats.queues().forEach((kind, queue) -> queues.put(kind.name(), QueueStatusDto.from(queue)));
        final Map<String, Long> processed = new LinkedHashMap<>();
        stats.processed().forEach((kind, count) -> processed.put(kind.name(), count));

        final List<BackfillStatusDto> backfills = stats.backfills().values().stream()
            .sorted((a, b) -> a.scopeId().compareTo(b.scopeId()))
            .map(BackfillStatusDto::from)
            .collect(Collectors.toList());
        final List<ComponentStatusDto> components = pipeline.components().entrySet().stream()
            .map(entry -> ComponentStatusDto.from(entry.getKey(), entry.getValue()))
            .collect(Collectors.toList());

        final String status;
        if (!stats.accepting()) {
            status = "STOPPED";
        } else if (pipeline.isHealthy() && components.stream().allMatch(ComponentStatusDto::healthy)) {
            status = "RUNNING";
        } else {
            status = "DEGRADED";
        }

        ctx.status(HttpStatus.OK).json(new PipelineStatusDto(
            nodeId,
            status,
            stats.capturedAt().toString(),
            queues,
            processed,
            stats.duplicatesSkipped(),
            stats.filtered(),
            stats.rejectedStopped(),
            stats.validationFailures(),
            stats.rejectedRows(),
            stats.fatalBatches(),
            stats.lostEvents(),
            backfills,
            components));
    }

    void getHealth(final Context ctx) {
        final boolean healthy = pipeline.isHealthy();
        ctx.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
            .json(new HealthDto(healthy ? "UP" : "DOWN", pipeline.isAccepting()));
    }

    void getBackfillStatus(final Context ctx) {
        final String scopeId = ctx.pathParam("scopeId");
        final BackfillStatus status = pipeline.getBackfillStatus(scopeId).orElse(null);
        if (status == null) {
            error(ctx, HttpStatus.NOT_FOUND, "No backfill run known for scope '" + scopeId + "'.");
            return;
        }
        ctx.status(HttpStatus.OK).json(BackfillStatusDto.from(status));
    }

    void handleStartBackfill(final Context ctx) throws StorageException {
        final String scopeId = ctx.pathParam("scopeId");
        final BackfillStartResult result = pipeline.startBackfill(scopeId);
        switch (result) {
            case STARTED -> ctx.status(HttpStatus.ACCEPTED)
                .json(new MessageResponseDto("Backfill of scope '" + scopeId + "' started."));
            case ALREADY_RUNNING -> error(ctx, HttpStatus.CONFLICT,
                "A backfill of scope '" + scopeId + "' is already running.");
            case FILTERED -> error(ctx, HttpStatus.FORBIDDEN,
                "Scope '" + scopeId + "' is excluded by the filter configuration.");
            case STOPPED -> error(ctx, HttpStatus.SERVICE_UNAVAILABLE, "The pipeline is not accepting work.");
            default -> throw new IllegalStateException("Unexpected start result: " + result);
        }
    }

    void handlePauseBackfill(final Context ctx) {
        final String scopeId = ctx.pathParam("scopeId");
        if (pipeline.pauseBackfill(scopeId)) {
            ctx.status(HttpStatus.ACCEPTED).json(new MessageResponseDto("Pause of scope '" + scopeId + "' requested."));
        } else {
            error(ctx, HttpStatus.NOT_FOUND, "No active backfill run for scope '" + scopeId + "'.");
        }
    }

    private static void error(final Context ctx, final HttpStatus status, final String message) {
        ctx.status(status).json(ErrorResponseDto.of(status.getCode(), status.getMessage(), message));
    }

    private static String determineNodeId() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (final UnknownHostException e) {
            LOGGER.debug("Could not determine hostname: {}", e.getMessage());
            return "unknown-node";
        }
    }
}
