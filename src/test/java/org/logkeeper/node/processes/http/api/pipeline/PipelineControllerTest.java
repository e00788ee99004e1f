package org.logkeeper.node.processes.http.api.pipeline;

import com.typesafe.config.ConfigFactory;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.logkeeper.ingest.IngestionPipeline;
import org.logkeeper.ingest.PipelineStatistics;
import org.logkeeper.ingest.PipelineStatistics.QueueStatistics;
import org.logkeeper.ingest.api.errors.TransientStorageException;
import org.logkeeper.ingest.api.events.EventKind;
import org.logkeeper.ingest.api.resources.IMonitorable;
import org.logkeeper.ingest.api.resources.OperationalError;
import org.logkeeper.ingest.services.backfill.BackfillStartResult;
import org.logkeeper.ingest.services.backfill.BackfillState;
import org.logkeeper.ingest.services.backfill.BackfillStatus;
import org.logkeeper.node.processes.http.api.pipeline.dto.BackfillStatusDto;
import org.logkeeper.node.processes.http.api.pipeline.dto.ErrorResponseDto;
import org.logkeeper.node.processes.http.api.pipeline.dto.HealthDto;
import org.logkeeper.node.processes.http.api.pipeline.dto.MessageResponseDto;
import org.logkeeper.node.processes.http.api.pipeline.dto.PipelineStatusDto;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("PipelineController Unit Tests")
class PipelineControllerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private IngestionPipeline pipeline;

    @Mock
    private Context ctx;

    @Mock
    private IMonitorable writer;

    @Captor
    private ArgumentCaptor<Object> jsonCaptor;

    private PipelineController controller;

    @BeforeEach
    void setUp() {
        // Context is a fluent interface
        when(ctx.status(any(HttpStatus.class))).thenReturn(ctx);
        when(ctx.json(any())).thenReturn(ctx);

        when(writer.getMetrics()).thenReturn(Map.of("batches_flushed", 3L));
        when(writer.getErrors()).thenReturn(List.of());
        when(writer.isHealthy()).thenReturn(true);
        when(pipeline.components()).thenReturn(Map.of("batch-writer", writer));

        controller = new PipelineController(pipeline, ConfigFactory.empty());
    }

    private static PipelineStatistics statistics(boolean accepting, Map<String, BackfillStatus> backfills) {
        return new PipelineStatistics(NOW, accepting,
            Map.of(EventKind.MESSAGE, new QueueStatistics(5, 100, 1, 2),
                EventKind.ACTION, new QueueStatistics(0, 100, 0, 0)),
            Map.of(EventKind.MESSAGE, 42L, EventKind.ACTION, 7L),
            3, 2, 1, 4, 0, 0, 0, backfills, Map.of());
    }

    private static BackfillStatus runningBackfill(String scopeId) {
        return new BackfillStatus(scopeId, BackfillState.RUNNING, 2, 200, 150, 10, "m150", NOW, null, null);
    }

    private <T> T capturedJson(Class<T> type) {
        verify(ctx).json(jsonCaptor.capture());
        return type.cast(jsonCaptor.getValue());
    }

    @Nested
    @DisplayName("Status and health")
    class StatusAndHealth {

        @Test
        @DisplayName("getPipelineStatus should report counters and RUNNING when everything is healthy")
        void getPipelineStatus_shouldReportRunning() {
            // Arrange
            when(pipeline.getStatistics()).thenReturn(statistics(true, Map.of("c2", runningBackfill("c2"),
                "c1", runningBackfill("c1"))));
            when(pipeline.isHealthy()).thenReturn(true);

            // Act
            controller.getPipelineStatus(ctx);

            // Assert
            verify(ctx).status(HttpStatus.OK);
            PipelineStatusDto result = capturedJson(PipelineStatusDto.class);
            assertThat(result.status()).isEqualTo("RUNNING");
            assertThat(result.capturedAt()).isEqualTo("2024-03-01T12:00:00Z");
            assertThat(result.processed()).containsEntry("MESSAGE", 42L).containsEntry("ACTION", 7L);
            assertThat(result.queues().get("MESSAGE").dropped()).isEqualTo(1);
            assertThat(result.duplicatesSkipped()).isEqualTo(3);
            assertThat(result.backfills()).extracting(BackfillStatusDto::scopeId).containsExactly("c1", "c2");
            assertThat(result.components()).singleElement().satisfies(component -> {
                assertThat(component.name()).isEqualTo("batch-writer");
                assertThat(component.metrics()).containsEntry("batches_flushed", 3L);
            });
        }

        @Test
        @DisplayName("getPipelineStatus should report DEGRADED when a component is unhealthy")
        void getPipelineStatus_withUnhealthyComponent_shouldReportDegraded() {
            // Arrange
            when(pipeline.getStatistics()).thenReturn(statistics(true, Map.of()));
            when(pipeline.isHealthy()).thenReturn(true);
            when(writer.isHealthy()).thenReturn(false);
            when(writer.getErrors()).thenReturn(List.of(
                new OperationalError(NOW, "FATAL_BATCH", "Batch dropped", "details")));

            // Act
            controller.getPipelineStatus(ctx);

            // Assert
            PipelineStatusDto result = capturedJson(PipelineStatusDto.class);
            assertThat(result.status()).isEqualTo("DEGRADED");
            assertThat(result.components().get(0).errors()).containsExactly("FATAL_BATCH: Batch dropped");
        }

        @Test
        @DisplayName("getPipelineStatus should report STOPPED when the pipeline does not accept events")
        void getPipelineStatus_whenNotAccepting_shouldReportStopped() {
            // Arrange
            when(pipeline.getStatistics()).thenReturn(statistics(false, Map.of()));

            // Act
            controller.getPipelineStatus(ctx);

            // Assert
            assertThat(capturedJson(PipelineStatusDto.class).status()).isEqualTo("STOPPED");
        }

        @Test
        @DisplayName("getHealth should answer 503 when the pipeline is unhealthy")
        void getHealth_whenUnhealthy_shouldReturn503() {
            // Arrange
            when(pipeline.isHealthy()).thenReturn(false);
            when(pipeline.isAccepting()).thenReturn(true);

            // Act
            controller.getHealth(ctx);

            // Assert
            verify(ctx).status(HttpStatus.SERVICE_UNAVAILABLE);
            assertThat(capturedJson(HealthDto.class)).isEqualTo(new HealthDto("DOWN", true));
        }
    }

    @Nested
    @DisplayName("Backfill control")
    class BackfillControl {

        @Test
        @DisplayName("handleStartBackfill should answer 202 when the run starts")
        void handleStartBackfill_whenStarted_shouldReturn202() throws Exception {
            // Arrange
            when(ctx.pathParam("scopeId")).thenReturn("c1");
            when(pipeline.startBackfill("c1")).thenReturn(BackfillStartResult.STARTED);

            // Act
            controller.handleStartBackfill(ctx);

            // Assert
            verify(ctx).status(HttpStatus.ACCEPTED);
            assertThat(capturedJson(MessageResponseDto.class).message()).contains("c1");
        }

        @Test
        @DisplayName("handleStartBackfill should map refusals to 409, 403 and 503")
        void handleStartBackfill_whenRefused_shouldMapStatus() throws Exception {
            when(ctx.pathParam("scopeId")).thenReturn("c1");

            when(pipeline.startBackfill("c1")).thenReturn(BackfillStartResult.ALREADY_RUNNING);
            controller.handleStartBackfill(ctx);
            verify(ctx).status(HttpStatus.CONFLICT);

            when(pipeline.startBackfill("c1")).thenReturn(BackfillStartResult.FILTERED);
            controller.handleStartBackfill(ctx);
            verify(ctx).status(HttpStatus.FORBIDDEN);

            when(pipeline.startBackfill("c1")).thenReturn(BackfillStartResult.STOPPED);
            controller.handleStartBackfill(ctx);
            verify(ctx).status(HttpStatus.SERVICE_UNAVAILABLE);
        }

        @Test
        @DisplayName("handleStartBackfill should propagate storage failures to the exception handler")
        void handleStartBackfill_whenStorageFails_shouldThrow() throws Exception {
            when(ctx.pathParam("scopeId")).thenReturn("c1");
            when(pipeline.startBackfill("c1")).thenThrow(new TransientStorageException("pool exhausted"));

            assertThatThrownBy(() -> controller.handleStartBackfill(ctx))
                .isInstanceOf(TransientStorageException.class);
        }

        @Test
        @DisplayName("getBackfillStatus should answer 404 for an unknown scope")
        void getBackfillStatus_whenUnknown_shouldReturn404() {
            // Arrange
            when(ctx.pathParam("scopeId")).thenReturn("nope");
            when(pipeline.getBackfillStatus("nope")).thenReturn(Optional.empty());

            // Act
            controller.getBackfillStatus(ctx);

            // Assert
            verify(ctx).status(HttpStatus.NOT_FOUND);
            ErrorResponseDto error = capturedJson(ErrorResponseDto.class);
            assertThat(error.status()).isEqualTo(404);
            assertThat(error.message()).contains("nope");
        }

        @Test
        @DisplayName("getBackfillStatus should return the run snapshot")
        void getBackfillStatus_shouldReturnSnapshot() {
            // Arrange
            when(ctx.pathParam("scopeId")).thenReturn("c1");
            when(pipeline.getBackfillStatus("c1")).thenReturn(Optional.of(runningBackfill("c1")));

            // Act
            controller.getBackfillStatus(ctx);

            // Assert
            BackfillStatusDto result = capturedJson(BackfillStatusDto.class);
            assertThat(result.state()).isEqualTo("RUNNING");
            assertThat(result.cursor()).isEqualTo("m150");
            assertThat(result.finishedAt()).isNull();
        }

        @Test
        @DisplayName("handlePauseBackfill should answer 202 for an active run and 404 otherwise")
        void handlePauseBackfill_shouldMapResult() {
            when(ctx.pathParam("scopeId")).thenReturn("c1");

            when(pipeline.pauseBackfill("c1")).thenReturn(true);
            controller.handlePauseBackfill(ctx);
            verify(ctx).status(HttpStatus.ACCEPTED);

            when(pipeline.pauseBackfill("c1")).thenReturn(false);
            controller.handlePauseBackfill(ctx);
            verify(ctx).status(HttpStatus.NOT_FOUND);
        }
    }
}
