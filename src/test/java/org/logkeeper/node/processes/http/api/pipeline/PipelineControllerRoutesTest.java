package org.logkeeper.node.processes.http.api.pipeline;

import com.typesafe.config.ConfigFactory;
import io.javalin.Javalin;
import io.javalin.testtools.JavalinTest;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.logkeeper.ingest.IngestionPipeline;
import org.logkeeper.ingest.api.errors.TransientStorageException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
class PipelineControllerRoutesTest {

    private Javalin appFor(IngestionPipeline pipeline) {
        Javalin app = Javalin.create();
        new PipelineController(pipeline, ConfigFactory.empty()).registerRoutes(app, "/api/pipeline/");
        return app;
    }

    @Test
    void healthRouteAnswersUp() throws Exception {
        IngestionPipeline pipeline = mock(IngestionPipeline.class);
        when(pipeline.isHealthy()).thenReturn(true);
        when(pipeline.isAccepting()).thenReturn(true);

        JavalinTest.test(appFor(pipeline), (server, client) -> {
            var response = client.get("/api/pipeline/health");
            assertThat(response.code()).isEqualTo(200);
            String json = response.body().string();
            assertThat(json).contains("\"status\":\"UP\"").contains("\"accepting\":true");
        });
    }

    @Test
    void storageFailureMapsToServiceUnavailable() throws Exception {
        IngestionPipeline pipeline = mock(IngestionPipeline.class);
        when(pipeline.startBackfill("c1")).thenThrow(new TransientStorageException("connection pool exhausted"));

        JavalinTest.test(appFor(pipeline), (server, client) -> {
            var response = client.post("/api/pipeline/backfill/c1");
            assertThat(response.code()).isEqualTo(503);
            String json = response.body().string();
            assertThat(json).contains("\"status\":503").contains("connection pool exhausted");
        });
    }

    @Test
    void invalidArgumentMapsToBadRequest() throws Exception {
        IngestionPipeline pipeline = mock(IngestionPipeline.class);
        when(pipeline.startBackfill("c1")).thenThrow(new IllegalArgumentException("scopeId must not be blank"));

        JavalinTest.test(appFor(pipeline), (server, client) -> {
            var response = client.post("/api/pipeline/backfill/c1");
            assertThat(response.code()).isEqualTo(400);
            assertThat(response.body().string()).contains("scopeId must not be blank");
        });
    }

    @Test
    void unexpectedFailureHidesDetails() throws Exception {
        IngestionPipeline pipeline = mock(IngestionPipeline.class);
        when(pipeline.startBackfill("c1")).thenThrow(new IllegalStateException("writer thread died"));

        JavalinTest.test(appFor(pipeline), (server, client) -> {
            var response = client.post("/api/pipeline/backfill/c1");
            assertThat(response.code()).isEqualTo(500);
            String json = response.body().string();
            assertThat(json).contains("An internal server error occurred.").doesNotContain("writer thread died");
        });
    }

    @Test
    void pauseRouteForwardsScope() throws Exception {
        IngestionPipeline pipeline = mock(IngestionPipeline.class);
        when(pipeline.pauseBackfill("general")).thenReturn(true);

        JavalinTest.test(appFor(pipeline), (server, client) -> {
            var response = client.post("/api/pipeline/backfill/general/pause");
            assertThat(response.code()).isEqualTo(202);
            verify(pipeline).pauseBackfill("general");
        });
    }
}
