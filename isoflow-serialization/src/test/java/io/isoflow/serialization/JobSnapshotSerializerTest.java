package io.isoflow.serialization;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.isoflow.core.job.JobSnapshot;
import io.isoflow.core.job.JobStatus;
import io.isoflow.core.render.AttemptFailure;
import io.isoflow.core.render.BackendId;
import io.isoflow.core.render.OutputFormat;
import io.isoflow.core.render.RenderResult;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class JobSnapshotSerializerTest {

    private static final Instant CREATED = Instant.parse("2026-05-04T10:15:30Z");
    private static final Instant UPDATED = Instant.parse("2026-05-04T10:15:32Z");

    private final ObjectMapper mapper = FlowchartJson.createMapper();

    @Test
    void shouldWriteRenderMetadataWithoutArtifact() throws Exception {
        RenderResult render =
                new RenderResult(
                        "<html></html>".getBytes(StandardCharsets.UTF_8),
                        BackendId.HTML,
                        OutputFormat.HTML,
                        List.of(BackendId.GRAPHVIZ, BackendId.HTML),
                        true,
                        List.of("Backend failed, falling back: graphviz"),
                        List.of(
                                new AttemptFailure(
                                        BackendId.GRAPHVIZ,
                                        "BackendUnavailableException",
                                        "graphviz is not available")));
        JobSnapshot snapshot =
                new JobSnapshot(
                        "job-1",
                        JobStatus.COMPLETED,
                        "Rendered with html",
                        render,
                        null,
                        CREATED,
                        UPDATED);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(snapshot));

        assertThat(json.get("status").asText()).isEqualTo("COMPLETED");
        assertThat(json.get("createdAt").asText()).isEqualTo("2026-05-04T10:15:30Z");
        JsonNode written = json.get("render");
        assertThat(written.get("backend").asText()).isEqualTo("html");
        assertThat(written.get("mediaType").asText()).isEqualTo("text/html");
        assertThat(written.get("size").asInt()).isEqualTo(13);
        assertThat(written.has("artifactBytes")).isFalse();
        assertThat(written.get("fallbackChainTried").get(0).asText()).isEqualTo("graphviz");
        assertThat(written.get("failures").get(0).get("errorType").asText())
                .isEqualTo("BackendUnavailableException");
        assertThat(json.has("error")).isFalse();
    }

    @Test
    void shouldWriteErrorOfFailedJob() throws Exception {
        JobSnapshot snapshot =
                new JobSnapshot(
                        "job-2",
                        JobStatus.FAILED,
                        "Render failed",
                        null,
                        "All backends exhausted",
                        CREATED,
                        UPDATED);

        JsonNode json = mapper.readTree(FlowchartJson.toJson(snapshot));

        assertThat(json.get("error").asText()).isEqualTo("All backends exhausted");
        assertThat(json.has("render")).isFalse();
        assertThat(json.get("updatedAt").asText()).isEqualTo("2026-05-04T10:15:32Z");
    }
}
