package io.isoflow.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.isoflow.core.render.BackendId;
import io.isoflow.core.render.FallbackPolicy;
import io.isoflow.core.render.OutputFormat;
import io.isoflow.core.render.QualityMode;
import java.net.URI;
import java.time.Duration;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class IsoflowConfigTest {

    @Test
    void shouldKeepDefaultsForEmptyProperties() {
        IsoflowConfig config = IsoflowConfig.fromProperties(new Properties());

        assertThat(config.getThreadPoolSize()).isEqualTo(4);
        assertThat(config.getRenderConcurrency()).isEqualTo(3);
        assertThat(config.getRenderTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.isStrictArtifactChecks()).isTrue();
        assertThat(config.getQualityMode()).isEqualTo(QualityMode.DRAFT_ALLOWED);
        assertThat(config.getFallbackPolicy()).isEqualTo(FallbackPolicy.defaults());
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.SVG);
        assertThat(config.getCapabilityTtl()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.getCandidateTimeout()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.getJobTtl()).isEqualTo(Duration.ofHours(1));
        assertThat(config.getEngines().kroki()).isEqualTo(URI.create("https://kroki.io"));
    }

    @Test
    void shouldReadIsoflowKeys() {
        Properties properties = new Properties();
        properties.setProperty("isoflow.threadPoolSize", "8");
        properties.setProperty("isoflow.render.concurrency", " 2 ");
        properties.setProperty("isoflow.render.timeoutSeconds", "15");
        properties.setProperty("isoflow.render.strictArtifactChecks", "false");
        properties.setProperty("isoflow.render.qualityMode", "certified_only");
        properties.setProperty("isoflow.render.fallbackPolicy", "d2, mermaid");
        properties.setProperty("isoflow.render.format", "png");
        properties.setProperty("isoflow.detect.minConfidence", "0.5");
        properties.setProperty("isoflow.jobs.maxConcurrent", "1");
        properties.setProperty("isoflow.engine.dot", "/opt/graphviz/bin/dot");
        properties.setProperty("isoflow.engine.krokiUrl", "http://localhost:8000");

        IsoflowConfig config = IsoflowConfig.fromProperties(properties);

        assertThat(config.getThreadPoolSize()).isEqualTo(8);
        assertThat(config.getRenderConcurrency()).isEqualTo(2);
        assertThat(config.getRenderTimeout()).isEqualTo(Duration.ofSeconds(15));
        assertThat(config.isStrictArtifactChecks()).isFalse();
        assertThat(config.getQualityMode()).isEqualTo(QualityMode.CERTIFIED_ONLY);
        assertThat(config.getFallbackPolicy().order())
                .containsExactly(BackendId.D2, BackendId.MERMAID, BackendId.HTML);
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.PNG);
        assertThat(config.getMinCandidateConfidence()).isEqualTo(0.5);
        assertThat(config.getMaxConcurrentJobs()).isEqualTo(1);
        assertThat(config.getEngines().dot()).isEqualTo("/opt/graphviz/bin/dot");
        assertThat(config.getEngines().d2()).isEqualTo("d2");
        assertThat(config.getEngines().kroki()).isEqualTo(URI.create("http://localhost:8000"));
    }

    @Test
    void shouldIgnoreKeysWithoutPrefix() {
        Properties properties = new Properties();
        properties.setProperty("threadPoolSize", "16");

        assertThat(IsoflowConfig.fromProperties(properties).getThreadPoolSize()).isEqualTo(4);
    }

    @Test
    void shouldNameKeyOfInvalidValue() {
        Properties properties = new Properties();
        properties.setProperty("isoflow.render.timeoutSeconds", "soon");

        assertThatThrownBy(() -> IsoflowConfig.fromProperties(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid integer for isoflow.render.timeoutSeconds: soon");
    }

    @Test
    void shouldBuildFluently() {
        IsoflowConfig config =
                IsoflowConfig.builder()
                        .threadPoolSize(2)
                        .qualityMode(QualityMode.CERTIFIED_ONLY)
                        .fallbackPolicy(FallbackPolicy.of(BackendId.KROKI))
                        .build();

        assertThat(config.getThreadPoolSize()).isEqualTo(2);
        assertThat(config.getQualityMode()).isEqualTo(QualityMode.CERTIFIED_ONLY);
        assertThat(config.getFallbackPolicy().order())
                .containsExactly(BackendId.KROKI, BackendId.HTML);
    }
}
