package io.isoflow.core.render.backend;

import io.isoflow.core.model.Flowchart;
import io.isoflow.core.render.BackendAdapter;
import io.isoflow.core.render.BackendId;
import io.isoflow.core.render.OutputFormat;
import io.isoflow.core.render.RenderedArtifact;
import io.isoflow.core.render.source.HtmlViewerPage;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/// Last-resort adapter: writes a self-contained HTML viewer page in process.
///
/// Needs no binary and no network at render time, so it cannot be unavailable and does
/// not time out. Whatever format is requested, the artifact is HTML.
public final class HtmlFallbackBackend implements BackendAdapter {

    private final HtmlViewerPage page;

    public HtmlFallbackBackend() {
        this(new HtmlViewerPage());
    }

    public HtmlFallbackBackend(HtmlViewerPage page) {
        this.page = Objects.requireNonNull(page, "page must not be null");
    }

    @Override
    public BackendId id() {
        return BackendId.HTML;
    }

    @Override
    public Set<OutputFormat> supportedFormats() {
        return EnumSet.allOf(OutputFormat.class);
    }

    @Override
    public RenderedArtifact render(Flowchart flowchart, OutputFormat format, Duration timeout) {
        Objects.requireNonNull(flowchart, "flowchart must not be null");
        byte[] html = page.generate(flowchart).getBytes(StandardCharsets.UTF_8);
        return new RenderedArtifact(html, OutputFormat.HTML);
    }
}
