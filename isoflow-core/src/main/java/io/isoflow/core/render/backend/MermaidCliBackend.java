package io.isoflow.core.render.backend;

import io.isoflow.core.render.BackendId;
import io.isoflow.core.render.OutputFormat;
import io.isoflow.core.render.source.MermaidSource;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/// Renders through the Mermaid CLI (`mmdc`).
public final class MermaidCliBackend extends ExternalEngineBackend {

    private static final Set<OutputFormat> FORMATS =
            EnumSet.of(OutputFormat.SVG, OutputFormat.PNG, OutputFormat.PDF, OutputFormat.SOURCE);

    public MermaidCliBackend(String executable, ProcessRunner runner) {
        super(new MermaidSource(), runner, executable);
    }

    @Override
    public BackendId id() {
        return BackendId.MERMAID;
    }

    @Override
    public Set<OutputFormat> supportedFormats() {
        return FORMATS;
    }

    @Override
    protected List<String> command(Path input, Path output, OutputFormat format) {
        return List.of(executable, "-i", input.toString(), "-o", output.toString(), "-q");
    }
}
