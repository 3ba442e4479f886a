package io.isoflow.core.render.backend;

import io.isoflow.core.render.BackendId;
import io.isoflow.core.render.OutputFormat;
import io.isoflow.core.render.source.DotSource;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/// Renders through the Graphviz `dot` executable.
public final class GraphvizBackend extends ExternalEngineBackend {

    private static final Set<OutputFormat> FORMATS =
            EnumSet.of(OutputFormat.SVG, OutputFormat.PNG, OutputFormat.PDF, OutputFormat.SOURCE);

    public GraphvizBackend(String executable, ProcessRunner runner) {
        super(new DotSource(), runner, executable);
    }

    @Override
    public BackendId id() {
        return BackendId.GRAPHVIZ;
    }

    @Override
    public Set<OutputFormat> supportedFormats() {
        return FORMATS;
    }

    @Override
    protected List<String> command(Path input, Path output, OutputFormat format) {
        return List.of(
                executable, "-T" + format.cliName(), input.toString(), "-o", output.toString());
    }
}
