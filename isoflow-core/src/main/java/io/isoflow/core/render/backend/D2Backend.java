package io.isoflow.core.render.backend;

import io.isoflow.core.render.BackendId;
import io.isoflow.core.render.OutputFormat;
import io.isoflow.core.render.source.D2Source;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/// Renders through the `d2` executable. D2 picks the format from the output extension.
public final class D2Backend extends ExternalEngineBackend {

    private static final Set<OutputFormat> FORMATS =
            EnumSet.of(OutputFormat.SVG, OutputFormat.PNG, OutputFormat.PDF, OutputFormat.SOURCE);

    public D2Backend(String executable, ProcessRunner runner) {
        super(new D2Source(), runner, executable);
    }

    @Override
    public BackendId id() {
        return BackendId.D2;
    }

    @Override
    public Set<OutputFormat> supportedFormats() {
        return FORMATS;
    }

    @Override
    protected List<String> command(Path input, Path output, OutputFormat format) {
        return List.of(executable, input.toString(), output.toString());
    }
}
