package io.isoflow.core.render.backend;

import io.isoflow.core.model.Flowchart;
import io.isoflow.core.render.BackendAdapter;
import io.isoflow.core.render.BackendFailureException;
import io.isoflow.core.render.BackendId;
import io.isoflow.core.render.BackendTimeoutException;
import io.isoflow.core.render.BackendUnavailableException;
import io.isoflow.core.render.OutputFormat;
import io.isoflow.core.render.RenderException;
import io.isoflow.core.render.RenderedArtifact;
import io.isoflow.core.render.source.DiagramSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;
import java.util.stream.Stream;

/// Base for adapters that drive a locally installed engine binary.
///
/// Each render works in its own temporary directory: the generated source is written
/// there, the engine is run through {@link ProcessRunner}, and the output file is read
/// back. The directory is removed afterwards whatever the outcome.
///
/// {@link OutputFormat#SOURCE} is answered with the generated source text without
/// starting the engine.
///
/// ### Failure mapping
/// | Condition                       | Exception                        |
/// |---------------------------------|----------------------------------|
/// | executable cannot be started    | {@link BackendUnavailableException} |
/// | process outlives the timeout    | {@link BackendTimeoutException}  |
/// | non-zero exit or no output file | {@link BackendFailureException}  |
/// | unsupported format              | {@link BackendFailureException}  |
public abstract class ExternalEngineBackend implements BackendAdapter {

    private static final Logger logger = Logger.getLogger(ExternalEngineBackend.class.getName());

    private final DiagramSource source;
    private final ProcessRunner runner;
    protected final String executable;

    protected ExternalEngineBackend(DiagramSource source, ProcessRunner runner, String executable) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.executable = Objects.requireNonNull(executable, "executable must not be null");
    }

    /// Builds the engine command line.
    ///
    /// @param input generated source file, not null
    /// @param output file the engine must write, not null
    /// @param format requested format, never {@link OutputFormat#SOURCE}
    /// @return command and arguments, never null
    protected abstract List<String> command(Path input, Path output, OutputFormat format);

    /// Returns the source generator of this engine.
    public DiagramSource getSource() {
        return source;
    }

    @Override
    public RenderedArtifact render(Flowchart flowchart, OutputFormat format, Duration timeout)
            throws RenderException, InterruptedException {
        Objects.requireNonNull(flowchart, "flowchart must not be null");
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");

        if (!supportedFormats().contains(format)) {
            throw new BackendFailureException(
                    id(), id().getName() + " cannot produce " + format.cliName());
        }

        String text = source.generate(flowchart);
        if (format == OutputFormat.SOURCE) {
            return new RenderedArtifact(text.getBytes(StandardCharsets.UTF_8), format);
        }

        Path workDir = createWorkDir();
        try {
            Path input = workDir.resolve("diagram." + source.getExtension());
            Path output = workDir.resolve("diagram." + format.getExtension());
            write(input, text);
            ProcessResult result = execute(command(input, output, format), workDir, timeout);

            if (!result.isSuccess()) {
                throw new BackendFailureException(
                        id(),
                        executable + " exited with " + result.exitCode() + ": " + result.output());
            }
            if (!Files.isRegularFile(output)) {
                throw new BackendFailureException(id(), executable + " produced no output file");
            }
            return new RenderedArtifact(read(output), format);
        } finally {
            deleteQuietly(workDir);
        }
    }

    private ProcessResult execute(List<String> command, Path workDir, Duration timeout)
            throws RenderException, InterruptedException {
        try {
            return runner.run(command, workDir, timeout);
        } catch (TimeoutException e) {
            throw new BackendTimeoutException(id(), e.getMessage(), e);
        } catch (IOException e) {
            throw new BackendUnavailableException(
                    id(), "Cannot start " + executable + ": " + e.getMessage(), e);
        }
    }

    private Path createWorkDir() throws BackendFailureException {
        try {
            return Files.createTempDirectory("isoflow-" + id().getName() + "-");
        } catch (IOException e) {
            throw new BackendFailureException(id(), "Cannot create work directory", e);
        }
    }

    private void write(Path file, String text) throws BackendFailureException {
        try {
            Files.writeString(file, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new BackendFailureException(id(), "Cannot write " + file.getFileName(), e);
        }
    }

    private byte[] read(Path file) throws BackendFailureException {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new BackendFailureException(id(), "Cannot read " + file.getFileName(), e);
        }
    }

    private static void deleteQuietly(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(ExternalEngineBackend::deleteFile);
        } catch (IOException e) {
            logger.fine("Could not clean up " + dir + ": " + e.getMessage());
        }
    }

    private static void deleteFile(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.fine("Could not delete " + path + ": " + e.getMessage());
        }
    }
}
