package io.isoflow.core.render.backend;

/// Exit status and combined stdout/stderr of a finished process.
///
/// @param exitCode process exit code
/// @param output combined output, truncated to the runner's capture limit; never null
public record ProcessResult(int exitCode, String output) {

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
