package io.isoflow.core.render;

import java.util.Objects;

/// Result of one backend attempt, fed to {@link DispatchTransitions#next}.
public sealed interface AttemptOutcome {

    /// The backend produced an accepted artifact.
    ///
    /// @param artifact the artifact, not null
    /// @param integrityChecked whether integrity checks ran on it
    record Success(RenderedArtifact artifact, boolean integrityChecked) implements AttemptOutcome {
        public Success {
            Objects.requireNonNull(artifact, "artifact must not be null");
        }
    }

    /// The attempt failed or its artifact was rejected.
    ///
    /// @param failure what went wrong, not null
    record Failure(AttemptFailure failure) implements AttemptOutcome {
        public Failure {
            Objects.requireNonNull(failure, "failure must not be null");
        }
    }

    static AttemptOutcome success(RenderedArtifact artifact, boolean integrityChecked) {
        return new Success(artifact, integrityChecked);
    }

    static AttemptOutcome failure(AttemptFailure failure) {
        return new Failure(failure);
    }
}
