package io.isoflow.core.render;

import java.util.List;
import java.util.Objects;

/// States of one render dispatch.
///
/// ```
/// Selecting -> Attempting -> Succeeded
///                  |
///                  v
///              Retrying -> Attempting (next backend) ...
///                  |
///                  v
///              AllFailed
/// ```
///
/// {@link Succeeded} and {@link AllFailed} are terminal.
public sealed interface DispatchState {

    /// Returns true for {@link Succeeded} and {@link AllFailed}.
    default boolean isTerminal() {
        return this instanceof Succeeded || this instanceof AllFailed;
    }

    /// Choosing the next backend from `candidates`, in order.
    record Selecting(List<BackendId> candidates) implements DispatchState {
        public Selecting {
            candidates = List.copyOf(candidates);
        }
    }

    /// About to call `backend`; `remaining` are still to try after it.
    record Attempting(BackendId backend, List<BackendId> remaining) implements DispatchState {
        public Attempting {
            Objects.requireNonNull(backend, "backend must not be null");
            remaining = List.copyOf(remaining);
        }
    }

    /// `failed` did not deliver; `remaining` are still to try.
    record Retrying(BackendId failed, AttemptFailure failure, List<BackendId> remaining)
            implements DispatchState {
        public Retrying {
            Objects.requireNonNull(failed, "failed must not be null");
            Objects.requireNonNull(failure, "failure must not be null");
            remaining = List.copyOf(remaining);
        }
    }

    /// `backend` delivered `artifact`.
    record Succeeded(BackendId backend, RenderedArtifact artifact, boolean integrityChecked)
            implements DispatchState {
        public Succeeded {
            Objects.requireNonNull(backend, "backend must not be null");
            Objects.requireNonNull(artifact, "artifact must not be null");
        }
    }

    /// No backend delivered.
    record AllFailed(String reason) implements DispatchState {
        public AllFailed {
            Objects.requireNonNull(reason, "reason must not be null");
        }
    }
}
