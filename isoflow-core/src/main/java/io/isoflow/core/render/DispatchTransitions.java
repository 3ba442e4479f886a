package io.isoflow.core.render;

import io.isoflow.core.render.AttemptOutcome.Failure;
import io.isoflow.core.render.AttemptOutcome.Success;
import io.isoflow.core.render.DispatchState.AllFailed;
import io.isoflow.core.render.DispatchState.Attempting;
import io.isoflow.core.render.DispatchState.Retrying;
import io.isoflow.core.render.DispatchState.Selecting;
import io.isoflow.core.render.DispatchState.Succeeded;
import java.util.List;
import java.util.Objects;

/// Transition function of the render dispatch state machine.
///
/// Pure: the next state depends only on the current state, the attempt outcome and the
/// quality mode. No I/O happens here; {@link RenderDispatcher} performs the attempts.
///
/// ### Transitions
/// | From         | Outcome  | To                                                    |
/// |--------------|----------|-------------------------------------------------------|
/// | Selecting    | (none)   | Attempting(head), or AllFailed when empty or forbidden |
/// | Attempting   | Success  | Succeeded                                             |
/// | Attempting   | Failure  | Retrying                                              |
/// | Retrying     | (none)   | same as Selecting over the remaining backends         |
///
/// Under {@link QualityMode#CERTIFIED_ONLY} a backend below the certified tier is never
/// attempted: reaching one ends the dispatch in AllFailed.
public final class DispatchTransitions {

    private final QualityMode qualityMode;

    public DispatchTransitions(QualityMode qualityMode) {
        this.qualityMode = Objects.requireNonNull(qualityMode, "qualityMode must not be null");
    }

    /// Returns the initial state for an ordered candidate list.
    public DispatchState start(List<BackendId> candidates) {
        return new Selecting(candidates);
    }

    /// Computes the next state.
    ///
    /// @param state current state, not null and not terminal
    /// @param outcome outcome of the attempt; required from {@link Attempting}, ignored
    ///     otherwise and may be null there
    /// @return the next state, never null
    /// @throws IllegalStateException if `state` is terminal, or if `outcome` is missing
    ///     for an {@link Attempting} state
    public DispatchState next(DispatchState state, AttemptOutcome outcome) {
        Objects.requireNonNull(state, "state must not be null");
        if (state instanceof Selecting selecting) {
            return select(selecting.candidates());
        }
        if (state instanceof Retrying retrying) {
            return select(retrying.remaining());
        }
        if (state instanceof Attempting attempting) {
            if (outcome == null) {
                throw new IllegalStateException(
                        "Attempt on " + attempting.backend() + " needs an outcome");
            }
            if (outcome instanceof Success success) {
                return new Succeeded(
                        attempting.backend(), success.artifact(), success.integrityChecked());
            }
            Failure failure = (Failure) outcome;
            return new Retrying(attempting.backend(), failure.failure(), attempting.remaining());
        }
        throw new IllegalStateException("No transition from terminal state " + state);
    }

    private DispatchState select(List<BackendId> candidates) {
        if (candidates.isEmpty()) {
            return new AllFailed("No backend left to try");
        }
        BackendId head = candidates.get(0);
        if (!qualityMode.permits(head)) {
            return new AllFailed(
                    "Quality mode "
                            + qualityMode
                            + " forbids degrading to "
                            + head.getName()
                            + " ("
                            + head.getTier()
                            + ")");
        }
        return new Attempting(head, candidates.subList(1, candidates.size()));
    }
}
