package io.isoflow.core.pipeline;

import io.isoflow.core.detect.WorkflowCandidate;
import java.util.Objects;

/// Outcome of one candidate in a {@link BatchProcessor} run.
///
/// ### Permitted Subtypes
/// - {@link Processed} - the pipeline produced a result, possibly with warnings or a
///   failed render
/// - {@link Failed} - no flowchart could be built: no steps, timeout or unexpected error
public sealed interface BatchOutcome {

    WorkflowCandidate candidate();

    /// @param result the pipeline result, not null
    record Processed(CandidateResult result) implements BatchOutcome {
        public Processed {
            Objects.requireNonNull(result, "result must not be null");
        }

        @Override
        public WorkflowCandidate candidate() {
            return result.getCandidate();
        }
    }

    /// @param candidate the candidate that failed, not null
    /// @param error the cause, not null
    record Failed(WorkflowCandidate candidate, Exception error) implements BatchOutcome {
        public Failed {
            Objects.requireNonNull(candidate, "candidate must not be null");
            Objects.requireNonNull(error, "error must not be null");
        }
    }
}
