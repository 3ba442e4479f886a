package io.isoflow.core.extract;

import io.isoflow.core.model.WorkflowStep;
import java.util.List;

/// Turns raw process text into ordered, classified workflow steps.
///
/// Every implementation, heuristic or model-backed, populates each step's category and
/// confidence. Callers do not depend on which implementation produced the steps.
///
/// ### Contracts
/// - Blank input yields an empty list, never an exception
/// - Steps come back in source order with positive indices
/// - Decision steps keep exactly the branches found in the text; none are invented
///
/// @see HeuristicStepExtractor for the built-in implementation
public interface StepExtractor {

    /// Extracts steps from text.
    ///
    /// @param text the process text, not null
    /// @return ordered steps, never null, may be empty
    /// @throws ExtractionException if the implementation cannot produce a usable result
    List<WorkflowStep> extract(String text) throws ExtractionException;

    /// Returns a short name for logs and result metadata.
    default String getName() {
        return getClass().getSimpleName();
    }
}
