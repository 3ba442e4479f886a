package io.isoflow.core.extract;

import io.isoflow.core.model.WorkflowStep;
import java.util.List;

/// Parses a model-generated step listing into {@link WorkflowStep}s.
///
/// Keeps JSON handling out of {@code isoflow-core}. The Jackson implementation lives in
/// {@code isoflow-serialization} as {@code JacksonStepResponseParser}.
///
/// ### Expected shape (JSON)
/// ```json
/// [
///   {"index": 1, "text": "Start", "category": "TERMINATOR", "confidence": 0.95},
///   {"index": 2, "text": "Is the form complete?", "category": "DECISION", "confidence": 0.9,
///    "branches": [{"label": "Yes", "text": "Continue"},
///                 {"label": "No", "text": "Return to step 1", "targetStep": 1}]}
/// ]
/// ```
public interface StepResponseParser {

    /// Parses a raw response.
    ///
    /// The content may be wrapped in markdown code fences; implementations strip them.
    ///
    /// @param content raw model response, not null
    /// @return steps in order, never null, may be empty
    /// @throws ExtractionException if the content is not a valid step list
    List<WorkflowStep> parse(String content) throws ExtractionException;
}
