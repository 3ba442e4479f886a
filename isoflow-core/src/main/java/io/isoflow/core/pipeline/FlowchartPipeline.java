package io.isoflow.core.pipeline;

import io.isoflow.core.build.GraphBuilder;
import io.isoflow.core.detect.CrossReference;
import io.isoflow.core.detect.CrossReferenceResolver;
import io.isoflow.core.detect.WorkflowBoundaryDetector;
import io.isoflow.core.detect.WorkflowCandidate;
import io.isoflow.core.extract.ExtractionException;
import io.isoflow.core.extract.StepExtractor;
import io.isoflow.core.model.Flowchart;
import io.isoflow.core.model.WorkflowStep;
import io.isoflow.core.quality.QualityAssessment;
import io.isoflow.core.quality.QualityGate;
import io.isoflow.core.render.AllBackendsExhaustedException;
import io.isoflow.core.render.RenderDispatcher;
import io.isoflow.core.render.RenderResult;
import io.isoflow.core.validate.FlowchartValidator;
import io.isoflow.core.validate.ValidationException;
import io.isoflow.core.validate.ValidationResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Runs text through detection, extraction, graph building, validation and rendering.
///
/// Every stage before rendering is synchronous and free of shared state, so one pipeline
/// instance may serve many threads. Rendering is the only blocking stage; callers that
/// run candidates in parallel bound it themselves (see {@link BatchProcessor}).
///
/// ### Stages
/// 1. {@link #detect(String)} splits a document into workflow candidates
/// 2. {@link #analyze(WorkflowCandidate, CrossReferenceResolver)} extracts, builds and
///    validates one candidate
/// 3. {@link #render(CandidateResult, RenderOptions)} renders an analysed candidate,
///    refusing a flowchart with validation errors
///
/// @see BatchProcessor for parallel document processing
public class FlowchartPipeline {

    private static final Logger logger = Logger.getLogger(FlowchartPipeline.class.getName());

    private final WorkflowBoundaryDetector detector;
    private final StepExtractor extractor;
    private final GraphBuilder builder;
    private final FlowchartValidator validator;
    private final RenderDispatcher dispatcher;
    private final QualityGate qualityGate;

    public FlowchartPipeline(
            WorkflowBoundaryDetector detector,
            StepExtractor extractor,
            GraphBuilder builder,
            FlowchartValidator validator,
            RenderDispatcher dispatcher,
            QualityGate qualityGate) {
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.builder = Objects.requireNonNull(builder, "builder must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.qualityGate = Objects.requireNonNull(qualityGate, "qualityGate must not be null");
    }

    /// Splits a document into workflow candidates.
    public List<WorkflowCandidate> detect(String document) {
        return detector.detect(document);
    }

    /// Extracts steps from a single workflow text and builds its flowchart.
    ///
    /// @param text process text, not null
    /// @param title flowchart title, not null
    /// @return the flowchart, never null
    /// @throws ExtractionException if the text yields no steps
    public Flowchart toFlowchart(String text, String title) throws ExtractionException {
        return builder.build(extractSteps(text, title), title);
    }

    /// Extracts, builds and validates one candidate.
    ///
    /// @param candidate the candidate, not null
    /// @param resolver cross-reference index of the candidate's document, not null
    /// @return the analysed candidate without render, never null
    /// @throws ExtractionException if the candidate yields no steps
    public CandidateResult analyze(WorkflowCandidate candidate, CrossReferenceResolver resolver)
            throws ExtractionException {
        Objects.requireNonNull(candidate, "candidate must not be null");
        Objects.requireNonNull(resolver, "resolver must not be null");

        List<WorkflowStep> steps = extractSteps(candidate.text(), candidate.title());
        Flowchart flowchart = builder.build(steps, candidate.title());
        ValidationResult validation = validator.validate(flowchart);

        List<CrossReference> references = new ArrayList<>();
        for (WorkflowStep step : steps) {
            references.addAll(resolver.resolveAll(step.getRawText()));
        }

        List<String> warnings = new ArrayList<>(candidate.warnings());
        for (CrossReference reference : references) {
            if (!reference.isResolved()) {
                warnings.add("Unresolved reference to section " + reference.section());
            }
        }
        warnings.addAll(validation.warningMessages());

        logger.info(
                "Analysed '"
                        + candidate.title()
                        + "': "
                        + steps.size()
                        + " steps, "
                        + flowchart.nodeCount()
                        + " nodes, "
                        + validation.errors().size()
                        + " errors, "
                        + validation.warnings().size()
                        + " warnings");

        return CandidateResult.builder()
                .candidate(candidate)
                .steps(steps)
                .flowchart(flowchart)
                .validation(validation)
                .crossReferences(references)
                .warnings(warnings)
                .quality(qualityGate.evaluate(candidate.confidence(), validation))
                .build();
    }

    /// Renders an analysed candidate.
    ///
    /// Rendering failures do not escape: a flowchart with validation errors is refused
    /// with a {@link ValidationException}, and an exhausted fallback chain gives an
    /// {@link AllBackendsExhaustedException}; both are attached to the returned result.
    ///
    /// @param analysed result of {@link #analyze}, not null
    /// @param options render settings, not null
    /// @return the result with render or render failure, never null
    /// @throws InterruptedException if interrupted while a backend runs
    public CandidateResult render(CandidateResult analysed, RenderOptions options)
            throws InterruptedException {
        Objects.requireNonNull(analysed, "analysed must not be null");
        Objects.requireNonNull(options, "options must not be null");

        double confidence = analysed.getCandidate().confidence();
        ValidationResult validation = analysed.getValidation();
        try {
            RenderResult render = render(analysed.getFlowchart(), validation, options);
            QualityAssessment quality = qualityGate.evaluate(confidence, validation, render);
            return analysed.toBuilder().render(render).quality(quality).build();
        } catch (ValidationException e) {
            logger.warning(e.getMessage());
            return analysed.toBuilder().renderFailure(e).build();
        } catch (AllBackendsExhaustedException e) {
            QualityAssessment quality =
                    qualityGate.evaluateFailedRender(confidence, validation, e);
            return analysed.toBuilder().renderFailure(e).quality(quality).build();
        }
    }

    /// Renders a flowchart whose validation has no errors.
    ///
    /// @param flowchart the flowchart, not null
    /// @param validation its validation, not null
    /// @param options render settings, not null
    /// @return the render result, never null
    /// @throws ValidationException if `validation` has errors
    /// @throws AllBackendsExhaustedException if no backend delivered
    /// @throws InterruptedException if interrupted while a backend runs
    public RenderResult render(
            Flowchart flowchart, ValidationResult validation, RenderOptions options)
            throws ValidationException, AllBackendsExhaustedException, InterruptedException {
        if (!validation.isValid()) {
            throw new ValidationException(flowchart.getTitle(), validation);
        }
        return dispatcher.dispatch(options.toRequest(flowchart, validation.warningMessages()));
    }

    /// Runs {@link #analyze} then {@link #render(CandidateResult, RenderOptions)}.
    public CandidateResult process(
            WorkflowCandidate candidate, CrossReferenceResolver resolver, RenderOptions options)
            throws ExtractionException, InterruptedException {
        return render(analyze(candidate, resolver), options);
    }

    private List<WorkflowStep> extractSteps(String text, String title) throws ExtractionException {
        List<WorkflowStep> steps = extractor.extract(text);
        if (steps.isEmpty()) {
            throw new ExtractionException("No workflow steps found in '" + title + "'");
        }
        logger.fine(
                "Extracted "
                        + steps.size()
                        + " steps from '"
                        + title
                        + "' with "
                        + extractor.getName());
        return steps;
    }
}
