package io.isoflow.core.render;

import io.isoflow.core.render.DispatchState.AllFailed;
import io.isoflow.core.render.DispatchState.Attempting;
import io.isoflow.core.render.DispatchState.Retrying;
import io.isoflow.core.render.DispatchState.Succeeded;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Renders a flowchart with the best available backend, degrading along a fallback policy.
///
/// Drives the {@link DispatchState} machine through {@link DispatchTransitions}: each
/// {@link Attempting} state calls one adapter with the configured timeout, and each
/// {@link Retrying} state records the failure as a warning before the next backend is
/// selected.
///
/// ### Candidate order
/// - Auto request: the policy order, keeping only backends the {@link CapabilityDetector}
///   reports available
/// - Explicit request: the preferred backend first, even when not available (the attempt
///   then fails as unavailable), followed by the available rest of the policy
///
/// {@link BackendId#HTML} needs nothing installed and is always treated as available.
///
/// ### Attempt failures
/// Adapter exceptions, integrity rejections and unexpected runtime exceptions all become
/// an {@link AttemptFailure} and trigger the next backend. Only exhaustion of the chain
/// reaches the caller, as {@link AllBackendsExhaustedException}.
///
/// @implNote Thread-safe. Holds no lock while an adapter blocks; concurrent dispatches
/// are limited by the caller.
public class RenderDispatcher {

    private static final Logger logger = Logger.getLogger(RenderDispatcher.class.getName());

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final BackendRegistry registry;
    private final CapabilityDetector capabilityDetector;
    private final ArtifactIntegrityChecker integrityChecker;
    private final Duration timeout;
    private final boolean strictArtifactChecks;

    public RenderDispatcher(BackendRegistry registry, CapabilityDetector capabilityDetector) {
        this(registry, capabilityDetector, new ArtifactIntegrityChecker(), DEFAULT_TIMEOUT, true);
    }

    public RenderDispatcher(
            BackendRegistry registry,
            CapabilityDetector capabilityDetector,
            ArtifactIntegrityChecker integrityChecker,
            Duration timeout,
            boolean strictArtifactChecks) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.capabilityDetector =
                Objects.requireNonNull(capabilityDetector, "capabilityDetector must not be null");
        this.integrityChecker =
                Objects.requireNonNull(integrityChecker, "integrityChecker must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        this.strictArtifactChecks = strictArtifactChecks;
    }

    /// Renders the request.
    ///
    /// @param request render request, not null
    /// @return the artifact with the chain tried and all warnings, never null
    /// @throws AllBackendsExhaustedException if no backend delivered; only possible when
    ///     the policy lacks HTML or the quality mode forbids it
    /// @throws InterruptedException if interrupted while a backend runs; external
    ///     processes are killed before this propagates
    public RenderResult dispatch(RenderRequest request)
            throws AllBackendsExhaustedException, InterruptedException {
        Objects.requireNonNull(request, "request must not be null");

        Set<BackendId> available = capabilityDetector.listAvailable();
        List<BackendId> candidates = candidates(request, available);
        logger.fine(
                "Render candidates for '"
                        + request.getFlowchart().getTitle()
                        + "': "
                        + candidates);

        DispatchTransitions transitions = new DispatchTransitions(request.getQualityMode());
        List<BackendId> chainTried = new ArrayList<>();
        List<AttemptFailure> failures = new ArrayList<>();
        List<String> warnings = new ArrayList<>(request.getWarnings());

        DispatchState state = transitions.start(candidates);
        while (!state.isTerminal()) {
            AttemptOutcome outcome = null;
            if (state instanceof Attempting attempting) {
                chainTried.add(attempting.backend());
                outcome = attempt(attempting.backend(), request, available);
            } else if (state instanceof Retrying retrying) {
                failures.add(retrying.failure());
                String warning = "Backend failed, falling back: " + retrying.failure();
                warnings.add(warning);
                logger.warning(warning);
            }
            state = transitions.next(state, outcome);
        }

        if (state instanceof Succeeded succeeded) {
            RenderedArtifact artifact = succeeded.artifact();
            logger.info(
                    "Rendered '"
                            + request.getFlowchart().getTitle()
                            + "' with "
                            + succeeded.backend().getName()
                            + " ("
                            + artifact.size()
                            + " bytes "
                            + artifact.format()
                            + ")");
            return new RenderResult(
                    artifact.bytes(),
                    succeeded.backend(),
                    artifact.format(),
                    chainTried,
                    succeeded.integrityChecked(),
                    warnings,
                    failures);
        }

        AllFailed allFailed = (AllFailed) state;
        logger.warning("Render failed: " + allFailed.reason() + "; tried " + chainTried);
        throw new AllBackendsExhaustedException(allFailed.reason(), chainTried, failures);
    }

    /// Returns the ordered backends a request will walk through.
    List<BackendId> candidates(RenderRequest request, Set<BackendId> available) {
        List<BackendId> candidates = new ArrayList<>();
        Optional<BackendId> preferred = request.getPreferredBackend();
        preferred.ifPresent(candidates::add);
        for (BackendId id : request.getFallbackPolicy().order()) {
            if (!candidates.contains(id) && isAvailable(id, available)) {
                candidates.add(id);
            }
        }
        return candidates;
    }

    private AttemptOutcome attempt(
            BackendId backend, RenderRequest request, Set<BackendId> available)
            throws InterruptedException {
        if (!isAvailable(backend, available)) {
            return AttemptOutcome.failure(
                    AttemptFailure.of(
                            backend,
                            new BackendUnavailableException(
                                    backend, backend.getName() + " is not available")));
        }
        Optional<BackendAdapter> adapter = registry.get(backend);
        if (adapter.isEmpty()) {
            return AttemptOutcome.failure(
                    AttemptFailure.of(
                            backend,
                            new BackendUnavailableException(
                                    backend, "No adapter registered for " + backend.getName())));
        }

        try {
            RenderedArtifact artifact =
                    adapter.get().render(request.getFlowchart(), request.getFormat(), timeout);
            if (strictArtifactChecks) {
                integrityChecker.check(backend, artifact);
            }
            return AttemptOutcome.success(artifact, strictArtifactChecks);
        } catch (RenderException e) {
            return AttemptOutcome.failure(AttemptFailure.of(backend, e));
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Unexpected error from " + backend.getName(), e);
            return AttemptOutcome.failure(AttemptFailure.of(backend, e));
        }
    }

    private static boolean isAvailable(BackendId id, Set<BackendId> available) {
        return id == BackendId.HTML || available.contains(id);
    }
}
