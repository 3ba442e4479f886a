package io.isoflow.core.render;

import java.io.Serial;
import java.util.List;

/// Terminal dispatch failure: no backend in the chain produced an accepted artifact.
///
/// Only possible when the policy lacks the HTML fallback, or when
/// {@link QualityMode#CERTIFIED_ONLY} forbids reaching it.
public class AllBackendsExhaustedException extends RenderException {

    @Serial private static final long serialVersionUID = -1862360372207725945L;

    private final transient List<BackendId> chainTried;
    private final transient List<AttemptFailure> failures;

    public AllBackendsExhaustedException(
            String reason, List<BackendId> chainTried, List<AttemptFailure> failures) {
        super(null, reason + "; tried " + chainTried + ", failures " + failures);
        this.chainTried = List.copyOf(chainTried);
        this.failures = List.copyOf(failures);
    }

    /// Returns the backends attempted, in order.
    public List<BackendId> getChainTried() {
        return chainTried;
    }

    /// Returns one failure per attempted backend, in order.
    public List<AttemptFailure> getFailures() {
        return failures;
    }
}
