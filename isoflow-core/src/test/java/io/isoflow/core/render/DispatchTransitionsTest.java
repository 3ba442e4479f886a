package io.isoflow.core.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.isoflow.core.render.DispatchState.AllFailed;
import io.isoflow.core.render.DispatchState.Attempting;
import io.isoflow.core.render.DispatchState.Retrying;
import io.isoflow.core.render.DispatchState.Selecting;
import io.isoflow.core.render.DispatchState.Succeeded;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DispatchTransitionsTest {

    private static final RenderedArtifact SVG =
            new RenderedArtifact("<svg/>".getBytes(StandardCharsets.UTF_8), OutputFormat.SVG);
    private static final AttemptFailure CRASH =
            new AttemptFailure(BackendId.GRAPHVIZ, "BackendFailureException", "exit 1");

    private final DispatchTransitions transitions =
            new DispatchTransitions(QualityMode.DRAFT_ALLOWED);

    @Test
    void shouldStartBySelecting() {
        assertThat(transitions.start(List.of(BackendId.GRAPHVIZ, BackendId.HTML)))
                .isEqualTo(new Selecting(List.of(BackendId.GRAPHVIZ, BackendId.HTML)));
    }

    @Nested
    class Selection {

        @Test
        void shouldAttemptHeadOfCandidates() {
            DispatchState next =
                    transitions.next(
                            new Selecting(List.of(BackendId.GRAPHVIZ, BackendId.HTML)), null);

            assertThat(next).isEqualTo(new Attempting(BackendId.GRAPHVIZ, List.of(BackendId.HTML)));
        }

        @Test
        void shouldFailWhenNoCandidates() {
            DispatchState next = transitions.next(new Selecting(List.of()), null);

            assertThat(next).isInstanceOf(AllFailed.class);
            assertThat(next.isTerminal()).isTrue();
        }

        @Test
        void shouldRefuseDraftBackendInCertifiedMode() {
            DispatchTransitions certified = new DispatchTransitions(QualityMode.CERTIFIED_ONLY);

            DispatchState next = certified.next(new Selecting(List.of(BackendId.HTML)), null);

            assertThat(next).isInstanceOf(AllFailed.class);
            assertThat(((AllFailed) next).reason()).contains("html");
        }
    }

    @Nested
    class Attempts {

        private final Attempting attempting =
                new Attempting(BackendId.GRAPHVIZ, List.of(BackendId.HTML));

        @Test
        void shouldSucceedOnSuccessfulAttempt() {
            DispatchState next = transitions.next(attempting, AttemptOutcome.success(SVG, true));

            assertThat(next).isEqualTo(new Succeeded(BackendId.GRAPHVIZ, SVG, true));
            assertThat(next.isTerminal()).isTrue();
        }

        @Test
        void shouldRetryRemainingOnFailure() {
            DispatchState next = transitions.next(attempting, AttemptOutcome.failure(CRASH));

            assertThat(next)
                    .isEqualTo(new Retrying(BackendId.GRAPHVIZ, CRASH, List.of(BackendId.HTML)));
            assertThat(transitions.next(next, null))
                    .isEqualTo(new Attempting(BackendId.HTML, List.of()));
        }

        @Test
        void shouldRequireOutcome() {
            assertThatThrownBy(() -> transitions.next(attempting, null))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void shouldRejectTransitionFromTerminalState() {
        assertThatThrownBy(() -> transitions.next(new AllFailed("done"), null))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(
                        () -> transitions.next(new Succeeded(BackendId.HTML, SVG, false), null))
                .isInstanceOf(IllegalStateException.class);
    }
}
