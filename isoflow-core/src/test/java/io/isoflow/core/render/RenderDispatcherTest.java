package io.isoflow.core.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.isoflow.core.model.Connection;
import io.isoflow.core.model.Flowchart;
import io.isoflow.core.model.Node;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RenderDispatcherTest {

    private static final byte[] SVG = "<svg></svg>".getBytes(StandardCharsets.UTF_8);
    private static final Set<BackendId> ENGINES =
            EnumSet.of(BackendId.GRAPHVIZ, BackendId.D2, BackendId.MERMAID, BackendId.KROKI);

    @FunctionalInterface
    interface Behavior {
        RenderedArtifact render(OutputFormat format) throws RenderException, InterruptedException;
    }

    private static BackendAdapter adapter(BackendId id, Behavior behavior) {
        return new BackendAdapter() {
            @Override
            public BackendId id() {
                return id;
            }

            @Override
            public Set<OutputFormat> supportedFormats() {
                return EnumSet.allOf(OutputFormat.class);
            }

            @Override
            public RenderedArtifact render(
                    Flowchart flowchart, OutputFormat format, Duration timeout)
                    throws RenderException, InterruptedException {
                return behavior.render(format);
            }
        };
    }

    private static BackendAdapter working(BackendId id) {
        return adapter(id, format -> new RenderedArtifact(SVG, format));
    }

    private static BackendAdapter failing(BackendId id) {
        return adapter(
                id,
                format -> {
                    throw new BackendFailureException(id, id.getName() + " exited with 1");
                });
    }

    private Flowchart flowchart;
    private DefaultBackendRegistry registry;

    @BeforeEach
    void setUp() {
        flowchart = new Flowchart("Demo").addNode(Node.start()).addNode(Node.end());
        flowchart.addConnection(Connection.sequential(Node.START_ID, Node.END_ID));
        registry = new DefaultBackendRegistry();
    }

    private RenderDispatcher dispatcher(Set<BackendId> available) {
        return new RenderDispatcher(registry, () -> available);
    }

    private RenderRequest.Builder request() {
        return RenderRequest.builder(flowchart).format(OutputFormat.SVG);
    }

    @Test
    void shouldUseFirstAvailableBackend() throws Exception {
        registry.register(working(BackendId.GRAPHVIZ));

        RenderResult result = dispatcher(Set.of(BackendId.GRAPHVIZ)).dispatch(request().build());

        assertThat(result.resolvedBackend()).isEqualTo(BackendId.GRAPHVIZ);
        assertThat(result.format()).isEqualTo(OutputFormat.SVG);
        assertThat(result.fallbackChainTried()).containsExactly(BackendId.GRAPHVIZ);
        assertThat(result.integrityChecked()).isTrue();
        assertThat(result.isDegraded()).isFalse();
        assertThat(result.warnings()).isEmpty();
    }

    @Nested
    class Fallback {

        @Test
        void shouldEndOnHtmlWhenEveryEngineFails() throws Exception {
            ENGINES.forEach(id -> registry.register(failing(id)));

            RenderResult result = dispatcher(ENGINES).dispatch(request().build());

            assertThat(result.resolvedBackend()).isEqualTo(BackendId.HTML);
            assertThat(result.format()).isEqualTo(OutputFormat.HTML);
            assertThat(result.fallbackChainTried())
                    .containsExactly(
                            BackendId.GRAPHVIZ,
                            BackendId.D2,
                            BackendId.MERMAID,
                            BackendId.KROKI,
                            BackendId.HTML);
            assertThat(result.failures())
                    .extracting(AttemptFailure::errorType)
                    .containsOnly("BackendFailureException")
                    .hasSize(4);
            assertThat(result.warnings())
                    .hasSize(4)
                    .allMatch(w -> w.startsWith("Backend failed, falling back"));
            assertThat(result.isDegraded()).isTrue();
        }

        @Test
        void shouldAlwaysTerminateWithDefaultPolicy() throws Exception {
            List<BackendId> engines = List.copyOf(ENGINES);
            for (int mask = 0; mask < 1 << engines.size(); mask++) {
                registry = new DefaultBackendRegistry();
                BackendId expected = BackendId.HTML;
                for (int i = 0; i < engines.size(); i++) {
                    BackendId id = engines.get(i);
                    boolean fails = (mask & (1 << i)) != 0;
                    registry.register(fails ? failing(id) : working(id));
                    if (!fails && expected == BackendId.HTML) {
                        expected = id;
                    }
                }

                RenderResult result = dispatcher(ENGINES).dispatch(request().build());

                assertThat(result.resolvedBackend()).as("mask %d", mask).isEqualTo(expected);
            }
        }

        @Test
        void shouldFallBackWhenArtifactFailsIntegrityCheck() throws Exception {
            registry.register(
                    adapter(
                            BackendId.GRAPHVIZ,
                            format ->
                                    new RenderedArtifact(
                                            "Error: syntax".getBytes(StandardCharsets.UTF_8),
                                            format)));

            RenderResult result = dispatcher(Set.of(BackendId.GRAPHVIZ)).dispatch(request().build());

            assertThat(result.resolvedBackend()).isEqualTo(BackendId.HTML);
            assertThat(result.failures())
                    .singleElement()
                    .extracting(AttemptFailure::errorType)
                    .isEqualTo("ArtifactIntegrityException");
        }

        @Test
        void shouldAcceptUncheckedArtifactWhenChecksDisabled() throws Exception {
            registry.register(
                    adapter(
                            BackendId.GRAPHVIZ,
                            format ->
                                    new RenderedArtifact(
                                            "Error: syntax".getBytes(StandardCharsets.UTF_8),
                                            format)));
            RenderDispatcher lenient =
                    new RenderDispatcher(
                            registry,
                            () -> Set.of(BackendId.GRAPHVIZ),
                            new ArtifactIntegrityChecker(),
                            Duration.ofSeconds(5),
                            false);

            RenderResult result = lenient.dispatch(request().build());

            assertThat(result.resolvedBackend()).isEqualTo(BackendId.GRAPHVIZ);
            assertThat(result.integrityChecked()).isFalse();
        }

        @Test
        void shouldTreatRuntimeExceptionAsFailedAttempt() throws Exception {
            registry.register(
                    adapter(
                            BackendId.D2,
                            format -> {
                                throw new IllegalStateException("layout bug");
                            }));

            RenderResult result = dispatcher(Set.of(BackendId.D2)).dispatch(request().build());

            assertThat(result.resolvedBackend()).isEqualTo(BackendId.HTML);
            assertThat(result.failures().get(0).errorType()).isEqualTo("IllegalStateException");
            assertThat(result.failures().get(0).message()).isEqualTo("layout bug");
        }

        @Test
        void shouldKeepRequestWarningsFirst() throws Exception {
            registry.register(failing(BackendId.GRAPHVIZ));

            RenderResult result =
                    dispatcher(Set.of(BackendId.GRAPHVIZ))
                            .dispatch(request().warning("Low classification confidence").build());

            assertThat(result.warnings()).hasSize(2);
            assertThat(result.warnings().get(0)).isEqualTo("Low classification confidence");
        }
    }

    @Nested
    class Availability {

        @Test
        void shouldSkipUnavailableBackendsInAutoMode() throws Exception {
            BackendAdapter graphviz = mock(BackendAdapter.class);
            when(graphviz.id()).thenReturn(BackendId.GRAPHVIZ);
            registry.register(graphviz);

            RenderResult result = dispatcher(Set.of()).dispatch(request().build());

            assertThat(result.fallbackChainTried()).containsExactly(BackendId.HTML);
            assertThat(result.failures()).isEmpty();
            verify(graphviz, never()).render(any(), any(), any());
        }

        @Test
        void shouldRecordUnavailablePreferredBackend() throws Exception {
            RenderResult result =
                    dispatcher(Set.of()).dispatch(request().preferredBackend(BackendId.D2).build());

            assertThat(result.fallbackChainTried()).containsExactly(BackendId.D2, BackendId.HTML);
            assertThat(result.failures())
                    .singleElement()
                    .satisfies(
                            f -> {
                                assertThat(f.backend()).isEqualTo(BackendId.D2);
                                assertThat(f.errorType()).isEqualTo("BackendUnavailableException");
                            });
        }

        @Test
        void shouldTryPreferredBackendBeforePolicyOrder() throws Exception {
            registry.register(working(BackendId.GRAPHVIZ));
            registry.register(working(BackendId.MERMAID));

            RenderResult result =
                    dispatcher(ENGINES)
                            .dispatch(request().preferredBackend(BackendId.MERMAID).build());

            assertThat(result.resolvedBackend()).isEqualTo(BackendId.MERMAID);
            assertThat(result.fallbackChainTried()).containsExactly(BackendId.MERMAID);
        }

        @Test
        void shouldFailAttemptOnAvailableButUnregisteredBackend() throws Exception {
            RenderResult result = dispatcher(Set.of(BackendId.KROKI)).dispatch(request().build());

            assertThat(result.fallbackChainTried()).containsExactly(BackendId.KROKI, BackendId.HTML);
            assertThat(result.failures().get(0).message()).contains("No adapter registered");
        }

        @Test
        void shouldPassConfiguredTimeoutToAdapter() throws Exception {
            BackendAdapter kroki = mock(BackendAdapter.class);
            when(kroki.id()).thenReturn(BackendId.KROKI);
            when(kroki.render(any(), any(), any()))
                    .thenReturn(new RenderedArtifact(SVG, OutputFormat.SVG));
            registry.register(kroki);
            Duration timeout = Duration.ofSeconds(7);

            new RenderDispatcher(
                            registry,
                            () -> Set.of(BackendId.KROKI),
                            new ArtifactIntegrityChecker(),
                            timeout,
                            true)
                    .dispatch(request().build());

            verify(kroki).render(flowchart, OutputFormat.SVG, timeout);
        }
    }

    @Nested
    class Exhaustion {

        @Test
        void shouldExhaustInCertifiedModeWhenOnlyDraftRemains() {
            registry.register(failing(BackendId.GRAPHVIZ));
            RenderRequest certified =
                    request().qualityMode(QualityMode.CERTIFIED_ONLY).build();

            assertThatThrownBy(() -> dispatcher(Set.of(BackendId.GRAPHVIZ)).dispatch(certified))
                    .isInstanceOfSatisfying(
                            AllBackendsExhaustedException.class,
                            e -> {
                                assertThat(e.getChainTried()).containsExactly(BackendId.GRAPHVIZ);
                                assertThat(e.getFailures()).hasSize(1);
                                assertThat(e.getMessage()).contains("forbids");
                            });
        }

        @Test
        void shouldExhaustPolicyWithoutHtml() {
            registry.register(failing(BackendId.GRAPHVIZ));
            RenderRequest request =
                    request().fallbackPolicy(FallbackPolicy.withoutFallback(BackendId.GRAPHVIZ)).build();

            assertThatThrownBy(() -> dispatcher(Set.of(BackendId.GRAPHVIZ)).dispatch(request))
                    .isInstanceOf(AllBackendsExhaustedException.class)
                    .hasMessageContaining("No backend left to try");
        }

        @Test
        void shouldPropagateInterruption() {
            registry.register(
                    adapter(
                            BackendId.GRAPHVIZ,
                            format -> {
                                throw new InterruptedException("cancelled");
                            }));

            assertThatThrownBy(
                            () -> dispatcher(Set.of(BackendId.GRAPHVIZ)).dispatch(request().build()))
                    .isInstanceOf(InterruptedException.class);
        }
    }
}
