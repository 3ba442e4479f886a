package io.isoflow.core.render.source;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class MermaidSourceTest {

    private final MermaidSource source = new MermaidSource();

    @Test
    void shouldGenerateTopDownFlowchart() {
        String mermaid = source.generate(SampleFlowcharts.login());

        assertThat(mermaid).startsWith("---\ntitle: Login #quot;v2#quot;\n---\nflowchart TD\n");
        assertThat(mermaid).contains("  START([\"Start\"])");
        assertThat(mermaid).contains("  STEP_1[/\"Read the password\"/]");
        assertThat(mermaid).contains("  STEP_2{\"Is it valid?\"}");
    }

    @Test
    void shouldPrefixReservedIds() {
        String mermaid = source.generate(SampleFlowcharts.login());

        assertThat(mermaid).contains("  node_END([\"End\"])");
        assertThat(mermaid).contains("  STEP_2 -->|\"Yes\"| node_END");
        assertThat(MermaidSource.sanitizeId("step-1.a")).isEqualTo("step_1_a");
        assertThat(MermaidSource.sanitizeId("class")).isEqualTo("node_class");
    }

    @Test
    void shouldDashLoopbacksAndMarkUncertainNodes() {
        String mermaid = source.generate(SampleFlowcharts.login());

        assertThat(mermaid).contains("  STEP_2 -.->|\"No\"| STEP_1");
        assertThat(mermaid).contains("  class STEP_1 uncertain");
        assertThat(mermaid).contains("classDef uncertain");
    }
}
