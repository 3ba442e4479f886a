package io.isoflow.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FlowchartTest {

    private Flowchart flowchart;

    @BeforeEach
    void setUp() {
        flowchart = new Flowchart("Orders");
        flowchart.addNode(Node.start());
        flowchart.addNode(new Node("STEP_1", NodeCategory.PROCESS, "Pack", 0.8));
        flowchart.addNode(Node.end());
        flowchart.addConnection(Connection.sequential(Node.START_ID, "STEP_1"));
        flowchart.addConnection(Connection.sequential("STEP_1", Node.END_ID));
    }

    @Test
    void shouldRejectConnectionToMissingNode() {
        assertThatThrownBy(() -> flowchart.addConnection(Connection.sequential("STEP_1", "STEP_9")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("STEP_9");
        assertThatThrownBy(() -> flowchart.addConnection(Connection.sequential("NOPE", "STEP_1")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("NOPE");
    }

    @Test
    void shouldRejectDuplicateNodeId() {
        assertThatThrownBy(() -> flowchart.addNode(Node.end()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldDropEdgesWithRemovedNode() {
        assertThat(flowchart.removeNode("STEP_1")).isTrue();

        assertThat(flowchart.getNodeIds()).containsExactly(Node.START_ID, Node.END_ID);
        assertThat(flowchart.getConnections()).isEmpty();
        assertThat(flowchart.removeNode("STEP_1")).isFalse();
    }

    @Test
    void shouldKeepInsertionOrder() {
        assertThat(flowchart.getNodeIds()).containsExactly(Node.START_ID, "STEP_1", Node.END_ID);
        assertThat(flowchart.outgoing("STEP_1")).extracting(Connection::toId).containsExactly("END");
        assertThat(flowchart.incoming("STEP_1")).extracting(Connection::fromId).containsExactly("START");
    }

    @Test
    void shouldAllowReclassification() {
        Node node = flowchart.getNode("STEP_1").orElseThrow();
        node.reclassify(NodeCategory.CONNECTOR);

        assertThat(flowchart.getNode("STEP_1").orElseThrow().getCategory())
                .isEqualTo(NodeCategory.CONNECTOR);
    }

    @Test
    void shouldDecideTerminatorRoleByIdOrLabel() {
        Node begin = new Node("T1", NodeCategory.TERMINATOR, "Begin", 0.9);
        Node finish = new Node("T2", NodeCategory.TERMINATOR, "Finish", 0.9);

        assertThat(begin.isStartTerminator()).isTrue();
        assertThat(finish.isEndTerminator()).isTrue();
        assertThat(Node.start().isStartTerminator()).isTrue();
        assertThat(new Node("X", NodeCategory.PROCESS, "Start", 0.9).isStartTerminator()).isFalse();
    }

    @Test
    void shouldRejectConfidenceOutOfRange() {
        assertThatThrownBy(() -> new Node("X", NodeCategory.PROCESS, "x", 1.2))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
