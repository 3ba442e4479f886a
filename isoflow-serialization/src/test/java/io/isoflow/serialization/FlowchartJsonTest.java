package io.isoflow.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.isoflow.core.model.Branch;
import io.isoflow.core.model.Connection;
import io.isoflow.core.model.ConnectionKind;
import io.isoflow.core.model.Flowchart;
import io.isoflow.core.model.Node;
import io.isoflow.core.model.NodeCategory;
import io.isoflow.core.model.StepTarget;
import io.isoflow.core.model.WorkflowStep;
import io.isoflow.core.validate.IssueKind;
import io.isoflow.core.validate.ValidationIssue;
import io.isoflow.core.validate.ValidationResult;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FlowchartJsonTest {

    private final ObjectMapper mapper = FlowchartJson.createMapper();

    private Flowchart flowchart;

    @BeforeEach
    void setUp() {
        flowchart = new Flowchart("Password reset");
        flowchart.addNode(Node.start());
        flowchart.addNode(new Node("STEP_1", NodeCategory.INPUT_OUTPUT, "Enter the email", 0.85));
        flowchart.addNode(new Node("STEP_2", NodeCategory.DECISION, "Is the email known?", 0.9));
        flowchart.addNode(Node.end());
        flowchart.addConnection(Connection.sequential(Node.START_ID, "STEP_1"));
        flowchart.addConnection(Connection.sequential("STEP_1", "STEP_2"));
        flowchart.addConnection(Connection.branch("STEP_2", Node.END_ID, "Yes"));
        flowchart.addConnection(Connection.loopback("STEP_2", "STEP_1", "No"));
    }

    @Nested
    class Flowcharts {

        @Test
        void shouldWriteNodesAndConnectionsAsArrays() throws Exception {
            JsonNode json = mapper.readTree(FlowchartJson.toJson(flowchart));

            assertThat(json.get("title").asText()).isEqualTo("Password reset");
            assertThat(json.get("nodes")).hasSize(4);
            assertThat(json.get("nodes").get(1).get("category").asText())
                    .isEqualTo("INPUT_OUTPUT");
            assertThat(json.get("connections").get(3).get("kind").asText())
                    .isEqualTo("LOOPBACK");
            assertThat(json.get("connections").get(0).get("label").asText()).isEmpty();
        }

        @Test
        void shouldRestoreEquivalentFlowchart() {
            Flowchart restored = FlowchartJson.fromJson(FlowchartJson.toJson(flowchart));

            assertThat(restored.getTitle()).isEqualTo("Password reset");
            assertThat(restored.getNodeIds()).isEqualTo(flowchart.getNodeIds());
            assertThat(restored.getConnections()).isEqualTo(flowchart.getConnections());
            assertThat(restored.getNode("STEP_1").orElseThrow().getConfidence()).isEqualTo(0.85);
        }

        @Test
        void shouldAcceptConnectionsBeforeNodes() {
            String json =
                    """
                    {"connections": [{"from": "START", "to": "END"}],
                     "title": "Reordered",
                     "nodes": [{"id": "START", "category": "TERMINATOR", "label": "Start"},
                               {"id": "END", "category": "TERMINATOR", "label": "End"}]}
                    """;

            Flowchart restored = FlowchartJson.fromJson(json);

            assertThat(restored.getConnections())
                    .singleElement()
                    .satisfies(c -> assertThat(c.kind()).isEqualTo(ConnectionKind.SEQUENTIAL));
            assertThat(restored.getNode("START").orElseThrow().getConfidence()).isEqualTo(1.0);
        }

        @Test
        void shouldRejectConnectionToUnknownNode() {
            String json =
                    """
                    {"title": "Dangling",
                     "nodes": [{"id": "START", "category": "TERMINATOR"}],
                     "connections": [{"from": "START", "to": "STEP_9"}]}
                    """;

            assertThatThrownBy(() -> FlowchartJson.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Invalid flowchart");
        }

        @Test
        void shouldRejectUnknownCategory() {
            String json =
                    """
                    {"title": "Odd", "nodes": [{"id": "A", "category": "CLOUD"}]}
                    """;

            assertThatThrownBy(() -> FlowchartJson.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldRequireTitle() {
            assertThatThrownBy(() -> FlowchartJson.fromJson("{\"nodes\": []}"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Missing required field 'title'");
        }
    }

    @Nested
    class Steps {

        @Test
        void shouldRoundTripStepsWithBranchesAndJumps() {
            WorkflowStep decision =
                    WorkflowStep.builder()
                            .index(2)
                            .rawText("Is the email known?")
                            .text("Is the email known?")
                            .category(NodeCategory.DECISION)
                            .confidence(0.9)
                            .branch(new Branch("Yes", "send the link", StepTarget.end()))
                            .branch(new Branch("No", "ask again", StepTarget.step(1)))
                            .build();
            WorkflowStep retry =
                    WorkflowStep.builder()
                            .index(3)
                            .rawText("Return to step 1")
                            .text("Return to step 1")
                            .jumpTarget(StepTarget.step(1))
                            .build();

            String json = FlowchartJson.stepsToJson(List.of(decision, retry));
            List<WorkflowStep> restored = FlowchartJson.stepsFromJson(json);

            assertThat(restored).containsExactly(decision, retry);
        }

        @Test
        void shouldWriteTargetsAsNumbersOrKeywords() throws Exception {
            WorkflowStep step =
                    WorkflowStep.builder()
                            .index(1)
                            .rawText("Check the stock")
                            .text("Check the stock")
                            .branch(new Branch("Yes", "ship", StepTarget.end()))
                            .branch(new Branch("No", "reorder", StepTarget.step(4)))
                            .build();

            JsonNode json = mapper.readTree(FlowchartJson.stepsToJson(List.of(step))).get(0);

            assertThat(json.get("jumpTarget").asText()).isEqualTo("next");
            assertThat(json.get("branches").get(0).get("target").asText()).isEqualTo("end");
            assertThat(json.get("branches").get(1).get("target").asInt()).isEqualTo(4);
            assertThat(json.has("decision")).isFalse();
            assertThat(json.get("branches").get(0).has("implicit")).isFalse();
        }

        @Test
        void shouldRejectNonPositiveStepTarget() {
            String json =
                    """
                    [{"index": 1, "rawText": "Loop", "text": "Loop", "jumpTarget": 0}]
                    """;

            assertThatThrownBy(() -> FlowchartJson.stepsFromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Step target must be positive");
        }
    }

    @Test
    void shouldWriteValidationResult() throws Exception {
        ValidationResult result =
                ValidationResult.of(
                        List.of(
                                ValidationIssue.of(
                                        IssueKind.ORPHAN_NODE, "STEP_4", "Orphan node STEP_4")));

        JsonNode json = mapper.readTree(FlowchartJson.toJson(result));

        assertThat(json.get("errors")).isEmpty();
        assertThat(json.get("warnings").get(0).get("kind").asText()).isEqualTo("ORPHAN_NODE");
        assertThat(json.get("warnings").get(0).get("nodeIds").get(0).asText())
                .isEqualTo("STEP_4");
    }
}
