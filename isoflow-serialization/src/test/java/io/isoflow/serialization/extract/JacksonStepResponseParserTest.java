package io.isoflow.serialization.extract;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.isoflow.core.extract.ExtractionException;
import io.isoflow.core.model.NodeCategory;
import io.isoflow.core.model.StepTarget;
import io.isoflow.core.model.WorkflowStep;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class JacksonStepResponseParserTest {

    private static final String STEPS =
            """
            [
              {"index": 1, "text": "Receive the claim", "category": "input/output",
               "confidence": 0.9},
              {"index": 2, "text": "Is the claim complete?", "category": "decision",
               "branches": [
                 {"label": "Yes", "text": "continue", "targetStep": 3},
                 {"label": "No", "text": "reject the claim", "targetStep": "end"}
               ]},
              {"index": 3, "text": "Pay the claim", "jumpTo": "end"}
            ]
            """;

    private final JacksonStepResponseParser parser =
            new JacksonStepResponseParser(new ObjectMapper());

    @Test
    void shouldParseFencedArray() throws Exception {
        List<WorkflowStep> steps = parser.parse("Here you go:\n```json\n" + STEPS + "```\n");

        assertThat(steps).extracting(WorkflowStep::getIndex).containsExactly(1, 2, 3);
        assertThat(steps.get(0).getCategory()).isEqualTo(NodeCategory.INPUT_OUTPUT);
        assertThat(steps.get(0).getConfidence()).isEqualTo(0.9);
        assertThat(steps.get(1).isDecision()).isTrue();
        assertThat(steps.get(1).getBranches())
                .extracting(b -> b.label() + "->" + b.target())
                .containsExactly("Yes->" + StepTarget.step(3), "No->" + StepTarget.end());
        assertThat(steps.get(2).getJumpTarget()).isEqualTo(StepTarget.end());
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "```\n[{\"text\": \"Ship the order\"}]\n```",
                "The steps are [{\"text\": \"Ship the order\"}] as requested.",
                "[{\"text\": \"Ship the order\"}]"
            })
    void shouldFindArrayInAnyWrapping(String content) throws Exception {
        assertThat(parser.parse(content))
                .singleElement()
                .satisfies(s -> assertThat(s.getText()).isEqualTo("Ship the order"));
    }

    @Test
    void shouldClassifyWhenCategoryIsMissingOrUnknown() throws Exception {
        List<WorkflowStep> steps =
                parser.parse(
                        """
                        [{"text": "Save the record to the database"},
                         {"text": "Save the record to the database", "category": "cloud"}]
                        """);

        assertThat(steps)
                .allSatisfy(
                        s -> {
                            assertThat(s.getCategory()).isEqualTo(NodeCategory.DATABASE);
                            assertThat(s.getConfidence()).isEqualTo(0.8);
                        });
    }

    @Test
    void shouldDefaultIndexToPositionAndClampConfidence() throws Exception {
        List<WorkflowStep> steps =
                parser.parse(
                        """
                        [{"text": "Open the form", "confidence": 3.5},
                         {"index": 0, "text": "Close the form", "confidence": -1}]
                        """);

        assertThat(steps).extracting(WorkflowStep::getIndex).containsExactly(1, 2);
        assertThat(steps).extracting(WorkflowStep::getConfidence).containsExactly(1.0, 0.0);
        assertThat(steps.get(0).getJumpTarget()).isEqualTo(StepTarget.next());
    }

    @Test
    void shouldRejectStepWithoutText() {
        assertThatThrownBy(() -> parser.parse("[{\"text\": \"Go\"}, {\"index\": 2}]"))
                .isInstanceOf(ExtractionException.class)
                .hasMessage("Step at position 2 has no text");
    }

    @ParameterizedTest
    @ValueSource(strings = {"{\"text\": \"Go\"}", "no json here", "[{\"text\": }]"})
    void shouldRejectNonArrayOrMalformedContent(String content) {
        assertThatThrownBy(() -> parser.parse(content)).isInstanceOf(ExtractionException.class);
    }

    @Test
    void shouldAcceptEmptyArray() throws Exception {
        assertThat(parser.parse("[]")).isEmpty();
    }
}
