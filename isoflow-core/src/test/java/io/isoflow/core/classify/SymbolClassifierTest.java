package io.isoflow.core.classify;

import static org.assertj.core.api.Assertions.assertThat;

import io.isoflow.core.model.NodeCategory;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class SymbolClassifierTest {

    private final SymbolClassifier classifier = new SymbolClassifier();

    @ParameterizedTest
    @CsvSource(
            delimiter = '|',
            value = {
                "Start                                  | TERMINATOR",
                "3. End                                 | TERMINATOR",
                "End of procedure                       | TERMINATOR",
                "Is the form complete?                  | DECISION",
                "Check if the printer is online         | DECISION",
                "Receive the order                      | INPUT_OUTPUT",
                "Save the record to the database        | DATABASE",
                "Print the monthly report               | DOCUMENT",
                "Show the results on screen             | DISPLAY",
                "Sign the delivery note                 | MANUAL_OPERATION",
                "See section 4.2                        | PREDEFINED_PROCESS",
                "Calculate the invoice total            | PROCESS"
            })
    void shouldClassifyLine(String line, NodeCategory expected) {
        assertThat(classifier.classify(line).category()).isEqualTo(expected);
    }

    @Test
    void shouldDefaultToProcessWhenNothingMatches() {
        Classification result = classifier.classify("Mix the ingredients");

        assertThat(result.category()).isEqualTo(NodeCategory.PROCESS);
        assertThat(result.confidence()).isEqualTo(SymbolClassifier.DEFAULT_CONFIDENCE);
        assertThat(result.isDefault()).isTrue();
    }

    @Test
    void shouldGiveTerminatorsFixedConfidence() {
        assertThat(classifier.classify("Begin").confidence())
                .isEqualTo(ClassificationPatterns.TERMINATOR_CONFIDENCE);
        assertThat(classifier.isTerminator("Finish.")).isTrue();
        assertThat(classifier.isTerminator("Finish the report")).isFalse();
    }

    @Nested
    class DecisionExclusions {

        @ParameterizedTest
        @ValueSource(
                strings = {
                    "Enter the licence key when prompted",
                    "Check current settings in the panel",
                    "Verify hardware connections"
                })
        void shouldNotClassifyAsDecision(String line) {
            assertThat(classifier.classify(line).category()).isNotEqualTo(NodeCategory.DECISION);
        }
    }

    @Test
    void shouldPreferHigherConfidenceMatch() {
        // "database" noun (0.8) outranks the leading "save" verb (0.7); both are DATABASE,
        // the noun match is reported
        Classification result = classifier.classify("Save the record to the database");
        assertThat(result.confidence()).isEqualTo(0.8);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "Start", "Is it ready?", "Connect the cable", "x"})
    void shouldNeverEmitConnector(String line) {
        assertThat(classifier.classify(line).category()).isNotEqualTo(NodeCategory.CONNECTOR);
    }

    @Test
    void shouldStripStepMarkersBeforeMatching() {
        assertThat(SymbolClassifier.normalize("  12)  Receive   THE order "))
                .isEqualTo("receive the order");
        assertThat(SymbolClassifier.normalize("• Print report")).isEqualTo("print report");
    }
}
