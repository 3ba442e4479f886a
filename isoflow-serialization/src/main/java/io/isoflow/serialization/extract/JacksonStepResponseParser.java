package io.isoflow.serialization.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.isoflow.core.classify.Classification;
import io.isoflow.core.classify.SymbolClassifier;
import io.isoflow.core.extract.ExtractionException;
import io.isoflow.core.extract.StepResponseParser;
import io.isoflow.core.model.Branch;
import io.isoflow.core.model.NodeCategory;
import io.isoflow.core.model.StepTarget;
import io.isoflow.core.model.WorkflowStep;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/// Jackson-based implementation of {@link StepResponseParser}.
///
/// Parses a model-generated JSON array of steps. Each element needs a `text`; the other
/// fields are optional:
///
/// | Field        | When missing or invalid                               |
/// |--------------|-------------------------------------------------------|
/// | `index`      | position in the array, 1-based                        |
/// | `category`   | the {@link SymbolClassifier} classifies `text`        |
/// | `confidence` | the classifier confidence; clamped to `[0, 1]`        |
/// | `branches`   | no branches                                           |
/// | `jumpTo`     | fall-through                                          |
///
/// Branch and jump targets are a step number or `"end"`.
///
/// The parser strips markdown code fences before deserialisation and falls back to the
/// outermost `[ ... ]` bounds when the model wrapped the array in prose.
///
/// @implNote Thread-safe if the supplied {@link ObjectMapper} is.
public class JacksonStepResponseParser implements StepResponseParser {

    private final ObjectMapper objectMapper;
    private final SymbolClassifier classifier;

    public JacksonStepResponseParser(ObjectMapper objectMapper) {
        this(objectMapper, new SymbolClassifier());
    }

    public JacksonStepResponseParser(ObjectMapper objectMapper, SymbolClassifier classifier) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    @Override
    public List<WorkflowStep> parse(String content) throws ExtractionException {
        Objects.requireNonNull(content, "content must not be null");
        String json = extractJson(content);

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ExtractionException("Failed to parse step JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new ExtractionException("Step response is not a JSON array");
        }

        List<WorkflowStep> steps = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            steps.add(parseStep(i, root.get(i)));
        }
        return steps;
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private WorkflowStep parseStep(int position, JsonNode dto) throws ExtractionException {
        String text = dto.path("text").asText("").strip();
        if (text.isEmpty()) {
            throw new ExtractionException("Step at position " + (position + 1) + " has no text");
        }

        int index = dto.path("index").asInt(position + 1);
        if (index < 1) {
            index = position + 1;
        }

        Classification classification = classifier.classify(text);
        NodeCategory category = category(dto.path("category").asText(""), classification);
        double confidence =
                dto.hasNonNull("confidence")
                        ? Math.max(0.0, Math.min(1.0, dto.get("confidence").asDouble()))
                        : classification.confidence();

        WorkflowStep.Builder step =
                WorkflowStep.builder()
                        .index(index)
                        .rawText(text)
                        .text(text)
                        .category(category)
                        .confidence(confidence)
                        .jumpTarget(target(dto.get("jumpTo")));

        for (JsonNode branch : dto.path("branches")) {
            String branchText = branch.path("text").asText("").strip();
            String label = branch.path("label").asText("").strip();
            step.branch(
                    new Branch(
                            label,
                            branchText.isEmpty() ? label : branchText,
                            target(branch.get("targetStep"))));
        }
        return step.build();
    }

    private static NodeCategory category(String name, Classification fallback) {
        if (name.isBlank()) {
            return fallback.category();
        }
        String normalized =
                name.strip().toUpperCase(Locale.ROOT).replace(' ', '_').replace('/', '_');
        try {
            return NodeCategory.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return fallback.category();
        }
    }

    private static StepTarget target(JsonNode node) {
        if (node == null || node.isNull()) {
            return StepTarget.next();
        }
        if (node.canConvertToInt() && node.asInt() >= 1) {
            return StepTarget.step(node.asInt());
        }
        if ("end".equalsIgnoreCase(node.asText().strip())) {
            return StepTarget.end();
        }
        return StepTarget.next();
    }

    /// Extracts the JSON content from a model response, stripping markdown fences.
    private static String extractJson(String content) {
        int start = content.indexOf("```json");
        if (start >= 0) {
            start = content.indexOf('\n', start) + 1;
            int end = content.indexOf("```", start);
            if (end > start) {
                return content.substring(start, end).trim();
            }
        }

        start = content.indexOf("```");
        if (start >= 0) {
            start = content.indexOf('\n', start) + 1;
            int end = content.indexOf("```", start);
            if (end > start) {
                return content.substring(start, end).trim();
            }
        }

        int arrayStart = content.indexOf('[');
        int arrayEnd = content.lastIndexOf(']');
        if (arrayStart >= 0 && arrayEnd > arrayStart) {
            return content.substring(arrayStart, arrayEnd + 1);
        }
        return content.trim();
    }
}
