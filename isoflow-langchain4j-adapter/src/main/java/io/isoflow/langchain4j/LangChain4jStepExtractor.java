package io.isoflow.langchain4j;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.isoflow.core.extract.ExtractionException;
import io.isoflow.core.extract.HeuristicStepExtractor;
import io.isoflow.core.extract.StepExtractor;
import io.isoflow.core.extract.StepResponseParser;
import io.isoflow.core.model.WorkflowStep;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Model-backed {@link StepExtractor} built on a LangChain4j {@link ChatModel}.
///
/// Sends the process text with a system prompt that asks for a JSON step list, then parses
/// the reply with a {@link StepResponseParser}. When the model call fails, returns nothing,
/// or replies with something the parser rejects, extraction falls back to the heuristic
/// extractor and logs a warning. Callers always get steps in the same shape.
///
/// Text longer than one {@link DocumentChunker} window is sent window by window. A window
/// that fails is skipped with a warning; the steps of the others are merged and
/// renumbered. Only when no window yields steps does the fallback run.
///
/// @implNote Thread-safe if the wrapped model is. No per-call state is kept.
///
/// @see LangChain4jModelFactory for building the model
public class LangChain4jStepExtractor implements StepExtractor {

    private static final Logger logger =
            Logger.getLogger(LangChain4jStepExtractor.class.getName());

    static final String SYSTEM_PROMPT =
            """
            You convert process descriptions into flowchart steps.
            Reply with a JSON array only, no prose. One object per step, in source order:
              {"index": <1-based int>, "text": "<short label>",
               "category": "<TERMINATOR|PROCESS|DECISION|INPUT_OUTPUT|DATABASE|DISPLAY|\
            DOCUMENT|PREDEFINED_PROCESS|MANUAL_OPERATION>",
               "confidence": <0.0-1.0>,
               "branches": [{"label": "<Yes/No/...>", "text": "<action>", "targetStep": <int>}],
               "jumpTo": <int or "end">}
            Rules:
            - Keep the steps that appear in the text. Do not add start or end steps.
            - Only decisions have branches. Include only branches the text states.
            - Set targetStep or jumpTo only when the text refers to another step.
            """;

    private final ChatModel model;
    private final StepResponseParser parser;
    private final StepExtractor fallback;
    private final DocumentChunker chunker;

    public LangChain4jStepExtractor(ChatModel model, StepResponseParser parser) {
        this(model, parser, new HeuristicStepExtractor());
    }

    public LangChain4jStepExtractor(
            ChatModel model, StepResponseParser parser, StepExtractor fallback) {
        this(model, parser, fallback, new DocumentChunker());
    }

    /// @param model chat model to query, not null
    /// @param parser parser for the model's JSON reply, not null
    /// @param fallback extractor used when the model path fails, not null
    /// @param chunker splits text that does not fit one model call, not null
    public LangChain4jStepExtractor(
            ChatModel model,
            StepResponseParser parser,
            StepExtractor fallback,
            DocumentChunker chunker) {
        this.model = Objects.requireNonNull(model, "model required");
        this.parser = Objects.requireNonNull(parser, "parser required");
        this.fallback = Objects.requireNonNull(fallback, "fallback required");
        this.chunker = Objects.requireNonNull(chunker, "chunker required");
    }

    @Override
    public List<WorkflowStep> extract(String text) throws ExtractionException {
        Objects.requireNonNull(text, "text required");
        if (text.isBlank()) {
            return List.of();
        }

        List<String> chunks = chunker.chunk(text);
        if (chunks.size() == 1) {
            try {
                List<WorkflowStep> steps = extractWithModel(text);
                logger.fine("Model extracted " + steps.size() + " steps");
                return steps;
            } catch (ExtractionException e) {
                logger.warning("Model extraction unusable, using heuristics: " + e.getMessage());
            } catch (RuntimeException e) {
                logger.warning("Model call failed, using heuristics: " + e);
            }
            return fallback.extract(text);
        }

        logger.info("Text split into " + chunks.size() + " windows for model extraction");
        ChunkedStepMerger merger = new ChunkedStepMerger();
        for (int i = 0; i < chunks.size(); i++) {
            try {
                merger.add(extractWithModel(chunks.get(i)));
            } catch (ExtractionException e) {
                logger.warning("Window " + (i + 1) + " unusable, skipping: " + e.getMessage());
            } catch (RuntimeException e) {
                logger.warning("Model call failed for window " + (i + 1) + ", skipping: " + e);
            }
        }
        List<WorkflowStep> steps = merger.steps();
        if (!steps.isEmpty()) {
            logger.fine("Model extracted " + steps.size() + " steps");
            return steps;
        }
        logger.warning("No window produced steps, using heuristics");
        return fallback.extract(text);
    }

    @Override
    public String getName() {
        return "langchain4j";
    }

    private List<WorkflowStep> extractWithModel(String text) throws ExtractionException {
        List<ChatMessage> messages =
                List.of(SystemMessage.from(SYSTEM_PROMPT), UserMessage.from(text));
        ChatResponse response = model.chat(messages);

        if (response == null || response.aiMessage() == null) {
            throw new ExtractionException("No response from model");
        }
        String content = response.aiMessage().text();
        if (content == null || content.isBlank()) {
            throw new ExtractionException("Empty response from model");
        }

        List<WorkflowStep> steps = parser.parse(content);
        if (steps.isEmpty()) {
            throw new ExtractionException("Model returned no steps");
        }
        return steps;
    }
}
