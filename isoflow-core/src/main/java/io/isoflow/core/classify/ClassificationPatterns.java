package io.isoflow.core.classify;

import static io.isoflow.core.model.NodeCategory.DATABASE;
import static io.isoflow.core.model.NodeCategory.DECISION;
import static io.isoflow.core.model.NodeCategory.DISPLAY;
import static io.isoflow.core.model.NodeCategory.DOCUMENT;
import static io.isoflow.core.model.NodeCategory.INPUT_OUTPUT;
import static io.isoflow.core.model.NodeCategory.MANUAL_OPERATION;
import static io.isoflow.core.model.NodeCategory.PREDEFINED_PROCESS;
import static io.isoflow.core.model.NodeCategory.PROCESS;

import java.util.List;
import java.util.regex.Pattern;

/// Keyword and regex tables used by {@link SymbolClassifier}.
///
/// Table order is the evaluation order. Cross references come first, then decisions,
/// then object nouns, then leading verbs. The classifier picks the highest confidence
/// across all matches, so order only decides among equal confidence and equal match
/// length.
final class ClassificationPatterns {

    private ClassificationPatterns() {}

    /// Whole-line terminator phrases. Checked before everything else.
    static final Pattern TERMINATOR =
            Pattern.compile(
                    "^(?:start|begin|end|finish|finished|stop|terminate|exit|complete|done"
                            + "|setup complete|process complete|procedure complete)[.!]?$");

    /// Short start/end headings such as "End of procedure" or "Begin the process".
    static final Pattern TERMINATOR_PHRASE =
            Pattern.compile(
                    "^(?:start|begin|end)(?: of)?(?: the)?"
                            + " (?:process|procedure|workflow|setup|installation|program)[.!]?$");

    static final double TERMINATOR_CONFIDENCE = 0.95;

    /// Lines that look conditional but describe a plain action.
    static final List<Pattern> DECISION_EXCLUSIONS =
            List.of(
                    Pattern.compile("\\bwhen (?:prompted|asked|finished|done|complete|ready)\\b"),
                    Pattern.compile("\\binput .+ when\\b"),
                    Pattern.compile("\\bcheck current\\b"),
                    Pattern.compile("\\bverify (?:hardware|software|system|settings?)\\b"),
                    Pattern.compile("\\bvalidate (?:credentials|data|input) against\\b"),
                    Pattern.compile(
                            "^(?:check|verify|validate|confirm) (?:the )?[a-z]+(?: [a-z]+)?"
                                    + " (?:via|by|using|from|in|at)\\b"));

    static final List<CategoryPattern> TABLE =
            List.of(
                    // cross references
                    CategoryPattern.of(PREDEFINED_PROCESS, "\\bsee section\\b", 0.9),
                    CategoryPattern.of(PREDEFINED_PROCESS, "\\brefer to\\b", 0.9),
                    CategoryPattern.of(PREDEFINED_PROCESS, "\\bas described in\\b", 0.9),
                    CategoryPattern.of(PREDEFINED_PROCESS, "\\bfollow procedure\\b", 0.9),
                    CategoryPattern.of(
                            PREDEFINED_PROCESS,
                            "\\bper (?:section|procedure|protocol|guideline)\\b",
                            0.9),
                    CategoryPattern.of(PREDEFINED_PROCESS, "\\busing (?:method|protocol)\\b", 0.9),
                    CategoryPattern.of(
                            PREDEFINED_PROCESS, "\\baccording to (?:section|procedure)\\b", 0.9),

                    // decisions
                    CategoryPattern.of(DECISION, "\\?$", 0.9),
                    CategoryPattern.of(
                            DECISION, "\\b(?:is|are|does|do|can|should|has|have)\\b.*\\?", 0.9),
                    CategoryPattern.of(DECISION, "\\bcheck (?:if|whether)\\b", 0.85),
                    CategoryPattern.of(
                            DECISION,
                            "\\b(?:verify|confirm|ensure|validate|determine) (?:if|whether|that)\\b",
                            0.85),
                    CategoryPattern.of(DECISION, "^if .+ (?:then|:)$|^if .+:$", 0.85),
                    CategoryPattern.of(DECISION, "\\bwhether\\b", 0.8),
                    CategoryPattern.of(DECISION, "\\bin case\\b", 0.8),
                    CategoryPattern.of(DECISION, "\\bdepending on\\b", 0.8),
                    CategoryPattern.of(DECISION, "\\bselect (?:one|from|between)\\b", 0.8),
                    CategoryPattern.of(DECISION, "\\bchoose\\b", 0.8),

                    // object nouns
                    CategoryPattern.of(
                            DATABASE, "(?<=\\s)(?:database|db|tables?|collections?)\\b", 0.8),
                    CategoryPattern.of(INPUT_OUTPUT, "(?<=\\s)(?:files?|disk|drive|port)\\b", 0.8),
                    CategoryPattern.of(
                            DISPLAY, "(?<=\\s)(?:screen|monitor|console|dialog|popup)\\b", 0.8),
                    CategoryPattern.of(
                            MANUAL_OPERATION, "(?<=\\s)(?:by (?:the )?(?:user|operator|technician))\\b", 0.8),
                    CategoryPattern.of(
                            PREDEFINED_PROCESS,
                            "(?<=\\s)(?:api|subroutine|module|procedure)\\b",
                            0.8),
                    CategoryPattern.of(
                            DOCUMENT, "(?<=\\s)(?:report|document|log|form|certificate)s?\\b", 0.8),

                    // leading verbs
                    CategoryPattern.of(
                            INPUT_OUTPUT,
                            "^(?:read|write|input|output|receive|send|upload|download|import"
                                    + "|transmit|scan|capture|submit|accept|collect|obtain)\\b",
                            0.85),
                    CategoryPattern.of(
                            DATABASE,
                            "^(?:query|insert|delete|save|fetch|retrieve|store|persist|load|lookup"
                                    + "|look up|cache|index|search)\\b",
                            0.7),
                    CategoryPattern.of(
                            DISPLAY,
                            "^(?:display|show|render|present|visualize|alert|notify|prompt"
                                    + "|preview)\\b",
                            0.7),
                    CategoryPattern.of(
                            DOCUMENT,
                            "^(?:print|export|log|record|archive|document)\\b"
                                    + "|^(?:generate|create|produce|save) (?:a |the )?(?:report|document)\\b",
                            0.7),
                    CategoryPattern.of(
                            MANUAL_OPERATION,
                            "^(?:enter|type|fill|fill in|sign|approve|press|insert the|connect)\\b",
                            0.7),
                    CategoryPattern.of(
                            PROCESS,
                            "^(?:process|calculate|transform|convert|update|create|generate"
                                    + "|execute|perform|compute|analy[sz]e|evaluate|modify|change|set"
                                    + "|configure|initialize|prepare|check|verify|validate|confirm"
                                    + "|inspect|review|examine|test|assess|install|run|apply)\\b",
                            0.65));
}
