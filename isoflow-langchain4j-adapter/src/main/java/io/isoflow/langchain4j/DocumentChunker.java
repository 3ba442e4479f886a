package io.isoflow.langchain4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Splits long process text into overlapping windows that fit a model's context.
///
/// Windows are cut on line boundaries so that numbered steps stay whole. Size is
/// measured in words, at roughly three words for every four tokens. Each window after the
/// first repeats the trailing lines of the previous one, up to `overlapWords`, so a step
/// cut at a boundary is seen complete at least once. A single line longer than the
/// window becomes a window of its own.
///
/// @implNote Immutable and thread-safe.
public final class DocumentChunker {

    /// Words per window, about 6000 tokens.
    public static final int DEFAULT_MAX_WORDS = 4500;

    /// Words repeated between windows, about 500 tokens.
    public static final int DEFAULT_OVERLAP_WORDS = 375;

    private final int maxWords;
    private final int overlapWords;

    public DocumentChunker() {
        this(DEFAULT_MAX_WORDS, DEFAULT_OVERLAP_WORDS);
    }

    /// @param maxWords words per window, positive
    /// @param overlapWords words repeated between windows, zero or more and below `maxWords`
    public DocumentChunker(int maxWords, int overlapWords) {
        if (maxWords < 1) {
            throw new IllegalArgumentException("maxWords must be positive: " + maxWords);
        }
        if (overlapWords < 0 || overlapWords >= maxWords) {
            throw new IllegalArgumentException(
                    "overlapWords must be in [0, " + maxWords + "): " + overlapWords);
        }
        this.maxWords = maxWords;
        this.overlapWords = overlapWords;
    }

    /// Splits the text into windows.
    ///
    /// @param text process text, not null
    /// @return the text itself when it fits one window, otherwise the windows in order;
    ///     never null or empty
    public List<String> chunk(String text) {
        String[] lines = text.split("\\R", -1);
        int[] words = new int[lines.length];
        int total = 0;
        for (int i = 0; i < lines.length; i++) {
            words[i] = wordCount(lines[i]);
            total += words[i];
        }
        if (total <= maxWords) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        int start = 0;
        while (start < lines.length) {
            int end = start;
            int size = 0;
            while (end < lines.length && (end == start || size + words[end] <= maxWords)) {
                size += words[end];
                end++;
            }
            chunks.add(String.join("\n", Arrays.asList(lines).subList(start, end)));
            if (end >= lines.length) {
                break;
            }

            int back = end;
            int overlap = 0;
            while (back - 1 > start && overlap + words[back - 1] <= overlapWords) {
                back--;
                overlap += words[back];
            }
            start = back;
        }
        return List.copyOf(chunks);
    }

    static int wordCount(String line) {
        String stripped = line.strip();
        return stripped.isEmpty() ? 0 : stripped.split("\\s+").length;
    }
}
