package io.isoflow.core.render.source;

import java.util.ArrayList;
import java.util.List;

/// Label helpers shared by the source generators.
final class Labels {

    static final int WRAP_WIDTH = 28;

    /// Confidence below which a node is drawn as uncertain.
    static final double UNCERTAIN_BELOW = 0.7;

    private Labels() {}

    /// Breaks a label into lines of at most `width` characters at word boundaries.
    /// A single word longer than `width` stays on its own line.
    static List<String> wrap(String label, int width) {
        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder();
        for (String word : label.strip().split("\\s+")) {
            if (line.length() > 0 && line.length() + 1 + word.length() > width) {
                lines.add(line.toString());
                line.setLength(0);
            }
            if (line.length() > 0) {
                line.append(' ');
            }
            line.append(word);
        }
        if (line.length() > 0 || lines.isEmpty()) {
            lines.add(line.toString());
        }
        return lines;
    }
}
