package io.isoflow.core.render;

import java.util.Locale;

/// Artifact formats a backend may produce.
public enum OutputFormat {
    SVG("svg", "image/svg+xml"),
    PNG("png", "image/png"),
    PDF("pdf", "application/pdf"),
    HTML("html", "text/html"),
    /// The diagram source text of the backend (DOT, D2, Mermaid).
    SOURCE("txt", "text/plain");

    private final String extension;
    private final String mediaType;

    OutputFormat(String extension, String mediaType) {
        this.extension = extension;
        this.mediaType = mediaType;
    }

    public String getExtension() {
        return extension;
    }

    public String getMediaType() {
        return mediaType;
    }

    /// Returns the lower-case name used on engine command lines and URLs.
    public String cliName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
