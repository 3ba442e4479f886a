package io.isoflow.core.render.source;

import io.isoflow.core.model.Flowchart;
import java.util.Objects;

/// Self-contained HTML page that embeds the Mermaid source and renders it in the browser.
///
/// Needs no local engine. The viewer script is loaded from a CDN when the page is
/// opened; the Mermaid source stays readable in the page even without it.
public final class HtmlViewerPage implements DiagramSource {

    static final String DEFAULT_VIEWER_URL =
            "https://cdn.jsdelivr.net/npm/mermaid@10/dist/mermaid.esm.min.mjs";

    private final MermaidSource mermaid;
    private final String viewerUrl;

    public HtmlViewerPage() {
        this(new MermaidSource(), DEFAULT_VIEWER_URL);
    }

    public HtmlViewerPage(MermaidSource mermaid, String viewerUrl) {
        this.mermaid = Objects.requireNonNull(mermaid, "mermaid must not be null");
        this.viewerUrl = Objects.requireNonNull(viewerUrl, "viewerUrl must not be null");
    }

    @Override
    public String getName() {
        return "html";
    }

    @Override
    public String getExtension() {
        return "html";
    }

    @Override
    public String generate(Flowchart flowchart) {
        String title = escapeHtml(flowchart.getTitle());
        StringBuilder sb = new StringBuilder();
        sb.append("<!DOCTYPE html>\n");
        sb.append("<html lang=\"en\">\n");
        sb.append("<head>\n");
        sb.append("  <meta charset=\"utf-8\">\n");
        sb.append("  <title>").append(title).append("</title>\n");
        sb.append("  <style>\n");
        sb.append("    body { font-family: Helvetica, Arial, sans-serif; margin: 2rem; }\n");
        sb.append("    .mermaid { background: #fff; }\n");
        sb.append("  </style>\n");
        sb.append("</head>\n");
        sb.append("<body>\n");
        sb.append("  <h1>").append(title).append("</h1>\n");
        sb.append("  <pre class=\"mermaid\">\n");
        sb.append(escapeHtml(mermaid.generate(flowchart)));
        sb.append("  </pre>\n");
        sb.append("  <script type=\"module\">\n");
        sb.append("    import mermaid from '").append(viewerUrl).append("';\n");
        sb.append("    mermaid.initialize({ startOnLoad: true, securityLevel: 'strict' });\n");
        sb.append("  </script>\n");
        sb.append("</body>\n");
        sb.append("</html>\n");
        return sb.toString();
    }

    private static String escapeHtml(String text) {
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }
}
