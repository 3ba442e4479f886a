package io.isoflow.core.render.backend;

import io.isoflow.core.model.Flowchart;
import io.isoflow.core.render.BackendAdapter;
import io.isoflow.core.render.BackendFailureException;
import io.isoflow.core.render.BackendId;
import io.isoflow.core.render.BackendTimeoutException;
import io.isoflow.core.render.BackendUnavailableException;
import io.isoflow.core.render.OutputFormat;
import io.isoflow.core.render.RenderException;
import io.isoflow.core.render.RenderedArtifact;
import io.isoflow.core.render.source.DotSource;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Renders DOT source through a Kroki server.
///
/// The source is posted as `text/plain` to `{base}/graphviz/{format}`; the response
/// body is the artifact. The request carries the render timeout, so a slow server is
/// reported as {@link BackendTimeoutException}.
///
/// ### Failure mapping
/// - Connection refused or host unreachable: {@link BackendUnavailableException}
/// - Request timeout: {@link BackendTimeoutException}
/// - Any non-200 status: {@link BackendFailureException} with the status and body head
public final class KrokiBackend implements BackendAdapter {

    private static final Logger logger = Logger.getLogger(KrokiBackend.class.getName());

    static final String DIAGRAM_TYPE = "graphviz";
    private static final int ERROR_BODY_LIMIT = 200;

    private static final Set<OutputFormat> FORMATS =
            EnumSet.of(OutputFormat.SVG, OutputFormat.PNG, OutputFormat.PDF, OutputFormat.SOURCE);

    private final URI baseUrl;
    private final HttpClient httpClient;
    private final DotSource source = new DotSource();

    public KrokiBackend(URI baseUrl) {
        this(baseUrl, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
    }

    public KrokiBackend(URI baseUrl, HttpClient httpClient) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    }

    @Override
    public BackendId id() {
        return BackendId.KROKI;
    }

    @Override
    public Set<OutputFormat> supportedFormats() {
        return FORMATS;
    }

    /// Returns the endpoint a format is posted to.
    URI endpoint(OutputFormat format) {
        String base = baseUrl.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + "/" + DIAGRAM_TYPE + "/" + format.cliName());
    }

    @Override
    public RenderedArtifact render(Flowchart flowchart, OutputFormat format, Duration timeout)
            throws RenderException, InterruptedException {
        Objects.requireNonNull(flowchart, "flowchart must not be null");
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");

        if (!FORMATS.contains(format)) {
            throw new BackendFailureException(id(), "kroki cannot produce " + format.cliName());
        }

        String dot = source.generate(flowchart);
        if (format == OutputFormat.SOURCE) {
            return new RenderedArtifact(dot.getBytes(StandardCharsets.UTF_8), format);
        }

        URI uri = endpoint(format);
        HttpRequest request =
                HttpRequest.newBuilder()
                        .uri(uri)
                        .timeout(timeout)
                        .header("Content-Type", "text/plain")
                        .header("Accept", format.getMediaType())
                        .POST(HttpRequest.BodyPublishers.ofString(dot, StandardCharsets.UTF_8))
                        .build();

        logger.fine("POST " + uri);
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw new BackendTimeoutException(
                    id(), "Kroki did not answer within " + timeout.toMillis() + "ms", e);
        } catch (ConnectException e) {
            throw new BackendUnavailableException(id(), "Cannot reach " + baseUrl, e);
        } catch (IOException e) {
            throw new BackendFailureException(id(), "Kroki request failed: " + e.getMessage(), e);
        }

        if (response.statusCode() != 200) {
            throw new BackendFailureException(
                    id(), "Kroki returned " + response.statusCode() + ": " + bodyHead(response));
        }
        return new RenderedArtifact(response.body(), format);
    }

    private static String bodyHead(HttpResponse<byte[]> response) {
        byte[] body = response.body();
        if (body == null) {
            return "";
        }
        int length = Math.min(body.length, ERROR_BODY_LIMIT);
        return new String(body, 0, length, StandardCharsets.UTF_8).strip();
    }
}
