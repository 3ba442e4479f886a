package io.isoflow.core.render;

import io.isoflow.core.render.backend.EngineLocations;
import io.isoflow.core.render.backend.ProcessResult;
import io.isoflow.core.render.backend.ProcessRunner;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// Probes the local machine and the Kroki server for usable backends.
///
/// Results are cached per instance for a fixed TTL. {@link #refresh()} discards the
/// cache and probes again. No state is shared between instances.
///
/// ### Probes
/// | Backend  | Check                                |
/// |----------|--------------------------------------|
/// | GRAPHVIZ | `dot -V` exits 0                     |
/// | D2       | `d2 --version` exits 0               |
/// | MERMAID  | `mmdc --version` exits 0             |
/// | KROKI    | `GET {kroki}/health` answers 200     |
/// | HTML     | always available                     |
///
/// @implNote Thread-safe. Probing happens outside any lock; two threads that find the
/// cache expired at the same moment may both probe, and the later snapshot wins.
public class SystemCapabilityDetector implements CapabilityDetector {

    private static final Logger logger = Logger.getLogger(SystemCapabilityDetector.class.getName());

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);

    /// Checks one backend.
    @FunctionalInterface
    public interface Probe {
        boolean isAvailable(BackendId backend);
    }

    private record Snapshot(Set<BackendId> available, Instant takenAt) {}

    private final Probe probe;
    private final Duration ttl;
    private final Clock clock;
    private volatile Snapshot snapshot;

    public SystemCapabilityDetector(EngineLocations locations, Duration ttl) {
        this(new SystemProbe(locations, new ProcessRunner()), ttl, Clock.systemUTC());
    }

    public SystemCapabilityDetector(Probe probe, Duration ttl, Clock clock) {
        this.probe = Objects.requireNonNull(probe, "probe must not be null");
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Set<BackendId> listAvailable() {
        Snapshot current = snapshot;
        if (current == null || isExpired(current)) {
            current = probeAll();
            snapshot = current;
        }
        return current.available();
    }

    /// Discards the cached result and probes every backend again.
    ///
    /// @return the fresh result, never null
    public Set<BackendId> refresh() {
        Snapshot fresh = probeAll();
        snapshot = fresh;
        return fresh.available();
    }

    private boolean isExpired(Snapshot current) {
        return !clock.instant().isBefore(current.takenAt().plus(ttl));
    }

    private Snapshot probeAll() {
        Set<BackendId> available = EnumSet.of(BackendId.HTML);
        for (BackendId id : BackendId.values()) {
            if (id != BackendId.HTML && probe.isAvailable(id)) {
                available.add(id);
            }
        }
        logger.info("Available render backends: " + available);
        return new Snapshot(Set.copyOf(available), clock.instant());
    }

    // -- Default probe --------------------------------------------------------

    static final class SystemProbe implements Probe {

        private final EngineLocations locations;
        private final ProcessRunner runner;
        private final HttpClient httpClient;

        SystemProbe(EngineLocations locations, ProcessRunner runner) {
            this.locations = Objects.requireNonNull(locations, "locations must not be null");
            this.runner = Objects.requireNonNull(runner, "runner must not be null");
            this.httpClient = HttpClient.newBuilder().connectTimeout(PROBE_TIMEOUT).build();
        }

        @Override
        public boolean isAvailable(BackendId backend) {
            return switch (backend) {
                case GRAPHVIZ -> runs(List.of(locations.dot(), "-V"));
                case D2 -> runs(List.of(locations.d2(), "--version"));
                case MERMAID -> runs(List.of(locations.mmdc(), "--version"));
                case KROKI -> healthy(locations.kroki());
                case HTML -> true;
            };
        }

        private boolean runs(List<String> command) {
            Path workDir = Path.of(System.getProperty("java.io.tmpdir"));
            try {
                ProcessResult result = runner.run(command, workDir, PROBE_TIMEOUT);
                return result.isSuccess();
            } catch (IOException | TimeoutException e) {
                logger.fine(command.get(0) + " not usable: " + e.getMessage());
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }

        private boolean healthy(URI base) {
            String url = base.toString();
            if (url.endsWith("/")) {
                url = url.substring(0, url.length() - 1);
            }
            HttpRequest request =
                    HttpRequest.newBuilder(URI.create(url + "/health"))
                            .timeout(PROBE_TIMEOUT)
                            .GET()
                            .build();
            try {
                HttpResponse<Void> response =
                        httpClient.send(request, HttpResponse.BodyHandlers.discarding());
                return response.statusCode() == 200;
            } catch (IOException e) {
                logger.fine("Kroki not reachable at " + base + ": " + e.getMessage());
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }
}
