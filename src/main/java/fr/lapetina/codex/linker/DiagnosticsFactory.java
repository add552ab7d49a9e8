package fr.lapetina.codex.linker;

import fr.lapetina.codex.linker.detection.EndpointRace;
import fr.lapetina.codex.linker.dispatch.LogDispatcher;
import fr.lapetina.codex.linker.domain.model.Candidate;
import fr.lapetina.codex.linker.domain.probe.Probe;
import fr.lapetina.codex.linker.domain.provider.ProviderResolver;
import fr.lapetina.codex.linker.infrastructure.config.ConfigLoader;
import fr.lapetina.codex.linker.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.codex.linker.infrastructure.config.LinkerConfig;
import fr.lapetina.codex.linker.infrastructure.http.HttpLogTransport;
import fr.lapetina.codex.linker.infrastructure.http.HttpProbe;
import fr.lapetina.codex.linker.infrastructure.http.ModelListingException;
import fr.lapetina.codex.linker.infrastructure.http.OpenAiHttpClient;
import fr.lapetina.codex.linker.infrastructure.logging.LoggingConfigurator;
import fr.lapetina.codex.linker.infrastructure.logging.StructuredEvents;
import fr.lapetina.codex.linker.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Factory for creating fully-wired diagnostics components from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (DiagnosticsFactory factory = DiagnosticsFactory.create("linker.yaml")) {
 *     Optional<Candidate> server = factory.detect(List.of());
 *     // use server...
 * }
 * }</pre>
 */
public class DiagnosticsFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsFactory.class);

    private final LinkerConfig config;
    private final MetricsRegistry metricsRegistry;
    private final OpenAiHttpClient httpClient;
    private final EndpointRace endpointRace;
    private final LogDispatcher dispatcher;
    private final LoggingConfigurator loggingConfigurator;

    /**
     * @param config              Loaded configuration
     * @param probeOverride       Probe to use instead of the HTTP probe, may be null
     * @param loggingConfigurator Applies the logging options, or null to leave Logback untouched
     */
    protected DiagnosticsFactory(LinkerConfig config, Probe probeOverride, LoggingConfigurator loggingConfigurator) {
        this.config = config;
        LinkerConfig.DetectionConfig detection = config.getDetection();

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());
        MetricsRegistry raceMetrics = config.getMetrics().isEnabled() ? metricsRegistry : null;

        // Initialize HTTP client
        this.httpClient = new OpenAiHttpClient(Duration.ofMillis(detection.getConnectTimeoutMs()));

        // Probe and race (allow override for testing)
        Probe probe = probeOverride != null
                ? probeOverride
                : new HttpProbe(httpClient, detection.getModelsPath(), detection.getApiKey());
        this.endpointRace = new EndpointRace(probe, raceMetrics);

        // Remote log shipping is optional
        this.dispatcher = createDispatcher(config.getLogging());
        if (dispatcher != null && raceMetrics != null) {
            metricsRegistry.registerDispatcher(dispatcher);
        }

        this.loggingConfigurator = loggingConfigurator;
        if (loggingConfigurator != null) {
            loggingConfigurator.configure(config.getLogging(), dispatcher);
        }

        log.debug("DiagnosticsFactory initialized: candidates={}, probeTimeoutMs={}, remoteLogging={}",
                detection.getCandidates().size(), detection.getProbeTimeoutMs(), dispatcher != null);
    }

    /**
     * Creates a factory from an already loaded configuration and applies its logging options.
     */
    public static DiagnosticsFactory create(LinkerConfig config) {
        return new DiagnosticsFactory(config, null, new LoggingConfigurator());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static DiagnosticsFactory create(String configPath) {
        return create(new ConfigLoader(configPath).load());
    }

    /**
     * Races the given base URLs, or the configured candidates when none are given.
     *
     * @return The first candidate that answered with a model listing
     */
    public Optional<Candidate> detect(List<String> baseUrls) {
        List<Candidate> candidates = candidates(baseUrls);
        Duration timeout = probeTimeout();
        long start = System.nanoTime();

        Optional<Candidate> winner = endpointRace.race(candidates, timeout);
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        if (winner.isPresent()) {
            StructuredEvents.event("detect_success")
                    .provider(ProviderResolver.resolve(winner.get().baseUrl()))
                    .path(config.getDetection().getModelsPath())
                    .durationMs(elapsedMs)
                    .log(log, Level.INFO, "Detected server: baseUrl={}", winner.get());
        } else {
            StructuredEvents.event("detect_none")
                    .path(config.getDetection().getModelsPath())
                    .durationMs(elapsedMs)
                    .log(log, Level.WARN, "No server detected among {} candidates", candidates.size());
        }
        return winner;
    }

    /**
     * Lists the model ids served at a base URL.
     *
     * @throws ModelListingException if the listing cannot be fetched
     */
    public List<String> listModels(String baseUrl) {
        long start = System.nanoTime();
        String provider = ProviderResolver.resolve(baseUrl);
        try {
            List<String> models = httpClient.listModels(baseUrl, probeTimeout(), config.getDetection().getApiKey());
            StructuredEvents.event("list_models")
                    .provider(provider)
                    .durationMs(Duration.ofNanos(System.nanoTime() - start).toMillis())
                    .log(log, Level.INFO, "Listed {} models at {}", models.size(), baseUrl);
            return models;
        } catch (ModelListingException e) {
            StructuredEvents.event("list_models_failed")
                    .provider(provider)
                    .errorType(e.getFailure().name())
                    .durationMs(Duration.ofNanos(System.nanoTime() - start).toMillis())
                    .log(log, Level.WARN, "Failed to list models: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Best-effort context window lookup for a model.
     *
     * @return Context window in tokens, or 0 when unknown
     */
    public int detectContextWindow(String baseUrl, String modelId) {
        int window = httpClient.detectContextWindow(baseUrl, modelId, probeTimeout(),
                config.getDetection().getApiKey());
        StructuredEvents.event("context_window")
                .provider(ProviderResolver.resolve(baseUrl))
                .model(modelId)
                .log(log, Level.DEBUG, "Context window for {}: {}", modelId, window);
        return window;
    }

    /**
     * Converts base URLs to candidates, falling back to the configured list when empty.
     * Blank entries are ignored.
     */
    public List<Candidate> candidates(List<String> baseUrls) {
        List<String> source = baseUrls == null || baseUrls.isEmpty()
                ? config.getDetection().getCandidates()
                : baseUrls;
        List<Candidate> candidates = new ArrayList<>();
        if (source == null) {
            return candidates;
        }
        for (String url : source) {
            if (url != null && !url.isBlank()) {
                candidates.add(Candidate.of(url));
            }
        }
        return candidates;
    }

    public Duration probeTimeout() {
        return Duration.ofMillis(config.getDetection().getProbeTimeoutMs());
    }

    public LinkerConfig getConfig() {
        return config;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public Optional<LogDispatcher> getDispatcher() {
        return Optional.ofNullable(dispatcher);
    }

    private LogDispatcher createDispatcher(LinkerConfig.LoggingConfig logging) {
        String remoteUrl = logging.getRemoteUrl();
        if (remoteUrl == null || remoteUrl.isBlank()) {
            return null;
        }

        HttpLogTransport transport;
        try {
            transport = new HttpLogTransport(httpClient, URI.create(remoteUrl.strip()),
                    Duration.ofMillis(logging.getRequestTimeoutMs()));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid remote log URL: " + remoteUrl, e);
        }

        return LogDispatcher.builder()
                .transport(transport)
                .capacity(logging.getQueueCapacity())
                .drainTimeout(Duration.ofMillis(logging.getDrainTimeoutMs()))
                .synchronous(logging.isSynchronous())
                .build();
    }

    @Override
    public void close() {
        log.debug("Shutting down DiagnosticsFactory...");

        if (loggingConfigurator != null) {
            try {
                loggingConfigurator.reset();
            } catch (Exception e) {
                log.warn("Error resetting logging", e);
            }
        }

        if (dispatcher != null) {
            try {
                dispatcher.close();
            } catch (Exception e) {
                log.warn("Error closing log dispatcher", e);
            }
        }

        try {
            httpClient.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP client", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.debug("DiagnosticsFactory shut down");
    }
}
