package fr.lapetina.codex.linker.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.codex.linker.domain.model.Candidate;
import fr.lapetina.codex.linker.domain.model.ProbeFailure;
import fr.lapetina.codex.linker.domain.model.ProbeOutcome;
import fr.lapetina.codex.linker.domain.probe.Probe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;

/**
 * Probes a candidate by fetching its model listing.
 *
 * A candidate is healthy when {@code GET <base>/models} answers with a JSON
 * object containing a {@code data} key.
 */
public final class HttpProbe implements Probe {

    private static final Logger log = LoggerFactory.getLogger(HttpProbe.class);

    private final OpenAiHttpClient httpClient;
    private final String path;
    private final String bearerToken;

    public HttpProbe(OpenAiHttpClient httpClient, String path, String bearerToken) {
        this.httpClient = httpClient;
        this.path = path == null || path.isBlank() ? Candidate.DEFAULT_MODELS_PATH : path;
        this.bearerToken = bearerToken;
    }

    public HttpProbe(OpenAiHttpClient httpClient) {
        this(httpClient, Candidate.DEFAULT_MODELS_PATH, null);
    }

    @Override
    public ProbeOutcome probe(Candidate candidate, Duration timeout) {
        URI uri;
        try {
            uri = candidate.resolve(path);
        } catch (IllegalArgumentException e) {
            log.debug("Probe failed: candidate={}, invalid URL", candidate);
            return ProbeOutcome.failure(candidate, ProbeFailure.CONNECTION_ERROR,
                    "invalid URL: " + e.getMessage(), Duration.ZERO);
        }

        JsonFetchResult result = httpClient.fetchJson(uri, timeout, bearerToken);

        if (!result.isSuccess()) {
            log.debug("Probe failed: candidate={}, failure={}, error={}",
                    candidate, result.failure(), result.error());
            return ProbeOutcome.failure(candidate, result.failure(), result.error(), result.latency());
        }

        JsonNode data = result.data();
        if (!data.isObject() || !data.has("data")) {
            log.debug("Probe failed: candidate={}, response has no data key", candidate);
            return ProbeOutcome.failure(candidate, ProbeFailure.MISSING_DATA,
                    "response has no \"data\" key", result.latency());
        }

        log.debug("Probe succeeded: candidate={}, latencyMs={}", candidate, result.latency().toMillis());
        return ProbeOutcome.success(candidate, data, result.latency());
    }
}
