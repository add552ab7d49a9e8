package fr.lapetina.codex.linker.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.codex.linker.domain.model.Candidate;
import fr.lapetina.codex.linker.domain.model.ProbeFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP client for OpenAI-compatible model servers.
 *
 * Uses java.net.http.HttpClient. Every call carries its own deadline covering
 * the whole exchange, body included, and callers block until it completes or
 * expires, so callers decide the concurrency.
 */
public class OpenAiHttpClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OpenAiHttpClient.class);

    private static final String NULL_KEY = "NULLKEY";

    private static final List<String> CONTEXT_KEYS = List.of(
            "context_length", "max_context_length", "context_window", "max_context_window", "n_ctx"
    );
    private static final List<String> CONTEXT_CONTAINERS = List.of(
            "metadata", "settings", "config", "parameters"
    );

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public OpenAiHttpClient(Duration connectTimeout) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public OpenAiHttpClient() {
        this(Duration.ofSeconds(3));
    }

    /**
     * Fetches a small JSON document. Never throws.
     *
     * @param uri         Absolute URL to GET
     * @param timeout     Timeout for the whole request
     * @param bearerToken Optional API key sent as {@code Authorization: Bearer}
     * @return Parsed document or classified error
     */
    public JsonFetchResult fetchJson(URI uri, Duration timeout, String bearerToken) {
        long start = System.nanoTime();
        CompletableFuture<HttpResponse<String>> future = null;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(uri)
                    .timeout(timeout)
                    .header("Accept", "application/json")
                    .GET();
            if (hasToken(bearerToken)) {
                builder.header("Authorization", "Bearer " + bearerToken.strip());
            }

            // The request timeout stops at the headers; the deadline below also covers the body
            future = httpClient.sendAsync(builder.build(),
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            HttpResponse<String> response = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            Duration latency = elapsedSince(start);
            int status = response.statusCode();

            if (status < 200 || status >= 300) {
                log.debug("JSON fetch failed with HTTP error: uri={}, status={}, latencyMs={}",
                        uri, status, latency.toMillis());
                return JsonFetchResult.failed(ProbeFailure.HTTP_ERROR, "HTTP " + status, status, latency);
            }

            JsonNode data = objectMapper.readTree(response.body());
            if (data == null || data.isMissingNode()) {
                return JsonFetchResult.failed(ProbeFailure.MALFORMED_BODY, "empty body", status, latency);
            }
            log.debug("JSON fetch succeeded: uri={}, status={}, latencyMs={}", uri, status, latency.toMillis());
            return JsonFetchResult.ok(data, status, latency);

        } catch (JsonProcessingException e) {
            return JsonFetchResult.failed(ProbeFailure.MALFORMED_BODY,
                    "invalid JSON: " + e.getOriginalMessage(), 200, elapsedSince(start));
        } catch (TimeoutException e) {
            future.cancel(true);
            return timedOut(timeout, start);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof HttpTimeoutException) {
                return timedOut(timeout, start);
            }
            if (cause instanceof IOException) {
                return JsonFetchResult.failed(ProbeFailure.CONNECTION_ERROR,
                        describe((IOException) cause), -1, elapsedSince(start));
            }
            return JsonFetchResult.failed(ProbeFailure.INTERNAL_ERROR,
                    String.valueOf(cause), -1, elapsedSince(start));
        } catch (InterruptedException e) {
            if (future != null) {
                future.cancel(true);
            }
            Thread.currentThread().interrupt();
            return JsonFetchResult.failed(ProbeFailure.INTERNAL_ERROR, "interrupted", -1, elapsedSince(start));
        } catch (IllegalArgumentException e) {
            return JsonFetchResult.failed(ProbeFailure.CONNECTION_ERROR,
                    "invalid URL: " + e.getMessage(), -1, elapsedSince(start));
        }
    }

    private static JsonFetchResult timedOut(Duration timeout, long start) {
        return JsonFetchResult.failed(ProbeFailure.TIMEOUT,
                "timed out after " + timeout.toMillis() + "ms", -1, elapsedSince(start));
    }

    /**
     * POSTs a JSON-serialized body.
     *
     * @return HTTP status code of the response
     * @throws IOException          on connection failure, timeout (body included) or serialization error
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public int postJson(URI uri, Object body, Duration timeout) throws IOException, InterruptedException {
        byte[] payload = objectMapper.writeValueAsBytes(body);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(payload))
                .build();
        CompletableFuture<HttpResponse<Void>> future =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding());
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS).statusCode();
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new HttpTimeoutException("POST timed out after " + timeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException("POST failed: " + cause, cause);
        }
    }

    /**
     * Lists the model ids served at a base URL.
     *
     * @throws ModelListingException if the listing cannot be fetched
     */
    public List<String> listModels(String baseUrl, Duration timeout, String bearerToken) {
        URI uri;
        try {
            uri = Candidate.of(baseUrl).modelsUri();
        } catch (IllegalArgumentException e) {
            throw new ModelListingException(baseUrl, JsonFetchResult.failed(ProbeFailure.CONNECTION_ERROR,
                    "invalid URL: " + e.getMessage(), -1, Duration.ZERO));
        }
        JsonFetchResult result = fetchJson(uri, timeout, bearerToken);
        if (!result.isSuccess()) {
            throw new ModelListingException(uri.toString(), result);
        }

        List<String> ids = new ArrayList<>();
        for (JsonNode entry : result.data().path("data")) {
            String id = entry.path("id").asText("");
            if (!id.isEmpty()) {
                ids.add(id);
            }
        }
        log.debug("Listed models: baseUrl={}, count={}", baseUrl, ids.size());
        return ids;
    }

    /**
     * Best-effort context window detection from model metadata.
     *
     * Looks at the chosen model first, then at any listed model.
     *
     * @return Context window in tokens, or 0 when unknown
     */
    public int detectContextWindow(String baseUrl, String modelId, Duration timeout, String bearerToken) {
        JsonFetchResult result;
        try {
            result = fetchJson(Candidate.of(baseUrl).modelsUri(), timeout, bearerToken);
        } catch (IllegalArgumentException e) {
            return 0;
        }
        if (!result.isSuccess() || !result.data().path("data").isArray()) {
            return 0;
        }
        JsonNode models = result.data().path("data");

        for (JsonNode entry : models) {
            if (entry.path("id").asText("").equals(modelId)) {
                int ctx = contextWindowOf(entry);
                if (ctx > 0) {
                    return ctx;
                }
            }
        }
        for (JsonNode entry : models) {
            int ctx = contextWindowOf(entry);
            if (ctx > 0) {
                return ctx;
            }
        }
        return 0;
    }

    private static int contextWindowOf(JsonNode entry) {
        int ctx = extractContext(entry);
        if (ctx == 0 && entry.path("meta").isObject()) {
            ctx = extractContext(entry.path("meta"));
        }
        return ctx;
    }

    private static int extractContext(JsonNode meta) {
        for (String key : CONTEXT_KEYS) {
            int direct = positiveInt(meta.get(key));
            if (direct > 0) {
                return direct;
            }
            for (String container : CONTEXT_CONTAINERS) {
                JsonNode sub = meta.get(container);
                if (sub != null && sub.isObject()) {
                    int nested = positiveInt(sub.get(key));
                    if (nested > 0) {
                        return nested;
                    }
                }
            }
        }
        return 0;
    }

    private static int positiveInt(JsonNode node) {
        if (node != null && node.isIntegralNumber() && node.canConvertToInt() && node.intValue() > 0) {
            return node.intValue();
        }
        return 0;
    }

    private static boolean hasToken(String token) {
        return token != null && !token.isBlank() && !NULL_KEY.equalsIgnoreCase(token.strip());
    }

    private static String describe(IOException e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    @Override
    public void close() {
        // HttpClient doesn't need explicit closing in Java 17
    }
}
