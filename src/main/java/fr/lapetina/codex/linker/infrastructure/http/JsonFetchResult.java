package fr.lapetina.codex.linker.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.codex.linker.domain.model.ProbeFailure;

import java.time.Duration;

/**
 * Outcome of a small JSON GET: either a parsed document or a classified error.
 *
 * @param data       Parsed body, null on failure
 * @param failure    Failure classification, null on success
 * @param error      Short human-readable error, e.g. {@code HTTP 404}
 * @param statusCode HTTP status, or -1 when no response was received
 * @param latency    Time spent on the request
 */
public record JsonFetchResult(
        JsonNode data,
        ProbeFailure failure,
        String error,
        int statusCode,
        Duration latency
) {
    static JsonFetchResult ok(JsonNode data, int statusCode, Duration latency) {
        return new JsonFetchResult(data, null, null, statusCode, latency);
    }

    static JsonFetchResult failed(ProbeFailure failure, String error, int statusCode, Duration latency) {
        return new JsonFetchResult(null, failure, error, statusCode, latency);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
