package fr.lapetina.codex.linker.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of a single probe against a candidate.
 * Immutable and thread-safe; produced once per probe invocation.
 */
public record ProbeOutcome(
        Candidate candidate,
        boolean success,
        JsonNode payload,
        ProbeFailure failure,
        String detail,
        Duration latency
) {
    public ProbeOutcome {
        Objects.requireNonNull(candidate, "Candidate is required");
        if (success && failure != null) {
            throw new IllegalArgumentException("A successful outcome cannot carry a failure");
        }
        if (!success && failure == null) {
            throw new IllegalArgumentException("A failed outcome must carry a failure type");
        }
        if (latency == null) {
            latency = Duration.ZERO;
        }
    }

    public static ProbeOutcome success(Candidate candidate, JsonNode payload, Duration latency) {
        return new ProbeOutcome(candidate, true, payload, null, null, latency);
    }

    public static ProbeOutcome failure(Candidate candidate, ProbeFailure failure, String detail, Duration latency) {
        return new ProbeOutcome(candidate, false, null, failure, detail, latency);
    }

    public boolean isFailure() {
        return !success;
    }
}
