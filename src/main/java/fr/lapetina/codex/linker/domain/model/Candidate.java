package fr.lapetina.codex.linker.domain.model;

import java.net.URI;
import java.util.Objects;

/**
 * An OpenAI-compatible server endpoint under consideration for auto-detection.
 * Immutable and thread-safe.
 *
 * @param baseUrl base URL of the API, usually ending in {@code /v1}
 */
public record Candidate(String baseUrl) {

    public static final String DEFAULT_MODELS_PATH = "/models";

    public Candidate {
        Objects.requireNonNull(baseUrl, "Base URL is required");
        baseUrl = baseUrl.strip();
        if (baseUrl.isEmpty()) {
            throw new IllegalArgumentException("Base URL must not be blank");
        }
    }

    public static Candidate of(String baseUrl) {
        return new Candidate(baseUrl);
    }

    /**
     * Resolves the {@code /models} listing URL for this candidate.
     */
    public URI modelsUri() {
        return resolve(DEFAULT_MODELS_PATH);
    }

    /**
     * Resolves a path relative to the base URL, tolerating slashes on either side.
     */
    public URI resolve(String path) {
        String base = baseUrl.replaceAll("/+$", "");
        String suffix = path == null || path.isEmpty() ? "" : (path.startsWith("/") ? path : "/" + path);
        return URI.create(base + suffix);
    }

    @Override
    public String toString() {
        return baseUrl;
    }
}
