package fr.lapetina.codex.linker.infrastructure.http;

import fr.lapetina.codex.linker.domain.model.ProbeFailure;

/**
 * Thrown when the model list of a server cannot be fetched.
 */
public final class ModelListingException extends RuntimeException {

    private final ProbeFailure failure;

    public ModelListingException(String modelsUrl, JsonFetchResult result) {
        super("Failed to fetch models from " + modelsUrl + ": " + result.error());
        this.failure = result.failure();
    }

    public ProbeFailure getFailure() {
        return failure;
    }
}
