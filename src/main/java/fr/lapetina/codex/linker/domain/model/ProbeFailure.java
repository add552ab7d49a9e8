package fr.lapetina.codex.linker.domain.model;

/**
 * Failure taxonomy for endpoint probes.
 * Provides clear categorization for logging and metrics.
 */
public enum ProbeFailure {
    /** No response within the per-probe timeout */
    TIMEOUT,

    /** Connection refused, DNS failure or other I/O error */
    CONNECTION_ERROR,

    /** Server answered with a non-2xx status */
    HTTP_ERROR,

    /** Body is not valid JSON */
    MALFORMED_BODY,

    /** Body is JSON but not an object with a "data" key */
    MISSING_DATA,

    /** The probe was interrupted or failed unexpectedly */
    INTERNAL_ERROR
}
