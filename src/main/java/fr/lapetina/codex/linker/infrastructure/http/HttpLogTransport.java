package fr.lapetina.codex.linker.infrastructure.http;

import fr.lapetina.codex.linker.dispatch.LogTransport;
import fr.lapetina.codex.linker.domain.model.LogRecord;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * Ships log records as JSON objects POSTed to a remote endpoint.
 *
 * Deliberately does not log: its own records would be shipped again.
 */
public final class HttpLogTransport implements LogTransport {

    private final OpenAiHttpClient httpClient;
    private final URI endpoint;
    private final Duration requestTimeout;

    public HttpLogTransport(OpenAiHttpClient httpClient, URI endpoint, Duration requestTimeout) {
        String scheme = endpoint.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("Remote log URL must be http or https: " + endpoint);
        }
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public void send(LogRecord record) throws IOException, InterruptedException {
        int status = httpClient.postJson(endpoint, record, requestTimeout);
        if (status < 200 || status >= 300) {
            throw new IOException("Log endpoint answered HTTP " + status);
        }
    }
}
