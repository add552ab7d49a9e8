package fr.lapetina.codex.linker.infrastructure.http;

import fr.lapetina.codex.linker.domain.model.Candidate;
import fr.lapetina.codex.linker.domain.model.ProbeFailure;
import fr.lapetina.codex.linker.domain.model.ProbeOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class HttpProbeTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private StubServer server;
    private OpenAiHttpClient client;
    private HttpProbe probe;

    @BeforeEach
    void setUp() throws Exception {
        server = StubServer.start();
        client = new OpenAiHttpClient(Duration.ofSeconds(1));
        probe = new HttpProbe(client);
    }

    @AfterEach
    void tearDown() {
        client.close();
        server.close();
    }

    @Test
    @DisplayName("should succeed when the listing carries a data key")
    void shouldSucceedOnDataKey() {
        server.json("/v1/models", 200, "{\"object\":\"list\",\"data\":[]}");

        ProbeOutcome outcome = probe.probe(Candidate.of(server.baseUrl()), TIMEOUT);

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.failure()).isNull();
        assertThat(outcome.payload().has("data")).isTrue();
    }

    @Test
    @DisplayName("should fail when the object has no data key")
    void shouldFailWithoutDataKey() {
        server.json("/v1/models", 200, "{\"models\":[]}");

        ProbeOutcome outcome = probe.probe(Candidate.of(server.baseUrl()), TIMEOUT);

        assertThat(outcome.isFailure()).isTrue();
        assertThat(outcome.failure()).isEqualTo(ProbeFailure.MISSING_DATA);
    }

    @Test
    @DisplayName("should fail when the body is not a JSON object")
    void shouldFailOnNonObject() {
        server.json("/v1/models", 200, "[\"data\"]");

        ProbeOutcome outcome = probe.probe(Candidate.of(server.baseUrl()), TIMEOUT);

        assertThat(outcome.failure()).isEqualTo(ProbeFailure.MISSING_DATA);
    }

    @Test
    @DisplayName("should carry the HTTP failure through")
    void shouldCarryHttpFailure() {
        server.json("/v1/models", 404, "{\"data\":[]}");

        ProbeOutcome outcome = probe.probe(Candidate.of(server.baseUrl()), TIMEOUT);

        assertThat(outcome.failure()).isEqualTo(ProbeFailure.HTTP_ERROR);
        assertThat(outcome.detail()).isEqualTo("HTTP 404");
        assertThat(outcome.candidate().baseUrl()).isEqualTo(server.baseUrl());
    }

    @Test
    @DisplayName("should time out within the probe timeout")
    void shouldTimeOut() {
        server.slow("/v1/models", 3_000, "{\"data\":[]}");

        long start = System.nanoTime();
        ProbeOutcome outcome = probe.probe(Candidate.of(server.baseUrl()), Duration.ofMillis(250));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertThat(outcome.failure()).isEqualTo(ProbeFailure.TIMEOUT);
        assertThat(elapsedMs).isLessThan(2_000);
    }

    @Test
    @DisplayName("should time out when the body stalls after the headers")
    void shouldTimeOutOnStalledBody() {
        server.stallBody("/v1/models", 4_000);

        long start = System.nanoTime();
        ProbeOutcome outcome = probe.probe(Candidate.of(server.baseUrl()), Duration.ofMillis(250));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertThat(outcome.failure()).isEqualTo(ProbeFailure.TIMEOUT);
        assertThat(elapsedMs).isLessThan(1_000);
    }

    @Test
    @DisplayName("should not throw on an unparseable base URL")
    void shouldNotThrowOnBadUrl() {
        ProbeOutcome outcome = probe.probe(Candidate.of("not a url"), TIMEOUT);

        assertThat(outcome.isFailure()).isTrue();
    }

    @Test
    @DisplayName("should probe a custom models path")
    void shouldProbeCustomPath() {
        server.json("/v1/api/models", 200, "{\"data\":[]}");
        HttpProbe custom = new HttpProbe(client, "api/models", null);

        assertThat(custom.probe(Candidate.of(server.baseUrl()), TIMEOUT).success()).isTrue();
    }
}
