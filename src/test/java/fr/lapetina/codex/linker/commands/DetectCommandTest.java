package fr.lapetina.codex.linker.commands;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import fr.lapetina.codex.linker.DiagnosticsFactory;
import fr.lapetina.codex.linker.infrastructure.http.StubServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

class DetectCommandTest {

    private static final String DEAD_URL = "http://127.0.0.1:9/v1";

    private StubServer server;
    private CommandHarness harness;

    @BeforeEach
    void setUp() throws Exception {
        server = StubServer.start()
                .json("/v1/models", 200, "{\"data\":[{\"id\":\"llama3\"}]}")
                .handle("/ingest", exchange -> StubServer.respond(exchange, 204, ""));
        harness = new CommandHarness();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    @DisplayName("should print the detected base URL and provider")
    void shouldPrintDetectedServer() {
        int code = harness.run("--config", "test-config.yaml", "detect",
                "--candidate", DEAD_URL + "," + server.baseUrl());

        assertThat(code).isZero();
        assertThat(harness.out())
                .contains("base_url=" + server.baseUrl())
                .contains("provider=custom");
    }

    @Test
    @DisplayName("should exit with 1 when nothing answers")
    void shouldFailWhenNothingAnswers() {
        int code = harness.run("--config", "test-config.yaml", "detect", "--timeout-ms", "300");

        assertThat(code).isEqualTo(1);
        assertThat(harness.err()).contains("No server detected");
        assertThat(harness.out()).doesNotContain("base_url=");
    }

    @Test
    @DisplayName("should reject a non-positive timeout as a usage error")
    void shouldRejectNonPositiveTimeout() {
        int code = harness.run("--config", "test-config.yaml", "detect",
                "--candidate", server.baseUrl(), "--timeout-ms", "0");

        assertThat(code).isEqualTo(2);
        assertThat(harness.err()).contains("--timeout-ms must be positive");
        assertThat(harness.out()).doesNotContain("base_url=");
    }

    @Test
    @DisplayName("should print metrics on exit when asked")
    void shouldPrintMetrics() {
        int code = harness.run("--config", "test-config.yaml", "--print-metrics", "detect",
                "--candidate", server.baseUrl());

        assertThat(code).isZero();
        assertThat(harness.out())
                .contains("test_linker_races_total")
                .contains("test_linker_probes_total");
    }

    @Test
    @DisplayName("should apply logging options with the default factory")
    void shouldRunWithDefaultFactory() {
        Logger root = ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        Level original = root.getLevel();
        CommandHarness realHarness = new CommandHarness(DiagnosticsFactory::create);

        try {
            int code = realHarness.run("--config", "test-config.yaml", "--log-level", "error",
                    "--log-remote", "http://127.0.0.1:" + server.port() + "/ingest", "--log-sync",
                    "detect", "--candidate", server.baseUrl());

            assertThat(code).isZero();
            assertThat(root.getLevel()).isEqualTo(Level.ERROR);
            assertThat(realHarness.out()).contains("base_url=" + server.baseUrl());
        } finally {
            root.setLevel(original);
        }
    }
}
