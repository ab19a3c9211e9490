package com.sentinelx.flink;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HealthServer}.
 */
class HealthServerTest {

    private final HttpClient client = HttpClient.newHttpClient();
    private HealthServer server;

    @BeforeEach
    void setUp() {
        server = new HealthServer();
        server.start(0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    @DisplayName("Liveness is UP as soon as the server runs")
    void shouldReportHealth() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(server.isRunning()).isTrue();
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("UP");
    }

    @Test
    @DisplayName("Readiness turns from 503 to 200 once marked ready")
    void shouldReportReadiness() throws Exception {
        assertThat(get("/readiness").statusCode()).isEqualTo(503);

        server.markReady();

        assertThat(get("/readiness").statusCode()).isEqualTo(200);
    }

    @Test
    @DisplayName("Stop is idempotent")
    void shouldStopOnce() {
        server.stop();
        server.stop();

        assertThat(server.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Out-of-range port is rejected")
    void shouldRejectBadPort() {
        assertThatThrownBy(() -> new HealthServer().start(70_000))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(
                URI.create("http://localhost:" + server.getPort() + path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
