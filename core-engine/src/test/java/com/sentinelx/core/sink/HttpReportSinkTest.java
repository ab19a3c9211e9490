package com.sentinelx.core.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinelx.core.model.AnomalyScores;
import com.sentinelx.core.model.RiskReport;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests {@link HttpReportSink} against a local JDK {@link HttpServer}.
 */
class HttpReportSinkTest {

    private HttpServer server;
    private final AtomicInteger status = new AtomicInteger(200);
    private final AtomicReference<String> responseBody = new AtomicReference<>("{\"status\":\"ok\"}");
    private final AtomicReference<String> received = new AtomicReference<>();
    private final AtomicReference<String> path = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/", exchange -> {
            path.set(exchange.getRequestURI().getPath());
            try (InputStream is = exchange.getRequestBody()) {
                received.set(new String(is.readAllBytes(), StandardCharsets.UTF_8));
            }
            byte[] bytes = responseBody.get().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status.get(), bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    @DisplayName("Should POST snake_case JSON to /risk and accept 2xx")
    void shouldPostReport() throws IOException {
        DeliveryResult result = sink().deliver(report());

        assertThat(result.isAccepted()).isTrue();
        assertThat(path.get()).isEqualTo("/risk");

        JsonNode json = new ObjectMapper().readTree(received.get());
        assertThat(json.get("session_id").asText()).isEqualTo("session-1");
        assertThat(json.get("risk_score").asDouble()).isEqualTo(28.0);
        assertThat(json.get("source").asText()).isEqualTo(RiskReport.DEFAULT_SOURCE);
        assertThat(json.get("anomaly_scores").get("idle_burst").asDouble()).isEqualTo(70.0);
        assertThat(json.get("anomaly_scores").get("overall").asDouble()).isEqualTo(70.0);
    }

    @Test
    @DisplayName("Should report 422 as a rejection with the response body")
    void shouldTreatUnprocessableAsRejected() {
        status.set(422);
        responseBody.set("{\"detail\":\"Risk score out of range\"}");

        DeliveryResult result = sink().deliver(report());

        assertThat(result.getStatus()).isEqualTo(DeliveryResult.Status.REJECTED);
        assertThat(result.getDetail()).contains("out of range");
    }

    @Test
    @DisplayName("Should report a server error as a failure")
    void shouldTreatServerErrorAsFailed() {
        status.set(503);

        DeliveryResult result = sink().deliver(report());

        assertThat(result.getStatus()).isEqualTo(DeliveryResult.Status.FAILED);
        assertThat(result.getDetail()).isEqualTo("HTTP 503");
    }

    @Test
    @DisplayName("Should report an unreachable server as a failure without throwing")
    void shouldTreatUnreachableAsFailed() {
        int port = server.getAddress().getPort();
        server.stop(0);

        DeliveryResult result = new HttpReportSink("http://127.0.0.1:" + port, Duration.ofMillis(500))
                .deliver(report());

        assertThat(result.getStatus()).isEqualTo(DeliveryResult.Status.FAILED);
    }

    @Test
    @DisplayName("Should strip a trailing slash from the base URL")
    void shouldNormalizeEndpoint() {
        HttpReportSink sink = new HttpReportSink("http://localhost:8000/");

        assertThat(sink.getEndpoint().toString()).isEqualTo("http://localhost:8000/risk");
    }

    @Test
    @DisplayName("Should reject a blank server URL")
    void shouldRejectBlankUrl() {
        assertThatThrownBy(() -> new HttpReportSink(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private HttpReportSink sink() {
        return new HttpReportSink("http://127.0.0.1:" + server.getAddress().getPort(), Duration.ofSeconds(2));
    }

    private static RiskReport report() {
        return RiskReport.builder()
                .timestamp(1_700_000_000.0)
                .riskScore(28.0)
                .anomalyScores(AnomalyScores.of(70.0, 0.0, 0.0))
                .sessionId("session-1")
                .build();
    }
}
