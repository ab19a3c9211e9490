package com.sentinelx.core.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinelx.core.model.RiskReport;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Posts risk reports as JSON to {@code {serverUrl}/risk}.
 *
 * <h3>Outcomes</h3>
 * <ul>
 * <li>2xx: {@link DeliveryResult.Status#ACCEPTED}</li>
 * <li>400 or 422: {@link DeliveryResult.Status#REJECTED} with the response
 * body as detail</li>
 * <li>any other status, I/O error or timeout:
 * {@link DeliveryResult.Status#FAILED}</li>
 * </ul>
 *
 * <p>
 * Backed by an Apache HttpClient 5 classic client whose connect, response
 * and pool-lease timeouts all equal the configured timeout, so a delivery
 * never blocks the polling loop for long and never throws.
 * </p>
 *
 * @since 1.0.0
 */
public class HttpReportSink implements ReportSink, Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(HttpReportSink.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(2);

    private final URI endpoint;
    private final CloseableHttpClient client;
    private final ObjectMapper mapper = new ObjectMapper();

    public HttpReportSink(String serverUrl) {
        this(serverUrl, DEFAULT_TIMEOUT);
    }

    /**
     * @param serverUrl base URL of the collector, e.g. {@code http://localhost:8000}
     * @param timeout   connect and response timeout
     * @throws IllegalArgumentException if the URL is blank or malformed
     */
    public HttpReportSink(String serverUrl, Duration timeout) {
        Objects.requireNonNull(serverUrl, "serverUrl must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (serverUrl.isBlank()) {
            throw new IllegalArgumentException("serverUrl must not be blank");
        }
        String base = serverUrl.endsWith("/") ? serverUrl.substring(0, serverUrl.length() - 1) : serverUrl;
        this.endpoint = URI.create(base + "/risk");

        Timeout limit = Timeout.ofMilliseconds(timeout.toMillis());
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(limit)
                .setResponseTimeout(limit)
                .setConnectionRequestTimeout(limit)
                .build();
        this.client = HttpClientBuilder.create()
                .setDefaultRequestConfig(requestConfig)
                .disableAutomaticRetries()
                .build();
    }

    @Override
    public DeliveryResult deliver(RiskReport report) {
        Objects.requireNonNull(report, "RiskReport must not be null");
        byte[] body;
        try {
            body = mapper.writeValueAsBytes(report);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize report for session {}: {}", report.getSessionId(), e.getMessage(), e);
            return DeliveryResult.failed("serialization: " + e.getMessage());
        }

        HttpPost post = new HttpPost(endpoint);
        post.setEntity(new ByteArrayEntity(body, ContentType.APPLICATION_JSON));
        try {
            return client.execute(post, response -> {
                int status = response.getCode();
                String text = response.getEntity() != null
                        ? EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8)
                        : "";
                if (status >= 200 && status < 300) {
                    LOG.debug("Report for session {} accepted", report.getSessionId());
                    return DeliveryResult.accepted();
                }
                if (status == 400 || status == 422) {
                    LOG.warn("Report for session {} rejected ({}): {}", report.getSessionId(), status, text);
                    return DeliveryResult.rejected(text);
                }
                LOG.warn("Report for session {} failed with HTTP {}", report.getSessionId(), status);
                return DeliveryResult.failed("HTTP " + status);
            });
        } catch (IOException e) {
            LOG.warn("Report for session {} not delivered: {}", report.getSessionId(), e.toString());
            return DeliveryResult.failed(e.toString());
        }
    }

    public URI getEndpoint() {
        return endpoint;
    }

    @Override
    public void close() throws IOException {
        client.close();
    }
}
