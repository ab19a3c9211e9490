package com.sentinelx.flink;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Small HTTP server exposing liveness and readiness probes.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: {@code 200} with {@code {"status":"UP"}} while the
 * process is alive</li>
 * <li>{@code GET /readiness}: {@code 200} once {@link #markReady()} was
 * called, {@code 503} with {@code {"status":"STARTING"}} before</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    private static final byte[] UP = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final byte[] STARTING = "{\"status\":\"STARTING\"}".getBytes(StandardCharsets.UTF_8);

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean ready = new AtomicBoolean(false);

    /**
     * Start the server.
     *
     * @param port TCP port in [0, 65535]; 0 binds an ephemeral port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", exchange -> respond(exchange, 200, UP));
            server.createContext("/readiness", exchange -> {
                if (ready.get()) {
                    respond(exchange, 200, UP);
                } else {
                    respond(exchange, 503, STARTING);
                }
            });
            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "health-server");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Health server started on port {}", getPort());
        } catch (IOException e) {
            LOG.error("Failed to start health server on port {}: {}", port, e.getMessage(), e);
        }
    }

    /** Report ready on {@code /readiness}. */
    public void markReady() {
        ready.set(true);
    }

    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Health server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, or -1 when not started
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
