package com.processsentinel.flink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Lightweight HTTP server exposing health and readiness endpoints.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: {@code {"status":"UP", ...}} plus whatever the
 * status supplier contributes</li>
 * <li>{@code GET /readiness}: same body; target of the Kubernetes readiness check</li>
 * </ul>
 *
 * <p>
 * Built on the JDK {@link HttpServer}; bodies are written with Jackson.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final Supplier<Map<String, Object>> details;

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HealthServer() {
        this(Map::of);
    }

    /**
     * @param details extra fields merged into every health response
     */
    public HealthServer(Supplier<Map<String, Object>> details) {
        this.details = Objects.requireNonNull(details, "details supplier must not be null");
    }

    /**
     * Start the server. Port {@code 0} binds an ephemeral port, readable from
     * {@link #getPort()}.
     *
     * @param port TCP port in [0, 65535]
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", this::handleHealthCheck);
            server.createContext("/readiness", this::handleHealthCheck);

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
     * @return the bound port, or {@code -1} when not started
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handler (shared between /health and /readiness)
    // ---------------------------------------------------------------

    private void handleHealthCheck(HttpExchange exchange) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        try {
            body.putAll(details.get());
        } catch (RuntimeException e) {
            LOG.warn("Health details unavailable – reporting status only: {}", e.getMessage());
        }
        byte[] response = mapper.writeValueAsBytes(body);

        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, response.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(response);
        }
    }
}
