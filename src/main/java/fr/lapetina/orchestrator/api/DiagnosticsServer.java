package fr.lapetina.orchestrator.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.orchestrator.AiOrchestrator;
import fr.lapetina.orchestrator.api.dto.DispatchApiRequest;
import fr.lapetina.orchestrator.api.dto.DispatchApiResponse;
import fr.lapetina.orchestrator.domain.model.ErrorType;
import fr.lapetina.orchestrator.domain.model.HealthStatus;
import fr.lapetina.orchestrator.domain.model.ModelTier;
import fr.lapetina.orchestrator.domain.model.ProviderHealthRecord;
import fr.lapetina.orchestrator.domain.model.ProviderResponse;
import fr.lapetina.orchestrator.domain.model.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /api/dispatch - Send a prompt through the fallback dispatcher
 * - GET /api/providers/status - Health records of every provider
 * - GET /api/cache/stats - Context cache statistics
 * - GET /health - Overall health
 * - GET /metrics - Prometheus metrics endpoint
 */
public final class DiagnosticsServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsServer.class);

    private static final long DISPATCH_WAIT_SECONDS = 120;

    private final HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final AiOrchestrator orchestrator;

    public DiagnosticsServer(String host, int port, int backlog, int threads, AiOrchestrator orchestrator)
            throws IOException {
        this.orchestrator = orchestrator;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule());

        this.server = HttpServer.create(new InetSocketAddress(host, port), backlog);

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "diagnostics-http-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/api/dispatch", new DispatchHandler());
        server.createContext("/api/providers/status", new ProviderStatusHandler());
        server.createContext("/api/cache/stats", new CacheStatsHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());

        log.info("HTTP server configured on {}:{}", host, port);
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Bound port, useful when the server was created on port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    // ==================== DISPATCH HANDLER ====================

    private class DispatchHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            MDC.put("requestId", UUID.randomUUID().toString().substring(0, 8));

            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }

                DispatchApiRequest apiRequest;
                try (InputStream is = exchange.getRequestBody()) {
                    apiRequest = objectMapper.readValue(is, DispatchApiRequest.class);
                } catch (JsonProcessingException e) {
                    sendError(exchange, 400, "Invalid request body: " + e.getOriginalMessage());
                    return;
                }

                if (apiRequest.getPrompt() == null || apiRequest.getPrompt().isBlank()) {
                    sendError(exchange, 400, "Missing 'prompt' field");
                    return;
                }

                ModelTier tier;
                try {
                    tier = ModelTier.fromString(apiRequest.getTier());
                } catch (IllegalArgumentException e) {
                    sendError(exchange, 400, e.getMessage());
                    return;
                }

                String userId = apiRequest.getUserId();
                if (userId == null) {
                    userId = exchange.getRequestHeaders().getFirst("X-User-ID");
                }
                String operation = apiRequest.getOperation() != null ? apiRequest.getOperation() : "dispatch";

                Result<ProviderResponse> result = orchestrator
                        .dispatch(operation, userId,
                                provider -> apiRequest.toProviderRequest(orchestrator.resolveModel(provider, tier)))
                        .get(DISPATCH_WAIT_SECONDS, TimeUnit.SECONDS);

                int statusCode = result.isSuccess() ? 200 : mapErrorToStatus(result.errorType());
                sendJson(exchange, statusCode, DispatchApiResponse.fromResult(result));

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                sendError(exchange, 503, "Interrupted");
            } catch (Exception e) {
                log.error("Error handling dispatch request", e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            } finally {
                MDC.clear();
            }
        }
    }

    static int mapErrorToStatus(ErrorType errorType) {
        if (errorType == null) {
            return 500;
        }
        return switch (errorType) {
            case CONFIGURATION, CIRCUIT_OPEN -> 503;
            case TIMEOUT -> 504;
            case TRANSIENT, EXHAUSTED -> 502;
            case FATAL -> 500;
        };
    }

    // ==================== STATUS HANDLERS ====================

    private class ProviderStatusHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            sendJson(exchange, 200, orchestrator.getProviderStatuses());
        }
    }

    private class CacheStatsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            sendJson(exchange, 200, orchestrator.getCacheStats());
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            List<ProviderHealthRecord> statuses = orchestrator.getProviderStatuses();

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", determineOverallHealth(statuses));
            health.put("timestamp", System.currentTimeMillis());

            Map<String, String> providers = new LinkedHashMap<>();
            for (ProviderHealthRecord record : statuses) {
                providers.put(record.providerId(), record.status().name());
            }
            health.put("providers", providers);
            health.put("healthMonitorRunning", orchestrator.getHealthMonitor().isRunning());

            int statusCode = "DOWN".equals(health.get("status")) ? 503 : 200;
            sendJson(exchange, statusCode, health);
        }
    }

    /**
     * UP when every enabled provider is operational or not yet sampled, DOWN when
     * none is usable, DEGRADED otherwise.
     */
    static String determineOverallHealth(List<ProviderHealthRecord> statuses) {
        List<ProviderHealthRecord> enabled = statuses.stream()
                .filter(ProviderHealthRecord::enabled)
                .toList();
        if (enabled.isEmpty()) {
            return "DOWN";
        }

        long usable = enabled.stream()
                .filter(r -> r.status() != HealthStatus.OUTAGE)
                .count();
        long healthy = enabled.stream()
                .filter(r -> r.status() == HealthStatus.OPERATIONAL || r.status() == HealthStatus.UNKNOWN)
                .count();

        if (usable == 0) {
            return "DOWN";
        } else if (healthy < enabled.size()) {
            return "DEGRADED";
        }
        return "UP";
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String metrics = orchestrator.getMetricsRegistry().scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== HELPER METHODS ====================

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message);
        sendJson(exchange, statusCode, error);
    }
}
