package fr.lapetina.orchestrator.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.orchestrator.domain.exception.ProviderException;
import fr.lapetina.orchestrator.domain.model.ErrorType;
import fr.lapetina.orchestrator.domain.model.HealthSample;
import fr.lapetina.orchestrator.domain.model.Provider;
import fr.lapetina.orchestrator.domain.model.ProviderRequest;
import fr.lapetina.orchestrator.domain.model.ProviderResponse;
import fr.lapetina.orchestrator.infrastructure.health.ProviderProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * HTTP transport to an OpenAI-compatible model gateway that routes to
 * providers by model prefix ({@code provider/model}).
 *
 * Uses java.net.http.HttpClient for non-blocking I/O and keeps one circuit
 * breaker per provider. Also serves as the health probe by listing the
 * gateway's models and counting those of the probed provider.
 */
public class GatewayHttpClient implements ProviderTransport, ProviderProbe, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayHttpClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Map<String, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();

    private final String baseUrl;
    private final String apiKey;
    private final Duration requestTimeout;
    private final Duration probeTimeout;
    private final Map<String, String> extraHeaders;
    private final int failureThreshold;
    private final Duration circuitBreakerRecoveryTimeout;
    private final Clock clock;

    private GatewayHttpClient(Builder builder) {
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(builder.baseUrl, "Gateway base URL is required"));
        this.apiKey = builder.apiKey;
        this.requestTimeout = builder.requestTimeout;
        this.probeTimeout = builder.probeTimeout;
        this.extraHeaders = Map.copyOf(builder.extraHeaders);
        this.failureThreshold = builder.failureThreshold;
        this.circuitBreakerRecoveryTimeout = builder.circuitBreakerRecoveryTimeout;
        this.clock = builder.clock;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(builder.connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Sends a chat completion request for the given provider.
     * The future completes exceptionally with a {@link ProviderException}.
     */
    @Override
    public CompletableFuture<ProviderResponse> send(Provider provider, ProviderRequest request) {
        if (apiKey == null || apiKey.isBlank()) {
            return CompletableFuture.failedFuture(new ProviderException(
                    ErrorType.CONFIGURATION, "Gateway API key is not configured", null, provider.getId(), null));
        }

        CircuitBreaker breaker = getOrCreateCircuitBreaker(provider.getId());
        if (!breaker.allowRequest()) {
            log.warn("Request blocked by circuit breaker: providerId={}, model={}", provider.getId(), request.model());
            return CompletableFuture.failedFuture(new ProviderException(
                    ErrorType.CIRCUIT_OPEN, "Circuit breaker is open for provider: " + provider.getId(),
                    null, provider.getId(), null));
        }

        String qualifiedModel = provider.qualifiedModel(request.model());
        HttpRequest httpRequest;
        try {
            httpRequest = authorized(HttpRequest.newBuilder(URI.create(baseUrl + "/chat/completions")))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(buildRequestBody(qualifiedModel, request)))
                    .build();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to build request: providerId={}, model={}", provider.getId(), qualifiedModel, e);
            return CompletableFuture.failedFuture(new ProviderException(
                    ErrorType.FATAL, "Failed to build request: " + e.getMessage(), null, provider.getId(), e));
        }

        long start = System.nanoTime();
        log.debug("Sending request: providerId={}, model={}, endpoint={}", provider.getId(), qualifiedModel, httpRequest.uri());

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .handle((response, ex) -> {
                    long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                    if (ex != null) {
                        throw handleException(provider, qualifiedModel, ex, breaker);
                    }
                    return handleResponse(provider, qualifiedModel, response, latencyMs, breaker);
                });
    }

    String buildRequestBody(String qualifiedModel, ProviderRequest request) throws JsonProcessingException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", qualifiedModel);
        ArrayNode messages = body.putArray("messages");
        for (ProviderRequest.Message message : request.messages()) {
            messages.addObject()
                    .put("role", message.role())
                    .put("content", message.content());
        }
        if (request.temperature() != null) {
            body.put("temperature", request.temperature());
        }
        if (request.maxTokens() != null) {
            body.put("max_tokens", request.maxTokens());
        }
        return objectMapper.writeValueAsString(body);
    }

    private ProviderResponse handleResponse(
            Provider provider,
            String qualifiedModel,
            HttpResponse<String> response,
            long latencyMs,
            CircuitBreaker breaker
    ) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            breaker.recordSuccess();
            log.info("Request successful: providerId={}, model={}, status={}, latencyMs={}",
                    provider.getId(), qualifiedModel, status, latencyMs);
            return parseSuccessResponse(provider, qualifiedModel, response.body(), latencyMs);
        }

        if (status == 429 || status >= 500) {
            breaker.recordFailure();
        }
        String message = extractErrorMessage(response.body(), status);
        log.warn("Request failed with HTTP error: providerId={}, model={}, status={}, latencyMs={}, error={}",
                provider.getId(), qualifiedModel, status, latencyMs, message);
        throw ProviderException.fromStatus(provider.getId(), status, message);
    }

    ProviderResponse parseSuccessResponse(Provider provider, String qualifiedModel, String body, long latencyMs) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ErrorType.FATAL,
                    "Failed to parse response: " + e.getOriginalMessage(), null, provider.getId(), e);
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new ProviderException(ErrorType.FATAL, "Response contains no completion", null, provider.getId(), null);
        }
        JsonNode usage = root.path("usage");
        return new ProviderResponse(
                provider.getId(),
                root.path("model").asText(qualifiedModel),
                content.asText(),
                usage.path("prompt_tokens").asInt(0),
                usage.path("completion_tokens").asInt(0),
                latencyMs
        );
    }

    String extractErrorMessage(String body, int status) {
        String fallback = "HTTP " + status;
        if (body == null || body.isBlank()) {
            return fallback;
        }
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.isTextual()) {
                return fallback + ": " + error.asText();
            }
            if (error.path("message").isTextual()) {
                return fallback + ": " + error.path("message").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: status={}", status);
        }
        return fallback;
    }

    private ProviderException handleException(Provider provider, String model, Throwable ex, CircuitBreaker breaker) {
        Throwable cause = ProviderException.unwrap(ex);
        if (cause instanceof ProviderException pe) {
            return pe;
        }
        breaker.recordFailure();

        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        if (cause instanceof HttpTimeoutException) {
            log.error("Request timed out: providerId={}, model={}, error={}", provider.getId(), model, message);
            return new ProviderException(ErrorType.TIMEOUT, "Request timed out: " + message, null, provider.getId(), cause);
        }
        if (cause instanceof IOException) {
            log.error("Provider connection error: providerId={}, model={}, errorType={}, error={}",
                    provider.getId(), model, cause.getClass().getSimpleName(), message);
            return new ProviderException(ErrorType.TRANSIENT, "Network error: " + message, null, provider.getId(), cause);
        }
        log.error("Request failed unexpectedly: providerId={}, model={}", provider.getId(), model, cause);
        return new ProviderException(ErrorType.FATAL, message, null, provider.getId(), cause);
    }

    /**
     * Lists the gateway's models and counts those routed to the provider.
     */
    @Override
    public CompletableFuture<HealthSample> probe(Provider provider) {
        HttpRequest request = authorized(HttpRequest.newBuilder(URI.create(baseUrl + "/models")))
                .timeout(probeTimeout)
                .GET()
                .build();

        long start = System.nanoTime();
        log.debug("Health probe started: providerId={}, uri={}", provider.getId(), request.uri());

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                    if (response.statusCode() != 200) {
                        log.warn("Health probe failed: providerId={}, status={}", provider.getId(), response.statusCode());
                        return HealthSample.failure(latencyMs, "HTTP " + response.statusCode());
                    }
                    int models = countProviderModels(provider, response.body());
                    log.debug("Health probe passed: providerId={}, models={}, latencyMs={}", provider.getId(), models, latencyMs);
                    return HealthSample.success(latencyMs, models);
                });
    }

    int countProviderModels(Provider provider, String body) {
        String prefix = provider.getRoutingPath() + "/";
        try {
            int count = 0;
            for (JsonNode model : objectMapper.readTree(body).path("data")) {
                if (model.path("id").asText("").startsWith(prefix)) {
                    count++;
                }
            }
            return count;
        } catch (JsonProcessingException e) {
            log.warn("Unreadable model list: providerId={}, error={}", provider.getId(), e.getOriginalMessage());
            return 0;
        }
    }

    private HttpRequest.Builder authorized(HttpRequest.Builder builder) {
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        extraHeaders.forEach(builder::header);
        return builder;
    }

    private CircuitBreaker getOrCreateCircuitBreaker(String providerId) {
        return circuitBreakers.computeIfAbsent(providerId, id ->
                new CircuitBreaker(id, failureThreshold, circuitBreakerRecoveryTimeout, 2, clock));
    }

    /**
     * Gets the circuit breaker of a provider, null before its first call.
     */
    public CircuitBreaker getCircuitBreaker(String providerId) {
        return circuitBreakers.get(providerId);
    }

    public void resetCircuitBreaker(String providerId) {
        CircuitBreaker breaker = circuitBreakers.get(providerId);
        if (breaker != null) {
            breaker.reset();
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public void close() {
        // HttpClient is only closeable from Java 21
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String baseUrl;
        private String apiKey;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(60);
        private Duration probeTimeout = Duration.ofSeconds(5);
        private final Map<String, String> extraHeaders = new java.util.LinkedHashMap<>();
        private int failureThreshold = 5;
        private Duration circuitBreakerRecoveryTimeout = Duration.ofSeconds(30);
        private Clock clock = Clock.systemUTC();

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder probeTimeout(Duration probeTimeout) {
            this.probeTimeout = probeTimeout;
            return this;
        }

        /**
         * Adds a header sent with every call, e.g. {@code HTTP-Referer} or {@code X-Title}.
         */
        public Builder header(String name, String value) {
            if (name != null && !name.isBlank() && value != null && !value.isBlank()) {
                this.extraHeaders.put(name, value);
            }
            return this;
        }

        public Builder failureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
            return this;
        }

        public Builder circuitBreakerRecoveryTimeout(Duration timeout) {
            this.circuitBreakerRecoveryTimeout = timeout;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public GatewayHttpClient build() {
            return new GatewayHttpClient(this);
        }
    }
}
