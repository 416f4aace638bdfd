package fr.lapetina.orchestrator.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object of the orchestrator.
 * Designed to be populated from YAML.
 */
public class OrchestratorConfig {

    private ServerConfig server = new ServerConfig();
    private GatewayConfig gateway = new GatewayConfig();
    private List<ProviderConfig> providers = new ArrayList<>();
    private FallbackConfig fallback = new FallbackConfig();
    private RetryConfig retry = new RetryConfig();
    private HealthCheckConfig healthCheck = new HealthCheckConfig();
    private CacheConfig cache = new CacheConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public GatewayConfig getGateway() { return gateway; }
    public void setGateway(GatewayConfig gateway) { this.gateway = gateway; }

    public List<ProviderConfig> getProviders() { return providers; }
    public void setProviders(List<ProviderConfig> providers) { this.providers = providers; }

    public FallbackConfig getFallback() { return fallback; }
    public void setFallback(FallbackConfig fallback) { this.fallback = fallback; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public HealthCheckConfig getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheckConfig healthCheck) { this.healthCheck = healthCheck; }

    public CacheConfig getCache() { return cache; }
    public void setCache(CacheConfig cache) { this.cache = cache; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Diagnostics HTTP server configuration.
     */
    public static class ServerConfig {
        private boolean enabled = true;
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int threads = 8;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }

    /**
     * Model gateway connection. The API key is read from the environment
     * variable named by {@code apiKeyEnv}, never from the file.
     */
    public static class GatewayConfig {
        private String baseUrl = "https://openrouter.ai/api/v1";
        private String apiKeyEnv = "OPENROUTER_API_KEY";
        private String referer;
        private String title;
        private String defaultModel = "gpt-4o-mini";
        private long connectTimeoutMs = 10000;
        private long requestTimeoutMs = 60000;
        private long attemptTimeoutMs = 0;
        private int circuitBreakerFailureThreshold = 5;
        private long circuitBreakerRecoveryMs = 30000;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKeyEnv() { return apiKeyEnv; }
        public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }

        public String getReferer() { return referer; }
        public void setReferer(String referer) { this.referer = referer; }

        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }

        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        /**
         * Per-attempt timeout applied by the retry engine, 0 to disable.
         */
        public long getAttemptTimeoutMs() { return attemptTimeoutMs; }
        public void setAttemptTimeoutMs(long attemptTimeoutMs) { this.attemptTimeoutMs = attemptTimeoutMs; }

        public int getCircuitBreakerFailureThreshold() { return circuitBreakerFailureThreshold; }
        public void setCircuitBreakerFailureThreshold(int threshold) { this.circuitBreakerFailureThreshold = threshold; }

        public long getCircuitBreakerRecoveryMs() { return circuitBreakerRecoveryMs; }
        public void setCircuitBreakerRecoveryMs(long ms) { this.circuitBreakerRecoveryMs = ms; }
    }

    /**
     * Individual provider configuration.
     */
    public static class ProviderConfig {
        private String id;
        private String name;
        private String routingPath;
        private int priority = 100;
        private boolean enabled = true;
        private ModelsConfig models = new ModelsConfig();

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getRoutingPath() { return routingPath; }
        public void setRoutingPath(String routingPath) { this.routingPath = routingPath; }

        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public ModelsConfig getModels() { return models; }
        public void setModels(ModelsConfig models) { this.models = models; }
    }

    /**
     * Provider-specific model names per task tier. Unset tiers use the
     * standard model, then the gateway default model.
     */
    public static class ModelsConfig {
        private String fast;
        private String standard;
        private String advanced;

        public String getFast() { return fast; }
        public void setFast(String fast) { this.fast = fast; }

        public String getStandard() { return standard; }
        public void setStandard(String standard) { this.standard = standard; }

        public String getAdvanced() { return advanced; }
        public void setAdvanced(String advanced) { this.advanced = advanced; }
    }

    /**
     * Environment default for cross-provider fallback.
     */
    public static class FallbackConfig {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    /**
     * Retry configuration.
     */
    public static class RetryConfig {
        private int maxAttempts = 3;
        private long initialDelayMs = 100;
        private long maxDelayMs = 5000;
        private double multiplier = 2.0;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public long getInitialDelayMs() { return initialDelayMs; }
        public void setInitialDelayMs(long initialDelayMs) { this.initialDelayMs = initialDelayMs; }

        public long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }

        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }
    }

    /**
     * Health monitor configuration.
     */
    public static class HealthCheckConfig {
        private boolean enabled = true;
        private long intervalMs = 30000;
        private long probeTimeoutMs = 5000;
        private int windowSize = 20;
        private int outageConsecutiveFailures = 3;
        private double degradedSuccessRate = 0.8;
        private long degradedLatencyMs = 5000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public long getProbeTimeoutMs() { return probeTimeoutMs; }
        public void setProbeTimeoutMs(long probeTimeoutMs) { this.probeTimeoutMs = probeTimeoutMs; }

        public int getWindowSize() { return windowSize; }
        public void setWindowSize(int windowSize) { this.windowSize = windowSize; }

        public int getOutageConsecutiveFailures() { return outageConsecutiveFailures; }
        public void setOutageConsecutiveFailures(int count) { this.outageConsecutiveFailures = count; }

        public double getDegradedSuccessRate() { return degradedSuccessRate; }
        public void setDegradedSuccessRate(double degradedSuccessRate) { this.degradedSuccessRate = degradedSuccessRate; }

        public long getDegradedLatencyMs() { return degradedLatencyMs; }
        public void setDegradedLatencyMs(long degradedLatencyMs) { this.degradedLatencyMs = degradedLatencyMs; }
    }

    /**
     * Context cache configuration. Fixed for the lifetime of the process.
     */
    public static class CacheConfig {
        private long ttlMs = 300000;
        private int maxSize = 50;
        private long cleanupIntervalMs = 120000;

        public long getTtlMs() { return ttlMs; }
        public void setTtlMs(long ttlMs) { this.ttlMs = ttlMs; }

        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }

        public long getCleanupIntervalMs() { return cleanupIntervalMs; }
        public void setCleanupIntervalMs(long cleanupIntervalMs) { this.cleanupIntervalMs = cleanupIntervalMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "ai_orchestrator";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
