package fr.lapetina.orchestrator;

import fr.lapetina.orchestrator.dispatch.AnalyticsSink;
import fr.lapetina.orchestrator.dispatch.FallbackDispatcher;
import fr.lapetina.orchestrator.dispatch.LoggingAnalyticsSink;
import fr.lapetina.orchestrator.domain.model.OperationContext;
import fr.lapetina.orchestrator.domain.model.ModelTier;
import fr.lapetina.orchestrator.domain.model.Provider;
import fr.lapetina.orchestrator.domain.model.ProviderHealthRecord;
import fr.lapetina.orchestrator.domain.model.ProviderRequest;
import fr.lapetina.orchestrator.domain.model.ProviderResponse;
import fr.lapetina.orchestrator.domain.model.Result;
import fr.lapetina.orchestrator.domain.resolution.InMemoryPreferenceStore;
import fr.lapetina.orchestrator.domain.resolution.PreferenceStore;
import fr.lapetina.orchestrator.domain.resolution.ProviderResolver;
import fr.lapetina.orchestrator.infrastructure.cache.CacheStats;
import fr.lapetina.orchestrator.infrastructure.cache.ContextCache;
import fr.lapetina.orchestrator.infrastructure.config.ConfigLoader;
import fr.lapetina.orchestrator.infrastructure.config.OrchestratorConfig;
import fr.lapetina.orchestrator.infrastructure.health.HealthThresholds;
import fr.lapetina.orchestrator.infrastructure.health.ProviderHealthMonitor;
import fr.lapetina.orchestrator.infrastructure.health.ProviderProbe;
import fr.lapetina.orchestrator.infrastructure.health.ProviderRegistry;
import fr.lapetina.orchestrator.infrastructure.http.GatewayHttpClient;
import fr.lapetina.orchestrator.infrastructure.http.ProviderTransport;
import fr.lapetina.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.orchestrator.infrastructure.retry.RetryExecutor;
import fr.lapetina.orchestrator.infrastructure.retry.RetryPolicy;
import fr.lapetina.orchestrator.infrastructure.retry.ScheduledBackoffScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Wires the orchestration layer from configuration and exposes it as a single facade.
 *
 * <p>Usage:
 * <pre>{@code
 * try (AiOrchestrator orchestrator = AiOrchestrator.create("config.yaml").start()) {
 *     Result<ProviderResponse> result = orchestrator
 *             .dispatch("summarize", userId, provider -> ProviderRequest.of(model, system, prompt))
 *             .join();
 * }
 * }</pre>
 */
public class AiOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AiOrchestrator.class);

    private final OrchestratorConfig config;
    private final MetricsRegistry metricsRegistry;
    private final ProviderRegistry providerRegistry;
    private final GatewayHttpClient gatewayClient;
    private final ProviderTransport transport;
    private final ProviderHealthMonitor healthMonitor;
    private final ScheduledBackoffScheduler backoffScheduler;
    private final RetryPolicy retryPolicy;
    private final ContextCache<String> contextCache;
    private final ScheduledExecutorService cacheCleanupScheduler;
    private final PreferenceStore preferenceStore;
    private final ProviderResolver resolver;
    private final ExecutorService sinkExecutor;
    private final FallbackDispatcher dispatcher;

    protected AiOrchestrator(
            OrchestratorConfig config,
            ProviderTransport transportOverride,
            ProviderProbe probeOverride,
            PreferenceStore preferenceStoreOverride,
            List<AnalyticsSink> additionalSinks
    ) {
        this.config = config;

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        this.providerRegistry = new ProviderRegistry();
        loadProviders();

        // The gateway client is only built when something still needs it
        this.gatewayClient = transportOverride == null || probeOverride == null ? createGatewayClient() : null;
        this.transport = transportOverride != null ? transportOverride : gatewayClient;
        ProviderProbe probe = probeOverride != null ? probeOverride : gatewayClient;

        OrchestratorConfig.HealthCheckConfig healthConfig = config.getHealthCheck();
        this.healthMonitor = new ProviderHealthMonitor(
                providerRegistry,
                probe,
                new HealthThresholds(
                        healthConfig.getWindowSize(),
                        healthConfig.getOutageConsecutiveFailures(),
                        healthConfig.getDegradedSuccessRate(),
                        healthConfig.getDegradedLatencyMs()
                ),
                Duration.ofMillis(healthConfig.getIntervalMs()),
                Duration.ofMillis(healthConfig.getProbeTimeoutMs())
        );

        this.backoffScheduler = new ScheduledBackoffScheduler();
        this.retryPolicy = createRetryPolicy();

        OrchestratorConfig.CacheConfig cacheConfig = config.getCache();
        this.contextCache = new ContextCache<>(Duration.ofMillis(cacheConfig.getTtlMs()), cacheConfig.getMaxSize());
        this.cacheCleanupScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "context-cache-cleanup");
            t.setDaemon(true);
            return t;
        });

        this.preferenceStore = preferenceStoreOverride != null ? preferenceStoreOverride : new InMemoryPreferenceStore();
        this.resolver = new ProviderResolver(
                providerRegistry, preferenceStore, config.getFallback().isEnabled(), metricsRegistry);

        AtomicInteger sinkThreads = new AtomicInteger();
        this.sinkExecutor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "analytics-sink-" + sinkThreads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        long attemptTimeoutMs = config.getGateway().getAttemptTimeoutMs();
        FallbackDispatcher.Builder dispatcherBuilder = FallbackDispatcher.builder()
                .resolver(resolver)
                .retryExecutor(new RetryExecutor(backoffScheduler))
                .retryPolicy(retryPolicy)
                .attemptTimeout(attemptTimeoutMs > 0 ? Duration.ofMillis(attemptTimeoutMs) : null)
                .healthMonitor(healthMonitor)
                .sinkExecutor(sinkExecutor)
                .metricsRegistry(metricsRegistry)
                .analyticsSink(new LoggingAnalyticsSink());
        if (config.getMetrics().isEnabled()) {
            dispatcherBuilder.analyticsSink(metricsRegistry);
        }
        for (AnalyticsSink sink : additionalSinks) {
            dispatcherBuilder.analyticsSink(sink);
        }
        this.dispatcher = dispatcherBuilder.build();

        registerMetrics();

        log.info("AiOrchestrator initialized: providers={}, enabled={}, fallbackEnabled={}",
                providerRegistry.size(), providerRegistry.getEnabledProviders().size(), config.getFallback().isEnabled());
    }

    protected AiOrchestrator(String configPath, ProviderTransport transportOverride, ProviderProbe probeOverride) {
        this(loadConfig(configPath), transportOverride, probeOverride, null, List.of());
    }

    /**
     * Creates an orchestrator from the specified configuration file.
     */
    public static AiOrchestrator create(String configPath) {
        return new AiOrchestrator(configPath, null, null);
    }

    /**
     * Creates an orchestrator from the default configuration (config.yaml).
     */
    public static AiOrchestrator create() {
        return create("config.yaml");
    }

    /**
     * Creates an orchestrator from an already loaded configuration.
     */
    public static AiOrchestrator create(OrchestratorConfig config) {
        return new AiOrchestrator(config, null, null, null, List.of());
    }

    /**
     * Starts the health monitor and the periodic cache cleanup.
     */
    public AiOrchestrator start() {
        if (config.getHealthCheck().isEnabled()) {
            healthMonitor.start();
        }
        long cleanupMs = config.getCache().getCleanupIntervalMs();
        if (cleanupMs > 0) {
            cacheCleanupScheduler.scheduleAtFixedRate(this::cleanupCache, cleanupMs, cleanupMs, TimeUnit.MILLISECONDS);
        }
        log.info("AiOrchestrator started");
        return this;
    }

    /**
     * Sends a chat completion to the resolved providers with fallback.
     *
     * @param operationName logical name used in logs and telemetry
     * @param userId        caller identity for preference lookup, null when anonymous
     * @param buildRequest  builds the request for a given provider
     */
    public CompletableFuture<Result<ProviderResponse>> dispatch(
            String operationName,
            String userId,
            Function<Provider, ProviderRequest> buildRequest
    ) {
        return dispatcher.execute(operationName, userId, provider -> transport.send(provider, buildRequest.apply(provider)));
    }

    /**
     * Sends a system and user prompt with each provider's standard model.
     */
    public CompletableFuture<Result<ProviderResponse>> dispatch(
            String operationName,
            String userId,
            String systemPrompt,
            String userPrompt
    ) {
        return dispatch(operationName, userId, ModelTier.STANDARD, systemPrompt, userPrompt);
    }

    /**
     * Sends a system and user prompt; every provider tried gets its own model for {@code tier}.
     */
    public CompletableFuture<Result<ProviderResponse>> dispatch(
            String operationName,
            String userId,
            ModelTier tier,
            String systemPrompt,
            String userPrompt
    ) {
        return dispatch(operationName, userId,
                provider -> ProviderRequest.of(resolveModel(provider, tier), systemPrompt, userPrompt));
    }

    /**
     * Model name to request from a provider for a tier, falling back to the gateway default model.
     */
    public String resolveModel(Provider provider, ModelTier tier) {
        return provider.modelFor(tier).orElse(config.getGateway().getDefaultModel());
    }

    /**
     * Runs an arbitrary provider-bound operation with fallback.
     */
    public <T> CompletableFuture<Result<T>> execute(
            String operationName,
            String userId,
            Function<Provider, CompletableFuture<T>> operation
    ) {
        return dispatcher.execute(operationName, userId, operation);
    }

    public Optional<String> getCachedContext(String subjectId, String contentHash) {
        return contextCache.get(subjectId, contentHash);
    }

    public void cacheContext(String subjectId, String payload, String contentHash) {
        contextCache.set(subjectId, payload, contentHash);
    }

    /**
     * Returns the cached payload for the context, extracting and caching it on a miss.
     */
    public String getOrComputeContext(OperationContext context, Function<OperationContext, String> extractor) {
        return contextCache.getOrCompute(context, extractor);
    }

    public String hashContext(Object content) {
        return contextCache.getHasher().hash(content);
    }

    public boolean invalidateContext(String subjectId) {
        return contextCache.invalidate(subjectId);
    }

    public void clearCache() {
        contextCache.clear();
    }

    public CacheStats getCacheStats() {
        return contextCache.stats();
    }

    public List<ProviderHealthRecord> getProviderStatuses() {
        return healthMonitor.getAllStatuses();
    }

    public ProviderHealthRecord getProviderStatus(String providerId) {
        return healthMonitor.getStatus(providerId);
    }

    public OrchestratorConfig getConfig() {
        return config;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ProviderRegistry getProviderRegistry() {
        return providerRegistry;
    }

    public ProviderHealthMonitor getHealthMonitor() {
        return healthMonitor;
    }

    public PreferenceStore getPreferenceStore() {
        return preferenceStore;
    }

    public ProviderResolver getResolver() {
        return resolver;
    }

    public FallbackDispatcher getDispatcher() {
        return dispatcher;
    }

    public ContextCache<String> getContextCache() {
        return contextCache;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    private static OrchestratorConfig loadConfig(String configPath) {
        log.info("Initializing AiOrchestrator from config: {}", configPath);
        return new ConfigLoader(configPath).load();
    }

    private GatewayHttpClient createGatewayClient() {
        OrchestratorConfig.GatewayConfig gateway = config.getGateway();
        String apiKey = gateway.getApiKeyEnv() != null ? System.getenv(gateway.getApiKeyEnv()) : null;
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("No gateway API key found, provider calls will be rejected: env={}", gateway.getApiKeyEnv());
        }

        GatewayHttpClient.Builder builder = GatewayHttpClient.builder()
                .baseUrl(gateway.getBaseUrl())
                .apiKey(apiKey)
                .connectTimeout(Duration.ofMillis(gateway.getConnectTimeoutMs()))
                .requestTimeout(Duration.ofMillis(gateway.getRequestTimeoutMs()))
                .probeTimeout(Duration.ofMillis(config.getHealthCheck().getProbeTimeoutMs()))
                .failureThreshold(gateway.getCircuitBreakerFailureThreshold())
                .circuitBreakerRecoveryTimeout(Duration.ofMillis(gateway.getCircuitBreakerRecoveryMs()));
        if (gateway.getReferer() != null) {
            builder.header("HTTP-Referer", gateway.getReferer());
        }
        if (gateway.getTitle() != null) {
            builder.header("X-Title", gateway.getTitle());
        }
        return builder.build();
    }

    private RetryPolicy createRetryPolicy() {
        OrchestratorConfig.RetryConfig retry = config.getRetry();
        return new RetryPolicy(
                retry.getMaxAttempts(),
                Duration.ofMillis(retry.getInitialDelayMs()),
                retry.getMultiplier(),
                Duration.ofMillis(retry.getMaxDelayMs()),
                null
        );
    }

    private void loadProviders() {
        for (OrchestratorConfig.ProviderConfig providerConfig : config.getProviders()) {
            OrchestratorConfig.ModelsConfig models = providerConfig.getModels();
            Provider provider = Provider.builder()
                    .id(providerConfig.getId())
                    .name(providerConfig.getName())
                    .routingPath(providerConfig.getRoutingPath())
                    .priority(providerConfig.getPriority())
                    .enabled(providerConfig.isEnabled())
                    .model(ModelTier.FAST, models != null ? models.getFast() : null)
                    .model(ModelTier.STANDARD, models != null ? models.getStandard() : null)
                    .model(ModelTier.ADVANCED, models != null ? models.getAdvanced() : null)
                    .build();
            providerRegistry.registerProvider(provider);
            log.debug("Registered provider: {}", provider);
        }
    }

    private void registerMetrics() {
        if (!config.getMetrics().isEnabled()) {
            return;
        }
        for (Provider provider : providerRegistry.getAllProviders()) {
            String providerId = provider.getId();
            metricsRegistry.registerProviderHealth(providerId,
                    () -> healthMonitor.getStatus(providerId).status().gaugeValue());
        }
        metricsRegistry.registerGauge("context_cache_size", "Entries held by the context cache", contextCache::size);
        metricsRegistry.registerGauge("context_cache_hit_rate", "Context cache hit rate since the last clear",
                () -> contextCache.stats().hitRate());
    }

    private void cleanupCache() {
        try {
            int removed = contextCache.cleanup();
            if (removed > 0) {
                log.debug("Context cache cleanup: removed={}", removed);
            }
        } catch (RuntimeException e) {
            log.warn("Context cache cleanup failed", e);
        }
    }

    @Override
    public void close() {
        log.info("Shutting down AiOrchestrator...");

        try {
            healthMonitor.close();
        } catch (Exception e) {
            log.warn("Error closing health monitor", e);
        }

        cacheCleanupScheduler.shutdownNow();

        try {
            sinkExecutor.shutdown();
            if (!sinkExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                sinkExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            sinkExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        try {
            backoffScheduler.close();
        } catch (Exception e) {
            log.warn("Error closing backoff scheduler", e);
        }

        if (gatewayClient != null) {
            try {
                gatewayClient.close();
            } catch (Exception e) {
                log.warn("Error closing gateway client", e);
            }
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("AiOrchestrator shut down");
    }
}
