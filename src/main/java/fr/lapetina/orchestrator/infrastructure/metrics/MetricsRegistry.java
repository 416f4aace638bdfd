package fr.lapetina.orchestrator.infrastructure.metrics;

import fr.lapetina.orchestrator.dispatch.AnalyticsSink;
import fr.lapetina.orchestrator.domain.model.AttemptRecord;
import fr.lapetina.orchestrator.domain.model.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Attempt counters and latency timers per provider
 * - Dispatch outcome counters and latency per operation
 * - Preference lookup fallback counter
 * - Provider health and cache gauges
 * - JVM and system metrics, Prometheus exposition
 *
 * Also an {@link AnalyticsSink}, so attempt records feed the counters directly.
 */
public final class MetricsRegistry implements AnalyticsSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> attemptCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> callCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> attemptTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> dispatchCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> dispatchTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> preferenceFallbackCounters = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix, boolean bindJvmMetrics) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        if (bindJvmMetrics) {
            new JvmMemoryMetrics().bindTo(registry);
            new JvmGcMetrics().bindTo(registry);
            new JvmThreadMetrics().bindTo(registry);
            new ProcessorMetrics().bindTo(registry);
        }

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry(String prefix) {
        this(prefix, true);
    }

    public MetricsRegistry() {
        this("ai_orchestrator");
    }

    /**
     * Counts one provider attempt of a dispatch and its underlying calls.
     */
    @Override
    public void record(AttemptRecord attempt) {
        String provider = attempt.providerId();
        String outcome = attempt.success() ? "success" : "failure";

        attemptCounters.computeIfAbsent(provider + ":" + attempt.operation() + ":" + outcome, k ->
                Counter.builder(prefix + "_provider_attempts_total")
                        .description("Provider attempts per dispatch, after local retries")
                        .tag("provider", provider)
                        .tag("operation", attempt.operation())
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();

        callCounters.computeIfAbsent(provider, k ->
                Counter.builder(prefix + "_provider_calls_total")
                        .description("Underlying provider calls, retries included")
                        .tag("provider", provider)
                        .register(registry)
        ).increment(attempt.calls());

        attemptTimers.computeIfAbsent(provider, k ->
                Timer.builder(prefix + "_provider_attempt_latency")
                        .description("Time spent on a provider within a dispatch")
                        .tag("provider", provider)
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(Duration.ofMillis(attempt.latencyMs()));

        if (!attempt.success() && attempt.errorType() != null) {
            incrementErrorCount(provider, attempt.errorType());
        }
    }

    /**
     * Increments the error counter of a provider.
     */
    public void incrementErrorCount(String providerId, ErrorType errorType) {
        errorCounters.computeIfAbsent(providerId + ":" + errorType.name(), k ->
                Counter.builder(prefix + "_provider_errors_total")
                        .description("Provider failures by error type")
                        .tag("provider", providerId)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records the terminal outcome of a dispatch.
     */
    public void recordDispatch(String operation, String outcome, Duration latency) {
        dispatchCounters.computeIfAbsent(operation + ":" + outcome, k ->
                Counter.builder(prefix + "_dispatch_total")
                        .description("Dispatches by terminal outcome")
                        .tag("operation", operation)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();

        dispatchTimers.computeIfAbsent(operation, k ->
                Timer.builder(prefix + "_dispatch_latency")
                        .description("End-to-end dispatch latency")
                        .tag("operation", operation)
                        .publishPercentileHistogram()
                        .register(registry)
        ).record(latency);
    }

    /**
     * Counts resolutions that fell back to the environment provider order.
     */
    public void incrementPreferenceFallback(String reason) {
        preferenceFallbackCounters.computeIfAbsent(reason, k ->
                Counter.builder(prefix + "_preference_fallback_total")
                        .description("Resolutions that used the environment default order")
                        .tag("reason", reason)
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a gauge for provider health status.
     */
    public void registerProviderHealth(String providerId, Supplier<Number> healthValue) {
        Gauge.builder(prefix + "_provider_health", healthValue, s -> s.get().doubleValue())
                .description("Provider health status (0=UNKNOWN, 1=OUTAGE, 2=DEGRADED, 3=OPERATIONAL)")
                .tag("provider", providerId)
                .strongReference(true)
                .register(registry);
    }

    /**
     * Registers a gauge backed by a supplier, e.g. cache size or hit rate.
     */
    public void registerGauge(String name, String description, Supplier<Number> value) {
        Gauge.builder(prefix + "_" + name, value, s -> s.get().doubleValue())
                .description(description)
                .strongReference(true)
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
