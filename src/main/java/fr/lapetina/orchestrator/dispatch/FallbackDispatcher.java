package fr.lapetina.orchestrator.dispatch;

import fr.lapetina.orchestrator.domain.exception.AggregatedDispatchException;
import fr.lapetina.orchestrator.domain.exception.ProviderException;
import fr.lapetina.orchestrator.domain.model.AttemptRecord;
import fr.lapetina.orchestrator.domain.model.Provider;
import fr.lapetina.orchestrator.domain.model.Result;
import fr.lapetina.orchestrator.domain.resolution.ProviderResolution;
import fr.lapetina.orchestrator.domain.resolution.ProviderResolver;
import fr.lapetina.orchestrator.infrastructure.health.ProviderHealthMonitor;
import fr.lapetina.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.orchestrator.infrastructure.retry.RetryExecutor;
import fr.lapetina.orchestrator.infrastructure.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs an operation against the resolved providers, first success wins.
 *
 * The resolver is consulted once per dispatch. Providers are tried strictly in
 * resolved order, each one under the retry engine; a provider that failed is
 * never tried again within the same dispatch. Every attempted provider produces
 * exactly one {@link AttemptRecord}, fed to the health monitor and to the
 * analytics sinks once the provider settled.
 *
 * The returned future never completes exceptionally.
 */
public final class FallbackDispatcher {

    private static final Logger log = LoggerFactory.getLogger(FallbackDispatcher.class);

    private final ProviderResolver resolver;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;
    private final Duration attemptTimeout;
    private final ProviderHealthMonitor healthMonitor;
    private final List<AnalyticsSink> analyticsSinks;
    private final Executor sinkExecutor;
    private final MetricsRegistry metricsRegistry;

    private FallbackDispatcher(Builder builder) {
        this.resolver = Objects.requireNonNull(builder.resolver, "Resolver is required");
        this.retryExecutor = Objects.requireNonNull(builder.retryExecutor, "Retry executor is required");
        this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : RetryPolicy.defaults();
        this.attemptTimeout = builder.attemptTimeout;
        this.healthMonitor = Objects.requireNonNull(builder.healthMonitor, "Health monitor is required");
        this.analyticsSinks = List.copyOf(builder.analyticsSinks);
        this.sinkExecutor = Objects.requireNonNull(builder.sinkExecutor, "Sink executor is required");
        this.metricsRegistry = builder.metricsRegistry;
    }

    /**
     * Executes an operation with provider fallback.
     *
     * @param operationName logical name used in logs and telemetry
     * @param userId        caller identity for preference lookup, null when anonymous
     * @param operation     call to perform against a given provider
     * @return the first successful value, or a typed failure
     */
    public <T> CompletableFuture<Result<T>> execute(
            String operationName,
            String userId,
            Function<Provider, CompletableFuture<T>> operation
    ) {
        DispatchContext<T> ctx = new DispatchContext<>(
                operationName, newDispatchId(), userId, operation, System.nanoTime());

        CompletableFuture<Result<T>> outcome;
        try {
            outcome = resolver.resolve(userId).thenCompose(resolution -> start(ctx, resolution));
        } catch (RuntimeException e) {
            outcome = CompletableFuture.failedFuture(e);
        }

        return outcome.handle((result, ex) -> {
            if (ex != null) {
                ProviderException error = ProviderException.wrap(ex, null);
                withMdc(ctx, () -> log.error("Dispatch failed unexpectedly: operation={}, dispatchId={}",
                        ctx.operationName, ctx.dispatchId, error));
                return Result.<T>failure(error);
            }
            return result;
        });
    }

    private <T> CompletableFuture<Result<T>> start(DispatchContext<T> ctx, ProviderResolution resolution) {
        ctx.resolution = resolution;
        if (resolution.isEmpty()) {
            ProviderException error = ProviderException.configuration("No AI providers are enabled");
            withMdc(ctx, () -> log.error("Dispatch rejected, no provider enabled: operation={}, source={}",
                    ctx.operationName, resolution.source()));
            return CompletableFuture.completedFuture(finish(ctx, DispatchState.REJECTED, Result.failure(error)));
        }

        withMdc(ctx, () -> log.debug("Dispatch started: operation={}, userId={}, providers={}, allowFallback={}, source={}",
                ctx.operationName,
                ctx.userId,
                resolution.providers().stream().map(Provider::getId).toList(),
                resolution.allowFallback(),
                resolution.source()));
        return attempt(ctx, 0);
    }

    private <T> CompletableFuture<Result<T>> attempt(DispatchContext<T> ctx, int index) {
        List<Provider> providers = ctx.resolution.providers();
        Provider provider = providers.get(index);
        ctx.attempted.add(provider.getId());

        AtomicInteger calls = new AtomicInteger();
        long start = System.nanoTime();
        AtomicLong lastCallStart = new AtomicLong(start);
        Supplier<CompletableFuture<T>> call = () -> {
            calls.incrementAndGet();
            lastCallStart.set(System.nanoTime());
            return ctx.operation.apply(provider);
        };
        String retryLabel = ctx.operationName + "@" + provider.getId();

        CompletableFuture<Result<T>> attempt = attemptTimeout != null
                ? retryExecutor.executeWithRetryAndTimeout(retryLabel, call, attemptTimeout, retryPolicy)
                : retryExecutor.executeWithRetry(retryLabel, call, retryPolicy);

        return attempt.thenCompose(result -> {
            long now = System.nanoTime();
            long latencyMs = TimeUnit.NANOSECONDS.toMillis(now - start);
            long callLatencyMs = TimeUnit.NANOSECONDS.toMillis(now - lastCallStart.get());
            record(ctx, provider, result, latencyMs, callLatencyMs, calls.get());

            boolean hasNext = index + 1 < providers.size();
            DispatchState state = DispatchState.afterAttempt(
                    result.isSuccess(), result.errorType(), ctx.resolution.allowFallback(), hasNext);

            return switch (state) {
                case SUCCESS -> CompletableFuture.completedFuture(
                        finish(ctx, state, result.withProvider(provider.getId())));
                case REJECTED -> CompletableFuture.completedFuture(
                        finish(ctx, state, result.withProvider(provider.getId())));
                case EXHAUSTED -> CompletableFuture.completedFuture(
                        finish(ctx, state, Result.failure(new AggregatedDispatchException(
                                ctx.operationName, ctx.attempted, result.error()))));
                case FALLBACK -> {
                    withMdc(ctx, () -> log.warn("Provider failed, falling back: operation={}, providerId={}, nextProviderId={}, errorType={}, error={}",
                            ctx.operationName, provider.getId(), providers.get(index + 1).getId(),
                            result.errorType(), result.error().getMessage()));
                    yield attempt(ctx, index + 1);
                }
                case ATTEMPTING -> throw new IllegalStateException("Attempt settled without a terminal or fallback state");
            };
        });
    }

    private <T> Result<T> finish(DispatchContext<T> ctx, DispatchState state, Result<T> result) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - ctx.startNanos);
        withMdc(ctx, () -> {
            switch (state) {
                case SUCCESS -> log.info("Dispatch succeeded: operation={}, providerId={}, attemptedProviders={}, latencyMs={}",
                        ctx.operationName, result.providerId(), ctx.attempted, elapsed.toMillis());
                case EXHAUSTED -> log.error("Dispatch failed with all providers: operation={}, attemptedProviders={}, latencyMs={}, error={}",
                        ctx.operationName, ctx.attempted, elapsed.toMillis(), result.error().getMessage());
                default -> log.error("Dispatch rejected: operation={}, attemptedProviders={}, error={}",
                        ctx.operationName, ctx.attempted, result.error().getMessage());
            }
        });
        if (metricsRegistry != null) {
            metricsRegistry.recordDispatch(ctx.operationName, state.name().toLowerCase(), elapsed);
        }
        return result;
    }

    /**
     * The analytics record carries the wall time spent on the provider, backoff
     * included. The health sample carries the latency of the last call only.
     */
    private <T> void record(DispatchContext<T> ctx, Provider provider, Result<T> result,
                            long latencyMs, long callLatencyMs, int calls) {
        AttemptRecord attempt = new AttemptRecord(
                provider.getId(),
                ctx.operationName,
                ctx.dispatchId,
                result.isSuccess(),
                latencyMs,
                calls,
                result.errorType(),
                result.isFailure() ? result.error().getMessage() : null,
                Instant.now()
        );

        try {
            healthMonitor.recordSample(provider, attempt.toHealthSample(callLatencyMs));
        } catch (RuntimeException e) {
            log.warn("Failed to record health sample: providerId={}, error={}", provider.getId(), e.getMessage());
        }

        for (AnalyticsSink sink : analyticsSinks) {
            try {
                sinkExecutor.execute(() -> {
                    try {
                        sink.record(attempt);
                    } catch (RuntimeException e) {
                        log.warn("Analytics sink failed: sink={}, providerId={}, error={}",
                                sink.getClass().getSimpleName(), provider.getId(), e.getMessage());
                    }
                });
            } catch (RejectedExecutionException e) {
                log.warn("Analytics record dropped, executor rejected it: providerId={}, dispatchId={}",
                        provider.getId(), ctx.dispatchId);
            }
        }
    }

    private static void withMdc(DispatchContext<?> ctx, Runnable action) {
        MDC.put("operation", ctx.operationName);
        MDC.put("dispatchId", ctx.dispatchId);
        try {
            action.run();
        } finally {
            MDC.remove("operation");
            MDC.remove("dispatchId");
        }
    }

    private static String newDispatchId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Mutable state of one dispatch. Only touched by the dispatch's own
     * continuation chain, which is sequential.
     */
    private static final class DispatchContext<T> {
        private final String operationName;
        private final String dispatchId;
        private final String userId;
        private final Function<Provider, CompletableFuture<T>> operation;
        private final long startNanos;
        private final List<String> attempted = new ArrayList<>();
        private ProviderResolution resolution;

        private DispatchContext(
                String operationName,
                String dispatchId,
                String userId,
                Function<Provider, CompletableFuture<T>> operation,
                long startNanos
        ) {
            this.operationName = operationName;
            this.dispatchId = dispatchId;
            this.userId = userId;
            this.operation = operation;
            this.startNanos = startNanos;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ProviderResolver resolver;
        private RetryExecutor retryExecutor;
        private RetryPolicy retryPolicy;
        private Duration attemptTimeout;
        private ProviderHealthMonitor healthMonitor;
        private final List<AnalyticsSink> analyticsSinks = new ArrayList<>();
        private Executor sinkExecutor;
        private MetricsRegistry metricsRegistry;

        public Builder resolver(ProviderResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder retryExecutor(RetryExecutor retryExecutor) {
            this.retryExecutor = retryExecutor;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * Per-attempt timeout, null for none.
         */
        public Builder attemptTimeout(Duration attemptTimeout) {
            this.attemptTimeout = attemptTimeout;
            return this;
        }

        public Builder healthMonitor(ProviderHealthMonitor healthMonitor) {
            this.healthMonitor = healthMonitor;
            return this;
        }

        public Builder analyticsSink(AnalyticsSink sink) {
            this.analyticsSinks.add(sink);
            return this;
        }

        public Builder sinkExecutor(Executor sinkExecutor) {
            this.sinkExecutor = sinkExecutor;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public FallbackDispatcher build() {
            return new FallbackDispatcher(this);
        }
    }
}
