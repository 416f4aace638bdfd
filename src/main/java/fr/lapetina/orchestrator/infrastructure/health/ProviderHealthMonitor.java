package fr.lapetina.orchestrator.infrastructure.health;

import fr.lapetina.orchestrator.domain.exception.ProviderException;
import fr.lapetina.orchestrator.domain.model.HealthSample;
import fr.lapetina.orchestrator.domain.model.HealthStatus;
import fr.lapetina.orchestrator.domain.model.Provider;
import fr.lapetina.orchestrator.domain.model.ProviderHealthRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Background health monitor for providers.
 *
 * Periodically probes every enabled provider and keeps a rolling window of the
 * most recent samples per provider. Dispatch outcomes are fed in as samples too.
 * Each sample rebuilds an immutable {@link ProviderHealthRecord}; readers never
 * take the lock and never see a partially updated record.
 */
public final class ProviderHealthMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProviderHealthMonitor.class);

    private final ProviderRegistry providerRegistry;
    private final ProviderProbe providerProbe;
    private final HealthThresholds thresholds;
    private final Duration checkInterval;
    private final Duration probeTimeout;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Deque<HealthSample>> windows = new ConcurrentHashMap<>();
    private final Map<String, Integer> lastModelCounts = new ConcurrentHashMap<>();
    private final Map<String, ProviderHealthRecord> records = new ConcurrentHashMap<>();

    public ProviderHealthMonitor(
            ProviderRegistry providerRegistry,
            ProviderProbe providerProbe,
            HealthThresholds thresholds,
            Duration checkInterval,
            Duration probeTimeout
    ) {
        this.providerRegistry = Objects.requireNonNull(providerRegistry, "Provider registry is required");
        this.providerProbe = Objects.requireNonNull(providerProbe, "Provider probe is required");
        this.thresholds = Objects.requireNonNull(thresholds, "Thresholds are required");
        this.checkInterval = checkInterval;
        this.probeTimeout = probeTimeout;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "provider-health-monitor");
            t.setDaemon(true);
            return t;
        });

        for (Provider provider : providerRegistry.getAllProviders()) {
            records.put(provider.getId(), ProviderHealthRecord.unknown(provider));
        }
    }

    public ProviderHealthMonitor(ProviderRegistry providerRegistry, ProviderProbe providerProbe) {
        this(providerRegistry, providerProbe, HealthThresholds.defaults(), Duration.ofSeconds(30), Duration.ofSeconds(5));
    }

    /**
     * Starts the periodic probe loop. The first cycle runs immediately.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::runCycle,
                    0,
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Health monitor started: interval={}, windowSize={}", checkInterval, thresholds.windowSize());
        }
    }

    private void runCycle() {
        if (!running.get()) {
            return;
        }
        try {
            checkAllProviders();
        } catch (RuntimeException e) {
            log.error("Health check cycle failed", e);
        }
    }

    /**
     * Probes every enabled provider once. Probes run asynchronously; the method
     * returns a future completing when every probe has been recorded.
     */
    public CompletableFuture<Void> checkAllProviders() {
        List<Provider> enabled = providerRegistry.getEnabledProviders();
        log.debug("Starting health check cycle: providerCount={}", enabled.size());

        CompletableFuture<?>[] probes = enabled.stream()
                .map(provider -> probe(provider).thenAccept(sample -> recordSample(provider, sample)))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(probes);
    }

    /**
     * Probes a single provider without recording the result.
     * The returned future never completes exceptionally: probe errors and
     * timeouts yield a failed sample.
     */
    public CompletableFuture<HealthSample> probe(Provider provider) {
        long start = System.nanoTime();
        CompletableFuture<HealthSample> result;
        try {
            CompletableFuture<HealthSample> source = providerProbe.probe(provider);
            result = source != null
                    ? source.copy().orTimeout(probeTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    : CompletableFuture.failedFuture(new IllegalStateException("Probe returned no result"));
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }

        return result.handle((sample, ex) -> {
            if (ex == null && sample != null) {
                return sample;
            }
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            String message = describeProbeFailure(ex);
            log.warn("Health probe failed: providerId={}, latencyMs={}, error={}",
                    provider.getId(), elapsedMs, message);
            return HealthSample.failure(elapsedMs, message);
        });
    }

    private String describeProbeFailure(Throwable ex) {
        if (ex == null) {
            return "Probe returned no result";
        }
        Throwable cause = ProviderException.unwrap(ex);
        if (cause instanceof TimeoutException) {
            return "Probe timed out after " + probeTimeout.toMillis() + "ms";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    /**
     * Adds a sample to the provider's window and reclassifies it.
     */
    public ProviderHealthRecord recordSample(Provider provider, HealthSample sample) {
        Objects.requireNonNull(provider, "Provider is required");
        Objects.requireNonNull(sample, "Sample is required");

        ProviderHealthRecord previous;
        ProviderHealthRecord updated;

        lock.lock();
        try {
            Deque<HealthSample> window = windows.computeIfAbsent(provider.getId(), id -> new ArrayDeque<>());
            window.addLast(sample);
            while (window.size() > thresholds.windowSize()) {
                window.removeFirst();
            }
            if (sample.success() && sample.modelCount() > 0) {
                lastModelCounts.put(provider.getId(), sample.modelCount());
            }
            previous = records.get(provider.getId());
            updated = buildRecord(provider, window, lastModelCounts.getOrDefault(provider.getId(), 0));
            records.put(provider.getId(), updated);
        } finally {
            lock.unlock();
        }

        HealthStatus before = previous != null ? previous.status() : HealthStatus.UNKNOWN;
        if (before != updated.status()) {
            log.info("Provider health changed: providerId={}, previousStatus={}, newStatus={}, successRate={}, avgLatencyMs={}",
                    provider.getId(), before, updated.status(),
                    String.format("%.2f", updated.successRate()), updated.avgLatencyMs());
        } else {
            log.debug("Health sample recorded: providerId={}, success={}, latencyMs={}, status={}",
                    provider.getId(), sample.success(), sample.latencyMs(), updated.status());
        }
        return updated;
    }

    /**
     * Latest record of a provider. Unknown providers and providers without samples are {@code UNKNOWN}.
     */
    public ProviderHealthRecord getStatus(Provider provider) {
        ProviderHealthRecord record = records.get(provider.getId());
        return record != null ? record : ProviderHealthRecord.unknown(provider);
    }

    public ProviderHealthRecord getStatus(String providerId) {
        ProviderHealthRecord record = records.get(providerId);
        if (record != null) {
            return record;
        }
        return providerRegistry.getProvider(providerId)
                .map(ProviderHealthRecord::unknown)
                .orElseGet(() -> new ProviderHealthRecord(
                        providerId, providerId, false, HealthStatus.UNKNOWN, 0, 0.0, 0, 0, null));
    }

    /**
     * Records of every registered provider, in priority order.
     */
    public List<ProviderHealthRecord> getAllStatuses() {
        return providerRegistry.getAllProviders().stream()
                .map(this::getStatus)
                .toList();
    }

    public boolean isRunning() {
        return running.get();
    }

    private ProviderHealthRecord buildRecord(Provider provider, Deque<HealthSample> window, int modelCount) {
        int total = window.size();
        int successes = 0;
        long successLatency = 0;
        Instant last = null;
        for (HealthSample s : window) {
            if (s.success()) {
                successes++;
                successLatency += s.latencyMs();
            }
            last = s.observedAt();
        }
        double successRate = total == 0 ? 0.0 : (double) successes / total;
        long avgLatency = successes == 0 ? 0 : successLatency / successes;

        return new ProviderHealthRecord(
                provider.getId(),
                provider.getName(),
                provider.isEnabled(),
                classify(window, successRate, avgLatency),
                avgLatency,
                successRate,
                modelCount,
                total,
                last
        );
    }

    HealthStatus classify(Deque<HealthSample> window, double successRate, long avgLatencyMs) {
        if (window.isEmpty()) {
            return HealthStatus.UNKNOWN;
        }
        if (successRate == 0.0 || trailingFailures(window) >= thresholds.outageConsecutiveFailures()) {
            return HealthStatus.OUTAGE;
        }
        if (successRate < thresholds.degradedSuccessRate() || avgLatencyMs > thresholds.degradedLatencyMs()) {
            return HealthStatus.DEGRADED;
        }
        return HealthStatus.OPERATIONAL;
    }

    private static int trailingFailures(Deque<HealthSample> window) {
        int count = 0;
        Iterator<HealthSample> it = window.descendingIterator();
        while (it.hasNext() && !it.next().success()) {
            count++;
        }
        return count;
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Health monitor stopped");
        } else {
            scheduler.shutdownNow();
        }
    }
}
