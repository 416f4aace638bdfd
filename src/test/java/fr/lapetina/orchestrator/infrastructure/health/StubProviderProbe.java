package fr.lapetina.orchestrator.infrastructure.health;

import fr.lapetina.orchestrator.domain.model.HealthSample;
import fr.lapetina.orchestrator.domain.model.Provider;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Probe whose answer per provider is set by the test.
 */
public class StubProviderProbe implements ProviderProbe {

    private final Map<String, Function<Provider, CompletableFuture<HealthSample>>> behaviours = new ConcurrentHashMap<>();
    private final AtomicInteger probeCount = new AtomicInteger();

    @Override
    public CompletableFuture<HealthSample> probe(Provider provider) {
        probeCount.incrementAndGet();
        return behaviours.getOrDefault(provider.getId(),
                p -> CompletableFuture.completedFuture(HealthSample.success(50, 1))).apply(provider);
    }

    public void healthy(String providerId, long latencyMs, int models) {
        behaviours.put(providerId, p -> CompletableFuture.completedFuture(HealthSample.success(latencyMs, models)));
    }

    public void failing(String providerId, RuntimeException error) {
        behaviours.put(providerId, p -> CompletableFuture.failedFuture(error));
    }

    public void hanging(String providerId) {
        behaviours.put(providerId, p -> new CompletableFuture<>());
    }

    public int getProbeCount() {
        return probeCount.get();
    }
}
